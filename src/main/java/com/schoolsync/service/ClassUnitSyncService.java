package com.schoolsync.service;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schoolsync.api.LookupResult;
import com.schoolsync.api.PaginatedFetcher;
import com.schoolsync.dto.ClassUnitRecord;
import com.schoolsync.dto.ParsedRecord;
import com.schoolsync.model.ClassUnit;
import com.schoolsync.repo.ClassUnitRepository;
import com.schoolsync.repo.StaffRepository;
import com.schoolsync.time.SyncClock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.json.JsonArray;
import jakarta.json.JsonValue;

/**
 * Saves the school's class units and rebuilds their mentor links. Classes are
 * never deactivated here.
 */
@ApplicationScoped
public class ClassUnitSyncService {

    private static final Logger log = LoggerFactory.getLogger(ClassUnitSyncService.class);

    static final String ENDPOINT = "class_units";

    private final DataSource dataSource;
    private final PaginatedFetcher fetcher;
    private final ClassUnitRepository classUnits;
    private final StaffRepository staff;
    private final SyncClock clock;

    @Inject
    public ClassUnitSyncService(DataSource dataSource, PaginatedFetcher fetcher, ClassUnitRepository classUnits,
            StaffRepository staff, SyncClock clock) {
        this.dataSource = dataSource;
        this.fetcher = fetcher;
        this.classUnits = classUnits;
        this.staff = staff;
        this.clock = clock;
    }

    public SyncStats sync() throws SQLException, InterruptedException {
        log.info("Starting class sync");
        SyncStats stats = new SyncStats("classes");

        Map<String, String> params = new LinkedHashMap<>();
        params.put("with_home_based", "true");
        LookupResult<JsonArray> result = fetcher.fetchOnce(ENDPOINT, params);
        if (!result.isFound()) {
            stats.recordFetchFailure();
            log.warn("Class list unavailable ({}); classes left as they are", result.getReason());
            return stats;
        }
        stats.recordPage();
        JsonArray records = result.getValue();
        log.info("Received {} classes", records.size());

        Set<Long> seen = new HashSet<>();
        SyncStats staged = new SyncStats("classes");
        try (UnitOfWork unit = UnitOfWork.begin(dataSource)) {
            Instant now = clock.now();
            for (JsonValue raw : records) {
                stats.recordSeen();
                ParsedRecord<ClassUnitRecord> parsed = ClassUnitRecord.parse(raw);
                if (!parsed.isAccepted()) {
                    if (parsed.getRejection() == ParsedRecord.Rejection.NOT_AN_OBJECT) {
                        stats.recordMalformed();
                    } else {
                        stats.recordSkippedMissingField();
                    }
                    continue;
                }
                ClassUnitRecord record = parsed.getRecord();
                if (!seen.add(record.getId())) {
                    stats.recordDuplicate();
                    log.warn("Duplicate class id {}", record.getId());
                    continue;
                }
                SyncStats recordStats = new SyncStats("classes");
                try {
                    unit.inSavepoint(connection -> save(connection, record, now, recordStats));
                    staged.add(recordStats);
                } catch (SQLException | RuntimeException e) {
                    staged.recordError();
                    log.error("Failed to save class {}: {}", record.getId(), e.getMessage());
                }
            }
            try {
                unit.commit();
                stats.add(staged);
            } catch (SQLException e) {
                log.error("Commit of classes failed: {}", e.getMessage());
                stats.recordErrors(staged.getSaved() + staged.getErrors());
                unit.rollbackQuietly();
            }
        }

        log.info("Class sync complete. {}", stats);
        return stats;
    }

    private Void save(Connection connection, ClassUnitRecord record, Instant now, SyncStats stats)
            throws SQLException {
        Optional<ClassUnit> existing = classUnits.findById(connection, record.getId());
        if (existing.isEmpty()) {
            ClassUnit unit = new ClassUnit();
            unit.setId(record.getId());
            unit.setName(record.getName());
            unit.setParallel(record.getParallel());
            unit.setLiteral(record.getLiteral());
            unit.setSchoolId(record.getSchoolId());
            unit.setClassLevelId(record.getClassLevelId());
            unit.setCreatedAt(now);
            unit.setUpdatedAt(now);
            classUnits.insert(connection, unit);
            stats.recordCreated();
            log.info("Added class {}", record.getName());
        } else {
            ClassUnit unit = existing.get();
            FieldMerger merger = new FieldMerger();
            unit.setName(merger.merge("name", unit.getName(), record.getName()));
            unit.setSchoolId(merger.merge("school_id", unit.getSchoolId(), record.getSchoolId()));
            unit.setClassLevelId(merger.merge("class_level_id", unit.getClassLevelId(), record.getClassLevelId()));
            unit.setParallel(record.getParallel());
            unit.setLiteral(record.getLiteral());
            unit.setUpdatedAt(now);
            classUnits.update(connection, unit);
            if (merger.hasChanges()) {
                stats.recordUpdated();
                log.info("Updated class {}: {}", unit.getName(), String.join(", ", merger.getChangedFields()));
            } else {
                stats.recordUnchanged();
            }
        }

        if (record.isMentorIdsPresent()) {
            Set<Long> staffIds = new LinkedHashSet<>();
            for (Long mentorId : record.getMentorIds()) {
                Optional<Long> staffId = staff.findActiveIdByPersonId(connection, mentorId);
                if (staffId.isPresent()) {
                    staffIds.add(staffId.get());
                } else {
                    log.debug("Mentor {} of class {} is not an active staff member", mentorId, record.getName());
                }
            }
            stats.recordLinked(classUnits.replaceStaffLinks(connection, record.getId(), staffIds));
        }
        return null;
    }
}
