package com.schoolsync.service;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schoolsync.api.Page;
import com.schoolsync.api.PaginatedFetcher;
import com.schoolsync.dto.ParentRecord;
import com.schoolsync.dto.ParsedRecord;
import com.schoolsync.dto.StudentRecord;
import com.schoolsync.identity.ExternalIdentity;
import com.schoolsync.identity.IdentityKind;
import com.schoolsync.model.Parent;
import com.schoolsync.model.Student;
import com.schoolsync.normalize.DataNormalizer;
import com.schoolsync.normalize.NameParts;
import com.schoolsync.repo.ParentRepository;
import com.schoolsync.repo.StudentRepository;
import com.schoolsync.time.SyncClock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.json.JsonValue;

/**
 * Student reconciliation scoped to one class unit at a time. Parents are
 * upserted and linked inline with each student; only students are
 * deactivated.
 */
@ApplicationScoped
public class StudentSyncService {

    private static final Logger log = LoggerFactory.getLogger(StudentSyncService.class);

    static final String ENDPOINT = "student_profiles";
    static final int PAUSE_EVERY = 10;
    static final Duration PAUSE = Duration.ofSeconds(2);

    private final DataSource dataSource;
    private final PaginatedFetcher fetcher;
    private final IdentityEnricher identities;
    private final StudentRepository students;
    private final ParentRepository parents;
    private final SyncClock clock;

    @Inject
    public StudentSyncService(DataSource dataSource, PaginatedFetcher fetcher, IdentityEnricher identities,
            StudentRepository students, ParentRepository parents, SyncClock clock) {
        this.dataSource = dataSource;
        this.fetcher = fetcher;
        this.identities = identities;
        this.students = students;
        this.parents = parents;
        this.clock = clock;
    }

    public StudentSyncResult sync(Collection<Long> classUnitIds) throws SQLException, InterruptedException {
        log.info("Starting student sync for {} classes", classUnitIds.size());
        StudentSyncResult result = new StudentSyncResult();
        for (Long classUnitId : classUnitIds) {
            SyncStats classStats = syncClass(classUnitId, result.getParents());
            result.getStudents().add(classStats);
            result.recordClass(classStats.isFetchFailed());
        }
        log.info("Student sync complete. {}", result.getStudents());
        log.info("Parents: {}", result.getParents());
        return result;
    }

    /**
     * Reconciles the students of one class. Parent counters are added to
     * {@code parentStats}.
     */
    public SyncStats syncClass(long classUnitId, SyncStats parentStats) throws SQLException, InterruptedException {
        log.info("Processing class {}", classUnitId);
        SyncStats stats = new SyncStats("students");
        Set<Long> remoteIds = new HashSet<>();
        Set<Long> acceptedIds = new HashSet<>();
        Set<Long> currentIds = new LinkedHashSet<>();

        Map<String, String> params = new LinkedHashMap<>();
        params.put("class_unit_ids", String.valueOf(classUnitId));
        params.put("with_deleted", "false");
        params.put("with_parents", "true");
        params.put("with_user_info", "true");

        try (UnitOfWork unit = UnitOfWork.begin(dataSource)) {
            PaginatedFetcher.PageCursor cursor = fetcher.fetch(ENDPOINT, params);
            Optional<Page> next;
            while ((next = cursor.next()).isPresent()) {
                Page page = next.get();
                stats.recordPage();

                List<StudentRecord> batch = new ArrayList<>();
                boolean pageHasIds = false;
                int newIds = 0;
                for (JsonValue raw : page.getRecords()) {
                    stats.recordSeen();
                    Long rawId = StudentRecord.peekId(raw);
                    if (rawId != null && rawId > 0) {
                        pageHasIds = true;
                        if (remoteIds.add(rawId)) {
                            newIds++;
                        }
                    }
                    ParsedRecord<StudentRecord> parsed = StudentRecord.parse(raw);
                    if (!parsed.isAccepted()) {
                        if (parsed.getRejection() == ParsedRecord.Rejection.NOT_AN_OBJECT) {
                            stats.recordMalformed();
                        } else {
                            stats.recordSkippedMissingField();
                        }
                        continue;
                    }
                    StudentRecord record = parsed.getRecord();
                    if (!acceptedIds.add(record.getPersonId())) {
                        stats.recordDuplicate();
                        log.warn("Duplicate student id {} in class {}", record.getPersonId(), classUnitId);
                        continue;
                    }
                    currentIds.add(record.getPersonId());
                    batch.add(record);
                }

                processPage(unit, classUnitId, batch, stats, parentStats);

                if (pageHasIds && newIds == 0 && !page.isLast()) {
                    log.warn("Class {} page {} repeated only known students, stopping", classUnitId, page.getNumber());
                    cursor.stop();
                }
            }

            if (cursor.isFailed()) {
                stats.recordFetchFailure();
                log.error("Unable to load students of class {} ({})", classUnitId, cursor.getFailureReason());
            }
            deactivateMissing(unit, classUnitId, currentIds, stats);
        }

        log.info("Class {} done: {} students saved", classUnitId, stats.getSaved());
        return stats;
    }

    private void processPage(UnitOfWork unit, long classUnitId, List<StudentRecord> batch, SyncStats stats,
            SyncStats parentStats) throws InterruptedException {
        if (batch.isEmpty()) {
            return;
        }

        Map<Long, Student> existing;
        try {
            existing = students.findByPersonIds(unit.connection(),
                    batch.stream().map(StudentRecord::getPersonId).toList());
        } catch (SQLException e) {
            log.error("Unable to load existing students of class {}: {}", classUnitId, e.getMessage());
            stats.recordErrors(batch.size());
            unit.rollbackQuietly();
            return;
        }

        SyncStats pageStats = new SyncStats("students");
        SyncStats pageParents = new SyncStats("parents");
        int index = 0;
        for (StudentRecord record : batch) {
            Student incoming = toRow(record, classUnitId,
                    identities.lookup(IdentityKind.PERSON, record.getPersonId()));
            Map<Long, Parent> parentRows = new LinkedHashMap<>();
            for (ParentRecord parent : record.getParents()) {
                parentRows.putIfAbsent(parent.getPersonId(),
                        toRow(parent, identities.lookup(IdentityKind.PERSON, parent.getPersonId())));
            }
            for (int i = 0; i < record.getRejectedParents(); i++) {
                pageParents.recordSkippedMissingField();
            }

            Instant now = clock.now();
            Student current = existing.get(record.getPersonId());
            SyncStats recordStats = new SyncStats("students");
            SyncStats recordParents = new SyncStats("parents");
            try {
                unit.inSavepoint(connection -> {
                    Student saved = saveStudent(connection, current, incoming, now, recordStats);
                    saveParents(unit, saved, parentRows.values(), now, recordParents);
                    return saved;
                });
                pageStats.add(recordStats);
                pageParents.add(recordParents);
            } catch (SQLException | RuntimeException e) {
                pageStats.recordError();
                log.error("Failed to save student {}: {}", record.getPersonId(), e.getMessage());
            }

            if (++index % PAUSE_EVERY == 0) {
                clock.sleep(PAUSE);
            }
        }

        try {
            unit.commit();
            stats.add(pageStats);
            parentStats.add(pageParents);
        } catch (SQLException e) {
            log.error("Commit of class {} students failed: {}", classUnitId, e.getMessage());
            stats.recordErrors(pageStats.getSaved() + pageStats.getErrors());
            unit.rollbackQuietly();
        }
    }

    private Student saveStudent(Connection connection, Student current, Student incoming, Instant now,
            SyncStats stats) throws SQLException {
        if (current == null) {
            incoming.setCreatedAt(now);
            incoming.markSeen(now);
            students.insert(connection, incoming);
            stats.recordCreated();
            log.debug("Added student {}", incoming.displayName());
            return incoming;
        }

        FieldMerger merger = new FieldMerger();
        current.setUserName(merger.merge("user_name", current.getUserName(), incoming.getUserName()));
        current.setClassUnitId(merger.merge("class_unit_id", current.getClassUnitId(), incoming.getClassUnitId()));
        merger.mergePerson(current, incoming, now);
        students.update(connection, current);
        if (merger.hasChanges()) {
            stats.recordUpdated();
            log.debug("Updated student {}: {}", current.displayName(), String.join(", ", merger.getChangedFields()));
        } else {
            stats.recordUnchanged();
        }
        return current;
    }

    /**
     * Upserts each parent under its own savepoint, so one bad parent does not
     * discard the student.
     */
    private void saveParents(UnitOfWork unit, Student student, Collection<Parent> rows,
            Instant now, SyncStats parentStats) throws SQLException {
        for (Parent incoming : rows) {
            parentStats.recordSeen();
            try {
                unit.inSavepoint(c -> {
                    Parent saved = upsertParent(c, incoming, now, parentStats);
                    if (parents.linkToStudent(c, saved.getId(), student.getId())) {
                        parentStats.recordLinked(1);
                        log.debug("Linked parent {} to student {}", saved.displayName(), student.displayName());
                    }
                    return saved;
                });
            } catch (SQLException | RuntimeException e) {
                parentStats.recordError();
                log.error("Failed to save parent {}: {}", incoming.getPersonId(), e.getMessage());
            }
        }
    }

    private Parent upsertParent(Connection connection, Parent incoming, Instant now, SyncStats parentStats)
            throws SQLException {
        Optional<Parent> existing = parents.findByPersonId(connection, incoming.getPersonId());
        if (existing.isEmpty()) {
            incoming.setCreatedAt(now);
            incoming.markSeen(now);
            parents.insert(connection, incoming);
            parentStats.recordCreated();
            return incoming;
        }
        Parent current = existing.get();
        FieldMerger merger = new FieldMerger();
        current.setName(merger.merge("name", current.getName(), incoming.getName()));
        merger.mergePerson(current, incoming, now);
        parents.update(connection, current);
        if (merger.hasChanges()) {
            parentStats.recordUpdated();
        } else {
            parentStats.recordUnchanged();
        }
        return current;
    }

    private void deactivateMissing(UnitOfWork unit, long classUnitId, Set<Long> currentIds, SyncStats stats) {
        if (stats.isFetchFailed()) {
            log.warn("Class {}: deactivation skipped, incomplete fetch", classUnitId);
            return;
        }
        if (currentIds.isEmpty()) {
            log.info("Class {}: no students received, deactivation skipped", classUnitId);
            return;
        }
        try {
            Set<Long> missing = students.findActivePersonIdsInClass(unit.connection(), classUnitId);
            missing.removeAll(currentIds);
            int deactivated = students.deactivate(unit.connection(), missing, clock.now());
            unit.commit();
            stats.recordDeactivated(deactivated);
            if (deactivated > 0) {
                log.info("Class {}: deactivated {} students", classUnitId, deactivated);
            }
        } catch (SQLException e) {
            stats.recordError();
            log.error("Student deactivation for class {} failed: {}", classUnitId, e.getMessage());
            unit.rollbackQuietly();
        }
    }

    Student toRow(StudentRecord record, long classUnitId, ExternalIdentity identity) {
        Student row = new Student();
        row.setPersonId(record.getPersonId());
        row.setUserName(record.getUserName());
        row.setLastName(record.getLastName());
        row.setFirstName(record.getFirstName());
        row.setMiddleName(record.getMiddleName());
        row.setEmail(DataNormalizer.normalizeEmail(record.getEmailEzd()));
        row.setPhone(DataNormalizer.normalizePhone(record.getPhoneNumber()));
        row.setClassUnitId(classUnitId);
        IdentityEnricher.apply(row, identity);
        return row;
    }

    Parent toRow(ParentRecord record, ExternalIdentity identity) {
        Parent row = new Parent();
        row.setPersonId(record.getPersonId());
        row.setName(record.getName());
        NameParts parts = DataNormalizer.splitFullName(record.getName());
        row.setLastName(parts.getLastName());
        row.setFirstName(parts.getFirstName());
        row.setMiddleName(parts.getMiddleName());
        row.setEmail(DataNormalizer.normalizeEmail(record.getEmail()));
        row.setPhone(DataNormalizer.normalizePhone(record.getPhoneNumber()));
        IdentityEnricher.apply(row, identity);
        return row;
    }
}
