package com.schoolsync.service;

import java.sql.SQLException;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
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
import com.schoolsync.config.SyncConfig;
import com.schoolsync.dto.ParsedRecord;
import com.schoolsync.dto.StaffRecord;
import com.schoolsync.identity.ExternalIdentity;
import com.schoolsync.identity.IdentityKind;
import com.schoolsync.model.Staff;
import com.schoolsync.normalize.DataNormalizer;
import com.schoolsync.normalize.NameParts;
import com.schoolsync.repo.StaffRepository;
import com.schoolsync.time.SyncClock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.json.JsonValue;

/**
 * School-wide staff reconciliation. Pages are merged in batches and committed
 * one at a time; once every page is in, staff that were not seen are
 * deactivated and rows without a {@code user_id} are cleaned up.
 */
@ApplicationScoped
public class StaffSyncService {

    private static final Logger log = LoggerFactory.getLogger(StaffSyncService.class);

    static final String ENDPOINT = "teacher_profiles";

    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final DataSource dataSource;
    private final PaginatedFetcher fetcher;
    private final IdentityEnricher identities;
    private final StaffRepository repository;
    private final SyncClock clock;
    private final long schoolId;
    private final Duration recordPacing;

    @Inject
    public StaffSyncService(DataSource dataSource, PaginatedFetcher fetcher, IdentityEnricher identities,
            StaffRepository repository, SyncClock clock, SyncConfig config) {
        this(dataSource, fetcher, identities, repository, clock, config.getSchoolId(), config.getRecordPacing());
    }

    public StaffSyncService(DataSource dataSource, PaginatedFetcher fetcher, IdentityEnricher identities,
            StaffRepository repository, SyncClock clock, long schoolId, Duration recordPacing) {
        this.dataSource = dataSource;
        this.fetcher = fetcher;
        this.identities = identities;
        this.repository = repository;
        this.clock = clock;
        this.schoolId = schoolId;
        this.recordPacing = recordPacing;
    }

    public SyncStats sync() throws SQLException, InterruptedException {
        log.info("Starting staff sync for school {}", schoolId);
        SyncStats stats = new SyncStats("staff");
        Set<Long> remoteIds = new HashSet<>();
        Set<Long> acceptedIds = new HashSet<>();
        Set<Long> currentIds = new LinkedHashSet<>();

        Map<String, String> params = new LinkedHashMap<>();
        params.put("school_id", String.valueOf(schoolId));

        try (UnitOfWork unit = UnitOfWork.begin(dataSource)) {
            PaginatedFetcher.PageCursor cursor = fetcher.fetch(ENDPOINT, params);
            Optional<Page> next;
            while ((next = cursor.next()).isPresent()) {
                Page page = next.get();
                stats.recordPage();
                log.info("Staff page {}: {} records", page.getNumber(), page.size());

                List<StaffRecord> batch = new ArrayList<>();
                boolean pageHasIds = false;
                int newIds = 0;
                for (JsonValue raw : page.getRecords()) {
                    stats.recordSeen();
                    Long rawId = StaffRecord.peekId(raw);
                    if (rawId != null && rawId > 0) {
                        pageHasIds = true;
                        if (remoteIds.add(rawId)) {
                            newIds++;
                        }
                    }

                    ParsedRecord<StaffRecord> parsed = StaffRecord.parse(raw);
                    if (!parsed.isAccepted()) {
                        countRejection(stats, parsed.getRejection(), rawId);
                        continue;
                    }
                    StaffRecord record = parsed.getRecord();
                    if (!acceptedIds.add(record.getPersonId())) {
                        stats.recordDuplicate();
                        log.warn("Duplicate staff id {} on page {}", record.getPersonId(), page.getNumber());
                        continue;
                    }
                    if (DataNormalizer.isSuspiciousName(record.getFullName())) {
                        stats.recordFiltered();
                        log.debug("Skipping staff {} with suspicious name '{}'", record.getPersonId(), record.getFullName());
                        continue;
                    }
                    currentIds.add(record.getPersonId());
                    batch.add(record);
                }

                processPage(unit, page.getNumber(), batch, stats);

                if (pageHasIds && newIds == 0 && !page.isLast()) {
                    log.warn("Staff page {} repeated only known ids, stopping pagination", page.getNumber());
                    cursor.stop();
                }
            }

            if (cursor.isFailed()) {
                stats.recordFetchFailure();
                log.warn("Staff fetch failed after {} pages ({}); skipping deactivation",
                        cursor.getPagesFetched(), cursor.getFailureReason());
            }
            finish(unit, currentIds, stats);
        }

        log.info("Staff sync complete. {}", stats);
        return stats;
    }

    private void processPage(UnitOfWork unit, int pageNumber, List<StaffRecord> batch, SyncStats stats)
            throws InterruptedException {
        if (batch.isEmpty()) {
            log.warn("Staff page {}: nothing to save", pageNumber);
            return;
        }

        List<Staff> incoming = new ArrayList<>(batch.size());
        for (StaffRecord record : batch) {
            ExternalIdentity identity = identities.lookup(IdentityKind.STAFF, record.getUserIntegrationId());
            incoming.add(toRow(record, identity));
            clock.sleep(recordPacing);
        }

        Instant now = clock.now();
        SyncStats pageStats = new SyncStats("staff");
        Map<Long, Staff> existing;
        try {
            existing = repository.findByPersonIds(unit.connection(),
                    incoming.stream().map(Staff::getPersonId).toList());
        } catch (SQLException e) {
            log.error("Unable to load existing staff for page {}: {}", pageNumber, e.getMessage());
            stats.recordErrors(incoming.size());
            unit.rollbackQuietly();
            return;
        }

        List<Staff> creates = new ArrayList<>();
        for (Staff row : incoming) {
            Staff current = existing.get(row.getPersonId());
            if (current == null) {
                row.setCreatedAt(now);
                row.markSeen(now);
                creates.add(row);
                continue;
            }
            try {
                FieldMerger merger = unit.inSavepoint(connection -> {
                    FieldMerger m = merge(current, row, now);
                    repository.update(connection, current);
                    return m;
                });
                if (merger.hasChanges()) {
                    pageStats.recordUpdated();
                    log.info("Updated staff {}: {}", current.displayName(), String.join(", ", merger.getChangedFields()));
                } else {
                    pageStats.recordUnchanged();
                    log.debug("Staff {} unchanged", current.displayName());
                }
            } catch (SQLException | RuntimeException e) {
                pageStats.recordError();
                log.error("Failed to update staff {}: {}", row.getPersonId(), e.getMessage());
            }
        }

        insertCreates(unit, creates, pageStats);

        try {
            unit.commit();
            stats.add(pageStats);
            log.info("Staff page {}: saved {}, errors {}", pageNumber, pageStats.getSaved(), pageStats.getErrors());
        } catch (SQLException e) {
            log.error("Commit of staff page {} failed: {}", pageNumber, e.getMessage());
            stats.recordErrors(pageStats.getSaved() + pageStats.getErrors());
            unit.rollbackQuietly();
        }
    }

    private void insertCreates(UnitOfWork unit, List<Staff> creates, SyncStats pageStats) {
        if (creates.isEmpty()) {
            return;
        }
        try {
            unit.inSavepoint(connection -> repository.insertAll(connection, creates));
            for (Staff row : creates) {
                pageStats.recordCreated();
                log.info("Added staff {} (user_id {})", row.displayName(), row.getUserId());
            }
            return;
        } catch (SQLException | RuntimeException e) {
            log.warn("Batch insert of {} staff failed ({}), inserting one by one", creates.size(), e.getMessage());
        }

        for (Staff row : creates) {
            try {
                unit.inSavepoint(connection -> repository.insert(connection, row));
                pageStats.recordCreated();
                log.info("Added staff {} (user_id {})", row.displayName(), row.getUserId());
            } catch (SQLException | RuntimeException e) {
                pageStats.recordError();
                log.error("Failed to add staff {}: {}", row.getPersonId(), e.getMessage());
            }
        }
    }

    private void finish(UnitOfWork unit, Set<Long> currentIds, SyncStats stats) {
        Instant now = clock.now();
        try {
            if (stats.isFetchFailed()) {
                log.warn("Staff deactivation skipped: incomplete fetch");
            } else if (currentIds.isEmpty()) {
                log.warn("Staff deactivation skipped: no staff seen");
            } else {
                Set<Long> missing = repository.findActivePersonIds(unit.connection());
                missing.removeAll(currentIds);
                int deactivated = repository.deactivate(unit.connection(), missing, now);
                stats.recordDeactivated(deactivated);
                if (deactivated > 0) {
                    log.info("Deactivated {} staff missing from the directory", deactivated);
                }
            }
            int cleaned = repository.deactivateWithoutUserId(unit.connection(), now);
            stats.recordCleaned(cleaned);
            if (cleaned > 0) {
                log.info("Deactivated {} staff without user_id", cleaned);
            }
            unit.commit();
        } catch (SQLException e) {
            stats.recordError();
            log.error("Staff deactivation failed: {}", e.getMessage());
            unit.rollbackQuietly();
        }
    }

    Staff toRow(StaffRecord record, ExternalIdentity identity) {
        Staff row = new Staff();
        row.setPersonId(record.getPersonId());
        row.setUserId(record.getUserId());
        row.setName(record.getFullName());

        NameParts parts = record.getLastName() != null && !record.getLastName().isBlank()
                ? new NameParts(record.getLastName(), record.getFirstName(), record.getMiddleName())
                : DataNormalizer.splitFullName(record.getFullName());
        row.setLastName(parts.getLastName());
        row.setFirstName(parts.getFirstName());
        row.setMiddleName(parts.getMiddleName());

        String email = DataNormalizer.normalizeEmail(record.getEmail());
        row.setEmail(email != null ? email : DataNormalizer.normalizeEmail(record.getEmailEzd()));
        row.setPhone(DataNormalizer.normalizePhone(record.getPhoneNumber()));
        row.setType(record.getType());
        row.setUpdatedAtApi(parseApiTimestamp(record.getUpdatedAt()));
        IdentityEnricher.apply(row, identity);
        return row;
    }

    private static FieldMerger merge(Staff existing, Staff incoming, Instant now) {
        FieldMerger merger = new FieldMerger();
        existing.setUserId(merger.merge("user_id", existing.getUserId(), incoming.getUserId()));
        existing.setName(merger.merge("name", existing.getName(), incoming.getName()));
        existing.setType(merger.merge("type", existing.getType(), incoming.getType()));
        existing.setUpdatedAtApi(merger.merge("updated_at_api", existing.getUpdatedAtApi(), incoming.getUpdatedAtApi()));
        merger.mergePerson(existing, incoming, now);
        return merger;
    }

    /**
     * Parses the directory's {@code updated_at}, which arrives as a date, a
     * date-time with a space, or an ISO date-time. Values without an offset
     * are taken as UTC.
     */
    static Instant parseApiTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        try {
            if (trimmed.length() == 10) {
                return LocalDate.parse(trimmed).atStartOfDay().toInstant(ZoneOffset.UTC);
            }
            if (trimmed.indexOf('T') > 0) {
                TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parse(trimmed);
                ZoneOffset offset = parsed.isSupported(ChronoField.OFFSET_SECONDS)
                        ? ZoneOffset.ofTotalSeconds(parsed.get(ChronoField.OFFSET_SECONDS))
                        : ZoneOffset.UTC;
                return LocalDateTime.from(parsed).toInstant(offset);
            }
            return LocalDateTime.parse(trimmed, DATE_TIME).toInstant(ZoneOffset.UTC);
        } catch (DateTimeException e) {
            log.debug("Unparseable staff updated_at '{}'", value);
            return null;
        }
    }

    private static void countRejection(SyncStats stats, ParsedRecord.Rejection rejection, Long rawId) {
        switch (rejection) {
            case NOT_AN_OBJECT -> {
                stats.recordMalformed();
                log.warn("Skipping staff entry that is not an object");
            }
            case MISSING_ID -> {
                stats.recordSkippedMissingField();
                log.warn("Skipping staff entry without id");
            }
            case MISSING_USER_ID -> {
                stats.recordSkippedMissingField();
                log.debug("Skipping staff {} without user_id", rawId);
            }
        }
    }
}
