package com.schoolsync.service;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Map;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schoolsync.repo.ClassUnitRepository;
import com.schoolsync.repo.ParentRepository;
import com.schoolsync.repo.StaffRepository;
import com.schoolsync.repo.StudentRepository;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

@ApplicationScoped
public class StatisticsService {

    private static final Logger log = LoggerFactory.getLogger(StatisticsService.class);

    private final DataSource dataSource;
    private final StaffRepository staff;
    private final ClassUnitRepository classUnits;
    private final StudentRepository students;
    private final ParentRepository parents;

    @Inject
    public StatisticsService(DataSource dataSource, StaffRepository staff, ClassUnitRepository classUnits,
            StudentRepository students, ParentRepository parents) {
        this.dataSource = dataSource;
        this.staff = staff;
        this.classUnits = classUnits;
        this.students = students;
        this.parents = parents;
    }

    public StaffAudit auditStaff() throws SQLException {
        try (Connection connection = dataSource.getConnection()) {
            StaffAudit audit = new StaffAudit(
                    staff.countWithoutUserId(connection),
                    staff.countWithoutName(connection),
                    staff.countWithoutContacts(connection));
            log.info("Staff audit: without user_id={}, without name={}, without contacts={}",
                    audit.getWithoutUserId(), audit.getWithoutName(), audit.getWithoutContacts());
            return audit;
        }
    }

    public DirectoryStatistics collect() throws SQLException {
        try (Connection connection = dataSource.getConnection()) {
            DirectoryStatistics stats = new DirectoryStatistics(
                    classUnits.countAll(connection),
                    staff.countActive(connection),
                    staff.countAll(connection),
                    staff.countActiveWithPhone(connection),
                    staff.countActiveWithEmail(connection),
                    staff.countActiveWithExternalId(connection),
                    staff.countActiveByType(connection),
                    students.countActive(connection),
                    students.countAll(connection),
                    parents.countActive(connection),
                    parents.countAll(connection),
                    parents.countLinks(connection));
            logStatistics(stats);
            return stats;
        }
    }

    private static void logStatistics(DirectoryStatistics stats) {
        log.info("Classes: {}", stats.getClasses());
        log.info("Staff: {} active of {} ({} deactivated), with phone {}, with email {}, with external id {}",
                stats.getStaffActive(), stats.getStaffTotal(), stats.getStaffDeactivated(),
                stats.getStaffWithPhone(), stats.getStaffWithEmail(), stats.getStaffWithExternalId());
        for (Map.Entry<String, Integer> entry : stats.getStaffByType().entrySet()) {
            log.info("  {}: {}", entry.getKey(), entry.getValue());
        }
        log.info("Students: {} active of {}", stats.getStudentsActive(), stats.getStudentsTotal());
        log.info("Parents: {} active of {}, {} student links",
                stats.getParentsActive(), stats.getParentsTotal(), stats.getParentLinks());
    }
}
