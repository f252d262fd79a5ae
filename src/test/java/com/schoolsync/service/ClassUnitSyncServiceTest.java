package com.schoolsync.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;

import javax.sql.DataSource;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.schoolsync.api.DirectoryApiClient;
import com.schoolsync.api.LookupResult;
import com.schoolsync.api.PaginatedFetcher;
import com.schoolsync.model.ClassUnit;
import com.schoolsync.repo.ClassUnitRepository;
import com.schoolsync.repo.StaffRepository;
import com.schoolsync.testing.FakeClock;
import com.schoolsync.testing.TestDatabase;

import jakarta.json.Json;
import jakarta.json.JsonArray;

class ClassUnitSyncServiceTest {

    private DataSource dataSource;
    private DirectoryApiClient client;
    private FakeClock clock;
    private PaginatedFetcher fetcher;
    private ClassUnitRepository classUnits;
    private ClassUnitSyncService service;

    @BeforeEach
    void setUp() throws Exception {
        dataSource = TestDatabase.migrated();
        client = mock(DirectoryApiClient.class);
        classUnits = new ClassUnitRepository();
        clock = new FakeClock();
        fetcher = new PaginatedFetcher(client, clock, 3, 10, 500, Duration.ZERO);
        service = new ClassUnitSyncService(dataSource, fetcher, classUnits, new StaffRepository(), clock);

        TestDatabase.execute(dataSource, "INSERT INTO staff (person_id, user_id, name) VALUES (101, 1101, 'Active Mentor')");
        TestDatabase.execute(dataSource, "INSERT INTO staff (person_id, user_id, name, is_active, deactivated_at)"
                + " VALUES (102, 1102, 'Former Mentor', FALSE, CURRENT_TIMESTAMP)");
    }

    @Test
    void sync_savesClassesAndLinksActiveMentors() throws Exception {
        when(client.get(eq(ClassUnitSyncService.ENDPOINT), anyMap())).thenReturn(LookupResult.found(classes(
                List.of(101, 102, 999))));

        SyncStats stats = service.sync();

        assertEquals(3, stats.getCreated());
        assertEquals(1, stats.getSkippedMissingField());
        assertEquals(1, stats.getLinked());
        try (Connection connection = dataSource.getConnection()) {
            ClassUnit fifth = classUnits.findById(connection, 10L).orElseThrow();
            assertEquals("5", fifth.getParallel());
            assertEquals("A", fifth.getLiteral());
            assertEquals("Class_11", classUnits.findById(connection, 11L).orElseThrow().getName());
            assertEquals(1, classUnits.findLinkedStaffIds(connection, 10L).size());
        }
        verify(client).get(eq(ClassUnitSyncService.ENDPOINT),
                argThat(p -> p != null && "true".equals(p.get("with_home_based"))));
    }

    @Test
    void sync_emptyMentorListClearsLinks() throws Exception {
        when(client.get(eq(ClassUnitSyncService.ENDPOINT), anyMap()))
                .thenReturn(LookupResult.found(classes(List.of(101))))
                .thenReturn(LookupResult.found(classes(List.of())));
        service.sync();

        SyncStats second = service.sync();

        assertEquals(0, second.getCreated());
        assertEquals(3, second.getUnchanged());
        try (Connection connection = dataSource.getConnection()) {
            assertTrue(classUnits.findLinkedStaffIds(connection, 10L).isEmpty());
        }
    }

    @Test
    void sync_fetchFailureLeavesClassesUntouched() throws Exception {
        TestDatabase.execute(dataSource, "INSERT INTO class_units (id, name) VALUES (10, '5-A')");
        when(client.get(eq(ClassUnitSyncService.ENDPOINT), anyMap()))
                .thenReturn(LookupResult.transientFailure("timeout"));

        SyncStats stats = service.sync();

        assertEquals(1, stats.getFetchFailures());
        assertEquals(0, stats.getSaved());
        assertEquals(1, TestDatabase.count(dataSource, "SELECT COUNT(*) FROM class_units"));
    }

    @Test
    void sync_failedCommitIsCountedAndReturnsStats() throws Exception {
        DataSource failingCommit = mock(DataSource.class);
        when(failingCommit.getConnection()).thenAnswer(invocation -> {
            Connection connection = spy(dataSource.getConnection());
            doThrow(new SQLException("commit failed")).when(connection).commit();
            return connection;
        });
        service = new ClassUnitSyncService(failingCommit, fetcher, classUnits, new StaffRepository(), clock);
        when(client.get(eq(ClassUnitSyncService.ENDPOINT), anyMap())).thenReturn(LookupResult.found(classes(List.of(101))));

        SyncStats stats = service.sync();

        assertEquals(3, stats.getErrors());
        assertEquals(0, stats.getSaved());
        assertEquals(1, stats.getSkippedMissingField());
        assertEquals(0, TestDatabase.count(dataSource, "SELECT COUNT(*) FROM class_units"));
        assertEquals(0, TestDatabase.count(dataSource, "SELECT COUNT(*) FROM class_staff"));
    }

    private static JsonArray classes(List<Integer> mentors) {
        return Json.createArrayBuilder()
                .add(Json.createObjectBuilder()
                        .add("id", 10)
                        .add("name", "5-A")
                        .add("school_id", 28)
                        .add("mentor_ids", Json.createArrayBuilder(mentors)))
                .add(11)
                .add(Json.createObjectBuilder().add("id", 12).add("name", "6-B"))
                .add(Json.createObjectBuilder().add("name", "orphan"))
                .build();
    }
}
