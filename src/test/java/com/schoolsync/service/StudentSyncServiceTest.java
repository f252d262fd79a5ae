package com.schoolsync.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import javax.sql.DataSource;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.schoolsync.api.DirectoryApiClient;
import com.schoolsync.api.LookupResult;
import com.schoolsync.api.PaginatedFetcher;
import com.schoolsync.repo.ParentRepository;
import com.schoolsync.repo.StudentRepository;
import com.schoolsync.testing.FakeClock;
import com.schoolsync.testing.TestDatabase;

import jakarta.json.Json;
import jakarta.json.JsonArray;
import jakarta.json.JsonArrayBuilder;
import jakarta.json.JsonObjectBuilder;

class StudentSyncServiceTest {

    private DataSource dataSource;
    private DirectoryApiClient client;
    private FakeClock clock;
    private StudentSyncService service;
    private final Map<String, LookupResult<JsonArray>> responses = new HashMap<>();

    @BeforeEach
    void setUp() throws Exception {
        dataSource = TestDatabase.migrated();
        client = mock(DirectoryApiClient.class);
        clock = new FakeClock();
        PaginatedFetcher fetcher = new PaginatedFetcher(client, clock, 3, 10, 500, Duration.ZERO);
        service = new StudentSyncService(dataSource, fetcher, mock(IdentityEnricher.class),
                new StudentRepository(), new ParentRepository(), clock);

        TestDatabase.execute(dataSource, "INSERT INTO class_units (id, name) VALUES (10, '5-A')");
        TestDatabase.execute(dataSource, "INSERT INTO class_units (id, name) VALUES (20, '6-B')");

        when(client.get(eq(StudentSyncService.ENDPOINT), anyMap())).thenAnswer(invocation -> {
            Map<String, String> params = invocation.getArgument(1);
            String key = params.get("class_unit_ids") + "/" + params.get("page");
            return responses.getOrDefault(key, LookupResult.found(Json.createArrayBuilder().build()));
        });
    }

    @Test
    void sync_savesStudentsAndSharedParents() throws Exception {
        givenDefaultClasses();

        StudentSyncResult result = service.sync(List.of(10L, 20L));

        assertEquals(4, result.getStudents().getCreated());
        assertEquals(2, result.getParents().getCreated());
        assertEquals(3, result.getParents().getLinked());
        assertEquals(1, result.getParents().getSkippedMissingField());
        assertEquals(2, result.getClassesProcessed());
        assertEquals(0, result.getClassesFailed());
        assertEquals(3, TestDatabase.count(dataSource, "SELECT COUNT(*) FROM parent_student"));
        assertEquals(3, TestDatabase.count(dataSource, "SELECT COUNT(*) FROM students WHERE class_unit_id = 10"));
    }

    @Test
    void sync_secondRunAddsNoLinks() throws Exception {
        givenDefaultClasses();
        service.sync(List.of(10L, 20L));
        givenDefaultClasses();

        StudentSyncResult second = service.sync(List.of(10L, 20L));

        assertEquals(0, second.getStudents().getCreated());
        assertEquals(4, second.getStudents().getUnchanged());
        assertEquals(0, second.getParents().getLinked());
        assertEquals(3, second.getParents().getUnchanged());
        assertEquals(3, TestDatabase.count(dataSource, "SELECT COUNT(*) FROM parent_student"));
    }

    @Test
    void sync_deactivatesOnlyWithinClass() throws Exception {
        givenDefaultClasses();
        service.sync(List.of(10L, 20L));
        responses.put("10/1", LookupResult.found(array(student(1, 4001, 4002), student(2, 4001))));

        StudentSyncResult result = service.sync(List.of(10L));

        assertEquals(1, result.getStudents().getDeactivated());
        assertEquals(0, TestDatabase.count(dataSource, "SELECT COUNT(*) FROM students WHERE person_id = 3 AND is_active = TRUE"));
        assertEquals(1, TestDatabase.count(dataSource, "SELECT COUNT(*) FROM students WHERE person_id = 5 AND is_active = TRUE"));
        assertEquals(2, TestDatabase.count(dataSource, "SELECT COUNT(*) FROM parents WHERE is_active = TRUE"));
    }

    @Test
    void sync_failedClassKeepsItsStudents() throws Exception {
        givenDefaultClasses();
        service.sync(List.of(10L, 20L));
        responses.put("20/1", LookupResult.permanentFailure("HTTP 502"));

        StudentSyncResult result = service.sync(List.of(20L));

        assertEquals(1, result.getClassesFailed());
        assertEquals(0, result.getStudents().getDeactivated());
        assertEquals(1, TestDatabase.count(dataSource, "SELECT COUNT(*) FROM students WHERE person_id = 5 AND is_active = TRUE"));
    }

    @Test
    void sync_pausesAfterEveryTenStudents() throws Exception {
        JsonArrayBuilder builder = Json.createArrayBuilder();
        for (int id = 1; id <= 12; id++) {
            builder.add(student(id));
        }
        responses.put("10/1", LookupResult.found(builder.build()));

        StudentSyncResult result = service.sync(List.of(10L));

        assertEquals(12, result.getStudents().getCreated());
        assertEquals(List.of(StudentSyncService.PAUSE), clock.getSleeps());
    }

    private void givenDefaultClasses() {
        JsonObjectBuilder orphanParent = student(3);
        orphanParent.add("parents", Json.createArrayBuilder().add(Json.createObjectBuilder().add("name", "Unknown")));
        responses.put("10/1", LookupResult.found(array(student(1, 4001, 4002), student(2, 4001), orphanParent)));
        responses.put("20/1", LookupResult.found(array(student(5))));
    }

    private static JsonObjectBuilder student(int personId, int... parentIds) {
        JsonArrayBuilder parents = Json.createArrayBuilder();
        for (int parentId : parentIds) {
            parents.add(Json.createObjectBuilder()
                    .add("person_id", parentId)
                    .add("name", "Parent Family " + parentId)
                    .add("phone_number", "+7 900 000-00-" + (parentId % 100)));
        }
        return Json.createObjectBuilder()
                .add("person_id", personId)
                .add("user_name", "student" + personId)
                .add("last_name", "Student")
                .add("first_name", "Number" + personId)
                .add("parents", parents);
    }

    private static JsonArray array(JsonObjectBuilder... records) {
        JsonArrayBuilder builder = Json.createArrayBuilder();
        for (JsonObjectBuilder record : records) {
            builder.add(record);
        }
        return builder.build();
    }
}
