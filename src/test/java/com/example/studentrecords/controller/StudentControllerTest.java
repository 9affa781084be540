package com.example.studentrecords.controller;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.studentrecords.access.InMemoryStudentAccess;
import com.example.studentrecords.models.StudentRecord;
import com.example.studentrecords.models.StudentStatistics;
import com.example.studentrecords.service.MutableClock;
import com.example.studentrecords.service.StudentRecordService;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StudentControllerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String FIXTURE_PATH = "/fixtures/students.json";

    private MutableClock clock;
    private StudentController controller;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-10-01T09:00:00Z"), ZoneOffset.UTC);
        controller = new StudentController(new StudentRecordService(new InMemoryStudentAccess(), clock));
    }

    private static List<Map<String, Object>> readFixture() throws IOException {
        try (InputStream in = StudentControllerTest.class.getResourceAsStream(FIXTURE_PATH)) {
            if (in == null) {
                throw new IllegalStateException("Missing test fixture: " + FIXTURE_PATH);
            }
            return MAPPER.readValue(in, new TypeReference<List<Map<String, Object>>>() { });
        }
    }

    private static Map<String, Object> student(String id, String name, int age, String major, double gpa) {
        Map<String, Object> data = new HashMap<>();
        data.put("id", id);
        data.put("name", name);
        data.put("email", name.toLowerCase().replace(' ', '.') + "@email.com");
        data.put("age", age);
        data.put("major", major);
        data.put("gpa", gpa);
        return data;
    }

    private void loadFiveStudents() {
        controller.create(student("STU001", "John Doe", 20, "Computer Science", 3.8));
        controller.create(student("STU002", "Jane Smith", 19, "Mathematics", 3.9));
        controller.create(student("STU003", "Mike Johnson", 21, "Physics", 3.5));
        controller.create(student("STU004", "Sarah Wilson", 20, "Computer Science", 3.7));
        controller.create(student("STU005", "David Brown", 22, "Engineering", 3.6));
    }

    private static RecordError.Kind kindOf(OperationResult<?> result) {
        return result.error().orElseThrow().kind();
    }

    @Test
    @DisplayName("create then readById returns the same record")
    void createThenRead() {
        OperationResult<StudentRecord> created = controller.create(student("STU001", "John Doe", 20, "Computer Science", 3.8));
        OperationResult<StudentRecord> read = controller.readById("STU001");

        assertInstanceOf(OperationResult.Success.class, created);
        assertEquals("Student John Doe (ID: STU001) created successfully!", created.message());
        assertTrue(read.succeeded());
        assertEquals(created.payload().orElseThrow(), read.payload().orElseThrow());
    }

    @Test
    @DisplayName("create reports all validation errors as one failure")
    void createValidationFailure() {
        OperationResult<StudentRecord> result = controller.create(Map.of("id", "ab", "age", 15));

        assertInstanceOf(OperationResult.Failure.class, result);
        RecordError error = result.error().orElseThrow();
        assertEquals(RecordError.Kind.VALIDATION, error.kind());
        assertEquals(List.of(
                "Student ID must be at least 3 characters long",
                "Name cannot be empty",
                "Email cannot be empty",
                "Age must be between 16 and 100",
                "Major cannot be empty"
        ), error.details());
        assertTrue(result.message().startsWith("Validation failed:\n- "));
        assertTrue(result.payload().isEmpty());
    }

    @Test
    @DisplayName("duplicate id is a validation failure and leaves the collection alone")
    void duplicateId() {
        loadFiveStudents();

        OperationResult<StudentRecord> result = controller.create(student("STU003", "Someone Else", 30, "History", 2.5));

        assertEquals(RecordError.Kind.VALIDATION, kindOf(result));
        assertEquals(List.of("Student ID already exists"), result.error().orElseThrow().details());
        assertEquals(5, controller.readAll().payload().orElseThrow().size());
        assertEquals("Mike Johnson", controller.readById("STU003").payload().orElseThrow().getName());
    }

    @Test
    @DisplayName("readAll on an empty collection succeeds with an explicit message")
    void readAllEmpty() {
        OperationResult<List<StudentRecord>> result = controller.readAll();

        assertTrue(result.succeeded());
        assertEquals("No students found in the system.", result.message());
        assertEquals(List.of(), result.payload().orElseThrow());

        loadFiveStudents();
        assertEquals("Found 5 student(s).", controller.readAll().message());
    }

    @Test
    @DisplayName("readById separates request errors from not-found")
    void readByIdErrors() {
        loadFiveStudents();

        OperationResult<StudentRecord> empty = controller.readById("");
        OperationResult<StudentRecord> missing = controller.readById("STU404");

        assertEquals(RecordError.Kind.INVALID_REQUEST, kindOf(empty));
        assertEquals("Student ID cannot be empty.", empty.message());
        assertEquals(RecordError.Kind.NOT_FOUND, kindOf(missing));
        assertEquals("Student with ID 'STU404' not found.", missing.message());
    }

    @Test
    @DisplayName("update keeps the original id and re-stamps updated_at")
    void updateIgnoresId() {
        loadFiveStudents();
        StudentRecord original = controller.readById("STU002").payload().orElseThrow();
        clock.advance(Duration.ofMinutes(30));

        OperationResult<StudentRecord> result = controller.update("STU002", Map.of("id", "XYZ999", "gpa", 4.0));

        assertEquals("Student Jane Smith (ID: STU002) updated successfully!", result.message());
        StudentRecord updated = result.payload().orElseThrow();
        assertEquals("STU002", updated.getId());
        assertEquals(4.0, updated.getGpa());
        assertEquals(original.getCreatedAt(), updated.getCreatedAt());
        assertEquals(original.getUpdatedAt().plusMinutes(30), updated.getUpdatedAt());
        assertEquals(RecordError.Kind.NOT_FOUND, kindOf(controller.readById("XYZ999")));
    }

    @Test
    @DisplayName("a failed update reports validation errors and keeps the record")
    void updateFailure() {
        loadFiveStudents();
        StudentRecord original = controller.readById("STU001").payload().orElseThrow();

        OperationResult<StudentRecord> result = controller.update("STU001", Map.of("name", "R2 D2"));

        assertEquals(RecordError.Kind.VALIDATION, kindOf(result));
        assertEquals(original, controller.readById("STU001").payload().orElseThrow());
    }

    @Test
    @DisplayName("deleting twice succeeds once, then reports not found")
    void deleteTwice() {
        loadFiveStudents();

        OperationResult<StudentRecord> first = controller.delete("STU004");
        OperationResult<StudentRecord> second = controller.delete("STU004");

        assertTrue(first.succeeded());
        assertEquals("Student Sarah Wilson (ID: STU004) deleted successfully!", first.message());
        assertEquals(RecordError.Kind.NOT_FOUND, kindOf(second));
        assertEquals(RecordError.Kind.INVALID_REQUEST, kindOf(controller.delete("")));
    }

    @Test
    @DisplayName("search messages cover matches, no matches and bad requests")
    void search() {
        loadFiveStudents();

        OperationResult<List<StudentRecord>> found = controller.search("science", "major");
        OperationResult<List<StudentRecord>> none = controller.search("Biology", "major");
        OperationResult<List<StudentRecord>> badField = controller.search("x", "age");
        OperationResult<List<StudentRecord>> emptyTerm = controller.search("", "name");

        assertEquals("Found 2 student(s) matching 'science' in major.", found.message());
        assertEquals(List.of("STU001", "STU004"),
                found.payload().orElseThrow().stream().map(StudentRecord::getId).toList());
        assertTrue(none.succeeded());
        assertEquals("No students found matching 'Biology' in major.", none.message());
        assertEquals(List.of(), none.payload().orElseThrow());
        assertEquals(RecordError.Kind.INVALID_REQUEST, kindOf(badField));
        assertTrue(badField.message().contains("name, major, email, id"));
        assertEquals(RecordError.Kind.INVALID_REQUEST, kindOf(emptyTerm));
    }

    @Test
    @DisplayName("search by term alone matches names")
    void searchByName() {
        loadFiveStudents();

        OperationResult<List<StudentRecord>> result = controller.search("jo");

        assertEquals("Found 2 student(s) matching 'jo' in name.", result.message());
        assertEquals(List.of("STU001", "STU003"),
                result.payload().orElseThrow().stream().map(StudentRecord::getId).toList());
    }

    @Test
    @DisplayName("statistics over five students")
    void statistics() {
        OperationResult<StudentStatistics> empty = controller.statistics();
        assertTrue(empty.succeeded());
        assertTrue(empty.payload().isEmpty());
        assertEquals("No students in the system.", empty.message());

        loadFiveStudents();
        StudentStatistics stats = controller.statistics().payload().orElseThrow();

        assertEquals(5, stats.totalStudents());
        assertEquals(3.7, stats.averageGpa());
        assertEquals(3.9, stats.highestGpa());
        assertEquals(3.5, stats.lowestGpa());
        assertEquals(20.4, stats.averageAge());
        assertEquals(2L, stats.majorDistribution().get("Computer Science"));
        assertEquals(4, stats.majorDistribution().size());
    }

    @Test
    @DisplayName("import of ten valid rows replaces the collection")
    void importFixture() throws IOException {
        loadFiveStudents();

        OperationResult<Integer> result = controller.importAll(readFixture());

        assertEquals("Successfully imported 10 student records.", result.message());
        assertEquals(10, result.payload().orElseThrow());
        List<StudentRecord> all = controller.readAll().payload().orElseThrow();
        assertEquals("STU101", all.get(0).getId());
        assertEquals("2024-09-01 09:00:00", StudentRecord.formatTimestamp(all.get(0).getCreatedAt()));
        assertEquals(RecordError.Kind.NOT_FOUND, kindOf(controller.readById("STU001")));
    }

    @Test
    @DisplayName("one invalid row among ten valid ones rejects the import")
    void importWithOneBadRow() throws IOException {
        loadFiveStudents();
        List<Map<String, Object>> before = controller.exportAll().payload().orElseThrow();

        List<Map<String, Object>> rows = new ArrayList<>(readFixture());
        rows.add(5, student("BAD01", "Bad Row", 12, "Art", 3.0));

        OperationResult<Integer> result = controller.importAll(rows);

        assertFalse(result.succeeded());
        assertEquals(RecordError.Kind.VALIDATION, kindOf(result));
        assertEquals(List.of("Row 6: Age must be between 16 and 100"), result.error().orElseThrow().details());
        assertTrue(result.message().startsWith("Import failed due to validation errors:"));
        assertEquals(before, controller.exportAll().payload().orElseThrow());
    }

    @Test
    @DisplayName("export reports how many records were copied out")
    void exportMessage() {
        loadFiveStudents();

        OperationResult<List<Map<String, Object>>> result = controller.exportAll();

        assertEquals("Exported 5 student records.", result.message());
        assertEquals("STU001", result.payload().orElseThrow().get(0).get("id"));
    }

    @Test
    @DisplayName("unexpected service failures become INTERNAL errors")
    void unexpectedFailure() {
        StudentRecordService service = mock(StudentRecordService.class);
        when(service.create(any())).thenThrow(new IllegalStateException("store unavailable"));
        StudentController mocked = new StudentController(service);

        OperationResult<StudentRecord> result = mocked.create(Map.of());

        assertEquals(RecordError.Kind.INTERNAL, kindOf(result));
        assertEquals("Error during create: store unavailable", result.message());
    }
}
