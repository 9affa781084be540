package com.example.studentrecords.controller;

import com.example.studentrecords.models.SearchField;
import com.example.studentrecords.models.StudentRecord;
import com.example.studentrecords.models.StudentStatistics;
import com.example.studentrecords.service.StudentRecordException;
import com.example.studentrecords.service.StudentRecordService;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Caller-facing entry point for student record operations. Converts requests into service calls
 * and turns every outcome, including domain failures, into an {@link OperationResult}. Nothing
 * thrown by the service escapes this class.
 */
@Component
@Slf4j
public class StudentController {

    private final StudentRecordService recordService;

    public StudentController(StudentRecordService recordService) {
        this.recordService = recordService;
    }

    public OperationResult<StudentRecord> create(Map<String, ?> data) {
        return handle("create", () -> {
            StudentRecord record = recordService.create(data);
            return OperationResult.success(
                    "Student " + record.getName() + " (ID: " + record.getId() + ") created successfully!", record);
        });
    }

    public OperationResult<List<StudentRecord>> readAll() {
        return handle("read all", () -> {
            List<StudentRecord> records = recordService.findAll();
            if (records.isEmpty()) {
                return OperationResult.success("No students found in the system.", records);
            }
            return OperationResult.success("Found " + records.size() + " student(s).", records);
        });
    }

    public OperationResult<StudentRecord> readById(String studentId) {
        return handle("read", () ->
                OperationResult.success("Student found successfully.", recordService.findById(studentId)));
    }

    public OperationResult<StudentRecord> update(String studentId, Map<String, ?> changes) {
        return handle("update", () -> {
            StudentRecord record = recordService.update(studentId, changes);
            return OperationResult.success(
                    "Student " + record.getName() + " (ID: " + studentId + ") updated successfully!", record);
        });
    }

    public OperationResult<StudentRecord> delete(String studentId) {
        return handle("delete", () -> {
            StudentRecord removed = recordService.delete(studentId);
            return OperationResult.success(
                    "Student " + removed.getName() + " (ID: " + studentId + ") deleted successfully!", removed);
        });
    }

    public OperationResult<List<StudentRecord>> search(String term) {
        return search(term, SearchField.NAME.key());
    }

    public OperationResult<List<StudentRecord>> search(String term, String field) {
        return handle("search", () -> {
            List<StudentRecord> matches = recordService.search(term, field);
            if (matches.isEmpty()) {
                return OperationResult.success(
                        "No students found matching '" + term + "' in " + field + ".", matches);
            }
            return OperationResult.success(
                    "Found " + matches.size() + " student(s) matching '" + term + "' in " + field + ".", matches);
        });
    }

    public OperationResult<StudentStatistics> statistics() {
        return handle("statistics", () -> {
            Optional<StudentStatistics> statistics = recordService.statistics();
            if (statistics.isEmpty()) {
                return OperationResult.<StudentStatistics>success("No students in the system.");
            }
            return OperationResult.success("Statistics calculated successfully.", statistics.get());
        });
    }

    public OperationResult<List<Map<String, Object>>> exportAll() {
        return handle("export", () -> {
            List<Map<String, Object>> rows = recordService.exportAll();
            return OperationResult.success("Exported " + rows.size() + " student records.", rows);
        });
    }

    public OperationResult<Integer> importAll(List<? extends Map<String, ?>> rows) {
        return handle("import", () -> {
            int imported = recordService.importAll(rows).size();
            return OperationResult.success("Successfully imported " + imported + " student records.", imported);
        });
    }

    private <T> OperationResult<T> handle(String action, Supplier<OperationResult<T>> operation) {
        try {
            return operation.get();
        } catch (StudentRecordException ex) {
            log.warn("Rejected {} request: {}", action, ex.getCode());
            return OperationResult.failure(new RecordError(kindOf(ex.getCode()), ex.getMessage(), ex.getErrors()));
        } catch (RuntimeException ex) {
            log.error("Unexpected error during {}", action, ex);
            return OperationResult.failure(new RecordError(RecordError.Kind.INTERNAL,
                    "Error during " + action + ": " + ex.getMessage()));
        }
    }

    private static RecordError.Kind kindOf(StudentRecordException.Code code) {
        return switch (code) {
            case VALIDATION_FAILED -> RecordError.Kind.VALIDATION;
            case STUDENT_NOT_FOUND -> RecordError.Kind.NOT_FOUND;
            case INVALID_REQUEST -> RecordError.Kind.INVALID_REQUEST;
        };
    }
}
