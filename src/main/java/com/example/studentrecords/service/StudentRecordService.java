package com.example.studentrecords.service;

import com.example.studentrecords.access.StudentAccess;
import com.example.studentrecords.models.SearchField;
import com.example.studentrecords.models.StudentRecord;
import com.example.studentrecords.models.StudentStatistics;
import com.example.studentrecords.models.ValidationResult;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Owns every change to the student collection. Each mutation is validated on a detached copy
 * and only committed to the store once it passes, so a rejected request leaves the collection
 * exactly as it was. Failures surface as {@link StudentRecordException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StudentRecordService {

    private static final Set<String> IMMUTABLE_FIELDS = Set.of(
            StudentRecord.FIELD_ID,
            StudentRecord.FIELD_LEGACY_ID,
            StudentRecord.FIELD_CREATED_AT,
            StudentRecord.FIELD_UPDATED_AT
    );

    private final StudentAccess studentAccess;
    private final Clock clock;

    public StudentRecord create(Map<String, ?> data) {
        Objects.requireNonNull(data, "data");

        StudentRecord record = StudentRecord.fromInput(data, clock);
        ValidationResult result = record.validate(studentAccess.findAllIds());
        if (!result.valid()) {
            throw StudentRecordException.validationFailed(result.errors());
        }

        studentAccess.save(record);
        log.info("Created student {} ({} total)", record.getId(), studentAccess.count());
        return record;
    }

    public List<StudentRecord> findAll() {
        return studentAccess.findAll();
    }

    public StudentRecord findById(String studentId) {
        requireStudentId(studentId);
        return studentAccess.findById(studentId)
                .orElseThrow(() -> StudentRecordException.studentNotFound(studentId));
    }

    /**
     * Merges the given fields onto the stored record. Keys the record does not have are skipped,
     * as are attempts to change the id or the timestamps. The merged record is validated against
     * every other record's id before it replaces the original in place.
     *
     * @param studentId id of the record to change
     * @param changes   field name to new value; may be empty, in which case only updated_at moves
     * @return the committed record
     */
    public StudentRecord update(String studentId, Map<String, ?> changes) {
        requireStudentId(studentId);
        Objects.requireNonNull(changes, "changes");

        StudentRecord current = studentAccess.findById(studentId)
                .orElseThrow(() -> StudentRecordException.studentNotFound(studentId));

        Map<String, Object> merged = new LinkedHashMap<>(current.toMap());
        changes.forEach((field, value) -> {
            if (merged.containsKey(field) && !IMMUTABLE_FIELDS.contains(field)) {
                merged.put(field, value);
            }
        });

        StudentRecord updated = StudentRecord.fromMap(merged, clock);
        List<String> otherIds = studentAccess.findAllIds().stream()
                .filter(id -> !id.equals(studentId))
                .toList();
        ValidationResult result = updated.validate(otherIds);
        if (!result.valid()) {
            throw StudentRecordException.validationFailed(result.errors());
        }

        updated.touchUpdatedAt(clock);
        studentAccess.update(updated);
        log.info("Updated student {} fields {}", studentId, changes.keySet());
        return updated;
    }

    public StudentRecord delete(String studentId) {
        requireStudentId(studentId);
        StudentRecord removed = studentAccess.delete(studentId)
                .orElseThrow(() -> StudentRecordException.studentNotFound(studentId));
        log.info("Deleted student {} ({} remaining)", studentId, studentAccess.count());
        return removed;
    }

    /**
     * Searches by name.
     */
    public List<StudentRecord> search(String term) {
        return search(term, SearchField.NAME.key());
    }

    /**
     * Case-insensitive substring search over one field, in insertion order.
     *
     * @param term      text to look for; must be non-empty
     * @param fieldName one of name, major, email, id
     */
    public List<StudentRecord> search(String term, String fieldName) {
        if (term == null || term.isEmpty()) {
            throw StudentRecordException.emptySearchTerm();
        }
        SearchField field = SearchField.fromKey(fieldName)
                .orElseThrow(() -> StudentRecordException.invalidSearchField(fieldName, SearchField.validKeys()));

        String needle = term.toLowerCase(Locale.ROOT);
        return studentAccess.findAll().stream()
                .filter(record -> field.valueOf(record).toLowerCase(Locale.ROOT).contains(needle))
                .toList();
    }

    public Optional<StudentStatistics> statistics() {
        List<StudentRecord> records = studentAccess.findAll();
        if (records.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(StudentStatistics.of(records));
    }

    public List<Map<String, Object>> exportAll() {
        return studentAccess.findAll().stream()
                .map(StudentRecord::toMap)
                .toList();
    }

    /**
     * Replaces the whole collection with the given rows. Each row is checked against the rows
     * accepted before it; if any row fails, nothing is replaced.
     *
     * @return the records now stored
     */
    public List<StudentRecord> importAll(List<? extends Map<String, ?>> rows) {
        Objects.requireNonNull(rows, "rows");

        List<StudentRecord> accepted = new ArrayList<>();
        Set<String> acceptedIds = new HashSet<>();
        List<String> rowErrors = new ArrayList<>();

        for (int i = 0; i < rows.size(); i++) {
            int rowNumber = i + 1;
            Map<String, ?> row = rows.get(i);
            if (row == null) {
                rowErrors.add("Row " + rowNumber + ": row is missing");
                continue;
            }

            StudentRecord record;
            try {
                record = StudentRecord.fromMap(row, clock);
            } catch (IllegalArgumentException ex) {
                rowErrors.add("Row " + rowNumber + ": " + ex.getMessage());
                continue;
            }

            ValidationResult result = record.validate(acceptedIds);
            if (result.valid()) {
                accepted.add(record);
                acceptedIds.add(record.getId());
            } else {
                rowErrors.add("Row " + rowNumber + ": " + String.join(", ", result.errors()));
            }
        }

        if (!rowErrors.isEmpty()) {
            log.warn("Rejected import of {} rows: {} invalid", rows.size(), rowErrors.size());
            throw StudentRecordException.importRejected(rowErrors);
        }

        studentAccess.replaceAll(accepted);
        log.info("Imported {} students", accepted.size());
        return accepted;
    }

    private static void requireStudentId(String studentId) {
        if (studentId == null || studentId.isEmpty()) {
            throw StudentRecordException.emptyStudentId();
        }
    }
}
