package com.example.studentrecords.access;

import com.example.studentrecords.models.StudentRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.springframework.stereotype.Component;

@Component
public class InMemoryStudentAccess implements StudentAccess {

    private final List<StudentRecord> records = new ArrayList<>();

    @Override
    public List<StudentRecord> findAll() {
        return records.stream()
                .map(StudentRecord::copy)
                .toList();
    }

    @Override
    public Optional<StudentRecord> findById(String id) {
        int index = indexOf(id);
        return index < 0 ? Optional.empty() : Optional.of(records.get(index).copy());
    }

    @Override
    public List<String> findAllIds() {
        return records.stream()
                .map(StudentRecord::getId)
                .toList();
    }

    @Override
    public int count() {
        return records.size();
    }

    @Override
    public StudentRecord save(StudentRecord record) {
        Objects.requireNonNull(record, "record");
        if (indexOf(record.getId()) >= 0) {
            throw new IllegalStateException("Student " + record.getId() + " is already stored");
        }
        records.add(record.copy());
        return record;
    }

    @Override
    public StudentRecord update(StudentRecord record) {
        Objects.requireNonNull(record, "record");
        int index = indexOf(record.getId());
        if (index < 0) {
            throw new IllegalStateException("Student " + record.getId() + " is not stored");
        }
        records.set(index, record.copy());
        return record;
    }

    @Override
    public Optional<StudentRecord> delete(String id) {
        int index = indexOf(id);
        return index < 0 ? Optional.empty() : Optional.of(records.remove(index));
    }

    @Override
    public void replaceAll(List<StudentRecord> replacement) {
        Objects.requireNonNull(replacement, "replacement");
        List<StudentRecord> copies = replacement.stream()
                .map(StudentRecord::copy)
                .toList();
        records.clear();
        records.addAll(copies);
    }

    private int indexOf(String id) {
        for (int i = 0; i < records.size(); i++) {
            if (Objects.equals(records.get(i).getId(), id)) {
                return i;
            }
        }
        return -1;
    }
}
