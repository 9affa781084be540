package com.example.studentrecords.access;

import com.example.studentrecords.models.StudentRecord;
import java.util.List;
import java.util.Optional;

/**
 * Ordered store of student records. Insertion order is the order callers see. Records handed in
 * or out are copies, so callers never share state with the store.
 */
public interface StudentAccess {

    /**
     * @return every record in insertion order
     */
    List<StudentRecord> findAll();

    Optional<StudentRecord> findById(String id);

    List<String> findAllIds();

    int count();

    /**
     * Appends a new record. Will fail if the id is already stored.
     */
    StudentRecord save(StudentRecord record);

    /**
     * Replaces the stored record with the same id, keeping its position. Will fail if no record
     * has that id.
     */
    StudentRecord update(StudentRecord record);

    /**
     * Removes the record with the given id.
     *
     * @return the removed record, or empty when none matched
     */
    Optional<StudentRecord> delete(String id);

    /**
     * Swaps the whole collection for the given records, in the given order.
     */
    void replaceAll(List<StudentRecord> records);
}
