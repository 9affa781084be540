package com.example.studentrecords.service;

import com.example.studentrecords.config.SampleDataProperties;
import com.example.studentrecords.models.StudentRecord;
import com.example.studentrecords.models.StudentStatistics;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Seeds the collection with five demo students at start-up. Students whose id is already taken
 * are skipped, so running it twice loads nothing the second time.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(value = "student-records.sample-data.enabled", havingValue = "true")
public class SampleDataLoader implements ApplicationRunner {

    static final List<Map<String, Object>> SAMPLE_STUDENTS = List.of(
            student("STU001", "John Doe", "john.doe@email.com", 20, "Computer Science", 3.8),
            student("STU002", "Jane Smith", "jane.smith@email.com", 19, "Mathematics", 3.9),
            student("STU003", "Mike Johnson", "mike.johnson@email.com", 21, "Physics", 3.5),
            student("STU004", "Sarah Wilson", "sarah.wilson@email.com", 20, "Computer Science", 3.7),
            student("STU005", "David Brown", "david.brown@email.com", 22, "Engineering", 3.6)
    );

    private final StudentRecordService recordService;
    private final SampleDataProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        int loaded = load();
        if (properties.isLogStatistics()) {
            recordService.statistics().ifPresent(this::logStatistics);
        }
        log.info("Sample data ready: {} of {} students loaded", loaded, SAMPLE_STUDENTS.size());
    }

    public int load() {
        int loaded = 0;
        for (Map<String, Object> sample : SAMPLE_STUDENTS) {
            try {
                recordService.create(sample);
                loaded++;
            } catch (StudentRecordException ex) {
                log.debug("Skipped sample student {}: {}", sample.get(StudentRecord.FIELD_ID), ex.getMessage());
            }
        }
        return loaded;
    }

    private void logStatistics(StudentStatistics stats) {
        log.info("Students={}, averageGpa={}, highestGpa={}, lowestGpa={}, averageAge={}",
                stats.totalStudents(), stats.averageGpa(), stats.highestGpa(),
                stats.lowestGpa(), stats.averageAge());
        stats.majorDistribution().forEach((major, count) ->
                log.info("  {}: {} students ({}%)", major, count, stats.majorPercentage(major)));
    }

    private static Map<String, Object> student(String id, String name, String email,
                                               int age, String major, double gpa) {
        return Map.of(
                StudentRecord.FIELD_ID, id,
                StudentRecord.FIELD_NAME, name,
                StudentRecord.FIELD_EMAIL, email,
                StudentRecord.FIELD_AGE, age,
                StudentRecord.FIELD_MAJOR, major,
                StudentRecord.FIELD_GPA, gpa
        );
    }
}
