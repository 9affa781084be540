package com.example.studentrecords.models;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Aggregate figures over the live collection. Averages are rounded on their exact binary value
 * with ties to even, GPA to two decimals and age to one.
 */
public record StudentStatistics(
        int totalStudents,
        double averageGpa,
        double highestGpa,
        double lowestGpa,
        double averageAge,
        Map<String, Long> majorDistribution
) {

    public StudentStatistics {
        majorDistribution = Collections.unmodifiableMap(new LinkedHashMap<>(majorDistribution));
    }

    /**
     * @param records a non-empty list of validated records
     */
    public static StudentStatistics of(List<StudentRecord> records) {
        if (records == null || records.isEmpty()) {
            throw new IllegalArgumentException("records must be non-empty");
        }

        double gpaSum = 0.0;
        double highest = Double.NEGATIVE_INFINITY;
        double lowest = Double.POSITIVE_INFINITY;
        long ageSum = 0;
        for (StudentRecord record : records) {
            double gpa = record.getGpa();
            gpaSum += gpa;
            highest = Math.max(highest, gpa);
            lowest = Math.min(lowest, gpa);
            ageSum += record.getAge();
        }

        Map<String, Long> majors = records.stream()
                .collect(Collectors.groupingBy(StudentRecord::getMajor, LinkedHashMap::new, Collectors.counting()));

        int total = records.size();
        return new StudentStatistics(
                total,
                round(gpaSum / total, 2),
                highest,
                lowest,
                round((double) ageSum / total, 1),
                majors
        );
    }

    public double majorPercentage(String major) {
        long count = majorDistribution.getOrDefault(major, 0L);
        return round(count * 100.0 / totalStudents, 1);
    }

    private static double round(double value, int scale) {
        return new BigDecimal(value).setScale(scale, RoundingMode.HALF_EVEN).doubleValue();
    }
}
