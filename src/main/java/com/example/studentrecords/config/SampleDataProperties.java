package com.example.studentrecords.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for start-up sample data.
 * These values are bound from application.yml (student-records.sample-data.*).
 * To seed the demo students, set student-records.sample-data.enabled=true.
 */
@Component
@ConfigurationProperties(prefix = "student-records.sample-data")
@Data
public class SampleDataProperties {

    private boolean enabled = false;
    private boolean logStatistics = true;  // Log a statistics summary once seeding finishes
}
