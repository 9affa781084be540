package com.example.studentrecords.models;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * One student plus its bookkeeping timestamps. Knows how to validate its own fields and how to
 * convert itself to and from the field-name-keyed map form used for export and import.
 */
@JsonPropertyOrder({"id", "name", "email", "age", "major", "gpa", "created_at", "updated_at"})
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE) // used by Lombok @Builder
@Builder(toBuilder = true)
@Getter @Setter
@EqualsAndHashCode
@ToString
public class StudentRecord {

    public static final String FIELD_ID = "id";
    public static final String FIELD_LEGACY_ID = "student_id";
    public static final String FIELD_NAME = "name";
    public static final String FIELD_EMAIL = "email";
    public static final String FIELD_AGE = "age";
    public static final String FIELD_MAJOR = "major";
    public static final String FIELD_GPA = "gpa";
    public static final String FIELD_CREATED_AT = "created_at";
    public static final String FIELD_UPDATED_AT = "updated_at";

    public static final String TIMESTAMP_PATTERN = "yyyy-MM-dd HH:mm:ss";
    public static final DateTimeFormatter TIMESTAMP_FORMATTER = DateTimeFormatter.ofPattern(TIMESTAMP_PATTERN);

    public static final int MIN_AGE = 16;
    public static final int MAX_AGE = 100;
    public static final double MIN_GPA = 0.0;
    public static final double MAX_GPA = 4.0;

    private static final Pattern NAME_PATTERN = Pattern.compile("^[A-Za-z ]+$");
    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[\\w.%+-]+@[\\w.-]+\\.[A-Za-z]{2,}$");
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper().registerModule(new JavaTimeModule());

    @JsonProperty(FIELD_ID)
    private String id;

    @JsonProperty(FIELD_NAME)
    private String name;

    @JsonProperty(FIELD_EMAIL)
    private String email;

    // null when the source value was not an integer
    @JsonProperty(FIELD_AGE)
    private Integer age;

    @JsonProperty(FIELD_MAJOR)
    private String major;

    // null when the source value was not a number
    @JsonProperty(FIELD_GPA)
    private Double gpa;

    @JsonProperty(FIELD_CREATED_AT)
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = TIMESTAMP_PATTERN)
    private LocalDateTime createdAt;

    @JsonProperty(FIELD_UPDATED_AT)
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = TIMESTAMP_PATTERN)
    private LocalDateTime updatedAt;

    // ----- Field validators -----

    public static FieldCheck validateId(String id) {
        if (id == null || id.isEmpty()) {
            return FieldCheck.fail("Student ID cannot be empty");
        }
        if (id.length() < 3) {
            return FieldCheck.fail("Student ID must be at least 3 characters long");
        }
        if (!id.codePoints().allMatch(StudentRecord::isAlphanumeric)) {
            return FieldCheck.fail("Student ID must contain only letters and numbers");
        }
        return FieldCheck.ok();
    }

    // letters plus every numeric category: decimal, letter (Ⅻ) and other (²) numbers
    private static boolean isAlphanumeric(int codePoint) {
        int type = Character.getType(codePoint);
        return Character.isLetterOrDigit(codePoint)
                || type == Character.OTHER_NUMBER
                || type == Character.LETTER_NUMBER;
    }

    public static FieldCheck validateName(String name) {
        if (name == null || name.isBlank()) {
            return FieldCheck.fail("Name cannot be empty");
        }
        String trimmed = name.strip();
        if (trimmed.length() < 2) {
            return FieldCheck.fail("Name must be at least 2 characters long");
        }
        if (!NAME_PATTERN.matcher(trimmed).matches()) {
            return FieldCheck.fail("Name must contain only letters and spaces");
        }
        return FieldCheck.ok();
    }

    public static FieldCheck validateEmail(String email) {
        if (email == null || email.isEmpty()) {
            return FieldCheck.fail("Email cannot be empty");
        }
        if (!EMAIL_PATTERN.matcher(email).matches()) {
            return FieldCheck.fail("Invalid email format");
        }
        return FieldCheck.ok();
    }

    public static FieldCheck validateAge(Integer age) {
        if (age == null) {
            return FieldCheck.fail("Age must be a number");
        }
        if (age < MIN_AGE || age > MAX_AGE) {
            return FieldCheck.fail("Age must be between " + MIN_AGE + " and " + MAX_AGE);
        }
        return FieldCheck.ok();
    }

    public static FieldCheck validateMajor(String major) {
        if (major == null || major.isBlank()) {
            return FieldCheck.fail("Major cannot be empty");
        }
        if (major.strip().length() < 2) {
            return FieldCheck.fail("Major must be at least 2 characters long");
        }
        return FieldCheck.ok();
    }

    public static FieldCheck validateGpa(Double gpa) {
        if (gpa == null || gpa.isNaN()) {
            return FieldCheck.fail("GPA must be a number");
        }
        if (gpa < MIN_GPA || gpa > MAX_GPA) {
            return FieldCheck.fail("GPA must be between 0.0 and 4.0");
        }
        return FieldCheck.ok();
    }

    /**
     * Runs every field validator in the order id, name, email, age, major, gpa and collects all
     * failures. The duplicate check only runs once the id itself is well-formed.
     *
     * @param existingIds ids already taken by other records; may be null
     * @return the accumulated outcome
     */
    public ValidationResult validate(Collection<String> existingIds) {
        List<String> errors = new ArrayList<>();

        FieldCheck idCheck = validateId(id);
        if (!idCheck.valid()) {
            errors.add(idCheck.message());
        } else if (existingIds != null && existingIds.contains(id)) {
            errors.add("Student ID already exists");
        }

        collect(errors, validateName(name));
        collect(errors, validateEmail(email));
        collect(errors, validateAge(age));
        collect(errors, validateMajor(major));
        collect(errors, validateGpa(gpa));

        return new ValidationResult(errors);
    }

    private static void collect(List<String> errors, FieldCheck check) {
        if (!check.valid()) {
            errors.add(check.message());
        }
    }

    // ----- Domain helpers -----

    public StudentRecord touchUpdatedAt(Clock clock) {
        LocalDateTime now = now(clock);
        // updated_at never precedes created_at
        this.updatedAt = createdAt != null && now.isBefore(createdAt) ? createdAt : now;
        return this;
    }

    public StudentRecord copy() {
        return toBuilder().build();
    }

    public Map<String, Object> toMap() {
        return OBJECT_MAPPER.convertValue(this, new TypeReference<LinkedHashMap<String, Object>>() { });
    }

    /**
     * Builds a brand-new record from raw input fields. Timestamps in the input are ignored and
     * both are stamped with the current time.
     */
    public static StudentRecord fromInput(Map<String, ?> data, Clock clock) {
        Objects.requireNonNull(data, "data");
        LocalDateTime now = now(clock);
        return readFields(data)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * Rebuilds a record from its map form, keeping the stored timestamps when present. A missing
     * timestamp is stamped with the current time, clamped so updated_at never precedes created_at:
     * a lone updated_at also becomes created_at, a lone created_at in the future also becomes
     * updated_at.
     *
     * @throws IllegalArgumentException if a timestamp is malformed, or both are given and
     *                                  updated_at precedes created_at
     */
    public static StudentRecord fromMap(Map<String, ?> data, Clock clock) {
        Objects.requireNonNull(data, "data");
        LocalDateTime now = now(clock);
        LocalDateTime createdAt = readTimestamp(data.get(FIELD_CREATED_AT), FIELD_CREATED_AT, null);
        LocalDateTime updatedAt = readTimestamp(data.get(FIELD_UPDATED_AT), FIELD_UPDATED_AT, null);
        if (createdAt == null && updatedAt == null) {
            createdAt = now;
            updatedAt = now;
        } else if (createdAt == null) {
            createdAt = updatedAt.isBefore(now) ? updatedAt : now;
        } else if (updatedAt == null) {
            updatedAt = now.isBefore(createdAt) ? createdAt : now;
        } else if (updatedAt.isBefore(createdAt)) {
            throw new IllegalArgumentException(FIELD_UPDATED_AT + " must not precede " + FIELD_CREATED_AT);
        }
        return readFields(data)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .build();
    }

    public static String formatTimestamp(LocalDateTime timestamp) {
        return timestamp == null ? null : TIMESTAMP_FORMATTER.format(timestamp);
    }

    private static StudentRecordBuilder readFields(Map<String, ?> data) {
        Object id = data.containsKey(FIELD_ID) ? data.get(FIELD_ID) : data.get(FIELD_LEGACY_ID);
        return StudentRecord.builder()
                .id(readText(id))
                .name(readText(data.get(FIELD_NAME)))
                .email(readText(data.get(FIELD_EMAIL)))
                .age(data.containsKey(FIELD_AGE) ? readAge(data.get(FIELD_AGE)) : Integer.valueOf(0))
                .major(readText(data.get(FIELD_MAJOR)))
                .gpa(data.containsKey(FIELD_GPA) ? readGpa(data.get(FIELD_GPA)) : Double.valueOf(0.0));
    }

    private static String readText(Object value) {
        return value == null ? "" : value.toString();
    }

    private static Integer readAge(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).intValue();
        }
        if (value instanceof Long longValue
                && longValue >= Integer.MIN_VALUE && longValue <= Integer.MAX_VALUE) {
            return longValue.intValue();
        }
        return null;
    }

    private static Double readGpa(Object value) {
        return value instanceof Number number ? number.doubleValue() : null;
    }

    private static LocalDateTime readTimestamp(Object value, String field, LocalDateTime fallback) {
        if (value == null) {
            return fallback;
        }
        if (value instanceof LocalDateTime timestamp) {
            return timestamp.truncatedTo(ChronoUnit.SECONDS);
        }
        try {
            return LocalDateTime.parse(value.toString(), TIMESTAMP_FORMATTER);
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException(
                    field + " must use the format " + TIMESTAMP_PATTERN + ": " + value, ex);
        }
    }

    private static LocalDateTime now(Clock clock) {
        return LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
    }
}
