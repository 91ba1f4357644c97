package com.phillippitts.phiredaction.domain;

import java.util.Locale;

/**
 * Closed set of PHI categories an entity can carry.
 *
 * <p>Each label has a wire name used in the REST contract, the placeholder token substituted on
 * apply, and a precedence used to order entity listings (higher first).
 */
public enum PhiLabel {
    PERSON("person", "[PERSON]", 5),
    PHONE("phone", "[PHONE]", 8),
    EMAIL("email", "[EMAIL]", 7),
    ADDRESS("address", "[ADDRESS]", 4),
    DATE_OF_BIRTH("date-of-birth", "[DOB]", 6),
    AGE("age", "[AGE]", 3),
    NATIONAL_ID("national-id", "[SSN]", 10),
    RECORD_NUMBER("record-number", "[MRN]", 9),
    ORGANIZATION("organization", "[ORG]", 2),
    INSTITUTION("institution", "[INSTITUTION]", 2),
    HANDLE("handle", "[HANDLE]", 1);

    private final String wireName;
    private final String placeholder;
    private final int precedence;

    PhiLabel(String wireName, String placeholder, int precedence) {
        this.wireName = wireName;
        this.placeholder = placeholder;
        this.precedence = precedence;
    }

    public String wireName() {
        return wireName;
    }

    public String placeholder() {
        return placeholder;
    }

    public int precedence() {
        return precedence;
    }

    /**
     * Resolves a label from its wire name or enum constant name, case-insensitively.
     *
     * @param value wire name ("date-of-birth") or constant name ("DATE_OF_BIRTH")
     * @return matching label
     * @throws IllegalArgumentException if no label matches
     */
    public static PhiLabel fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("label must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (PhiLabel label : values()) {
            if (label.wireName.equals(normalized)) {
                return label;
            }
        }
        throw new IllegalArgumentException("Unknown PHI label: " + value);
    }
}
