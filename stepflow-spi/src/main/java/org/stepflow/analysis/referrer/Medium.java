package org.stepflow.analysis.referrer;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Category of a referring source, the top-level keys of {@code referers.yml}.
 */
public enum Medium {
    UNKNOWN, INTERNAL, SEARCH, SOCIAL, EMAIL, PAID, VIDEO, DEVELOPER, AI;

    @JsonCreator
    public static Medium fromString(String medium) {
        return valueOf(medium.toUpperCase(Locale.ENGLISH));
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ENGLISH);
    }
}
