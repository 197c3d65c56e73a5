package org.matchreminder.fixtures;

import java.util.Locale;

/**
 * Bucket a competition label falls into.
 * <p>
 * Anything that is neither the Champions League nor La Liga counts as {@link #LEAGUE},
 * domestic cups included.
 */
public enum Competition {
    CHAMPIONS_LEAGUE("Champions League"),
    LA_LIGA("La Liga"),
    LEAGUE("League");

    private final String displayName;

    Competition(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static Competition classify(String label) {
        if (label == null) {
            return LEAGUE;
        }
        String lower = label.toLowerCase(Locale.ROOT);
        if (lower.contains("champions")) {
            return CHAMPIONS_LEAGUE;
        }
        if (lower.contains("liga")) {
            return LA_LIGA;
        }
        return LEAGUE;
    }
}
