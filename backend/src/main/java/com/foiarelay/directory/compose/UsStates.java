package com.foiarelay.directory.compose;

import java.util.List;
import java.util.Locale;

/**
 * Two-letter codes in the order the portal's domestic state dropdown lists them
 * (alphabetical by state name, DC included), so a code's list position is its option value.
 */
final class UsStates {
    private static final List<String> CODES = List.of(
        "AL", "AK", "AZ", "AR", "CA", "CO", "CT", "DE", "DC", "FL",
        "GA", "HI", "ID", "IL", "IN", "IA", "KS", "KY", "LA", "ME",
        "MD", "MA", "MI", "MN", "MS", "MO", "MT", "NE", "NV", "NH",
        "NJ", "NM", "NY", "NC", "ND", "OH", "OK", "OR", "PA", "RI",
        "SC", "SD", "TN", "TX", "UT", "VT", "VA", "WA", "WV", "WI",
        "WY"
    );

    private UsStates() {
    }

    /** Dropdown index for a state code; unknown or blank codes map to the first entry. */
    static String dropdownIndex(String stateCode) {
        if (stateCode == null) {
            return "0";
        }
        int index = CODES.indexOf(stateCode.trim().toUpperCase(Locale.ROOT));
        return String.valueOf(Math.max(0, index));
    }
}
