package com.foiarelay.directory.compose;

public record PostalAddress(
    String line1,
    String line2,
    String city,
    String state,
    String zip
) {
    /** Single-line form, e.g. {@code 1 Main St, Apt 2, Springfield, IL 62701}. */
    public String formatted() {
        StringBuilder sb = new StringBuilder(nullToEmpty(line1));
        if (line2 != null && !line2.isBlank()) {
            sb.append(", ").append(line2.trim());
        }
        sb.append(", ").append(nullToEmpty(city)).append(", ").append(nullToEmpty(state)).append(' ').append(nullToEmpty(zip));
        return sb.toString();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value.trim();
    }
}
