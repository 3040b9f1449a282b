package com.foiarelay.directory.model;

import java.time.Instant;
import java.util.List;

public record CanonicalRecord(
    String unitId,
    String name,
    String abbreviation,
    String parentAgencyName,
    String parentAbbreviation,
    List<String> emails,
    String website,
    String postalAddress,
    String phone,
    String foiaOfficerName,
    Instant lastReconciledAt
) {
    public CanonicalRecord {
        emails = emails == null ? List.of() : List.copyOf(emails);
    }

    public boolean hasEmail() {
        return !emails.isEmpty();
    }

    public String primaryEmail() {
        return emails.isEmpty() ? null : emails.get(0);
    }
}
