package com.foiarelay.directory.model;

import java.util.List;

public record RegistryRecord(
    String unitId,
    String title,
    String abbreviation,
    String parentAgencyId,
    String parentAgencyName,
    String parentAbbreviation,
    List<String> structuredEmails,
    String website,
    String postalAddress,
    String foiaOfficerName,
    String phone
) {
    public RegistryRecord {
        structuredEmails = structuredEmails == null ? List.of() : List.copyOf(structuredEmails);
    }
}
