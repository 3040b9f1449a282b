package com.foiarelay.directory.model;

public record ScrapedRecord(
    String unitId,
    String displayName,
    String extractedEmail,
    String phone,
    String postalAddressText,
    String foiaOfficerName,
    String sourceUrl
) {
    public static ScrapedRecord placeholder(String unitId, String sourceUrl) {
        return new ScrapedRecord(unitId, "", null, "", "", "", sourceUrl);
    }

    public boolean hasEmail() {
        return extractedEmail != null && !extractedEmail.isBlank();
    }
}
