package com.foiarelay.directory.model;

public record ExtractedContact(
    String email,
    String name,
    String foiaOfficerName,
    String phone,
    String address
) {
    public static ExtractedContact empty() {
        return new ExtractedContact("", "", "", "", "");
    }

    public boolean hasEmail() {
        return email != null && !email.isEmpty();
    }
}
