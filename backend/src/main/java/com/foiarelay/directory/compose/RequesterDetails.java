package com.foiarelay.directory.compose;

import java.math.BigDecimal;

public record RequesterDetails(
    String firstName,
    String lastName,
    String email,
    String phone,
    PostalAddress address,
    FeeCategory feeCategory,
    BigDecimal maxFee,
    boolean feeWaiverRequested,
    String feeWaiverReason
) {
    public RequesterDetails {
        feeCategory = feeCategory == null ? FeeCategory.OTHER : feeCategory;
        maxFee = maxFee == null ? BigDecimal.ZERO : maxFee;
        address = address == null ? new PostalAddress("", null, "", "", "") : address;
    }

    public String fullName() {
        return (safe(firstName) + " " + safe(lastName)).trim();
    }

    public boolean hasPhone() {
        return phone != null && !phone.isBlank();
    }

    public String maxFeeText() {
        return maxFee.stripTrailingZeros().toPlainString();
    }

    private static String safe(String value) {
        return value == null ? "" : value.trim();
    }
}
