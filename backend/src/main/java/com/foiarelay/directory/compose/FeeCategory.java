package com.foiarelay.directory.compose;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum FeeCategory {
    COMMERCIAL("commercial", "Commercial use requester", "3"),
    EDUCATIONAL("educational", "Educational institution", "1"),
    NEWS_MEDIA("news_media", "Representative of the news media", "0"),
    OTHER("other", "All other requesters", "4");

    private final String code;
    private final String label;
    private final String portalValue;

    FeeCategory(String code, String label, String portalValue) {
        this.code = code;
        this.label = label;
        this.portalValue = portalValue;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public String label() {
        return label;
    }

    /** Option value of the portal's request-category dropdown. */
    public String portalValue() {
        return portalValue;
    }

    @JsonCreator
    public static FeeCategory fromCode(String code) {
        if (code == null || code.isBlank()) {
            return OTHER;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (FeeCategory category : values()) {
            if (category.code.equals(normalized) || category.name().equalsIgnoreCase(normalized)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown fee category: " + code);
    }
}
