package com.foiarelay.directory.model;

public enum MatchTier {
    UNIT_ID,
    EXACT_NAME,
    NAME_CONTAINS
}
