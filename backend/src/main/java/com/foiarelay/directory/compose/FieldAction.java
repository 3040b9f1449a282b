package com.foiarelay.directory.compose;

public enum FieldAction {
    FILL,
    SELECT
}
