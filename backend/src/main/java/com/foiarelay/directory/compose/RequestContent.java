package com.foiarelay.directory.compose;

/** The already-rephrased request text plus the short description used in the subject line. */
public record RequestContent(
    String rephrasedRequest,
    String briefDescription
) {}
