package com.foiarelay.directory.model;

import java.util.List;

/**
 * Captured state of a unit page after the optional reveal step. Everything the
 * extraction heuristics need, with no reference back to the browser.
 */
public record PageSnapshot(
    String url,
    String renderedText,
    List<String> mailtoHrefs,
    String firstHeading
) {
    public PageSnapshot {
        renderedText = renderedText == null ? "" : renderedText;
        mailtoHrefs = mailtoHrefs == null ? List.of() : List.copyOf(mailtoHrefs);
        firstHeading = firstHeading == null ? "" : firstHeading;
    }
}
