package com.foiarelay.directory.persistence;

import com.foiarelay.directory.model.CanonicalRecord;

import java.util.List;

/**
 * Wholesale persistence for the canonical directory. There is no per-record update path:
 * a run replaces everything, and readers always load the full list in stored order.
 */
public interface DirectoryRepository {

    List<CanonicalRecord> loadAll();

    void replaceAll(List<CanonicalRecord> records);

    String backend();
}
