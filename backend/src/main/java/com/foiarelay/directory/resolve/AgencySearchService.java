package com.foiarelay.directory.resolve;

import com.foiarelay.config.DirectoryProperties;
import com.foiarelay.directory.model.CanonicalRecord;
import com.foiarelay.directory.store.DirectoryStore;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

@Service
public class AgencySearchService {
    private final DirectoryStore store;
    private final DirectoryProperties properties;

    public AgencySearchService(DirectoryStore store, DirectoryProperties properties) {
        this.store = store;
        this.properties = properties;
    }

    /**
     * Email-capable agencies whose name, parent name or either abbreviation contains the
     * query. A blank query lists the first {@code limit} email-capable agencies.
     */
    public List<CanonicalRecord> search(String query, Integer limit) {
        int effectiveLimit = limit == null || limit < 1 ? properties.getSearch().getDefaultLimit() : limit;
        String needle = query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
        return store.records().stream()
            .filter(CanonicalRecord::hasEmail)
            .filter(record -> needle.isEmpty() || matches(record, needle))
            .limit(effectiveLimit)
            .toList();
    }

    private boolean matches(CanonicalRecord record, String needle) {
        return contains(record.name(), needle)
            || contains(record.parentAgencyName(), needle)
            || contains(record.abbreviation(), needle)
            || contains(record.parentAbbreviation(), needle);
    }

    private boolean contains(String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
    }
}
