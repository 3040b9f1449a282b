package com.foiarelay.directory.resolve;

import com.foiarelay.directory.model.CanonicalRecord;
import com.foiarelay.directory.model.MatchTier;
import com.foiarelay.directory.model.ResolutionQuery;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Containment in either direction, so "FBI Records" finds "FBI" and "Bureau" finds
 * "Federal Bureau of Investigation". Ties go to the earliest record in stored order.
 */
@Component
public class NameContainsMatcher implements AgencyMatcher {

    @Override
    public MatchTier tier() {
        return MatchTier.NAME_CONTAINS;
    }

    @Override
    public Optional<CanonicalRecord> match(ResolutionQuery query, List<CanonicalRecord> records) {
        if (!query.hasName()) {
            return Optional.empty();
        }
        String wanted = query.name().trim().toLowerCase(Locale.ROOT);
        for (CanonicalRecord record : records) {
            if (record.name() == null || record.name().isBlank()) {
                continue;
            }
            String name = record.name().trim().toLowerCase(Locale.ROOT);
            if (name.contains(wanted) || wanted.contains(name)) {
                return Optional.of(record);
            }
        }
        return Optional.empty();
    }
}
