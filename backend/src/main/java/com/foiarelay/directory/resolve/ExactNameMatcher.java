package com.foiarelay.directory.resolve;

import com.foiarelay.directory.model.CanonicalRecord;
import com.foiarelay.directory.model.MatchTier;
import com.foiarelay.directory.model.ResolutionQuery;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Component
public class ExactNameMatcher implements AgencyMatcher {

    @Override
    public MatchTier tier() {
        return MatchTier.EXACT_NAME;
    }

    @Override
    public Optional<CanonicalRecord> match(ResolutionQuery query, List<CanonicalRecord> records) {
        if (!query.hasName()) {
            return Optional.empty();
        }
        String name = query.name().trim();
        return records.stream()
            .filter(record -> record.name() != null && record.name().trim().equalsIgnoreCase(name))
            .findFirst();
    }
}
