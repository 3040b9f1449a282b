package com.foiarelay.directory.resolve;

import com.foiarelay.directory.model.CanonicalRecord;
import com.foiarelay.directory.model.MatchTier;
import com.foiarelay.directory.model.ResolutionQuery;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Component
public class UnitIdMatcher implements AgencyMatcher {

    @Override
    public MatchTier tier() {
        return MatchTier.UNIT_ID;
    }

    @Override
    public Optional<CanonicalRecord> match(ResolutionQuery query, List<CanonicalRecord> records) {
        if (!query.hasUnitId()) {
            return Optional.empty();
        }
        String unitId = query.unitId().trim();
        return records.stream()
            .filter(record -> unitId.equals(record.unitId()))
            .findFirst();
    }
}
