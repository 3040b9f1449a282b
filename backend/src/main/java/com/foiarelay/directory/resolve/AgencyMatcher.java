package com.foiarelay.directory.resolve;

import com.foiarelay.directory.model.CanonicalRecord;
import com.foiarelay.directory.model.MatchTier;
import com.foiarelay.directory.model.ResolutionQuery;

import java.util.List;
import java.util.Optional;

/**
 * One tier of the resolution cascade. Implementations scan the records in stored order
 * and return the first match, or empty when the tier does not apply to the query.
 */
public interface AgencyMatcher {

    MatchTier tier();

    Optional<CanonicalRecord> match(ResolutionQuery query, List<CanonicalRecord> records);
}
