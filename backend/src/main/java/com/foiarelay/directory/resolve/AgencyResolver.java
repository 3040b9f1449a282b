package com.foiarelay.directory.resolve;

import com.foiarelay.directory.model.CanonicalRecord;
import com.foiarelay.directory.model.ResolutionQuery;
import com.foiarelay.directory.model.ResolutionResult;
import com.foiarelay.directory.store.DirectoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Picks a delivery channel for a query. Matchers run in tier order and the first hit
 * decides the outcome, even when that record carries no email.
 */
@Service
public class AgencyResolver {
    private static final Logger log = LoggerFactory.getLogger(AgencyResolver.class);

    private final DirectoryStore store;
    private final List<AgencyMatcher> matchers;

    public AgencyResolver(DirectoryStore store, List<AgencyMatcher> matchers) {
        this.store = store;
        this.matchers = matchers.stream()
            .sorted(Comparator.comparingInt(matcher -> matcher.tier().ordinal()))
            .toList();
    }

    public ResolutionResult resolve(ResolutionQuery query) {
        if (query == null || (!query.hasUnitId() && !query.hasName())) {
            throw new IllegalArgumentException("Either unitId or name is required");
        }
        List<CanonicalRecord> records = store.records();
        for (AgencyMatcher matcher : matchers) {
            Optional<CanonicalRecord> hit = matcher.match(query, records);
            if (hit.isPresent()) {
                CanonicalRecord record = hit.get();
                ResolutionResult result = record.hasEmail()
                    ? ResolutionResult.email(record, matcher.tier())
                    : ResolutionResult.portal(record, matcher.tier());
                log.debug("Resolved {} via {} to {} ({})", query, matcher.tier(), record.unitId(), result.channel());
                return result;
            }
        }
        log.debug("No directory match for {}; falling back to portal", query);
        return ResolutionResult.portal(null, null);
    }
}
