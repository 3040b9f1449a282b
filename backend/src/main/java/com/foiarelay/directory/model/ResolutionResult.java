package com.foiarelay.directory.model;

/**
 * Channel decision for one resolution call. {@code record} is null when nothing matched;
 * {@code emailAddress} is set only for {@link DeliveryChannel#EMAIL}.
 */
public record ResolutionResult(
    DeliveryChannel channel,
    CanonicalRecord record,
    String emailAddress,
    MatchTier matchedBy
) {
    public static ResolutionResult email(CanonicalRecord record, MatchTier matchedBy) {
        return new ResolutionResult(DeliveryChannel.EMAIL, record, record.primaryEmail(), matchedBy);
    }

    public static ResolutionResult portal(CanonicalRecord record, MatchTier matchedBy) {
        return new ResolutionResult(DeliveryChannel.PORTAL, record, null, matchedBy);
    }

    public boolean matched() {
        return record != null;
    }
}
