package com.foiarelay.directory.delivery;

import com.foiarelay.directory.model.DeliveryChannel;

/**
 * Result handed back to the requester. Failures never throw past the submission service;
 * they carry {@code manualFallback} instead.
 */
public record SubmissionOutcome(
    boolean success,
    DeliveryChannel channel,
    String message,
    String trackingId,
    String emailSentTo,
    String portalUrl,
    String manualFallback
) {
    static SubmissionOutcome failure(DeliveryChannel channel, String message, String portalUrl, String manualFallback) {
        return new SubmissionOutcome(false, channel, message, null, null, portalUrl, manualFallback);
    }
}
