package com.foiarelay.directory.compose;

import com.foiarelay.directory.model.DeliveryChannel;

public record EmailPayload(
    String to,
    String subject,
    String body,
    String replyTo,
    String replyToName
) implements SubmissionPayload {

    @Override
    public DeliveryChannel channel() {
        return DeliveryChannel.EMAIL;
    }
}
