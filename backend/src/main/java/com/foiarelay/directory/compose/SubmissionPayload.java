package com.foiarelay.directory.compose;

import com.foiarelay.directory.model.DeliveryChannel;

public interface SubmissionPayload {

    DeliveryChannel channel();
}
