package com.foiarelay.directory.delivery;

import com.foiarelay.directory.compose.EmailPayload;

/** Sends a finished email payload. Implementations throw {@link DeliveryException} on failure. */
public interface MailDispatcher {

    void send(EmailPayload payload);
}
