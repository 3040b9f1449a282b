package com.foiarelay.directory.compose;

import java.time.Duration;

/**
 * One step of the portal fill sequence. {@code fieldName} is the DOM id of the form
 * control; {@code settleAfter} is how long to wait before the next step, since some
 * selections reveal dependent fields.
 */
public record PortalField(
    String fieldName,
    String value,
    FieldAction action,
    Duration settleAfter
) {
    public PortalField {
        settleAfter = settleAfter == null ? Duration.ZERO : settleAfter;
    }

    static PortalField fill(String fieldName, String value) {
        return new PortalField(fieldName, value, FieldAction.FILL, Duration.ZERO);
    }

    static PortalField select(String fieldName, String value) {
        return new PortalField(fieldName, value, FieldAction.SELECT, Duration.ZERO);
    }

    static PortalField select(String fieldName, String value, long settleMs) {
        return new PortalField(fieldName, value, FieldAction.SELECT, Duration.ofMillis(settleMs));
    }
}
