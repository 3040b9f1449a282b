package com.foiarelay.directory.model;

public enum DeliveryChannel {
    EMAIL,
    PORTAL
}
