package com.foiarelay.directory.scrape;

public class PageSessionException extends RuntimeException {
    public PageSessionException(String message) {
        super(message);
    }

    public PageSessionException(String message, Throwable cause) {
        super(message, cause);
    }
}
