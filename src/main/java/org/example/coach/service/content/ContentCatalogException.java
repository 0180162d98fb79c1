package org.example.coach.service.content;

public class ContentCatalogException extends RuntimeException {

    public ContentCatalogException(String message) {
        super(message);
    }

    public ContentCatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
