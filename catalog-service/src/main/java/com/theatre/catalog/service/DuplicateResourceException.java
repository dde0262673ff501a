package com.theatre.catalog.service;

public class DuplicateResourceException extends CatalogException {

    public DuplicateResourceException(String message) {
        super(message);
    }

    public DuplicateResourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
