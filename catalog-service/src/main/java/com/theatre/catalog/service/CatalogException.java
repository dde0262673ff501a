package com.theatre.catalog.service;

import java.util.Map;

public class CatalogException extends RuntimeException {

    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }

    public Map<String, Object> getDetails() {
        return Map.of();
    }
}
