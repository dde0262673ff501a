package com.theatre.catalog.service;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

public class ResourceNotFoundException extends CatalogException {

    private final String resource;
    private final Object id;

    public ResourceNotFoundException(String resource, Object id) {
        super(resource + " not found: " + id);
        this.resource = resource;
        this.id = id;
    }

    public static ResourceNotFoundException of(String resource, Collection<Long> missingIds) {
        return new ResourceNotFoundException(resource, missingIds.size() == 1 ? missingIds.iterator().next() : missingIds);
    }

    public String getResource() {
        return resource;
    }

    public Object getId() {
        return id;
    }

    @Override
    public Map<String, Object> getDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("resource", resource);
        details.put("id", id);
        return details;
    }
}
