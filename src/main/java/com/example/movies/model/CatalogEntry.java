package com.example.movies.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A movie in the catalog, keyed by (year, title).
 * Anything else in the request body ends up in {@code attributes} and is stored as-is.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogEntry {

    // The partition key; boxed so a missing value can be told apart from 0
    private Integer year;

    // The sort key
    private String title;

    @Builder.Default
    private Map<String, Object> attributes = new LinkedHashMap<>();

    @JsonAnySetter
    public void putAttribute(String name, Object value) {
        if (attributes == null) {
            attributes = new LinkedHashMap<>();
        }
        attributes.put(name, value);
    }

    @JsonAnyGetter
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public CatalogKey key() {
        return CatalogKey.of(year, title);
    }
}
