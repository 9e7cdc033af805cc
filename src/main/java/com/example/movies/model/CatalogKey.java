package com.example.movies.model;

import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Composite primary key of a catalog entry: {@code year} is the partition key,
 * {@code title} the sort key.
 */
@Value
@AllArgsConstructor(staticName = "of")
public class CatalogKey {
    int year;
    String title;
}
