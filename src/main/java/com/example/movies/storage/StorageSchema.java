package com.example.movies.storage;

import com.example.movies.model.CatalogEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.dynamodb.model.AttributeDefinition;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.BillingMode;
import software.amazon.awssdk.services.dynamodb.model.CreateTableRequest;
import software.amazon.awssdk.services.dynamodb.model.KeySchemaElement;
import software.amazon.awssdk.services.dynamodb.model.KeyType;
import software.amazon.awssdk.services.dynamodb.model.ScalarAttributeType;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shape of the movies table: {@code year} (N) is the partition key and {@code title} (S)
 * the sort key. Every other attribute is free-form.
 */
@Slf4j
public final class StorageSchema {

    public static final String PARTITION_KEY = "year";
    public static final String SORT_KEY = "title";

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private StorageSchema() {
    }

    public static void validate(CatalogEntry entry) {
        if (entry == null) {
            throw new CatalogValidationException("Request body must be a JSON object");
        }
        if (entry.getYear() == null) {
            throw new CatalogValidationException("'year' is required and must be a number");
        }
        if (entry.getTitle() == null || entry.getTitle().isEmpty()) {
            throw new CatalogValidationException("'title' is required and must not be empty");
        }
    }

    /**
     * Converts a validated entry into the full item stored under its key.
     */
    public static Map<String, AttributeValue> toItem(CatalogEntry entry) {
        Map<String, AttributeValue> item = new LinkedHashMap<>();
        item.put(PARTITION_KEY, AttributeValue.builder().n(Integer.toString(entry.getYear())).build());
        item.put(SORT_KEY, AttributeValue.builder().s(entry.getTitle()).build());

        if (entry.getAttributes() != null) {
            entry.getAttributes().forEach((name, value) -> {
                if (PARTITION_KEY.equals(name) || SORT_KEY.equals(name)) {
                    return;
                }
                item.put(name, toAttributeValue(value));
            });
        }
        return item;
    }

    public static CreateTableRequest createTableRequest(String tableName) {
        return CreateTableRequest.builder()
                .tableName(tableName)
                .keySchema(
                        KeySchemaElement.builder().attributeName(PARTITION_KEY).keyType(KeyType.HASH).build(),
                        KeySchemaElement.builder().attributeName(SORT_KEY).keyType(KeyType.RANGE).build())
                .attributeDefinitions(
                        AttributeDefinition.builder().attributeName(PARTITION_KEY)
                                .attributeType(ScalarAttributeType.N).build(),
                        AttributeDefinition.builder().attributeName(SORT_KEY)
                                .attributeType(ScalarAttributeType.S).build())
                .billingMode(BillingMode.PAY_PER_REQUEST)
                .build();
    }

    @SuppressWarnings("unchecked")
    static AttributeValue toAttributeValue(Object value) {
        if (value == null) {
            return AttributeValue.builder().nul(true).build();
        } else if (value instanceof String) {
            return AttributeValue.builder().s((String) value).build();
        } else if (value instanceof BigDecimal) {
            return AttributeValue.builder().n(((BigDecimal) value).toPlainString()).build();
        } else if (value instanceof Number) {
            return AttributeValue.builder().n(value.toString()).build();
        } else if (value instanceof Boolean) {
            return AttributeValue.builder().bool((Boolean) value).build();
        } else if (value instanceof Map) {
            Map<String, AttributeValue> nested = new LinkedHashMap<>();
            ((Map<String, Object>) value).forEach((k, v) -> nested.put(k, toAttributeValue(v)));
            return AttributeValue.builder().m(nested).build();
        } else if (value instanceof Collection) {
            List<AttributeValue> nested = new ArrayList<>();
            for (Object element : (Collection<Object>) value) {
                nested.add(toAttributeValue(element));
            }
            return AttributeValue.builder().l(nested).build();
        }
        // Anything else Jackson handed us is stored as its JSON text
        return AttributeValue.builder().s(serializeToJson(value)).build();
    }

    private static String serializeToJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("JSON serialization failed: {}", value, e);
            throw new CatalogValidationException("Attribute value cannot be stored: " + value);
        }
    }
}
