package com.creditengine.common;

import com.creditengine.common.exception.InvalidOperationException;

import java.util.Map;

/**
 * Utility class for checking caller input against the storage column sizes.
 *
 * Identifiers are capped below the column width so scoped idempotency keys
 * built from them stay within {@link IdempotencyKey#MAX_LENGTH}.
 */
public final class InputLimits {

    public static final int MAX_ID_LENGTH = 128;
    public static final int MAX_TOKEN_LENGTH = 1024;
    public static final int MAX_METADATA_KEY_LENGTH = 255;
    public static final int MAX_METADATA_VALUE_LENGTH = 1024;

    private InputLimits() {
    }

    public static void requireId(String value, String field) {
        requireText(value, field, MAX_ID_LENGTH);
    }

    public static void requireText(String value, String field, int maxLength) {
        if (value == null || value.isBlank()) {
            throw new InvalidOperationException(field + " is required");
        }
        if (value.length() > maxLength) {
            throw new InvalidOperationException(field + " must be at most " + maxLength + " characters");
        }
    }

    public static void requireMetadata(Map<String, String> metadata) {
        if (metadata == null) {
            return;
        }
        metadata.forEach((key, value) -> {
            if (key == null || key.isBlank()) {
                throw new InvalidOperationException("Metadata keys must not be blank");
            }
            if (key.length() > MAX_METADATA_KEY_LENGTH) {
                throw new InvalidOperationException(
                    "Metadata key must be at most " + MAX_METADATA_KEY_LENGTH + " characters");
            }
            if (value != null && value.length() > MAX_METADATA_VALUE_LENGTH) {
                throw new InvalidOperationException(
                    "Metadata value for " + key + " must be at most " + MAX_METADATA_VALUE_LENGTH + " characters");
            }
        });
    }
}
