package com.gnovoa.swiss.exception;

/**
 * Thrown when a value does not fit its TRF16 fixed-width field (ids and ratings above 9999,
 * points above 99.9).
 */
public class FormatLimitException extends PairingEngineException {
    private final String entity;
    private final long value;
    private final long limit;

    public FormatLimitException(String entity, long value, long limit, String message) {
        super(message + " (" + entity + ": " + value + ", limit " + limit + ")");
        this.entity = entity;
        this.value = value;
        this.limit = limit;
    }

    public String getEntity() {
        return entity;
    }

    public long getValue() {
        return value;
    }

    public long getLimit() {
        return limit;
    }
}
