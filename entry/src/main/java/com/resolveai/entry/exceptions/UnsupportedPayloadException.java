package com.resolveai.entry.exceptions;

/**
 * Thrown when an entry's data is neither text nor a structured value and unsupported payloads are rejected.
 */
public class UnsupportedPayloadException extends RuntimeException {

    private final Class<?> payloadType;

    public UnsupportedPayloadException(Class<?> payloadType) {
        super("Log entry data of type " + payloadType.getName()
                + " cannot be written as a text or JSON payload");
        this.payloadType = payloadType;
    }

    public Class<?> getPayloadType() {
        return payloadType;
    }
}
