package com.resolveai.entry.models;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.temporal.TemporalAccessor;
import java.util.Collection;
import java.util.Map;

/**
 * The payload of a log entry, classified once from the raw data value.
 *
 * <ul>
 *     <li>{@link Kind#TEXT}: a {@link String}, written as {@code textPayload}.</li>
 *     <li>{@link Kind#STRUCTURED}: a {@link Map} or any other plain bean, written as {@code jsonPayload}.</li>
 *     <li>{@link Kind#UNSET}: no data at all.</li>
 *     <li>{@link Kind#UNSUPPORTED}: numbers, booleans, characters, binary blobs, arrays, collections, enums and
 *     temporal values. Neither payload field can carry them.</li>
 * </ul>
 */
@Getter
@EqualsAndHashCode
@ToString
public final class Payload {

    public enum Kind {
        TEXT,
        STRUCTURED,
        UNSET,
        UNSUPPORTED
    }

    private static final Payload UNSET = new Payload(Kind.UNSET, null);

    private final Kind kind;
    private final Object value;

    private Payload(Kind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    public static Payload of(Object data) {
        if (data == null) {
            return UNSET;
        }
        if (data instanceof String) {
            return new Payload(Kind.TEXT, data);
        }
        if (data instanceof Map) {
            return new Payload(Kind.STRUCTURED, data);
        }
        if (isScalarOrSequence(data)) {
            return new Payload(Kind.UNSUPPORTED, data);
        }
        return new Payload(Kind.STRUCTURED, data);
    }

    public String getText() {
        if (kind != Kind.TEXT) {
            throw new IllegalStateException("Payload is " + kind + ", not TEXT");
        }
        return (String) value;
    }

    private static boolean isScalarOrSequence(Object data) {
        return data instanceof Number
                || data instanceof Boolean
                || data instanceof Character
                || data instanceof CharSequence
                || data instanceof Collection
                || data instanceof Enum
                || data instanceof TemporalAccessor
                || data.getClass().isArray();
    }
}
