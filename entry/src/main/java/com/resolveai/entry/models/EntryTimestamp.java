package com.resolveai.entry.models;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Objects;

/**
 * The {@code EntryTimestamp} class holds the timestamp of a log entry in whichever of the three accepted forms the
 * caller supplied: a wall-clock {@link Instant}, an RFC3339 "Zulu" string, or a wire {@link Timestamp} pair. Exactly
 * one of the accessors returns a value, as reported by {@link #getKind()}.
 */
@Getter
@EqualsAndHashCode
@ToString
@JsonSerialize(using = EntryTimestampSerializer.class)
@JsonDeserialize(using = EntryTimestampDeserializer.class)
public final class EntryTimestamp {

    public enum Kind {
        WALL_CLOCK,
        RFC3339,
        SECONDS_NANOS
    }

    private final Kind kind;
    private final Instant instant;
    private final String text;
    private final Timestamp pair;

    private EntryTimestamp(Kind kind, Instant instant, String text, Timestamp pair) {
        this.kind = kind;
        this.instant = instant;
        this.text = text;
        this.pair = pair;
    }

    public static EntryTimestamp of(Instant instant) {
        return new EntryTimestamp(Kind.WALL_CLOCK, Objects.requireNonNull(instant, "instant"), null, null);
    }

    public static EntryTimestamp of(String rfc3339) {
        return new EntryTimestamp(Kind.RFC3339, null, Objects.requireNonNull(rfc3339, "rfc3339"), null);
    }

    public static EntryTimestamp of(Timestamp pair) {
        Objects.requireNonNull(pair, "pair");
        return new EntryTimestamp(Kind.SECONDS_NANOS, null, null, new Timestamp(pair.getSeconds(), pair.getNanos()));
    }

    public static EntryTimestamp of(long seconds, int nanos) {
        return new EntryTimestamp(Kind.SECONDS_NANOS, null, null, new Timestamp(seconds, nanos));
    }

    public static EntryTimestamp ofEpochMilli(long epochMilli) {
        return of(Instant.ofEpochMilli(epochMilli));
    }
}
