package com.resolveai.entry.services;

import com.resolveai.entry.models.EntryTimestamp;
import com.resolveai.entry.models.Timestamp;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Conversions between the accepted timestamp forms and the wire seconds/nanos pair.
 */
@Slf4j
public final class Timestamps {

    private static final Pattern SECOND_BOUNDARY = Pattern.compile("[.,Z]");
    private static final Pattern FRACTION =
            Pattern.compile("^\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}[.,](\\d{0,9})Z$");
    private static final int NANO_DIGITS = 9;

    private Timestamps() {
    }

    public static Timestamp normalize(EntryTimestamp timestamp) {
        switch (timestamp.getKind()) {
            case WALL_CLOCK:
                return fromInstant(timestamp.getInstant());
            case RFC3339:
                return fromRfc3339(timestamp.getText());
            case SECONDS_NANOS:
                return new Timestamp(timestamp.getPair().getSeconds(), timestamp.getPair().getNanos());
            default:
                throw new IllegalStateException("Unhandled timestamp kind: " + timestamp.getKind());
        }
    }

    public static Timestamp fromInstant(Instant instant) {
        return new Timestamp(instant.getEpochSecond(), instant.getNano());
    }

    /**
     * Parses an RFC3339 "Zulu" string such as {@code 2020-01-01T00:00:00.123456789Z}. The whole seconds and the
     * fraction are read separately so all nine fraction digits survive. An unreadable seconds part yields
     * {@code 0}, as does a missing fraction.
     */
    public static Timestamp fromRfc3339(String zulu) {
        long seconds = 0;
        String wholeSeconds = SECOND_BOUNDARY.split(zulu, 2)[0] + "Z";
        try {
            seconds = Instant.parse(wholeSeconds).getEpochSecond();
        } catch (DateTimeParseException e) {
            log.warn("TIMESTAMP_UNPARSEABLE | value={} | error={}", zulu, e.getMessage());
        }

        int nanos = 0;
        Matcher fraction = FRACTION.matcher(zulu);
        if (fraction.matches() && !fraction.group(1).isEmpty()) {
            StringBuilder digits = new StringBuilder(fraction.group(1));
            while (digits.length() < NANO_DIGITS) {
                digits.append('0');
            }
            nanos = Integer.parseInt(digits.toString());
        }
        return new Timestamp(seconds, nanos);
    }

    public static Instant toInstant(Timestamp timestamp) {
        return Instant.ofEpochSecond(timestamp.getSeconds(), timestamp.getNanos());
    }
}
