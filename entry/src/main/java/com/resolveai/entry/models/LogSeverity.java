package com.resolveai.entry.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;

/**
 * Enum class for LogSeverity. The levels include: DEFAULT, DEBUG, INFO, NOTICE, WARNING, ERROR, CRITICAL, ALERT,
 * EMERGENCY. Each level carries the numeric code used by the ingestion API; higher codes are more severe.
 */
@Slf4j
public enum LogSeverity {
    DEFAULT(0),
    DEBUG(100),
    INFO(200),
    NOTICE(300),
    WARNING(400),
    ERROR(500),
    CRITICAL(600),
    ALERT(700),
    EMERGENCY(800);

    private final int code;

    LogSeverity(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    @JsonValue
    public String toJson() {
        return name();
    }

    /**
     * Accepts either a level name (any case) or its numeric code. Unknown names and codes read as {@link #DEFAULT}.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static LogSeverity fromJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            if (value instanceof Number) {
                return fromCode(((Number) value).intValue());
            }
            String text = value.toString().trim();
            if (text.chars().allMatch(Character::isDigit) && !text.isEmpty()) {
                return fromCode(Integer.parseInt(text));
            }
            return LogSeverity.valueOf(text.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("SEVERITY_UNKNOWN | value={} | fallback={}", value, DEFAULT);
            return DEFAULT;
        }
    }

    public static LogSeverity fromCode(int code) {
        for (LogSeverity severity : values()) {
            if (severity.code == code) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown log severity code: " + code);
    }
}
