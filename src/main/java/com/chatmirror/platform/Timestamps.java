package com.chatmirror.platform;

import com.chatmirror.projector.InvalidEventException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

public final class Timestamps {
    private static final Logger LOGGER = LoggerFactory.getLogger(Timestamps.class);

    private Timestamps() {
    }

    /**
     * Parses an RFC 3339 timestamp as sent by the platform APIs.
     *
     * @return null for a null or empty value
     * @throws InvalidEventException for a malformed value
     */
    public static Instant parse(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            throw new InvalidEventException("Malformed timestamp: " + value, e);
        }
    }

    /**
     * Like {@link #parse} but maps a malformed value to null, leaving the event without that timestamp.
     */
    public static Instant parseOrNull(String value, String field, String messageId) {
        try {
            return parse(value);
        } catch (InvalidEventException e) {
            LOGGER.warn("ignoring malformed {} on message {}: {}", field, messageId, value);
            return null;
        }
    }
}
