package com.example.chat.shared.model;

import com.example.chat.shared.exception.InvalidCursorException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Base64;

/**
 * Opaque continuation token for history reads. It encodes the (createdAt, id) key of
 * the last message on a page; the next page holds messages strictly older than it.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class HistoryCursor {

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final OffsetDateTime createdAt;
    private final long id;

    public HistoryCursor(OffsetDateTime createdAt, long id) {
        this.createdAt = createdAt.withOffsetSameInstant(ZoneOffset.UTC);
        this.id = id;
    }

    public static HistoryCursor after(ChatMessage message) {
        return new HistoryCursor(message.getCreatedAt(), message.getId());
    }

    public String encode() {
        Instant instant = createdAt.toInstant();
        String raw = instant.getEpochSecond() + "." + instant.getNano() + ":" + id;
        return ENCODER.encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * @return the decoded cursor, or null when {@code token} is null or blank
     * @throws InvalidCursorException if the token was not produced by {@link #encode()}
     */
    public static HistoryCursor decode(String token) {
        if (token == null || token.isBlank()) {
            return null;
        }
        try {
            String raw = new String(DECODER.decode(token.trim()), StandardCharsets.UTF_8);
            int colon = raw.indexOf(':');
            int dot = raw.indexOf('.');
            if (colon < 0 || dot < 0 || dot > colon) {
                throw new InvalidCursorException("Invalid history cursor");
            }
            long seconds = Long.parseLong(raw.substring(0, dot));
            int nanos = Integer.parseInt(raw.substring(dot + 1, colon));
            long id = Long.parseLong(raw.substring(colon + 1));
            if (nanos < 0 || nanos > 999_999_999 || id <= 0) {
                throw new InvalidCursorException("Invalid history cursor");
            }
            return new HistoryCursor(Instant.ofEpochSecond(seconds, nanos).atOffset(ZoneOffset.UTC), id);
        } catch (IllegalArgumentException | DateTimeException e) {
            // NumberFormatException, bad Base64 and out-of-range instants all land here
            throw new InvalidCursorException("Invalid history cursor");
        }
    }
}
