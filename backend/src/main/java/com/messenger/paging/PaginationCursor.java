package com.messenger.paging;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.Base64;
import java.util.UUID;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.messenger.config.MessengerProperties;

/**
 * Opaque, signed pagination token for a (timestamp, tie-break id) sort position.
 *
 * <p>Layout: {@code base64url(epochMillis ":" uuid) "." base64url(HMAC-SHA256)}. The MAC keeps
 * callers from crafting positions of their own; a token that fails verification is rejected
 * rather than silently restarting the scan.
 */
@Component
public class PaginationCursor {

    private static final String ALGORITHM = "HmacSHA256";
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final SecretKeySpec key;

    @Autowired
    public PaginationCursor(MessengerProperties properties) {
        this(properties.getCursor().getSecret());
    }

    PaginationCursor(String secret) {
        this.key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM);
    }

    /** Last-seen sort position: timestamp first, id breaks ties. */
    public record Position(Instant timestamp, UUID tieBreak) {}

    public String encode(Instant timestamp, UUID tieBreak) {
        byte[] payload = (timestamp.toEpochMilli() + ":" + tieBreak).getBytes(StandardCharsets.UTF_8);
        return ENCODER.encodeToString(payload) + "." + ENCODER.encodeToString(sign(payload));
    }

    /** Decodes a token, or returns null for a missing/blank one (start of the scan). */
    public Position decode(String token) {
        if (token == null || token.isBlank()) {
            return null;
        }
        int dot = token.indexOf('.');
        if (dot <= 0 || dot == token.length() - 1) {
            throw new InvalidCursorException("Malformed cursor");
        }
        byte[] payload;
        byte[] mac;
        try {
            payload = DECODER.decode(token.substring(0, dot));
            mac = DECODER.decode(token.substring(dot + 1));
        } catch (IllegalArgumentException e) {
            throw new InvalidCursorException("Malformed cursor", e);
        }
        if (!MessageDigest.isEqual(sign(payload), mac)) {
            throw new InvalidCursorException("Cursor signature mismatch");
        }

        String text = new String(payload, StandardCharsets.UTF_8);
        int colon = text.indexOf(':');
        try {
            return new Position(
                    Instant.ofEpochMilli(Long.parseLong(text.substring(0, colon))),
                    UUID.fromString(text.substring(colon + 1)));
        } catch (RuntimeException e) {
            throw new InvalidCursorException("Malformed cursor", e);
        }
    }

    private byte[] sign(byte[] payload) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            return mac.doFinal(payload);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }
}
