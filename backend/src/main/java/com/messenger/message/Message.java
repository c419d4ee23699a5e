package com.messenger.message;

import java.time.Instant;
import java.util.UUID;

/**
 * An immutable message. {@code id} is a TIMEUUID: sortable by creation time and unique even
 * for messages created in the same millisecond.
 */
public record Message(
        UUID id,
        UUID conversationId,
        Instant createdAt,
        long senderId,
        long receiverId,
        String content
) {}
