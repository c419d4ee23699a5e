package com.messenger.conversation;

import java.time.Instant;
import java.util.UUID;

/**
 * Catalog view of a conversation, including the cached preview of its latest message.
 */
public record Conversation(
        UUID id,
        long lowUserId,
        long highUserId,
        Instant createdAt,
        Instant lastMessageAt,
        String lastMessageContent
) {

    /** False until the first message's snapshot lands (the stored timestamp is still the epoch). */
    public boolean hasLastMessage() {
        return lastMessageAt != null && lastMessageAt.isAfter(Instant.EPOCH);
    }

    public ConversationRef ref() {
        return new ConversationRef(id, lowUserId, highUserId);
    }
}
