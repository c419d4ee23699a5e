package com.messenger.conversation;

import java.time.Instant;
import java.util.UUID;

/**
 * {@code lastMessageAt}/{@code lastMessageContent} are null until the first message lands.
 */
public record ConversationResponse(
        UUID id,
        long user1Id,
        long user2Id,
        Instant createdAt,
        Instant lastMessageAt,
        String lastMessageContent
) {

    public static ConversationResponse from(Conversation conversation) {
        boolean hasPreview = conversation.hasLastMessage();
        return new ConversationResponse(
                conversation.id(),
                conversation.lowUserId(),
                conversation.highUserId(),
                conversation.createdAt(),
                hasPreview ? conversation.lastMessageAt() : null,
                hasPreview ? conversation.lastMessageContent() : null);
    }
}
