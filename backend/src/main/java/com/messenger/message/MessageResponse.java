package com.messenger.message;

import java.time.Instant;
import java.util.UUID;

public record MessageResponse(
        UUID id,
        UUID conversationId,
        long senderId,
        long receiverId,
        String content,
        Instant createdAt
) {

    public static MessageResponse from(Message message) {
        return new MessageResponse(
                message.id(),
                message.conversationId(),
                message.senderId(),
                message.receiverId(),
                message.content(),
                message.createdAt());
    }
}
