package com.messenger.conversation;

import java.time.Instant;
import java.util.UUID;

import com.messenger.directory.ConversationListEntry;

/** One line of a user's conversation list. */
public record ConversationSummary(
        UUID conversationId,
        long otherUserId,
        Instant lastMessageAt,
        String lastMessageContent
) {

    public static ConversationSummary from(ConversationListEntry entry) {
        return new ConversationSummary(
                entry.conversationId(),
                entry.otherUserId(),
                entry.lastMessageAt(),
                entry.lastMessageContent());
    }
}
