package com.messenger.directory;

import java.time.Instant;
import java.util.UUID;

public record ConversationListEntry(
        long ownerUserId,
        UUID conversationId,
        long otherUserId,
        Instant lastMessageAt,
        String lastMessageContent
) {}
