package com.messenger.conversation;

import java.util.UUID;

/**
 * Canonical identity of a two-party conversation. {@code lowUserId < highUserId} always holds,
 * whichever participant initiated it.
 */
public record ConversationRef(UUID id, long lowUserId, long highUserId) {

    public boolean involves(long userId) {
        return userId == lowUserId || userId == highUserId;
    }

    public long otherParticipant(long userId) {
        if (userId == lowUserId) {
            return highUserId;
        }
        if (userId == highUserId) {
            return lowUserId;
        }
        throw new IllegalArgumentException("User " + userId + " is not part of conversation " + id);
    }
}
