package com.messenger.conversation;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

import org.springframework.stereotype.Component;

/**
 * Maps an unordered pair of users to one stable conversation.
 *
 * <p>The id is a name-based UUID of {@code "low:high"}, so it is a pure function of the pair:
 * two first-contact sends racing from opposite directions compute the same id and meet on the
 * same catalog row instead of creating two conversations.
 */
@Component
public class ConversationIdentity {

    public ConversationRef resolve(long userA, long userB) {
        if (userA == userB) {
            throw new InvalidParticipantsException(userA);
        }
        long low = Math.min(userA, userB);
        long high = Math.max(userA, userB);
        UUID id = UUID.nameUUIDFromBytes((low + ":" + high).getBytes(StandardCharsets.UTF_8));
        return new ConversationRef(id, low, high);
    }
}
