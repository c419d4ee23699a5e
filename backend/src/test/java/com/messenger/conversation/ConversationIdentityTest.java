package com.messenger.conversation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

import org.junit.jupiter.api.Test;

class ConversationIdentityTest {

    private final ConversationIdentity identity = new ConversationIdentity();

    @Test
    void resolve_shouldBeIndependentOfArgumentOrder() {
        for (long a = 1; a <= 20; a++) {
            for (long b = 1; b <= 20; b++) {
                if (a != b) {
                    assertEquals(identity.resolve(a, b), identity.resolve(b, a));
                }
            }
        }
    }

    @Test
    void resolve_shouldOrderParticipantsLowThenHigh() {
        ConversationRef ref = identity.resolve(9, 5);

        assertEquals(5, ref.lowUserId());
        assertEquals(9, ref.highUserId());
        assertEquals(9, ref.otherParticipant(5));
        assertEquals(5, ref.otherParticipant(9));
        assertTrue(ref.involves(5));
    }

    @Test
    void resolve_shouldHandleNegativeAndLargeIds() {
        ConversationRef ref = identity.resolve(Long.MAX_VALUE, -3);

        assertEquals(-3, ref.lowUserId());
        assertEquals(Long.MAX_VALUE, ref.highUserId());
    }

    @Test
    void resolve_distinctPairs_shouldGetDistinctIds() {
        Set<UUID> ids = new HashSet<>();
        for (long a = 1; a <= 30; a++) {
            for (long b = a + 1; b <= 30; b++) {
                ids.add(identity.resolve(a, b).id());
            }
        }
        assertEquals(30 * 29 / 2, ids.size());
        assertNotEquals(identity.resolve(1, 23).id(), identity.resolve(12, 3).id());
    }

    @Test
    void resolve_sameUserTwice_shouldBeRejected() {
        assertThrows(InvalidParticipantsException.class, () -> identity.resolve(7, 7));
    }

    @Test
    void otherParticipant_forOutsider_shouldFail() {
        ConversationRef ref = identity.resolve(1, 2);

        assertThrows(IllegalArgumentException.class, () -> ref.otherParticipant(3));
    }
}
