package com.messenger.message;

import java.time.Instant;
import java.util.Comparator;
import java.util.UUID;

/**
 * Where a message sits in "latest wins" order: creation time first, message id for messages
 * created in the same millisecond. A missing id sorts below every real one.
 */
public record MessagePosition(Instant createdAt, UUID messageId) implements Comparable<MessagePosition> {

    private static final Comparator<MessagePosition> ORDER = Comparator
            .comparing(MessagePosition::createdAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
            .thenComparing(MessagePosition::messageId, Comparator.nullsFirst(Comparator.<UUID>naturalOrder()));

    public static MessagePosition of(Message message) {
        return new MessagePosition(message.createdAt(), message.id());
    }

    public boolean isAfter(MessagePosition other) {
        return compareTo(other) > 0;
    }

    @Override
    public int compareTo(MessagePosition other) {
        return ORDER.compare(this, other);
    }
}
