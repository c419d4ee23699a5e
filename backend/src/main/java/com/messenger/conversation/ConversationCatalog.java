package com.messenger.conversation;

import java.time.Instant;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.cassandra.core.ReactiveCassandraOperations;
import org.springframework.data.cassandra.core.cql.ReactiveCqlOperations;
import org.springframework.stereotype.Service;

import com.datastax.oss.driver.api.core.cql.SimpleStatement;
import com.messenger.message.MessagePosition;
import com.messenger.storage.TransientStorageException;

import reactor.core.publisher.Mono;

/**
 * Source of truth for conversation metadata (table {@code conversations}).
 *
 * <p>Both writes are lightweight transactions on the single conversation partition:
 * <ul>
 *   <li>{@link #createIfAbsent} inserts {@code IF NOT EXISTS}; a caller that loses the race
 *       re-reads the winner's row.</li>
 *   <li>{@link #updateLastMessage} applies {@code IF last_message_at < ?}, so the preview only
 *       ever moves forward in time regardless of the order fan-out writes complete in. Messages
 *       from the same millisecond are ordered by id with a compare-and-set on the stored
 *       position, matching the order {@code ConversationDirectory} uses.</li>
 * </ul>
 */
@Service
public class ConversationCatalog {

    private static final Logger log = LoggerFactory.getLogger(ConversationCatalog.class);

    static final String INSERT_IF_ABSENT_CQL =
            "INSERT INTO conversations (conversation_id, user1_id, user2_id, created_at, last_message_at, last_message_content) "
                    + "VALUES (?, ?, ?, ?, ?, ?) IF NOT EXISTS";

    static final String UPDATE_IF_NEWER_CQL =
            "UPDATE conversations SET last_message_at = ?, last_message_id = ?, last_message_content = ? "
                    + "WHERE conversation_id = ? IF last_message_at < ?";

    static final String UPDATE_IF_UNCHANGED_CQL =
            "UPDATE conversations SET last_message_at = ?, last_message_id = ?, last_message_content = ? "
                    + "WHERE conversation_id = ? IF last_message_at = ? AND last_message_id = ?";

    private final ConversationRepository repository;
    private final ReactiveCqlOperations cql;

    public ConversationCatalog(ConversationRepository repository, ReactiveCassandraOperations operations) {
        this.repository = repository;
        this.cql = operations.getReactiveCqlOperations();
    }

    public Mono<Conversation> get(UUID conversationId) {
        return find(conversationId)
                .switchIfEmpty(Mono.error(() -> new ConversationNotFoundException(conversationId)));
    }

    /** Empty when the conversation does not exist. */
    public Mono<Conversation> find(UUID conversationId) {
        return repository.findById(conversationId).map(ConversationCatalog::toConversation);
    }

    /**
     * Idempotent: returns the existing row when present, otherwise allocates it.
     * Concurrent callers all observe the single row that won the conditional insert.
     */
    public Mono<Conversation> createIfAbsent(ConversationRef ref, Instant createdAt) {
        return find(ref.id())
                .switchIfEmpty(Mono.defer(() -> insertIfAbsent(ref, createdAt)));
    }

    private Mono<Conversation> insertIfAbsent(ConversationRef ref, Instant createdAt) {
        SimpleStatement insert = SimpleStatement.newInstance(INSERT_IF_ABSENT_CQL,
                ref.id(), ref.lowUserId(), ref.highUserId(), createdAt, Instant.EPOCH, null);

        return cql.execute(insert).flatMap(applied -> {
            if (applied) {
                log.info("Created conversation {} between {} and {}", ref.id(), ref.lowUserId(), ref.highUserId());
                return Mono.just(new Conversation(ref.id(), ref.lowUserId(), ref.highUserId(),
                        createdAt, Instant.EPOCH, null));
            }
            log.debug("Lost creation race for conversation {}, reusing existing row", ref.id());
            return find(ref.id())
                    .switchIfEmpty(Mono.error(() -> new TransientStorageException(
                            "Conversation " + ref.id() + " exists but is not readable yet")));
        });
    }

    /**
     * Moves the last-message snapshot forward. Emits {@code false} when the stored snapshot is
     * already at or after {@code (timestamp, messageId)}: a newer write has landed and this one is
     * discarded. Fails with {@link TransientStorageException} when a same-millisecond write
     * changes the row between the read and the conditional update.
     */
    public Mono<Boolean> updateLastMessage(UUID conversationId, Instant timestamp, UUID messageId, String content) {
        SimpleStatement update = SimpleStatement.newInstance(UPDATE_IF_NEWER_CQL,
                timestamp, messageId, content, conversationId, timestamp);

        return cql.execute(update).flatMap(applied -> applied
                ? Mono.just(true)
                : breakTie(conversationId, new MessagePosition(timestamp, messageId), content));
    }

    private Mono<Boolean> breakTie(UUID conversationId, MessagePosition incoming, String content) {
        return repository.findById(conversationId)
                .flatMap(stored -> {
                    MessagePosition current = new MessagePosition(stored.getLastMessageAt(), stored.getLastMessageId());
                    if (!incoming.isAfter(current)) {
                        log.debug("Ignored stale last-message update for {} at {}", conversationId, incoming.createdAt());
                        return Mono.just(false);
                    }
                    SimpleStatement update = SimpleStatement.newInstance(UPDATE_IF_UNCHANGED_CQL,
                            incoming.createdAt(), incoming.messageId(), content, conversationId,
                            current.createdAt(), current.messageId());
                    return cql.execute(update).flatMap(applied -> applied
                            ? Mono.just(true)
                            : Mono.error(new TransientStorageException(
                                    "Last message of conversation " + conversationId + " changed concurrently")));
                })
                .defaultIfEmpty(false);
    }

    static Conversation toConversation(ConversationEntity entity) {
        return new Conversation(
                entity.getConversationId(),
                entity.getUser1Id(),
                entity.getUser2Id(),
                entity.getCreatedAt(),
                entity.getLastMessageAt(),
                entity.getLastMessageContent());
    }
}
