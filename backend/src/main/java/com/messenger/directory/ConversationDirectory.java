package com.messenger.directory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.cassandra.core.ReactiveCassandraOperations;
import org.springframework.data.cassandra.core.cql.ReactiveCqlOperations;
import org.springframework.stereotype.Service;

import com.datastax.oss.driver.api.core.cql.SimpleStatement;
import com.messenger.config.MessengerProperties;
import com.messenger.message.MessagePosition;
import com.messenger.paging.Page;
import com.messenger.paging.PaginationCursor;
import com.messenger.storage.TransientStorageException;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Per-user conversation list, most recent first (table {@code conversations_by_user}).
 *
 * <p>Each participant owns a copy of the entry. An upsert writes the entry under its new
 * recency key and prunes the owner's older rows for the same conversation. Two upserts racing
 * on one conversation can leave an older row behind; reads skip it within a page and the
 * next upsert prunes it.
 *
 * <p>Entries are ordered like the catalog's preview, by {@link MessagePosition}. Messages from
 * the same millisecond share a row key, so that row is only ever written conditionally: inserted
 * {@code IF NOT EXISTS}, or replaced {@code IF} it still holds the message id that was read.
 */
@Service
public class ConversationDirectory {

    private static final Logger log = LoggerFactory.getLogger(ConversationDirectory.class);

    static final String INSERT_IF_ABSENT_CQL =
            "INSERT INTO conversations_by_user (user_id, last_message_at, conversation_id, other_user_id, last_message_id, last_message_content) "
                    + "VALUES (?, ?, ?, ?, ?, ?) IF NOT EXISTS";

    static final String REPLACE_IF_UNCHANGED_CQL =
            "UPDATE conversations_by_user SET last_message_id = ?, last_message_content = ? "
                    + "WHERE user_id = ? AND last_message_at = ? AND conversation_id = ? IF last_message_id = ?";

    private final ConversationByUserRepository repository;
    private final ReactiveCqlOperations cql;
    private final PaginationCursor cursors;
    private final MessengerProperties.Paging paging;

    public ConversationDirectory(ConversationByUserRepository repository,
                                 ReactiveCassandraOperations operations,
                                 PaginationCursor cursors,
                                 MessengerProperties properties) {
        this.repository = repository;
        this.cql = operations.getReactiveCqlOperations();
        this.cursors = cursors;
        this.paging = properties.getPaging();
    }

    /**
     * Rewrites {@code ownerUserId}'s entry for the conversation. Emits {@code false} without
     * writing when the owner already has an entry at or after {@code (timestamp, messageId)},
     * which also makes replaying an applied message a no-op. Fails with
     * {@link TransientStorageException} when a concurrent upsert wrote the same row first.
     */
    public Mono<Boolean> upsertEntry(long ownerUserId, UUID conversationId, long otherUserId,
                                     Instant timestamp, UUID messageId, String content) {
        MessagePosition incoming = new MessagePosition(timestamp, messageId);
        ConversationByUserKey key = new ConversationByUserKey(ownerUserId, timestamp, conversationId);

        return repository.findAllForConversation(ownerUserId, conversationId)
                .collectList()
                .flatMap(existing -> {
                    boolean superseded = existing.stream()
                            .anyMatch(row -> !incoming.isAfter(positionOf(row)));
                    if (superseded) {
                        log.debug("Ignored stale directory entry for user {} conversation {} at {}",
                                ownerUserId, conversationId, timestamp);
                        return Mono.just(false);
                    }

                    SimpleStatement write = existing.stream()
                            .filter(row -> row.getKey().equals(key))
                            .findFirst()
                            .map(tied -> SimpleStatement.newInstance(REPLACE_IF_UNCHANGED_CQL,
                                    messageId, content, ownerUserId, timestamp, conversationId, tied.getLastMessageId()))
                            .orElseGet(() -> SimpleStatement.newInstance(INSERT_IF_ABSENT_CQL,
                                    ownerUserId, timestamp, conversationId, otherUserId, messageId, content));

                    return cql.execute(write).flatMap(applied -> {
                        if (!applied) {
                            return Mono.error(new TransientStorageException("Directory entry of user " + ownerUserId
                                    + " for conversation " + conversationId + " changed concurrently"));
                        }
                        return Flux.fromIterable(existing)
                                .filter(old -> !old.getKey().equals(key))
                                .concatMap(old -> repository.deleteById(old.getKey()))
                                .then(Mono.just(true));
                    });
                });
    }

    public Mono<Page<ConversationListEntry>> listConversations(long userId, String cursor, Integer limit) {
        return Mono.defer(() -> {
            int size = paging.clamp(limit);
            // Orphans may be skipped below, so read past the page boundary.
            int fetch = size * 2 + 1;
            PaginationCursor.Position position = cursors.decode(cursor);

            Flux<ConversationByUserEntity> rows = position == null
                    ? repository.findLatest(userId, fetch)
                    : Flux.concat(
                            repository.findSameInstantAfter(userId, position.timestamp(), position.tieBreak(), fetch),
                            repository.findOlderThan(userId, position.timestamp(), fetch))
                      .take(fetch);

            return rows.collectList().map(scanned -> toPage(scanned, size, fetch));
        });
    }

    private Page<ConversationListEntry> toPage(List<ConversationByUserEntity> scanned, int size, int fetch) {
        List<ConversationListEntry> items = new ArrayList<>(size);
        Set<UUID> seen = new HashSet<>();
        ConversationByUserEntity last = null;
        int consumed = 0;

        for (ConversationByUserEntity row : scanned) {
            if (items.size() == size) {
                break;
            }
            consumed++;
            last = row;
            if (seen.add(row.getKey().conversationId())) {
                items.add(toEntry(row));
            }
        }

        boolean more = consumed < scanned.size() || scanned.size() >= fetch;
        String next = more && last != null
                ? cursors.encode(last.getKey().lastMessageAt(), last.getKey().conversationId())
                : null;
        return new Page<>(items, next);
    }

    private static MessagePosition positionOf(ConversationByUserEntity row) {
        return new MessagePosition(row.getKey().lastMessageAt(), row.getLastMessageId());
    }

    private static ConversationListEntry toEntry(ConversationByUserEntity row) {
        return new ConversationListEntry(
                row.getKey().userId(),
                row.getKey().conversationId(),
                row.getOtherUserId(),
                row.getKey().lastMessageAt(),
                row.getLastMessageContent());
    }
}
