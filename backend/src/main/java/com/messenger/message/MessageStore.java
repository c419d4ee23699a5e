package com.messenger.message;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

import org.springframework.stereotype.Service;

import com.datastax.oss.driver.api.core.uuid.Uuids;
import com.messenger.config.MessengerProperties;
import com.messenger.paging.Page;
import com.messenger.paging.PaginationCursor;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Append-only message log, one partition per conversation, newest first.
 */
@Service
public class MessageStore {

    private final MessageRepository repository;
    private final PaginationCursor cursors;
    private final MessengerProperties.Paging paging;

    public MessageStore(MessageRepository repository, PaginationCursor cursors, MessengerProperties properties) {
        this.repository = repository;
        this.cursors = cursors;
        this.paging = properties.getPaging();
    }

    /**
     * Writes a new message row. The id is generated once, before the insert, so resubscribing
     * to the returned Mono (a retry) rewrites the same row instead of duplicating the message.
     *
     * @param clientTimestamp creation time supplied by the caller, or null to use the id's time
     */
    public Mono<Message> append(UUID conversationId, long senderId, long receiverId,
                                String content, Instant clientTimestamp) {
        UUID id = Uuids.timeBased();
        Instant createdAt = clientTimestamp != null
                ? clientTimestamp.truncatedTo(ChronoUnit.MILLIS)
                : Instant.ofEpochMilli(Uuids.unixTimestamp(id));

        MessageEntity entity = new MessageEntity();
        entity.setKey(new MessageKey(conversationId, createdAt, id));
        entity.setSenderId(senderId);
        entity.setReceiverId(receiverId);
        entity.setContent(content);

        return repository.insert(entity).map(MessageStore::toMessage);
    }

    /**
     * Most-recent-first page of a conversation.
     *
     * @param cursor          resume strictly after this position; null for the newest page
     * @param beforeTimestamp keep only messages strictly older than this; null for no bound
     */
    public Mono<Page<Message>> listMessages(UUID conversationId, String cursor, Integer limit, Instant beforeTimestamp) {
        return Mono.defer(() -> {
            int size = paging.clamp(limit);
            PaginationCursor.Position position = cursors.decode(cursor);

            return select(conversationId, position, beforeTimestamp, size + 1)
                    .map(MessageStore::toMessage)
                    .collectList()
                    .map(rows -> Page.fromOverfetch(rows, size, m -> cursors.encode(m.createdAt(), m.id())));
        });
    }

    // With both bounds present the tighter one wins: a cursor at or after "before" is looser
    // than created_at < before.
    private Flux<MessageEntity> select(UUID conversationId, PaginationCursor.Position position,
                                      Instant before, int fetch) {
        if (position != null && (before == null || position.timestamp().isBefore(before))) {
            return repository.findAfterPosition(conversationId, position.timestamp(), position.tieBreak(), fetch);
        }
        if (before != null) {
            return repository.findOlderThan(conversationId, before, fetch);
        }
        return repository.findLatest(conversationId, fetch);
    }

    static Message toMessage(MessageEntity entity) {
        MessageKey key = entity.getKey();
        return new Message(
                key.messageId(),
                key.conversationId(),
                key.createdAt(),
                entity.getSenderId(),
                entity.getReceiverId(),
                entity.getContent());
    }
}
