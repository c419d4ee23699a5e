package com.messenger.message;

import java.time.Instant;
import java.util.UUID;

import org.springframework.data.cassandra.repository.Query;
import org.springframework.data.cassandra.repository.ReactiveCassandraRepository;
import org.springframework.stereotype.Repository;

import reactor.core.publisher.Flux;

@Repository
public interface MessageRepository extends ReactiveCassandraRepository<MessageEntity, MessageKey> {

    @Query("SELECT * FROM messages WHERE conversation_id = ?0 LIMIT ?1")
    Flux<MessageEntity> findLatest(UUID conversationId, int limit);

    // Both clustering columns are DESC, so the tuple slice resumes exactly after the cursor.
    @Query("SELECT * FROM messages WHERE conversation_id = ?0 AND (created_at, message_id) < (?1, ?2) LIMIT ?3")
    Flux<MessageEntity> findAfterPosition(UUID conversationId, Instant createdAt, UUID messageId, int limit);

    @Query("SELECT * FROM messages WHERE conversation_id = ?0 AND created_at < ?1 LIMIT ?2")
    Flux<MessageEntity> findOlderThan(UUID conversationId, Instant before, int limit);
}
