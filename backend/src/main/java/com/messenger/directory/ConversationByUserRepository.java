package com.messenger.directory;

import java.time.Instant;
import java.util.UUID;

import org.springframework.data.cassandra.repository.Query;
import org.springframework.data.cassandra.repository.ReactiveCassandraRepository;
import org.springframework.stereotype.Repository;

import reactor.core.publisher.Flux;

@Repository
public interface ConversationByUserRepository extends ReactiveCassandraRepository<ConversationByUserEntity, ConversationByUserKey> {

    @Query("SELECT * FROM conversations_by_user WHERE user_id = ?0 LIMIT ?1")
    Flux<ConversationByUserEntity> findLatest(long userId, int limit);

    // Rows sharing the cursor's timestamp sort by conversation_id ASC, so resume above it.
    @Query("SELECT * FROM conversations_by_user WHERE user_id = ?0 AND last_message_at = ?1 AND conversation_id > ?2 LIMIT ?3")
    Flux<ConversationByUserEntity> findSameInstantAfter(long userId, Instant lastMessageAt, UUID conversationId, int limit);

    @Query("SELECT * FROM conversations_by_user WHERE user_id = ?0 AND last_message_at < ?1 LIMIT ?2")
    Flux<ConversationByUserEntity> findOlderThan(long userId, Instant lastMessageAt, int limit);

    // Filtering stays inside the single user_id partition.
    @Query("SELECT * FROM conversations_by_user WHERE user_id = ?0 AND conversation_id = ?1 ALLOW FILTERING")
    Flux<ConversationByUserEntity> findAllForConversation(long userId, UUID conversationId);
}
