package com.messenger.conversation;

import java.util.UUID;

import org.springframework.data.cassandra.repository.ReactiveCassandraRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ConversationRepository extends ReactiveCassandraRepository<ConversationEntity, UUID> {
    // Conditional writes live in ConversationCatalog; plain lookups come from here.
}
