package com.messenger.conversation;

import java.time.Instant;
import java.util.UUID;

import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKey;
import org.springframework.data.cassandra.core.mapping.Table;

/**
 * One row per conversation. {@code user1_id} is always the lower participant id.
 *
 * {@code last_message_at} starts at the epoch rather than null: a conditional
 * {@code IF last_message_at < ?} never applies against a null column.
 */
@Table("conversations")
public class ConversationEntity {

    @PrimaryKey("conversation_id")
    private UUID conversationId;

    @Column("user1_id")
    private long user1Id;

    @Column("user2_id")
    private long user2Id;

    @Column("created_at")
    private Instant createdAt;

    @Column("last_message_at")
    private Instant lastMessageAt;

    @Column("last_message_id")
    private UUID lastMessageId;

    @Column("last_message_content")
    private String lastMessageContent;

    public ConversationEntity() {}

    public UUID getConversationId() { return conversationId; }
    public void setConversationId(UUID conversationId) { this.conversationId = conversationId; }
    public long getUser1Id() { return user1Id; }
    public void setUser1Id(long user1Id) { this.user1Id = user1Id; }
    public long getUser2Id() { return user2Id; }
    public void setUser2Id(long user2Id) { this.user2Id = user2Id; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Instant getLastMessageAt() { return lastMessageAt; }
    public void setLastMessageAt(Instant lastMessageAt) { this.lastMessageAt = lastMessageAt; }
    public UUID getLastMessageId() { return lastMessageId; }
    public void setLastMessageId(UUID lastMessageId) { this.lastMessageId = lastMessageId; }
    public String getLastMessageContent() { return lastMessageContent; }
    public void setLastMessageContent(String lastMessageContent) { this.lastMessageContent = lastMessageContent; }
}
