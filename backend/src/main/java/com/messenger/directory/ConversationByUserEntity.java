package com.messenger.directory;

import java.util.UUID;

import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKey;
import org.springframework.data.cassandra.core.mapping.Table;

/**
 * A user's view of one conversation. The recency timestamp is part of the key, so every
 * newer message re-keys the row instead of updating it in place.
 */
@Table("conversations_by_user")
public class ConversationByUserEntity {

    @PrimaryKey
    private ConversationByUserKey key;

    @Column("other_user_id")
    private long otherUserId;

    @Column("last_message_id")
    private UUID lastMessageId;

    @Column("last_message_content")
    private String lastMessageContent;

    public ConversationByUserEntity() {}

    public ConversationByUserKey getKey() { return key; }
    public void setKey(ConversationByUserKey key) { this.key = key; }
    public long getOtherUserId() { return otherUserId; }
    public void setOtherUserId(long otherUserId) { this.otherUserId = otherUserId; }
    public UUID getLastMessageId() { return lastMessageId; }
    public void setLastMessageId(UUID lastMessageId) { this.lastMessageId = lastMessageId; }
    public String getLastMessageContent() { return lastMessageContent; }
    public void setLastMessageContent(String lastMessageContent) { this.lastMessageContent = lastMessageContent; }
}
