package com.messenger.message;

import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKey;
import org.springframework.data.cassandra.core.mapping.Table;

@Table("messages")
public class MessageEntity {

    @PrimaryKey
    private MessageKey key;

    @Column("sender_id")
    private long senderId;

    @Column("receiver_id")
    private long receiverId;

    @Column("content")
    private String content;

    public MessageEntity() {}

    public MessageKey getKey() { return key; }
    public void setKey(MessageKey key) { this.key = key; }
    public long getSenderId() { return senderId; }
    public void setSenderId(long senderId) { this.senderId = senderId; }
    public long getReceiverId() { return receiverId; }
    public void setReceiverId(long receiverId) { this.receiverId = receiverId; }
    public String getContent() { return content; }
    public void setContent(String content) { this.content = content; }
}
