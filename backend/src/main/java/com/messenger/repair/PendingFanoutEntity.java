package com.messenger.repair;

import java.time.Instant;

import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKey;
import org.springframework.data.cassandra.core.mapping.Table;

/**
 * A stored message whose catalog/directory fan-out did not finish. Carries everything needed to
 * replay the fan-out without reading the message back.
 */
@Table("pending_fanout")
public class PendingFanoutEntity {

    @PrimaryKey
    private PendingFanoutKey key;

    @Column("created_at")
    private Instant createdAt;

    @Column("sender_id")
    private long senderId;

    @Column("receiver_id")
    private long receiverId;

    @Column("content")
    private String content;

    @Column("enqueued_at")
    private Instant enqueuedAt;

    public PendingFanoutEntity() {}

    public PendingFanoutKey getKey() { return key; }
    public void setKey(PendingFanoutKey key) { this.key = key; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public long getSenderId() { return senderId; }
    public void setSenderId(long senderId) { this.senderId = senderId; }
    public long getReceiverId() { return receiverId; }
    public void setReceiverId(long receiverId) { this.receiverId = receiverId; }
    public String getContent() { return content; }
    public void setContent(String content) { this.content = content; }
    public Instant getEnqueuedAt() { return enqueuedAt; }
    public void setEnqueuedAt(Instant enqueuedAt) { this.enqueuedAt = enqueuedAt; }
}
