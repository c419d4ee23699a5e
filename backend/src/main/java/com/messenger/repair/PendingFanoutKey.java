package com.messenger.repair;

import java.io.Serializable;
import java.util.UUID;

import org.springframework.data.cassandra.core.cql.PrimaryKeyType;
import org.springframework.data.cassandra.core.mapping.PrimaryKeyClass;
import org.springframework.data.cassandra.core.mapping.PrimaryKeyColumn;

@PrimaryKeyClass
public record PendingFanoutKey(
    @PrimaryKeyColumn(name = "bucket", ordinal = 0, type = PrimaryKeyType.PARTITIONED)
    int bucket,

    @PrimaryKeyColumn(name = "conversation_id", ordinal = 1, type = PrimaryKeyType.CLUSTERED)
    UUID conversationId,

    @PrimaryKeyColumn(name = "message_id", ordinal = 2, type = PrimaryKeyType.CLUSTERED)
    UUID messageId
) implements Serializable {}
