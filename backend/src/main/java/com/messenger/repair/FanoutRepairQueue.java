package com.messenger.repair;

import java.time.Clock;
import java.util.UUID;

import org.springframework.stereotype.Service;

import com.messenger.config.MessengerProperties;
import com.messenger.message.Message;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Durable hand-off for fan-out steps that did not complete in line with the send.
 *
 * Rows are spread over {@code messenger.repair.buckets} partitions. Enqueueing the same message
 * twice (several steps failed) overwrites one row.
 */
@Service
public class FanoutRepairQueue {

    private final PendingFanoutRepository repository;
    private final Clock clock;
    private final MessengerProperties.Repair settings;

    public FanoutRepairQueue(PendingFanoutRepository repository, Clock clock, MessengerProperties properties) {
        this.repository = repository;
        this.clock = clock;
        this.settings = properties.getRepair();
    }

    public Mono<Void> enqueue(Message message) {
        PendingFanoutEntity entity = new PendingFanoutEntity();
        entity.setKey(keyOf(message));
        entity.setCreatedAt(message.createdAt());
        entity.setSenderId(message.senderId());
        entity.setReceiverId(message.receiverId());
        entity.setContent(message.content());
        entity.setEnqueuedAt(clock.instant());
        return repository.save(entity).then();
    }

    public Flux<Message> pending(int bucket) {
        return repository.findBatch(bucket, settings.getBatchSize())
                .map(entity -> new Message(
                        entity.getKey().messageId(),
                        entity.getKey().conversationId(),
                        entity.getCreatedAt(),
                        entity.getSenderId(),
                        entity.getReceiverId(),
                        entity.getContent()));
    }

    public Mono<Void> complete(Message message) {
        return repository.deleteById(keyOf(message));
    }

    public int buckets() {
        return settings.getBuckets();
    }

    int bucketOf(UUID conversationId) {
        return Math.floorMod(conversationId.hashCode(), settings.getBuckets());
    }

    private PendingFanoutKey keyOf(Message message) {
        return new PendingFanoutKey(bucketOf(message.conversationId()), message.conversationId(), message.id());
    }
}
