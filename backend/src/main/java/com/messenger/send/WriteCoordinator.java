package com.messenger.send;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.messenger.config.MessengerProperties;
import com.messenger.conversation.ConversationCatalog;
import com.messenger.conversation.ConversationIdentity;
import com.messenger.conversation.ConversationRef;
import com.messenger.directory.ConversationDirectory;
import com.messenger.message.Message;
import com.messenger.message.MessageStore;
import com.messenger.repair.FanoutRepairQueue;
import com.messenger.storage.StorageRetry;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Runs a send as a saga over three independently partitioned tables.
 *
 * <ol>
 *   <li>Resolve the conversation and make sure its catalog row exists.</li>
 *   <li>Append the message. This is the durability point: once it succeeds the send succeeds.</li>
 *   <li>Move the catalog's last-message snapshot forward.</li>
 *   <li>Upsert the directory entry of both participants.</li>
 * </ol>
 *
 * Steps 3 and 4 are guarded by (timestamp, message id) comparison, so they are idempotent and may complete in
 * any order. Each one is retried on its own; a step that still fails is handed to
 * {@link FanoutRepairQueue} instead of failing the send. Cancelling the returned Mono after step 2
 * only stops those retries, the message stays stored.
 */
@Service
public class WriteCoordinator {

    private static final Logger log = LoggerFactory.getLogger(WriteCoordinator.class);

    private final ConversationIdentity identity;
    private final ConversationCatalog catalog;
    private final MessageStore messages;
    private final ConversationDirectory directory;
    private final FanoutRepairQueue repairQueue;
    private final StorageRetry retry;
    private final Clock clock;
    private final Duration fanoutTimeout;

    public WriteCoordinator(ConversationIdentity identity,
                            ConversationCatalog catalog,
                            MessageStore messages,
                            ConversationDirectory directory,
                            FanoutRepairQueue repairQueue,
                            StorageRetry retry,
                            Clock clock,
                            MessengerProperties properties) {
        this.identity = identity;
        this.catalog = catalog;
        this.messages = messages;
        this.directory = directory;
        this.repairQueue = repairQueue;
        this.retry = retry;
        this.clock = clock;
        this.fanoutTimeout = properties.getFanout().getTimeout();
    }

    public Mono<SendResult> sendMessage(long senderId, long receiverId, String content) {
        return sendMessage(senderId, receiverId, content, null);
    }

    public Mono<SendResult> sendMessage(long senderId, long receiverId, String content, Instant clientTimestamp) {
        return Mono.fromCallable(() -> identity.resolve(senderId, receiverId))
                .flatMap(ref -> store(ref, senderId, receiverId, content, clientTimestamp)
                        .flatMap(message -> fanOut(ref, message)
                                .thenReturn(new SendResult(message, ref.id()))));
    }

    /**
     * Re-applies steps 3 and 4 for a message that is already stored. Errors propagate so the
     * caller can keep the message queued for another attempt.
     */
    public Mono<Void> replayFanout(Message message) {
        return Mono.fromCallable(() -> identity.resolve(message.senderId(), message.receiverId()))
                .flatMapMany(ref -> Flux.fromIterable(steps(ref, message)))
                .flatMap(this::guarded)
                .then();
    }

    private Mono<Message> store(ConversationRef ref, long senderId, long receiverId,
                                String content, Instant clientTimestamp) {
        return catalog.createIfAbsent(ref, clock.instant())
                .retryWhen(retry.transientFailures("create conversation"))
                // append() fixes the message id up front; retries resubscribe to the same insert
                .then(Mono.defer(() -> messages.append(ref.id(), senderId, receiverId, content, clientTimestamp)
                        .retryWhen(retry.transientFailures("append message"))))
                .onErrorMap(error -> {
                    log.error("Send from {} to {} failed before the message was stored", senderId, receiverId, error);
                    return new SendFailedException(senderId, receiverId, error);
                });
    }

    private Mono<Void> fanOut(ConversationRef ref, Message message) {
        return Flux.fromIterable(steps(ref, message))
                .flatMap(step -> guarded(step)
                        .onErrorResume(error -> handOff(step.name(), message, error)))
                .then();
    }

    private Mono<Boolean> guarded(FanoutStep step) {
        return step.write()
                .retryWhen(retry.transientFailures(step.name()))
                .timeout(fanoutTimeout);
    }

    private Mono<Boolean> handOff(String step, Message message, Throwable error) {
        log.warn("Fan-out step '{}' for message {} in conversation {} failed, scheduling repair: {}",
                step, message.id(), message.conversationId(), error.toString());
        return repairQueue.enqueue(message)
                .doOnError(enqueueError -> log.error(
                        "Could not schedule repair for message {} in conversation {}; catalog/directory may stay stale",
                        message.id(), message.conversationId(), enqueueError))
                .onErrorResume(enqueueError -> Mono.empty())
                .thenReturn(false);
    }

    private List<FanoutStep> steps(ConversationRef ref, Message message) {
        long sender = message.senderId();
        long receiver = message.receiverId();
        return List.of(
                new FanoutStep("catalog",
                        Mono.defer(() -> catalog.updateLastMessage(ref.id(),
                                message.createdAt(), message.id(), message.content()))),
                new FanoutStep("directory:" + sender,
                        Mono.defer(() -> directory.upsertEntry(sender, ref.id(), receiver,
                                message.createdAt(), message.id(), message.content()))),
                new FanoutStep("directory:" + receiver,
                        Mono.defer(() -> directory.upsertEntry(receiver, ref.id(), sender,
                                message.createdAt(), message.id(), message.content()))));
    }

    private record FanoutStep(String name, Mono<Boolean> write) {}
}
