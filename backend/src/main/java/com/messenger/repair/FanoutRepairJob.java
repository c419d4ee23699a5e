package com.messenger.repair;

import jakarta.annotation.PreDestroy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import com.messenger.config.MessengerProperties;
import com.messenger.message.Message;
import com.messenger.send.WriteCoordinator;

import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Background reconciliation: replays the catalog/directory fan-out of queued messages.
 *
 * <p>Every replica may run this job at the same time. Replayed steps are idempotent and
 * timestamp-guarded, so a message repaired twice ends in the same state.
 */
@Component
public class FanoutRepairJob {

    private static final Logger log = LoggerFactory.getLogger(FanoutRepairJob.class);

    private final FanoutRepairQueue queue;
    private final WriteCoordinator coordinator;
    private final MessengerProperties.Repair settings;

    private volatile Disposable schedule;

    public FanoutRepairJob(FanoutRepairQueue queue, WriteCoordinator coordinator, MessengerProperties properties) {
        this.queue = queue;
        this.coordinator = coordinator;
        this.settings = properties.getRepair();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!settings.isEnabled()) {
            log.info("Fan-out repair job disabled");
            return;
        }
        log.info("Starting fan-out repair job every {}", settings.getInterval());
        schedule = Flux.interval(settings.getInterval())
                .onBackpressureDrop()
                .concatMap(tick -> runOnce()
                        .onErrorResume(error -> {
                            log.warn("Fan-out repair pass aborted: {}", error.toString());
                            return Mono.just(0);
                        }))
                .subscribe(repaired -> {
                    if (repaired > 0) {
                        log.info("Repaired fan-out for {} message(s)", repaired);
                    }
                });
    }

    @PreDestroy
    public void stop() {
        Disposable current = schedule;
        if (current != null) {
            current.dispose();
        }
    }

    /** One pass over every bucket. Emits the number of messages whose fan-out was completed. */
    public Mono<Integer> runOnce() {
        return Flux.range(0, queue.buckets())
                .concatMap(queue::pending)
                .concatMap(this::repair)
                .reduce(0, Integer::sum);
    }

    private Mono<Integer> repair(Message message) {
        return coordinator.replayFanout(message)
                .then(Mono.defer(() -> queue.complete(message)))
                .thenReturn(1)
                .onErrorResume(error -> {
                    log.warn("Fan-out repair for message {} failed, keeping it queued: {}",
                            message.id(), error.toString());
                    return Mono.just(0);
                });
    }
}
