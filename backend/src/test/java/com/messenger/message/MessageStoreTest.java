package com.messenger.message;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.datastax.oss.driver.api.core.uuid.Uuids;
import com.messenger.config.MessengerProperties;
import com.messenger.paging.InvalidCursorException;
import com.messenger.paging.PaginationCursor;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

@ExtendWith(MockitoExtension.class)
class MessageStoreTest {

    @Mock
    private MessageRepository repository;

    private final MessengerProperties properties = new MessengerProperties();
    private final PaginationCursor cursors = new PaginationCursor(properties);

    private MessageStore store;

    private final UUID conversationId = UUID.randomUUID();

    /** Messages at t=1..5 ms, index i holds t=i+1. */
    private final List<MessageEntity> history = new ArrayList<>();

    @BeforeEach
    void setup() {
        store = new MessageStore(repository, cursors, properties);
        for (long t = 1; t <= 5; t++) {
            history.add(buildEntity(t, "message " + t));
        }
    }

    // ── Helper ────────────────────────────────────────────────────────────────

    private MessageEntity buildEntity(long millis, String content) {
        MessageEntity entity = new MessageEntity();
        entity.setKey(new MessageKey(conversationId, Instant.ofEpochMilli(millis), Uuids.startOf(millis)));
        entity.setSenderId(5L);
        entity.setReceiverId(9L);
        entity.setContent(content);
        return entity;
    }

    private MessageEntity at(long millis) {
        return history.get((int) millis - 1);
    }

    // ── append ────────────────────────────────────────────────────────────────

    @Test
    void append_shouldDeriveTimestampFromTimeBasedId() {
        when(repository.insert(any(MessageEntity.class)))
                .thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));

        StepVerifier.create(store.append(conversationId, 5L, 9L, "hi", null))
                .assertNext(message -> {
                    assertEquals(1, message.id().version(), "message id must be a TIMEUUID");
                    assertEquals(Instant.ofEpochMilli(Uuids.unixTimestamp(message.id())), message.createdAt());
                    assertEquals(conversationId, message.conversationId());
                    assertEquals(5L, message.senderId());
                    assertEquals(9L, message.receiverId());
                    assertEquals("hi", message.content());
                })
                .verifyComplete();
    }

    @Test
    void append_withClientTimestamp_shouldKeepItAndStillGenerateUniqueId() {
        when(repository.insert(any(MessageEntity.class)))
                .thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));
        Instant clientTime = Instant.ofEpochMilli(100);

        Message first = store.append(conversationId, 5L, 9L, "a", clientTime).block();
        Message second = store.append(conversationId, 5L, 9L, "b", clientTime).block();

        assertNotNull(first);
        assertNotNull(second);
        assertEquals(clientTime, first.createdAt());
        assertEquals(clientTime, second.createdAt());
        assertNotEquals(first.id(), second.id());
    }

    // ── listMessages ──────────────────────────────────────────────────────────

    @Test
    void listMessages_shouldPageNewestFirstWithoutGaps() {
        when(repository.findLatest(conversationId, 3)).thenReturn(Flux.just(at(5), at(4), at(3)));

        Message[] lastOfFirstPage = new Message[1];
        String[] cursor = new String[1];
        StepVerifier.create(store.listMessages(conversationId, null, 2, null))
                .assertNext(page -> {
                    assertEquals(List.of("message 5", "message 4"),
                            page.items().stream().map(Message::content).toList());
                    assertNotNull(page.nextCursor());
                    lastOfFirstPage[0] = page.items().get(1);
                    cursor[0] = page.nextCursor();
                })
                .verifyComplete();

        when(repository.findAfterPosition(conversationId, lastOfFirstPage[0].createdAt(), lastOfFirstPage[0].id(), 3))
                .thenReturn(Flux.just(at(3), at(2), at(1)));

        StepVerifier.create(store.listMessages(conversationId, cursor[0], 2, null))
                .assertNext(page -> {
                    assertEquals(List.of("message 3", "message 2"),
                            page.items().stream().map(Message::content).toList());
                    assertNotNull(page.nextCursor());
                })
                .verifyComplete();
    }

    @Test
    void listMessages_lastPage_shouldHaveNoCursor() {
        when(repository.findLatest(conversationId, 3)).thenReturn(Flux.just(at(2), at(1)));

        StepVerifier.create(store.listMessages(conversationId, null, 2, null))
                .assertNext(page -> {
                    assertEquals(2, page.items().size());
                    assertNull(page.nextCursor());
                })
                .verifyComplete();
    }

    @Test
    void listMessages_beforeTimestamp_shouldLoadStrictlyOlderHistory() {
        Instant before = Instant.ofEpochMilli(3);
        when(repository.findOlderThan(conversationId, before, 21)).thenReturn(Flux.just(at(2), at(1)));

        StepVerifier.create(store.listMessages(conversationId, null, null, before))
                .assertNext(page -> assertEquals(List.of("message 2", "message 1"),
                        page.items().stream().map(Message::content).toList()))
                .verifyComplete();
    }

    @Test
    void listMessages_cursorOlderThanBefore_shouldResumeFromCursor() {
        MessageEntity position = at(2);
        String cursor = cursors.encode(position.getKey().createdAt(), position.getKey().messageId());
        when(repository.findAfterPosition(conversationId, position.getKey().createdAt(), position.getKey().messageId(), 11))
                .thenReturn(Flux.just(at(1)));

        StepVerifier.create(store.listMessages(conversationId, cursor, 10, Instant.ofEpochMilli(4)))
                .assertNext(page -> assertEquals(1, page.items().size()))
                .verifyComplete();
    }

    @Test
    void listMessages_cursorNewerThanBefore_shouldUseTimestampBound() {
        MessageEntity position = at(5);
        String cursor = cursors.encode(position.getKey().createdAt(), position.getKey().messageId());
        Instant before = Instant.ofEpochMilli(3);
        when(repository.findOlderThan(conversationId, before, 11)).thenReturn(Flux.just(at(2), at(1)));

        StepVerifier.create(store.listMessages(conversationId, cursor, 10, before))
                .assertNext(page -> assertEquals(2, page.items().size()))
                .verifyComplete();
    }

    @Test
    void listMessages_oversizedLimit_shouldBeClamped() {
        when(repository.findLatest(conversationId, 101)).thenReturn(Flux.empty());

        StepVerifier.create(store.listMessages(conversationId, null, 10_000, null))
                .assertNext(page -> assertEquals(0, page.items().size()))
                .verifyComplete();

        verify(repository).findLatest(conversationId, 101);
    }

    @Test
    void listMessages_tamperedCursor_shouldFail() {
        StepVerifier.create(store.listMessages(conversationId, "forged.cursor", 2, null))
                .expectError(InvalidCursorException.class)
                .verify();
    }
}
