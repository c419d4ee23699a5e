package com.messenger.message;

import java.time.Instant;
import java.util.UUID;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import com.messenger.send.WriteCoordinator;

import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/messages")
public class MessageController {

    private final WriteCoordinator writeCoordinator;
    private final MessageStore messageStore;

    public MessageController(WriteCoordinator writeCoordinator, MessageStore messageStore) {
        this.writeCoordinator = writeCoordinator;
        this.messageStore = messageStore;
    }

    /**
     * Responds once the message itself is durable; conversation previews may catch up later.
     */
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<MessageResponse> sendMessage(@RequestBody MessageRequest request) {
        if (request.content() == null || request.content().isBlank()) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "Message content is required"));
        }
        return writeCoordinator
                .sendMessage(request.senderId(), request.receiverId(), request.content())
                .map(result -> MessageResponse.from(result.message()));
    }

    /**
     * History of a conversation, newest first. Pass {@code before} to load strictly older messages.
     */
    @GetMapping("/conversation/{conversationId}")
    public Mono<MessagePage> getConversationMessages(
            @PathVariable UUID conversationId,
            @RequestParam(required = false) String cursor,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Instant before) {
        return messageStore.listMessages(conversationId, cursor, limit, before)
                .map(page -> new MessagePage(
                        page.items().stream().map(MessageResponse::from).toList(),
                        page.nextCursor()));
    }
}
