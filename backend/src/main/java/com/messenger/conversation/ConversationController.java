package com.messenger.conversation;

import java.util.UUID;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.messenger.directory.ConversationDirectory;

import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/conversations")
public class ConversationController {

    private final ConversationCatalog catalog;
    private final ConversationDirectory directory;

    public ConversationController(ConversationCatalog catalog, ConversationDirectory directory) {
        this.catalog = catalog;
        this.directory = directory;
    }

    @GetMapping("/{conversationId}")
    public Mono<ConversationResponse> getConversation(@PathVariable UUID conversationId) {
        return catalog.get(conversationId).map(ConversationResponse::from);
    }

    /** The user's conversations, most recently active first. */
    @GetMapping("/user/{userId}")
    public Mono<ConversationPage> listConversationsForUser(
            @PathVariable long userId,
            @RequestParam(required = false) String cursor,
            @RequestParam(required = false) Integer limit) {
        return directory.listConversations(userId, cursor, limit)
                .map(page -> new ConversationPage(
                        page.items().stream().map(ConversationSummary::from).toList(),
                        page.nextCursor()));
    }
}
