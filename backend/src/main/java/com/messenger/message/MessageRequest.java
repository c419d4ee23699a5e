package com.messenger.message;

/**
 * Send request. The message timestamp is always taken from the server clock.
 */
public record MessageRequest(
    long senderId,
    long receiverId,
    String content
) {}
