package com.messenger.send;

import java.util.UUID;

import com.messenger.message.Message;

public record SendResult(Message message, UUID conversationId) {}
