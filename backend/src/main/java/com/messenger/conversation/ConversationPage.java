package com.messenger.conversation;

import java.util.List;

public record ConversationPage(List<ConversationSummary> data, String nextCursor) {}
