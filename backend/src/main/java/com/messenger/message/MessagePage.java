package com.messenger.message;

import java.util.List;

/** {@code nextCursor} is null on the last page. */
public record MessagePage(List<MessageResponse> data, String nextCursor) {}
