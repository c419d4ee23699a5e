package com.messenger.send;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * The message could not be made durable. Nothing beyond the (empty) conversation row was written.
 */
@ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
public class SendFailedException extends RuntimeException {

    public SendFailedException(long senderId, long receiverId, Throwable cause) {
        super("Message from " + senderId + " to " + receiverId + " was not stored", cause);
    }
}
