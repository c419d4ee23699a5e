package com.messenger.conversation;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/** A conversation needs two distinct users. Raised before anything is written. */
@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidParticipantsException extends RuntimeException {

    public InvalidParticipantsException(long userId) {
        super("A user cannot start a conversation with themselves: " + userId);
    }
}
