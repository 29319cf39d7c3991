package org.pubkit.exception;

import lombok.Getter;

@Getter
public class PublicationParseException extends RuntimeException {

    private final ParseError error;

    public PublicationParseException(ParseError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }
}
