package org.pubkit.exception;

import lombok.Getter;

@Getter
public enum ParseError {
    ROOT_FILE_NOT_FOUND("Cannot locate the package document: %s"),
    INVALID_PACKAGE_DOCUMENT("Invalid package document '%s'"),
    NO_BITMAP_FOUND("No bitmap found in publication '%s'"),
    FETCHER_FAILURE("Cannot list the resources of '%s'"),
    UNSUPPORTED_FORMAT("No parser accepts '%s' (%s)"),
    FILE_READ_ERROR("Error reading file: %s");

    private final String message;

    ParseError(String message) {
        this.message = message;
    }

    public PublicationParseException createException(Object... details) {
        return new PublicationParseException(this, String.format(message, details), null);
    }

    public PublicationParseException createException(Throwable cause, Object... details) {
        String formatted = String.format(message, details);
        if (cause != null && cause.getMessage() != null) {
            formatted = formatted + ": " + cause.getMessage();
        }
        return new PublicationParseException(this, formatted, cause);
    }
}
