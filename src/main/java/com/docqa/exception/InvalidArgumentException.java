package com.docqa.exception;

/**
 * Caller-contract violation, e.g. a missing target language for a translation.
 */
public class InvalidArgumentException extends RagException {

    public InvalidArgumentException(String message) {
        super(message);
    }
}
