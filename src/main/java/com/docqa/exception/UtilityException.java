package com.docqa.exception;

public class UtilityException extends RagException {

    public UtilityException(String message) {
        super(message);
    }

    public UtilityException(String message, Throwable cause) {
        super(message, cause);
    }
}
