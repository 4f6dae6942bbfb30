package com.docqa.exception;

import lombok.Getter;

@Getter
public class DimensionMismatchException extends RetrievalException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super("Embedding dimension mismatch: expected " + expected + ", got " + actual);
        this.expected = expected;
        this.actual = actual;
    }
}
