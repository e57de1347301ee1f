package com.judgmentrag.exception;

public class DimensionMismatchException extends RagException {

    public DimensionMismatchException(int expected, int actual) {
        super("Vector dimension mismatch: index holds " + expected + ", got " + actual);
    }
}
