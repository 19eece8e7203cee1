package io.kairos.core.vector;

public final class DimensionMismatchException extends RuntimeException {
    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super("Embedding dimension mismatch: expected " + expected + " but was " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public int expected() {
        return expected;
    }

    public int actual() {
        return actual;
    }
}
