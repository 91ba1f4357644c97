package com.phillippitts.phiredaction.service.detect.fast;

/**
 * CharSequence wrapper that aborts regex matching once a deadline has passed.
 *
 * <p>{@link java.util.regex.Matcher} reads its input exclusively through {@link #charAt(int)}, so
 * checking the clock there bounds the wall-clock time of any match, including pathological
 * backtracking. The clock is sampled every {@value #CHECK_INTERVAL} reads.
 */
final class DeadlineCharSequence implements CharSequence {

    static final int CHECK_INTERVAL = 256;

    /** Thrown from {@link #charAt(int)} once the deadline has passed. */
    static final class DeadlineExceededException extends RuntimeException {
        DeadlineExceededException() {
            super("Pattern scan deadline exceeded", null, false, false);
        }
    }

    private final CharSequence delegate;
    private final long deadlineNanos;
    private int reads;

    DeadlineCharSequence(CharSequence delegate, long deadlineNanos) {
        this.delegate = delegate;
        this.deadlineNanos = deadlineNanos;
    }

    static DeadlineCharSequence withBudget(CharSequence delegate, long budgetMs) {
        return new DeadlineCharSequence(delegate, System.nanoTime() + budgetMs * 1_000_000L);
    }

    @Override
    public char charAt(int index) {
        if (++reads % CHECK_INTERVAL == 0 && System.nanoTime() - deadlineNanos > 0) {
            throw new DeadlineExceededException();
        }
        return delegate.charAt(index);
    }

    @Override
    public int length() {
        return delegate.length();
    }

    @Override
    public CharSequence subSequence(int start, int end) {
        return new DeadlineCharSequence(delegate.subSequence(start, end), deadlineNanos);
    }

    @Override
    public String toString() {
        return delegate.toString();
    }
}
