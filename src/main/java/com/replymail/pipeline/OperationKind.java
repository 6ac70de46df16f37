package com.replymail.pipeline;

/**
 * External call categories, each with its own retry/timeout budget
 */
public enum OperationKind {
    FETCH(true),
    SEND(false),
    GENERATE(true),
    EMBED(true);

    /**
     * A non-idempotent call may still complete after its subscriber gave up,
     * so it is never abandoned on a per-attempt timeout and retried alongside itself.
     */
    private final boolean idempotent;

    OperationKind(boolean idempotent) {
        this.idempotent = idempotent;
    }

    public boolean isIdempotent() {
        return idempotent;
    }
}
