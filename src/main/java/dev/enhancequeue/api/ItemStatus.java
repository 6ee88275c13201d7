package dev.enhancequeue.api;

/**
 * Work item lifecycle: {@code PENDING -> PROCESSING -> COMPLETED | FAILED}; PENDING and
 * PROCESSING may also become CANCELLED. Terminal states never change again.
 */
public enum ItemStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Only PENDING and FAILED items may be removed by the caller.
     */
    public boolean isRemovable() {
        return this == PENDING || this == FAILED;
    }
}
