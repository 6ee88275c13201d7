package dev.enhancequeue.api;

public enum RejectionReason {
    QUEUE_FULL,
    UNSUPPORTED_FORMAT,
    DUPLICATE,
    OVERSIZE
}
