package dev.enhancequeue.api;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of one {@link BatchQueue#submit} call. Partial acceptance is normal.
 *
 * @param accepted    number of references enqueued
 * @param acceptedIds ids of the new items, in submission order
 * @param rejections  one entry per rejected reference, in submission order
 */
public record SubmissionResult(int accepted, List<UUID> acceptedIds, List<Rejection> rejections) {
    public SubmissionResult {
        acceptedIds = List.copyOf(acceptedIds);
        rejections = List.copyOf(rejections);
    }

    public int rejected() {
        return rejections.size();
    }
}
