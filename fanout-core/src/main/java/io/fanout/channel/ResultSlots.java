package io.fanout.channel;

import io.fanout.DispatchResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Pre-sized, index-addressed result collection shared by the concurrent sends of one request.
 *
 * <p>Each recipient index is written at most once. Slots left empty when the request
 * finishes are reported as failures, so the result list always has one entry per recipient.
 */
final class ResultSlots {
    static final String NO_RESULT = "No result recorded";

    private final List<String> recipients;
    private final AtomicReferenceArray<DispatchResult> slots;

    ResultSlots(List<String> recipients) {
        this.recipients = recipients;
        this.slots = new AtomicReferenceArray<>(recipients.size());
    }

    String recipient(int index) {
        return recipients.get(index);
    }

    /**
     * Stores the result for {@code index} unless one is already present.
     *
     * @return {@code true} if the result was stored
     */
    boolean record(int index, DispatchResult result) {
        return slots.compareAndSet(index, null, result);
    }

    /**
     * Marks every still-empty slot in {@code [from, to)} as failed with {@code cause}.
     */
    void failRemaining(int from, int to, Throwable cause) {
        for (int i = from; i < to; i++) {
            record(i, DispatchResult.failed(recipients.get(i), cause));
        }
    }

    void failRemaining(int from, int to, String error) {
        for (int i = from; i < to; i++) {
            record(i, DispatchResult.failed(recipients.get(i), error));
        }
    }

    List<DispatchResult> toList() {
        List<DispatchResult> results = new ArrayList<>(slots.length());
        for (int i = 0; i < slots.length(); i++) {
            DispatchResult result = slots.get(i);
            results.add(result != null ? result : DispatchResult.failed(recipients.get(i), NO_RESULT));
        }
        return Collections.unmodifiableList(results);
    }
}
