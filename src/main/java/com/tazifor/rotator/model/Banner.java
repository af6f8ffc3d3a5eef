package com.tazifor.rotator.model;

import lombok.AccessLevel;
import lombok.Getter;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Banner Model
 *
 * One inventory item: an image URL and a fixed impression budget.
 *
 * {@code url} and {@code total} never change after construction.
 * {@code remaining} is the only mutable state and only ever moves down,
 * one impression at a time, through {@link #show()}.
 *
 * INVARIANT: 0 <= remaining <= total, under any number of concurrent callers.
 */
@Getter
public class Banner {

    public static final String HTML_PREFIX = "<html><body><img src=\"";
    public static final String HTML_SUFFIX = "\"/></body></html>";

    private final String url;
    private final int total;

    @Getter(AccessLevel.NONE)
    private final AtomicInteger remaining;

    public Banner(String url, int total) {
        if (url == null || url.isEmpty()) {
            throw new IllegalArgumentException("Banner url must not be empty");
        }
        if (total <= 0) {
            throw new IllegalArgumentException("Banner total must be positive: " + total);
        }
        this.url = url;
        this.total = total;
        this.remaining = new AtomicInteger(total);
    }

    /**
     * Atomically spend one impression and render the markup
     *
     * COMPARE-AND-RETRY LOOP:
     * 1. Read current remaining
     * 2. If zero, fail immediately (never goes negative)
     * 3. CAS observed -> observed - 1
     * 4. CAS lost to another thread? Reread and try again
     *
     * Non-blocking: a thread only retries when some other thread made progress.
     *
     * @return rendered markup, or empty if the budget is exhausted
     */
    public Optional<String> show() {
        while (true) {
            int observed = remaining.get();
            if (observed <= 0) {
                return Optional.empty();
            }
            if (remaining.compareAndSet(observed, observed - 1)) {
                return Optional.of(render());
            }
        }
    }

    /**
     * Check if banner can still be shown (WITHOUT spending an impression)
     *
     * RACE CONDITION WARNING:
     * Plain read, not synchronized with concurrent {@link #show()} calls.
     * The answer may be stale by the time the caller acts on it;
     * {@link #show()} is the authoritative check.
     */
    public boolean canShow() {
        return remaining.get() > 0;
    }

    public int getRemaining() {
        return remaining.get();
    }

    /**
     * URL is inserted verbatim, no escaping.
     */
    String render() {
        return HTML_PREFIX + url + HTML_SUFFIX;
    }

    @Override
    public String toString() {
        return "Banner{url=" + url + ", total=" + total + ", remaining=" + remaining.get() + "}";
    }
}
