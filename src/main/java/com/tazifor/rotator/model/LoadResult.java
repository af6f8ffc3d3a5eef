package com.tazifor.rotator.model;

import java.util.Optional;

/**
 * Load Result
 *
 * IMMUTABLE: Thread-safe, can be passed between threads
 * CONTAINS: Success status, the assigned banner position or the rejection reason
 */
public final class LoadResult {

    private static final int NO_POSITION = -1;

    private final ValidationError error;
    private final int position;

    private LoadResult(ValidationError error, int position) {
        this.error = error;
        this.position = position;
    }

    public static LoadResult loaded(int position) {
        return new LoadResult(null, position);
    }

    public static LoadResult rejected(ValidationError error) {
        return new LoadResult(error, NO_POSITION);
    }

    public boolean isSuccess() { return error == null; }
    public Optional<ValidationError> getError() { return Optional.ofNullable(error); }

    /**
     * Banner position assigned by the store, -1 when rejected
     */
    public int getPosition() { return position; }

    @Override
    public String toString() {
        return isSuccess() ? "LoadResult{loaded at " + position + "}" : "LoadResult{rejected: " + error + "}";
    }
}
