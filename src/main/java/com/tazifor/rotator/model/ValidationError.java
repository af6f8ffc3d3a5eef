package com.tazifor.rotator.model;

/**
 * Reasons a banner record is rejected at load time.
 *
 * Scoped to the offending record only: the loader keeps going with the next one.
 */
public enum ValidationError {
    ILLEGAL_URL("Banner url is empty"),
    ILLEGAL_IMPRESSION_AMOUNT("Impression amount must be a positive integer"),
    EMPTY_CATEGORIES("Banner has no categories");

    private final String description;

    ValidationError(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
