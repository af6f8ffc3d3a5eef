package com.tazifor.rotator.service;

import com.tazifor.rotator.model.ValidationError;

import java.util.Map;

/**
 * Outcome of loading one banner configuration source.
 */
public record LoadSummary(String source, int loaded, int rejected, Map<ValidationError, Integer> rejectedByReason) {

    public LoadSummary {
        rejectedByReason = Map.copyOf(rejectedByReason);
    }

    public int rejectedFor(ValidationError error) {
        return rejectedByReason.getOrDefault(error, 0);
    }
}
