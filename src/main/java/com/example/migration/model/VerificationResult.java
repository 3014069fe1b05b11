package com.example.migration.model;

import java.util.List;

public record VerificationResult(boolean valid, long actualCount, List<String> mismatches) {

    public VerificationResult {
        mismatches = List.copyOf(mismatches);
    }

    public static VerificationResult of(long actualCount, List<String> mismatches) {
        return new VerificationResult(mismatches.isEmpty(), actualCount, mismatches);
    }
}
