package com.example.jsoncompare.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Locale;

/**
 * Elapsed time of one phase of a comparison run.
 */
@Getter
@AllArgsConstructor
public class StepTiming {
    private final String label;
    private final double durationSeconds;

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%s (%.3fs)", label, durationSeconds);
    }
}
