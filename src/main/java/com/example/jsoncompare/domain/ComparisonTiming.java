package com.example.jsoncompare.domain;

import lombok.AccessLevel;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Collects phase timings while a comparison runs. Steps keep the order they were recorded in.
 */
@Getter
public class ComparisonTiming {
    private final List<StepTiming> steps = new ArrayList<>();
    private double totalDurationSeconds;

    @Getter(AccessLevel.NONE)
    private final long startNanos = System.nanoTime();

    public static double nanosToSeconds(long nanos) {
        return nanos / 1_000_000_000.0;
    }

    /** Records the step that began at {@code stepStartNanos} and returns its duration in seconds. */
    public double record(String label, long stepStartNanos) {
        double seconds = nanosToSeconds(System.nanoTime() - stepStartNanos);
        steps.add(new StepTiming(label, seconds));
        return seconds;
    }

    public ComparisonTiming finish() {
        totalDurationSeconds = nanosToSeconds(System.nanoTime() - startNanos);
        return this;
    }

    public Optional<StepTiming> slowestStep() {
        return steps.stream().max(Comparator.comparingDouble(StepTiming::getDurationSeconds));
    }
}
