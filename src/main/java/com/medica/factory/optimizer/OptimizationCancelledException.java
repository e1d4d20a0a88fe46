package com.medica.factory.optimizer;

import lombok.Getter;

/**
 * Thrown when a search is stopped through its {@link CancellationToken}.
 * Carries the best result found before the stop.
 */
@Getter
public class OptimizationCancelledException extends RuntimeException {

    private final transient OptimizationResult bestSoFar;

    public OptimizationCancelledException(String message, OptimizationResult bestSoFar) {
        super(message);
        this.bestSoFar = bestSoFar;
    }
}
