package com.ryuqq.procedure.testkit.stress;

import java.util.Locale;
import java.util.function.BiConsumer;

/**
 * Stress level (immutable record).
 *
 * <p>A level is a number of batches, each running a number of iterations, and the time a single
 * batch is allowed to take before the stress run fails.</p>
 *
 * <p><strong>Predefined levels:</strong></p>
 * <ul>
 *   <li>LOW: 1 batch x 1,000 iterations, 30 seconds</li>
 *   <li>MEDIUM: 2 batches x 5,000 iterations, 60 seconds</li>
 *   <li>HIGH: 5 batches x 10,000 iterations, 120 seconds</li>
 * </ul>
 *
 * <p>The default level of a run can be overridden with {@code -Dprocedure.stress.level=medium}.</p>
 *
 * @author Procedure Team
 * @since 1.0.0
 * @param batches number of batches (must be positive)
 * @param iterations iterations per batch (must be positive)
 * @param timeoutSeconds time a single batch may take (must be positive)
 */
public record StressLevel(
    int batches,
    int iterations,
    long timeoutSeconds
) {

    public static final String SYSTEM_PROPERTY = "procedure.stress.level";

    public static final StressLevel LOW = new StressLevel(1, 1_000, 30);
    public static final StressLevel MEDIUM = new StressLevel(2, 5_000, 60);
    public static final StressLevel HIGH = new StressLevel(5, 10_000, 120);

    private static final long DEFAULT_TIMEOUT_SECONDS = 60;

    /**
     * Compact constructor (validation).
     *
     * @throws IllegalArgumentException if any value is not positive
     */
    public StressLevel {
        if (batches <= 0) {
            throw new IllegalArgumentException("batches must be positive (current: " + batches + ")");
        }
        if (iterations <= 0) {
            throw new IllegalArgumentException("iterations must be positive (current: " + iterations + ")");
        }
        if (timeoutSeconds <= 0) {
            throw new IllegalArgumentException("timeoutSeconds must be positive (current: " + timeoutSeconds + ")");
        }
    }

    public static StressLevel custom(int batches, int iterations) {
        return new StressLevel(batches, iterations, DEFAULT_TIMEOUT_SECONDS);
    }

    /**
     * Reads the level named by the {@value #SYSTEM_PROPERTY} system property.
     *
     * @param defaultLevel level used when the property is absent
     * @return LOW, MEDIUM or HIGH as named by the property, otherwise defaultLevel
     * @throws IllegalArgumentException if the property names an unknown level
     */
    public static StressLevel fromSystemProperty(StressLevel defaultLevel) {
        String value = System.getProperty(SYSTEM_PROPERTY);
        if (value == null || value.isBlank()) {
            return defaultLevel;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "low":
                return LOW;
            case "medium":
                return MEDIUM;
            case "high":
                return HIGH;
            default:
                throw new IllegalArgumentException("Unknown stress level: " + value);
        }
    }

    public int totalIterations() {
        return batches * iterations;
    }

    /**
     * Runs the block for every (batch, iteration) pair on the calling thread.
     *
     * @param block receives the batch number and the iteration number
     */
    public void forEach(BiConsumer<Integer, Integer> block) {
        if (block == null) {
            throw new IllegalArgumentException("block cannot be null");
        }
        for (int batch = 0; batch < batches; batch++) {
            for (int iteration = 0; iteration < iterations; iteration++) {
                block.accept(batch, iteration);
            }
        }
    }
}
