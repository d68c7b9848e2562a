package com.ryuqq.procedure.testkit.fixture;

import com.ryuqq.procedure.core.model.TaskError;

import java.util.UUID;

/**
 * Factory for distinguishable test errors.
 *
 * @author Procedure Team
 * @since 1.0.0
 */
public final class TestError {

    public static final String CODE = "TEST-ERROR";

    private TestError() {
        throw new AssertionError("Cannot instantiate utility class");
    }

    /**
     * Creates a test error with a unique message.
     *
     * @return error with code {@value #CODE}
     */
    public static TaskError create() {
        return TaskError.of(CODE, "Test error " + UUID.randomUUID());
    }

    public static TaskError create(String message) {
        return TaskError.of(CODE, message);
    }

    public static boolean isTestError(TaskError error) {
        return error != null && CODE.equals(error.code());
    }
}
