package com.ryuqq.procedure.testkit.fixture;

import com.ryuqq.procedure.core.condition.BlockCondition;
import com.ryuqq.procedure.core.condition.ConditionResult;
import com.ryuqq.procedure.core.condition.Precondition;
import com.ryuqq.procedure.core.model.TaskError;
import com.ryuqq.procedure.core.task.TaskReference;

import java.util.function.Consumer;

/**
 * Precondition that always fails with a {@link BlockCondition#FAILED_CODE} error.
 *
 * @author Procedure Team
 * @since 1.0.0
 */
public class FalseCondition extends Precondition {

    public FalseCondition() {
        super("FalseCondition");
    }

    @Override
    protected void evaluate(TaskReference owner, Consumer<ConditionResult> completion) {
        completion.accept(ConditionResult.failed(
            TaskError.of(BlockCondition.FAILED_CODE, "FalseCondition is never satisfied")));
    }
}
