package com.ryuqq.procedure.testkit.fixture;

import com.ryuqq.procedure.core.condition.ConditionResult;
import com.ryuqq.procedure.core.condition.Precondition;
import com.ryuqq.procedure.core.task.TaskReference;

import java.util.function.Consumer;

/**
 * Precondition that is always satisfied.
 *
 * @author Procedure Team
 * @since 1.0.0
 */
public class TrueCondition extends Precondition {

    public TrueCondition() {
        super("TrueCondition");
    }

    @Override
    protected void evaluate(TaskReference owner, Consumer<ConditionResult> completion) {
        completion.accept(ConditionResult.satisfied());
    }
}
