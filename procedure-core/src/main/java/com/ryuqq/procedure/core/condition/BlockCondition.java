package com.ryuqq.procedure.core.condition;

import com.ryuqq.procedure.core.model.TaskError;
import com.ryuqq.procedure.core.task.TaskReference;

import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * 동기 판정 블록으로 구성하는 전제조건.
 *
 * <p>블록이 true를 반환하면 충족, false를 반환하면 {@value #FAILED_CODE} 오류로 실패합니다.</p>
 *
 * @author Procedure Team
 * @since 1.0.0
 */
public class BlockCondition extends Precondition {

    public static final String FAILED_CODE = "CONDITION-FAILED";

    private final BooleanSupplier block;

    public BlockCondition(BooleanSupplier block) {
        this(null, block);
    }

    public BlockCondition(String name, BooleanSupplier block) {
        super(name);
        if (block == null) {
            throw new IllegalArgumentException("block cannot be null");
        }
        this.block = block;
    }

    @Override
    protected void evaluate(TaskReference owner, Consumer<ConditionResult> completion) {
        if (block.getAsBoolean()) {
            completion.accept(ConditionResult.satisfied());
        } else {
            completion.accept(ConditionResult.failed(
                TaskError.of(FAILED_CODE, "Condition " + getName() + " was not satisfied")));
        }
    }
}
