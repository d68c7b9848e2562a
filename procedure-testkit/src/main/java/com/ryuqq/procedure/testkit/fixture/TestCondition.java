package com.ryuqq.procedure.testkit.fixture;

import com.ryuqq.procedure.core.condition.ConditionResult;
import com.ryuqq.procedure.core.condition.Precondition;
import com.ryuqq.procedure.core.task.Task;
import com.ryuqq.procedure.core.task.TaskReference;

import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Precondition evaluated by a block, optionally with produced dependencies.
 *
 * @author Procedure Team
 * @since 1.0.0
 */
public class TestCondition extends Precondition {

    private final Supplier<ConditionResult> block;

    public TestCondition(Supplier<ConditionResult> block) {
        this(List.of(), block);
    }

    /**
     * Constructor.
     *
     * @param producedDependencies tasks that must finish before the block runs
     * @param block evaluation block
     * @throws IllegalArgumentException if an argument is null
     */
    public TestCondition(Collection<? extends Task> producedDependencies, Supplier<ConditionResult> block) {
        super("TestCondition");
        if (producedDependencies == null) {
            throw new IllegalArgumentException("producedDependencies cannot be null");
        }
        if (block == null) {
            throw new IllegalArgumentException("block cannot be null");
        }
        this.block = block;
        producedDependencies.forEach(this::addProducedDependency);
    }

    @Override
    protected void evaluate(TaskReference owner, Consumer<ConditionResult> completion) {
        completion.accept(block.get());
    }
}
