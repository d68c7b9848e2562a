package com.ryuqq.procedure.core.task;

import java.util.function.Consumer;

/**
 * 블록으로 실행 본문을 구성하는 Task.
 *
 * <p>블록이 반환되면 자동으로 {@link #finish()}를 호출합니다.
 * 블록 안에서 이미 finish했거나 비동기 종료를 위임했다면 자동 호출은 무시됩니다.</p>
 *
 * @author Procedure Team
 * @since 1.0.0
 */
public class BlockTask extends Task {

    private final Consumer<Task> block;

    public BlockTask(Runnable block) {
        this(null, block);
    }

    public BlockTask(String name, Runnable block) {
        super(name);
        if (block == null) {
            throw new IllegalArgumentException("block cannot be null");
        }
        this.block = task -> block.run();
    }

    public BlockTask(Consumer<Task> block) {
        this(null, block);
    }

    public BlockTask(String name, Consumer<Task> block) {
        super(name);
        if (block == null) {
            throw new IllegalArgumentException("block cannot be null");
        }
        this.block = block;
    }

    @Override
    protected void execute() {
        block.accept(this);
        finish();
    }
}
