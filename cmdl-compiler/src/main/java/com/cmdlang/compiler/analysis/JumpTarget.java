package com.cmdlang.compiler.analysis;

import com.cmdlang.compiler.ast.Block;

/**
 * 跳转目标：所在列表 + 继续执行的下标
 */
public final class JumpTarget {
    private final Block block;
    private final int index;

    public JumpTarget(Block block, int index) {
        this.block = block;
        this.index = index;
    }

    public Block getBlock() {
        return block;
    }

    public int getIndex() {
        return index;
    }

    @Override
    public String toString() {
        return "JumpTarget(index=" + index + (block.isRoot() ? ", root" : "") + ")";
    }
}
