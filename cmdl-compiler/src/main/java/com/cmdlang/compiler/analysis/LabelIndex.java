package com.cmdlang.compiler.analysis;

import com.cmdlang.compiler.ast.*;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 标签索引：对整棵树做一次先序遍历，记录每个标签之后的位置。
 *
 * <p>必须在执行前完成，向前跳转（尚未执行到的标签）才能解析。
 * 循环体和每个条件分支体内的标签都会被收录。</p>
 */
public final class LabelIndex implements NodeVisitor<Void, JumpTarget> {

    private final Map<String, JumpTarget> targets = new LinkedHashMap<>();
    private final Map<String, Integer> definedAt = new HashMap<>();

    private LabelIndex() {}

    /**
     * 构建标签表
     *
     * @throws DuplicateLabelException 同名标签定义多次
     */
    public static LabelTable build(Program program) {
        LabelIndex index = new LabelIndex();
        index.scan(program.getRoot());
        return new LabelTable(index.targets);
    }

    private void scan(Block block) {
        for (int i = 0; i < block.size(); i++) {
            block.get(i).accept(this, new JumpTarget(block, i));
        }
    }

    @Override
    public Void visitLabel(LabelNode node, JumpTarget position) {
        Integer first = definedAt.get(node.getName());
        if (first != null) {
            throw new DuplicateLabelException(node, first);
        }
        definedAt.put(node.getName(), node.getLocation().getLine());
        targets.put(node.getName(), new JumpTarget(position.getBlock(), position.getIndex() + 1));
        return null;
    }

    @Override
    public Void visitLoop(LoopNode node, JumpTarget position) {
        scan(node.getBody());
        return null;
    }

    @Override
    public Void visitConditional(ConditionalNode node, JumpTarget position) {
        for (ConditionalArm arm : node.getArms()) {
            scan(arm.getBody());
        }
        return null;
    }
}
