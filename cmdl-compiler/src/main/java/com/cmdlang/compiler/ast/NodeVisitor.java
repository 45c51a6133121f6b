package com.cmdlang.compiler.ast;

/**
 * 节点访问者接口
 *
 * <p>所有方法提供默认实现（返回 null），实现类只需覆盖感兴趣的节点类型。</p>
 */
public interface NodeVisitor<R, C> {

    default R visitLabel(LabelNode node, C ctx) { return null; }

    default R visitLoop(LoopNode node, C ctx) { return null; }

    default R visitConditional(ConditionalNode node, C ctx) { return null; }

    default R visitStatement(StatementNode node, C ctx) { return null; }
}
