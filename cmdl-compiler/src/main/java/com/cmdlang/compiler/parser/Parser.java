package com.cmdlang.compiler.parser;

import com.cmdlang.compiler.ast.*;
import com.cmdlang.compiler.lexer.LineClassifier;
import com.cmdlang.compiler.lexer.LineKind;
import com.cmdlang.compiler.lexer.SourceLine;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * 树构建器：按缩进栈把分类后的行组装为嵌套节点。
 *
 * <p>栈帧为 (缩进层级, 目标列表)，初始为 (-1, 根列表)。每行先弹出所有
 * 层级不小于本行的帧（至少保留根帧），再把节点追加到栈顶列表。
 * 循环体和每个条件分支体各压入一帧，使后续更深的行落入该体内。</p>
 *
 * <p>elif / else 只会追加到紧邻的前一个兄弟节点所代表的条件链上。</p>
 */
public class Parser {

    private final LineClassifier classifier;
    private final String fileName;

    public Parser(LineClassifier classifier) {
        this.classifier = classifier;
        this.fileName = classifier.getFileName();
    }

    public Parser(String source, String fileName) {
        this(new LineClassifier(source, fileName));
    }

    /** 便捷入口 */
    public static Program parse(String source, String fileName) {
        return new Parser(source, fileName).parse();
    }

    public Program parse() {
        List<SourceLine> lines = classifier.classify();
        Block root = Block.root();
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(-1, root));

        for (SourceLine line : lines) {
            while (line.getDepth() <= stack.peek().depth && stack.size() > 1) {
                stack.pop();
            }
            Block current = stack.peek().block;
            SourceLocation loc = new SourceLocation(fileName, line.getLine(), indentColumn(line));

            switch (line.getKind()) {
                case LABEL:
                    current.add(new LabelNode(loc, line.getText(), line.getArgument()));
                    break;
                case LOOP: {
                    Block body = current.openChild();
                    current.add(new LoopNode(loc, line.getText(), line.getArgument(), body));
                    stack.push(new Frame(line.getDepth(), body));
                    break;
                }
                case IF: {
                    Block body = current.openChild();
                    ConditionalArm arm = new ConditionalArm(ConditionalArm.Kind.IF, line.getArgument(), body, loc);
                    current.add(new ConditionalNode(loc, line.getText(), arm));
                    stack.push(new Frame(line.getDepth(), body));
                    break;
                }
                case ELIF:
                case ELSE: {
                    ConditionalNode chain = openChain(current, line);
                    Block body = current.childOf(current.size() - 1);
                    ConditionalArm.Kind kind = line.is(LineKind.ELIF)
                            ? ConditionalArm.Kind.ELIF : ConditionalArm.Kind.ELSE;
                    chain.addArm(new ConditionalArm(kind, line.getArgument(), body, loc));
                    stack.push(new Frame(line.getDepth(), body));
                    break;
                }
                default:
                    current.add(new StatementNode(loc, line.getText()));
                    break;
            }
        }
        return new Program(fileName, root);
    }

    /**
     * 查找紧邻的前一个兄弟条件链；不存在或已被 else 关闭则为孤立头部
     */
    private ConditionalNode openChain(Block current, SourceLine line) {
        Node last = current.last();
        if (!(last instanceof ConditionalNode) || ((ConditionalNode) last).hasElse()) {
            String keyword = line.is(LineKind.ELIF) ? "elif" : "else";
            throw new OrphanControlHeaderException(keyword, fileName, line.getLine(), line.getText());
        }
        return (ConditionalNode) last;
    }

    private static int indentColumn(SourceLine line) {
        return line.getDepth() * LineClassifier.INDENT_UNIT + 1;
    }

    private static final class Frame {
        final int depth;
        final Block block;

        Frame(int depth, Block block) {
            this.depth = depth;
            this.block = block;
        }
    }
}
