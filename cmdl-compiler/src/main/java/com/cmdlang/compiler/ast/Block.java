package com.cmdlang.compiler.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 有序语句列表（根列表、循环体或条件分支体）
 *
 * <p>每个嵌套列表记住外层列表以及拥有它的节点在外层列表中的下标，
 * 这样执行游标跑出嵌套列表末尾时可以回到外层继续。</p>
 */
public final class Block {
    private final Block parent;
    private final int ownerIndex;
    private final List<Node> nodes = new ArrayList<>();
    private final List<Node> view = Collections.unmodifiableList(nodes);

    private Block(Block parent, int ownerIndex) {
        this.parent = parent;
        this.ownerIndex = ownerIndex;
    }

    /** 创建根列表 */
    public static Block root() {
        return new Block(null, -1);
    }

    /**
     * 为即将追加到本列表末尾的节点创建子列表。
     * 必须在追加该节点之前调用。
     */
    public Block openChild() {
        return new Block(this, nodes.size());
    }

    /** 为本列表中已有的节点创建子列表（条件链的后续分支体） */
    public Block childOf(int ownerIndex) {
        if (ownerIndex < 0 || ownerIndex >= nodes.size()) {
            throw new IndexOutOfBoundsException("No node at index " + ownerIndex);
        }
        return new Block(this, ownerIndex);
    }

    /** 构建期追加节点（仅供 Parser 使用） */
    public void add(Node node) {
        nodes.add(node);
    }

    public Node get(int index) {
        return nodes.get(index);
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /** 最后一个节点，空列表返回 null */
    public Node last() {
        return nodes.isEmpty() ? null : nodes.get(nodes.size() - 1);
    }

    public List<Node> getNodes() {
        return view;
    }

    public Block getParent() {
        return parent;
    }

    public boolean isRoot() {
        return parent == null;
    }

    /** 拥有本列表的节点在外层列表中的下标，根列表为 -1 */
    public int getOwnerIndex() {
        return ownerIndex;
    }
}
