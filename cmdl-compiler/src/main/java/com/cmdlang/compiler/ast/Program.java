package com.cmdlang.compiler.ast;

/**
 * 解析结果：根语句列表
 */
public final class Program {
    private final String fileName;
    private final Block root;

    public Program(String fileName, Block root) {
        this.fileName = fileName;
        this.root = root;
    }

    public String getFileName() {
        return fileName;
    }

    public Block getRoot() {
        return root;
    }
}
