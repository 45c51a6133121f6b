package com.cmdlang.compiler.analysis;

import com.cmdlang.compiler.ast.LabelNode;
import com.cmdlang.compiler.parser.ParseException;

/**
 * 同名标签重复定义
 */
public class DuplicateLabelException extends ParseException {
    private final int firstLine;

    public DuplicateLabelException(LabelNode duplicate, int firstLine) {
        super("Label '" + duplicate.getName() + "' already defined on line " + firstLine,
                duplicate.getLocation().getFile(), duplicate.getLocation().getLine(),
                duplicate.getSourceText());
        this.firstLine = firstLine;
    }

    public int getFirstLine() {
        return firstLine;
    }
}
