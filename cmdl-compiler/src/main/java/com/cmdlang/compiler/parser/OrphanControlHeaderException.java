package com.cmdlang.compiler.parser;

/**
 * elif / else 前面没有可追加的 if 链
 */
public class OrphanControlHeaderException extends ParseException {

    public OrphanControlHeaderException(String keyword, String fileName, int line, String lineText) {
        super("'" + keyword + "' without a preceding open 'if'", fileName, line, lineText);
    }
}
