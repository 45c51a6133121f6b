package com.cmdlang.compiler.analysis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 标签表（只读）：标签名 → 跳转目标
 */
public final class LabelTable {
    private final Map<String, JumpTarget> targets;

    LabelTable(Map<String, JumpTarget> targets) {
        this.targets = Collections.unmodifiableMap(new LinkedHashMap<>(targets));
    }

    /** 查找标签，不存在返回 null */
    public JumpTarget lookup(String name) {
        return targets.get(name);
    }

    public boolean contains(String name) {
        return targets.containsKey(name);
    }

    public Set<String> names() {
        return targets.keySet();
    }

    public int size() {
        return targets.size();
    }
}
