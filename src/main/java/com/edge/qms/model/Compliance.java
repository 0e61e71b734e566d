package com.edge.qms.model;

/**
 * 符合性判定（三态）
 * <p>
 * UNKNOWN 表示无法自动判定（数值无法解析、文本项等），不计入合格率分母
 */
public enum Compliance {
    PASS,
    FAIL,
    UNKNOWN;

    public static Compliance of(boolean passed) {
        return passed ? PASS : FAIL;
    }
}
