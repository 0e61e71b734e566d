package com.edge.qms.core.update;

/**
 * MAJOR.MINOR.PATCH 版本比较
 * <p>
 * 缺少的分量按 0 处理，允许前缀 v；任一分量不是数字时视为"不更新"。
 */
public final class SemanticVersion {

    private SemanticVersion() {
    }

    /**
     * candidate 是否比 current 新，任何解析失败都返回 false
     */
    public static boolean isNewer(String candidate, String current) {
        int[] a = parse(candidate);
        int[] b = parse(current);
        if (a == null || b == null) {
            return false;
        }
        for (int i = 0; i < 3; i++) {
            if (a[i] != b[i]) {
                return a[i] > b[i];
            }
        }
        return false;
    }

    static int[] parse(String version) {
        if (version == null) {
            return null;
        }
        String v = version.trim();
        if (v.startsWith("v") || v.startsWith("V")) {
            v = v.substring(1);
        }
        if (v.isEmpty()) {
            return null;
        }
        String[] parts = v.split("\\.", -1);
        if (parts.length > 3) {
            return null;
        }
        int[] result = new int[3];
        for (int i = 0; i < parts.length; i++) {
            String part = parts[i];
            if (part.isEmpty() || !part.chars().allMatch(Character::isDigit)) {
                return null;
            }
            try {
                result[i] = Integer.parseInt(part);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return result;
    }
}
