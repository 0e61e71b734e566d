package com.edge.qms.core.update;

import java.util.Locale;

/**
 * 更新包所针对的操作系统
 */
public enum PlatformFamily {
    WINDOWS("windows", ".exe"),
    LINUX("linux", ".AppImage"),
    MACOS("macos", ".dmg");

    private final String metadataKey;
    private final String artifactExtension;

    PlatformFamily(String metadataKey, String artifactExtension) {
        this.metadataKey = metadataKey;
        this.artifactExtension = artifactExtension;
    }

    /**
     * 版本信息 JSON 中的平台字段名
     */
    public String getMetadataKey() {
        return metadataKey;
    }

    public String getArtifactExtension() {
        return artifactExtension;
    }

    public boolean isPosix() {
        return this != WINDOWS;
    }

    public static PlatformFamily current() {
        return fromOsName(System.getProperty("os.name", ""));
    }

    static PlatformFamily fromOsName(String osName) {
        String os = osName.toLowerCase(Locale.ROOT);
        if (os.contains("win")) {
            return WINDOWS;
        }
        if (os.contains("mac") || os.contains("darwin")) {
            return MACOS;
        }
        return LINUX;
    }
}
