package com.edge.qms.core.update;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 安装辅助脚本
 * <p>
 * 运行中的程序不能覆盖自身文件，由独立进程完成替换：
 * 1. 每隔 pollIntervalMs 检查父进程，直到其退出
 * 2. 把下载的更新包复制到安装目标
 * 3. 可选重新启动
 * 4. 删除更新包和脚本自身
 * 复制失败时脚本直接退出，保留原安装文件。
 */
public class InstallHelperScript {

    private final PlatformFamily platform;
    private final long parentPid;
    private final Path artifact;
    private final Path target;
    private final List<String> relaunchCommand;
    private final long pollIntervalMs;

    /**
     * @param relaunchCommand 重新启动命令，null 或空表示不重启
     */
    public InstallHelperScript(PlatformFamily platform, long parentPid, Path artifact, Path target,
                               List<String> relaunchCommand, long pollIntervalMs) {
        this.platform = platform;
        this.parentPid = parentPid;
        this.artifact = artifact;
        this.target = target;
        this.relaunchCommand = relaunchCommand != null ? relaunchCommand : List.of();
        this.pollIntervalMs = Math.max(pollIntervalMs, 50);
    }

    public String fileName() {
        return platform.isPosix() ? "qms_update_helper.sh" : "qms_update_helper.cmd";
    }

    public String render() {
        return platform.isPosix() ? renderPosix() : renderWindows();
    }

    private String renderPosix() {
        StringBuilder sb = new StringBuilder();
        sb.append("#!/bin/sh\n");
        sb.append("PARENT_PID=").append(parentPid).append('\n');
        sb.append("while kill -0 \"$PARENT_PID\" 2>/dev/null; do\n");
        sb.append("  sleep ").append(String.format(Locale.ROOT, "%.3f", pollIntervalMs / 1000.0)).append('\n');
        sb.append("done\n");
        sb.append("cp -f ").append(shQuote(artifact)).append(' ').append(shQuote(target)).append(" || exit 1\n");
        sb.append("chmod +x ").append(shQuote(target)).append('\n');
        if (!relaunchCommand.isEmpty()) {
            List<String> quoted = new ArrayList<>();
            for (String part : relaunchCommand) {
                quoted.add(shQuote(part));
            }
            sb.append("nohup ").append(String.join(" ", quoted)).append(" >/dev/null 2>&1 &\n");
        }
        sb.append("rm -f ").append(shQuote(artifact)).append('\n');
        sb.append("rm -f \"$0\"\n");
        return sb.toString();
    }

    private String renderWindows() {
        StringBuilder sb = new StringBuilder();
        sb.append("@echo off\r\n");
        sb.append(":wait\r\n");
        sb.append("tasklist /FI \"PID eq ").append(parentPid).append("\" 2>NUL | find \"")
                .append(parentPid).append("\" >NUL\r\n");
        sb.append("if not errorlevel 1 (\r\n");
        sb.append("  powershell -NoProfile -Command \"Start-Sleep -Milliseconds ").append(pollIntervalMs)
                .append("\"\r\n");
        sb.append("  goto wait\r\n");
        sb.append(")\r\n");
        sb.append("copy /Y ").append(cmdQuote(artifact.toString())).append(' ')
                .append(cmdQuote(target.toString())).append(" >NUL\r\n");
        sb.append("if errorlevel 1 exit /b 1\r\n");
        if (!relaunchCommand.isEmpty()) {
            List<String> quoted = new ArrayList<>();
            for (String part : relaunchCommand) {
                quoted.add(cmdQuote(part));
            }
            sb.append("start \"\" ").append(String.join(" ", quoted)).append("\r\n");
        }
        sb.append("del /F /Q ").append(cmdQuote(artifact.toString())).append("\r\n");
        sb.append("(goto) 2>nul & del \"%~f0\"\r\n");
        return sb.toString();
    }

    private static String shQuote(Path path) {
        return shQuote(path.toString());
    }

    static String shQuote(String value) {
        return "'" + value.replace("'", "'\\''") + "'";
    }

    static String cmdQuote(String value) {
        return "\"" + value.replace("\"", "") + "\"";
    }
}
