package com.edge.qms.core.update;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 更新安装：写出辅助脚本并以分离进程启动，替换在当前进程退出后进行
 * <p>
 * 启动脚本之前的任何失败都只影响本次更新，当前运行的实例不受影响。
 */
public class UpdateInstaller {
    private static final Logger logger = LoggerFactory.getLogger(UpdateInstaller.class);

    private final PlatformFamily platform;
    private final ProcessLauncher launcher;
    private final Path scriptDir;
    private final long pollIntervalMs;

    public UpdateInstaller(PlatformFamily platform, ProcessLauncher launcher, Path scriptDir, long pollIntervalMs) {
        this.platform = platform;
        this.launcher = launcher;
        this.scriptDir = scriptDir;
        this.pollIntervalMs = pollIntervalMs;
    }

    /**
     * @param relaunchCommand 替换完成后执行的命令，null 表示不重启
     * @return 写出的辅助脚本路径
     * @throws IOException 更新包不存在、脚本写入或进程启动失败
     */
    public Path install(Path artifact, Path target, List<String> relaunchCommand) throws IOException {
        if (artifact == null || !Files.isRegularFile(artifact)) {
            throw new IOException("Downloaded update not found: " + artifact);
        }
        if (target == null) {
            throw new IOException("Install target is not configured");
        }
        if (platform.isPosix() && !artifact.toFile().setExecutable(true, false)) {
            throw new IOException("Failed to set executable bit on " + artifact);
        }

        InstallHelperScript script = new InstallHelperScript(platform, ProcessHandle.current().pid(),
                artifact, target, relaunchCommand, pollIntervalMs);
        Files.createDirectories(scriptDir);
        Path scriptPath = scriptDir.resolve(script.fileName());
        Files.write(scriptPath, script.render().getBytes(StandardCharsets.UTF_8));

        if (platform.isPosix()) {
            if (!scriptPath.toFile().setExecutable(true, true)) {
                throw new IOException("Failed to set executable bit on " + scriptPath);
            }
            launcher.launchDetached(List.of("sh", scriptPath.toString()));
        } else {
            launcher.launchDetached(List.of("cmd", "/c", "start", "\"\"", "/min", scriptPath.toString()));
        }
        logger.info("Update helper started, {} will replace {} after exit", artifact, target);
        return scriptPath;
    }
}
