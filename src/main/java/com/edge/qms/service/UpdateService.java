package com.edge.qms.service;

import com.edge.qms.config.QmsConfig;
import com.edge.qms.core.update.*;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * 自动更新服务
 * <p>
 * 检查与下载在单独的工作线程执行，调用方通过 {@link #getStatus()} 读取状态快照。
 * 所有失败都写入状态的 message，不向调用方抛出。
 */
@Service
public class UpdateService {
    private static final Logger logger = LoggerFactory.getLogger(UpdateService.class);

    private static final String ARTIFACT_NAME = "QMS_Update";

    @Autowired
    private QmsConfig config;

    @Autowired(required = false)
    private ConfigurableApplicationContext applicationContext;

    private final AtomicReference<UpdateStatus> status = new AtomicReference<>();
    private final AtomicBoolean cancelFlag = new AtomicBoolean(false);

    private ExecutorService executor;
    private PlatformFamily platform = PlatformFamily.current();
    private UpdateChecker checker;
    private UpdateDownloader downloader;
    private UpdateInstaller installer;
    private ProcessLauncher processLauncher = new DefaultProcessLauncher();
    private Path downloadDir = Paths.get(System.getProperty("java.io.tmpdir"));
    private Runnable exitAction = this::exitApplication;

    @PostConstruct
    public void init() {
        QmsConfig.UpdateConfig update = config.getUpdate();
        OkHttpClient checkClient = new OkHttpClient.Builder()
                .connectTimeout(update.getTimeout(), TimeUnit.SECONDS)
                .readTimeout(update.getTimeout(), TimeUnit.SECONDS)
                .callTimeout(update.getTimeout(), TimeUnit.SECONDS)
                .build();
        OkHttpClient downloadClient = checkClient.newBuilder()
                .callTimeout(0, TimeUnit.SECONDS)
                .readTimeout(update.getDownloadTimeout(), TimeUnit.SECONDS)
                .build();

        checker = new UpdateChecker(checkClient, update.getMetadataUrl(), update.getCurrentVersion(), platform);
        downloader = new UpdateDownloader(downloadClient);
        installer = new UpdateInstaller(platform, processLauncher, downloadDir, update.getPollIntervalMs());
        executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "update-worker");
            t.setDaemon(true);
            return t;
        });
        status.set(UpdateStatus.idle(update.getCurrentVersion()));
        logger.info("UpdateService initialized: version {}, platform {}, metadata {}",
                update.getCurrentVersion(), platform, update.getMetadataUrl());
    }

    @PreDestroy
    public void shutdown() {
        cancelFlag.set(true);
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    public UpdateStatus getStatus() {
        return status.get();
    }

    /**
     * 异步检查更新，返回的 future 在检查结束后给出最终状态
     *
     * @throws IllegalStateException 正在检查、下载或安装
     */
    public synchronized CompletableFuture<UpdateStatus> checkForUpdates() {
        UpdateStatus current = status.get();
        if (current.getState().isBusy() || current.getState() == UpdateState.DOWNLOADED) {
            throw new IllegalStateException("Update is " + current.getState() + ", cannot check now");
        }
        transition(s -> s.toBuilder().state(UpdateState.CHECKING).message("Checking for updates").build());

        return CompletableFuture.supplyAsync(() -> {
            CheckOutcome outcome = checker.check();
            if (!outcome.isSuccess()) {
                return transition(s -> s.toBuilder()
                        .state(UpdateState.IDLE)
                        .message("Update check failed: " + outcome.getMessage())
                        .build());
            }
            UpdateInfo info = outcome.getInfo();
            return transition(s -> s.toBuilder()
                    .state(outcome.isUpdateAvailable() ? UpdateState.UPDATE_AVAILABLE : UpdateState.UP_TO_DATE)
                    .latestVersion(info.getVersion())
                    .downloadUrl(info.getDownloadUrl())
                    .releaseNotesUrl(info.getReleaseNotesUrl())
                    .notes(buildNotes(outcome))
                    .sizeMb(info.getSizeMb())
                    .message(outcome.getMessage())
                    .build());
        }, executor);
    }

    /**
     * 开始下载，仅在 UPDATE_AVAILABLE 状态可用；失败或取消后回到 UPDATE_AVAILABLE
     */
    public synchronized CompletableFuture<UpdateStatus> startDownload() {
        UpdateStatus current = status.get();
        if (current.getState() != UpdateState.UPDATE_AVAILABLE) {
            throw new IllegalStateException("No update available to download (state " + current.getState() + ")");
        }
        cancelFlag.set(false);
        String url = current.getDownloadUrl();
        Path target = downloadDir.resolve(ARTIFACT_NAME + platform.getArtifactExtension());
        transition(s -> s.toBuilder()
                .state(UpdateState.DOWNLOADING)
                .bytesDownloaded(0)
                .totalBytes(0)
                .downloadedFile(null)
                .message("Downloading " + s.getLatestVersion())
                .build());

        return CompletableFuture.supplyAsync(() -> {
            try {
                Path file = downloader.download(url, target, (done, total) ->
                        transition(s -> s.toBuilder().bytesDownloaded(done).totalBytes(total).build()), cancelFlag);
                return transition(s -> s.toBuilder()
                        .state(UpdateState.DOWNLOADED)
                        .downloadedFile(file.toString())
                        .message("Update downloaded, ready to install")
                        .build());
            } catch (CancellationException e) {
                logger.info("Update download cancelled");
                return transition(s -> s.toBuilder()
                        .state(UpdateState.UPDATE_AVAILABLE)
                        .bytesDownloaded(0)
                        .totalBytes(0)
                        .message("Download cancelled")
                        .build());
            } catch (IOException | RuntimeException e) {
                logger.error("Update download failed", e);
                return transition(s -> s.toBuilder()
                        .state(UpdateState.UPDATE_AVAILABLE)
                        .bytesDownloaded(0)
                        .totalBytes(0)
                        .message("Download failed: " + e.getMessage())
                        .build());
            }
        }, executor);
    }

    public UpdateStatus cancelDownload() {
        if (status.get().getState() == UpdateState.DOWNLOADING) {
            cancelFlag.set(true);
            logger.info("Update download cancellation requested");
        }
        return status.get();
    }

    /**
     * 启动安装辅助进程并退出应用，仅在 DOWNLOADED 状态可用
     */
    public synchronized UpdateStatus install() {
        UpdateStatus current = status.get();
        if (current.getState() != UpdateState.DOWNLOADED) {
            throw new IllegalStateException("Update is not downloaded (state " + current.getState() + ")");
        }
        transition(s -> s.toBuilder().state(UpdateState.INSTALLING).message("Installing update").build());
        try {
            Path target = resolveInstallTarget();
            List<String> relaunch = config.getUpdate().isRelaunch() ? relaunchCommand(target) : null;
            installer.install(Paths.get(current.getDownloadedFile()), target, relaunch);
        } catch (IOException | RuntimeException e) {
            logger.error("Update install failed", e);
            return transition(s -> s.toBuilder()
                    .state(UpdateState.FAILED)
                    .message("Install failed: " + e.getMessage())
                    .build());
        }
        UpdateStatus installing = transition(s -> s.toBuilder()
                .message("Update helper started, application will restart")
                .build());
        executor.submit(exitAction);
        return installing;
    }

    private Path resolveInstallTarget() throws IOException {
        String configured = config.getUpdate().getInstallTarget();
        if (StringUtils.hasText(configured)) {
            return Paths.get(configured);
        }
        try {
            Path location = Paths.get(UpdateService.class.getProtectionDomain().getCodeSource().getLocation().toURI());
            if (location.toString().endsWith(".jar")) {
                return location;
            }
        } catch (URISyntaxException | SecurityException e) {
            throw new IOException("Cannot determine install target", e);
        }
        throw new IOException("Install target is not configured (qms.update.install-target)");
    }

    private static List<String> relaunchCommand(Path target) {
        List<String> command = new ArrayList<>();
        if (target.toString().endsWith(".jar")) {
            command.add(ProcessHandle.current().info().command().orElse("java"));
            command.add("-jar");
        }
        command.add(target.toString());
        return command;
    }

    private static String buildNotes(CheckOutcome outcome) {
        UpdateInfo info = outcome.getInfo();
        if (!outcome.isUpdateAvailable()) {
            return "You are running the latest version";
        }
        if (StringUtils.hasText(info.getNotes())) {
            return info.getNotes();
        }
        return "New version available: " + info.getVersion()
                + "\nSize: ~" + info.getSizeMb() + "MB"
                + "\n\nRelease notes: " + info.getReleaseNotesUrl();
    }

    private UpdateStatus transition(UnaryOperator<UpdateStatus> change) {
        UpdateStatus next = status.updateAndGet(s -> change.apply(s).toBuilder().updatedAt(LocalDateTime.now()).build());
        if (next.getState() != UpdateState.DOWNLOADING || next.getBytesDownloaded() == 0) {
            logger.debug("Update state {}: {}", next.getState(), next.getMessage());
        }
        return next;
    }

    private void exitApplication() {
        logger.info("Exiting for update install");
        int code = applicationContext != null ? SpringApplication.exit(applicationContext, () -> 0) : 0;
        System.exit(code);
    }

    // Setters for wiring outside the container

    public void setConfig(QmsConfig config) {
        this.config = config;
    }

    public void setPlatform(PlatformFamily platform) {
        this.platform = platform;
    }

    public void setProcessLauncher(ProcessLauncher processLauncher) {
        this.processLauncher = processLauncher;
    }

    public void setDownloadDir(Path downloadDir) {
        this.downloadDir = downloadDir;
    }

    public void setExitAction(Runnable exitAction) {
        this.exitAction = exitAction;
    }
}
