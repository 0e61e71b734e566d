package com.edge.qms.core.update;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 流式下载更新包
 * <p>
 * 每 8192 字节回调一次进度。取消、非 2xx、IO 错误都会删除不完整的文件，
 * 只有完整下载的文件才会留在目标路径。
 */
public class UpdateDownloader {
    private static final Logger logger = LoggerFactory.getLogger(UpdateDownloader.class);

    private static final int CHUNK_SIZE = 8192;

    private final OkHttpClient httpClient;

    public UpdateDownloader(OkHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    /**
     * @param cancelFlag 置为 true 时在下一块写入前中止
     * @return 下载完成的文件
     * @throws CancellationException 下载被取消
     * @throws IOException           网络或文件错误
     */
    public Path download(String url, Path target, DownloadProgressListener listener, AtomicBoolean cancelFlag)
            throws IOException {
        if (url == null || url.trim().isEmpty()) {
            throw new IOException("No download URL for this platform");
        }
        Request request = new Request.Builder().url(url).get().build();
        boolean complete = false;
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("Download failed with code: " + response.code());
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new IOException("Download returned an empty body");
            }
            long total = Math.max(body.contentLength(), 0);
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }

            long downloaded = 0;
            byte[] buffer = new byte[CHUNK_SIZE];
            try (InputStream in = body.byteStream(); OutputStream out = Files.newOutputStream(target)) {
                int read;
                while ((read = in.read(buffer)) != -1) {
                    if (cancelFlag != null && cancelFlag.get()) {
                        throw new CancellationException("Download cancelled");
                    }
                    out.write(buffer, 0, read);
                    downloaded += read;
                    if (listener != null) {
                        listener.onProgress(downloaded, total);
                    }
                }
            }
            if (cancelFlag != null && cancelFlag.get()) {
                throw new CancellationException("Download cancelled");
            }
            complete = true;
            logger.info("Downloaded {} bytes to {}", downloaded, target);
            return target;
        } finally {
            if (!complete) {
                deletePartial(target);
            }
        }
    }

    private static void deletePartial(Path target) {
        try {
            if (Files.deleteIfExists(target)) {
                logger.info("Deleted partial download {}", target);
            }
        } catch (IOException e) {
            logger.warn("Failed to delete partial download {}: {}", target, e.getMessage());
        }
    }
}
