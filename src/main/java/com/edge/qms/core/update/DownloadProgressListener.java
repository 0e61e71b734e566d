package com.edge.qms.core.update;

/**
 * 下载进度回调，每写入一块调用一次；totalBytes 为 0 表示总大小未知
 */
@FunctionalInterface
public interface DownloadProgressListener {
    void onProgress(long bytesSoFar, long totalBytes);
}
