package com.edge.qms.core.update;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * 更新状态快照，每次状态变化生成新对象
 */
@Value
@Builder(toBuilder = true)
public class UpdateStatus {
    UpdateState state;
    String currentVersion;
    String latestVersion;
    String downloadUrl;
    String releaseNotesUrl;
    String notes;
    double sizeMb;
    long bytesDownloaded;
    long totalBytes;
    String downloadedFile;
    String message;
    LocalDateTime updatedAt;

    /**
     * 下载百分比，总大小未知时为 null
     */
    public Double getProgressPercent() {
        if (totalBytes <= 0) {
            return null;
        }
        return Math.min(100.0, bytesDownloaded * 100.0 / totalBytes);
    }

    public static UpdateStatus idle(String currentVersion) {
        return UpdateStatus.builder()
                .state(UpdateState.IDLE)
                .currentVersion(currentVersion)
                .updatedAt(LocalDateTime.now())
                .build();
    }
}
