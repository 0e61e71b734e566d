package com.edge.qms.core.update;

/**
 * 自动更新状态
 * <p>
 * IDLE → CHECKING → {UP_TO_DATE, UPDATE_AVAILABLE} → DOWNLOADING → DOWNLOADED → INSTALLING → 进程退出。
 * 检查失败回到 IDLE；安装在启动辅助进程前失败则进入 FAILED。
 */
public enum UpdateState {
    IDLE,
    CHECKING,
    UP_TO_DATE,
    UPDATE_AVAILABLE,
    DOWNLOADING,
    DOWNLOADED,
    INSTALLING,
    FAILED;

    public boolean isBusy() {
        return this == CHECKING || this == DOWNLOADING || this == INSTALLING;
    }
}
