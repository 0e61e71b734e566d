package com.edge.qms.core.update;

import lombok.Value;

/**
 * 一次版本检查的结果，失败时 info 为 null、message 为原因
 */
@Value
public class CheckOutcome {
    boolean success;
    boolean updateAvailable;
    UpdateInfo info;
    String message;

    public static CheckOutcome available(UpdateInfo info) {
        return new CheckOutcome(true, true, info, "New version available: " + info.getVersion());
    }

    public static CheckOutcome upToDate(UpdateInfo info) {
        return new CheckOutcome(true, false, info, "You are running the latest version");
    }

    public static CheckOutcome failed(String reason) {
        return new CheckOutcome(false, false, null, reason);
    }
}
