package com.edge.qms.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "qms")
public class QmsConfig {
    private SystemConfig system = new SystemConfig();
    private ReportConfig report = new ReportConfig();
    private UpdateConfig update = new UpdateConfig();
    private NonConformanceConfig nonConformance = new NonConformanceConfig();

    @Data
    public static class SystemConfig {
        private String dataDir = "data";
    }

    @Data
    public static class ReportConfig {
        // 未指定日期范围时，每个模板取最近的记录数
        private int lookbackLimit = 100;
        // 合格率小数位
        private int scorePrecision = 2;
        private double sigmaMultiplier = 3.0;
        // 移动极差图 D4 常数（子组大小 2）
        private double movingRangeD4 = 3.267;
    }

    @Data
    public static class UpdateConfig {
        private String currentVersion = "1.0.4";
        private String metadataUrl;          // 可选的版本信息地址
        private int timeout = 5;             // 版本检查超时（秒）
        private int downloadTimeout = 30;    // 下载读超时（秒）
        private boolean autoCheck = false;
        private String checkCron = "0 0 9 * * ?";
        private String installTarget;        // 被替换的可执行文件，缺省为当前进程命令
        private boolean relaunch = true;
        private long pollIntervalMs = 500;
    }

    @Data
    public static class NonConformanceConfig {
        // 记录终审后为不合格项自动创建 NC
        private boolean autoRaise = true;
        private int defaultClosureDays = 30;
    }
}
