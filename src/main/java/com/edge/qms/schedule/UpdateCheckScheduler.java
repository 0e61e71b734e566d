package com.edge.qms.schedule;

import com.edge.qms.config.QmsConfig;
import com.edge.qms.service.UpdateService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * 定时检查更新
 * 默认每天 09:00 执行，需开启 qms.update.auto-check 并配置版本信息地址
 */
@Component
public class UpdateCheckScheduler {

    private static final Logger logger = LoggerFactory.getLogger(UpdateCheckScheduler.class);

    @Autowired
    private QmsConfig config;

    @Autowired
    private UpdateService updateService;

    /**
     * cron表达式: 秒 分 时 日 月 周
     */
    @Scheduled(cron = "${qms.update.check-cron:0 0 9 * * ?}")
    public void checkForUpdates() {
        if (!config.getUpdate().isAutoCheck()) {
            return;
        }
        if (!StringUtils.hasText(config.getUpdate().getMetadataUrl())) {
            logger.debug("Update metadata URL not configured, skip scheduled check");
            return;
        }
        try {
            updateService.checkForUpdates();
            logger.info("Scheduled update check started");
        } catch (IllegalStateException e) {
            logger.info("Skip scheduled update check: {}", e.getMessage());
        }
    }
}
