package com.edge.qms.config;

import com.edge.qms.core.statistics.AggregationEngine;
import com.edge.qms.core.summary.RecordSummaryCalculator;
import com.edge.qms.repository.JsonlRecordStore;
import com.edge.qms.repository.NonConformanceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 存储与计算组件装配
 * <p>
 * 数据目录由 qms.system.data-dir 指定，存储句柄显式创建并随容器关闭释放。
 */
@Configuration
public class StoreConfig {
    private static final Logger logger = LoggerFactory.getLogger(StoreConfig.class);

    @Bean(initMethod = "open", destroyMethod = "close")
    public JsonlRecordStore recordStore(QmsConfig config) {
        Path dataDir = dataDir(config);
        logger.info("Using data directory: {}", dataDir.toAbsolutePath());
        return new JsonlRecordStore(dataDir);
    }

    @Bean(initMethod = "load")
    public NonConformanceRepository nonConformanceRepository(QmsConfig config) {
        return new NonConformanceRepository(dataDir(config));
    }

    @Bean
    public RecordSummaryCalculator recordSummaryCalculator(QmsConfig config) {
        return new RecordSummaryCalculator(config.getReport().getScorePrecision());
    }

    @Bean
    public AggregationEngine aggregationEngine(QmsConfig config) {
        QmsConfig.ReportConfig report = config.getReport();
        return new AggregationEngine(report.getSigmaMultiplier(), report.getMovingRangeD4());
    }

    static Path dataDir(QmsConfig config) {
        return Paths.get(config.getSystem().getDataDir());
    }
}
