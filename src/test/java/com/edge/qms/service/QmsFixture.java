package com.edge.qms.service;

import com.edge.qms.config.QmsConfig;
import com.edge.qms.core.compliance.ComplianceEvaluator;
import com.edge.qms.core.statistics.AggregationEngine;
import com.edge.qms.core.summary.RecordSummaryCalculator;
import com.edge.qms.model.*;
import com.edge.qms.repository.JsonlRecordStore;
import com.edge.qms.repository.NonConformanceRepository;

import java.nio.file.Path;
import java.util.List;

/**
 * 基于临时目录装配的服务组合，事件同步投递给 NonConformanceService
 */
class QmsFixture implements AutoCloseable {

    static final String TEMPLATE_ID = "T-001";

    final QmsConfig config = new QmsConfig();
    final JsonlRecordStore store;
    final NonConformanceRepository ncRepository;
    final StandardCatalogService catalogService = new StandardCatalogService();
    final RecordService recordService = new RecordService();
    final NonConformanceService nonConformanceService = new NonConformanceService();
    final StatisticsService statisticsService = new StatisticsService();
    final ReportService reportService = new ReportService();

    QmsFixture(Path dataDir) {
        config.getSystem().setDataDir(dataDir.toString());

        store = new JsonlRecordStore(dataDir);
        store.open();
        ncRepository = new NonConformanceRepository(dataDir);
        ncRepository.load();

        catalogService.setConfig(config);
        catalogService.setStore(store);
        catalogService.init();

        nonConformanceService.setRepository(ncRepository);
        nonConformanceService.setCatalogService(catalogService);
        nonConformanceService.setConfig(config);

        recordService.setStore(store);
        recordService.setCatalogService(catalogService);
        recordService.setEvaluator(new ComplianceEvaluator());
        recordService.setSummaryCalculator(new RecordSummaryCalculator());
        recordService.setEventPublisher(event -> {
            if (event instanceof com.edge.qms.event.RecordFinalizedEvent) {
                nonConformanceService.onApplicationEvent((com.edge.qms.event.RecordFinalizedEvent) event);
            }
        });

        statisticsService.setStore(store);
        statisticsService.setCatalogService(catalogService);
        statisticsService.setAggregationEngine(new AggregationEngine());
        statisticsService.setConfig(config);

        reportService.setStore(store);
        reportService.setCatalogService(catalogService);
        reportService.setNonConformanceService(nonConformanceService);
    }

    /**
     * 标准 ISO-2859：DIM-001 数值 [99.5, 100.5]，VIS-001 单选，NOTE 文本，SEAL-001 布尔；模板 T-001 依次引用四项
     */
    QmsFixture withDefaultCatalog() {
        catalogService.saveStandard(Standard.builder()
                .code("ISO-2859")
                .name("来料尺寸检验")
                .version("1.0")
                .active(true)
                .criteria(List.of(
                        Criterion.builder().code("DIM-001").title("外径").dataType(DataType.NUMERIC)
                                .lowerLimit(99.5).upperLimit(100.5).unit("mm").severity(Severity.CRITICAL)
                                .sortOrder(1).build(),
                        Criterion.builder().code("VIS-001").title("外观").dataType(DataType.SELECT)
                                .options(List.of("Good", "Scratched")).acceptableOptions(List.of("Good"))
                                .severity(Severity.MINOR).sortOrder(2).build(),
                        Criterion.builder().code("NOTE").title("备注").dataType(DataType.TEXT).sortOrder(3).build(),
                        Criterion.builder().code("SEAL-001").title("密封完好").dataType(DataType.BOOLEAN)
                                .severity(Severity.MAJOR).sortOrder(4).build()))
                .build());
        catalogService.saveTemplate(InspectionTemplate.builder()
                .id(TEMPLATE_ID)
                .code("IQC-01")
                .name("来料检验")
                .standardCode("ISO-2859")
                .category("IQC")
                .criterionCodes(List.of("DIM-001", "VIS-001", "NOTE", "SEAL-001"))
                .active(true)
                .build());
        return this;
    }

    InspectionRecord recordWithDiameter(String value) {
        InspectionRecord record = recordService.createRecord(TEMPLATE_ID, null, "B1", "QA", "tester");
        return recordService.recordMeasurement(record.getId(), "DIM-001", value, "tester", null, null);
    }

    @Override
    public void close() {
        store.close();
    }
}
