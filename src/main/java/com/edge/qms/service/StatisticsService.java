package com.edge.qms.service;

import com.edge.qms.config.QmsConfig;
import com.edge.qms.core.statistics.AggregationEngine;
import com.edge.qms.core.statistics.AggregationResult;
import com.edge.qms.core.statistics.DescriptiveStatistics;
import com.edge.qms.model.*;
import com.edge.qms.repository.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 统计报表服务
 * <p>
 * 未指定日期范围时，每个模板只取最近 qms.report.lookback-limit 条记录，按时间正序参与统计。
 */
@Service
public class StatisticsService {
    private static final Logger logger = LoggerFactory.getLogger(StatisticsService.class);

    @Autowired
    private RecordStore store;

    @Autowired
    private StandardCatalogService catalogService;

    @Autowired
    private AggregationEngine aggregationEngine;

    @Autowired
    private QmsConfig config;

    /**
     * 模板下每个数值检验项的控制图统计，数据不足的检验项同样返回（chartable = false）
     */
    public List<AggregationResult> templateStatistics(String templateId, DateRange range) {
        List<Criterion> criteria = catalogService.resolveCriteria(templateId);
        List<InspectionRecord> records = loadRecords(templateId, range);

        List<AggregationResult> results = criteria.stream()
                .filter(Criterion::isNumeric)
                .map(c -> aggregationEngine.aggregate(c, records))
                .collect(Collectors.toList());

        logger.info("Template {} statistics: {} records, {} numeric criteria, {} chartable",
                templateId, records.size(), results.size(),
                results.stream().filter(AggregationResult::isChartable).count());
        return results;
    }

    public AggregationResult criterionStatistics(String templateId, String criterionCode, DateRange range) {
        Criterion criterion = catalogService.findCriterion(templateId, criterionCode)
                .orElseThrow(() -> new IllegalArgumentException("Criterion " + criterionCode
                        + " is not part of template " + templateId));
        return aggregationEngine.aggregate(criterion, loadRecords(templateId, range));
    }

    /**
     * 单条记录内 NUMERIC 检验项测量值的描述性统计
     */
    public Map<String, Object> recordDataStatistics(String recordId) {
        InspectionRecord record = store.findById(recordId)
                .orElseThrow(() -> new NoSuchElementException("Record not found: " + recordId));

        // BOOLEAN 项的 1.0 / 0.0 不是测量值
        List<Double> values = store.getItemsForRecord(recordId).stream()
                .filter(item -> catalogService.findCriterionInStandard(record.getStandardCode(), item.getCriterionCode())
                        .map(Criterion::isNumeric)
                        .orElse(false))
                .map(MeasurementItem::getNumericValue)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("recordId", record.getId());
        stats.put("recordNumber", record.getRecordNumber());
        stats.put("count", values.size());
        if (values.isEmpty()) {
            stats.put("message", "记录中没有数值测量项");
            return stats;
        }
        DescriptiveStatistics descriptive = DescriptiveStatistics.of(values);
        stats.put("mean", descriptive.getMean());
        stats.put("stddev", descriptive.getStddev());
        stats.put("min", descriptive.getMin());
        stats.put("max", descriptive.getMax());
        stats.put("range", descriptive.getRange());
        return stats;
    }

    private List<InspectionRecord> loadRecords(String templateId, DateRange range) {
        if (catalogService.getTemplate(templateId).isEmpty()) {
            throw new IllegalArgumentException("Template not found: " + templateId);
        }
        if (range != null && !range.isUnbounded()) {
            return store.getRecordsForTemplate(templateId, range);
        }
        List<InspectionRecord> all = store.getRecordsForTemplate(templateId, null);
        int limit = config.getReport().getLookbackLimit();
        if (limit > 0 && all.size() > limit) {
            return new ArrayList<>(all.subList(all.size() - limit, all.size()));
        }
        return all;
    }

    // Setters for wiring outside the container

    public void setStore(RecordStore store) {
        this.store = store;
    }

    public void setCatalogService(StandardCatalogService catalogService) {
        this.catalogService = catalogService;
    }

    public void setAggregationEngine(AggregationEngine aggregationEngine) {
        this.aggregationEngine = aggregationEngine;
    }

    public void setConfig(QmsConfig config) {
        this.config = config;
    }
}
