package com.edge.qms.service;

import com.edge.qms.core.compliance.ComplianceEvaluator;
import com.edge.qms.core.compliance.Evaluation;
import com.edge.qms.core.summary.RecordSummary;
import com.edge.qms.core.summary.RecordSummaryCalculator;
import com.edge.qms.event.RecordFinalizedEvent;
import com.edge.qms.model.*;
import com.edge.qms.repository.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.*;
import java.util.stream.Collectors;

/**
 * 检验记录服务
 * <p>
 * 测量项每次变化都会重新计算记录汇总（合格率、总体结论、不合格数），
 * 派生字段只在这里写入。终审后的记录只能通过 correctMeasurement 修改。
 */
@Service
public class RecordService {
    private static final Logger logger = LoggerFactory.getLogger(RecordService.class);

    private static final DateTimeFormatter NUMBER_FORMAT = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    private static final Map<RecordStatus, Set<RecordStatus>> TRANSITIONS = new EnumMap<>(RecordStatus.class);

    static {
        TRANSITIONS.put(RecordStatus.DRAFT, EnumSet.of(RecordStatus.SUBMITTED));
        TRANSITIONS.put(RecordStatus.SUBMITTED, EnumSet.of(RecordStatus.DRAFT, RecordStatus.UNDER_REVIEW,
                RecordStatus.APPROVED, RecordStatus.REJECTED));
        TRANSITIONS.put(RecordStatus.UNDER_REVIEW, EnumSet.of(RecordStatus.APPROVED, RecordStatus.REJECTED));
        TRANSITIONS.put(RecordStatus.APPROVED, EnumSet.of(RecordStatus.CLOSED));
        TRANSITIONS.put(RecordStatus.REJECTED, EnumSet.of(RecordStatus.DRAFT, RecordStatus.CLOSED));
        TRANSITIONS.put(RecordStatus.CLOSED, EnumSet.noneOf(RecordStatus.class));
    }

    @Autowired
    private RecordStore store;

    @Autowired
    private StandardCatalogService catalogService;

    @Autowired
    private ComplianceEvaluator evaluator;

    @Autowired
    private RecordSummaryCalculator summaryCalculator;

    @Autowired
    private ApplicationEventPublisher eventPublisher;

    private String lastNumberBase;
    private int lastNumberSuffix;

    /**
     * 按模板新建记录，状态为 DRAFT
     */
    public InspectionRecord createRecord(String templateId, String title, String batchNumber,
                                         String department, String createdBy) {
        InspectionTemplate template = catalogService.getTemplate(templateId)
                .orElseThrow(() -> new IllegalArgumentException("Template not found: " + templateId));

        LocalDateTime now = LocalDateTime.now();
        InspectionRecord record = InspectionRecord.builder()
                .id(UUID.randomUUID().toString())
                .recordNumber(nextRecordNumber(now))
                .templateId(template.getId())
                .standardCode(template.getStandardCode())
                .title(StringUtils.hasText(title) ? title : template.getName())
                .category(template.getCategory())
                .status(RecordStatus.DRAFT)
                .batchNumber(batchNumber)
                .department(department)
                .createdBy(createdBy)
                .createdAt(now)
                .items(List.of())
                .complianceScore(0.0)
                .build();

        InspectionRecord saved = store.insert(record);
        logger.info("Created record {} for template {}", saved.getRecordNumber(), templateId);
        return saved;
    }

    /**
     * 录入测量值：判定合格性，替换同一检验项已有的测量项（没有则追加），然后重算汇总
     *
     * @param override 人工判定结果，null 表示自动判定
     */
    public synchronized InspectionRecord recordMeasurement(String recordId, String criterionCode, String rawValue,
                                                           String operator, Boolean override, String remarks) {
        InspectionRecord record = requireRecord(recordId);
        if (record.getStatus() != null && record.getStatus().isFinalized()) {
            throw new IllegalStateException("Record " + record.label() + " is " + record.getStatus()
                    + ", use the correction path to change measurements");
        }
        Criterion criterion = requireCriterion(record, criterionCode);
        Evaluation evaluation = evaluator.evaluate(criterion, rawValue, override);

        MeasurementItem item = MeasurementItem.builder()
                .criterionCode(criterionCode)
                .rawValue(rawValue)
                .numericValue(evaluation.getParsedValue())
                .compliance(evaluation.getCompliance())
                .deviation(evaluation.getDeviation())
                .measuredAt(LocalDateTime.now())
                .measuredBy(operator)
                .remarks(remarks)
                .build();

        InspectionRecord updated = applyItems(record, replaceOrAppend(record.getItems(), item));
        logger.debug("Record {} criterion {} = '{}' -> {}", record.label(), criterionCode, rawValue,
                evaluation.getCompliance());
        return updated;
    }

    /**
     * 更正已录入的测量值，必须给出原因，测量项标记为已更正
     */
    public synchronized InspectionRecord correctMeasurement(String recordId, String criterionCode, String rawValue,
                                                            String operator, Boolean override, String reason) {
        if (!StringUtils.hasText(reason)) {
            throw new IllegalArgumentException("Correction reason is required");
        }
        InspectionRecord record = requireRecord(recordId);
        MeasurementItem existing = record.getItems().stream()
                .filter(i -> criterionCode.equals(i.getCriterionCode()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No measurement for criterion " + criterionCode
                        + " in record " + record.label()));

        Criterion criterion = requireCriterion(record, criterionCode);
        Evaluation evaluation = evaluator.evaluate(criterion, rawValue, override);

        MeasurementItem corrected = existing.toBuilder()
                .rawValue(rawValue)
                .numericValue(evaluation.getParsedValue())
                .compliance(evaluation.getCompliance())
                .deviation(evaluation.getDeviation())
                .measuredAt(LocalDateTime.now())
                .measuredBy(operator)
                .corrected(true)
                .correctionReason(reason)
                .build();

        InspectionRecord updated = applyItems(record, replaceOrAppend(record.getItems(), corrected));
        logger.info("Record {} criterion {} corrected from '{}' to '{}': {}", record.label(), criterionCode,
                existing.getRawValue(), rawValue, reason);
        return updated;
    }

    /**
     * 变更记录状态，进入终审状态时写入完成时间并发布 RecordFinalizedEvent
     */
    public InspectionRecord changeStatus(String recordId, RecordStatus newStatus) {
        if (newStatus == null) {
            throw new IllegalArgumentException("Status is required");
        }
        InspectionRecord updated;
        RecordStatus previous;
        synchronized (this) {
            InspectionRecord record = requireRecord(recordId);
            previous = record.getStatus() != null ? record.getStatus() : RecordStatus.DRAFT;
            if (!TRANSITIONS.get(previous).contains(newStatus)) {
                throw new IllegalStateException("Cannot change record " + record.label()
                        + " from " + previous + " to " + newStatus);
            }
            InspectionRecord.InspectionRecordBuilder builder = record.toBuilder().status(newStatus);
            if (newStatus.isFinalized() && record.getCompletedAt() == null) {
                builder.completedAt(LocalDateTime.now());
            } else if (!newStatus.isFinalized()) {
                builder.completedAt(null);
            }
            updated = builder.build();
            store.update(updated);
        }
        logger.info("Record {} status {} -> {}", updated.label(), previous, newStatus);

        if (newStatus.isFinalized()) {
            eventPublisher.publishEvent(new RecordFinalizedEvent(this, updated, previous));
        }
        return updated;
    }

    public Optional<InspectionRecord> getRecord(String recordId) {
        return store.findById(recordId);
    }

    /**
     * 查询记录，按创建时间倒序
     */
    public List<InspectionRecord> queryRecords(DateRange range, String templateId, RecordStatus status, Integer limit) {
        List<InspectionRecord> results = templateId != null
                ? store.getRecordsForTemplate(templateId, range)
                : store.findAll(range);

        List<InspectionRecord> filtered = results.stream()
                .filter(r -> status == null || status == r.getStatus())
                .sorted(Comparator.comparing(InspectionRecord::getCreatedAt,
                        Comparator.nullsFirst(Comparator.naturalOrder())).reversed())
                .collect(Collectors.toList());

        if (limit != null && limit > 0 && filtered.size() > limit) {
            return filtered.subList(0, limit);
        }
        return filtered;
    }

    public synchronized void deleteRecord(String recordId) {
        InspectionRecord record = requireRecord(recordId);
        store.delete(recordId);
        logger.info("Deleted record {}", record.label());
    }

    public long countRecords() {
        return store.count();
    }

    private InspectionRecord applyItems(InspectionRecord record, List<MeasurementItem> items) {
        RecordSummary summary = summaryCalculator.recompute(items);
        InspectionRecord updated = record.toBuilder()
                .items(items)
                .complianceScore(summary.getComplianceScore())
                .overallCompliance(summary.getOverallCompliance())
                .failedItemsCount(summary.getFailedCount())
                .build();
        store.update(updated);
        return updated;
    }

    private static List<MeasurementItem> replaceOrAppend(List<MeasurementItem> items, MeasurementItem item) {
        List<MeasurementItem> result = new ArrayList<>(items);
        for (int i = 0; i < result.size(); i++) {
            if (item.getCriterionCode().equals(result.get(i).getCriterionCode())) {
                result.set(i, item);
                return result;
            }
        }
        result.add(item);
        return result;
    }

    private InspectionRecord requireRecord(String recordId) {
        return store.findById(recordId)
                .orElseThrow(() -> new NoSuchElementException("Record not found: " + recordId));
    }

    private Criterion requireCriterion(InspectionRecord record, String criterionCode) {
        return catalogService.findCriterion(record.getTemplateId(), criterionCode)
                .orElseThrow(() -> new IllegalArgumentException("Criterion " + criterionCode
                        + " is not part of template " + record.getTemplateId()));
    }

    private synchronized String nextRecordNumber(LocalDateTime now) {
        String base = "REC-" + now.format(NUMBER_FORMAT);
        if (base.equals(lastNumberBase)) {
            lastNumberSuffix++;
            return base + "-" + lastNumberSuffix;
        }
        lastNumberBase = base;
        lastNumberSuffix = 0;
        return base;
    }

    // Setters for wiring outside the container

    public void setStore(RecordStore store) {
        this.store = store;
    }

    public void setCatalogService(StandardCatalogService catalogService) {
        this.catalogService = catalogService;
    }

    public void setEvaluator(ComplianceEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    public void setSummaryCalculator(RecordSummaryCalculator summaryCalculator) {
        this.summaryCalculator = summaryCalculator;
    }

    public void setEventPublisher(ApplicationEventPublisher eventPublisher) {
        this.eventPublisher = eventPublisher;
    }
}
