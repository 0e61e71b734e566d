package com.edge.qms.service;

import com.edge.qms.config.QmsConfig;
import com.edge.qms.event.RecordFinalizedEvent;
import com.edge.qms.model.*;
import com.edge.qms.repository.NonConformanceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 不合格项（NC）服务
 * <p>
 * 记录审批通过或关闭时，为每个 FAIL 测量项自动创建 NC（qms.non-conformance.auto-raise）。
 * 同一记录同一检验项只创建一次。
 */
@Service
public class NonConformanceService implements ApplicationListener<RecordFinalizedEvent> {
    private static final Logger logger = LoggerFactory.getLogger(NonConformanceService.class);

    @Autowired
    private NonConformanceRepository repository;

    @Autowired
    private StandardCatalogService catalogService;

    @Autowired
    private QmsConfig config;

    @Override
    public void onApplicationEvent(RecordFinalizedEvent event) {
        InspectionRecord record = event.getRecord();
        if (!config.getNonConformance().isAutoRaise()) {
            return;
        }
        if (record.getStatus() != RecordStatus.APPROVED && record.getStatus() != RecordStatus.CLOSED) {
            return;
        }

        int raised = 0;
        for (MeasurementItem item : record.getItems()) {
            if (item.getCompliance() != Compliance.FAIL || hasNonConformance(record.getId(), item.getCriterionCode())) {
                continue;
            }
            Optional<Criterion> criterion = catalogService.findCriterionInStandard(
                    record.getStandardCode(), item.getCriterionCode());
            String title = criterion.map(Criterion::getTitle).filter(StringUtils::hasText)
                    .orElse(item.getCriterionCode());
            Severity severity = criterion.map(Criterion::getSeverity).orElse(Severity.MAJOR);

            String description = "记录 " + record.label() + " 检验项 " + item.getCriterionCode()
                    + " 不合格，测量值: " + item.getRawValue()
                    + (item.getDeviation() != null ? "，偏差: " + item.getDeviation() : "");
            createNonConformance(record.getId(), item.getCriterionCode(), title, description, severity, null);
            raised++;
        }
        if (raised > 0) {
            logger.info("Auto-raised {} non-conformances for record {}", raised, record.label());
        }
    }

    /**
     * 新建 NC，状态 OPEN，未指定目标关闭日期时取检出时间 + default-closure-days
     */
    public synchronized NonConformance createNonConformance(String recordId, String criterionCode, String title,
                                                           String description, Severity severity,
                                                           LocalDateTime targetClosureDate) {
        if (!StringUtils.hasText(title)) {
            throw new IllegalArgumentException("Non-conformance title is required");
        }
        LocalDateTime now = LocalDateTime.now();
        NonConformance nc = NonConformance.builder()
                .ncNumber(nextNumber(now.getYear()))
                .recordId(recordId)
                .criterionCode(criterionCode)
                .title(title)
                .description(description)
                .severity(severity != null ? severity : Severity.MAJOR)
                .status(NonConformanceStatus.OPEN)
                .detectedAt(now)
                .targetClosureDate(targetClosureDate != null ? targetClosureDate
                        : now.plusDays(config.getNonConformance().getDefaultClosureDays()))
                .build();
        NonConformance saved = repository.save(nc);
        logger.info("Non-conformance {} opened: {}", saved.getNcNumber(), title);
        return saved;
    }

    /**
     * 更新 NC 状态，关闭时写入关闭时间；已关闭的 NC 不能再修改
     */
    public synchronized NonConformance updateStatus(String id, NonConformanceStatus status,
                                                    String rootCause, String correctiveAction) {
        if (status == null) {
            throw new IllegalArgumentException("Status is required");
        }
        NonConformance nc = requireNonConformance(id);
        if (nc.getStatus() == NonConformanceStatus.CLOSED) {
            throw new IllegalStateException("Non-conformance " + nc.getNcNumber() + " is already closed");
        }
        NonConformance updated = nc.toBuilder()
                .status(status)
                .rootCause(StringUtils.hasText(rootCause) ? rootCause : nc.getRootCause())
                .correctiveAction(StringUtils.hasText(correctiveAction) ? correctiveAction : nc.getCorrectiveAction())
                .closedAt(status == NonConformanceStatus.CLOSED ? LocalDateTime.now() : null)
                .build();
        repository.save(updated);
        logger.info("Non-conformance {} status {} -> {}", nc.getNcNumber(), nc.getStatus(), status);
        return updated;
    }

    public NonConformance close(String id, String rootCause, String correctiveAction) {
        return updateStatus(id, NonConformanceStatus.CLOSED, rootCause, correctiveAction);
    }

    public Optional<NonConformance> getNonConformance(String id) {
        return repository.findById(id);
    }

    /**
     * 按检出时间倒序，status / recordId 为 null 时不过滤
     */
    public List<NonConformance> listNonConformances(NonConformanceStatus status, String recordId) {
        List<NonConformance> source = recordId != null ? repository.findByRecordId(recordId) : repository.findAll();
        return source.stream()
                .filter(nc -> status == null || status == nc.getStatus())
                .sorted(Comparator.comparing(NonConformance::getDetectedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .collect(Collectors.toList());
    }

    public synchronized void deleteNonConformance(String id) {
        NonConformance nc = requireNonConformance(id);
        repository.delete(id);
        logger.info("Non-conformance {} deleted", nc.getNcNumber());
    }

    private boolean hasNonConformance(String recordId, String criterionCode) {
        return repository.findByRecordId(recordId).stream()
                .anyMatch(nc -> criterionCode.equals(nc.getCriterionCode()));
    }

    private String nextNumber(int year) {
        return String.format("NC-%d-%03d", year, repository.maxSequenceForYear(year) + 1);
    }

    private NonConformance requireNonConformance(String id) {
        return repository.findById(id)
                .orElseThrow(() -> new NoSuchElementException("Non-conformance not found: " + id));
    }

    public List<NonConformance> findAll() {
        return new ArrayList<>(repository.findAll());
    }

    // Setters for wiring outside the container

    public void setRepository(NonConformanceRepository repository) {
        this.repository = repository;
    }

    public void setCatalogService(StandardCatalogService catalogService) {
        this.catalogService = catalogService;
    }

    public void setConfig(QmsConfig config) {
        this.config = config;
    }
}
