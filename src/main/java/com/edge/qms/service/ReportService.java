package com.edge.qms.service;

import com.edge.qms.model.*;
import com.edge.qms.repository.RecordStore;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.WeekFields;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 分析报表
 * <p>
 * 百分比与平均分统一保留 2 位小数。合格率 = 合格记录 / (合格 + 不合格) * 100，
 * 尚无结论的记录计入 pending，不参与合格率。
 */
@Service
public class ReportService {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ISO_LOCAL_DATE;
    private static final DateTimeFormatter MINUTE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final DateTimeFormatter MONTH = DateTimeFormatter.ofPattern("yyyy-MM");
    private static final WeekFields MONDAY_WEEKS = WeekFields.of(DayOfWeek.MONDAY, 7);
    private static final int DASHBOARD_DAYS = 30;
    private static final int RECENT_RECORDS = 5;

    @Autowired
    private RecordStore store;

    @Autowired
    private StandardCatalogService catalogService;

    @Autowired
    private NonConformanceService nonConformanceService;

    /**
     * 合格率汇总
     *
     * @param department 可选，按部门过滤
     */
    public Map<String, Object> complianceSummary(DateRange range, String department) {
        List<InspectionRecord> records = store.findAll(range).stream()
                .filter(r -> department == null || department.equals(r.getDepartment()))
                .collect(Collectors.toList());

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("totalRecords", records.size());
        if (records.isEmpty()) {
            report.put("message", "No records found for the specified criteria");
            return report;
        }

        long passed = records.stream().filter(r -> Boolean.TRUE.equals(r.getOverallCompliance())).count();
        long failed = records.stream().filter(r -> Boolean.FALSE.equals(r.getOverallCompliance())).count();
        long pending = records.size() - passed - failed;

        Map<String, Long> statusBreakdown = new LinkedHashMap<>();
        Map<String, Long> categoryBreakdown = new LinkedHashMap<>();
        for (InspectionRecord record : records) {
            statusBreakdown.merge(String.valueOf(record.getStatus()), 1L, Long::sum);
            categoryBreakdown.merge(record.getCategory() != null ? record.getCategory() : "Unknown", 1L, Long::sum);
        }

        report.put("passed", passed);
        report.put("failed", failed);
        report.put("pending", pending);
        report.put("passRate", percentage(passed, passed + failed));
        report.put("averageScore", averageScore(records));
        report.put("statusBreakdown", statusBreakdown);
        report.put("categoryBreakdown", categoryBreakdown);

        Map<String, String> dateRange = new LinkedHashMap<>();
        dateRange.put("start", range != null && range.getStart() != null ? range.getStart().format(DATE) : "All time");
        dateRange.put("end", range != null && range.getEnd() != null ? range.getEnd().format(DATE) : "Present");
        report.put("dateRange", dateRange);
        return report;
    }

    /**
     * 按 FAIL 次数排序的检验项
     */
    public List<Map<String, Object>> criteriaFailureReport(int topN) {
        Map<String, Long> failures = new HashMap<>();
        Map<String, String> standardOf = new HashMap<>();
        for (InspectionRecord record : store.findAll(null)) {
            for (MeasurementItem item : record.getItems()) {
                if (item.getCompliance() == Compliance.FAIL) {
                    String key = record.getStandardCode() + "/" + item.getCriterionCode();
                    failures.merge(key, 1L, Long::sum);
                    standardOf.put(key, record.getStandardCode());
                }
            }
        }

        return failures.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(topN > 0 ? topN : Long.MAX_VALUE)
                .map(e -> {
                    String standardCode = standardOf.get(e.getKey());
                    String code = e.getKey().substring(e.getKey().indexOf('/') + 1);
                    Optional<Criterion> criterion = catalogService.findCriterionInStandard(standardCode, code);
                    Map<String, Object> row = new LinkedHashMap<>();
                    row.put("standardCode", standardCode);
                    row.put("code", code);
                    row.put("title", criterion.map(Criterion::getTitle).orElse(null));
                    row.put("severity", criterion.map(Criterion::getSeverity).orElse(null));
                    row.put("failureCount", e.getValue());
                    return row;
                })
                .collect(Collectors.toList());
    }

    /**
     * 每个模板的使用次数和平均合格率，按使用次数倒序
     */
    public List<Map<String, Object>> templateUsageReport() {
        Map<String, List<InspectionRecord>> byTemplate = store.findAll(null).stream()
                .filter(r -> r.getTemplateId() != null)
                .collect(Collectors.groupingBy(InspectionRecord::getTemplateId));

        List<Map<String, Object>> rows = new ArrayList<>();
        for (InspectionTemplate template : catalogService.listTemplates()) {
            List<InspectionRecord> records = byTemplate.getOrDefault(template.getId(), List.of());
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("templateId", template.getId());
            row.put("code", template.getCode());
            row.put("name", template.getName());
            row.put("category", template.getCategory());
            row.put("usageCount", records.size());
            row.put("avgScore", averageScore(records));
            rows.add(row);
        }
        rows.sort(Comparator.comparing((Map<String, Object> row) -> (Integer) row.get("usageCount")).reversed());
        return rows;
    }

    /**
     * 合格率趋势，按 day / week / month / year 分组，返回最近 limit 个周期（时间正序）
     * <p>
     * 周编号以周一为一周开始，每年第一个周一之前的日期属于第 00 周。
     * 此处合格率 = 合格记录 / 该周期记录总数 * 100。
     */
    public Map<String, Object> trendAnalysis(String period, int limit) {
        String periodType = period != null ? period.toLowerCase(Locale.ROOT) : "month";
        Function<LocalDateTime, String> grouping = periodGrouping(periodType);

        TreeMap<String, List<InspectionRecord>> byPeriod = store.findAll(null).stream()
                .filter(r -> r.getCreatedAt() != null)
                .collect(Collectors.groupingBy(r -> grouping.apply(r.getCreatedAt()), TreeMap::new,
                        Collectors.toList()));

        List<Map<String, Object>> data = new ArrayList<>();
        for (Map.Entry<String, List<InspectionRecord>> entry : byPeriod.entrySet()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("period", entry.getKey());
            putPerformance(row, "total", entry.getValue());
            data.add(row);
        }
        if (limit > 0 && data.size() > limit) {
            data = new ArrayList<>(data.subList(data.size() - limit, data.size()));
        }

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("periodType", periodType);
        report.put("data", data);
        return report;
    }

    private static Function<LocalDateTime, String> periodGrouping(String periodType) {
        switch (periodType) {
            case "day":
                return t -> t.toLocalDate().format(DATE);
            case "week":
                return t -> String.format("%d-W%02d", t.getYear(), t.get(MONDAY_WEEKS.weekOfYear()));
            case "month":
                return t -> t.format(MONTH);
            case "year":
                return t -> String.valueOf(t.getYear());
            default:
                throw new IllegalArgumentException("Unsupported trend period: " + periodType
                        + " (expected day, week, month or year)");
        }
    }

    /**
     * 检验员绩效，按 createdBy 分组，按检验次数倒序；未记录检验员的记录不计入
     */
    public List<Map<String, Object>> inspectorPerformance(DateRange range) {
        Map<String, List<InspectionRecord>> byInspector = store.findAll(range).stream()
                .filter(r -> StringUtils.hasText(r.getCreatedBy()))
                .collect(Collectors.groupingBy(InspectionRecord::getCreatedBy, TreeMap::new, Collectors.toList()));

        List<Map<String, Object>> rows = new ArrayList<>();
        for (Map.Entry<String, List<InspectionRecord>> entry : byInspector.entrySet()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("inspector", entry.getKey());
            row.put("department", entry.getValue().stream()
                    .map(InspectionRecord::getDepartment)
                    .filter(Objects::nonNull)
                    .findFirst()
                    .orElse(null));
            putPerformance(row, "totalInspections", entry.getValue());
            rows.add(row);
        }
        rows.sort(Comparator.comparing((Map<String, Object> row) -> (Integer) row.get("totalInspections")).reversed());
        return rows;
    }

    /**
     * 部门绩效，按平均分倒序；未填写部门的记录不计入
     */
    public List<Map<String, Object>> departmentPerformance() {
        Map<String, List<InspectionRecord>> byDepartment = store.findAll(null).stream()
                .filter(r -> StringUtils.hasText(r.getDepartment()))
                .collect(Collectors.groupingBy(InspectionRecord::getDepartment, TreeMap::new, Collectors.toList()));

        List<Map<String, Object>> rows = new ArrayList<>();
        for (Map.Entry<String, List<InspectionRecord>> entry : byDepartment.entrySet()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("department", entry.getKey());
            putPerformance(row, "totalRecords", entry.getValue());
            rows.add(row);
        }
        rows.sort(Comparator.comparing((Map<String, Object> row) -> (Double) row.get("avgScore")).reversed());
        return rows;
    }

    private static void putPerformance(Map<String, Object> row, String totalKey, List<InspectionRecord> records) {
        long passed = records.stream().filter(r -> Boolean.TRUE.equals(r.getOverallCompliance())).count();
        long failed = records.stream().filter(r -> Boolean.FALSE.equals(r.getOverallCompliance())).count();
        row.put(totalKey, records.size());
        row.put("passed", passed);
        row.put("failed", failed);
        row.put("passRate", percentage(passed, records.size()));
        row.put("avgScore", averageScore(records));
    }

    /**
     * 首页指标：近 30 天记录数、待审批、未关闭 NC、严重 NC、近 30 天平均分、最近 5 条记录
     */
    public Map<String, Object> dashboardSummary() {
        LocalDate today = LocalDate.now();
        List<InspectionRecord> recent30 = store.findAll(DateRange.of(today.minusDays(DASHBOARD_DAYS), today));
        List<InspectionRecord> all = store.findAll(null);
        List<NonConformance> openNcs = nonConformanceService.findAll().stream()
                .filter(nc -> nc.getStatus() != NonConformanceStatus.CLOSED)
                .collect(Collectors.toList());

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("totalRecords30d", recent30.size());
        summary.put("pendingApprovals", all.stream()
                .filter(r -> r.getStatus() != null && r.getStatus().isPendingApproval())
                .count());
        summary.put("openNcs", openNcs.size());
        summary.put("criticalNcs", openNcs.stream().filter(nc -> nc.getSeverity() == Severity.CRITICAL).count());
        summary.put("avgCompliance30d", averageScore(recent30));

        List<Map<String, Object>> recentRecords = new ArrayList<>();
        for (InspectionRecord record : store.findRecent(RECENT_RECORDS)) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", record.getId());
            row.put("recordNumber", record.getRecordNumber());
            row.put("title", record.getTitle());
            row.put("status", record.getStatus());
            row.put("createdAt", record.getCreatedAt() != null ? record.getCreatedAt().format(MINUTE) : null);
            row.put("compliance", record.getOverallCompliance() == null ? "Pending"
                    : record.getOverallCompliance() ? "Pass" : "Fail");
            recentRecords.add(row);
        }
        summary.put("recentRecords", recentRecords);
        return summary;
    }

    /**
     * NC 汇总：按状态、严重度分布，关闭率和平均关闭天数
     */
    public Map<String, Object> nonConformanceSummary(DateRange range) {
        List<NonConformance> ncs = nonConformanceService.findAll().stream()
                .filter(nc -> range == null || range.isUnbounded() || range.contains(nc.getDetectedAt()))
                .collect(Collectors.toList());

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("totalNcs", ncs.size());
        if (ncs.isEmpty()) {
            report.put("message", "No non-conformances found");
            return report;
        }

        Map<String, Long> statusBreakdown = new LinkedHashMap<>();
        Map<String, Long> severityBreakdown = new LinkedHashMap<>();
        for (NonConformance nc : ncs) {
            statusBreakdown.merge(String.valueOf(nc.getStatus()), 1L, Long::sum);
            severityBreakdown.merge(String.valueOf(nc.getSeverity()), 1L, Long::sum);
        }

        long closed = ncs.stream().filter(nc -> nc.getStatus() == NonConformanceStatus.CLOSED).count();
        List<NonConformance> withDates = ncs.stream()
                .filter(nc -> nc.getClosedAt() != null && nc.getDetectedAt() != null)
                .collect(Collectors.toList());
        double avgClosureDays = withDates.isEmpty() ? 0 : withDates.stream()
                .mapToLong(nc -> Duration.between(nc.getDetectedAt(), nc.getClosedAt()).toDays())
                .average()
                .orElse(0);

        report.put("open", ncs.size() - closed);
        report.put("closed", closed);
        report.put("closureRate", percentage(closed, ncs.size()));
        report.put("avgClosureDays", round(avgClosureDays, 1));
        report.put("statusBreakdown", statusBreakdown);
        report.put("severityBreakdown", severityBreakdown);
        return report;
    }

    /**
     * 超过目标关闭日期仍未关闭的 NC，按目标日期正序
     */
    public List<Map<String, Object>> overdueNonConformances() {
        LocalDateTime now = LocalDateTime.now();
        return nonConformanceService.findAll().stream()
                .filter(nc -> nc.isOverdue(now))
                .sorted(Comparator.comparing(NonConformance::getTargetClosureDate))
                .map(nc -> {
                    Map<String, Object> row = new LinkedHashMap<>();
                    row.put("id", nc.getId());
                    row.put("ncNumber", nc.getNcNumber());
                    row.put("title", nc.getTitle());
                    row.put("severity", nc.getSeverity());
                    row.put("status", nc.getStatus());
                    row.put("targetClosureDate", nc.getTargetClosureDate().toLocalDate().format(DATE));
                    row.put("daysOverdue", Duration.between(nc.getTargetClosureDate(), now).toDays());
                    return row;
                })
                .collect(Collectors.toList());
    }

    private static double averageScore(List<InspectionRecord> records) {
        if (records.isEmpty()) {
            return 0.0;
        }
        double sum = records.stream()
                .mapToDouble(r -> r.getComplianceScore() != null ? r.getComplianceScore() : 0.0)
                .sum();
        return round(sum / records.size(), 2);
    }

    private static double percentage(long part, long total) {
        return total > 0 ? round(part * 100.0 / total, 2) : 0.0;
    }

    private static double round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }

    // Setters for wiring outside the container

    public void setStore(RecordStore store) {
        this.store = store;
    }

    public void setCatalogService(StandardCatalogService catalogService) {
        this.catalogService = catalogService;
    }

    public void setNonConformanceService(NonConformanceService nonConformanceService) {
        this.nonConformanceService = nonConformanceService;
    }
}
