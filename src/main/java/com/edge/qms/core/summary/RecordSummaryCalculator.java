package com.edge.qms.core.summary;

import com.edge.qms.model.Compliance;
import com.edge.qms.model.MeasurementItem;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * 记录汇总计算
 * <p>
 * 合格率 = 合格项 / (合格项 + 不合格项) * 100，UNKNOWN 项不计入分母。
 * 结果只依赖测量项集合，重复调用结果一致。
 */
public class RecordSummaryCalculator {

    public static final int DEFAULT_PRECISION = 2;

    private int precision = DEFAULT_PRECISION;

    public RecordSummaryCalculator() {
    }

    public RecordSummaryCalculator(int precision) {
        this.precision = precision;
    }

    public RecordSummary recompute(List<MeasurementItem> items) {
        int passed = 0;
        int failed = 0;
        if (items != null) {
            for (MeasurementItem item : items) {
                if (item == null) {
                    continue;
                }
                if (item.getCompliance() == Compliance.PASS) {
                    passed++;
                } else if (item.getCompliance() == Compliance.FAIL) {
                    failed++;
                }
            }
        }

        int total = passed + failed;
        double score = total > 0 ? round(passed * 100.0 / total, precision) : 0.0;
        Boolean overall = total > 0 ? failed == 0 : null;
        return new RecordSummary(score, overall, failed, passed, total);
    }

    public int getPrecision() {
        return precision;
    }

    public void setPrecision(int precision) {
        this.precision = precision;
    }

    static double round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
