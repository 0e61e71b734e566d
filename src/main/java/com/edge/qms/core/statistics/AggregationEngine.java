package com.edge.qms.core.statistics;

import com.edge.qms.model.Criterion;
import com.edge.qms.model.InspectionRecord;
import com.edge.qms.model.MeasurementItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 统计聚合引擎（单值-移动极差控制图）
 * <p>
 * 对同一模板下的一组记录，按检验项收集数值并计算：
 * - 均值、样本标准差（除以 n-1）、极差、最小值、最大值
 * - 控制限 UCL/LCL = 均值 ± k·σ（默认 k = 3）
 * - 移动极差 MR_i = |v_i - v_(i-1)|，UCL_R = D4 · MR均值（子组大小 2 时 D4 = 3.267），LCL_R = 0
 * <p>
 * 选取规则：每条记录只取该检验项的第一个数值测量项（按存储顺序），没有数值的记录整体跳过。
 * 超出控制限的点只做标记，仍参与统计。
 * <p>
 * 输入顺序即图表顺序，调用方负责按时间正序排列记录。
 */
public class AggregationEngine {
    private static final Logger logger = LoggerFactory.getLogger(AggregationEngine.class);

    public static final double DEFAULT_SIGMA_MULTIPLIER = 3.0;
    public static final double D4_SUBGROUP_2 = 3.267;
    public static final int MIN_SAMPLES = 2;

    private double sigmaMultiplier = DEFAULT_SIGMA_MULTIPLIER;
    private double movingRangeD4 = D4_SUBGROUP_2;

    public AggregationEngine() {
    }

    public AggregationEngine(double sigmaMultiplier, double movingRangeD4) {
        this.sigmaMultiplier = sigmaMultiplier;
        this.movingRangeD4 = movingRangeD4;
    }

    public AggregationResult aggregate(Criterion criterion, List<InspectionRecord> records) {
        if (criterion == null) {
            return AggregationResult.insufficient(null, 0, "检验项不存在");
        }
        if (!criterion.isNumeric()) {
            return AggregationResult.insufficient(criterion, 0, "非数值检验项，不生成控制图");
        }
        if (records == null || records.isEmpty()) {
            return AggregationResult.insufficient(criterion, 0, "没有可用的检验记录");
        }

        List<InspectionRecord> contributing = new ArrayList<>();
        List<Double> values = new ArrayList<>();
        for (InspectionRecord record : records) {
            Double value = firstNumericValue(record, criterion.getCode());
            if (value != null) {
                contributing.add(record);
                values.add(value);
            }
        }

        int n = values.size();
        if (n < MIN_SAMPLES) {
            logger.debug("Criterion {}: only {} numeric values, need at least {}",
                    criterion.getCode(), n, MIN_SAMPLES);
            return AggregationResult.insufficient(criterion, n,
                    "数据不足：至少需要 " + MIN_SAMPLES + " 个数值，当前 " + n + " 个");
        }

        DescriptiveStatistics stats = DescriptiveStatistics.of(values);
        double mean = stats.getMean();
        double stddev = stats.getStddev();

        double ucl = mean + sigmaMultiplier * stddev;
        double lcl = mean - sigmaMultiplier * stddev;

        List<SamplePoint> samples = new ArrayList<>(n);
        int outOfControl = 0;
        int outOfSpec = 0;
        for (int i = 0; i < n; i++) {
            double v = values.get(i);
            InspectionRecord record = contributing.get(i);
            boolean flagged = v > ucl || v < lcl;
            if (flagged) {
                outOfControl++;
            }
            if (isOutOfSpec(criterion, v)) {
                outOfSpec++;
            }
            samples.add(new SamplePoint(record.getId(), record.label(), record.effectiveTimestamp(), v, flagged));
        }

        double[] movingRanges = new double[n - 1];
        double mrSum = 0;
        for (int i = 1; i < n; i++) {
            movingRanges[i - 1] = Math.abs(values.get(i) - values.get(i - 1));
            mrSum += movingRanges[i - 1];
        }
        double meanMr = mrSum / movingRanges.length;
        double uclR = movingRangeD4 * meanMr;

        List<MovingRangePoint> mrSeries = new ArrayList<>(movingRanges.length);
        int mrOutOfControl = 0;
        for (int i = 0; i < movingRanges.length; i++) {
            boolean flagged = movingRanges[i] > uclR;
            if (flagged) {
                mrOutOfControl++;
            }
            mrSeries.add(new MovingRangePoint(i + 2, contributing.get(i + 1).label(), movingRanges[i], flagged));
        }

        logger.debug("Criterion {}: n={}, mean={}, stddev={}, ucl={}, lcl={}, uclR={}",
                criterion.getCode(), n, mean, stddev, ucl, lcl, uclR);

        return AggregationResult.builder()
                .criterion(criterion)
                .chartable(true)
                .sampleCount(n)
                .mean(mean)
                .stddev(stddev)
                .range(stats.getRange())
                .min(stats.getMin())
                .max(stats.getMax())
                .ucl(ucl)
                .lcl(lcl)
                .sampleSeries(samples)
                .movingRangeSeries(mrSeries)
                .meanMovingRange(meanMr)
                .uclR(uclR)
                .lclR(0.0)
                .outOfControlCount(outOfControl)
                .movingRangeOutOfControlCount(mrOutOfControl)
                .outOfSpecCount(outOfSpec)
                .build();
    }

    /**
     * 记录中该检验项的第一个数值（按存储顺序），没有则返回 null
     */
    static Double firstNumericValue(InspectionRecord record, String criterionCode) {
        if (record == null || criterionCode == null) {
            return null;
        }
        for (MeasurementItem item : record.getItems()) {
            if (criterionCode.equals(item.getCriterionCode()) && item.getNumericValue() != null) {
                return item.getNumericValue();
            }
        }
        return null;
    }

    private static boolean isOutOfSpec(Criterion criterion, double value) {
        return (criterion.getLowerLimit() != null && value < criterion.getLowerLimit())
                || (criterion.getUpperLimit() != null && value > criterion.getUpperLimit());
    }

    public double getSigmaMultiplier() {
        return sigmaMultiplier;
    }

    public void setSigmaMultiplier(double sigmaMultiplier) {
        this.sigmaMultiplier = sigmaMultiplier;
    }

    public double getMovingRangeD4() {
        return movingRangeD4;
    }

    public void setMovingRangeD4(double movingRangeD4) {
        this.movingRangeD4 = movingRangeD4;
    }
}
