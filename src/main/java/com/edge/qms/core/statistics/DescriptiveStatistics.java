package com.edge.qms.core.statistics;

import lombok.Value;

import java.util.List;

/**
 * 描述性统计（样本标准差，n < 2 时为 0）
 */
@Value
public class DescriptiveStatistics {
    int count;
    double mean;
    double stddev;
    double min;
    double max;

    public double getRange() {
        return max - min;
    }

    /**
     * @param values 非空数值列表
     */
    public static DescriptiveStatistics of(List<Double> values) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("values must not be empty");
        }
        int n = values.size();
        double sum = 0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            sum += v;
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        double mean = sum / n;

        double stddev = 0;
        if (n > 1) {
            double squares = 0;
            for (double v : values) {
                squares += (v - mean) * (v - mean);
            }
            stddev = Math.sqrt(squares / (n - 1));
        }
        return new DescriptiveStatistics(n, mean, stddev, min, max);
    }
}
