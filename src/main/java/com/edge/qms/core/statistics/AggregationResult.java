package com.edge.qms.core.statistics;

import com.edge.qms.model.Criterion;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 单个检验项跨记录的统计结果（每次报表请求临时构造，不持久化）
 * <p>
 * chartable 为 false 时表示"数据不足"终态：少于 2 个有效数值、非数值检验项或没有候选记录。
 * 这是正常结果而不是错误，调用方应渲染"数据不足"，此时统计字段均为 null、序列为空。
 */
@Value
@Builder
public class AggregationResult {
    Criterion criterion;
    boolean chartable;
    String reason;
    int sampleCount;

    Double mean;
    Double stddev;
    Double range;
    Double min;
    Double max;
    Double ucl;
    Double lcl;

    List<SamplePoint> sampleSeries;
    List<MovingRangePoint> movingRangeSeries;
    Double meanMovingRange;
    Double uclR;
    Double lclR;

    int outOfControlCount;
    int movingRangeOutOfControlCount;
    int outOfSpecCount;

    public static AggregationResult insufficient(Criterion criterion, int sampleCount, String reason) {
        return AggregationResult.builder()
                .criterion(criterion)
                .chartable(false)
                .reason(reason)
                .sampleCount(sampleCount)
                .sampleSeries(List.of())
                .movingRangeSeries(List.of())
                .build();
    }

    public boolean isInsufficientData() {
        return !chartable;
    }
}
