package com.edge.qms.core.summary;

import lombok.Value;

/**
 * 记录汇总结果
 * <p>
 * overallCompliance 为 null 表示尚无可判定的测量项（区别于 false）
 */
@Value
public class RecordSummary {
    double complianceScore;
    Boolean overallCompliance;
    int failedCount;
    int passedCount;
    int evaluatedCount;
}
