package com.edge.qms.core.statistics;

import lombok.Value;

/**
 * 移动极差图上的一个点，index 从 2 开始（对应第 i 个样本与第 i-1 个样本之差）
 */
@Value
public class MovingRangePoint {
    int index;
    String recordLabel;
    double value;
    boolean flagged;
}
