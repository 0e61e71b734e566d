package com.edge.qms.core.statistics;

import lombok.Value;

import java.time.LocalDateTime;

/**
 * 单值控制图上的一个点
 */
@Value
public class SamplePoint {
    String recordId;
    String recordLabel;
    LocalDateTime timestamp;
    double value;
    boolean flagged;
}
