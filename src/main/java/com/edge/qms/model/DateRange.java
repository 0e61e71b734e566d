package com.edge.qms.model;

import lombok.Value;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * 闭区间日期范围，任一端为 null 表示该方向不限
 */
@Value
public class DateRange {
    LocalDate start;
    LocalDate end;

    public static DateRange of(LocalDate start, LocalDate end) {
        if (start != null && end != null && start.isAfter(end)) {
            throw new IllegalArgumentException("Start date " + start + " is after end date " + end);
        }
        return new DateRange(start, end);
    }

    public boolean contains(LocalDateTime timestamp) {
        if (timestamp == null) {
            return false;
        }
        if (start != null && timestamp.isBefore(start.atStartOfDay())) {
            return false;
        }
        return end == null || !timestamp.isAfter(end.atTime(LocalTime.MAX));
    }

    public boolean isUnbounded() {
        return start == null && end == null;
    }
}
