package com.edge.qms.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDateTime;

/**
 * 不合格项（NC）
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class NonConformance {
    String id;
    String ncNumber;
    String recordId;
    String criterionCode;
    String title;
    String description;
    Severity severity;
    NonConformanceStatus status;
    LocalDateTime detectedAt;
    LocalDateTime targetClosureDate;
    LocalDateTime closedAt;
    String rootCause;
    String correctiveAction;

    public boolean isOverdue(LocalDateTime now) {
        return status != NonConformanceStatus.CLOSED
                && targetClosureDate != null
                && targetClosureDate.isBefore(now);
    }
}
