package com.edge.qms.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Optional;

/**
 * 检验标准（一组检验项）
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Standard {
    String code;
    String name;
    String version;
    String description;
    String industry;
    boolean active;
    List<Criterion> criteria;

    public Optional<Criterion> findCriterion(String criterionCode) {
        if (criteria == null || criterionCode == null) {
            return Optional.empty();
        }
        return criteria.stream()
                .filter(c -> criterionCode.equals(c.getCode()))
                .findFirst();
    }
}
