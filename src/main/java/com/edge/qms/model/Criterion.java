package com.edge.qms.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * 检验标准中的单个检验项定义
 * <p>
 * 上下限仅对 NUMERIC 类型有意义，缺省表示该方向不设限。
 * 两个限值同时存在时必须满足 lowerLimit <= upperLimit（由 StandardCatalogService 在写入时校验）。
 * <p>
 * acceptableOptions 为 SELECT / MULTISELECT 类型的合格选项白名单。
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Criterion {
    String code;
    String title;
    String description;
    DataType dataType;
    Double lowerLimit;
    Double upperLimit;
    String unit;
    Severity severity;
    RequirementType requirementType;
    List<String> options;
    List<String> acceptableOptions;
    int sortOrder;

    @JsonIgnore
    public boolean isNumeric() {
        return dataType == DataType.NUMERIC;
    }

    @JsonIgnore
    public boolean hasValidLimits() {
        return lowerLimit == null || upperLimit == null || lowerLimit <= upperLimit;
    }

    @JsonIgnore
    public List<String> getAcceptableOptionsOrEmpty() {
        return acceptableOptions != null ? acceptableOptions : List.of();
    }
}
