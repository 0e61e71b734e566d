package com.edge.qms.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * 检验模板（检验表单）
 * <p>
 * criterionCodes 即模板字段，按排列顺序引用所属标准中的检验项
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class InspectionTemplate {
    String id;
    String code;
    String name;
    String standardCode;
    String category;
    String description;
    List<String> criterionCodes;
    boolean active;
}
