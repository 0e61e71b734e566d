package com.edge.qms.config;

import com.edge.qms.model.InspectionTemplate;
import com.edge.qms.model.Standard;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 检验标准目录
 * <p>
 * 运行时可编辑，持久化到 data/standards.json：
 * {
 *   "version": "1.0",
 *   "updatedAt": 1704067200000,
 *   "standards": {
 *     "ISO-2859": {"code": "ISO-2859", "name": "...", "criteria": [
 *       {"code": "DIM-001", "dataType": "NUMERIC", "lowerLimit": 99.5, "upperLimit": 100.5, "unit": "mm"}
 *     ]}
 *   },
 *   "templates": {
 *     "T-001": {"id": "T-001", "standardCode": "ISO-2859", "criterionCodes": ["DIM-001"]}
 *   }
 * }
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class StandardCatalog {
    private String version = "1.0";
    private String description = "Inspection standards, criteria and templates";
    private long updatedAt = System.currentTimeMillis();

    /**
     * key: 标准编码
     */
    private Map<String, Standard> standards = new LinkedHashMap<>();

    /**
     * key: 模板 ID
     */
    private Map<String, InspectionTemplate> templates = new LinkedHashMap<>();
}
