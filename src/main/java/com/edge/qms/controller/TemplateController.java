package com.edge.qms.controller;

import com.edge.qms.model.InspectionTemplate;
import com.edge.qms.service.StandardCatalogService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.NoSuchElementException;

/**
 * 检验模板控制器
 */
@RestController
@RequestMapping("/api/templates")
@Tag(name = "检验模板", description = "模板引用一个标准，按顺序列出需要录入的检验项")
public class TemplateController {
    private static final Logger logger = LoggerFactory.getLogger(TemplateController.class);

    @Autowired
    private StandardCatalogService catalogService;

    @GetMapping
    @Operation(summary = "获取所有模板")
    public ResponseEntity<Map<String, Object>> listTemplates() {
        try {
            return ApiResult.success(catalogService.listTemplates());
        } catch (Exception e) {
            return ApiResult.failure(logger, "Failed to list templates", e);
        }
    }

    @GetMapping("/{id}")
    @Operation(summary = "获取模板")
    public ResponseEntity<Map<String, Object>> getTemplate(@PathVariable String id) {
        try {
            InspectionTemplate template = catalogService.getTemplate(id)
                    .orElseThrow(() -> new NoSuchElementException("Template not found: " + id));
            return ApiResult.success(template);
        } catch (Exception e) {
            return ApiResult.failure(logger, "Failed to get template " + id, e);
        }
    }

    @GetMapping("/{id}/criteria")
    @Operation(summary = "获取模板的检验项", description = "按模板字段顺序返回完整的检验项定义")
    public ResponseEntity<Map<String, Object>> getTemplateCriteria(@PathVariable String id) {
        try {
            if (catalogService.getTemplate(id).isEmpty()) {
                throw new NoSuchElementException("Template not found: " + id);
            }
            return ApiResult.success(catalogService.resolveCriteria(id));
        } catch (Exception e) {
            return ApiResult.failure(logger, "Failed to resolve criteria of template " + id, e);
        }
    }

    @PostMapping
    @Operation(
            summary = "新建模板",
            description = """
                    ```json
                    {"code": "IQC-01", "name": "来料检验", "standardCode": "ISO-2859",
                     "category": "IQC", "criterionCodes": ["DIM-001", "VIS-001"], "active": true}
                    ```
                    未提供 id 时自动生成。
                    """
    )
    public ResponseEntity<Map<String, Object>> createTemplate(@RequestBody InspectionTemplate template) {
        try {
            return ApiResult.success(catalogService.saveTemplate(template), "Template saved");
        } catch (Exception e) {
            return ApiResult.failure(logger, "Failed to save template", e);
        }
    }

    @PutMapping("/{id}")
    @Operation(summary = "更新模板")
    public ResponseEntity<Map<String, Object>> updateTemplate(@PathVariable String id,
                                                              @RequestBody InspectionTemplate template) {
        try {
            return ApiResult.success(catalogService.saveTemplate(template.toBuilder().id(id).build()),
                    "Template updated");
        } catch (Exception e) {
            return ApiResult.failure(logger, "Failed to update template " + id, e);
        }
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "删除模板")
    public ResponseEntity<Map<String, Object>> deleteTemplate(@PathVariable String id) {
        try {
            catalogService.deleteTemplate(id);
            return ApiResult.success(null, "Template deleted");
        } catch (Exception e) {
            return ApiResult.failure(logger, "Failed to delete template " + id, e);
        }
    }
}
