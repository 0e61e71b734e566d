package com.edge.qms.controller;

import com.edge.qms.model.Standard;
import com.edge.qms.service.StandardCatalogService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.NoSuchElementException;

/**
 * 检验标准控制器
 *
 * 标准及其检验项的增删改查，配置自动持久化到 data/standards.json
 */
@RestController
@RequestMapping("/api/standards")
@Tag(name = "检验标准", description = "检验标准与检验项的维护，写入时校验上下限和检验项编码唯一性")
public class StandardController {
    private static final Logger logger = LoggerFactory.getLogger(StandardController.class);

    @Autowired
    private StandardCatalogService catalogService;

    @GetMapping
    @Operation(summary = "获取所有检验标准")
    public ResponseEntity<Map<String, Object>> listStandards() {
        try {
            return ApiResult.success(catalogService.listStandards());
        } catch (Exception e) {
            return ApiResult.failure(logger, "Failed to list standards", e);
        }
    }

    @GetMapping("/{code}")
    @Operation(summary = "获取指定检验标准")
    public ResponseEntity<Map<String, Object>> getStandard(
            @Parameter(description = "标准编码", required = true, example = "ISO-2859") @PathVariable String code) {
        try {
            Standard standard = catalogService.getStandard(code)
                    .orElseThrow(() -> new NoSuchElementException("Standard not found: " + code));
            return ApiResult.success(standard);
        } catch (Exception e) {
            return ApiResult.failure(logger, "Failed to get standard " + code, e);
        }
    }

    @PostMapping
    @Operation(
            summary = "新增或覆盖检验标准",
            description = """
                    **请求示例**：
                    ```json
                    {
                      "code": "ISO-2859",
                      "name": "来料尺寸检验",
                      "version": "1.0",
                      "active": true,
                      "criteria": [
                        {"code": "DIM-001", "title": "外径", "dataType": "NUMERIC",
                         "lowerLimit": 99.5, "upperLimit": 100.5, "unit": "mm", "severity": "MAJOR"},
                        {"code": "VIS-001", "title": "外观", "dataType": "SELECT",
                         "options": ["良好", "划痕", "破损"], "acceptableOptions": ["良好"]}
                      ]
                    }
                    ```
                    下限大于上限、检验项编码重复、非数值检验项设置上下限时返回 400。
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "保存成功"),
            @ApiResponse(responseCode = "400", description = "校验失败",
                    content = @Content(mediaType = "application/json", examples = @ExampleObject(value = """
                            {
                              "status": "error",
                              "message": "Criterion DIM-001: lower limit 100.5 is greater than upper limit 99.5"
                            }
                            """)))
    })
    public ResponseEntity<Map<String, Object>> saveStandard(@RequestBody Standard standard) {
        try {
            return ApiResult.success(catalogService.saveStandard(standard), "Standard saved");
        } catch (Exception e) {
            return ApiResult.failure(logger, "Failed to save standard", e);
        }
    }

    @PutMapping("/{code}")
    @Operation(summary = "更新检验标准", description = "路径中的编码覆盖请求体中的 code")
    public ResponseEntity<Map<String, Object>> updateStandard(@PathVariable String code,
                                                              @RequestBody Standard standard) {
        try {
            return ApiResult.success(catalogService.saveStandard(standard.toBuilder().code(code).build()),
                    "Standard updated");
        } catch (Exception e) {
            return ApiResult.failure(logger, "Failed to update standard " + code, e);
        }
    }

    @DeleteMapping("/{code}")
    @Operation(summary = "删除检验标准", description = "仍被模板引用的标准不能删除（409）")
    public ResponseEntity<Map<String, Object>> deleteStandard(@PathVariable String code) {
        try {
            catalogService.deleteStandard(code);
            return ApiResult.success(null, "Standard deleted");
        } catch (Exception e) {
            return ApiResult.failure(logger, "Failed to delete standard " + code, e);
        }
    }
}
