package com.edge.qms.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.responses.ApiResponse;
import org.springdoc.core.customizers.OpenApiCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * OpenAPI / Swagger 配置
 *
 * 访问地址：
 * - Swagger UI: http://localhost:{port}/swagger-ui.html
 * - API 文档 (JSON): http://localhost:{port}/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI qmsOpenAPI(QmsConfig config) {
        return new OpenAPI()
                .info(new Info()
                        .title("Edge QMS API")
                        .description("""
                                质量管理系统 API 文档

                                ### 核心功能
                                - **检验标准**：标准、检验项（上下限 / 合格选项）与检验模板的维护
                                - **检验记录**：按模板录入测量值，自动判定合格性并汇总合格率
                                - **统计分析**：单值-移动极差控制图（均值、σ、UCL/LCL、MR、UCL_R）
                                - **报表**：合格率汇总、不合格项排行、模板使用、首页指标
                                - **不合格项（NC）**：记录终审后自动创建，跟踪至关闭
                                - **自动更新**：版本检查、下载、独立进程替换安装

                                ### 合格性判定
                                | 类型 | 规则 |
                                |------|------|
                                | `NUMERIC` | 在上下限内（含边界）为 PASS，偏差 = 值 - 越界限值 |
                                | `BOOLEAN` | yes/true/1 为 PASS，no/false/0 为 FAIL |
                                | `SELECT` / `MULTISELECT` | 全部选项都在合格选项内为 PASS |
                                | `TEXT` | 需人工判定，否则为 UNKNOWN |

                                ### API 响应格式
                                ```json
                                {
                                  "status": "success | error",
                                  "data": { ... },
                                  "message": "错误信息（仅错误时）"
                                }
                                ```
                                """)
                        .version(config.getUpdate().getCurrentVersion())
                        .contact(new Contact()
                                .name("Edge QMS Team")));
    }

    /**
     * 为所有接口添加统一的响应结构
     */
    @Bean
    public OpenApiCustomizer globalResponseCustomizer() {
        return openApi -> openApi.getPaths().forEach((path, pathItem) -> {
            if (pathItem.getGet() != null) {
                pathItem.getGet().getResponses().addApiResponse("200", createSuccessResponse());
            }
            if (pathItem.getPost() != null) {
                pathItem.getPost().getResponses().addApiResponse("200", createSuccessResponse());
                pathItem.getPost().getResponses().addApiResponse("400", createErrorResponse("请求错误"));
            }
            if (pathItem.getPut() != null) {
                pathItem.getPut().getResponses().addApiResponse("400", createErrorResponse("请求错误"));
                pathItem.getPut().getResponses().addApiResponse("409", createErrorResponse("状态冲突"));
            }
        });
    }

    private ApiResponse createSuccessResponse() {
        Schema<?> schema = new Schema<>();
        schema.setType("object");
        schema.setProperties(Map.of(
                "status", new Schema<>().type("string").description("状态: success/error").example("success"),
                "data", new Schema<>().type("object").description("响应数据"),
                "message", new Schema<>().type("string").description("消息（可选）").example("操作成功")
        ));
        return new ApiResponse()
                .description("成功")
                .content(new Content().addMediaType("application/json", new MediaType().schema(schema)));
    }

    private ApiResponse createErrorResponse(String description) {
        Schema<?> schema = new Schema<>();
        schema.setType("object");
        schema.setProperties(Map.of(
                "status", new Schema<>().type("string").description("状态").example("error"),
                "message", new Schema<>().type("string").description("错误信息").example(description)
        ));
        return new ApiResponse()
                .description(description)
                .content(new Content().addMediaType("application/json", new MediaType().schema(schema)));
    }
}
