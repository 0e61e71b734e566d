package com.edge.qms.controller;

import com.edge.qms.service.UpdateService;
import io.swagger.v3.oas.annotations.Operation;
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

/**
 * 自动更新控制器
 *
 * 检查和下载在后台执行，接口立即返回当前状态，通过 /status 轮询进度
 */
@RestController
@RequestMapping("/api/update")
@Tag(name = "自动更新", description = "IDLE → CHECKING → UP_TO_DATE / UPDATE_AVAILABLE → DOWNLOADING → DOWNLOADED → INSTALLING")
public class UpdateController {
    private static final Logger logger = LoggerFactory.getLogger(UpdateController.class);

    @Autowired
    private UpdateService updateService;

    @GetMapping("/status")
    @Operation(summary = "获取更新状态")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "获取成功",
                    content = @Content(mediaType = "application/json", examples = @ExampleObject(value = """
                            {
                              "status": "success",
                              "data": {
                                "state": "DOWNLOADING",
                                "currentVersion": "1.0.4",
                                "latestVersion": "1.0.5",
                                "bytesDownloaded": 4194304,
                                "totalBytes": 89128960,
                                "progressPercent": 4.71,
                                "message": "Downloading 1.0.5"
                              }
                            }
                            """)))
    })
    public ResponseEntity<Map<String, Object>> getStatus() {
        try {
            return ApiResult.success(updateService.getStatus());
        } catch (Exception e) {
            return ApiResult.failure(logger, "Failed to get update status", e);
        }
    }

    @PostMapping("/check")
    @Operation(summary = "检查更新", description = "检查失败回到 IDLE 并在 message 中给出原因")
    public ResponseEntity<Map<String, Object>> check() {
        try {
            updateService.checkForUpdates();
            return ApiResult.success(updateService.getStatus(), "Update check started");
        } catch (Exception e) {
            return ApiResult.failure(logger, "Failed to start update check", e);
        }
    }

    @PostMapping("/download")
    @Operation(summary = "下载更新", description = "仅在 UPDATE_AVAILABLE 状态可用")
    public ResponseEntity<Map<String, Object>> download() {
        try {
            updateService.startDownload();
            return ApiResult.success(updateService.getStatus(), "Download started");
        } catch (Exception e) {
            return ApiResult.failure(logger, "Failed to start update download", e);
        }
    }

    @PostMapping("/cancel")
    @Operation(summary = "取消下载", description = "删除未完成的文件，回到 UPDATE_AVAILABLE")
    public ResponseEntity<Map<String, Object>> cancel() {
        try {
            return ApiResult.success(updateService.cancelDownload());
        } catch (Exception e) {
            return ApiResult.failure(logger, "Failed to cancel update download", e);
        }
    }

    @PostMapping("/install")
    @Operation(summary = "安装更新", description = "仅在 DOWNLOADED 状态可用；启动辅助进程后应用退出，由辅助进程替换并重启")
    public ResponseEntity<Map<String, Object>> install() {
        try {
            return ApiResult.success(updateService.install());
        } catch (Exception e) {
            return ApiResult.failure(logger, "Failed to install update", e);
        }
    }
}
