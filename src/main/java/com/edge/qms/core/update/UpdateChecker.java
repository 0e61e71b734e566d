package com.edge.qms.core.update;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * 版本检查
 * <p>
 * 对版本信息地址发起一次 GET，响应格式：
 * {
 *   "version": "1.0.5",
 *   "build": "20260301",
 *   "download_url": "https://.../QMS-1.0.5",
 *   "release_notes_url": "https://.../CHANGELOG",
 *   "notes": "...",
 *   "linux": {"url": "https://.../QMS-1.0.5.AppImage", "size_mb": 85}
 * }
 * 平台字段（windows / linux / macos）中的 url 优先于顶层 download_url。
 * 超时、非 200、响应体格式错误都返回 {@link CheckOutcome#failed(String)}，不抛异常。
 */
public class UpdateChecker {
    private static final Logger logger = LoggerFactory.getLogger(UpdateChecker.class);

    private final OkHttpClient httpClient;
    private final String metadataUrl;
    private final String currentVersion;
    private final PlatformFamily platform;

    public UpdateChecker(OkHttpClient httpClient, String metadataUrl, String currentVersion, PlatformFamily platform) {
        this.httpClient = httpClient;
        this.metadataUrl = metadataUrl;
        this.currentVersion = currentVersion;
        this.platform = platform;
    }

    public CheckOutcome check() {
        if (metadataUrl == null || metadataUrl.trim().isEmpty()) {
            return CheckOutcome.failed("Update metadata URL is not configured");
        }

        Request request;
        try {
            request = new Request.Builder().url(metadataUrl).get().build();
        } catch (IllegalArgumentException e) {
            return CheckOutcome.failed("Invalid update metadata URL: " + metadataUrl);
        }

        try (Response response = httpClient.newCall(request).execute()) {
            if (response.code() != 200) {
                logger.warn("Update check failed with HTTP {}", response.code());
                return CheckOutcome.failed("Update check failed with code: " + response.code());
            }
            ResponseBody body = response.body();
            String json = body != null ? body.string() : "";
            UpdateInfo info = parse(json);

            if (SemanticVersion.isNewer(info.getVersion(), currentVersion)) {
                logger.info("Update available: {} (current {})", info.getVersion(), currentVersion);
                return CheckOutcome.available(info);
            }
            logger.info("No update available, latest {} current {}", info.getVersion(), currentVersion);
            return CheckOutcome.upToDate(info);
        } catch (IOException e) {
            logger.warn("Update check failed: {}", e.getMessage());
            return CheckOutcome.failed("Update check failed: " + e.getMessage());
        } catch (JsonParseException | IllegalStateException e) {
            logger.warn("Malformed update metadata: {}", e.getMessage());
            return CheckOutcome.failed("Malformed update metadata");
        }
    }

    UpdateInfo parse(String json) {
        JsonElement root = JsonParser.parseString(json);
        if (!root.isJsonObject()) {
            throw new JsonParseException("Update metadata is not a JSON object");
        }
        JsonObject data = root.getAsJsonObject();

        JsonObject platformData = data.has(platform.getMetadataKey()) && data.get(platform.getMetadataKey()).isJsonObject()
                ? data.getAsJsonObject(platform.getMetadataKey())
                : new JsonObject();

        String downloadUrl = string(platformData, "url");
        if (downloadUrl.isEmpty()) {
            downloadUrl = string(data, "download_url");
        }
        String version = string(data, "version");

        return UpdateInfo.builder()
                .version(version.isEmpty() ? "0.0.0" : version)
                .build(string(data, "build"))
                .downloadUrl(downloadUrl)
                .releaseNotesUrl(string(data, "release_notes_url"))
                .notes(string(data, "notes"))
                .sizeMb(number(platformData, "size_mb"))
                .build();
    }

    private static String string(JsonObject obj, String key) {
        JsonElement element = obj.get(key);
        if (element == null || !element.isJsonPrimitive()) {
            return "";
        }
        return element.getAsString();
    }

    private static double number(JsonObject obj, String key) {
        JsonElement element = obj.get(key);
        if (element == null || !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
            return 0;
        }
        return element.getAsDouble();
    }

    public String getCurrentVersion() {
        return currentVersion;
    }
}
