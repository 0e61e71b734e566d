package com.edge.qms.core.update;

import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class UpdateCheckerTest {

    private MockWebServer server;
    private final OkHttpClient client = new OkHttpClient.Builder()
            .readTimeout(1, TimeUnit.SECONDS)
            .build();

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private UpdateChecker checker(String currentVersion, PlatformFamily platform) {
        return new UpdateChecker(client, server.url("/update_info.json").toString(), currentVersion, platform);
    }

    @Test
    void newerVersionUsesPlatformSpecificUrl() {
        server.enqueue(new MockResponse().setBody("""
                {
                  "version": "1.0.5",
                  "build": "20260301",
                  "download_url": "http://example.com/QMS-1.0.5",
                  "release_notes_url": "http://example.com/notes",
                  "linux": {"url": "http://example.com/QMS-1.0.5.AppImage", "size_mb": 85.5},
                  "windows": {"url": "http://example.com/QMS-1.0.5.exe", "size_mb": 70}
                }
                """));

        CheckOutcome outcome = checker("1.0.4", PlatformFamily.LINUX).check();

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.isUpdateAvailable()).isTrue();
        assertThat(outcome.getInfo().getVersion()).isEqualTo("1.0.5");
        assertThat(outcome.getInfo().getDownloadUrl()).isEqualTo("http://example.com/QMS-1.0.5.AppImage");
        assertThat(outcome.getInfo().getSizeMb()).isEqualTo(85.5);
        assertThat(outcome.getInfo().getBuild()).isEqualTo("20260301");
    }

    @Test
    void missingOptionalFieldsFallBackToDefaults() {
        server.enqueue(new MockResponse().setBody("{\"version\": \"2.0.0\", \"download_url\": \"http://example.com/qms\"}"));

        CheckOutcome outcome = checker("1.0.4", PlatformFamily.MACOS).check();

        assertThat(outcome.isUpdateAvailable()).isTrue();
        assertThat(outcome.getInfo().getDownloadUrl()).isEqualTo("http://example.com/qms");
        assertThat(outcome.getInfo().getReleaseNotesUrl()).isEmpty();
        assertThat(outcome.getInfo().getNotes()).isEmpty();
        assertThat(outcome.getInfo().getSizeMb()).isZero();
    }

    @Test
    void sameVersionIsUpToDate() {
        server.enqueue(new MockResponse().setBody("{\"version\": \"1.0.4\"}"));

        CheckOutcome outcome = checker("1.0.4", PlatformFamily.WINDOWS).check();

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.isUpdateAvailable()).isFalse();
    }

    @Test
    void serverErrorIsReportedAsFailure() {
        server.enqueue(new MockResponse().setResponseCode(500));

        CheckOutcome outcome = checker("1.0.4", PlatformFamily.LINUX).check();

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.getMessage()).contains("500");
    }

    @Test
    void malformedBodyIsReportedAsFailure() {
        server.enqueue(new MockResponse().setBody("<html>not json</html>"));

        assertThat(checker("1.0.4", PlatformFamily.LINUX).check().isSuccess()).isFalse();
    }

    @Test
    void nonObjectBodyIsReportedAsFailure() {
        server.enqueue(new MockResponse().setBody("[1, 2, 3]"));

        assertThat(checker("1.0.4", PlatformFamily.LINUX).check().isSuccess()).isFalse();
    }

    @Test
    void missingUrlIsReportedAsFailure() {
        UpdateChecker unconfigured = new UpdateChecker(client, "", "1.0.4", PlatformFamily.LINUX);

        assertThat(unconfigured.check().isSuccess()).isFalse();
    }
}
