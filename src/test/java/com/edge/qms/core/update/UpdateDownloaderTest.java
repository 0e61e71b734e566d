package com.edge.qms.core.update;

import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okio.Buffer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UpdateDownloaderTest {

    @TempDir
    Path tempDir;

    private MockWebServer server;
    private final UpdateDownloader downloader = new UpdateDownloader(new OkHttpClient());

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private static byte[] payload(int size) {
        byte[] bytes = new byte[size];
        for (int i = 0; i < size; i++) {
            bytes[i] = (byte) (i % 251);
        }
        return bytes;
    }

    @Test
    void streamsToTargetAndReportsProgress() throws IOException {
        byte[] bytes = payload(20_000);
        server.enqueue(new MockResponse().setBody(new Buffer().write(bytes)));
        Path target = tempDir.resolve("QMS_Update.AppImage");
        List<long[]> progress = new ArrayList<>();

        Path result = downloader.download(server.url("/QMS.AppImage").toString(), target,
                (done, total) -> progress.add(new long[]{done, total}), new AtomicBoolean(false));

        assertThat(result).isEqualTo(target);
        assertThat(Files.readAllBytes(target)).isEqualTo(bytes);
        assertThat(progress).isNotEmpty();
        long[] last = progress.get(progress.size() - 1);
        assertThat(last[0]).isEqualTo(20_000L);
        assertThat(last[1]).isEqualTo(20_000L);
        for (int i = 1; i < progress.size(); i++) {
            assertThat(progress.get(i)[0]).isGreaterThan(progress.get(i - 1)[0]);
        }
    }

    @Test
    void cancellationDeletesPartialFile() {
        server.enqueue(new MockResponse().setBody(new Buffer().write(payload(100_000))));
        Path target = tempDir.resolve("QMS_Update.exe");
        AtomicBoolean cancel = new AtomicBoolean(false);

        assertThatThrownBy(() -> downloader.download(server.url("/QMS.exe").toString(), target,
                (done, total) -> cancel.set(true), cancel))
                .isInstanceOf(CancellationException.class);
        assertThat(target).doesNotExist();
    }

    @Test
    void httpErrorDeletesPartialFile() throws IOException {
        server.enqueue(new MockResponse().setResponseCode(404));
        Path target = tempDir.resolve("QMS_Update.dmg");
        Files.write(target, new byte[]{1, 2, 3});

        assertThatThrownBy(() -> downloader.download(server.url("/missing").toString(), target, null, null))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("404");
        assertThat(target).doesNotExist();
    }

    @Test
    void blankUrlFails() {
        assertThatThrownBy(() -> downloader.download("", tempDir.resolve("x"), null, null))
                .isInstanceOf(IOException.class);
    }
}
