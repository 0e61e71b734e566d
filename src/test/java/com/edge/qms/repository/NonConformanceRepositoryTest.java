package com.edge.qms.repository;

import com.edge.qms.model.NonConformance;
import com.edge.qms.model.NonConformanceStatus;
import com.edge.qms.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NonConformanceRepositoryTest {

    @TempDir
    Path dataDir;

    private NonConformanceRepository repository;

    @BeforeEach
    void setUp() {
        repository = new NonConformanceRepository(dataDir);
        repository.load();
    }

    private static NonConformance nc(String number) {
        return NonConformance.builder()
                .ncNumber(number)
                .title("Burr on edge")
                .severity(Severity.MAJOR)
                .status(NonConformanceStatus.OPEN)
                .detectedAt(LocalDateTime.of(2026, 3, 2, 8, 0))
                .build();
    }

    @Test
    void savedItemsSurviveReload() {
        NonConformance saved = repository.save(nc("NC-2026-001"));

        NonConformanceRepository reloaded = new NonConformanceRepository(dataDir);
        reloaded.load();

        assertThat(saved.getId()).isNotBlank();
        assertThat(reloaded.findById(saved.getId())).contains(saved);
        assertThat(reloaded.maxSequenceForYear(2026)).isEqualTo(1);
    }

    @Test
    void failedWriteDoesNotChangeTheCache() throws IOException {
        NonConformance kept = repository.save(nc("NC-2026-001"));
        Path blocker = Files.createDirectory(dataDir.resolve("non-conformances.json.tmp"));

        assertThatThrownBy(() -> repository.save(nc("NC-2026-002"))).isInstanceOf(RuntimeException.class);
        assertThatThrownBy(() -> repository.delete(kept.getId())).isInstanceOf(RuntimeException.class);

        assertThat(repository.findAll()).containsExactly(kept);
        assertThat(repository.maxSequenceForYear(2026)).isEqualTo(1);

        Files.delete(blocker);
        repository.delete(kept.getId());
        assertThat(repository.findAll()).isEmpty();
    }
}
