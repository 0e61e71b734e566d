package com.edge.qms.repository;

import com.edge.qms.model.*;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonlRecordStoreTest {

    @TempDir
    Path dataDir;

    private JsonlRecordStore store;

    @BeforeEach
    void setUp() {
        store = new JsonlRecordStore(dataDir);
        store.open();
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private static InspectionRecord record(String id, String templateId, LocalDateTime createdAt) {
        return InspectionRecord.builder()
                .id(id)
                .recordNumber("REC-" + id)
                .templateId(templateId)
                .status(RecordStatus.DRAFT)
                .createdAt(createdAt)
                .items(List.of(
                        MeasurementItem.builder().criterionCode("B").rawValue("1").numericValue(1.0)
                                .compliance(Compliance.PASS).deviation(0.0).build(),
                        MeasurementItem.builder().criterionCode("A").rawValue("x")
                                .compliance(Compliance.UNKNOWN).build()))
                .build();
    }

    @Test
    void roundTripPreservesItemOrder() {
        LocalDateTime createdAt = LocalDateTime.of(2026, 1, 15, 9, 30);
        store.insert(record("r1", "T1", createdAt));

        InspectionRecord loaded = store.findById("r1").orElseThrow();

        assertThat(loaded.getCreatedAt()).isEqualTo(createdAt);
        assertThat(loaded.getItems()).extracting(MeasurementItem::getCriterionCode).containsExactly("B", "A");
        assertThat(store.getItemsForRecord("r1")).hasSize(2);
        assertThat(Files.exists(dataDir.resolve("records").resolve("2026-01-15.jsonl"))).isTrue();
    }

    @Test
    void insertAssignsIdAndCreationTime() {
        InspectionRecord saved = store.insert(InspectionRecord.builder().templateId("T1").build());

        assertThat(saved.getId()).isNotBlank();
        assertThat(saved.getCreatedAt()).isNotNull();
        assertThat(store.findById(saved.getId())).isPresent();
    }

    @Test
    void templateRecordsAreChronologicalAndFilteredByRange() {
        store.insert(record("r3", "T1", LocalDateTime.of(2026, 1, 20, 8, 0)));
        store.insert(record("r1", "T1", LocalDateTime.of(2026, 1, 10, 8, 0)));
        store.insert(record("r2", "T1", LocalDateTime.of(2026, 1, 10, 9, 0)));
        store.insert(record("x", "T2", LocalDateTime.of(2026, 1, 10, 9, 0)));

        assertThat(store.getRecordsForTemplate("T1", null)).extracting(InspectionRecord::getId)
                .containsExactly("r1", "r2", "r3");
        assertThat(store.getRecordsForTemplate("T1",
                DateRange.of(LocalDate.of(2026, 1, 15), LocalDate.of(2026, 1, 31))))
                .extracting(InspectionRecord::getId).containsExactly("r3");
        assertThat(store.getRecordsForTemplate("missing", null)).isEmpty();
    }

    @Test
    void updateRewritesRecordInPlace() {
        store.insert(record("r1", "T1", LocalDateTime.of(2026, 1, 10, 8, 0)));
        store.insert(record("r2", "T1", LocalDateTime.of(2026, 1, 10, 9, 0)));

        store.update(store.findById("r1").orElseThrow().toBuilder().status(RecordStatus.SUBMITTED).build());

        assertThat(store.findById("r1").orElseThrow().getStatus()).isEqualTo(RecordStatus.SUBMITTED);
        assertThat(store.count()).isEqualTo(2);
        assertThat(store.findAll(null)).extracting(InspectionRecord::getId).containsExactly("r1", "r2");
    }

    @Test
    void updateOfUnknownRecordIsRejected() {
        assertThatThrownBy(() -> store.update(record("nope", "T1", LocalDateTime.now())))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void deleteRemovesRecordAndIndexes() {
        store.insert(record("r1", "T1", LocalDateTime.of(2026, 1, 10, 8, 0)));
        store.insert(record("r2", "T1", LocalDateTime.of(2026, 1, 10, 9, 0)));

        store.delete("r1");

        assertThat(store.findById("r1")).isEmpty();
        assertThat(store.getRecordsForTemplate("T1", null)).extracting(InspectionRecord::getId).containsExactly("r2");
        assertThat(store.count()).isEqualTo(1);
    }

    @Test
    void findRecentReturnsNewestFirst() {
        store.insert(record("r1", "T1", LocalDateTime.of(2026, 1, 10, 8, 0)));
        store.insert(record("r2", "T1", LocalDateTime.of(2026, 1, 11, 8, 0)));
        store.insert(record("r3", "T1", LocalDateTime.of(2026, 1, 11, 9, 0)));

        assertThat(store.findRecent(2)).extracting(InspectionRecord::getId).containsExactly("r3", "r2");
    }

    @Test
    void corruptLinesAreSkipped() throws IOException {
        store.insert(record("r1", "T1", LocalDateTime.of(2026, 1, 10, 8, 0)));
        Files.write(dataDir.resolve("records").resolve("2026-01-10.jsonl"),
                "{not json\n".getBytes(StandardCharsets.UTF_8), StandardOpenOption.APPEND);

        assertThat(store.findAll(null)).extracting(InspectionRecord::getId).containsExactly("r1");
    }

    @Test
    void closedStoreRejectsAccess() {
        store.close();

        assertThatThrownBy(() -> store.findAll(null)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void failedRewriteLeavesDayFileIntact() throws IOException {
        LocalDateTime createdAt = LocalDateTime.of(2026, 1, 15, 9, 30);
        store.insert(record("r1", "T1", createdAt));
        store.insert(record("r2", "T1", createdAt.plusMinutes(1)));
        Path dayFile = dataDir.resolve("records").resolve("2026-01-15.jsonl");
        Path blocker = Files.createDirectory(dayFile.resolveSibling("2026-01-15.jsonl.tmp"));
        String before = Files.readString(dayFile);

        InspectionRecord changed = store.findById("r1").orElseThrow().toBuilder().title("changed").build();
        assertThatThrownBy(() -> store.update(changed)).isInstanceOf(RuntimeException.class);
        assertThatThrownBy(() -> store.delete("r2")).isInstanceOf(RuntimeException.class);

        assertThat(Files.readString(dayFile)).isEqualTo(before);
        assertThat(store.findAll(null)).extracting(InspectionRecord::getId).containsExactly("r1", "r2");

        Files.delete(blocker);
        store.update(changed);

        assertThat(store.findById("r1").orElseThrow().getTitle()).isEqualTo("changed");
        assertThat(Files.exists(blocker)).isFalse();
    }
}
