package com.edge.qms.service;

import com.edge.qms.core.compliance.ComplianceEvaluator;
import com.edge.qms.core.summary.RecordSummaryCalculator;
import com.edge.qms.event.RecordFinalizedEvent;
import com.edge.qms.model.*;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;

import java.nio.file.Path;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;
import static org.mockito.Mockito.*;

class RecordServiceTest {

    @TempDir
    Path dataDir;

    private QmsFixture fixture;
    private RecordService service;
    private ApplicationEventPublisher publisher;

    @BeforeEach
    void setUp() {
        fixture = new QmsFixture(dataDir).withDefaultCatalog();
        publisher = mock(ApplicationEventPublisher.class);
        service = new RecordService();
        service.setStore(fixture.store);
        service.setCatalogService(fixture.catalogService);
        service.setEvaluator(new ComplianceEvaluator());
        service.setSummaryCalculator(new RecordSummaryCalculator());
        service.setEventPublisher(publisher);
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void newRecordIsDraftWithZeroScore() {
        InspectionRecord record = service.createRecord(QmsFixture.TEMPLATE_ID, null, "B1", "QA", "alice");

        assertThat(record.getStatus()).isEqualTo(RecordStatus.DRAFT);
        assertThat(record.getComplianceScore()).isEqualTo(0.0);
        assertThat(record.getTitle()).isEqualTo("来料检验");
        assertThat(record.getStandardCode()).isEqualTo("ISO-2859");
        assertThat(record.getRecordNumber()).matches("REC-\\d{14}(-\\d+)?");
        assertThat(service.getRecord(record.getId())).isPresent();
    }

    @Test
    void recordNumbersAreUniqueWithinTheSameSecond() {
        String first = service.createRecord(QmsFixture.TEMPLATE_ID, null, null, null, null).getRecordNumber();
        String second = service.createRecord(QmsFixture.TEMPLATE_ID, null, null, null, null).getRecordNumber();

        assertThat(first).isNotEqualTo(second);
    }

    @Test
    void unknownTemplateIsRejected() {
        assertThatThrownBy(() -> service.createRecord("missing", null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void measurementsDriveTheRecordSummary() {
        String id = service.createRecord(QmsFixture.TEMPLATE_ID, null, null, null, null).getId();

        service.recordMeasurement(id, "DIM-001", "99.9", "alice", null, null);
        service.recordMeasurement(id, "VIS-001", "Scratched", "alice", null, null);
        InspectionRecord record = service.recordMeasurement(id, "NOTE", "ok", "alice", true, "looks fine");

        assertThat(record.getItems()).extracting(MeasurementItem::getCompliance)
                .containsExactly(Compliance.PASS, Compliance.FAIL, Compliance.PASS);
        assertThat(record.getComplianceScore()).isEqualTo(66.67);
        assertThat(record.getOverallCompliance()).isFalse();
        assertThat(record.getFailedItemsCount()).isEqualTo(1);

        InspectionRecord stored = service.getRecord(id).orElseThrow();
        assertThat(stored.getComplianceScore()).isEqualTo(66.67);
        assertThat(stored.getItems()).hasSize(3);
    }

    @Test
    void outOfLimitValueFailsWithSignedDeviation() {
        String id = service.createRecord(QmsFixture.TEMPLATE_ID, null, null, null, null).getId();

        InspectionRecord record = service.recordMeasurement(id, "DIM-001", "100.6", "alice", null, null);

        MeasurementItem item = record.getItems().get(0);
        assertThat(item.getCompliance()).isEqualTo(Compliance.FAIL);
        assertThat(item.getNumericValue()).isEqualTo(100.6);
        assertThat(item.getDeviation()).isCloseTo(0.1, offset(1e-9));
    }

    @Test
    void repeatedMeasurementReplacesThePreviousItem() {
        String id = service.createRecord(QmsFixture.TEMPLATE_ID, null, null, null, null).getId();
        service.recordMeasurement(id, "DIM-001", "100.6", "alice", null, null);

        InspectionRecord record = service.recordMeasurement(id, "DIM-001", "100.0", "alice", null, null);

        assertThat(record.getItems()).hasSize(1);
        assertThat(record.getItems().get(0).getCompliance()).isEqualTo(Compliance.PASS);
        assertThat(record.getOverallCompliance()).isTrue();
        assertThat(record.getComplianceScore()).isEqualTo(100.0);
    }

    @Test
    void criterionOutsideTemplateIsRejected() {
        String id = service.createRecord(QmsFixture.TEMPLATE_ID, null, null, null, null).getId();

        assertThatThrownBy(() -> service.recordMeasurement(id, "OTHER", "1", "alice", null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unknownRecordIsNotFound() {
        assertThatThrownBy(() -> service.recordMeasurement("missing", "DIM-001", "1", "alice", null, null))
                .isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void finalizedRecordOnlyAcceptsCorrections() {
        String id = service.createRecord(QmsFixture.TEMPLATE_ID, null, null, null, null).getId();
        service.recordMeasurement(id, "DIM-001", "100.6", "alice", null, null);
        service.changeStatus(id, RecordStatus.SUBMITTED);
        service.changeStatus(id, RecordStatus.APPROVED);

        assertThatThrownBy(() -> service.recordMeasurement(id, "DIM-001", "100.0", "alice", null, null))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> service.correctMeasurement(id, "DIM-001", "100.0", "bob", null, " "))
                .isInstanceOf(IllegalArgumentException.class);

        InspectionRecord corrected = service.correctMeasurement(id, "DIM-001", "100.0", "bob", null,
                "gauge recalibrated");

        MeasurementItem item = corrected.getItems().get(0);
        assertThat(item.isCorrected()).isTrue();
        assertThat(item.getCorrectionReason()).isEqualTo("gauge recalibrated");
        assertThat(item.getMeasuredBy()).isEqualTo("bob");
        assertThat(corrected.getOverallCompliance()).isTrue();
        assertThat(corrected.getStatus()).isEqualTo(RecordStatus.APPROVED);
    }

    @Test
    void correctionRequiresAnExistingMeasurement() {
        String id = service.createRecord(QmsFixture.TEMPLATE_ID, null, null, null, null).getId();

        assertThatThrownBy(() -> service.correctMeasurement(id, "DIM-001", "100", "bob", null, "typo"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void finalizingPublishesEventAndSetsCompletion() {
        String id = service.createRecord(QmsFixture.TEMPLATE_ID, null, null, null, null).getId();

        InspectionRecord submitted = service.changeStatus(id, RecordStatus.SUBMITTED);
        assertThat(submitted.getCompletedAt()).isNull();
        verifyNoInteractions(publisher);

        InspectionRecord approved = service.changeStatus(id, RecordStatus.APPROVED);
        assertThat(approved.getCompletedAt()).isNotNull();

        ArgumentCaptor<RecordFinalizedEvent> captor = ArgumentCaptor.forClass(RecordFinalizedEvent.class);
        verify(publisher).publishEvent(captor.capture());
        assertThat(captor.getValue().getRecord().getId()).isEqualTo(id);
        assertThat(captor.getValue().getPreviousStatus()).isEqualTo(RecordStatus.SUBMITTED);
    }

    @Test
    void illegalTransitionIsRejected() {
        String id = service.createRecord(QmsFixture.TEMPLATE_ID, null, null, null, null).getId();

        assertThatThrownBy(() -> service.changeStatus(id, RecordStatus.APPROVED))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> service.changeStatus(id, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void reopeningARejectedRecordClearsCompletion() {
        String id = service.createRecord(QmsFixture.TEMPLATE_ID, null, null, null, null).getId();
        service.changeStatus(id, RecordStatus.SUBMITTED);
        service.changeStatus(id, RecordStatus.REJECTED);

        InspectionRecord reopened = service.changeStatus(id, RecordStatus.DRAFT);

        assertThat(reopened.getCompletedAt()).isNull();
        assertThat(service.recordMeasurement(id, "DIM-001", "100", "alice", null, null).getItems()).hasSize(1);
    }

    @Test
    void queryFiltersByStatusAndLimit() {
        String a = service.createRecord(QmsFixture.TEMPLATE_ID, "a", null, null, null).getId();
        service.createRecord(QmsFixture.TEMPLATE_ID, "b", null, null, null);
        service.createRecord(QmsFixture.TEMPLATE_ID, "c", null, null, null);
        service.changeStatus(a, RecordStatus.SUBMITTED);

        assertThat(service.queryRecords(null, QmsFixture.TEMPLATE_ID, RecordStatus.SUBMITTED, null))
                .extracting(InspectionRecord::getId).containsExactly(a);
        assertThat(service.queryRecords(null, null, null, 2)).hasSize(2);
        assertThat(service.countRecords()).isEqualTo(3);
    }

    @Test
    void deleteRemovesTheRecord() {
        String id = service.createRecord(QmsFixture.TEMPLATE_ID, null, null, null, null).getId();

        service.deleteRecord(id);

        assertThat(service.getRecord(id)).isEmpty();
        assertThatThrownBy(() -> service.deleteRecord(id)).isInstanceOf(NoSuchElementException.class);
    }
}
