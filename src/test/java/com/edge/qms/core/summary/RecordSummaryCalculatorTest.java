package com.edge.qms.core.summary;

import com.edge.qms.model.Compliance;
import com.edge.qms.model.MeasurementItem;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RecordSummaryCalculatorTest {

    private final RecordSummaryCalculator calculator = new RecordSummaryCalculator();

    private static MeasurementItem item(Compliance compliance) {
        return MeasurementItem.builder().criterionCode("C").compliance(compliance).build();
    }

    @Test
    void twoPassesOneFail() {
        RecordSummary summary = calculator.recompute(List.of(
                item(Compliance.PASS), item(Compliance.FAIL), item(Compliance.PASS)));

        assertThat(summary.getComplianceScore()).isEqualTo(66.67);
        assertThat(summary.getOverallCompliance()).isFalse();
        assertThat(summary.getFailedCount()).isEqualTo(1);
        assertThat(summary.getPassedCount()).isEqualTo(2);
    }

    @Test
    void unknownItemsAreExcludedFromDenominator() {
        RecordSummary summary = calculator.recompute(List.of(
                item(Compliance.PASS), item(Compliance.UNKNOWN), item(Compliance.UNKNOWN)));

        assertThat(summary.getComplianceScore()).isEqualTo(100.0);
        assertThat(summary.getOverallCompliance()).isTrue();
        assertThat(summary.getEvaluatedCount()).isEqualTo(1);
    }

    @Test
    void nothingEvaluatedLeavesOverallUndetermined() {
        RecordSummary onlyUnknown = calculator.recompute(List.of(item(Compliance.UNKNOWN)));
        RecordSummary empty = calculator.recompute(List.of());

        assertThat(onlyUnknown.getComplianceScore()).isEqualTo(0.0);
        assertThat(onlyUnknown.getOverallCompliance()).isNull();
        assertThat(empty.getOverallCompliance()).isNull();
        assertThat(empty.getFailedCount()).isZero();
    }

    @Test
    void roundsHalfUp() {
        // 1/8 = 12.5%
        List<MeasurementItem> items = new ArrayList<>();
        items.add(item(Compliance.PASS));
        for (int i = 0; i < 7; i++) {
            items.add(item(Compliance.FAIL));
        }
        assertThat(calculator.recompute(items).getComplianceScore()).isEqualTo(12.5);
        assertThat(new RecordSummaryCalculator(0).recompute(items).getComplianceScore()).isEqualTo(13.0);
    }

    @Test
    void recomputeIsIdempotent() {
        List<MeasurementItem> items = List.of(item(Compliance.PASS), item(Compliance.FAIL));

        assertThat(calculator.recompute(items)).isEqualTo(calculator.recompute(items));
    }
}
