package com.edge.qms.service;

import com.edge.qms.config.QmsConfig;
import com.edge.qms.model.*;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StandardCatalogServiceTest {

    @TempDir
    Path dataDir;

    private QmsFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new QmsFixture(dataDir).withDefaultCatalog();
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void catalogIsPersistedAndReloaded() {
        assertThat(Files.exists(dataDir.resolve("standards.json"))).isTrue();

        QmsConfig config = new QmsConfig();
        config.getSystem().setDataDir(dataDir.toString());
        StandardCatalogService reloaded = new StandardCatalogService();
        reloaded.setConfig(config);
        reloaded.init();

        assertThat(reloaded.getStandard("ISO-2859")).isPresent();
        Criterion diameter = reloaded.findCriterion(QmsFixture.TEMPLATE_ID, "DIM-001").orElseThrow();
        assertThat(diameter.getLowerLimit()).isEqualTo(99.5);
        assertThat(diameter.getUpperLimit()).isEqualTo(100.5);
        assertThat(diameter.getSeverity()).isEqualTo(Severity.CRITICAL);
    }

    @Test
    void resolvesTemplateCriteriaInTemplateOrder() {
        assertThat(fixture.catalogService.resolveCriteria(QmsFixture.TEMPLATE_ID))
                .extracting(Criterion::getCode)
                .containsExactly("DIM-001", "VIS-001", "NOTE", "SEAL-001");
    }

    @Test
    void invertedLimitsAreRejected() {
        Standard standard = Standard.builder().code("BAD").criteria(List.of(
                Criterion.builder().code("X").dataType(DataType.NUMERIC).lowerLimit(10.0).upperLimit(1.0).build()))
                .build();

        assertThatThrownBy(() -> fixture.catalogService.saveStandard(standard))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("greater than upper limit");
        assertThat(fixture.catalogService.getStandard("BAD")).isEmpty();
    }

    @Test
    void duplicateCriterionCodesAreRejected() {
        Criterion c = Criterion.builder().code("X").dataType(DataType.BOOLEAN).build();
        Standard standard = Standard.builder().code("DUP").criteria(List.of(c, c)).build();

        assertThatThrownBy(() -> fixture.catalogService.saveStandard(standard))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate");
    }

    @Test
    void limitsOnNonNumericCriterionAreRejected() {
        Standard standard = Standard.builder().code("S").criteria(List.of(
                Criterion.builder().code("X").dataType(DataType.TEXT).upperLimit(1.0).build())).build();

        assertThatThrownBy(() -> fixture.catalogService.saveStandard(standard))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void templateMustReferenceExistingCriteria() {
        InspectionTemplate template = InspectionTemplate.builder()
                .standardCode("ISO-2859").criterionCodes(List.of("NOPE")).build();

        assertThatThrownBy(() -> fixture.catalogService.saveTemplate(template))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void templateWithoutIdGetsOne() {
        InspectionTemplate saved = fixture.catalogService.saveTemplate(InspectionTemplate.builder()
                .standardCode("ISO-2859").criterionCodes(List.of("DIM-001")).build());

        assertThat(saved.getId()).isNotBlank();
        assertThat(fixture.catalogService.getTemplate(saved.getId())).isPresent();
    }

    @Test
    void standardInUseCannotBeDeleted() {
        assertThatThrownBy(() -> fixture.catalogService.deleteStandard("ISO-2859"))
                .isInstanceOf(IllegalStateException.class);

        fixture.catalogService.deleteTemplate(QmsFixture.TEMPLATE_ID);
        fixture.catalogService.deleteStandard("ISO-2859");

        assertThat(fixture.catalogService.listStandards()).isEmpty();
    }

    private Standard isoWithDiameter(Criterion diameter) {
        Standard current = fixture.catalogService.getStandard("ISO-2859").orElseThrow();
        List<Criterion> criteria = new ArrayList<>();
        for (Criterion c : current.getCriteria()) {
            if (!"DIM-001".equals(c.getCode())) {
                criteria.add(c);
            }
        }
        if (diameter != null) {
            criteria.add(diameter);
        }
        return current.toBuilder().criteria(criteria).build();
    }

    @Test
    void measuredCriterionCannotBeRedefined() {
        fixture.recordWithDiameter("100.6");
        fixture.recordWithDiameter("100.0");
        Criterion diameter = fixture.catalogService.findCriterion(QmsFixture.TEMPLATE_ID, "DIM-001").orElseThrow();

        assertThatThrownBy(() -> fixture.catalogService.saveStandard(isoWithDiameter(
                diameter.toBuilder().dataType(DataType.TEXT).lowerLimit(null).upperLimit(null).build())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("DIM-001");
        assertThatThrownBy(() -> fixture.catalogService.saveStandard(isoWithDiameter(
                diameter.toBuilder().upperLimit(101.0).build())))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> fixture.catalogService.saveStandard(isoWithDiameter(null)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("cannot be removed");

        Criterion stored = fixture.catalogService.findCriterion(QmsFixture.TEMPLATE_ID, "DIM-001").orElseThrow();
        assertThat(stored.getDataType()).isEqualTo(DataType.NUMERIC);
        assertThat(stored.getUpperLimit()).isEqualTo(100.5);
        assertThat(fixture.statisticsService.templateStatistics(QmsFixture.TEMPLATE_ID, null)).hasSize(1);
    }

    @Test
    void measuredCriterionAcceptsDescriptiveChanges() {
        fixture.recordWithDiameter("100.0");
        Criterion diameter = fixture.catalogService.findCriterion(QmsFixture.TEMPLATE_ID, "DIM-001").orElseThrow();

        fixture.catalogService.saveStandard(isoWithDiameter(diameter.toBuilder().title("外径 (修订)").build()));

        assertThat(fixture.catalogService.findCriterion(QmsFixture.TEMPLATE_ID, "DIM-001").orElseThrow().getTitle())
                .isEqualTo("外径 (修订)");
    }

    @Test
    void unmeasuredCriterionCanStillBeRedefined() {
        Criterion diameter = fixture.catalogService.findCriterion(QmsFixture.TEMPLATE_ID, "DIM-001").orElseThrow();

        fixture.catalogService.saveStandard(isoWithDiameter(diameter.toBuilder().upperLimit(101.0).build()));

        assertThat(fixture.catalogService.findCriterion(QmsFixture.TEMPLATE_ID, "DIM-001").orElseThrow().getUpperLimit())
                .isEqualTo(101.0);
    }

    @Test
    void standardWithRecordsCannotBeDeleted() {
        fixture.recordWithDiameter("100.0");
        fixture.catalogService.deleteTemplate(QmsFixture.TEMPLATE_ID);

        assertThatThrownBy(() -> fixture.catalogService.deleteStandard("ISO-2859"))
                .isInstanceOf(IllegalStateException.class);
    }
}
