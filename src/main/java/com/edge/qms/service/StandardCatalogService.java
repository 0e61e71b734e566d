package com.edge.qms.service;

import com.edge.qms.config.QmsConfig;
import com.edge.qms.config.StandardCatalog;
import com.edge.qms.model.InspectionRecord;
import com.edge.qms.model.Criterion;
import com.edge.qms.model.InspectionTemplate;
import com.edge.qms.model.Standard;
import com.edge.qms.repository.RecordStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;
import java.util.stream.Collectors;

/**
 * 检验标准目录服务
 * <p>
 * 负责标准、检验项、模板的增删改查，配置自动持久化到 data/standards.json。
 * 写入时校验：
 * - 同一标准内检验项编码唯一
 * - 上下限同时存在时下限不大于上限
 * - 上下限只允许出现在 NUMERIC 检验项上
 * - 模板引用的标准和检验项必须存在
 * - 已有测量记录引用的检验项不能删除，也不能修改数据类型和上下限
 */
@Service
public class StandardCatalogService {
    private static final Logger logger = LoggerFactory.getLogger(StandardCatalogService.class);

    private static final String CONFIG_FILE_NAME = "standards.json";

    @Autowired
    private QmsConfig config;

    @Autowired
    private RecordStore store;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private Path configFilePath;
    private StandardCatalog catalog = new StandardCatalog();

    @PostConstruct
    public void init() {
        Path dataDir = Paths.get(config.getSystem().getDataDir());
        configFilePath = dataDir.resolve(CONFIG_FILE_NAME);
        try {
            Files.createDirectories(dataDir);
        } catch (IOException e) {
            logger.warn("Failed to create data directory: {}", e.getMessage());
        }
        loadCatalog();
        logger.info("StandardCatalogService initialized: {} standards, {} templates, file: {}",
                catalog.getStandards().size(), catalog.getTemplates().size(), configFilePath);
    }

    private void loadCatalog() {
        if (!Files.exists(configFilePath)) {
            catalog = new StandardCatalog();
            return;
        }
        try {
            catalog = objectMapper.readValue(configFilePath.toFile(), StandardCatalog.class);
            if (catalog.getStandards() == null) {
                catalog.setStandards(new LinkedHashMap<>());
            }
            if (catalog.getTemplates() == null) {
                catalog.setTemplates(new LinkedHashMap<>());
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to read standards catalog " + configFilePath, e);
        }
    }

    private void saveCatalog() {
        catalog.setUpdatedAt(System.currentTimeMillis());
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(configFilePath.toFile(), catalog);
            logger.debug("Saved standards catalog to {}", configFilePath);
        } catch (IOException e) {
            throw new RuntimeException("Failed to save standards catalog " + configFilePath, e);
        }
    }

    public synchronized StandardCatalog getCatalog() {
        return catalog;
    }

    // ------------------------------------------------------------------ standards

    public synchronized List<Standard> listStandards() {
        return new ArrayList<>(catalog.getStandards().values());
    }

    public synchronized Optional<Standard> getStandard(String code) {
        return Optional.ofNullable(catalog.getStandards().get(code));
    }

    /**
     * 新增或覆盖标准，检验项按 sortOrder 排列
     */
    public synchronized Standard saveStandard(Standard standard) {
        if (standard == null || isBlank(standard.getCode())) {
            throw new IllegalArgumentException("Standard code is required");
        }
        List<Criterion> criteria = standard.getCriteria() != null ? standard.getCriteria() : List.of();
        validateCriteria(standard.getCode(), criteria);
        Standard existing = catalog.getStandards().get(standard.getCode());
        if (existing != null) {
            checkReferencedCriteria(existing, criteria);
        }

        Standard toSave = standard.toBuilder()
                .criteria(criteria.stream()
                        .sorted(Comparator.comparingInt(Criterion::getSortOrder))
                        .collect(Collectors.toList()))
                .build();
        catalog.getStandards().put(toSave.getCode(), toSave);
        saveCatalog();
        logger.info("Standard {} saved with {} criteria", toSave.getCode(), criteria.size());
        return toSave;
    }

    public synchronized void deleteStandard(String code) {
        List<String> referencing = catalog.getTemplates().values().stream()
                .filter(t -> code.equals(t.getStandardCode()))
                .map(InspectionTemplate::getId)
                .collect(Collectors.toList());
        if (!referencing.isEmpty()) {
            throw new IllegalStateException("Standard " + code + " is used by templates " + referencing);
        }
        if (!referencedCriterionCodes(code).isEmpty()) {
            throw new IllegalStateException("Standard " + code + " is referenced by recorded measurements");
        }
        if (catalog.getStandards().remove(code) != null) {
            saveCatalog();
            logger.info("Standard {} deleted", code);
        }
    }

    /**
     * 被测量记录引用过的检验项，替换后必须保留，且数据类型和上下限不变
     */
    private void checkReferencedCriteria(Standard existing, List<Criterion> replacement) {
        Set<String> referenced = referencedCriterionCodes(existing.getCode());
        for (String code : referenced) {
            Criterion current = existing.findCriterion(code).orElse(null);
            if (current == null) {
                continue;
            }
            Criterion updated = replacement.stream()
                    .filter(c -> code.equals(c.getCode()))
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException("Criterion " + code + " of standard "
                            + existing.getCode() + " is referenced by recorded measurements and cannot be removed"));
            if (current.getDataType() != updated.getDataType()
                    || !Objects.equals(current.getLowerLimit(), updated.getLowerLimit())
                    || !Objects.equals(current.getUpperLimit(), updated.getUpperLimit())) {
                throw new IllegalStateException("Criterion " + code + " of standard " + existing.getCode()
                        + " is referenced by recorded measurements, its data type and limits cannot change");
            }
        }
    }

    private Set<String> referencedCriterionCodes(String standardCode) {
        Set<String> codes = new HashSet<>();
        for (InspectionRecord record : store.findAll(null)) {
            if (standardCode.equals(record.getStandardCode())) {
                record.getItems().forEach(item -> codes.add(item.getCriterionCode()));
            }
        }
        return codes;
    }

    private void validateCriteria(String standardCode, List<Criterion> criteria) {
        Set<String> codes = new HashSet<>();
        for (Criterion criterion : criteria) {
            if (isBlank(criterion.getCode())) {
                throw new IllegalArgumentException("Criterion code is required in standard " + standardCode);
            }
            if (!codes.add(criterion.getCode())) {
                throw new IllegalArgumentException("Duplicate criterion code " + criterion.getCode()
                        + " in standard " + standardCode);
            }
            if (criterion.getDataType() == null) {
                throw new IllegalArgumentException("Criterion " + criterion.getCode() + " has no data type");
            }
            boolean hasLimits = criterion.getLowerLimit() != null || criterion.getUpperLimit() != null;
            if (hasLimits && !criterion.isNumeric()) {
                throw new IllegalArgumentException("Criterion " + criterion.getCode()
                        + ": limits are only allowed on NUMERIC criteria");
            }
            if (!criterion.hasValidLimits()) {
                throw new IllegalArgumentException("Criterion " + criterion.getCode() + ": lower limit "
                        + criterion.getLowerLimit() + " is greater than upper limit " + criterion.getUpperLimit());
            }
        }
    }

    // ------------------------------------------------------------------ templates

    public synchronized List<InspectionTemplate> listTemplates() {
        return new ArrayList<>(catalog.getTemplates().values());
    }

    public synchronized Optional<InspectionTemplate> getTemplate(String templateId) {
        return Optional.ofNullable(catalog.getTemplates().get(templateId));
    }

    public synchronized InspectionTemplate saveTemplate(InspectionTemplate template) {
        if (template == null || isBlank(template.getStandardCode())) {
            throw new IllegalArgumentException("Template must reference a standard");
        }
        Standard standard = getStandard(template.getStandardCode())
                .orElseThrow(() -> new IllegalArgumentException("Standard not found: " + template.getStandardCode()));

        List<String> codes = template.getCriterionCodes() != null ? template.getCriterionCodes() : List.of();
        for (String code : codes) {
            if (standard.findCriterion(code).isEmpty()) {
                throw new IllegalArgumentException("Criterion " + code + " not found in standard " + standard.getCode());
            }
        }

        InspectionTemplate toSave = template.toBuilder()
                .id(isBlank(template.getId()) ? UUID.randomUUID().toString() : template.getId())
                .criterionCodes(List.copyOf(new LinkedHashSet<>(codes)))
                .build();
        catalog.getTemplates().put(toSave.getId(), toSave);
        saveCatalog();
        logger.info("Template {} saved ({} fields, standard {})", toSave.getId(), codes.size(), standard.getCode());
        return toSave;
    }

    public synchronized void deleteTemplate(String templateId) {
        if (catalog.getTemplates().remove(templateId) != null) {
            saveCatalog();
            logger.info("Template {} deleted", templateId);
        }
    }

    /**
     * 模板字段对应的检验项，按模板顺序
     */
    public synchronized List<Criterion> resolveCriteria(String templateId) {
        InspectionTemplate template = getTemplate(templateId)
                .orElseThrow(() -> new IllegalArgumentException("Template not found: " + templateId));
        Standard standard = getStandard(template.getStandardCode()).orElse(null);
        if (standard == null) {
            logger.warn("Template {} references missing standard {}", templateId, template.getStandardCode());
            return List.of();
        }
        List<Criterion> result = new ArrayList<>();
        for (String code : template.getCriterionCodes()) {
            standard.findCriterion(code).ifPresent(result::add);
        }
        return result;
    }

    public synchronized Optional<Criterion> findCriterion(String templateId, String criterionCode) {
        return resolveCriteria(templateId).stream()
                .filter(c -> c.getCode().equals(criterionCode))
                .findFirst();
    }

    /**
     * 按编码在所有标准中查找检验项（用于跨模板报表）
     */
    public synchronized Optional<Criterion> findCriterionInStandard(String standardCode, String criterionCode) {
        return getStandard(standardCode).flatMap(s -> s.findCriterion(criterionCode));
    }

    // Getters and Setters

    public void setConfig(QmsConfig config) {
        this.config = config;
    }

    public void setStore(RecordStore store) {
        this.store = store;
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
