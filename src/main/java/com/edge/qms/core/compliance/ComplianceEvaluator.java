package com.edge.qms.core.compliance;

import com.edge.qms.model.Compliance;
import com.edge.qms.model.Criterion;
import com.edge.qms.model.DataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 符合性判定器
 * <p>
 * 根据检验项定义判定单个原始输入值是否合格：
 * - NUMERIC: 解析为浮点数，与上下限比较（闭区间），偏差为相对越界限值的有符号距离
 * - BOOLEAN: yes/true/1 为合格，no/false/0 为不合格，其它为无法判定
 * - SELECT / MULTISELECT: 所选项全部在合格白名单内为合格
 * - TEXT: 无自动判定规则，除非调用方给出显式判定
 * <p>
 * 纯函数，不抛异常：任何无法解析的输入都回退为 UNKNOWN，单个坏值不会中断整条记录的判定。
 */
@Component
public class ComplianceEvaluator {
    private static final Logger logger = LoggerFactory.getLogger(ComplianceEvaluator.class);

    private static final Set<String> TRUE_TOKENS = Set.of("yes", "true", "1");
    private static final Set<String> FALSE_TOKENS = Set.of("no", "false", "0");

    public Evaluation evaluate(Criterion criterion, String rawValue) {
        return evaluate(criterion, rawValue, null, null);
    }

    /**
     * @param override 调用方显式判定（TEXT 类型唯一的判定来源；对其它类型优先于自动规则）
     */
    public Evaluation evaluate(Criterion criterion, String rawValue, Boolean override) {
        return evaluate(criterion, rawValue, override, null);
    }

    /**
     * @param override          调用方显式判定，可为 null
     * @param acceptableOptions 调用方提供的合格选项，为 null 时使用检验项自身配置
     */
    public Evaluation evaluate(Criterion criterion, String rawValue, Boolean override,
                               Collection<String> acceptableOptions) {
        if (criterion == null || criterion.getDataType() == null) {
            logger.warn("Cannot evaluate value '{}': criterion or data type missing", rawValue);
            return Evaluation.unknown();
        }

        Evaluation automatic = evaluateByType(criterion, rawValue, acceptableOptions);
        if (override == null) {
            return automatic;
        }
        // 显式判定只替换符合性，保留解析值
        if (override) {
            return Evaluation.pass(automatic.getParsedValue());
        }
        return Evaluation.fail(automatic.getParsedValue(), automatic.getDeviation());
    }

    private Evaluation evaluateByType(Criterion criterion, String rawValue, Collection<String> acceptableOptions) {
        if (rawValue == null) {
            return Evaluation.unknown();
        }
        switch (criterion.getDataType()) {
            case NUMERIC:
                return evaluateNumeric(criterion, rawValue);
            case BOOLEAN:
                return evaluateBoolean(rawValue);
            case SELECT:
            case MULTISELECT:
                Collection<String> allowed = acceptableOptions != null
                        ? acceptableOptions
                        : criterion.getAcceptableOptionsOrEmpty();
                return evaluateSelection(criterion.getDataType(), rawValue, allowed);
            case TEXT:
            default:
                return Evaluation.unknown();
        }
    }

    private Evaluation evaluateNumeric(Criterion criterion, String rawValue) {
        Double value = parseNumber(rawValue);
        if (value == null) {
            logger.warn("Unparsable numeric value '{}' for criterion {}", rawValue, criterion.getCode());
            return Evaluation.unknown();
        }

        Double lower = criterion.getLowerLimit();
        Double upper = criterion.getUpperLimit();
        if (lower != null && value < lower) {
            return Evaluation.fail(value, value - lower);
        }
        if (upper != null && value > upper) {
            return Evaluation.fail(value, value - upper);
        }
        return Evaluation.pass(value);
    }

    private Evaluation evaluateBoolean(String rawValue) {
        String token = rawValue.trim().toLowerCase(Locale.ROOT);
        if (TRUE_TOKENS.contains(token)) {
            return new Evaluation(1.0, Compliance.PASS, null);
        }
        if (FALSE_TOKENS.contains(token)) {
            return new Evaluation(0.0, Compliance.FAIL, null);
        }
        return Evaluation.unknown();
    }

    private Evaluation evaluateSelection(DataType dataType, String rawValue, Collection<String> allowed) {
        List<String> selections = dataType == DataType.MULTISELECT
                ? splitSelections(rawValue)
                : rawValue.isBlank() ? List.of() : List.of(rawValue.trim());

        if (selections.isEmpty() || allowed == null || allowed.isEmpty()) {
            return Evaluation.unknown();
        }

        Set<String> normalized = allowed.stream()
                .filter(o -> o != null)
                .map(String::trim)
                .collect(Collectors.toSet());
        boolean allAccepted = normalized.containsAll(selections);
        return allAccepted ? new Evaluation(null, Compliance.PASS, null)
                : new Evaluation(null, Compliance.FAIL, null);
    }

    static List<String> splitSelections(String rawValue) {
        return Arrays.stream(rawValue.split("[,;]"))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    /**
     * 解析数值，失败或非有限值返回 null
     */
    static Double parseNumber(String rawValue) {
        if (rawValue == null) {
            return null;
        }
        String trimmed = rawValue.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        try {
            double value = Double.parseDouble(trimmed);
            return Double.isFinite(value) ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
