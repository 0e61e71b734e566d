package com.edge.qms.core.compliance;

import com.edge.qms.model.Compliance;
import lombok.Value;

/**
 * 单个测量值的判定结果
 */
@Value
public class Evaluation {
    Double parsedValue;
    Compliance compliance;
    Double deviation;

    public static Evaluation unknown() {
        return new Evaluation(null, Compliance.UNKNOWN, null);
    }

    public static Evaluation pass(Double parsedValue) {
        return new Evaluation(parsedValue, Compliance.PASS, parsedValue != null ? 0.0 : null);
    }

    public static Evaluation fail(Double parsedValue, Double deviation) {
        return new Evaluation(parsedValue, Compliance.FAIL, deviation);
    }
}
