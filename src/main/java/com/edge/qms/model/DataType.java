package com.edge.qms.model;

/**
 * 检验项数据类型
 */
public enum DataType {
    NUMERIC,
    BOOLEAN,
    SELECT,
    MULTISELECT,
    TEXT;

    public boolean isSelect() {
        return this == SELECT || this == MULTISELECT;
    }
}
