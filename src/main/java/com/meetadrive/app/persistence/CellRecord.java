package com.meetadrive.app.persistence;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Persisted form of one cell: {"value": "5"} or
 * {"formula": "=SUM(A1:A3)", "cachedValue": 12.0}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CellRecord {
    private String value;
    private String formula;
    // Number or String; written for readers of the file, never trusted on load
    private Object cachedValue;

    public CellRecord() {
    }

    public CellRecord(String value, String formula, Object cachedValue) {
        this.value = value;
        this.formula = formula;
        this.cachedValue = cachedValue;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }

    public String getFormula() {
        return formula;
    }

    public void setFormula(String formula) {
        this.formula = formula;
    }

    public Object getCachedValue() {
        return cachedValue;
    }

    public void setCachedValue(Object cachedValue) {
        this.cachedValue = cachedValue;
    }
}
