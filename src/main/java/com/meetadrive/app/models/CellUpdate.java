package com.meetadrive.app.models;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A partial update of a cell. Each field is either absent (left untouched)
 * or present, and a present null clears the stored field.
 * JSON bodies like {"value": "42", "formula": null} bind through the setters,
 * which is how presence is tracked.
 */
public class CellUpdate {

    public static final String FORMULA_PREFIX = "=";

    private String value;
    private boolean valuePresent;
    private String formula;
    private boolean formulaPresent;
    private EvaluationResult cachedValue;
    private boolean cachedValuePresent;

    // Default constructor needed for JSON deserialization
    public CellUpdate() {
    }

    /**
     * What committing a line of user input does: text starting with "="
     * becomes a formula, anything else a literal. The other field is cleared.
     */
    public static CellUpdate fromInput(String input) {
        CellUpdate update = new CellUpdate();
        if (input != null && input.startsWith(FORMULA_PREFIX)) {
            update.setFormula(input);
            update.setValue(null);
        } else {
            update.setValue(input);
            update.setFormula(null);
        }
        return update;
    }

    public static CellUpdate literal(String value) {
        CellUpdate update = new CellUpdate();
        update.setValue(value);
        update.setFormula(null);
        return update;
    }

    public static CellUpdate formula(String formula) {
        CellUpdate update = new CellUpdate();
        update.setFormula(formula);
        update.setValue(null);
        return update;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
        this.valuePresent = true;
    }

    public String getFormula() {
        return formula;
    }

    public void setFormula(String formula) {
        this.formula = formula;
        this.formulaPresent = true;
    }

    @JsonIgnore
    public EvaluationResult getCachedValue() {
        return cachedValue;
    }

    @JsonIgnore
    public void setCachedValue(EvaluationResult cachedValue) {
        this.cachedValue = cachedValue;
        this.cachedValuePresent = true;
    }

    @JsonIgnore
    public boolean hasValue() {
        return valuePresent;
    }

    @JsonIgnore
    public boolean hasFormula() {
        return formulaPresent;
    }

    @JsonIgnore
    public boolean hasCachedValue() {
        return cachedValuePresent;
    }

    /**
     * True when the update changes what the sheet's formulas can see,
     * so the sheet has to be re-evaluated.
     */
    @JsonIgnore
    public boolean touchesContent() {
        return valuePresent || formulaPresent;
    }

    /**
     * Merges this update into the current cell content.
     * A non-empty formula wins over a non-empty value; whichever is set
     * clears the other, so the result is never both.
     */
    public Cell applyTo(Cell current) {
        if (formulaPresent && formula != null && !formula.isEmpty()) {
            return Cell.formula(formula, cachedValuePresent ? cachedValue : null);
        }
        if (valuePresent && value != null && !value.isEmpty()) {
            return Cell.literal(value);
        }

        String mergedFormula = formulaPresent ? formula : current.getFormula();
        String mergedValue = valuePresent ? value : current.getValue();
        if (mergedFormula != null && !mergedFormula.isEmpty()) {
            EvaluationResult cached = cachedValuePresent ? cachedValue : current.getCachedValue();
            return Cell.formula(mergedFormula, cached);
        }
        return Cell.literal(mergedValue);
    }
}
