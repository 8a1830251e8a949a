package com.meetadrive.app.models;

import java.util.Objects;

/**
 * Content of a single spreadsheet cell. A cell is exactly one of:
 * - EMPTY (never stored in a sheet)
 * - LITERAL: the text the user typed
 * - FORMULA: formula text like "=SUM(A1:A3)" plus the last evaluation
 *   result, which is null until the sheet has been evaluated
 * Instances are immutable; updates produce a new Cell.
 */
public final class Cell {

    public enum Kind {
        EMPTY,
        LITERAL,
        FORMULA
    }

    private static final Cell EMPTY = new Cell(Kind.EMPTY, null, null, null);

    private final Kind kind;
    private final String value;
    private final String formula;
    private final EvaluationResult cachedValue;

    private Cell(Kind kind, String value, String formula, EvaluationResult cachedValue) {
        this.kind = kind;
        this.value = value;
        this.formula = formula;
        this.cachedValue = cachedValue;
    }

    public static Cell empty() {
        return EMPTY;
    }

    /**
     * An empty or null text gives the empty cell.
     */
    public static Cell literal(String value) {
        if (value == null || value.isEmpty()) {
            return EMPTY;
        }
        return new Cell(Kind.LITERAL, value, null, null);
    }

    public static Cell formula(String formula, EvaluationResult cachedValue) {
        if (formula == null || formula.isEmpty()) {
            return EMPTY;
        }
        return new Cell(Kind.FORMULA, null, formula, cachedValue);
    }

    public Cell withCachedValue(EvaluationResult result) {
        if (kind != Kind.FORMULA) {
            return this;
        }
        return new Cell(Kind.FORMULA, null, formula, result);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isEmpty() {
        return kind == Kind.EMPTY;
    }

    public boolean isFormula() {
        return kind == Kind.FORMULA;
    }

    // Literal text, null unless LITERAL
    public String getValue() {
        return value;
    }

    // Formula text, null unless FORMULA
    public String getFormula() {
        return formula;
    }

    public EvaluationResult getCachedValue() {
        return cachedValue;
    }

    /**
     * The string a grid shows. A formula that has not been evaluated
     * shows its own text.
     */
    public String getDisplayValue() {
        switch (kind) {
            case FORMULA:
                return cachedValue != null ? cachedValue.toDisplayString() : formula;
            case LITERAL:
                return value;
            default:
                return "";
        }
    }

    /**
     * What the user would edit: the formula text or the literal text.
     */
    public String getInput() {
        switch (kind) {
            case FORMULA:
                return formula;
            case LITERAL:
                return value;
            default:
                return "";
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Cell)) {
            return false;
        }
        Cell other = (Cell) o;
        return kind == other.kind
                && Objects.equals(value, other.value)
                && Objects.equals(formula, other.formula)
                && Objects.equals(cachedValue, other.cachedValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value, formula, cachedValue);
    }

    @Override
    public String toString() {
        return "Cell{" + kind + ", input='" + getInput() + "', cached=" + cachedValue + "}";
    }
}
