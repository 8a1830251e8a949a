package com.meetadrive.app.models;

import java.util.Objects;

/**
 * Outcome of evaluating a formula: either a number (a computed aggregate)
 * or text (the formula body, when it matched no supported shape).
 */
public final class EvaluationResult {

    public enum Kind {
        NUMBER,
        TEXT
    }

    private final Kind kind;
    private final double number;
    private final String text;

    private EvaluationResult(Kind kind, double number, String text) {
        this.kind = kind;
        this.number = number;
        this.text = text;
    }

    public static EvaluationResult number(double value) {
        return new EvaluationResult(Kind.NUMBER, value, null);
    }

    public static EvaluationResult text(String value) {
        return new EvaluationResult(Kind.TEXT, 0, Objects.requireNonNull(value, "text"));
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isNumber() {
        return kind == Kind.NUMBER;
    }

    public double getNumber() {
        if (kind != Kind.NUMBER) {
            throw new IllegalStateException("Not a number result: " + text);
        }
        return number;
    }

    public String getText() {
        if (kind != Kind.TEXT) {
            throw new IllegalStateException("Not a text result: " + number);
        }
        return text;
    }

    /**
     * The raw Java value, as stored in a persisted record's "cachedValue".
     */
    public Object toValue() {
        return kind == Kind.NUMBER ? (Object) number : text;
    }

    /**
     * The string a grid shows for this result.
     */
    public String toDisplayString() {
        return kind == Kind.NUMBER ? Double.toString(number) : text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EvaluationResult)) {
            return false;
        }
        EvaluationResult other = (EvaluationResult) o;
        return kind == other.kind
                && Double.compare(number, other.number) == 0
                && Objects.equals(text, other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, number, text);
    }

    @Override
    public String toString() {
        return kind + "(" + toDisplayString() + ")";
    }
}
