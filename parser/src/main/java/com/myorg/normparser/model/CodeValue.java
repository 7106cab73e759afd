package com.myorg.normparser.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;

import java.util.Objects;

/**
 * Raw value of the code column: either the string a cell holds, or its number.
 * Keeps the spreadsheet typing so {@code "101"} and {@code 101} serialize differently.
 */
@EqualsAndHashCode
public final class CodeValue {

    private final String text;
    private final Number number;

    private CodeValue(String text, Number number) {
        this.text = text;
        this.number = number;
    }

    public static CodeValue ofText(String text) {
        return new CodeValue(Objects.requireNonNull(text, "text must not be null"), null);
    }

    /**
     * Integral doubles collapse to {@code Long}, so a numeric cell holding 10101 stays {@code 10101}.
     */
    public static CodeValue ofNumber(double value) {
        if (!Double.isInfinite(value) && value == Math.rint(value) && Math.abs(value) < Long.MAX_VALUE) {
            return new CodeValue(null, (long) value);
        }
        return new CodeValue(null, value);
    }

    public boolean isText() {
        return text != null;
    }

    public boolean isNumber() {
        return number != null;
    }

    public String getText() {
        return text;
    }

    public Number getNumber() {
        return number;
    }

    /**
     * Empty strings and numeric zero count as "no code" for row classification.
     */
    public boolean isAbsent() {
        if (text != null) {
            return text.isEmpty();
        }
        return number.doubleValue() == 0.0;
    }

    /**
     * True when the printed value consists of ASCII digits only.
     */
    public boolean isAllDigits() {
        String s = asString();
        return !s.isEmpty() && s.chars().allMatch(c -> c >= '0' && c <= '9');
    }

    public int length() {
        return asString().length();
    }

    public String asString() {
        if (text != null) {
            return text;
        }
        if (number instanceof Long) {
            return Long.toString(number.longValue());
        }
        return Double.toString(number.doubleValue());
    }

    @JsonValue
    public Object jsonValue() {
        return text != null ? text : number;
    }

    @Override
    public String toString() {
        return text != null ? '"' + text + '"' : asString();
    }
}
