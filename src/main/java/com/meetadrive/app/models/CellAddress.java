package com.meetadrive.app.models;

import com.meetadrive.app.exceptions.AddressParseException;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A zero-based (row, column) position, and the codec between positions
 * and spreadsheet references such as "B3" (row 2, column 1).
 * Column labels use bijective base 26: 0 -> A, 25 -> Z, 26 -> AA.
 */
public final class CellAddress {

    private static final Pattern REFERENCE_PATTERN = Pattern.compile("^([A-Z]+)([0-9]+)$");

    private final int row;
    private final int column;

    public CellAddress(int row, int column) {
        if (row < 0 || column < 0) {
            throw new IllegalArgumentException("Row and column must be non-negative: " + row + ", " + column);
        }
        this.row = row;
        this.column = column;
    }

    public int getRow() {
        return row;
    }

    public int getColumn() {
        return column;
    }

    /**
     * Converts a 0-based column index to its letter label.
     */
    public static String encodeColumn(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Column index must be non-negative: " + index);
        }
        StringBuilder letters = new StringBuilder();
        int remaining = index;
        while (remaining >= 0) {
            letters.insert(0, (char) ('A' + remaining % 26));
            remaining = remaining / 26 - 1;
        }
        return letters.toString();
    }

    /**
     * Converts a column label like "AA" back to its 0-based index.
     */
    public static int decodeColumn(String letters) {
        if (letters == null || letters.isEmpty()) {
            throw new AddressParseException("Column label is empty");
        }
        long result = 0;
        for (int i = 0; i < letters.length(); i++) {
            char c = letters.charAt(i);
            if (c < 'A' || c > 'Z') {
                throw new AddressParseException("Invalid column label: " + letters);
            }
            result = result * 26 + (c - 'A' + 1);
            if (result - 1 > Integer.MAX_VALUE) {
                throw new AddressParseException("Column label out of range: " + letters);
            }
        }
        return (int) (result - 1);
    }

    public static String toReference(int row, int column) {
        return encodeColumn(column) + (row + 1);
    }

    /**
     * Parses a reference like "B3". The whole text must be uppercase letters
     * followed by a positive row number.
     */
    public static CellAddress parse(String text) {
        if (text == null) {
            throw new AddressParseException("Reference is empty");
        }
        Matcher matcher = REFERENCE_PATTERN.matcher(text);
        if (!matcher.matches()) {
            throw new AddressParseException("Invalid cell reference: '" + text + "'");
        }
        int column = decodeColumn(matcher.group(1));
        int rowNumber;
        try {
            rowNumber = Integer.parseInt(matcher.group(2));
        } catch (NumberFormatException e) {
            throw new AddressParseException("Row number out of range: " + text);
        }
        if (rowNumber < 1) {
            throw new AddressParseException("Row number must be positive: " + text);
        }
        return new CellAddress(rowNumber - 1, column);
    }

    /**
     * Like {@link #parse(String)} but answers false instead of throwing.
     */
    public static boolean isValid(String text) {
        try {
            parse(text);
            return true;
        } catch (AddressParseException e) {
            return false;
        }
    }

    public String toReference() {
        return toReference(row, column);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellAddress)) {
            return false;
        }
        CellAddress other = (CellAddress) o;
        return row == other.row && column == other.column;
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, column);
    }

    @Override
    public String toString() {
        return toReference();
    }
}
