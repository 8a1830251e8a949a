package com.meetadrive.app.services;

import com.meetadrive.app.exceptions.AddressParseException;
import com.meetadrive.app.models.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Evaluates formulas of the shape "=SUM(A1:B3)", "=SUM(A1,B1,C1)" and
 * "=AVERAGE(A1:B3)" against a sheet.
 * Evaluation never throws: a formula that matches no supported shape
 * evaluates to its own body as text.
 */
@Service
public class FormulaEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(FormulaEvaluator.class);

    private static final Pattern CORNER_PREFIX = Pattern.compile("[A-Z]+[0-9]+");

    private static final String DIGITS = "[0-9]+(?:_[0-9]+)*";
    private static final Pattern DECIMAL_NUMBER = Pattern.compile(
            "[+-]?(?:" + DIGITS + "(?:\\.(?:" + DIGITS + ")?)?|\\." + DIGITS + ")(?:[eE][+-]?" + DIGITS + ")?");
    private static final Pattern SPECIAL_NUMBER = Pattern.compile(
            "[+-]?(?:inf|infinity|nan)", Pattern.CASE_INSENSITIVE);

    /**
     * Evaluates a formula (with or without its "=" prefix) against the sheet.
     */
    public EvaluationResult evaluate(String formulaText, Sheet sheet) {
        String body = stripPrefix(formulaText);
        for (AggregateFunction function : AggregateFunction.values()) {
            if (body.startsWith(function.callPrefix()) && body.endsWith(")")) {
                AggregateResult result = aggregate(function, body, sheet);
                if (result != null) {
                    return EvaluationResult.number(result.getValue());
                }
            }
        }
        return EvaluationResult.text(body);
    }

    /**
     * Runs the aggregate a formula body calls, reporting how many cells were
     * used and skipped. Returns null when the argument has no shape the
     * function supports.
     */
    public AggregateResult aggregate(AggregateFunction function, String body, Sheet sheet) {
        String argument = body.substring(function.callPrefix().length(), body.length() - 1);

        List<String> references;
        if (argument.contains(":")) {
            references = expandRange(argument, sheet);
            if (references == null) {
                return null;
            }
        } else if (function.acceptsList()) {
            references = splitList(argument);
        } else {
            return null;
        }

        List<Double> numbers = new ArrayList<>();
        int skipped = 0;
        for (String reference : references) {
            Cell cell = sheet.getCell(reference);
            String value = cell.getValue();
            if (value == null || value.isEmpty()) {
                continue;
            }
            Double number = parseNumber(value);
            if (number == null) {
                logger.debug("Skipping non-numeric cell {} = '{}' in {}", reference, value, body);
                skipped++;
            } else {
                numbers.add(number);
            }
        }
        return new AggregateResult(function.apply(numbers), numbers.size(), skipped);
    }

    /**
     * Re-evaluates every formula cell of the sheet and stores the results
     * as their cached values.
     */
    public void refresh(Sheet sheet) {
        Map<String, Cell> formulaCells = new LinkedHashMap<>();
        for (Map.Entry<String, Cell> entry : sheet.getCells().entrySet()) {
            if (entry.getValue().isFormula()) {
                formulaCells.put(entry.getKey(), entry.getValue());
            }
        }
        for (Map.Entry<String, Cell> entry : formulaCells.entrySet()) {
            Cell cell = entry.getValue();
            sheet.putCell(entry.getKey(), cell.withCachedValue(evaluate(cell.getFormula(), sheet)));
        }
        logger.debug("Re-evaluated {} formula cell(s) in sheet {}", formulaCells.size(), sheet.getId());
    }

    // ----------------------------------------------------------------
    // Argument parsing
    // ----------------------------------------------------------------

    private String stripPrefix(String formulaText) {
        if (formulaText == null) {
            return "";
        }
        String text = formulaText.startsWith(CellUpdate.FORMULA_PREFIX)
                ? formulaText.substring(CellUpdate.FORMULA_PREFIX.length())
                : formulaText;
        return text.trim();
    }

    /**
     * "B3:A1" -> the references of the rectangle A1..B3 that can hold content.
     * Returns null unless the text is two corners that each begin with a valid reference.
     */
    private List<String> expandRange(String argument, Sheet sheet) {
        String[] corners = argument.split(":", -1);
        if (corners.length != 2) {
            return null;
        }
        CellAddress start;
        CellAddress end;
        try {
            start = parseCorner(corners[0]);
            end = parseCorner(corners[1]);
        } catch (AddressParseException e) {
            return null;
        }
        int minRow = Math.min(start.getRow(), end.getRow());
        int maxRow = Math.max(start.getRow(), end.getRow());
        int minCol = Math.min(start.getColumn(), end.getColumn());
        int maxCol = Math.max(start.getColumn(), end.getColumn());

        long area = ((long) maxRow - minRow + 1) * ((long) maxCol - minCol + 1);
        List<String> references = new ArrayList<>();
        if (area > sheet.getCells().size()) {
            // Sparse sheet: only stored cells can contribute
            for (String reference : sheet.getCells().keySet()) {
                if (!CellAddress.isValid(reference)) {
                    continue;
                }
                CellAddress address = CellAddress.parse(reference);
                if (address.getRow() >= minRow && address.getRow() <= maxRow
                        && address.getColumn() >= minCol && address.getColumn() <= maxCol) {
                    references.add(reference);
                }
            }
            return references;
        }
        // long counters: a bound of Integer.MAX_VALUE must not wrap
        for (long row = minRow; row <= maxRow; row++) {
            for (long col = minCol; col <= maxCol; col++) {
                references.add(CellAddress.toReference((int) row, (int) col));
            }
        }
        return references;
    }

    /**
     * Reads a cell literal as a number. Accepts signed decimals with an
     * optional fraction and exponent, digit groups joined by single
     * underscores, surrounding whitespace, and "inf", "infinity" and "nan"
     * in any case. Anything else (hex, "f"/"d" suffixes, ...) returns null.
     */
    static Double parseNumber(String text) {
        String trimmed = text.strip();
        if (SPECIAL_NUMBER.matcher(trimmed).matches()) {
            boolean negative = trimmed.startsWith("-");
            String word = trimmed.replaceFirst("^[+-]", "").toLowerCase(Locale.ROOT);
            if (word.equals("nan")) {
                return Double.NaN;
            }
            return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        if (!DECIMAL_NUMBER.matcher(trimmed).matches()) {
            return null;
        }
        return Double.parseDouble(trimmed.replace("_", ""));
    }

    // A corner only has to start with a reference: "A1 " and "A1x" read as A1, " A1" does not
    private CellAddress parseCorner(String corner) {
        Matcher matcher = CORNER_PREFIX.matcher(corner);
        if (!matcher.lookingAt()) {
            throw new AddressParseException("Invalid range corner: '" + corner + "'");
        }
        return CellAddress.parse(matcher.group());
    }

    private List<String> splitList(String argument) {
        List<String> references = new ArrayList<>();
        for (String item : argument.split(",", -1)) {
            references.add(item.trim());
        }
        return references;
    }
}
