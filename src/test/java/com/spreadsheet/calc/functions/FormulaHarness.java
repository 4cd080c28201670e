package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.exceptions.InvalidReferenceException;
import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.ErrorCode;
import com.spreadsheet.calc.models.NamedRange;
import com.spreadsheet.calc.parser.FormulaParser;
import com.spreadsheet.calc.services.CellReader;
import com.spreadsheet.calc.services.FormulaEvaluator;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * In-memory cells on "Sheet1" and "Data" for evaluating single formulas.
 * Formulas are evaluated as if they sat in Sheet1!Z100.
 */
final class FormulaHarness implements CellReader {

    static final String SHEET = "Sheet1";

    private final Map<String, CellValue> cells = new HashMap<>();
    private final Map<String, NamedRange> names = new HashMap<>();
    private final FormulaParser parser = new FormulaParser(',', this::resolveName);

    FormulaHarness set(String address, Object value) {
        CellAddress parsed = CellAddress.parse(address);
        if (parsed.getSheetName() == null) {
            parsed = parsed.withSheet(SHEET);
        }
        cells.put(parsed.key(), CellValue.fromObject(value));
        return this;
    }

    /**
     * Fills a column downwards starting at the given cell.
     */
    FormulaHarness column(String top, Object... values) {
        CellAddress start = CellAddress.parse(top);
        for (int i = 0; i < values.length; i++) {
            set(start.offset(i, 0).toString(), values[i]);
        }
        return this;
    }

    FormulaHarness name(String name, String reference) {
        CellAddress[] corners = CellAddress.parseRange(reference);
        names.put(name.toUpperCase(Locale.ROOT), new NamedRange(name, null, corners[0], corners[1]));
        return this;
    }

    CellValue eval(String formula) {
        CellAddress current = new CellAddress(SHEET, 26, 100);
        return new FormulaEvaluator(FunctionRegistry.standard(), this, current)
                .evaluate(parser.parse(formula, SHEET).getAst());
    }

    double number(String formula) {
        CellValue value = eval(formula);
        assertTrue(value.isNumber(), () -> formula + " gave " + value);
        return value.getNumber();
    }

    String text(String formula) {
        CellValue value = eval(formula);
        assertTrue(value.isText(), () -> formula + " gave " + value);
        return value.getText();
    }

    boolean bool(String formula) {
        CellValue value = eval(formula);
        assertTrue(value.isBoolean(), () -> formula + " gave " + value);
        return value.getBoolean();
    }

    ErrorCode error(String formula) {
        CellValue value = eval(formula);
        assertTrue(value.isError(), () -> formula + " gave " + value);
        return value.getError();
    }

    @Override
    public CellValue read(CellAddress address) {
        String sheet = address.getSheetName();
        if (!SHEET.equalsIgnoreCase(sheet) && !"Data".equalsIgnoreCase(sheet)) {
            throw new InvalidReferenceException("Unknown sheet: " + sheet);
        }
        CellValue value = cells.get(address.key());
        return value == null ? CellValue.EMPTY : value;
    }

    @Override
    public NamedRange resolveName(String name, String currentSheet) {
        return names.get(name.toUpperCase(Locale.ROOT));
    }
}
