package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.exceptions.InvalidReferenceException;
import com.spreadsheet.calc.exceptions.InvalidTypeException;
import com.spreadsheet.calc.exceptions.LookupMissException;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.Operand;
import com.spreadsheet.calc.models.RangeValue;

import java.util.List;
import java.util.regex.Pattern;

/**
 * VLOOKUP, HLOOKUP, MATCH, INDEX and the reference functions.
 */
final class LookupFunctions {

    static final String CATEGORY = "Lookup";

    private static final int NOT_FOUND = -1;

    private LookupFunctions() {
    }

    static void register(FunctionRegistry registry) {
        registry.register("VLOOKUP", CATEGORY, 3, 4, (ctx, args) -> tableLookup(ctx, args, true));
        registry.register("HLOOKUP", CATEGORY, 3, 4, (ctx, args) -> tableLookup(ctx, args, false));
        registry.register("MATCH", CATEGORY, 2, 3, (ctx, args) -> {
            CellValue lookup = Coercion.value(args.get(0), ctx);
            List<CellValue> vector = vectorOf(args.get(1));
            int type = args.size() > 2 ? Coercion.toInt(args.get(2), ctx) : 1;
            int index;
            if (type == 0) {
                index = exactIndex(vector, lookup);
            } else if (type > 0) {
                index = approximateIndex(vector, lookup);
            } else {
                index = descendingIndex(vector, lookup);
            }
            if (index == NOT_FOUND) {
                throw new LookupMissException("MATCH found no " + lookup);
            }
            return CellValue.of(index + 1);
        });
        registry.register("INDEX", CATEGORY, 2, 3, LookupFunctions::index);
        registry.register("LOOKUP", CATEGORY, 2, 3, LookupFunctions::lookup);
        registry.registerErrorHandling("CHOOSE", CATEGORY, 2, FunctionDefinition.UNBOUNDED, (ctx, args) -> {
            int index = Coercion.toInt(args.get(0), ctx);
            if (index < 1 || index >= args.size()) {
                throw new InvalidTypeException("CHOOSE index out of range: " + index);
            }
            return args.get(index);
        });
        registry.register("INDIRECT", CATEGORY, 1, 2, (ctx, args) -> {
            String reference = Coercion.toText(args.get(0), ctx).trim();
            if (args.size() > 1 && !Coercion.toBoolean(args.get(1), ctx)) {
                throw new InvalidReferenceException("R1C1 references are not supported");
            }
            if (reference.isEmpty()) {
                throw new InvalidReferenceException("Empty reference");
            }
            return ctx.resolveReference(reference);
        });
        registry.register("ROWS", CATEGORY, 1, 1, (ctx, args) -> CellValue.of(Coercion.toRange(args.get(0)).getRows()));
        registry.register("COLUMNS", CATEGORY, 1, 1, (ctx, args) ->
                CellValue.of(Coercion.toRange(args.get(0)).getColumns()));
    }

    /**
     * VLOOKUP / HLOOKUP. A column index below 1 is #VALUE!, past the table #REF!,
     * no matching key #N/A. Approximate mode picks the last key not greater
     * than the lookup value.
     */
    private static Operand tableLookup(FunctionContext ctx, List<Operand> args, boolean vertical) {
        CellValue lookup = Coercion.value(args.get(0), ctx);
        RangeValue table = Coercion.toRange(args.get(1));
        int offset = Coercion.toInt(args.get(2), ctx);
        boolean approximate = args.size() < 4 || Coercion.toBoolean(args.get(3), ctx);
        int width = vertical ? table.getColumns() : table.getRows();
        if (offset < 1) {
            throw new InvalidTypeException("Index must be at least 1");
        }
        if (offset > width) {
            throw new InvalidReferenceException("Index " + offset + " past the table");
        }
        List<CellValue> keys = vertical ? table.column(0) : table.row(0);
        int index = approximate ? approximateIndex(keys, lookup) : exactIndex(keys, lookup);
        if (index == NOT_FOUND) {
            throw new LookupMissException("No match for " + lookup);
        }
        return vertical ? table.get(index, offset - 1) : table.get(offset - 1, index);
    }

    private static Operand index(FunctionContext ctx, List<Operand> args) {
        RangeValue range = Coercion.toRange(args.get(0));
        int first = Coercion.toInt(args.get(1), ctx);
        int row;
        int column;
        if (args.size() < 3) {
            // a single index walks along a vector
            if (range.getRows() == 1) {
                row = 1;
                column = first;
            } else {
                row = first;
                column = range.getColumns() == 1 ? 1 : 0;
            }
        } else {
            row = first;
            column = Coercion.toInt(args.get(2), ctx);
        }
        if (row < 0 || column < 0 || row > range.getRows() || column > range.getColumns()) {
            throw new InvalidReferenceException("INDEX out of range");
        }
        if (row == 0 && column == 0) {
            return range;
        }
        if (row == 0) {
            return slice(range, 0, column - 1, range.getRows(), 1);
        }
        if (column == 0) {
            return slice(range, row - 1, 0, 1, range.getColumns());
        }
        return range.get(row - 1, column - 1);
    }

    private static RangeValue slice(RangeValue range, int row, int column, int rows, int columns) {
        CellValue[] values = new CellValue[rows * columns];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < columns; c++) {
                values[r * columns + c] = range.get(row + r, column + c);
            }
        }
        return new RangeValue(range.getSheetName(), range.getFirstRow() + row,
                range.getFirstColumn() + column, rows, columns, values);
    }

    private static Operand lookup(FunctionContext ctx, List<Operand> args) {
        CellValue lookup = Coercion.value(args.get(0), ctx);
        RangeValue source = Coercion.toRange(args.get(1));
        List<CellValue> keys;
        List<CellValue> results;
        if (args.size() > 2) {
            keys = vectorOf(source);
            results = vectorOf(args.get(2));
        } else if (source.getRows() >= source.getColumns()) {
            keys = source.column(0);
            results = source.column(source.getColumns() - 1);
        } else {
            keys = source.row(0);
            results = source.row(source.getRows() - 1);
        }
        int index = approximateIndex(keys, lookup);
        if (index == NOT_FOUND || index >= results.size()) {
            throw new LookupMissException("LOOKUP found no " + lookup);
        }
        return results.get(index);
    }

    private static List<CellValue> vectorOf(Operand operand) {
        List<CellValue> vector = Coercion.toRange(operand).vector();
        if (vector == null) {
            throw new LookupMissException("Lookup range must be a single row or column");
        }
        return vector;
    }

    static int exactIndex(List<CellValue> keys, CellValue lookup) {
        Pattern pattern = lookup.isText() && (lookup.getText().indexOf('*') >= 0 || lookup.getText().indexOf('?') >= 0)
                ? Criteria.compileWildcard(lookup.getText())
                : null;
        for (int i = 0; i < keys.size(); i++) {
            CellValue key = keys.get(i);
            if (pattern != null) {
                if (key.isText() && pattern.matcher(key.getText()).matches()) {
                    return i;
                }
            } else if (Coercion.matches(key, lookup)) {
                return i;
            }
        }
        return NOT_FOUND;
    }

    /**
     * Last key of the lookup's type not greater than it, stopping at the first
     * greater key (keys are assumed sorted ascending).
     */
    static int approximateIndex(List<CellValue> keys, CellValue lookup) {
        int found = NOT_FOUND;
        for (int i = 0; i < keys.size(); i++) {
            CellValue key = keys.get(i);
            if (!Coercion.sameKind(key, lookup)) {
                continue;
            }
            if (Coercion.compare(key, lookup) > 0) {
                break;
            }
            found = i;
        }
        return found;
    }

    private static int descendingIndex(List<CellValue> keys, CellValue lookup) {
        int found = NOT_FOUND;
        for (int i = 0; i < keys.size(); i++) {
            CellValue key = keys.get(i);
            if (!Coercion.sameKind(key, lookup)) {
                continue;
            }
            if (Coercion.compare(key, lookup) < 0) {
                break;
            }
            found = i;
        }
        return found;
    }
}
