package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.exceptions.CellErrorException;
import com.spreadsheet.calc.exceptions.InvalidTypeException;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.Operand;
import com.spreadsheet.calc.models.RangeValue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Shared plumbing of the *IF and *IFS functions: criteria range/criteria pairs
 * reduce to a mask over the target range.
 */
final class ConditionalRanges {

    private ConditionalRanges() {
    }

    /**
     * Evaluates (criteria_range, criteria) pairs. Every criteria range must
     * have the shape of the target.
     */
    static boolean[] mask(List<Operand> pairs, RangeValue target, FunctionContext ctx) {
        if (pairs.size() % 2 != 0) {
            throw new InvalidTypeException("Criteria arguments must come in pairs");
        }
        boolean[] mask = new boolean[target.size()];
        Arrays.fill(mask, true);
        for (int p = 0; p < pairs.size(); p += 2) {
            RangeValue range = Coercion.toRange(pairs.get(p));
            if (range.getRows() != target.getRows() || range.getColumns() != target.getColumns()) {
                throw new InvalidTypeException("Criteria range differs in size");
            }
            Criteria criteria = Criteria.parse(Coercion.scalar(pairs.get(p + 1), ctx));
            List<CellValue> values = range.values();
            for (int i = 0; i < mask.length; i++) {
                mask[i] = mask[i] && criteria.test(values.get(i));
            }
        }
        return mask;
    }

    static List<Double> selectNumbers(RangeValue range, boolean[] mask) {
        return selectNumbers(range, range, mask);
    }

    /**
     * Numbers of valueRange at the positions selected in shape. Positions
     * outside valueRange read as empty.
     */
    static List<Double> selectNumbers(RangeValue shape, RangeValue valueRange, boolean[] mask) {
        List<Double> numbers = new ArrayList<>();
        for (int i = 0; i < mask.length; i++) {
            if (!mask[i]) {
                continue;
            }
            int row = i / shape.getColumns();
            int column = i % shape.getColumns();
            if (row >= valueRange.getRows() || column >= valueRange.getColumns()) {
                continue;
            }
            CellValue value = valueRange.get(row, column);
            if (value.isError()) {
                throw CellErrorException.of(value.getError(), "Error in range");
            }
            if (value.isNumber()) {
                numbers.add(value.getNumber());
            }
        }
        return numbers;
    }
}
