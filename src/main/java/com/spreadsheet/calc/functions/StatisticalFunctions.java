package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.exceptions.DivisionByZeroException;
import com.spreadsheet.calc.exceptions.NumericDomainException;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.Operand;
import com.spreadsheet.calc.models.RangeValue;
import com.spreadsheet.calc.parser.FormulaParser;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Counting, averaging and spread.
 */
final class StatisticalFunctions {

    static final String CATEGORY = "Statistical";

    private StatisticalFunctions() {
    }

    static void register(FunctionRegistry registry) {
        registry.register("AVERAGE", CATEGORY, 1, FunctionDefinition.UNBOUNDED, (ctx, args) ->
                CellValue.of(average(Coercion.numbers(args, ctx))));
        registry.register("MAX", CATEGORY, 1, FunctionDefinition.UNBOUNDED, (ctx, args) -> {
            List<Double> numbers = Coercion.numbers(args, ctx);
            return CellValue.of(numbers.isEmpty() ? 0 : Collections.max(numbers));
        });
        registry.register("MIN", CATEGORY, 1, FunctionDefinition.UNBOUNDED, (ctx, args) -> {
            List<Double> numbers = Coercion.numbers(args, ctx);
            return CellValue.of(numbers.isEmpty() ? 0 : Collections.min(numbers));
        });
        registry.register("MEDIAN", CATEGORY, 1, FunctionDefinition.UNBOUNDED, (ctx, args) -> {
            List<Double> numbers = new ArrayList<>(Coercion.numbers(args, ctx));
            if (numbers.isEmpty()) {
                throw new NumericDomainException("MEDIAN of no numbers");
            }
            Collections.sort(numbers);
            int mid = numbers.size() / 2;
            if (numbers.size() % 2 == 1) {
                return CellValue.of(numbers.get(mid));
            }
            return CellValue.of(average(numbers.subList(mid - 1, mid + 1)));
        });
        registry.register("VAR", CATEGORY, 1, FunctionDefinition.UNBOUNDED, (ctx, args) ->
                CellValue.of(sampleVariance(Coercion.numbers(args, ctx))));
        registry.register("STDEV", CATEGORY, 1, FunctionDefinition.UNBOUNDED, (ctx, args) ->
                CellValue.of(Math.sqrt(sampleVariance(Coercion.numbers(args, ctx)))));

        // COUNT skips errors, COUNTA counts them
        registry.registerErrorHandling("COUNT", CATEGORY, 1, FunctionDefinition.UNBOUNDED, StatisticalFunctions::count);
        registry.registerErrorHandling("COUNTA", CATEGORY, 1, FunctionDefinition.UNBOUNDED, (ctx, args) -> {
            int count = 0;
            for (CellValue value : Coercion.flatten(args)) {
                if (!value.isEmpty()) {
                    count++;
                }
            }
            return CellValue.of(count);
        });
        registry.registerErrorHandling("COUNTBLANK", CATEGORY, 1, 1, (ctx, args) -> {
            int count = 0;
            for (CellValue value : Coercion.toRange(args.get(0)).values()) {
                if (value.isEmpty() || (value.isText() && value.getText().isEmpty())) {
                    count++;
                }
            }
            return CellValue.of(count);
        });
        registry.register("COUNTIF", CATEGORY, 2, 2, (ctx, args) -> {
            RangeValue range = Coercion.toRange(args.get(0));
            return CellValue.of(countTrue(ConditionalRanges.mask(args, range, ctx)));
        });
        registry.register("COUNTIFS", CATEGORY, 2, FunctionDefinition.UNBOUNDED, (ctx, args) -> {
            RangeValue range = Coercion.toRange(args.get(0));
            return CellValue.of(countTrue(ConditionalRanges.mask(args, range, ctx)));
        });
        registry.register("AVERAGEIF", CATEGORY, 2, 3, (ctx, args) -> {
            RangeValue range = Coercion.toRange(args.get(0));
            RangeValue averageRange = args.size() > 2 ? Coercion.toRange(args.get(2)) : range;
            boolean[] mask = ConditionalRanges.mask(args.subList(0, 2), range, ctx);
            return CellValue.of(average(ConditionalRanges.selectNumbers(range, averageRange, mask)));
        });
        registry.register("AVERAGEIFS", CATEGORY, 3, FunctionDefinition.UNBOUNDED, (ctx, args) ->
                CellValue.of(average(selectByCriteria(ctx, args))));
        registry.register("MAXIFS", CATEGORY, 3, FunctionDefinition.UNBOUNDED, (ctx, args) -> {
            List<Double> numbers = selectByCriteria(ctx, args);
            return CellValue.of(numbers.isEmpty() ? 0 : Collections.max(numbers));
        });
        registry.register("MINIFS", CATEGORY, 3, FunctionDefinition.UNBOUNDED, (ctx, args) -> {
            List<Double> numbers = selectByCriteria(ctx, args);
            return CellValue.of(numbers.isEmpty() ? 0 : Collections.min(numbers));
        });
    }

    static double average(List<Double> numbers) {
        if (numbers.isEmpty()) {
            throw new DivisionByZeroException("AVERAGE of no numbers");
        }
        BigDecimal total = BigDecimal.valueOf(MathFunctions.sum(numbers));
        return total.divide(BigDecimal.valueOf(numbers.size()), MathContext.DECIMAL128).doubleValue();
    }

    private static double sampleVariance(List<Double> numbers) {
        if (numbers.size() < 2) {
            throw new DivisionByZeroException("Variance needs two numbers");
        }
        double mean = average(numbers);
        double squares = 0;
        for (double d : numbers) {
            squares += (d - mean) * (d - mean);
        }
        return squares / (numbers.size() - 1);
    }

    private static CellValue count(FunctionContext ctx, List<Operand> args) {
        int count = 0;
        for (Operand arg : args) {
            if (arg.isRange()) {
                for (CellValue value : ((RangeValue) arg).values()) {
                    if (value.isNumber()) {
                        count++;
                    }
                }
            } else {
                CellValue value = (CellValue) arg;
                if (value.isNumber() || value.isBoolean()
                        || (value.isText() && FormulaParser.parseNumber(value.getText().trim()) != null)) {
                    count++;
                }
            }
        }
        return CellValue.of(count);
    }

    private static List<Double> selectByCriteria(FunctionContext ctx, List<Operand> args) {
        RangeValue target = Coercion.toRange(args.get(0));
        boolean[] mask = ConditionalRanges.mask(args.subList(1, args.size()), target, ctx);
        return ConditionalRanges.selectNumbers(target, mask);
    }

    private static int countTrue(boolean[] mask) {
        int count = 0;
        for (boolean b : mask) {
            if (b) {
                count++;
            }
        }
        return count;
    }
}
