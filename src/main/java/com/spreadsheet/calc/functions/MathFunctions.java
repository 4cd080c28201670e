package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.exceptions.CellErrorException;
import com.spreadsheet.calc.exceptions.DivisionByZeroException;
import com.spreadsheet.calc.exceptions.InvalidTypeException;
import com.spreadsheet.calc.exceptions.NumericDomainException;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.Operand;
import com.spreadsheet.calc.models.RangeValue;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Arrays;
import java.util.List;
import java.util.function.DoubleUnaryOperator;

/**
 * SUM family, rounding and elementary math.
 */
final class MathFunctions {

    static final String CATEGORY = "Math";

    // below this every double rounds to 0 (or away from it, to 1E+308 at most)
    private static final int MIN_ROUNDING_DIGITS = -308;

    private MathFunctions() {
    }

    static void register(FunctionRegistry registry) {
        registry.register("SUM", CATEGORY, 1, FunctionDefinition.UNBOUNDED, (ctx, args) ->
                CellValue.of(sum(Coercion.numbers(args, ctx))));
        registry.register("PRODUCT", CATEGORY, 1, FunctionDefinition.UNBOUNDED, (ctx, args) -> {
            BigDecimal product = BigDecimal.ONE;
            for (double d : Coercion.numbers(args, ctx)) {
                product = product.multiply(BigDecimal.valueOf(d), MathContext.DECIMAL128);
            }
            return CellValue.of(product);
        });
        registry.register("SUMIF", CATEGORY, 2, 3, MathFunctions::sumIf);
        registry.register("SUMIFS", CATEGORY, 3, FunctionDefinition.UNBOUNDED, (ctx, args) -> {
            RangeValue sumRange = Coercion.toRange(args.get(0));
            boolean[] mask = ConditionalRanges.mask(args.subList(1, args.size()), sumRange, ctx);
            return CellValue.of(sum(ConditionalRanges.selectNumbers(sumRange, mask)));
        });
        registry.register("SUMPRODUCT", CATEGORY, 1, FunctionDefinition.UNBOUNDED, MathFunctions::sumProduct);

        registry.register("ROUND", CATEGORY, 1, 2, (ctx, args) -> round(ctx, args, RoundingMode.HALF_UP));
        registry.register("ROUNDUP", CATEGORY, 1, 2, (ctx, args) -> round(ctx, args, RoundingMode.UP));
        registry.register("ROUNDDOWN", CATEGORY, 1, 2, (ctx, args) -> round(ctx, args, RoundingMode.DOWN));
        registry.register("TRUNC", CATEGORY, 1, 2, (ctx, args) -> round(ctx, args, RoundingMode.DOWN));
        registry.register("INT", CATEGORY, 1, 1, unary(Math::floor));
        registry.register("ABS", CATEGORY, 1, 1, unary(Math::abs));
        registry.register("SIGN", CATEGORY, 1, 1, unary(Math::signum));
        registry.register("SQRT", CATEGORY, 1, 1, unary(x -> {
            if (x < 0) {
                throw new NumericDomainException("SQRT of a negative number");
            }
            return Math.sqrt(x);
        }));
        registry.register("EXP", CATEGORY, 1, 1, unary(Math::exp));
        registry.register("LN", CATEGORY, 1, 1, unary(x -> Math.log(positive(x))));
        registry.register("LOG10", CATEGORY, 1, 1, unary(x -> Math.log10(positive(x))));
        registry.register("LOG", CATEGORY, 1, 2, (ctx, args) -> {
            double x = positive(Coercion.toNumber(args.get(0), ctx));
            double base = args.size() > 1 ? positive(Coercion.toNumber(args.get(1), ctx)) : 10;
            if (base == 1) {
                throw new DivisionByZeroException("LOG base 1");
            }
            return CellValue.of(Math.log(x) / Math.log(base));
        });
        registry.register("PI", CATEGORY, 0, 0, (ctx, args) -> CellValue.of(Math.PI));
        registry.register("POWER", CATEGORY, 2, 2, (ctx, args) -> CellValue.of(OperatorFunctions.power(
                Coercion.toNumber(args.get(0), ctx), Coercion.toNumber(args.get(1), ctx))));
        registry.register("MOD", CATEGORY, 2, 2, (ctx, args) -> {
            BigDecimal n = BigDecimal.valueOf(Coercion.toNumber(args.get(0), ctx));
            BigDecimal d = BigDecimal.valueOf(Coercion.toNumber(args.get(1), ctx));
            if (d.signum() == 0) {
                throw new DivisionByZeroException("MOD by zero");
            }
            // result takes the sign of the divisor
            BigDecimal remainder = n.remainder(d);
            if (remainder.signum() != 0 && remainder.signum() != d.signum()) {
                remainder = remainder.add(d);
            }
            return CellValue.of(remainder);
        });
        registry.register("CEILING", CATEGORY, 1, 2, (ctx, args) -> toMultiple(ctx, args, RoundingMode.CEILING));
        registry.register("FLOOR", CATEGORY, 1, 2, (ctx, args) -> toMultiple(ctx, args, RoundingMode.FLOOR));
    }

    static double sum(List<Double> numbers) {
        BigDecimal total = BigDecimal.ZERO;
        for (double d : numbers) {
            total = total.add(BigDecimal.valueOf(d));
        }
        return total.doubleValue();
    }

    private static ExcelFunction unary(DoubleUnaryOperator operator) {
        return (ctx, args) -> CellValue.of(operator.applyAsDouble(Coercion.toNumber(args.get(0), ctx)));
    }

    private static double positive(double x) {
        if (x <= 0) {
            throw new NumericDomainException("Logarithm of a non-positive number");
        }
        return x;
    }

    /**
     * HALF_UP on a BigDecimal rounds ties away from zero, as Excel does.
     */
    private static CellValue round(FunctionContext ctx, List<Operand> args, RoundingMode mode) {
        double value = Coercion.toNumber(args.get(0), ctx);
        int digits = args.size() > 1 ? Coercion.toInt(args.get(1), ctx) : 0;
        BigDecimal decimal = BigDecimal.valueOf(value);
        if (digits >= decimal.scale()) {
            // already exact at that many digits
            return CellValue.of(value);
        }
        return CellValue.of(decimal.setScale(Math.max(digits, MIN_ROUNDING_DIGITS), mode));
    }

    private static CellValue toMultiple(FunctionContext ctx, List<Operand> args, RoundingMode mode) {
        double value = Coercion.toNumber(args.get(0), ctx);
        double significance = args.size() > 1 ? Coercion.toNumber(args.get(1), ctx) : 1;
        if (significance == 0) {
            return CellValue.ZERO;
        }
        if (value > 0 && significance < 0) {
            throw new NumericDomainException("Significance sign mismatch");
        }
        BigDecimal step = BigDecimal.valueOf(Math.abs(significance));
        BigDecimal quotient = BigDecimal.valueOf(value).divide(step, MathContext.DECIMAL128);
        // negative numbers with negative significance round away from zero
        RoundingMode effective = value < 0 && significance < 0
                ? (mode == RoundingMode.CEILING ? RoundingMode.FLOOR : RoundingMode.CEILING)
                : mode;
        return CellValue.of(quotient.setScale(0, effective).multiply(step));
    }

    private static CellValue sumIf(FunctionContext ctx, List<Operand> args) {
        RangeValue range = Coercion.toRange(args.get(0));
        Criteria criteria = Criteria.parse(Coercion.scalar(args.get(1), ctx));
        RangeValue sumRange = args.size() > 2 ? Coercion.toRange(args.get(2)) : range;
        boolean[] mask = new boolean[range.size()];
        List<CellValue> values = range.values();
        for (int i = 0; i < mask.length; i++) {
            mask[i] = criteria.test(values.get(i));
        }
        return CellValue.of(sum(ConditionalRanges.selectNumbers(range, sumRange, mask)));
    }

    private static CellValue sumProduct(FunctionContext ctx, List<Operand> args) {
        RangeValue first = Coercion.toRange(args.get(0));
        BigDecimal total = BigDecimal.ZERO;
        double[] products = new double[first.size()];
        Arrays.fill(products, 1);
        for (Operand arg : args) {
            RangeValue range = Coercion.toRange(arg);
            if (range.getRows() != first.getRows() || range.getColumns() != first.getColumns()) {
                throw new InvalidTypeException("SUMPRODUCT arrays differ in size");
            }
            List<CellValue> values = range.values();
            for (int i = 0; i < products.length; i++) {
                CellValue value = values.get(i);
                if (value.isError()) {
                    throw CellErrorException.of(value.getError(), "Error in SUMPRODUCT");
                }
                products[i] *= value.isNumber() ? value.getNumber() : 0;
            }
        }
        for (double p : products) {
            total = total.add(BigDecimal.valueOf(p));
        }
        return CellValue.of(total);
    }
}
