package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.exceptions.DivisionByZeroException;
import com.spreadsheet.calc.exceptions.NumericDomainException;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.Operand;
import com.spreadsheet.calc.parser.BinaryOperator;
import com.spreadsheet.calc.parser.UnaryOperator;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.function.IntPredicate;

/**
 * Formula operators as registry entries keyed by symbol. Arithmetic runs on
 * decimals so that 0.1 + 0.2 gives 0.3 as Excel displays it.
 */
final class OperatorFunctions {

    static final String CATEGORY = "Operator";

    static final String NEGATE = "u-";
    static final String PLUS = "u+";
    static final String PERCENT = "%";

    private OperatorFunctions() {
    }

    static String symbolOf(UnaryOperator operator) {
        switch (operator) {
            case NEGATE:
                return NEGATE;
            case PLUS:
                return PLUS;
            default:
                return PERCENT;
        }
    }

    static void register(FunctionRegistry registry) {
        registry.register(BinaryOperator.ADD.getSymbol(), CATEGORY, 2, 2, (ctx, args) ->
                CellValue.of(decimal(args.get(0), ctx).add(decimal(args.get(1), ctx), MathContext.DECIMAL128)));
        registry.register(BinaryOperator.SUBTRACT.getSymbol(), CATEGORY, 2, 2, (ctx, args) ->
                CellValue.of(decimal(args.get(0), ctx).subtract(decimal(args.get(1), ctx), MathContext.DECIMAL128)));
        registry.register(BinaryOperator.MULTIPLY.getSymbol(), CATEGORY, 2, 2, (ctx, args) ->
                CellValue.of(decimal(args.get(0), ctx).multiply(decimal(args.get(1), ctx), MathContext.DECIMAL128)));
        registry.register(BinaryOperator.DIVIDE.getSymbol(), CATEGORY, 2, 2, (ctx, args) -> {
            BigDecimal left = decimal(args.get(0), ctx);
            BigDecimal right = decimal(args.get(1), ctx);
            if (right.signum() == 0) {
                throw new DivisionByZeroException("Division by zero");
            }
            return CellValue.of(left.divide(right, MathContext.DECIMAL128));
        });
        registry.register(BinaryOperator.POWER.getSymbol(), CATEGORY, 2, 2, (ctx, args) ->
                CellValue.of(power(Coercion.toNumber(args.get(0), ctx), Coercion.toNumber(args.get(1), ctx))));
        registry.register(BinaryOperator.CONCAT.getSymbol(), CATEGORY, 2, 2, (ctx, args) ->
                CellValue.text(Coercion.toText(args.get(0), ctx) + Coercion.toText(args.get(1), ctx)));

        comparison(registry, BinaryOperator.EQUAL, c -> c == 0);
        comparison(registry, BinaryOperator.NOT_EQUAL, c -> c != 0);
        comparison(registry, BinaryOperator.LESS, c -> c < 0);
        comparison(registry, BinaryOperator.LESS_OR_EQUAL, c -> c <= 0);
        comparison(registry, BinaryOperator.GREATER, c -> c > 0);
        comparison(registry, BinaryOperator.GREATER_OR_EQUAL, c -> c >= 0);

        registry.register(NEGATE, CATEGORY, 1, 1, (ctx, args) ->
                CellValue.of(-Coercion.toNumber(args.get(0), ctx)));
        registry.register(PLUS, CATEGORY, 1, 1, (ctx, args) -> Coercion.scalar(args.get(0), ctx));
        registry.register(PERCENT, CATEGORY, 1, 1, (ctx, args) ->
                CellValue.of(decimal(args.get(0), ctx).movePointLeft(2)));
    }

    private static void comparison(FunctionRegistry registry, BinaryOperator operator, IntPredicate test) {
        registry.register(operator.getSymbol(), CATEGORY, 2, 2, (ctx, args) -> CellValue.bool(
                test.test(Coercion.compare(Coercion.scalar(args.get(0), ctx), Coercion.scalar(args.get(1), ctx)))));
    }

    private static BigDecimal decimal(Operand operand, FunctionContext ctx) {
        return BigDecimal.valueOf(Coercion.toNumber(operand, ctx));
    }

    static double power(double base, double exponent) {
        if (base == 0 && exponent == 0) {
            throw new NumericDomainException("0^0");
        }
        if (base == 0 && exponent < 0) {
            throw new DivisionByZeroException("Zero to a negative power");
        }
        if (base < 0 && exponent != Math.rint(exponent)) {
            throw new NumericDomainException("Fractional power of a negative number");
        }
        return Math.pow(base, exponent);
    }
}
