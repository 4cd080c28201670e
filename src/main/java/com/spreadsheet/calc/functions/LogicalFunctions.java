package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.exceptions.CellErrorException;
import com.spreadsheet.calc.exceptions.InvalidTypeException;
import com.spreadsheet.calc.exceptions.LookupMissException;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.ErrorCode;
import com.spreadsheet.calc.models.Operand;
import com.spreadsheet.calc.models.RangeValue;

import java.util.ArrayList;
import java.util.List;

/**
 * Conditionals and boolean algebra. The branching functions only propagate
 * errors from their conditions, never from the branch they skip.
 */
final class LogicalFunctions {

    static final String CATEGORY = "Logical";

    private LogicalFunctions() {
    }

    static void register(FunctionRegistry registry) {
        registry.registerErrorHandling("IF", CATEGORY, 1, 3, (ctx, args) -> {
            boolean condition = Coercion.toBoolean(Coercion.value(args.get(0), ctx));
            if (condition) {
                return args.size() > 1 ? args.get(1) : CellValue.TRUE;
            }
            return args.size() > 2 ? args.get(2) : CellValue.FALSE;
        });
        registry.registerErrorHandling("IFS", CATEGORY, 2, FunctionDefinition.UNBOUNDED, (ctx, args) -> {
            if (args.size() % 2 != 0) {
                throw new InvalidTypeException("IFS needs condition/value pairs");
            }
            for (int i = 0; i < args.size(); i += 2) {
                if (Coercion.toBoolean(Coercion.value(args.get(i), ctx))) {
                    return args.get(i + 1);
                }
            }
            throw new LookupMissException("No IFS condition was true");
        });
        registry.registerErrorHandling("IFERROR", CATEGORY, 2, 2, (ctx, args) ->
                isError(args.get(0), ctx, null) ? args.get(1) : args.get(0));
        registry.registerErrorHandling("IFNA", CATEGORY, 2, 2, (ctx, args) ->
                isError(args.get(0), ctx, ErrorCode.NA) ? args.get(1) : args.get(0));
        registry.registerErrorHandling("SWITCH", CATEGORY, 3, FunctionDefinition.UNBOUNDED, (ctx, args) -> {
            CellValue subject = Coercion.value(args.get(0), ctx);
            int i = 1;
            for (; i + 1 < args.size(); i += 2) {
                CellValue candidate = Coercion.value(args.get(i), ctx);
                if (Coercion.sameKind(subject, candidate) && Coercion.compare(subject, candidate) == 0) {
                    return args.get(i + 1);
                }
            }
            if (i < args.size()) {
                return args.get(i);
            }
            throw new LookupMissException("No SWITCH case matched");
        });

        registry.register("AND", CATEGORY, 1, FunctionDefinition.UNBOUNDED, (ctx, args) -> {
            for (boolean b : logicals(args)) {
                if (!b) {
                    return CellValue.FALSE;
                }
            }
            return CellValue.TRUE;
        });
        registry.register("OR", CATEGORY, 1, FunctionDefinition.UNBOUNDED, (ctx, args) -> {
            for (boolean b : logicals(args)) {
                if (b) {
                    return CellValue.TRUE;
                }
            }
            return CellValue.FALSE;
        });
        registry.register("XOR", CATEGORY, 1, FunctionDefinition.UNBOUNDED, (ctx, args) -> {
            boolean result = false;
            for (boolean b : logicals(args)) {
                result ^= b;
            }
            return CellValue.bool(result);
        });
        registry.register("NOT", CATEGORY, 1, 1, (ctx, args) ->
                CellValue.bool(!Coercion.toBoolean(args.get(0), ctx)));
        registry.register("TRUE", CATEGORY, 0, 0, (ctx, args) -> CellValue.TRUE);
        registry.register("FALSE", CATEGORY, 0, 0, (ctx, args) -> CellValue.FALSE);
    }

    private static boolean isError(Operand operand, FunctionContext ctx, ErrorCode only) {
        CellValue value;
        try {
            value = Coercion.scalar(operand, ctx);
        } catch (CellErrorException e) {
            return only == null || only == e.getErrorCode();
        }
        return value.isError() && (only == null || value.getError() == only);
    }

    /**
     * Logical values of AND/OR/XOR arguments: text and blanks inside ranges
     * are skipped, text given directly must spell TRUE or FALSE.
     */
    private static List<Boolean> logicals(List<Operand> args) {
        List<Boolean> result = new ArrayList<>();
        for (Operand arg : args) {
            if (arg.isRange()) {
                for (CellValue value : ((RangeValue) arg).values()) {
                    if (value.isError()) {
                        throw CellErrorException.of(value.getError(), "Error in range");
                    }
                    if (value.isBoolean() || value.isNumber()) {
                        result.add(Coercion.toBoolean(value));
                    }
                }
            } else if (!((CellValue) arg).isEmpty()) {
                result.add(Coercion.toBoolean((CellValue) arg));
            }
        }
        if (result.isEmpty()) {
            throw new InvalidTypeException("No logical values");
        }
        return result;
    }
}
