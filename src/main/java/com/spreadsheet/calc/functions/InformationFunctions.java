package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.exceptions.CellErrorException;
import com.spreadsheet.calc.exceptions.LookupMissException;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.ErrorCode;
import com.spreadsheet.calc.models.Operand;
import com.spreadsheet.calc.models.ValueType;

import java.util.List;
import java.util.function.Predicate;

/**
 * IS* predicates, NA() and N().
 */
final class InformationFunctions {

    static final String CATEGORY = "Information";

    private InformationFunctions() {
    }

    static void register(FunctionRegistry registry) {
        predicate(registry, "ISBLANK", CellValue::isEmpty);
        predicate(registry, "ISERROR", CellValue::isError);
        predicate(registry, "ISERR", v -> v.isError() && v.getError() != ErrorCode.NA);
        predicate(registry, "ISNA", v -> v.isError() && v.getError() == ErrorCode.NA);
        predicate(registry, "ISNUMBER", CellValue::isNumber);
        predicate(registry, "ISTEXT", CellValue::isText);
        predicate(registry, "ISNONTEXT", v -> !v.isText());
        predicate(registry, "ISLOGICAL", CellValue::isBoolean);
        registry.register("NA", CATEGORY, 0, 0, (ctx, args) -> {
            throw new LookupMissException("NA()");
        });
        registry.register("N", CATEGORY, 1, 1, (ctx, args) -> {
            CellValue value = Coercion.scalar(args.get(0), ctx);
            if (value.getType() == ValueType.NUMBER) {
                return value;
            }
            if (value.isBoolean()) {
                return CellValue.of(value.getBoolean() ? 1 : 0);
            }
            return CellValue.ZERO;
        });
    }

    private static void predicate(FunctionRegistry registry, String name, Predicate<CellValue> test) {
        registry.registerErrorHandling(name, CATEGORY, 1, 1, (ctx, args) -> CellValue.bool(test.test(single(args, ctx))));
    }

    private static CellValue single(List<Operand> args, FunctionContext ctx) {
        try {
            return Coercion.scalar(args.get(0), ctx);
        } catch (CellErrorException e) {
            return CellValue.error(e.getErrorCode());
        }
    }
}
