package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.exceptions.DivisionByZeroException;
import com.spreadsheet.calc.exceptions.NumericDomainException;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.Operand;

import java.util.List;

/**
 * Time value of money. Cash paid out is negative, as in Excel; type 1 means
 * payments at the start of each period.
 */
final class FinancialFunctions {

    static final String CATEGORY = "Financial";

    private FinancialFunctions() {
    }

    static void register(FunctionRegistry registry) {
        registry.register("PMT", CATEGORY, 3, 5, (ctx, args) -> {
            double rate = Coercion.toNumber(args.get(0), ctx);
            double periods = periods(ctx, args);
            double pv = Coercion.toNumber(args.get(2), ctx);
            double fv = optional(ctx, args, 3);
            double type = optional(ctx, args, 4);
            if (rate == 0) {
                return CellValue.of(-(pv + fv) / periods);
            }
            double growth = Math.pow(1 + rate, periods);
            return CellValue.of(-rate * (fv + pv * growth) / ((1 + rate * type) * (growth - 1)));
        });
        registry.register("PV", CATEGORY, 3, 5, (ctx, args) -> {
            double rate = Coercion.toNumber(args.get(0), ctx);
            double periods = periods(ctx, args);
            double payment = Coercion.toNumber(args.get(2), ctx);
            double fv = optional(ctx, args, 3);
            double type = optional(ctx, args, 4);
            if (rate == 0) {
                return CellValue.of(-(fv + payment * periods));
            }
            double growth = Math.pow(1 + rate, periods);
            return CellValue.of(-(fv + payment * (1 + rate * type) * (growth - 1) / rate) / growth);
        });
        registry.register("FV", CATEGORY, 3, 5, (ctx, args) -> {
            double rate = Coercion.toNumber(args.get(0), ctx);
            double periods = Coercion.toNumber(args.get(1), ctx);
            double payment = Coercion.toNumber(args.get(2), ctx);
            double pv = optional(ctx, args, 3);
            double type = optional(ctx, args, 4);
            if (rate == 0) {
                return CellValue.of(-(pv + payment * periods));
            }
            double growth = Math.pow(1 + rate, periods);
            return CellValue.of(-(pv * growth + payment * (1 + rate * type) * (growth - 1) / rate));
        });
        registry.register("NPV", CATEGORY, 2, FunctionDefinition.UNBOUNDED, (ctx, args) -> {
            double rate = Coercion.toNumber(args.get(0), ctx);
            if (rate == -1) {
                throw new DivisionByZeroException("NPV rate of -1");
            }
            double npv = 0;
            int period = 1;
            for (double cashFlow : Coercion.numbers(args.subList(1, args.size()), ctx)) {
                npv += cashFlow / Math.pow(1 + rate, period++);
            }
            return CellValue.of(npv);
        });
    }

    private static double periods(FunctionContext ctx, List<Operand> args) {
        double periods = Coercion.toNumber(args.get(1), ctx);
        if (periods == 0) {
            throw new NumericDomainException("Number of periods is zero");
        }
        return periods;
    }

    private static double optional(FunctionContext ctx, List<Operand> args, int index) {
        return args.size() > index ? Coercion.toNumber(args.get(index), ctx) : 0;
    }
}
