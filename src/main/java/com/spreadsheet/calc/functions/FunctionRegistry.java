package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.exceptions.CellErrorException;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.ErrorCode;
import com.spreadsheet.calc.models.Operand;
import com.spreadsheet.calc.parser.BinaryOperator;
import com.spreadsheet.calc.parser.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Static table from function name to handler, built once.
 * Operators are registered here too (under their symbols) so that they
 * follow the same error propagation rule as functions.
 */
public class FunctionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(FunctionRegistry.class);

    private static final class Holder {
        private static final FunctionRegistry STANDARD = createStandard();
    }

    private final Map<String, FunctionDefinition> functions = new HashMap<>();

    /**
     * The shared registry with every built-in function.
     */
    public static FunctionRegistry standard() {
        return Holder.STANDARD;
    }

    static FunctionRegistry createStandard() {
        FunctionRegistry registry = new FunctionRegistry();
        OperatorFunctions.register(registry);
        MathFunctions.register(registry);
        StatisticalFunctions.register(registry);
        LogicalFunctions.register(registry);
        InformationFunctions.register(registry);
        LookupFunctions.register(registry);
        TextFunctions.register(registry);
        FinancialFunctions.register(registry);
        DateFunctions.register(registry);
        return registry;
    }

    public void register(FunctionDefinition definition) {
        String key = definition.getName().toUpperCase(Locale.ROOT);
        if (functions.putIfAbsent(key, definition) != null) {
            throw new IllegalStateException("Function registered twice: " + key);
        }
    }

    /**
     * Shorthand for functions that propagate the first error argument.
     */
    public void register(String name, String category, int minArgs, int maxArgs, ExcelFunction handler) {
        register(new FunctionDefinition(name, category, minArgs, maxArgs, true, handler));
    }

    /**
     * For functions that look at error arguments themselves (IFERROR, ISERROR, ...).
     */
    public void registerErrorHandling(String name, String category, int minArgs, int maxArgs, ExcelFunction handler) {
        register(new FunctionDefinition(name, category, minArgs, maxArgs, false, handler));
    }

    public FunctionDefinition lookup(String name) {
        return functions.get(name.toUpperCase(Locale.ROOT));
    }

    public boolean contains(String name) {
        return lookup(name) != null;
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(functions.keySet()));
    }

    /**
     * Calls a function. Unknown names yield #NAME?, a wrong argument count #VALUE!.
     * Errors thrown by the handler are converted into error values; any other
     * failure of a handler becomes #VALUE!.
     */
    public Operand call(String name, FunctionContext context, List<Operand> args) {
        FunctionDefinition definition = lookup(name);
        if (definition == null) {
            return CellValue.error(ErrorCode.NAME);
        }
        if (args.size() < definition.getMinArgs() || args.size() > definition.getMaxArgs()) {
            return CellValue.error(ErrorCode.VALUE);
        }
        if (definition.propagatesErrors()) {
            for (Operand arg : args) {
                if (arg instanceof CellValue && ((CellValue) arg).isError()) {
                    return arg;
                }
            }
        }
        try {
            Operand result = definition.getHandler().apply(context, args);
            return result == null ? CellValue.EMPTY : result;
        } catch (CellErrorException e) {
            return CellValue.error(e.getErrorCode());
        } catch (ArithmeticException e) {
            return CellValue.error(ErrorCode.NUM);
        } catch (RuntimeException e) {
            // a failing handler only poisons its own cell
            logger.warn("Function {} failed", definition.getName(), e);
            return CellValue.error(ErrorCode.VALUE);
        }
    }

    public Operand callBinary(BinaryOperator operator, FunctionContext context, Operand left, Operand right) {
        return call(operator.getSymbol(), context, Arrays.asList(left, right));
    }

    public Operand callUnary(UnaryOperator operator, FunctionContext context, Operand operand) {
        return call(OperatorFunctions.symbolOf(operator), context, Arrays.asList(operand));
    }
}
