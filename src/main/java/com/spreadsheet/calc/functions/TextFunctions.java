package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.exceptions.CellErrorException;
import com.spreadsheet.calc.exceptions.InvalidTypeException;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.Operand;
import com.spreadsheet.calc.parser.FormulaParser;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.List;
import java.util.Locale;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;

final class TextFunctions {

    static final String CATEGORY = "Text";

    private static final int MAX_TEXT_LENGTH = 32767;

    private TextFunctions() {
    }

    static void register(FunctionRegistry registry) {
        registry.register("CONCATENATE", CATEGORY, 1, FunctionDefinition.UNBOUNDED, (ctx, args) -> {
            StringBuilder sb = new StringBuilder();
            for (Operand arg : args) {
                sb.append(Coercion.toText(arg, ctx));
            }
            return text(sb.toString());
        });
        registry.register("CONCAT", CATEGORY, 1, FunctionDefinition.UNBOUNDED, (ctx, args) -> {
            StringBuilder sb = new StringBuilder();
            for (CellValue value : Coercion.flatten(args)) {
                sb.append(Coercion.toText(value));
            }
            return text(sb.toString());
        });
        registry.register("TEXTJOIN", CATEGORY, 3, FunctionDefinition.UNBOUNDED, (ctx, args) -> {
            String delimiter = Coercion.toText(args.get(0), ctx);
            boolean ignoreEmpty = Coercion.toBoolean(args.get(1), ctx);
            StringBuilder sb = new StringBuilder();
            boolean first = true;
            for (CellValue value : Coercion.flatten(args.subList(2, args.size()))) {
                String part = Coercion.toText(value);
                if (ignoreEmpty && part.isEmpty()) {
                    continue;
                }
                if (!first) {
                    sb.append(delimiter);
                }
                sb.append(part);
                first = false;
            }
            return text(sb.toString());
        });
        registry.register("LEFT", CATEGORY, 1, 2, (ctx, args) -> {
            String s = Coercion.toText(args.get(0), ctx);
            int n = count(ctx, args, 1);
            return CellValue.text(s.substring(0, Math.min(n, s.length())));
        });
        registry.register("RIGHT", CATEGORY, 1, 2, (ctx, args) -> {
            String s = Coercion.toText(args.get(0), ctx);
            int n = count(ctx, args, 1);
            return CellValue.text(s.substring(Math.max(0, s.length() - n)));
        });
        registry.register("MID", CATEGORY, 3, 3, (ctx, args) -> {
            String s = Coercion.toText(args.get(0), ctx);
            int start = Coercion.toInt(args.get(1), ctx);
            int n = Coercion.toInt(args.get(2), ctx);
            if (start < 1 || n < 0) {
                throw new InvalidTypeException("MID arguments out of range");
            }
            if (start > s.length()) {
                return CellValue.EMPTY_TEXT;
            }
            int end = (int) Math.min(s.length(), start - 1L + n);
            return CellValue.text(s.substring(start - 1, end));
        });
        registry.register("LEN", CATEGORY, 1, 1, (ctx, args) -> CellValue.of(Coercion.toText(args.get(0), ctx).length()));
        registry.register("TRIM", CATEGORY, 1, 1, map(s -> s.trim().replaceAll(" +", " ")));
        registry.register("UPPER", CATEGORY, 1, 1, map(s -> s.toUpperCase(Locale.ROOT)));
        registry.register("LOWER", CATEGORY, 1, 1, map(s -> s.toLowerCase(Locale.ROOT)));
        registry.register("PROPER", CATEGORY, 1, 1, map(TextFunctions::proper));
        registry.register("EXACT", CATEGORY, 2, 2, (ctx, args) ->
                CellValue.bool(Coercion.toText(args.get(0), ctx).equals(Coercion.toText(args.get(1), ctx))));
        registry.register("REPT", CATEGORY, 2, 2, (ctx, args) -> {
            String s = Coercion.toText(args.get(0), ctx);
            int times = Coercion.toInt(args.get(1), ctx);
            if (times < 0 || (long) s.length() * times > MAX_TEXT_LENGTH) {
                throw new InvalidTypeException("REPT count out of range");
            }
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < times; i++) {
                sb.append(s);
            }
            return CellValue.text(sb.toString());
        });
        registry.register("SUBSTITUTE", CATEGORY, 3, 4, TextFunctions::substitute);
        registry.register("REPLACE", CATEGORY, 4, 4, (ctx, args) -> {
            String s = Coercion.toText(args.get(0), ctx);
            int start = Coercion.toInt(args.get(1), ctx);
            int n = Coercion.toInt(args.get(2), ctx);
            String replacement = Coercion.toText(args.get(3), ctx);
            if (start < 1 || n < 0) {
                throw new InvalidTypeException("REPLACE arguments out of range");
            }
            int from = Math.min(start - 1, s.length());
            int to = (int) Math.min(from + (long) n, s.length());
            return text(s.substring(0, from) + replacement + s.substring(to));
        });
        registry.register("FIND", CATEGORY, 2, 3, (ctx, args) -> find(ctx, args, false));
        registry.register("SEARCH", CATEGORY, 2, 3, (ctx, args) -> find(ctx, args, true));
        registry.register("VALUE", CATEGORY, 1, 1, (ctx, args) -> {
            CellValue value = Coercion.scalar(args.get(0), ctx);
            if (value.isNumber()) {
                return value;
            }
            Double parsed = FormulaParser.parseNumber(Coercion.toText(value).trim());
            if (parsed == null) {
                throw new InvalidTypeException("VALUE cannot parse " + value);
            }
            return CellValue.of(parsed);
        });
        registry.register("TEXT", CATEGORY, 2, 2, (ctx, args) ->
                CellValue.text(format(Coercion.scalar(args.get(0), ctx), Coercion.toText(args.get(1), ctx))));
    }

    private static CellValue text(String s) {
        if (s.length() > MAX_TEXT_LENGTH) {
            throw new InvalidTypeException("Text longer than " + MAX_TEXT_LENGTH);
        }
        return CellValue.text(s);
    }

    private static ExcelFunction map(UnaryOperator<String> operator) {
        return (ctx, args) -> CellValue.text(operator.apply(Coercion.toText(args.get(0), ctx)));
    }

    private static int count(FunctionContext ctx, List<Operand> args, int defaultCount) {
        int n = args.size() > 1 ? Coercion.toInt(args.get(1), ctx) : defaultCount;
        if (n < 0) {
            throw new InvalidTypeException("Negative character count");
        }
        return n;
    }

    private static String proper(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        boolean upperNext = true;
        for (char c : s.toCharArray()) {
            sb.append(upperNext ? Character.toUpperCase(c) : Character.toLowerCase(c));
            upperNext = !Character.isLetter(c);
        }
        return sb.toString();
    }

    private static CellValue substitute(FunctionContext ctx, List<Operand> args) {
        String s = Coercion.toText(args.get(0), ctx);
        String old = Coercion.toText(args.get(1), ctx);
        String replacement = Coercion.toText(args.get(2), ctx);
        if (old.isEmpty()) {
            return CellValue.text(s);
        }
        if (args.size() < 4) {
            return text(s.replace(old, replacement));
        }
        int instance = Coercion.toInt(args.get(3), ctx);
        if (instance < 1) {
            throw new InvalidTypeException("Instance must be at least 1");
        }
        int at = -1;
        for (int i = 0; i < instance; i++) {
            at = s.indexOf(old, at + 1);
            if (at < 0) {
                return CellValue.text(s);
            }
        }
        return text(s.substring(0, at) + replacement + s.substring(at + old.length()));
    }

    /**
     * FIND is case-sensitive; SEARCH ignores case and understands wildcards.
     */
    private static CellValue find(FunctionContext ctx, List<Operand> args, boolean search) {
        String needle = Coercion.toText(args.get(0), ctx);
        String haystack = Coercion.toText(args.get(1), ctx);
        int start = args.size() > 2 ? Coercion.toInt(args.get(2), ctx) : 1;
        if (start < 1 || start > haystack.length() + 1) {
            throw new InvalidTypeException("Start position out of range");
        }
        int found;
        if (search) {
            Matcher matcher = Criteria.compileWildcard(needle).matcher(haystack);
            found = matcher.find(start - 1) ? matcher.start() : -1;
        } else {
            found = haystack.indexOf(needle, start - 1);
        }
        if (found < 0) {
            throw new InvalidTypeException("'" + needle + "' not found");
        }
        return CellValue.of(found + 1);
    }

    /**
     * Numeric format codes such as 0, 0.00, #,##0.00 and 0%. Text passes through.
     */
    static String format(CellValue value, String pattern) {
        if (value.isError()) {
            throw CellErrorException.of(value.getError(), "Error operand");
        }
        if (!value.isNumber() && !value.isEmpty()) {
            Double parsed = value.isText() ? FormulaParser.parseNumber(value.getText().trim()) : null;
            if (parsed == null) {
                return Coercion.toText(value);
            }
            value = CellValue.of(parsed);
        }
        if (pattern.isEmpty() || "General".equalsIgnoreCase(pattern)) {
            return Coercion.toText(value);
        }
        try {
            DecimalFormat format = new DecimalFormat(pattern, DecimalFormatSymbols.getInstance(Locale.US));
            format.setRoundingMode(RoundingMode.HALF_UP);
            return format.format(BigDecimal.valueOf(Coercion.toNumber(value)));
        } catch (IllegalArgumentException e) {
            throw new InvalidTypeException("Unsupported format '" + pattern + "'");
        }
    }
}
