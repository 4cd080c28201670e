package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.parser.FormulaParser;

import java.util.Locale;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Condition argument of COUNTIF, SUMIF and friends: "&gt;=10", "&lt;&gt;x", "ab*", 5, TRUE.
 * Text comparisons ignore case; "=" and "&lt;&gt;" on text honour the * and ? wildcards
 * (~ escapes them).
 */
public final class Criteria implements Predicate<CellValue> {

    private enum Op { EQ, NE, LT, LE, GT, GE }

    private final Op op;
    private final CellValue operand;
    private final Pattern pattern;

    private Criteria(Op op, CellValue operand) {
        this.op = op;
        this.operand = operand;
        this.pattern = operand.isText() && (op == Op.EQ || op == Op.NE) && hasWildcard(operand.getText())
                ? compileWildcard(operand.getText())
                : null;
    }

    public static Criteria parse(CellValue criteria) {
        if (!criteria.isText()) {
            return new Criteria(Op.EQ, criteria);
        }
        String text = criteria.getText();
        Op op = Op.EQ;
        int skip = 0;
        if (text.startsWith(">=")) {
            op = Op.GE;
            skip = 2;
        } else if (text.startsWith("<=")) {
            op = Op.LE;
            skip = 2;
        } else if (text.startsWith("<>")) {
            op = Op.NE;
            skip = 2;
        } else if (text.startsWith(">")) {
            op = Op.GT;
            skip = 1;
        } else if (text.startsWith("<")) {
            op = Op.LT;
            skip = 1;
        } else if (text.startsWith("=")) {
            skip = 1;
        }
        String rest = text.substring(skip);
        return new Criteria(op, operandOf(rest, skip > 0));
    }

    private static CellValue operandOf(String rest, boolean hadOperator) {
        if (rest.isEmpty()) {
            return hadOperator ? CellValue.EMPTY : CellValue.EMPTY_TEXT;
        }
        Double number = FormulaParser.parseNumber(rest);
        if (number != null) {
            return CellValue.of(number);
        }
        if ("TRUE".equalsIgnoreCase(rest)) {
            return CellValue.TRUE;
        }
        if ("FALSE".equalsIgnoreCase(rest)) {
            return CellValue.FALSE;
        }
        return CellValue.text(rest);
    }

    @Override
    public boolean test(CellValue candidate) {
        if (operand.isEmpty()) {
            // "=" matches blank cells, "<>" matches anything non-blank
            boolean blank = candidate.isEmpty() || (candidate.isText() && candidate.getText().isEmpty());
            return op == Op.NE ? !blank : (op == Op.EQ && blank);
        }
        if (operand.isText() && operand.getText().isEmpty()) {
            return candidate.isEmpty() || (candidate.isText() && candidate.getText().isEmpty());
        }
        if (candidate.isError()) {
            return op == Op.NE;
        }
        if (pattern != null) {
            boolean found = candidate.isText() && pattern.matcher(candidate.getText()).matches();
            return op == Op.EQ ? found : !found;
        }
        CellValue value = candidate;
        if (operand.isNumber() && candidate.isText()) {
            Double parsed = FormulaParser.parseNumber(candidate.getText().trim());
            if (parsed != null && op == Op.EQ) {
                value = CellValue.of(parsed);
            }
        }
        if (!Coercion.sameKind(value, operand)) {
            return op == Op.NE;
        }
        int cmp = Coercion.compare(value, operand);
        switch (op) {
            case EQ:
                return cmp == 0;
            case NE:
                return cmp != 0;
            case LT:
                return cmp < 0;
            case LE:
                return cmp <= 0;
            case GT:
                return cmp > 0;
            default:
                return cmp >= 0;
        }
    }

    private static boolean hasWildcard(String text) {
        return text.indexOf('*') >= 0 || text.indexOf('?') >= 0;
    }

    static Pattern compileWildcard(String text) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '~' && i + 1 < text.length() && "*?~".indexOf(text.charAt(i + 1)) >= 0) {
                literal.append(text.charAt(++i));
            } else if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL);
    }

    @Override
    public String toString() {
        return op.name().toLowerCase(Locale.ROOT) + " " + operand;
    }
}
