package com.spreadsheet.calc.models;

import com.spreadsheet.calc.exceptions.InvalidAddressException;

import java.util.Locale;
import java.util.Objects;

/**
 * A1-style cell address, optionally sheet-qualified.
 * Column and row are 1-based. The absolute markers ($) are kept for display only.
 */
public final class CellAddress {

    public static final int MAX_COLUMN = 16384; // XFD
    public static final int MAX_ROW = 1048576;

    private final String sheetName;
    private final int column;
    private final int row;
    private final boolean absoluteColumn;
    private final boolean absoluteRow;

    public CellAddress(String sheetName, int column, int row, boolean absoluteColumn, boolean absoluteRow) {
        if (column < 1 || column > MAX_COLUMN) {
            throw new InvalidAddressException("Column out of range: " + column);
        }
        if (row < 1 || row > MAX_ROW) {
            throw new InvalidAddressException("Row out of range: " + row);
        }
        this.sheetName = sheetName;
        this.column = column;
        this.row = row;
        this.absoluteColumn = absoluteColumn;
        this.absoluteRow = absoluteRow;
    }

    public CellAddress(String sheetName, int column, int row) {
        this(sheetName, column, row, false, false);
    }

    /**
     * Parses "A1", "$B$2", "Sheet1!C3" or "'My Sheet'!D4".
     */
    public static CellAddress parse(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidAddressException("Empty cell address");
        }
        String trimmed = text.trim();
        String sheet = null;
        String local = trimmed;
        int bang = trimmed.lastIndexOf('!');
        if (bang >= 0) {
            sheet = unquoteSheet(trimmed.substring(0, bang));
            local = trimmed.substring(bang + 1);
            if (sheet.isEmpty()) {
                throw new InvalidAddressException("Empty sheet name in " + text);
            }
        }
        return parseLocal(sheet, local, text);
    }

    /**
     * Parses a cell or range reference such as "Sheet1!$A$1:$B$5" into its two
     * corners (equal for a single cell). The end inherits the start's sheet.
     */
    public static CellAddress[] parseRange(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidAddressException("Empty reference");
        }
        String trimmed = text.trim();
        int colon = -1;
        boolean quoted = false;
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            if (c == '\'') {
                quoted = !quoted;
            } else if (c == ':' && !quoted) {
                colon = i;
                break;
            }
        }
        if (colon < 0) {
            CellAddress single = parse(trimmed);
            return new CellAddress[] {single, single};
        }
        CellAddress start = parse(trimmed.substring(0, colon));
        CellAddress end = parse(trimmed.substring(colon + 1));
        if (end.getSheetName() != null && start.getSheetName() != null
                && !end.getSheetName().equalsIgnoreCase(start.getSheetName())) {
            throw new InvalidAddressException("Range spans two sheets: " + text);
        }
        return new CellAddress[] {start, end.withSheet(start.getSheetName())};
    }

    private static CellAddress parseLocal(String sheet, String local, String original) {
        int i = 0;
        int n = local.length();
        boolean absCol = false;
        boolean absRow = false;
        if (i < n && local.charAt(i) == '$') {
            absCol = true;
            i++;
        }
        int colStart = i;
        while (i < n && isLetter(local.charAt(i))) {
            i++;
        }
        if (i == colStart || i - colStart > 3) {
            throw new InvalidAddressException("Invalid column in cell address: " + original);
        }
        String letters = local.substring(colStart, i);
        if (i < n && local.charAt(i) == '$') {
            absRow = true;
            i++;
        }
        int rowStart = i;
        while (i < n && Character.isDigit(local.charAt(i))) {
            i++;
        }
        if (i == rowStart || i != n) {
            throw new InvalidAddressException("Invalid row in cell address: " + original);
        }
        int row;
        try {
            row = Integer.parseInt(local.substring(rowStart));
        } catch (NumberFormatException e) {
            throw new InvalidAddressException("Invalid row in cell address: " + original);
        }
        return new CellAddress(sheet, lettersToColumn(letters), row, absCol, absRow);
    }

    /**
     * True if the text is a well-formed unqualified address like "AB12" or "$C$3".
     */
    public static boolean isValidLocal(String text) {
        try {
            parseLocal(null, text, text);
            return true;
        } catch (InvalidAddressException e) {
            return false;
        }
    }

    private static boolean isLetter(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }

    /**
     * "A" -> 1, "Z" -> 26, "AA" -> 27.
     */
    public static int lettersToColumn(String letters) {
        int result = 0;
        for (int i = 0; i < letters.length(); i++) {
            char c = Character.toUpperCase(letters.charAt(i));
            result = result * 26 + (c - 'A' + 1);
        }
        return result;
    }

    /**
     * 1 -> "A", 27 -> "AA".
     */
    public static String columnToLetters(int column) {
        StringBuilder sb = new StringBuilder();
        int n = column;
        while (n > 0) {
            sb.append((char) ('A' + (n - 1) % 26));
            n = (n - 1) / 26;
        }
        return sb.reverse().toString();
    }

    public static String unquoteSheet(String sheet) {
        String s = sheet.trim();
        if (s.length() >= 2 && s.startsWith("'") && s.endsWith("'")) {
            return s.substring(1, s.length() - 1).replace("''", "'");
        }
        return s;
    }

    /**
     * Quotes a sheet name when it needs quoting inside a reference.
     */
    public static String quoteSheet(String sheet) {
        for (int i = 0; i < sheet.length(); i++) {
            char c = sheet.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '_' && c != '.') {
                return "'" + sheet.replace("'", "''") + "'";
            }
        }
        if (!sheet.isEmpty() && Character.isDigit(sheet.charAt(0))) {
            return "'" + sheet + "'";
        }
        return sheet;
    }

    public CellAddress withSheet(String sheet) {
        return new CellAddress(sheet, column, row, absoluteColumn, absoluteRow);
    }

    public CellAddress offset(int rows, int columns) {
        return new CellAddress(sheetName, column + columns, row + rows);
    }

    public String getSheetName() {
        return sheetName;
    }

    public int getColumn() {
        return column;
    }

    public int getRow() {
        return row;
    }

    public boolean isAbsoluteColumn() {
        return absoluteColumn;
    }

    public boolean isAbsoluteRow() {
        return absoluteRow;
    }

    /**
     * Unqualified address without markers, e.g. "B7".
     */
    public String toA1() {
        return columnToLetters(column) + row;
    }

    /**
     * Case-insensitive identity of a cell: "SHEET1!B7". Absolute markers are ignored.
     */
    public String key() {
        return key(sheetName, column, row);
    }

    public static String key(String sheet, int column, int row) {
        String prefix = sheet == null ? "" : sheet.toUpperCase(Locale.ROOT) + "!";
        return prefix + columnToLetters(column) + row;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellAddress)) {
            return false;
        }
        CellAddress other = (CellAddress) o;
        return column == other.column && row == other.row
                && Objects.equals(normalized(sheetName), normalized(other.sheetName));
    }

    private static String normalized(String sheet) {
        return sheet == null ? null : sheet.toUpperCase(Locale.ROOT);
    }

    @Override
    public int hashCode() {
        return Objects.hash(normalized(sheetName), column, row);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (sheetName != null) {
            sb.append(quoteSheet(sheetName)).append('!');
        }
        if (absoluteColumn) {
            sb.append('$');
        }
        sb.append(columnToLetters(column));
        if (absoluteRow) {
            sb.append('$');
        }
        sb.append(row);
        return sb.toString();
    }
}
