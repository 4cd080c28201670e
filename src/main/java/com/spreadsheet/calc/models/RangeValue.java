package com.spreadsheet.calc.models;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Rectangular block of values produced by evaluating a range reference.
 * Indexes passed to {@link #get(int, int)} are 0-based.
 */
public final class RangeValue implements Operand {

    private final String sheetName;
    private final int firstRow;
    private final int firstColumn;
    private final int rows;
    private final int columns;
    private final CellValue[] values;

    public RangeValue(String sheetName, int firstRow, int firstColumn, int rows, int columns, CellValue[] values) {
        if (values.length != rows * columns) {
            throw new IllegalArgumentException("Expected " + rows * columns + " values, got " + values.length);
        }
        this.sheetName = sheetName;
        this.firstRow = firstRow;
        this.firstColumn = firstColumn;
        this.rows = rows;
        this.columns = columns;
        this.values = values;
    }

    /**
     * Builds a detached range (no sheet position) from row-major lists, mostly for tests.
     */
    public static RangeValue of(List<List<CellValue>> grid) {
        int rows = grid.size();
        int columns = rows == 0 ? 0 : grid.get(0).size();
        CellValue[] values = new CellValue[rows * columns];
        for (int r = 0; r < rows; r++) {
            List<CellValue> row = grid.get(r);
            for (int c = 0; c < columns; c++) {
                values[r * columns + c] = c < row.size() ? row.get(c) : CellValue.EMPTY;
            }
        }
        return new RangeValue(null, 1, 1, rows, columns, values);
    }

    @Override
    public boolean isRange() {
        return true;
    }

    public String getSheetName() {
        return sheetName;
    }

    public int getFirstRow() {
        return firstRow;
    }

    public int getFirstColumn() {
        return firstColumn;
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return columns;
    }

    public int size() {
        return values.length;
    }

    public CellValue get(int row, int column) {
        if (row < 0 || row >= rows || column < 0 || column >= columns) {
            throw new IndexOutOfBoundsException("(" + row + "," + column + ") outside " + rows + "x" + columns);
        }
        return values[row * columns + column];
    }

    /**
     * All values in row-major order.
     */
    public List<CellValue> values() {
        return Collections.unmodifiableList(Arrays.asList(values));
    }

    public List<CellValue> row(int row) {
        List<CellValue> result = new ArrayList<>(columns);
        for (int c = 0; c < columns; c++) {
            result.add(get(row, c));
        }
        return result;
    }

    public List<CellValue> column(int column) {
        List<CellValue> result = new ArrayList<>(rows);
        for (int r = 0; r < rows; r++) {
            result.add(get(r, column));
        }
        return result;
    }

    /**
     * Values of a single-row or single-column range as a vector; null for a 2D block.
     */
    public List<CellValue> vector() {
        if (rows == 1) {
            return row(0);
        }
        if (columns == 1) {
            return column(0);
        }
        return null;
    }

    @Override
    public String toString() {
        return "RangeValue[" + rows + "x" + columns + "]";
    }
}
