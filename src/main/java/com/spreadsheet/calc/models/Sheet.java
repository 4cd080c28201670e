package com.spreadsheet.calc.models;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * A named, ordered collection of cells plus the names scoped to this sheet.
 * Cells are keyed by their unqualified A1 address ("B7").
 */
public class Sheet {

    private final String name;
    private final Map<String, Cell> cells = new LinkedHashMap<>();
    private final Map<String, NamedRange> namedRanges = new LinkedHashMap<>();

    public Sheet(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public Collection<Cell> getCells() {
        return Collections.unmodifiableCollection(cells.values());
    }

    /**
     * Retrieves the cell at the given column/row, if it exists.
     */
    public Cell getCell(int column, int row) {
        return cells.get(generateKey(column, row));
    }

    public void putCell(Cell cell) {
        CellAddress address = cell.getAddress();
        cells.put(generateKey(address.getColumn(), address.getRow()), cell);
    }

    public int size() {
        return cells.size();
    }

    private String generateKey(int column, int row) {
        return CellAddress.columnToLetters(column) + row;
    }

    public void addNamedRange(NamedRange namedRange) {
        namedRanges.put(namedRange.getName().toUpperCase(Locale.ROOT), namedRange);
    }

    public NamedRange getNamedRange(String name) {
        return namedRanges.get(name.toUpperCase(Locale.ROOT));
    }

    public Map<String, NamedRange> getNamedRanges() {
        return Collections.unmodifiableMap(namedRanges);
    }
}
