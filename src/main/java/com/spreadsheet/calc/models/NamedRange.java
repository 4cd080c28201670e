package com.spreadsheet.calc.models;

/**
 * A name bound to a sheet-qualified cell or range, e.g. Rates -> 'Price List'!$A$2:$B$20.
 * scopeSheet is null for workbook-wide names.
 */
public final class NamedRange {

    private final String name;
    private final String scopeSheet;
    private final CellAddress start;
    private final CellAddress end;

    public NamedRange(String name, String scopeSheet, CellAddress start, CellAddress end) {
        if (start.getSheetName() == null) {
            throw new IllegalArgumentException("Named range " + name + " must be sheet-qualified");
        }
        this.name = name;
        this.scopeSheet = scopeSheet;
        this.start = start;
        this.end = end == null ? start : end.withSheet(start.getSheetName());
    }

    public String getName() {
        return name;
    }

    public String getScopeSheet() {
        return scopeSheet;
    }

    public CellAddress getStart() {
        return start;
    }

    public CellAddress getEnd() {
        return end;
    }

    public boolean isSingleCell() {
        return start.equals(end);
    }

    @Override
    public String toString() {
        String target = isSingleCell() ? start.toString()
                : start + ":" + end.toString().substring(end.toString().indexOf('!') + 1);
        return name + " -> " + target;
    }
}
