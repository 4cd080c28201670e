package com.spreadsheet.calc.models;

import com.spreadsheet.calc.exceptions.DuplicateSheetException;
import com.spreadsheet.calc.exceptions.SheetNotFoundException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Represents an entire workbook:
 * - sheets by name (case-insensitive, insertion ordered)
 * - an arena of cells indexed by integer id; ids are stable for the life of the workbook
 * - workbook-scoped named ranges
 * - a read/write lock; a calculation pass holds the write lock, readers the read lock
 */
public class Workbook {

    private final Map<String, Sheet> sheets = new LinkedHashMap<>();
    private final List<Cell> arena = new ArrayList<>();
    private final Map<String, Integer> idsByKey = new HashMap<>();
    private final Map<String, NamedRange> namedRanges = new LinkedHashMap<>();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Sheet createSheet(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Sheet name must not be blank");
        }
        String key = name.toUpperCase(Locale.ROOT);
        if (sheets.containsKey(key)) {
            throw new DuplicateSheetException("Sheet already exists: " + name);
        }
        Sheet sheet = new Sheet(name);
        sheets.put(key, sheet);
        return sheet;
    }

    /**
     * Returns the sheet or null.
     */
    public Sheet findSheet(String name) {
        return name == null ? null : sheets.get(name.toUpperCase(Locale.ROOT));
    }

    public Sheet getSheet(String name) {
        Sheet sheet = findSheet(name);
        if (sheet == null) {
            throw new SheetNotFoundException("Sheet not found: " + name);
        }
        return sheet;
    }

    public Collection<Sheet> getSheets() {
        return Collections.unmodifiableCollection(sheets.values());
    }

    /**
     * Returns the id of the cell at the given position, creating an empty
     * placeholder cell when none exists yet. The sheet must exist.
     */
    public int cellId(String sheetName, int column, int row) {
        Sheet sheet = getSheet(sheetName);
        String key = CellAddress.key(sheet.getName(), column, row);
        Integer id = idsByKey.get(key);
        if (id != null) {
            return id;
        }
        Cell cell = new Cell(arena.size(), new CellAddress(sheet.getName(), column, row));
        arena.add(cell);
        idsByKey.put(key, cell.getId());
        sheet.putCell(cell);
        return cell.getId();
    }

    /**
     * Returns the cell at the given position or null, without creating anything.
     */
    public Cell findCell(String sheetName, int column, int row) {
        Sheet sheet = findSheet(sheetName);
        if (sheet == null) {
            return null;
        }
        Integer id = idsByKey.get(CellAddress.key(sheet.getName(), column, row));
        return id == null ? null : arena.get(id);
    }

    public Cell getCell(int id) {
        return arena.get(id);
    }

    public int cellCount() {
        return arena.size();
    }

    public List<Cell> getCells() {
        return Collections.unmodifiableList(arena);
    }

    public void addNamedRange(NamedRange namedRange) {
        if (namedRange.getScopeSheet() != null) {
            getSheet(namedRange.getScopeSheet()).addNamedRange(namedRange);
        } else {
            namedRanges.put(namedRange.getName().toUpperCase(Locale.ROOT), namedRange);
        }
    }

    /**
     * Resolves a name the way Excel does: a sheet-scoped name shadows a workbook-scoped one.
     */
    public NamedRange resolveName(String name, String currentSheet) {
        Sheet sheet = findSheet(currentSheet);
        if (sheet != null) {
            NamedRange local = sheet.getNamedRange(name);
            if (local != null) {
                return local;
            }
        }
        return namedRanges.get(name.toUpperCase(Locale.ROOT));
    }

    public Map<String, NamedRange> getNamedRanges() {
        return Collections.unmodifiableMap(namedRanges);
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }
}
