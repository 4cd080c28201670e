package com.spreadsheet.calc.services;

import com.spreadsheet.calc.exceptions.FormulaParseException;
import com.spreadsheet.calc.exceptions.InvalidAddressException;
import com.spreadsheet.calc.graph.DependencyGraph;
import com.spreadsheet.calc.models.Cell;
import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.CellState;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.ErrorCode;
import com.spreadsheet.calc.models.NamedRange;
import com.spreadsheet.calc.models.Sheet;
import com.spreadsheet.calc.models.Workbook;
import com.spreadsheet.calc.parser.FormulaNode;
import com.spreadsheet.calc.parser.FormulaParser;
import com.spreadsheet.calc.parser.ParseCache;
import com.spreadsheet.calc.parser.ReferenceCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Owns the workbook's cells, their parsed formulas and the dependency graph,
 * and keeps track of which formula cells are dirty.
 * Not thread-safe; {@link CalculationEngine} serializes access through the workbook lock.
 */
public class CellStore {

    private static final Logger logger = LoggerFactory.getLogger(CellStore.class);

    private final Workbook workbook = new Workbook();
    private final DependencyGraph graph = new DependencyGraph();
    private final ParseCache parseCache = new ParseCache();
    private final FormulaParser parser;

    private final Set<Integer> dirty = new LinkedHashSet<>();
    // formulas with INDIRECT: their inputs are unknown until evaluation
    private final Set<Integer> dynamicCells = new HashSet<>();
    // formulas referencing sheets that don't exist (yet)
    private final Set<Integer> unresolvedCells = new HashSet<>();

    public CellStore(char listSeparator) {
        this.parser = new FormulaParser(listSeparator, workbook::resolveName);
    }

    public CellStore() {
        this(',');
    }

    /**
     * Creates an empty sheet. Formulas that were waiting for it are relinked.
     *
     * @throws com.spreadsheet.calc.exceptions.DuplicateSheetException if the name exists (case-insensitive)
     */
    public Sheet createSheet(String name) {
        Sheet sheet = workbook.createSheet(name);
        if (!unresolvedCells.isEmpty()) {
            List<Integer> waiting = new ArrayList<>(unresolvedCells);
            unresolvedCells.clear();
            for (int id : waiting) {
                link(workbook.getCell(id));
                markDirty(Collections.singleton(id));
            }
        }
        logger.debug("Created sheet '{}'", name);
        return sheet;
    }

    /**
     * Stores raw cell content: a formula when it starts with "=", a literal otherwise.
     * A malformed formula is stored with #NAME? instead of failing.
     *
     * @return the cell
     * @throws InvalidAddressException if the address is malformed or out of bounds
     * @throws com.spreadsheet.calc.exceptions.SheetNotFoundException if the sheet doesn't exist
     */
    public Cell setCell(String sheetName, String address, String content) {
        Cell cell = cellAt(sheetName, address);
        clearFormula(cell);
        cell.setRawContent(content);
        cell.setErrorMessage(null);

        if (content != null && content.startsWith("=") && content.length() > 1) {
            try {
                FormulaNode ast = parseCache.acquire(content, cell.getSheetName(), parser);
                cell.setFormula(ast, ParseCache.keyOf(content, cell.getSheetName()));
                link(cell);
                cell.setState(CellState.DIRTY);
            } catch (FormulaParseException e) {
                logger.debug("Parse error in {}: {}", cell.getAddress(), e.getMessage());
                cell.setValue(CellValue.error(ErrorCode.NAME));
                cell.setErrorMessage(e.getMessage());
            }
        } else {
            cell.setValue(FormulaParser.parseLiteral(content));
        }
        markDirty(Collections.singleton(cell.getId()));
        return cell;
    }

    /**
     * Stores a typed constant.
     */
    public Cell setValue(String sheetName, String address, CellValue value) {
        Cell cell = cellAt(sheetName, address);
        clearFormula(cell);
        cell.setRawContent(value.isEmpty() ? null : rawText(value));
        cell.setErrorMessage(null);
        cell.setValue(value);
        markDirty(Collections.singleton(cell.getId()));
        return cell;
    }

    private static String rawText(CellValue value) {
        if (value.isText() && value.getText().startsWith("=")) {
            // Excel's quote prefix for text that looks like a formula
            return "'" + value.getText();
        }
        if (value.isText()) {
            return value.getText();
        }
        return value.format();
    }

    /**
     * The stored cell, or null if nothing was ever stored or referenced there.
     */
    public Cell findCell(String sheetName, String address) {
        CellAddress parsed = parseAddress(sheetName, address);
        return workbook.findCell(parsed.getSheetName(), parsed.getColumn(), parsed.getRow());
    }

    /**
     * Current value of a cell without calculating it; empty for unknown cells.
     */
    public CellValue getValue(String sheetName, String address) {
        workbook.getSheet(sheetName);
        Cell cell = findCell(sheetName, address);
        return cell == null ? CellValue.EMPTY : cell.getValue();
    }

    /**
     * Defines a name for a cell or range reference like "Sheet1!$A$1:$B$5".
     * Formulas already stored are reparsed so they pick the name up.
     *
     * @param scopeSheet sheet the name is local to, or null for a workbook-wide name
     */
    public NamedRange addNamedRange(String name, String scopeSheet, String reference) {
        String target = reference == null ? null : reference.trim();
        if (target != null && target.startsWith("=")) {
            target = target.substring(1);
        }
        CellAddress[] corners = CellAddress.parseRange(target);
        CellAddress start = corners[0];
        if (start.getSheetName() == null) {
            if (scopeSheet == null) {
                throw new InvalidAddressException("Named range " + name + " needs a sheet: " + reference);
            }
            start = start.withSheet(scopeSheet);
        }
        NamedRange namedRange = new NamedRange(name, scopeSheet, start, corners[1].withSheet(start.getSheetName()));
        if (workbook.findSheet(start.getSheetName()) == null) {
            logger.warn("Named range {} points at unknown sheet '{}'", name, start.getSheetName());
        }
        workbook.addNamedRange(namedRange);
        reparseFormulas();
        return namedRange;
    }

    private void reparseFormulas() {
        List<Cell> formulas = new ArrayList<>();
        for (Cell cell : workbook.getCells()) {
            if (cell.getFormula() != null) {
                formulas.add(cell);
            }
        }
        // cached trees were bound with the old names; every user re-acquires below
        parseCache.clear();
        // setCell may add placeholder cells, so iterate over a snapshot
        for (Cell cell : formulas) {
            setCell(cell.getSheetName(), cell.getAddress().toA1(), cell.getRawContent());
        }
        if (!formulas.isEmpty()) {
            logger.debug("Reparsed {} formulas after a name change", formulas.size());
        }
    }

    /**
     * Marks formula cells among the given ids, and everything downstream of them, dirty.
     * Formulas with dynamic references are always included.
     */
    public void markDirty(Set<Integer> changed) {
        Set<Integer> seeds = new LinkedHashSet<>(changed);
        seeds.addAll(dynamicCells);
        for (int id : graph.withTransitiveDependents(seeds)) {
            Cell cell = workbook.getCell(id);
            if (cell.getFormula() != null) {
                cell.setState(CellState.DIRTY);
                dirty.add(id);
            }
        }
    }

    /**
     * Marks every formula cell dirty.
     */
    public void markAllDirty() {
        for (Cell cell : workbook.getCells()) {
            if (cell.getFormula() != null) {
                cell.setState(CellState.DIRTY);
                dirty.add(cell.getId());
            }
        }
    }

    /**
     * Records a calculated value and clears the dirty flag.
     */
    public void commit(int id, CellValue value) {
        Cell cell = workbook.getCell(id);
        cell.setValue(value);
        dirty.remove(id);
    }

    public Set<Integer> getDirty() {
        return Collections.unmodifiableSet(dirty);
    }

    public boolean isDynamic(int id) {
        return dynamicCells.contains(id);
    }

    /**
     * Dirty cells the given cell needs, the cell itself included when dirty.
     */
    public Set<Integer> dirtyUpstream(int id) {
        Set<Integer> result = new LinkedHashSet<>();
        List<Integer> stack = new ArrayList<>();
        stack.add(id);
        while (!stack.isEmpty()) {
            int current = stack.remove(stack.size() - 1);
            if (!dirty.contains(current) || !result.add(current)) {
                continue;
            }
            stack.addAll(graph.getPrecedents(current));
        }
        return result;
    }

    public Cell getCell(int id) {
        return workbook.getCell(id);
    }

    public Workbook getWorkbook() {
        return workbook;
    }

    public DependencyGraph getGraph() {
        return graph;
    }

    public ParseCache getParseCache() {
        return parseCache;
    }

    public FormulaParser getParser() {
        return parser;
    }

    // ----------------------------------------------------------------
    // Internal Helpers
    // ----------------------------------------------------------------

    private Cell cellAt(String sheetName, String address) {
        CellAddress parsed = parseAddress(sheetName, address);
        return workbook.getCell(workbook.cellId(parsed.getSheetName(), parsed.getColumn(), parsed.getRow()));
    }

    private CellAddress parseAddress(String sheetName, String address) {
        CellAddress parsed = CellAddress.parse(address);
        if (parsed.getSheetName() == null) {
            return parsed.withSheet(workbook.getSheet(sheetName).getName());
        }
        return parsed.withSheet(workbook.getSheet(parsed.getSheetName()).getName());
    }

    private void clearFormula(Cell cell) {
        if (cell.getFormula() != null) {
            parseCache.release(cell.getFormulaCacheKey());
            cell.setFormula(null, null);
        }
        graph.removePrecedents(cell.getId());
        dynamicCells.remove(cell.getId());
        unresolvedCells.remove(cell.getId());
        dirty.remove(cell.getId());
    }

    /**
     * Rebuilds the outgoing edges of a formula cell from its tree; ranges are
     * expanded cell by cell. References to missing sheets get no edge yet.
     */
    private void link(Cell cell) {
        ReferenceCollector references = ReferenceCollector.collect(cell.getFormula());
        Set<Integer> precedents = new LinkedHashSet<>();
        boolean unresolved = false;
        for (FormulaNode.CellReference reference : references.getCells()) {
            CellAddress target = reference.getAddress();
            if (workbook.findSheet(target.getSheetName()) == null) {
                unresolved = true;
                continue;
            }
            precedents.add(workbook.cellId(target.getSheetName(), target.getColumn(), target.getRow()));
        }
        for (FormulaNode.RangeReference range : references.getRanges()) {
            if (workbook.findSheet(range.getSheetName()) == null) {
                unresolved = true;
                continue;
            }
            for (int row = range.getStart().getRow(); row <= range.getEnd().getRow(); row++) {
                for (int col = range.getStart().getColumn(); col <= range.getEnd().getColumn(); col++) {
                    precedents.add(workbook.cellId(range.getSheetName(), col, row));
                }
            }
        }
        graph.setPrecedents(cell.getId(), precedents);
        if (references.hasDynamicReferences()) {
            dynamicCells.add(cell.getId());
        }
        if (unresolved) {
            unresolvedCells.add(cell.getId());
        }
    }
}
