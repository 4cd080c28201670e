package com.spreadsheet.calc.services;

import com.spreadsheet.calc.analysis.FormulaEntry;
import com.spreadsheet.calc.analysis.WorkbookAnalysis;
import com.spreadsheet.calc.config.EngineProperties;
import com.spreadsheet.calc.exceptions.CircularReferenceException;
import com.spreadsheet.calc.exceptions.InvalidAddressException;
import com.spreadsheet.calc.exceptions.InvalidReferenceException;
import com.spreadsheet.calc.exceptions.SheetNotFoundException;
import com.spreadsheet.calc.functions.FunctionRegistry;
import com.spreadsheet.calc.graph.CalculationGroup;
import com.spreadsheet.calc.graph.CalculationPlan;
import com.spreadsheet.calc.models.CalcMode;
import com.spreadsheet.calc.models.Cell;
import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.CellState;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.ErrorCode;
import com.spreadsheet.calc.models.NamedRange;
import com.spreadsheet.calc.models.Sheet;
import com.spreadsheet.calc.models.Workbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.locks.Lock;

/**
 * Recalculates a workbook: plans the dirty cells with the dependency graph,
 * evaluates them layer by layer and solves cycles iteratively.
 *
 * <p>Mutations and calculation passes hold the workbook's write lock,
 * reads the read lock, so readers never see a half-finished pass.
 */
public class CalculationEngine implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(CalculationEngine.class);

    private final EngineProperties properties;
    private final FunctionRegistry registry;
    private final CellStore store;
    private final ExecutorService executor;
    private volatile CalcMode calcMode;

    public CalculationEngine(EngineProperties properties, FunctionRegistry registry) {
        this.properties = properties;
        this.registry = registry;
        this.store = new CellStore(properties.getListSeparator());
        this.calcMode = properties.getCalcMode();
        this.executor = properties.getParallelism() > 1
                ? Executors.newFixedThreadPool(properties.getParallelism())
                : null;
    }

    public CalculationEngine(EngineProperties properties) {
        this(properties, FunctionRegistry.standard());
    }

    public CalculationEngine() {
        this(new EngineProperties());
    }

    /**
     * Populates sheets, named ranges, constants and formulas from an analysis
     * document. Nothing is calculated; every formula is left dirty.
     *
     * @return number of formula cells loaded
     */
    public int loadAnalysis(WorkbookAnalysis analysis) {
        Lock lock = writeLock();
        try {
            for (String sheet : analysis.getSheetNames()) {
                if (store.getWorkbook().findSheet(sheet) == null) {
                    store.createSheet(sheet);
                }
            }
            for (Map.Entry<String, String> name : analysis.getNamedRanges().entrySet()) {
                addLoadedName(name.getKey(), name.getValue());
            }
            for (Map.Entry<String, Map<String, Object>> sheet : analysis.getValuesBySheet().entrySet()) {
                for (Map.Entry<String, Object> value : sheet.getValue().entrySet()) {
                    store.setValue(sheet.getKey(), value.getKey(), CellValue.fromObject(value.getValue()));
                }
            }
            int loaded = 0;
            int mismatches = 0;
            for (Map.Entry<String, List<FormulaEntry>> sheet : analysis.getFormulasBySheet().entrySet()) {
                for (FormulaEntry entry : sheet.getValue()) {
                    if (entry.getCell() == null || entry.getFormula() == null) {
                        logger.warn("Skipping incomplete formula entry on sheet '{}'", sheet.getKey());
                        continue;
                    }
                    Cell cell = store.setCell(sheet.getKey(), entry.getCell(), entry.normalizedFormula());
                    cell.setCategory(entry.getCategory());
                    loaded++;
                    if (!declaredMatchesGraph(cell, analysis.declaredDependencies(sheet.getKey(), entry))) {
                        mismatches++;
                    }
                }
            }
            if (mismatches > 0) {
                logger.debug("{} formulas declare dependencies that differ from their parsed references", mismatches);
            }
            logger.info("Loaded {} sheets, {} named ranges and {} formulas",
                    analysis.getSheetNames().size(), analysis.getNamedRanges().size(), loaded);
            return loaded;
        } finally {
            lock.unlock();
        }
    }

    public Sheet createSheet(String name) {
        Lock lock = writeLock();
        try {
            Sheet sheet = store.createSheet(name);
            recalculateIfAutomatic();
            return sheet;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sets raw content ("=A1*2", "42", "text"). In AUTOMATIC mode the affected
     * cells are recalculated before this returns.
     *
     * @return the cell's value afterwards (stale in MANUAL mode)
     */
    public CalculationResult setCell(String sheet, String address, String content) {
        Lock lock = writeLock();
        try {
            Cell cell = store.setCell(sheet, address, content);
            recalculateIfAutomatic();
            return CalculationResult.of(cell.getValue());
        } finally {
            lock.unlock();
        }
    }

    public CalculationResult setCellValue(String sheet, String address, CellValue value) {
        Lock lock = writeLock();
        try {
            Cell cell = store.setValue(sheet, address, value);
            recalculateIfAutomatic();
            return CalculationResult.of(cell.getValue());
        } finally {
            lock.unlock();
        }
    }

    /**
     * The stored value without calculating; an empty result for cells never set.
     */
    public CalculationResult getCell(String sheet, String address) {
        Lock lock = readLock();
        try {
            return CalculationResult.of(store.getValue(sheet, address));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Brings one cell up to date, calculating the dirty cells it needs first.
     */
    public CalculationResult calculateCell(String sheet, String address) {
        Lock lock = writeLock();
        try {
            Cell cell = store.findCell(sheet, address);
            if (cell == null) {
                return CalculationResult.of(CellValue.EMPTY);
            }
            Set<Integer> upstream = store.dirtyUpstream(cell.getId());
            if (!upstream.isEmpty()) {
                runPass(upstream, newContext(null));
            }
            return CalculationResult.of(cell.getValue());
        } finally {
            lock.unlock();
        }
    }

    public NamedRange addNamedRange(String name, String scopeSheet, String reference) {
        Lock lock = writeLock();
        try {
            NamedRange namedRange = store.addNamedRange(name, scopeSheet, reference);
            recalculateIfAutomatic();
            return namedRange;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Calculates the dirty cells only.
     */
    public RecalculationReport recalculate() {
        return recalculate(null);
    }

    public RecalculationReport recalculate(CancellationToken token) {
        Lock lock = writeLock();
        try {
            return runPass(new LinkedHashSet<>(store.getDirty()), newContext(token));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Full recalculation of every formula cell.
     */
    public RecalculationReport recalculateAll() {
        return recalculateAll(null);
    }

    public RecalculationReport recalculateAll(CancellationToken token) {
        Lock lock = writeLock();
        try {
            store.markAllDirty();
            return runPass(new LinkedHashSet<>(store.getDirty()), newContext(token));
        } finally {
            lock.unlock();
        }
    }

    public CalcMode getCalcMode() {
        return calcMode;
    }

    /**
     * Switching to AUTOMATIC calculates whatever is dirty.
     */
    public void setCalcMode(CalcMode calcMode) {
        Lock lock = writeLock();
        try {
            this.calcMode = calcMode;
            recalculateIfAutomatic();
        } finally {
            lock.unlock();
        }
    }

    public int getDirtyCount() {
        Lock lock = readLock();
        try {
            return store.getDirty().size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Snapshot of the cells holding a formula (parse failures included).
     */
    public List<Cell> getFormulaCells() {
        Lock lock = readLock();
        try {
            List<Cell> formulas = new ArrayList<>();
            for (Cell cell : store.getWorkbook().getCells()) {
                if (cell.isFormula()) {
                    formulas.add(cell);
                }
            }
            return formulas;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Address to current value for every non-placeholder cell of a sheet.
     */
    public Map<String, Object> getSheetData(String sheet) {
        Lock lock = readLock();
        try {
            Map<String, Object> data = new LinkedHashMap<>();
            for (Cell cell : store.getWorkbook().getSheet(sheet).getCells()) {
                if (!cell.isPlaceholder()) {
                    data.put(cell.getAddress().toA1(), cell.getValue().toObject());
                }
            }
            return data;
        } finally {
            lock.unlock();
        }
    }

    public Cell findCell(String sheet, String address) {
        Lock lock = readLock();
        try {
            return store.findCell(sheet, address);
        } finally {
            lock.unlock();
        }
    }

    CellStore getStore() {
        return store;
    }

    @Override
    public void close() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    // ----------------------------------------------------------------
    // Internal Helpers
    // ----------------------------------------------------------------

    // "Sheet1!Rate" declares a name local to Sheet1
    private void addLoadedName(String qualifiedName, String reference) {
        String name = qualifiedName;
        String scope = null;
        int bang = qualifiedName.lastIndexOf('!');
        if (bang > 0) {
            scope = CellAddress.unquoteSheet(qualifiedName.substring(0, bang));
            name = qualifiedName.substring(bang + 1);
        }
        try {
            store.addNamedRange(name, scope, reference);
        } catch (InvalidAddressException | SheetNotFoundException e) {
            logger.warn("Skipping named range {}: {}", qualifiedName, e.getMessage());
        }
    }

    private Lock writeLock() {
        Lock lock = store.getWorkbook().getLock().writeLock();
        lock.lock();
        return lock;
    }

    private Lock readLock() {
        Lock lock = store.getWorkbook().getLock().readLock();
        lock.lock();
        return lock;
    }

    private CalculationContext newContext(CancellationToken token) {
        return new CalculationContext(properties.isIterativeCalculation(), properties.getMaxIterations(),
                properties.getEpsilon(), token);
    }

    private void recalculateIfAutomatic() {
        if (calcMode == CalcMode.AUTOMATIC && !store.getDirty().isEmpty()) {
            runPass(new LinkedHashSet<>(store.getDirty()), newContext(null));
        }
    }

    private RecalculationReport runPass(Collection<Integer> scope, CalculationContext context) {
        CalculationPlan plan = store.getGraph().plan(scope);
        boolean cancelled = false;
        for (List<CalculationGroup> layer : plan.getLayers()) {
            if (context.isCancelled()) {
                cancelled = true;
                break;
            }
            if (executor != null && layer.size() > 1) {
                evaluateLayerInParallel(layer, context);
            } else {
                for (CalculationGroup group : layer) {
                    evaluateGroup(group, context);
                }
            }
        }
        int errors = 0;
        for (int id : scope) {
            Cell cell = store.getCell(id);
            if (!cell.isDirty() && cell.getValue().isError()) {
                errors++;
            }
        }
        double seconds = context.elapsedSeconds();
        int calculated = context.getCellsCalculated();
        RecalculationReport report = new RecalculationReport(calculated, errors, plan.getLayers().size(),
                plan.getCycles().size(), context.getFailedCycles(), context.getIterations(),
                context.elapsedMillis(), seconds > 0 ? calculated / seconds : 0, cancelled, store.getDirty().size());
        if (cancelled) {
            logger.info("Recalculation cancelled after {} cells; {} still dirty", calculated, report.getRemainingDirty());
        } else if (calculated > 0) {
            logger.info("Recalculated {} cells in {} ms ({} layers, {} cycles, {} errors)",
                    calculated, report.getDurationMs(), report.getLayers(), report.getCycles(), errors);
        }
        return report;
    }

    private void evaluateGroup(CalculationGroup group, CalculationContext context) {
        if (group.isCyclic()) {
            Map<Integer, CellValue> solved = solveCycle(group, context, true);
            for (Map.Entry<Integer, CellValue> result : solved.entrySet()) {
                commit(result.getKey(), result.getValue(), context);
            }
            return;
        }
        calculateNow(store.getCell(group.getCells().get(0)), context);
    }

    /**
     * Evaluates a dirty cell on the calling thread. Reaching a cell that is
     * already being calculated means a reference loop the graph couldn't see.
     */
    private void calculateNow(Cell cell, CalculationContext context) {
        if (!cell.isDirty()) {
            return;
        }
        cell.setState(CellState.CALCULATING);
        try {
            CellValue value = evaluate(cell, new WorkbookReader(null, true, context));
            commit(cell.getId(), value, context);
        } finally {
            if (cell.getState() == CellState.CALCULATING) {
                cell.setState(CellState.DIRTY);
            }
        }
    }

    private void commit(int id, CellValue value, CalculationContext context) {
        store.commit(id, value);
        context.cellCalculated();
        if (logger.isDebugEnabled()) {
            logger.debug("{} = {}", store.getCell(id).getAddress(), value);
        }
    }

    /**
     * Groups without dynamic references run on the pool against a private
     * overlay; results are committed here once the whole layer is done.
     */
    private void evaluateLayerInParallel(List<CalculationGroup> layer, CalculationContext context) {
        List<CalculationGroup> sequential = new ArrayList<>();
        List<Future<Map<Integer, CellValue>>> futures = new ArrayList<>();
        for (CalculationGroup group : layer) {
            if (hasDynamicCell(group)) {
                sequential.add(group);
            } else {
                futures.add(executor.submit(() -> computeGroup(group, context)));
            }
        }
        for (Future<Map<Integer, CellValue>> future : futures) {
            Map<Integer, CellValue> results;
            try {
                results = future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while calculating", e);
            } catch (ExecutionException e) {
                throw new IllegalStateException("Calculation task failed", e.getCause());
            }
            for (Map.Entry<Integer, CellValue> result : results.entrySet()) {
                commit(result.getKey(), result.getValue(), context);
            }
        }
        for (CalculationGroup group : sequential) {
            evaluateGroup(group, context);
        }
    }

    private Map<Integer, CellValue> computeGroup(CalculationGroup group, CalculationContext context) {
        if (group.isCyclic()) {
            return solveCycle(group, context, false);
        }
        int id = group.getCells().get(0);
        Map<Integer, CellValue> result = new LinkedHashMap<>();
        result.put(id, evaluate(store.getCell(id), new WorkbookReader(null, false, context)));
        return result;
    }

    private boolean hasDynamicCell(CalculationGroup group) {
        for (int id : group.getCells()) {
            if (store.isDynamic(id)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Gauss-Seidel iteration over a cycle: members are evaluated in order, each
     * seeing the newest values of the others, starting from zero. Converged when
     * no member moves by epsilon or more; otherwise every member gets #CIRCULAR!.
     */
    private Map<Integer, CellValue> solveCycle(CalculationGroup group, CalculationContext context, boolean onDemand) {
        Map<Integer, CellValue> working = new LinkedHashMap<>();
        for (int id : group.getCells()) {
            working.put(id, CellValue.ZERO);
        }
        if (context.isIterative()) {
            WorkbookReader reader = new WorkbookReader(working, onDemand, context);
            for (int iteration = 1; iteration <= context.getMaxIterations(); iteration++) {
                context.countIteration();
                double maxChange = 0;
                for (int id : group.getCells()) {
                    CellValue next = evaluate(store.getCell(id), reader);
                    CellValue previous = working.put(id, next);
                    maxChange = Math.max(maxChange, change(previous, next));
                }
                if (maxChange < context.getEpsilon()) {
                    context.cycleConverged();
                    logger.debug("Cycle {} converged after {} iterations", describe(group), iteration);
                    return working;
                }
            }
            logger.debug("Cycle {} did not converge in {} iterations", describe(group), context.getMaxIterations());
        }
        context.cycleFailed();
        CellValue circular = CellValue.error(ErrorCode.CIRCULAR);
        for (int id : group.getCells()) {
            working.put(id, circular);
        }
        return working;
    }

    private static double change(CellValue previous, CellValue next) {
        if (previous.isNumber() && next.isNumber()) {
            return Math.abs(next.getNumber() - previous.getNumber());
        }
        return previous.equals(next) ? 0 : Double.POSITIVE_INFINITY;
    }

    private String describe(CalculationGroup group) {
        List<String> addresses = new ArrayList<>();
        for (int id : group.getCells()) {
            addresses.add(store.getCell(id).getAddress().toString());
        }
        return addresses.toString();
    }

    private CellValue evaluate(Cell cell, CellReader reader) {
        return new FormulaEvaluator(registry, reader, cell.getAddress()).evaluate(cell.getFormula());
    }

    private boolean declaredMatchesGraph(Cell cell, List<String> declared) {
        if (declared.isEmpty()) {
            return true;
        }
        Set<Integer> expected = new HashSet<>();
        Workbook workbook = store.getWorkbook();
        for (String dependency : declared) {
            try {
                CellAddress[] corners = CellAddress.parseRange(dependency);
                String sheet = corners[0].getSheetName() == null ? cell.getSheetName() : corners[0].getSheetName();
                if (workbook.findSheet(sheet) == null) {
                    continue;
                }
                for (int row = Math.min(corners[0].getRow(), corners[1].getRow());
                     row <= Math.max(corners[0].getRow(), corners[1].getRow()); row++) {
                    for (int col = Math.min(corners[0].getColumn(), corners[1].getColumn());
                         col <= Math.max(corners[0].getColumn(), corners[1].getColumn()); col++) {
                        Cell target = workbook.findCell(sheet, col, row);
                        expected.add(target == null ? -1 : target.getId());
                    }
                }
            } catch (InvalidAddressException e) {
                logger.debug("Unreadable declared dependency '{}' of {}", dependency, cell.getAddress());
                return false;
            }
        }
        Set<Integer> actual = store.getGraph().getPrecedents(cell.getId());
        if (!expected.equals(actual)) {
            logger.debug("Declared dependencies of {} differ from parsed references: declared {}, parsed {} cells",
                    cell.getAddress(), declared, actual.size());
            return false;
        }
        return true;
    }

    /**
     * Reads committed cell values, or the overlay while a cycle is being solved.
     */
    private final class WorkbookReader implements CellReader {

        private final Map<Integer, CellValue> overlay;
        private final boolean onDemand;
        private final CalculationContext context;

        private WorkbookReader(Map<Integer, CellValue> overlay, boolean onDemand, CalculationContext context) {
            this.overlay = overlay;
            this.onDemand = onDemand;
            this.context = context;
        }

        @Override
        public CellValue read(CellAddress address) {
            Workbook workbook = store.getWorkbook();
            if (workbook.findSheet(address.getSheetName()) == null) {
                throw new InvalidReferenceException("Unknown sheet: " + address.getSheetName());
            }
            Cell cell = workbook.findCell(address.getSheetName(), address.getColumn(), address.getRow());
            if (cell == null) {
                return CellValue.EMPTY;
            }
            if (overlay != null) {
                CellValue working = overlay.get(cell.getId());
                if (working != null) {
                    return working;
                }
            }
            if (cell.getState() == CellState.CALCULATING) {
                throw new CircularReferenceException("Circular reference through " + address);
            }
            if (onDemand && cell.isDirty()) {
                calculateNow(cell, context);
            }
            return cell.getValue();
        }

        @Override
        public NamedRange resolveName(String name, String currentSheet) {
            return store.getWorkbook().resolveName(name, currentSheet);
        }
    }
}
