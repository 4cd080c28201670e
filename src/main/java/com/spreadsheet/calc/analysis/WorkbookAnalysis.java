package com.spreadsheet.calc.analysis;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The workbook analysis document: sheet metadata, named ranges, every formula
 * by sheet, the global dependency map and (optionally) the constant inputs.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkbookAnalysis {

    private AnalysisMetadata metadata = new AnalysisMetadata();

    @JsonProperty("named_ranges")
    private Map<String, String> namedRanges = new LinkedHashMap<>();

    @JsonProperty("formulas_by_sheet")
    private Map<String, List<FormulaEntry>> formulasBySheet = new LinkedHashMap<>();

    private Map<String, List<String>> dependencies = new LinkedHashMap<>();

    @JsonProperty("values_by_sheet")
    private Map<String, Map<String, Object>> valuesBySheet = new LinkedHashMap<>();

    public AnalysisMetadata getMetadata() {
        return metadata;
    }

    public void setMetadata(AnalysisMetadata metadata) {
        this.metadata = metadata;
    }

    public Map<String, String> getNamedRanges() {
        return namedRanges;
    }

    public void setNamedRanges(Map<String, String> namedRanges) {
        this.namedRanges = namedRanges == null ? new LinkedHashMap<>() : namedRanges;
    }

    public Map<String, List<FormulaEntry>> getFormulasBySheet() {
        return formulasBySheet;
    }

    public void setFormulasBySheet(Map<String, List<FormulaEntry>> formulasBySheet) {
        this.formulasBySheet = formulasBySheet == null ? new LinkedHashMap<>() : formulasBySheet;
    }

    public Map<String, List<String>> getDependencies() {
        return dependencies;
    }

    public void setDependencies(Map<String, List<String>> dependencies) {
        this.dependencies = dependencies == null ? new LinkedHashMap<>() : dependencies;
    }

    public Map<String, Map<String, Object>> getValuesBySheet() {
        return valuesBySheet;
    }

    public void setValuesBySheet(Map<String, Map<String, Object>> valuesBySheet) {
        this.valuesBySheet = valuesBySheet == null ? new LinkedHashMap<>() : valuesBySheet;
    }

    /**
     * Every sheet the document mentions, in document order.
     */
    @JsonIgnore
    public Set<String> getSheetNames() {
        Set<String> names = new LinkedHashSet<>();
        if (metadata != null) {
            names.addAll(metadata.getSheetCellCounts().keySet());
        }
        names.addAll(formulasBySheet.keySet());
        names.addAll(valuesBySheet.keySet());
        return names;
    }

    @JsonIgnore
    public int getFormulaCount() {
        int count = 0;
        for (List<FormulaEntry> entries : formulasBySheet.values()) {
            count += entries.size();
        }
        return count;
    }

    /**
     * Declared dependencies of a cell: the entry's own list, else the global map.
     */
    public List<String> declaredDependencies(String sheet, FormulaEntry entry) {
        if (!entry.getDependencies().isEmpty()) {
            return entry.getDependencies();
        }
        List<String> global = dependencies.get(sheet + "!" + entry.getCell());
        return global == null ? new ArrayList<>() : global;
    }
}
