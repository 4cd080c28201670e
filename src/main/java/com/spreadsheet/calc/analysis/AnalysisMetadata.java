package com.spreadsheet.calc.analysis;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AnalysisMetadata {

    @JsonProperty("total_sheets")
    @JsonAlias("sheet_count")
    private int totalSheets;

    @JsonProperty("total_formulas")
    private int totalFormulas;

    @JsonProperty("sheet_cell_counts")
    private Map<String, Integer> sheetCellCounts = new LinkedHashMap<>();

    @JsonProperty("category_histogram")
    private Map<String, Integer> categoryHistogram = new LinkedHashMap<>();

    public int getTotalSheets() {
        return totalSheets;
    }

    public void setTotalSheets(int totalSheets) {
        this.totalSheets = totalSheets;
    }

    public int getTotalFormulas() {
        return totalFormulas;
    }

    public void setTotalFormulas(int totalFormulas) {
        this.totalFormulas = totalFormulas;
    }

    public Map<String, Integer> getSheetCellCounts() {
        return sheetCellCounts;
    }

    public void setSheetCellCounts(Map<String, Integer> sheetCellCounts) {
        this.sheetCellCounts = sheetCellCounts == null ? new LinkedHashMap<>() : sheetCellCounts;
    }

    public Map<String, Integer> getCategoryHistogram() {
        return categoryHistogram;
    }

    public void setCategoryHistogram(Map<String, Integer> categoryHistogram) {
        this.categoryHistogram = categoryHistogram == null ? new LinkedHashMap<>() : categoryHistogram;
    }
}
