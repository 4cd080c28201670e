package com.spreadsheet.calc.models;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * AUTOMATIC recalculates after every setCell; MANUAL only marks cells dirty.
 */
public enum CalcMode {
    AUTOMATIC,
    MANUAL;

    /**
     * Allows case-insensitive input ("manual", "Automatic", ...).
     */
    @JsonCreator
    public static CalcMode fromValue(String value) {
        return CalcMode.valueOf(value.trim().toUpperCase());
    }
}
