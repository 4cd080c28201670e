package com.spreadsheet.calc.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Excel error codes a cell can resolve to.
 * CIRCULAR is not an Excel literal; it marks cells of a cycle that failed to converge.
 */
public enum ErrorCode {
    NULL("#NULL!"),
    DIV0("#DIV/0!"),
    VALUE("#VALUE!"),
    REF("#REF!"),
    NAME("#NAME?"),
    NUM("#NUM!"),
    NA("#N/A"),
    CIRCULAR("#CIRCULAR!");

    private final String text;

    ErrorCode(String text) {
        this.text = text;
    }

    @JsonValue
    public String getText() {
        return text;
    }

    /**
     * Resolves "#N/A", "#div/0!" etc. Returns null for anything that is not an error literal.
     */
    public static ErrorCode fromText(String value) {
        if (value == null) {
            return null;
        }
        String upper = value.trim().toUpperCase();
        for (ErrorCode code : values()) {
            if (code.text.equals(upper)) {
                return code;
            }
        }
        return null;
    }

    @JsonCreator
    public static ErrorCode fromJson(String value) {
        ErrorCode code = fromText(value);
        if (code == null) {
            return ErrorCode.valueOf(value.toUpperCase());
        }
        return code;
    }

    @Override
    public String toString() {
        return text;
    }
}
