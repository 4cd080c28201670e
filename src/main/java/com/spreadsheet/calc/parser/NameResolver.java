package com.spreadsheet.calc.parser;

import com.spreadsheet.calc.models.NamedRange;

/**
 * Looks up named ranges while parsing. Returns null for unknown names.
 */
@FunctionalInterface
public interface NameResolver {

    NameResolver NONE = (name, currentSheet) -> null;

    NamedRange resolve(String name, String currentSheet);
}
