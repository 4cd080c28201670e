package com.spreadsheet.calc.parser;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Shares parsed formula trees between cells with identical formula text.
 *
 * <p>Entries are keyed by sheet and formula text, because unqualified
 * references bind to the sheet at parse time. Each cell using an entry holds
 * one reference; an entry is dropped when its last user releases it.
 * Owned by one engine; never global.
 */
public class ParseCache {

    private final Map<String, Entry> entries = new HashMap<>();
    private long hits;
    private long misses;

    public static String keyOf(String formula, String sheet) {
        return sheet.toUpperCase(Locale.ROOT) + '\u0001' + formula;
    }

    /**
     * Returns the tree for the formula, parsing it on a miss, and records one more user.
     *
     * @param formula formula text including the leading "="
     * @throws com.spreadsheet.calc.exceptions.FormulaParseException if parsing fails; nothing is cached then
     */
    public synchronized FormulaNode acquire(String formula, String sheet, FormulaParser parser) {
        String key = keyOf(formula, sheet);
        Entry entry = entries.get(key);
        if (entry != null) {
            hits++;
            entry.references++;
            return entry.node;
        }
        misses++;
        FormulaNode node = parser.parse(formula, sheet).getAst();
        entries.put(key, new Entry(node));
        return node;
    }

    /**
     * Drops one user of the entry; evicts it when unused.
     */
    public synchronized void release(String key) {
        if (key == null) {
            return;
        }
        Entry entry = entries.get(key);
        if (entry != null && --entry.references <= 0) {
            entries.remove(key);
        }
    }

    public synchronized void clear() {
        entries.clear();
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized long getHits() {
        return hits;
    }

    public synchronized long getMisses() {
        return misses;
    }

    private static final class Entry {
        private final FormulaNode node;
        private int references = 1;

        Entry(FormulaNode node) {
            this.node = node;
        }
    }
}
