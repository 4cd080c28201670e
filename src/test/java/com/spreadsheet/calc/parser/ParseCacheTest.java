package com.spreadsheet.calc.parser;

import com.spreadsheet.calc.exceptions.FormulaParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ParseCacheTest {

    private ParseCache cache;
    private FormulaParser parser;

    @BeforeEach
    void setUp() {
        cache = new ParseCache();
        parser = new FormulaParser();
    }

    /**
     * The same text on the same sheet shares one tree.
     */
    @Test
    void testSharedTrees() {
        FormulaNode first = cache.acquire("=A1*2", "Sheet1", parser);
        FormulaNode second = cache.acquire("=A1*2", "SHEET1", parser);
        assertSame(first, second);
        assertEquals(1, cache.size());
        assertEquals(1, cache.getHits());
        assertEquals(1, cache.getMisses());

        FormulaNode other = cache.acquire("=A1*2", "Sheet2", parser);
        assertNotSame(first, other);
        assertEquals(2, cache.size());
    }

    /**
     * Entries are evicted once every user has released them.
     */
    @Test
    void testReferenceCounting() {
        cache.acquire("=1+1", "Sheet1", parser);
        cache.acquire("=1+1", "Sheet1", parser);
        String key = ParseCache.keyOf("=1+1", "Sheet1");

        cache.release(key);
        assertEquals(1, cache.size());
        cache.release(key);
        assertEquals(0, cache.size());
        cache.release(key);
        cache.release(null);
        assertEquals(0, cache.size());
    }

    @Test
    void testParseErrorsAreNotCached() {
        assertThrows(FormulaParseException.class, () -> cache.acquire("=1+", "Sheet1", parser));
        assertEquals(0, cache.size());
    }
}
