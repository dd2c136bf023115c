package com.ontask.core.filter;

import com.ontask.core.model.StatusConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StatusFilterCompilerTest {

    private final StatusFilterCompiler compiler = new StatusFilterCompiler();

    @Nested
    @DisplayName("inclusion")
    class InclusionTests {

        @Test
        @DisplayName("space and x included, question mark excluded")
        void includesOnlyEnabledSymbols() {
            var filter = compiler.compile(Map.of(" ", true, "x", true));
            assertTrue(filter.includes(' '));
            assertTrue(filter.includes('x'));
            assertFalse(filter.includes('?'));
        }

        @Test
        @DisplayName("explicit false excludes the symbol")
        void explicitFalseExcludes() {
            var filter = compiler.compile(Map.of("x", false, "/", true));
            assertFalse(filter.includes('x'));
            assertTrue(filter.includes('/'));
        }

        @Test
        @DisplayName("a present symbol with a null flag counts as included")
        void nullFlagIncludes() {
            var filterSet = new HashMap<String, Boolean>();
            filterSet.put("!", null);
            assertTrue(compiler.compile(filterSet).includes('!'));
        }

        @Test
        @DisplayName("keys that are not one character are ignored")
        void multiCharacterKeysIgnored() {
            var filter = compiler.compile(Map.of("checked", true, "", true, "+", true));
            assertEquals(java.util.Set.of('+'), filter.allowedSymbols());
        }

        @Test
        @DisplayName("works as a Predicate<Character>")
        void worksAsPredicate() {
            var filter = compiler.compile(Map.of("/", true));
            assertTrue(filter.test('/'));
            assertFalse(filter.test('x'));
            assertFalse(filter.test(null));
        }
    }

    @Nested
    @DisplayName("to-do synonym")
    class SynonymTests {

        @Test
        @DisplayName("enabling dot also includes space")
        void dotIncludesSpace() {
            var filter = compiler.compile(Map.of(".", true));
            assertTrue(filter.includes('.'));
            assertTrue(filter.includes(' '));
        }

        @Test
        @DisplayName("enabling space does not include dot")
        void spaceDoesNotIncludeDot() {
            var filter = compiler.compile(Map.of(" ", true));
            assertTrue(filter.includes(' '));
            assertFalse(filter.includes('.'));
        }

        @Test
        @DisplayName("dot included still wins over an explicitly disabled space")
        void dotOverridesDisabledSpace() {
            var filter = compiler.compile(Map.of(".", true, " ", false));
            assertTrue(filter.includes(' '));
        }

        @Test
        @DisplayName("disabled dot adds nothing")
        void disabledDotAddsNothing() {
            assertTrue(compiler.compile(Map.of(".", false)).matchesNothing());
        }
    }

    @Nested
    @DisplayName("degenerate sets")
    class DegenerateTests {

        @Test
        @DisplayName("empty map matches nothing")
        void emptyMapMatchesNothing() {
            var filter = compiler.compile(Map.of());
            assertTrue(filter.matchesNothing());
            assertFalse(filter.includes(' '));
        }

        @Test
        @DisplayName("null map matches nothing")
        void nullMapMatchesNothing() {
            assertTrue(compiler.compile(null).matchesNothing());
        }

        @Test
        @DisplayName("all flags false matches nothing")
        void allFalseMatchesNothing() {
            var filter = compiler.compile(Map.of("x", false, "/", false));
            assertTrue(filter.matchesNothing());
            assertSame(StatusFilter.none(), filter);
        }
    }

    @Test
    @DisplayName("filterSetOf maps each status to its filtered flag")
    void filterSetOfStatusConfigs() {
        var filterSet = StatusFilterCompiler.filterSetOf(List.of(
                new StatusConfig(".", "To-do", "Not started", true),
                new StatusConfig("x", "Done", "Completed", false)));
        assertEquals(Map.of(".", true, "x", false), filterSet);

        var filter = compiler.compile(filterSet);
        assertTrue(filter.includes(' '));
        assertFalse(filter.includes('x'));
    }

    @Test
    @DisplayName("default statuses include every configured symbol plus the space to-do")
    void defaultStatusesCompile() {
        var filter = compiler.compile(StatusFilterCompiler.filterSetOf(StatusConfig.defaults()));
        assertEquals(14, filter.allowedSymbols().size());
        assertTrue(filter.includes(' '));
        assertTrue(filter.includes('#'));
    }
}
