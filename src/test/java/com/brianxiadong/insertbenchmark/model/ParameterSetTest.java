package com.brianxiadong.insertbenchmark.model;

import com.brianxiadong.insertbenchmark.config.BenchmarkProperties;
import com.brianxiadong.insertbenchmark.exception.ConfigurationException;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ParameterSetTest {

    @Test
    void parsesDefaultGrid() {
        ParameterSet set = ParameterSet.parse(BenchmarkProperties.DEFAULT_PARAMETERS);

        assertEquals(7, set.size());
        assertEquals(new Parameter(1, 100000), set.getParameters().get(0));
        assertEquals(new Parameter(1000, 1000), set.getParameters().get(6));
    }

    @Test
    void formatIsInverseOfParse() {
        String text = "1x100000 10x10000";

        assertEquals(text, ParameterSet.parse(text).format());
        assertEquals(BenchmarkProperties.DEFAULT_PARAMETERS,
                ParameterSet.parse(BenchmarkProperties.DEFAULT_PARAMETERS).toString());
    }

    @Test
    void parseOfFormatReturnsEqualSet() {
        ParameterSet set = new ParameterSet(List.of(new Parameter(3, 7), new Parameter(0, 5)));

        assertEquals(set, ParameterSet.parse(set.format()));
    }

    @ParameterizedTest
    @ValueSource(strings = {"1x", "x5", "abc", "1-5", "1x2x3", "1x-5", "", "1x5  2x3", "\u0661x5", "5x\uFF13"})
    void rejectsMalformedTokens(String text) {
        assertThrows(ConfigurationException.class, () -> ParameterSet.parse(text));
    }

    @Test
    void groupsEqualTotalsTogetherPreservingOrder() {
        ParameterSet set = new ParameterSet(List.of(
                new Parameter(1, 100000),
                new Parameter(10, 10000),
                new Parameter(2, 50000)));

        List<ParameterSet> groups = set.groupByTotalRows();

        assertEquals(1, groups.size());
        assertEquals("1x100000 10x10000 2x50000", groups.get(0).format());
    }

    @Test
    void groupsAreOrderedByTotalRows() {
        List<ParameterSet> groups = ParameterSet.parse(BenchmarkProperties.DEFAULT_PARAMETERS).groupByTotalRows();

        assertEquals(2, groups.size());
        assertEquals("1x100000 10x10000 100x1000", groups.get(0).format());
        assertEquals("1x1000000 10x100000 100x10000 1000x1000", groups.get(1).format());
    }

    @Test
    void totalRowsDoesNotOverflow() {
        assertEquals(4_000_000_000L, new Parameter(4, 1_000_000_000).totalRows());
    }
}
