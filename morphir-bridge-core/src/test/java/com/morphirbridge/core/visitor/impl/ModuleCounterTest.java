package com.morphirbridge.core.visitor.impl;

import com.morphirbridge.core.IrFixtures;
import com.morphirbridge.core.format.FormatDetector;
import com.morphirbridge.core.model.Distribution;
import com.morphirbridge.core.visitor.IrWalker;
import com.morphirbridge.core.visitor.Reducer;
import com.morphirbridge.core.visitor.TraversalResult;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ModuleCounter}.
 */
class ModuleCounterTest {

    @ParameterizedTest
    @CsvSource({
        IrFixtures.CLASSIC_V1 + ", 2",
        IrFixtures.CLASSIC_V3 + ", 2",
        IrFixtures.V4_BUNDLED + ", 1",
        IrFixtures.V4_INCOMPLETE + ", 1"
    })
    void walk_countsModulesWithoutDescending(String fixture, int modules) {
        Distribution distribution = new FormatDetector().parse(IrFixtures.json(fixture)).distribution();

        TraversalResult<Integer> result = new IrWalker<>(new ModuleCounter(), Reducer.sum()).walk(distribution);

        assertThat(result.value()).isEqualTo(modules);
        assertThat(result.nodesVisited()).isEqualTo(modules);
    }
}
