package io.github.galkahana.testharness;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class RunSummaryTest {

    @Test
    public void testRecord_IncrementsExactlyOneOutcomeCounter() {
        // Arrange
        RunSummary summary = RunSummary.filteredOut(2);

        // Act
        summary = summary
            .record(Outcome.passed(), false)
            .record(Outcome.failed("nope"), false)
            .record(Outcome.ignored(), true)
            .record(Outcome.measured(10, 1), true)
            .record(Outcome.measured(20, 2), true);

        // Assert
        assertEquals(new RunSummary(2, 1, 1, 1, 2, 3), summary);
        assertEquals(7, summary.total());
    }

    @Test
    public void testRecord_IsOrderIndependent() {
        // Arrange
        List<Outcome> outcomes = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            outcomes.add(i % 4 == 0 ? Outcome.failed() : i % 3 == 0 ? Outcome.ignored() : Outcome.passed());
        }
        List<Outcome> shuffled = new ArrayList<>(outcomes);
        Collections.shuffle(shuffled, new Random(7));

        // Act
        RunSummary inOrder = RunSummary.empty();
        for (Outcome outcome : outcomes) inOrder = inOrder.record(outcome, false);
        RunSummary outOfOrder = RunSummary.empty();
        for (Outcome outcome : shuffled) outOfOrder = outOfOrder.record(outcome, false);

        // Assert
        assertEquals(inOrder, outOfOrder);
    }

    @Test
    public void testExitCode_FollowsHarnessConvention() {
        assertEquals(0, RunSummary.empty().record(Outcome.passed(), false).exitCode());
        assertEquals(0, RunSummary.filteredOut(5).exitCode());
        assertEquals(101, RunSummary.empty().record(Outcome.failed(), false).exitCode());
        assertTrue(RunSummary.empty().record(Outcome.failed(), false).hasFailed());
    }

    @Test
    public void testMeasured_AcceptsFullNonNegativeRange() {
        Outcome.Measured measured = (Outcome.Measured) Outcome.measured(Long.MAX_VALUE, 0);
        assertEquals(Long.MAX_VALUE, measured.averageNanos());
    }

    @Test
    public void testMeasured_RejectsNegativeValues() {
        assertThrows(IllegalArgumentException.class, () -> Outcome.measured(-1, 0));
        assertThrows(IllegalArgumentException.class, () -> Outcome.measured(0, -1));
    }
}
