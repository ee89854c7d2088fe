package io.verity.scenario;

import io.verity.config.EngineSettings;
import io.verity.errors.ConfigurationException;
import io.verity.model.BaselineComparison;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class ConfidenceCalculatorTest {
    private final ConfidenceCalculator calculator = new ConfidenceCalculator(EngineSettings.defaultConfidenceBands());

    @Test
    void fullPassScoresHundredAndPartialIsCapped() {
        Assertions.assertEquals(100, calculator.score(4, 4, 4));
        Assertions.assertEquals(100, calculator.score(0, 0, 0));
        Assertions.assertEquals(90, calculator.score(4, 3, 4));
        Assertions.assertEquals(75, calculator.score(3, 3, 4));
        Assertions.assertEquals(50, calculator.score(2, 2, 4));
        Assertions.assertEquals(0, calculator.score(1, 1, 4));
    }

    @Test
    void customBandsAboveNinetyAreStillCapped() {
        ConfidenceCalculator generous = new ConfidenceCalculator(List.of(new ConfidenceBand(0.5, 99), new ConfidenceBand(0.0, 10)));
        Assertions.assertEquals(90, generous.score(1, 0, 2));
        Assertions.assertEquals(10, generous.score(0, 0, 2));
    }

    @Test
    void baselineToleranceIsRelativeOrAbsolute() {
        Assertions.assertTrue(BaselineComparator.matches("200", "210", new BaselineComparison("size", "5%")));
        Assertions.assertFalse(BaselineComparator.matches("200", "211", new BaselineComparison("size", "5%")));
        Assertions.assertTrue(BaselineComparator.matches("10", "12.5", new BaselineComparison("size", "3")));
        Assertions.assertTrue(BaselineComparator.matches("ok\n", " ok", new BaselineComparison("status", "5%")));
        Assertions.assertFalse(BaselineComparator.matches("ok", "okay", new BaselineComparison("status", null)));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> BaselineComparator.matches("1", "1", new BaselineComparison("size", "lots")));
    }

    @Test
    void firstMatchingFixPatternWins() {
        FixPatternTable table = new FixPatternTable(List.of(
                new FixPattern("perm", "permission denied", List.of("chmod +x run.sh"), null, null),
                new FixPattern("any-denied", "denied", List.of("true"), null, "LOW")
        ));
        Assertions.assertEquals("perm", table.firstMatch("bash: ./run.sh: Permission denied").orElseThrow().id());
        Assertions.assertEquals("any-denied", table.firstMatch("access denied").orElseThrow().id());
        Assertions.assertEquals("low", table.firstMatch("access denied").orElseThrow().severity());
        Assertions.assertTrue(table.firstMatch("").isEmpty());
        Assertions.assertThrows(ConfigurationException.class,
                () -> new FixPatternTable(List.of(new FixPattern("bad", "([", List.of(), null, null))));
    }
}
