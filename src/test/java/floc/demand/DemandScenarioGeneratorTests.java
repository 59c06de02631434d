package floc.demand;

import floc.domain.Scenario;
import floc.registry.ModelData;
import floc.registry.TestInstances;
import floc.utility.Enums;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DemandScenarioGeneratorTests {
    @Test
    @DisplayName("generated scenarios should be equiprobable with non-negative demands")
    void testScenarioShape() throws Exception {
        ModelData modelData = TestInstances.twoFacilities();
        for (Enums.DistributionType type : Enums.DistributionType.values()) {
            List<Scenario> scenarios = new DemandScenarioGenerator(modelData, type, 0.5, 42)
                .generateScenarios(20);
            assertEquals(20, scenarios.size());
            double probabilitySum = 0.0;
            for (int k = 0; k < scenarios.size(); ++k) {
                Scenario scenario = scenarios.get(k);
                assertEquals(k, scenario.getIndex());
                assertEquals("sample_" + (k + 1), scenario.getId());
                probabilitySum += scenario.getProbability();
                for (double demand : scenario.getDemands())
                    assertTrue(demand >= 0.0);
            }
            assertEquals(1.0, probabilitySum, 1e-9);
        }
    }

    @Test
    @DisplayName("the same seed should reproduce the same samples")
    void testSeed() throws Exception {
        ModelData modelData = TestInstances.twoFacilities();
        List<Scenario> first = new DemandScenarioGenerator(modelData, Enums.DistributionType.LOG_NORMAL, 0.3, 7)
            .generateScenarios(5);
        List<Scenario> second = new DemandScenarioGenerator(modelData, Enums.DistributionType.LOG_NORMAL, 0.3, 7)
            .generateScenarios(5);
        List<Scenario> other = new DemandScenarioGenerator(modelData, Enums.DistributionType.LOG_NORMAL, 0.3, 8)
            .generateScenarios(5);

        boolean differs = false;
        for (int k = 0; k < 5; ++k) {
            assertArrayEquals(first.get(k).getDemands(), second.get(k).getDemands(), 0.0);
            differs |= first.get(k).getDemand(0) != other.get(k).getDemand(0);
        }
        assertTrue(differs);
    }

    @Test
    @DisplayName("sample means should approach the expected demand")
    void testMean() throws Exception {
        ModelData modelData = TestInstances.twoFacilities();
        List<Scenario> scenarios = new DemandScenarioGenerator(modelData, Enums.DistributionType.EXPONENTIAL, 1.0,
            1).generateScenarios(4000);
        double mean = 0.0;
        for (Scenario scenario : scenarios)
            mean += scenario.getDemand(0) * scenario.getProbability();
        assertEquals(8.0, mean, 0.8);
    }

    @Test
    @DisplayName("the generated model data should keep facilities and customers")
    void testModelData() throws Exception {
        ModelData modelData = TestInstances.twoFacilities();
        ModelData sampled = new DemandScenarioGenerator(modelData, Enums.DistributionType.TRUNCATED_NORMAL, 0.1, 3)
            .generateModelData(6);
        assertEquals(6, sampled.getNumScenarios());
        assertEquals(modelData.getNumFacilities(), sampled.getNumFacilities());
        assertEquals(1.0, sampled.getVariableCost(1, 1), 1e-9);
    }
}
