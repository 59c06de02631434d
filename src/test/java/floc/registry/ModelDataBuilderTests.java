package floc.registry;

import floc.utility.OptException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static floc.registry.TestInstances.demands;
import static org.junit.jupiter.api.Assertions.*;

public class ModelDataBuilderTests {
    @Test
    @DisplayName("facilities, customers and scenarios should be indexed in insertion order")
    void testIndexing() throws OptException {
        ModelData modelData = TestInstances.twoFacilities();
        assertEquals(2, modelData.getNumFacilities());
        assertEquals(1, modelData.getFacility("F2").getIndex());
        assertEquals(1, modelData.getCustomer("C2").getIndex());
        assertEquals(16.0, modelData.getMaxTotalDemand(), 1e-9);
        assertEquals(20.0, modelData.getTotalCapacity(), 1e-9);
        assertTrue(modelData.hasSufficientCapacity());
        assertFalse(modelData.hasRestrictedEligibility());
        assertEquals(5.0, modelData.getFixedCost(new boolean[]{true, false}), 1e-9);
    }

    @Test
    @DisplayName("eligibility restrictions should only allow listed customers")
    void testEligibility() throws OptException {
        ModelData modelData = TestInstances.restrictedEligibility(100);
        assertTrue(modelData.isEligible(0, 0));
        assertFalse(modelData.isEligible(0, 1));
        assertTrue(modelData.isEligible(1, 1));
        assertTrue(modelData.hasRestrictedEligibility());
    }

    @Test
    @DisplayName("probabilities that do not sum to one should be rejected")
    void testProbabilitySum() {
        ModelDataBuilder builder = new ModelDataBuilder()
            .addFacility("F1", 0, 10)
            .addCustomer("C1")
            .setUniformVariableCost(1)
            .addScenario("S1", 0.5, demands("C1", 1.0))
            .addScenario("S2", 0.4, demands("C1", 2.0));
        OptException ex = assertThrows(OptException.class, builder::build);
        assertTrue(ex.getMessage().contains("probabilities"));
    }

    @Test
    @DisplayName("negative demands and costs should be rejected")
    void testNegativeValues() {
        ModelDataBuilder negativeDemand = new ModelDataBuilder()
            .addFacility("F1", 0, 10)
            .addCustomer("C1")
            .setUniformVariableCost(1)
            .addScenario("S1", 1.0, demands("C1", -1.0));
        assertThrows(OptException.class, negativeDemand::build);

        ModelDataBuilder negativeCost = new ModelDataBuilder()
            .addFacility("F1", 0, 10)
            .addCustomer("C1")
            .setVariableCost("F1", "C1", -2)
            .addScenario("S1", 1.0, demands("C1", 1.0));
        assertThrows(OptException.class, negativeCost::build);
    }

    @Test
    @DisplayName("duplicate ids and unknown references should be rejected")
    void testIds() {
        ModelDataBuilder duplicate = new ModelDataBuilder()
            .addFacility("F1", 0, 10)
            .addFacility("F1", 1, 10)
            .addCustomer("C1")
            .setUniformVariableCost(1)
            .addScenario("S1", 1.0, demands("C1", 1.0));
        assertThrows(OptException.class, duplicate::build);

        ModelDataBuilder unknownCustomer = new ModelDataBuilder()
            .addFacility("F1", 0, 10)
            .addCustomer("C1")
            .setUniformVariableCost(1)
            .addScenario("S1", 1.0, demands("C9", 1.0));
        assertThrows(OptException.class, unknownCustomer::build);
    }

    @Test
    @DisplayName("a missing cost on an eligible arc or an unserved customer should be rejected")
    void testCoverage() {
        ModelDataBuilder missingCost = new ModelDataBuilder()
            .addFacility("F1", 0, 10)
            .addCustomer("C1")
            .addScenario("S1", 1.0, demands("C1", 1.0));
        assertThrows(OptException.class, missingCost::build);

        ModelDataBuilder unserved = new ModelDataBuilder()
            .addFacility("F1", 0, 10)
            .addCustomer("C1")
            .addCustomer("C2")
            .setVariableCost("F1", "C1", 1)
            .restrictEligibility("F1", Arrays.asList("C1"))
            .addScenario("S1", 1.0, demands("C1", 1.0));
        assertThrows(OptException.class, unserved::build);
    }

    @Test
    @DisplayName("empty instances should be rejected")
    void testEmpty() {
        assertThrows(OptException.class, () -> new ModelDataBuilder().build());
    }
}
