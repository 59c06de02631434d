package floc.dao;

import floc.registry.ModelData;
import floc.utility.OptException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URISyntaxException;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

public class InstanceDAOTests {
    static String getInstancePath(String name) throws URISyntaxException {
        return Paths.get(InstanceDAOTests.class.getResource("/instances/" + name).toURI()).toString();
    }

    @Test
    @DisplayName("a YAML instance should be read into model data")
    void testReadYaml() throws Exception {
        ModelData modelData = new InstanceDAO(getInstancePath("two_facilities.yaml")).getModelData();
        assertEquals(2, modelData.getNumFacilities());
        assertEquals(2, modelData.getNumCustomers());
        assertEquals(1, modelData.getNumScenarios());
        assertEquals(5.0, modelData.getFacility("F1").getFixedCost(), 1e-9);
        assertEquals(10.0, modelData.getFacility("F2").getCapacity(), 1e-9);
        assertEquals(8.0, modelData.getScenarios().get(0).getDemand(1), 1e-9);
    }

    @Test
    @DisplayName("a JSON instance with eligibility restrictions should be read")
    void testReadJson() throws Exception {
        ModelData modelData = new InstanceDAO(getInstancePath("eligibility.json")).getModelData();
        assertTrue(modelData.hasRestrictedEligibility());
        assertFalse(modelData.isEligible(0, 1));
        assertTrue(modelData.isEligible(1, 1));
    }

    @Test
    @DisplayName("a missing top level key should raise an error")
    void testMissingKey() {
        OptException ex = assertThrows(OptException.class,
            () -> new InstanceDAO(getInstancePath("missing_key.yaml")));
        assertTrue(ex.getMessage().contains("variableCosts"));
    }

    @Test
    @DisplayName("a non-numeric value should raise an error")
    void testBadType() {
        assertThrows(OptException.class, () -> new InstanceDAO(getInstancePath("bad_type.yaml")));
    }

    @Test
    @DisplayName("a missing file should raise an error")
    void testMissingFile() {
        assertThrows(OptException.class, () -> new InstanceDAO("does/not/exist.yaml"));
    }
}
