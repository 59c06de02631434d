package floc.solver;

import floc.lp.LinearSolver;
import floc.lp.OrToolsSolver;
import floc.output.LocationSolution;
import floc.registry.ModelData;
import floc.registry.TestInstances;
import floc.utility.Constants;
import floc.utility.ModelInfeasibleException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DepSolverTests {
    private final LinearSolver solver = new OrToolsSolver("GLOP", "SCIP");

    @Test
    @DisplayName("the extensive form should open both facilities when one cannot cover demand")
    void testTwoFacilities() throws Exception {
        DepSolver depSolver = new DepSolver(TestInstances.twoFacilities(), solver);
        LocationSolution solution = depSolver.solve(Constants.NO_TIME_LIMIT);
        assertTrue(depSolver.isOptimal());
        assertEquals(26.0, depSolver.getObjValue(), 1e-6);
        assertEquals(26.0, solution.getExpectedCost(), 1e-6);
        assertEquals(10.0, solution.getFixedCost(), 1e-6);
        assertEquals(16.0, solution.getScenarioCost(0), 1e-6);
        assertEquals(2, solution.getNumOpenFacilities());
    }

    @Test
    @DisplayName("allocations should respect eligibility")
    void testEligibility() throws Exception {
        ModelData modelData = TestInstances.restrictedEligibility(100);
        LocationSolution solution = new DepSolver(modelData, solver).solve(Constants.NO_TIME_LIMIT);
        assertEquals(20.0, solution.getExpectedCost(), 1e-6);
        assertEquals(0.0, solution.getAllocation(0, 0, 1), 1e-9);
        assertEquals(5.0, solution.getAllocation(0, 1, 1), 1e-6);
    }

    @Test
    @DisplayName("an instance without a feasible open set should raise a model infeasibility")
    void testInfeasible() throws Exception {
        DepSolver depSolver = new DepSolver(TestInstances.restrictedEligibility(3), solver);
        assertThrows(ModelInfeasibleException.class, () -> depSolver.solve(Constants.NO_TIME_LIMIT));
    }
}
