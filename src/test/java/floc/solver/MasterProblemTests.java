package floc.solver;

import floc.lp.LinearSolver;
import floc.lp.OrToolsSolver;
import floc.registry.ModelData;
import floc.registry.TestInstances;
import floc.utility.Constants;
import floc.utility.Enums;
import floc.utility.ModelInfeasibleException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MasterProblemTests {
    private final LinearSolver solver = new OrToolsSolver("GLOP", "SCIP");

    @Test
    @DisplayName("without cuts the master should open just enough capacity with zero recourse estimates")
    void testInitialSolve() throws Exception {
        ModelData modelData = TestInstances.twoFacilities();
        MasterSolution solution = new MasterProblem(modelData, solver).solve(Constants.NO_TIME_LIMIT);
        assertArrayEquals(new boolean[]{true, true}, solution.getOpenFacilities());
        assertEquals(10.0, solution.getObjValue(), 1e-6);
        assertEquals(10.0, solution.getBound(), 1e-4);
        assertEquals(0.0, solution.getThetaValues()[0], 1e-6);
    }

    @Test
    @DisplayName("an optimality cut should raise the recourse estimate of its scenario")
    void testOptimalityCut() throws Exception {
        ModelData modelData = TestInstances.trivial();
        MasterProblem masterProblem = new MasterProblem(modelData, solver);
        Cut cut = masterProblem.addOptimalityCut(0, new double[]{1.0}, new double[]{0.0}, 1);
        assertEquals(5.0, cut.getConstant(), 1e-9);

        MasterSolution solution = masterProblem.solve(Constants.NO_TIME_LIMIT);
        assertEquals(5.0, solution.getThetaValues()[0], 1e-6);
        assertEquals(5.0, solution.getObjValue(), 1e-6);
    }

    @Test
    @DisplayName("a feasibility cut should force the facility that can serve the missing customer")
    void testFeasibilityCut() throws Exception {
        ModelData modelData = TestInstances.restrictedEligibility(100);
        MasterProblem masterProblem = new MasterProblem(modelData, solver);
        assertArrayEquals(new boolean[]{true, false},
            masterProblem.solve(Constants.NO_TIME_LIMIT).getOpenFacilities());

        // 5 - 100 * open[F2] <= 0
        masterProblem.addFeasibilityCut(0, new double[]{0.0, 1.0}, new double[]{0.0, -1.0}, 1);
        assertArrayEquals(new boolean[]{false, true},
            masterProblem.solve(Constants.NO_TIME_LIMIT).getOpenFacilities());
    }

    @Test
    @DisplayName("a master without feasible open sets should raise a model infeasibility")
    void testInfeasible() throws Exception {
        ModelData modelData = TestInstances.trivial();
        MasterProblem masterProblem = new MasterProblem(modelData, solver);
        // 5 <= 0 holds for no open set.
        masterProblem.addFeasibilityCut(0, new double[]{1.0}, new double[]{0.0}, 1);
        assertThrows(ModelInfeasibleException.class, () -> masterProblem.solve(Constants.NO_TIME_LIMIT));
    }

    @Test
    @DisplayName("the cut pool should keep insertion order and be read only")
    void testCutPool() throws Exception {
        ModelData modelData = TestInstances.trivial();
        MasterProblem masterProblem = new MasterProblem(modelData, solver);
        masterProblem.addOptimalityCut(0, new double[]{1.0}, new double[]{0.0}, 1);
        masterProblem.addCut(new Cut(Enums.CutType.FEASIBILITY, 0, -1.0, new double[]{0.0}, 2));

        List<Cut> cuts = masterProblem.getCuts();
        assertEquals(2, cuts.size());
        assertEquals(Enums.CutType.OPTIMALITY, cuts.get(0).getType());
        assertEquals(2, cuts.get(1).getIteration());
        assertThrows(UnsupportedOperationException.class, cuts::clear);
    }
}
