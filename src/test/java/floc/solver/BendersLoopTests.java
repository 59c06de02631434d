package floc.solver;

import floc.lp.LinearProgram;
import floc.lp.LinearSolver;
import floc.lp.LpConstraint;
import floc.lp.LpVariable;
import floc.lp.OrToolsSolver;
import floc.lp.SolveOutcome;
import floc.output.LocationSolution;
import floc.registry.ModelData;
import floc.registry.ModelDataBuilder;
import floc.registry.Parameters;
import floc.registry.TestInstances;
import floc.utility.Constants;
import floc.utility.Enums;
import floc.utility.SolverFailureException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static floc.registry.TestInstances.demands;
import static org.junit.jupiter.api.Assertions.*;

public class BendersLoopTests {
    private final LinearSolver solver = new OrToolsSolver("GLOP", "SCIP");

    @BeforeEach
    void setUp() {
        Parameters.restoreDefaults();
    }

    @AfterEach
    void tearDown() {
        Parameters.restoreDefaults();
    }

    @Test
    @DisplayName("the single facility instance should converge in two iterations")
    void testTrivial() throws Exception {
        BendersResult result = new BendersLoop(TestInstances.trivial(), solver).solve();
        assertEquals(Enums.BendersState.CONVERGED, result.getState());
        assertTrue(result.getIterations() <= 2);
        assertEquals(5.0, result.getUpperBound(), 1e-6);
        assertEquals(5.0, result.getLowerBound(), 1e-4);
        assertTrue(result.getSolution().isOpen(0));
        assertEquals(5.0, result.getSolution().getAllocation(0, 0, 0), 1e-6);
        assertEquals(1, result.getNumOptimalityCuts());
        assertEquals(0, result.getNumFeasibilityCuts());
        assertEquals(0, result.getNumUnstableCuts());
    }

    @Test
    @DisplayName("demand above a single capacity should open both facilities")
    void testTwoFacilities() throws Exception {
        BendersResult result = new BendersLoop(TestInstances.twoFacilities(), solver).solve();
        assertEquals(Enums.BendersState.CONVERGED, result.getState());
        assertEquals(26.0, result.getUpperBound(), 1e-6);
        assertArrayEquals(new boolean[]{true, true}, result.getSolution().getOpenFacilities());
        assertEquals(0.0, result.getPercentGap(), 1e-3);
    }

    @Test
    @DisplayName("aggregate capacity below the largest demand should stop before iterating")
    void testInsufficientCapacity() throws Exception {
        ModelData modelData = new ModelDataBuilder()
            .addFacility("F1", 1, 10)
            .addCustomer("C1")
            .setUniformVariableCost(1)
            .addScenario("S1", 0.5, demands("C1", 5.0))
            .addScenario("S2", 0.5, demands("C1", 15.0))
            .build();
        BendersResult result = new BendersLoop(modelData, solver).solve();
        assertEquals(Enums.BendersState.INFEASIBLE_MODEL, result.getState());
        assertEquals(0, result.getIterations());
        assertFalse(result.hasSolution());
    }

    @Test
    @DisplayName("bounds should be monotone and bracket the deterministic equivalent optimum")
    void testBoundsAgainstDep() throws Exception {
        ModelData modelData = TestInstances.random(7, 5, 8, 4);
        BendersLoop loop = new BendersLoop(modelData, solver);
        BendersResult result = loop.solve();
        assertEquals(Enums.BendersState.CONVERGED, result.getState());

        List<Double> lowerBounds = result.getLowerBounds();
        List<Double> upperBounds = result.getUpperBounds();
        assertEquals(result.getIterations(), lowerBounds.size());
        for (int k = 1; k < lowerBounds.size(); ++k) {
            assertTrue(lowerBounds.get(k) >= lowerBounds.get(k - 1) - 1e-9);
            assertTrue(upperBounds.get(k) <= upperBounds.get(k - 1) + 1e-9);
        }

        DepSolver depSolver = new DepSolver(modelData, solver);
        LocationSolution depSolution = depSolver.solve(Constants.NO_TIME_LIMIT);
        final double optimum = depSolution.getExpectedCost();
        final double tolerance = 1e-4 * (1.0 + optimum);
        assertTrue(result.getLowerBound() <= optimum + tolerance);
        assertTrue(result.getUpperBound() >= optimum - tolerance);
        assertEquals(optimum, result.getUpperBound(), tolerance);
    }

    @Test
    @DisplayName("optimality cuts should hold at the optimal open set with the true scenario costs")
    void testCutValidity() throws Exception {
        ModelData modelData = TestInstances.random(3, 4, 6, 3);
        BendersLoop loop = new BendersLoop(modelData, solver);
        BendersResult result = loop.solve();
        LocationSolution solution = result.getSolution();
        boolean[] open = solution.getOpenFacilities();

        for (Cut cut : loop.getCuts()) {
            if (!cut.isOptimalityCut())
                continue;
            final double scenarioCost = solution.getScenarioCost(cut.getScenarioIndex());
            assertFalse(cut.isViolated(open, scenarioCost, 1e-5));
        }
    }

    @Test
    @DisplayName("re-solving the scenarios at the final open set should reproduce the upper bound")
    void testUpperBoundReproduction() throws Exception {
        ModelData modelData = TestInstances.random(5, 4, 7, 3);
        BendersResult result = new BendersLoop(modelData, solver).solve();
        LocationSolution solution = result.getSolution();

        double expectedCost = modelData.getFixedCost(solution.getOpenFacilities());
        for (int s = 0; s < modelData.getNumScenarios(); ++s) {
            SubproblemResult subResult = new ScenarioSubproblem(modelData, modelData.getScenarios().get(s),
                solution.getOpenFacilities()).solve(solver, Constants.NO_TIME_LIMIT);
            expectedCost += modelData.getScenarios().get(s).getProbability() * subResult.getObjValue();
        }
        assertEquals(result.getUpperBound(), expectedCost, 1e-5);
        assertEquals(result.getUpperBound(), solution.getExpectedCost(), 1e-5);
    }

    @Test
    @DisplayName("two runs on the same input should give identical results")
    void testDeterminism() throws Exception {
        ModelData modelData = TestInstances.random(21, 4, 6, 3);
        BendersResult first = new BendersLoop(modelData, solver).solve();
        BendersResult second = new BendersLoop(modelData, solver).solve();
        assertEquals(first.getIterations(), second.getIterations());
        assertEquals(first.getUpperBound(), second.getUpperBound(), 1e-9);
        assertEquals(first.getLowerBounds(), second.getLowerBounds());
        assertArrayEquals(first.getSolution().getOpenFacilities(), second.getSolution().getOpenFacilities());
    }

    @Test
    @DisplayName("parallel scenario solving should agree with sequential solving")
    void testParallel() throws Exception {
        ModelData modelData = TestInstances.random(13, 4, 6, 5);
        BendersResult sequential = new BendersLoop(modelData, solver).solve();

        Parameters.setRunScenariosInParallel(true);
        Parameters.setNumThreads(3);
        BendersResult parallel = new BendersLoop(modelData, solver).solve();

        assertEquals(sequential.getState(), parallel.getState());
        assertEquals(sequential.getIterations(), parallel.getIterations());
        assertEquals(sequential.getUpperBound(), parallel.getUpperBound(), 1e-9);
        assertArrayEquals(sequential.getSolution().getOpenFacilities(),
            parallel.getSolution().getOpenFacilities());
    }

    @Test
    @DisplayName("the iteration limit should stop the loop with the incumbent")
    void testMaxIterations() throws Exception {
        Parameters.setMaxIterations(1);
        BendersResult result = new BendersLoop(TestInstances.trivial(), solver).solve();
        assertEquals(Enums.BendersState.MAX_ITER_REACHED, result.getState());
        assertEquals(1, result.getIterations());
        assertEquals(5.0, result.getUpperBound(), 1e-6);
        assertEquals(0.0, result.getLowerBound(), 1e-6);
        assertTrue(result.hasSolution());
    }

    @Test
    @DisplayName("a master solve hitting the time limit should return the incumbent")
    void testTimeout() throws Exception {
        final int[] numMipCalls = {0};
        LinearSolver timingOut = new LinearSolver() {
            @Override
            public SolveOutcome solve(LinearProgram program) throws SolverFailureException {
                if (program.isMip() && ++numMipCalls[0] >= 2)
                    return SolveOutcome.withoutSolution(Enums.SolveStatus.TIMEOUT);
                return solver.solve(program);
            }
        };

        BendersResult result = new BendersLoop(TestInstances.trivial(), timingOut).solve();
        assertEquals(Enums.BendersState.TIME_LIMIT_REACHED, result.getState());
        assertEquals(2, result.getIterations());
        assertEquals(5.0, result.getUpperBound(), 1e-6);
        assertTrue(result.hasSolution());
        assertEquals(5.0, result.getSolution().getExpectedCost(), 1e-6);
    }

    @Test
    @DisplayName("restricted eligibility should trigger feasibility cuts and still reach the optimum")
    void testFeasibilityCuts() throws Exception {
        ModelData modelData = TestInstances.restrictedEligibility(100);
        BendersResult result = new BendersLoop(modelData, solver).solve();
        assertEquals(Enums.BendersState.CONVERGED, result.getState());
        assertTrue(result.getNumFeasibilityCuts() >= 1);
        assertEquals(20.0, result.getUpperBound(), 1e-6);
        assertArrayEquals(new boolean[]{false, true}, result.getSolution().getOpenFacilities());

        LocationSolution depSolution = new DepSolver(modelData, solver).solve(Constants.NO_TIME_LIMIT);
        assertEquals(depSolution.getExpectedCost(), result.getUpperBound(), 1e-6);
    }

    @Test
    @DisplayName("a customer that can never be served should end with an infeasible model")
    void testInfeasibleAfterFeasibilityCuts() throws Exception {
        ModelData modelData = TestInstances.restrictedEligibility(3);
        BendersResult result = new BendersLoop(modelData, solver).solve();
        assertEquals(Enums.BendersState.INFEASIBLE_MODEL, result.getState());
        assertTrue(result.getNumFeasibilityCuts() >= 1);
        assertFalse(result.hasSolution());
    }

    @Test
    @DisplayName("a loose absolute tolerance should stop the loop after the first iteration")
    void testAbsoluteTolerance() throws Exception {
        Parameters.setAbsoluteTolerance(10.0);
        BendersResult result = new BendersLoop(TestInstances.trivial(), solver).solve();
        assertEquals(Enums.BendersState.CONVERGED, result.getState());
        assertEquals(1, result.getIterations());
        assertEquals(0.0, result.getLowerBound(), 1e-6);
        assertEquals(5.0, result.getUpperBound(), 1e-6);
        assertTrue(result.getGap() <= 10.0);
    }

    @Test
    @DisplayName("cuts violated by less than the cut tolerance should not be added")
    void testCutTolerance() throws Exception {
        Parameters.setCutTolerance(10.0);
        BendersResult result = new BendersLoop(TestInstances.trivial(), solver).solve();
        assertEquals(Enums.BendersState.CONVERGED, result.getState());
        assertEquals(1, result.getIterations());
        assertEquals(0, result.getNumOptimalityCuts());
        assertEquals(5.0, result.getUpperBound(), 1e-6);
    }

    @Test
    @DisplayName("the wall clock budget should stop the loop with the incumbent")
    void testWallClockLimit() throws Exception {
        LinearSolver slowMaster = new LinearSolver() {
            @Override
            public SolveOutcome solve(LinearProgram program) throws SolverFailureException {
                if (program.isMip()) {
                    try {
                        Thread.sleep(600);
                    } catch (InterruptedException ex) {
                        Thread.currentThread().interrupt();
                        throw new SolverFailureException("interrupted", ex);
                    }
                }
                return solver.solve(program);
            }
        };

        Parameters.setTimeLimitInSeconds(1);
        BendersResult result = new BendersLoop(TestInstances.trivial(), slowMaster).solve();
        assertEquals(Enums.BendersState.TIME_LIMIT_REACHED, result.getState());
        assertTrue(result.getIterations() <= 2);
        assertTrue(result.getSolutionTime() >= 1.0);
        assertTrue(result.hasSolution());
        assertEquals(5.0, result.getUpperBound(), 1e-6);
        assertEquals(result.getIterations(), result.getLowerBounds().size());
    }

    @Test
    @DisplayName("cuts built from distorted duals should be flagged without stopping the loop")
    void testDistortedDuals() throws Exception {
        LinearSolver distorting = new LinearSolver() {
            @Override
            public SolveOutcome solve(LinearProgram program) throws SolverFailureException {
                SolveOutcome outcome = solver.solve(program);
                if (!outcome.hasDuals())
                    return outcome;

                List<LpVariable> variables = program.getVariables();
                double[] values = new double[variables.size()];
                for (LpVariable variable : variables)
                    values[variable.getIndex()] = outcome.getValue(variable);
                List<LpConstraint> constraints = program.getConstraints();
                double[] duals = new double[constraints.size()];
                for (LpConstraint constraint : constraints)
                    duals[constraint.getIndex()] = 1.5 * outcome.getDual(constraint);
                return new SolveOutcome(outcome.getStatus(), outcome.getObjectiveValue(),
                    outcome.getObjectiveBound(), values, duals);
            }
        };

        BendersResult result = new BendersLoop(TestInstances.trivial(), distorting).solve();
        assertEquals(Enums.BendersState.CONVERGED, result.getState());
        assertTrue(result.getNumUnstableCuts() >= 1);
        assertEquals(5.0, result.getUpperBound(), 1e-6);
        assertEquals(5.0, result.getSolution().getExpectedCost(), 1e-6);
    }
}
