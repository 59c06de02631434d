package floc.solver;

import floc.domain.Scenario;
import floc.lp.LinearSolver;
import floc.output.LocationSolution;
import floc.registry.ModelData;
import floc.registry.Parameters;
import floc.utility.Constants;
import floc.utility.Enums;
import floc.utility.ModelInfeasibleException;
import floc.utility.OptException;
import floc.utility.SolverFailureException;
import floc.utility.SolverTimeoutException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public class BendersLoop {
    /**
     * Class that solves the 2-stage stochastic facility location problem using multi-cut Benders
     * decomposition.
     */
    private final static Logger logger = LogManager.getLogger(BendersLoop.class);
    private final ModelData modelData;
    private final LinearSolver solver;
    private final CutGenerator cutGenerator;

    private MasterProblem masterProblem;
    private Enums.BendersState state;
    private int iteration;
    private double lowerBound;
    private double upperBound;
    private Incumbent incumbent;
    private int numOptimalityCuts;
    private int numFeasibilityCuts;
    private int numUnstableCuts;
    private ArrayList<Double> lowerBounds;
    private ArrayList<Double> upperBounds;
    private Instant deadline; // null if there is no time limit.

    public BendersLoop(ModelData modelData, LinearSolver solver) {
        this.modelData = modelData;
        this.solver = solver;
        this.cutGenerator = new CutGenerator(modelData);
        state = Enums.BendersState.INIT;
    }

    public Enums.BendersState getState() {
        return state;
    }

    /**
     * Cuts of the last run in insertion order, empty before the first run.
     */
    public List<Cut> getCuts() {
        return masterProblem != null ? masterProblem.getCuts() : new ArrayList<>();
    }

    public BendersResult solve() throws OptException {
        Instant start = Instant.now();
        reset(start);

        if (!modelData.hasSufficientCapacity()) {
            logger.error("total capacity " + modelData.getTotalCapacity() + " is below the largest scenario demand "
                + modelData.getMaxTotalDemand());
            state = Enums.BendersState.INFEASIBLE_MODEL;
            return buildResult(null, start);
        }

        masterProblem = new MasterProblem(modelData, solver);
        logger.info("algorithm starts.");
        logger.info("facilities: " + modelData.getNumFacilities() + ", customers: " + modelData.getNumCustomers()
            + ", scenarios: " + modelData.getNumScenarios());

        final boolean parallel = Parameters.isRunScenariosInParallel();
        if (parallel)
            SubproblemWrapper.initActorManager(solver, Parameters.getNumThreads());

        try {
            state = Enums.BendersState.ITERATING;
            do { runBendersIteration(parallel);
            } while (state == Enums.BendersState.ITERATING);
        } finally {
            if (parallel)
                SubproblemWrapper.clearActorManager();
        }

        LocationSolution solution = null;
        if (incumbent != null)
            solution = recoverSolution();
        else
            logger.warn("no incumbent found, loop ended with state " + state);

        BendersResult result = buildResult(solution, start);
        logger.info("Benders solution time: " + result.getSolutionTime() + " seconds");
        logger.info("algorithm ends with state " + state + ".");
        return result;
    }

    private void reset(Instant start) {
        state = Enums.BendersState.INIT;
        masterProblem = null;
        iteration = 0;
        lowerBound = Double.NEGATIVE_INFINITY;
        upperBound = Double.POSITIVE_INFINITY;
        incumbent = null;
        numOptimalityCuts = 0;
        numFeasibilityCuts = 0;
        numUnstableCuts = 0;
        lowerBounds = new ArrayList<>();
        upperBounds = new ArrayList<>();

        final int timeLimit = Parameters.getTimeLimitInSeconds();
        deadline = timeLimit > 0 ? start.plusSeconds(timeLimit) : null;
    }

    private void runBendersIteration(boolean parallel) throws OptException {
        ++iteration;
        logger.info("----- iteration: " + iteration);

        MasterSolution masterSolution;
        SubproblemResult[] results;
        try {
            masterSolution = masterProblem.solve(getRemainingTime());
            lowerBound = Math.max(lowerBound, masterSolution.getBound());

            SubproblemWrapper wrapper = new SubproblemWrapper(modelData, masterSolution.getOpenFacilities());
            results = parallel
                ? wrapper.solveParallel(getRemainingTime())
                : wrapper.solveSequential(solver, getRemainingTime());
        } catch (ModelInfeasibleException ex) {
            logger.error(ex.getMessage());
            state = Enums.BendersState.INFEASIBLE_MODEL;
            recordBounds();
            return;
        } catch (SolverTimeoutException ex) {
            logger.warn(ex.getMessage());
            state = Enums.BendersState.TIME_LIMIT_REACHED;
            recordBounds();
            return;
        }

        final boolean[] open = masterSolution.getOpenFacilities();
        final double[] thetaValues = masterSolution.getThetaValues();
        int numCutsAdded = addFeasibilityCuts(results);
        final boolean allFeasible = numCutsAdded == 0;

        if (allFeasible) {
            double expectedCost = modelData.getFixedCost(open);
            for (Scenario scenario : modelData.getScenarios())
                expectedCost += scenario.getProbability() * results[scenario.getIndex()].getObjValue();

            logger.info("----- upper bound from subproblems: " + expectedCost);
            if (expectedCost < upperBound) {
                upperBound = expectedCost;
                incumbent = new Incumbent(open, expectedCost, iteration);
            }
            numCutsAdded = addOptimalityCuts(results, open, thetaValues);
        } else
            logger.info("----- infeasible scenarios, upper bound not updated");

        recordBounds();
        logger.info("----- lower bound: " + lowerBound);
        logger.info("----- upper bound: " + upperBound);
        logger.info("----- number of cuts added: " + numCutsAdded);

        if (allFeasible && (isGapClosed() || numCutsAdded == 0)) {
            logger.info("----- converged");
            state = Enums.BendersState.CONVERGED;
        } else if (iteration >= Parameters.getMaxIterations()) {
            logger.warn("----- benders iteration limit reached, incumbent cost: " + upperBound + ", gap: "
                + (upperBound - lowerBound));
            state = Enums.BendersState.MAX_ITER_REACHED;
        } else if (isTimeUp()) {
            logger.warn("----- time limit reached, incumbent cost: " + upperBound);
            state = Enums.BendersState.TIME_LIMIT_REACHED;
        }
    }

    private int addFeasibilityCuts(SubproblemResult[] results) {
        int numCuts = 0;
        for (Scenario scenario : modelData.getScenarios()) {
            SubproblemResult result = results[scenario.getIndex()];
            if (result.isFeasible())
                continue;

            logger.debug("scenario " + scenario.getId() + " infeasible, shortfall " + result.getShortfall());
            masterProblem.addCut(cutGenerator.generateCut(scenario, result, iteration));
            ++numFeasibilityCuts;
            ++numCuts;
        }
        return numCuts;
    }

    private int addOptimalityCuts(SubproblemResult[] results, boolean[] open, double[] thetaValues) {
        final double eps = Parameters.getCutTolerance();
        int numCuts = 0;
        for (Scenario scenario : modelData.getScenarios()) {
            final int s = scenario.getIndex();
            SubproblemResult result = results[s];
            Cut cut = cutGenerator.generateCut(scenario, result, iteration);
            if (!checkStrongDuality(cut, open, result.getObjValue(), scenario))
                ++numUnstableCuts;

            if (cut.isViolated(open, thetaValues[s], eps)) {
                masterProblem.addCut(cut);
                ++numOptimalityCuts;
                ++numCuts;
            }
        }
        return numCuts;
    }

    /**
     * At the open set that produced them, the dual objective of a cut must match the recourse cost.
     */
    private boolean checkStrongDuality(Cut cut, boolean[] open, double objValue, Scenario scenario) {
        final double cutValue = cut.evaluate(open);
        if (Math.abs(cutValue - objValue) <= Constants.DUALITY_TOLERANCE * (1.0 + Math.abs(objValue)))
            return true;
        logger.warn("numeric instability in scenario " + scenario.getId() + ": cut value " + cutValue
            + " differs from recourse cost " + objValue);
        return false;
    }

    private boolean isGapClosed() {
        final double diff = upperBound - lowerBound;
        final double relativeGap = upperBound != 0.0 ? diff / Math.abs(upperBound) : Double.POSITIVE_INFINITY;
        logger.info("----- diff: " + diff + " relative gap: " + relativeGap);
        return diff <= Parameters.getAbsoluteTolerance() || relativeGap <= Parameters.getRelativeTolerance();
    }

    private void recordBounds() {
        lowerBounds.add(lowerBound);
        upperBounds.add(upperBound);
    }

    private long getRemainingTime() throws SolverTimeoutException {
        if (deadline == null)
            return Constants.NO_TIME_LIMIT;
        final long remaining = Duration.between(Instant.now(), deadline).toMillis();
        if (remaining <= 0)
            throw new SolverTimeoutException("time limit of " + Parameters.getTimeLimitInSeconds()
                + " seconds reached");
        return remaining;
    }

    private boolean isTimeUp() {
        return deadline != null && !Instant.now().isBefore(deadline);
    }

    /**
     * Re-solves every scenario at the incumbent to recover the allocation plan.
     */
    private LocationSolution recoverSolution() throws OptException {
        final boolean[] open = incumbent.getOpenFacilities();
        SubproblemResult[] results = new SubproblemWrapper(modelData, open).solveSequential(solver,
            Constants.NO_TIME_LIMIT);

        final int numScenarios = modelData.getNumScenarios();
        double[] scenarioCosts = new double[numScenarios];
        double[][][] allocations = new double[numScenarios][][];
        final double fixedCost = modelData.getFixedCost(open);
        double expectedCost = fixedCost;
        for (Scenario scenario : modelData.getScenarios()) {
            final int s = scenario.getIndex();
            if (!results[s].isFeasible())
                throw new SolverFailureException("scenario " + scenario.getId() + " infeasible at the incumbent");
            scenarioCosts[s] = results[s].getObjValue();
            allocations[s] = results[s].getProduction();
            expectedCost += scenario.getProbability() * scenarioCosts[s];
        }

        final double incumbentCost = incumbent.getExpectedCost();
        if (Math.abs(expectedCost - incumbentCost) > Constants.DUALITY_TOLERANCE * (1.0 + Math.abs(incumbentCost)))
            logger.warn("re-solved incumbent cost " + expectedCost + " differs from upper bound " + incumbentCost);

        logger.info("incumbent found in iteration " + incumbent.getIteration() + " with cost " + expectedCost);
        return new LocationSolution("benders", open, fixedCost, scenarioCosts, expectedCost, allocations);
    }

    private BendersResult buildResult(LocationSolution solution, Instant start) {
        final double solutionTime = Duration.between(start, Instant.now()).toMillis() / 1000.0;
        return new BendersResult(state, solution, lowerBound, upperBound, iteration, numOptimalityCuts,
            numFeasibilityCuts, numUnstableCuts, solutionTime, lowerBounds, upperBounds);
    }
}
