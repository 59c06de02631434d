package floc.solver;

import floc.domain.Scenario;
import floc.lp.LinearProgram;
import floc.lp.LinearSolver;
import floc.lp.SolveOutcome;
import floc.model.MasterModelBuilder;
import floc.model.SubModelBuilder;
import floc.output.LocationSolution;
import floc.registry.ModelData;
import floc.utility.ModelInfeasibleException;
import floc.utility.OptException;
import floc.utility.SolverFailureException;
import floc.utility.SolverTimeoutException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Solves the deterministic equivalent (extensive form) of the problem as a single MIP with one block of
 * production columns per scenario.
 */
public class DepSolver {
    private final static Logger logger = LogManager.getLogger(DepSolver.class);
    private final ModelData modelData;
    private final LinearSolver solver;
    private double objValue;
    private double bound;
    private boolean optimal;
    private double solutionTimeInSeconds;

    public DepSolver(ModelData modelData, LinearSolver solver) {
        this.modelData = modelData;
        this.solver = solver;
    }

    public LocationSolution solve(long timeLimitInMillis) throws OptException {
        logger.info("starting DEP...");
        LinearProgram program = new LinearProgram("dep");
        program.setTimeLimitInMillis(timeLimitInMillis);

        MasterModelBuilder masterModelBuilder = new MasterModelBuilder(modelData, program);
        masterModelBuilder.buildFirstStage();
        logger.info("added terms from master problem");

        List<Scenario> scenarios = modelData.getScenarios();
        SubModelBuilder[] subModelBuilders = new SubModelBuilder[scenarios.size()];
        for (Scenario scenario : scenarios) {
            SubModelBuilder subModelBuilder = new SubModelBuilder(modelData, scenario, program);
            subModelBuilder.buildProductionVariables(scenario.getProbability());
            subModelBuilder.addDemandConstraints(false);
            subModelBuilder.linkCapacityConstraints(masterModelBuilder.getOpen());
            subModelBuilders[scenario.getIndex()] = subModelBuilder;
            logger.debug("added terms for scenario " + (scenario.getIndex() + 1) + " of " + scenarios.size());
        }

        logger.info("starting to solve DEP");
        Instant start = Instant.now();
        SolveOutcome outcome = solver.solve(program);
        solutionTimeInSeconds = Duration.between(start, Instant.now()).toMillis() / 1000.0;

        switch (outcome.getStatus()) {
            case OPTIMAL:
                break;
            case TIMEOUT:
                if (!outcome.hasValues())
                    throw new SolverTimeoutException("DEP time limit reached without a feasible solution");
                logger.warn("DEP time limit reached, using best feasible solution");
                break;
            case INFEASIBLE:
                logger.error("DEP infeasible");
                throw new ModelInfeasibleException("deterministic equivalent is infeasible");
            default:
                logger.error("DEP returned " + outcome.getStatus());
                throw new SolverFailureException("error solving DEP");
        }

        optimal = outcome.isOptimal();
        objValue = outcome.getObjectiveValue();
        bound = outcome.getObjectiveBound();
        logger.info("DEP objective: " + objValue);
        logger.info("DEP solution time: " + solutionTimeInSeconds + " seconds");
        return buildSolution(outcome, masterModelBuilder, subModelBuilders);
    }

    private LocationSolution buildSolution(SolveOutcome outcome, MasterModelBuilder masterModelBuilder,
                                           SubModelBuilder[] subModelBuilders) {
        final boolean[] open = masterModelBuilder.getOpenValues(outcome);
        final double fixedCost = modelData.getFixedCost(open);
        final int numScenarios = modelData.getNumScenarios();
        double[] scenarioCosts = new double[numScenarios];
        double[][][] allocations = new double[numScenarios][][];
        double expectedCost = fixedCost;
        for (Scenario scenario : modelData.getScenarios()) {
            final int s = scenario.getIndex();
            scenarioCosts[s] = subModelBuilders[s].getShippingCost(outcome);
            allocations[s] = subModelBuilders[s].getProductionValues(outcome);
            expectedCost += scenario.getProbability() * scenarioCosts[s];
        }
        return new LocationSolution("dep", open, fixedCost, scenarioCosts, expectedCost, allocations);
    }

    public double getObjValue() {
        return objValue;
    }

    public double getBound() {
        return bound;
    }

    public boolean isOptimal() {
        return optimal;
    }

    public double getSolutionTimeInSeconds() {
        return solutionTimeInSeconds;
    }
}
