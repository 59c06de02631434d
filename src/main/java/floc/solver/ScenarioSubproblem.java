package floc.solver;

import floc.domain.Scenario;
import floc.lp.LinearProgram;
import floc.lp.LinearSolver;
import floc.lp.SolveOutcome;
import floc.model.SubModelBuilder;
import floc.registry.ModelData;
import floc.utility.Constants;
import floc.utility.Enums;
import floc.utility.OptException;
import floc.utility.SolverFailureException;
import floc.utility.SolverTimeoutException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public class ScenarioSubproblem {
    /**
     * Second-stage distribution problem of one scenario at a fixed open set. Instances hold no solver
     * state and can be solved from any thread.
     */
    private final static Logger logger = LogManager.getLogger(ScenarioSubproblem.class);
    private final ModelData modelData;
    private final Scenario scenario;
    private final boolean[] openFacilities;

    public ScenarioSubproblem(ModelData modelData, Scenario scenario, boolean[] openFacilities) {
        this.modelData = modelData;
        this.scenario = scenario;
        this.openFacilities = openFacilities.clone();
    }

    public Scenario getScenario() {
        return scenario;
    }

    /**
     * @param timeLimitInMillis limit per solve call, {@link Constants#NO_TIME_LIMIT} for none.
     * @return optimal recourse cost with duals, or the infeasibility certificate of the phase-one problem.
     */
    public SubproblemResult solve(LinearSolver solver, long timeLimitInMillis) throws OptException {
        LinearProgram program = new LinearProgram("recourse_" + scenario.getId());
        program.setTimeLimitInMillis(timeLimitInMillis);
        SubModelBuilder builder = new SubModelBuilder(modelData, scenario, program);
        builder.buildProductionVariables(1.0);
        builder.addDemandConstraints(false);
        builder.addCapacityConstraints(openFacilities);

        SolveOutcome outcome = solver.solve(program);
        if (outcome.getStatus() == Enums.SolveStatus.TIMEOUT)
            throw new SolverTimeoutException("time limit reached solving " + program.getName());

        if (outcome.isOptimal()) {
            checkDuals(outcome, program);
            logger.debug("scenario " + scenario.getId() + " recourse cost: " + outcome.getObjectiveValue());
            return SubproblemResult.optimal(scenario.getIndex(), outcome.getObjectiveValue(),
                builder.getDualsDemand(outcome), builder.getDualsCapacity(outcome),
                builder.getProductionValues(outcome));
        }

        logger.debug("scenario " + scenario.getId() + " recourse status " + outcome.getStatus()
            + ", solving phase one");
        return solvePhaseOne(solver, timeLimitInMillis);
    }

    private SubproblemResult solvePhaseOne(LinearSolver solver, long timeLimitInMillis) throws OptException {
        LinearProgram program = new LinearProgram("phase_one_" + scenario.getId());
        program.setTimeLimitInMillis(timeLimitInMillis);
        SubModelBuilder builder = new SubModelBuilder(modelData, scenario, program);
        builder.buildProductionVariables(0.0);
        builder.addDemandConstraints(true);
        builder.addCapacityConstraints(openFacilities);

        SolveOutcome outcome = solver.solve(program);
        if (outcome.getStatus() == Enums.SolveStatus.TIMEOUT)
            throw new SolverTimeoutException("time limit reached solving " + program.getName());
        if (!outcome.isOptimal()) {
            logger.error(program.getName() + " returned " + outcome.getStatus());
            throw new SolverFailureException("error solving " + program.getName());
        }
        checkDuals(outcome, program);

        final double shortfall = outcome.getObjectiveValue();
        if (shortfall <= Constants.EPS) {
            logger.error("scenario " + scenario.getId() + " reported infeasible but phase one has no shortfall");
            throw new SolverFailureException("inconsistent infeasibility verdict for scenario " + scenario.getId());
        }

        logger.debug("scenario " + scenario.getId() + " infeasible, shortfall: " + shortfall);
        return SubproblemResult.infeasible(scenario.getIndex(), shortfall, builder.getDualsDemand(outcome),
            builder.getDualsCapacity(outcome));
    }

    private static void checkDuals(SolveOutcome outcome, LinearProgram program) throws SolverFailureException {
        if (!outcome.hasDuals())
            throw new SolverFailureException("no duals available for " + program.getName());
    }
}
