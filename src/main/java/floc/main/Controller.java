package floc.main;

import floc.dao.InstanceDAO;
import floc.demand.DemandScenarioGenerator;
import floc.lp.LinearSolver;
import floc.lp.OrToolsSolver;
import floc.lp.RetryingSolver;
import floc.output.LocationSolution;
import floc.output.OutputManager;
import floc.registry.ModelData;
import floc.registry.Parameters;
import floc.solver.BendersLoop;
import floc.solver.BendersResult;
import floc.solver.DepSolver;
import floc.utility.Enums;
import floc.utility.ModelInfeasibleException;
import floc.utility.OptException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

class Controller {
    /**
     * Class that controls the entire solution process from reading data to writing output.
     */
    private final static Logger logger = LogManager.getLogger(Controller.class);
    private ModelData modelData;
    private OutputManager outputManager;

    Controller() throws OptException {
        logger.info("Started reading data...");
        logger.debug("instance path: " + Parameters.getInstancePath());
        modelData = new InstanceDAO(Parameters.getInstancePath()).getModelData();
        logger.info("completed reading data.");
    }

    ModelData getModelData() {
        return modelData;
    }

    /**
     * Replaces the scenarios of the instance with sampled ones if sampling was requested.
     */
    final void buildScenarios() {
        final int numScenarios = Parameters.getNumGeneratedScenarios();
        if (numScenarios <= 0)
            return;

        DemandScenarioGenerator generator = new DemandScenarioGenerator(modelData,
            Parameters.getDistributionType(), Parameters.getCoefficientOfVariation(), Parameters.getSeed());
        modelData = generator.generateModelData(numScenarios);
    }

    final void solve() throws OptException {
        outputManager = new OutputManager(modelData);
        LinearSolver solver = new RetryingSolver(
            new OrToolsSolver(Parameters.getLpSolverId(), Parameters.getMipSolverId()));

        if (Parameters.getModel() == Enums.Model.DEP)
            solveWithDep(solver);
        else
            solveWithBenders(solver);
    }

    private void solveWithBenders(LinearSolver solver) throws OptException {
        BendersResult result = new BendersLoop(modelData, solver).solve();
        if (result.getState() == Enums.BendersState.INFEASIBLE_MODEL)
            throw new ModelInfeasibleException("no open set can serve every scenario");

        if (result.getState() == Enums.BendersState.MAX_ITER_REACHED)
            logger.warn("iteration limit reached, writing incumbent with gap " + result.getPercentGap() + "%");
        if (!result.hasSolution())
            throw new OptException("Benders ended with state " + result.getState() + " without a solution");

        outputManager.addBendersResult(result);
        logger.info("Benders objective: " + result.getUpperBound());
    }

    private void solveWithDep(LinearSolver solver) throws OptException {
        final long timeLimit = Parameters.getTimeLimitInSeconds() * 1000L;
        DepSolver depSolver = new DepSolver(modelData, solver);
        LocationSolution solution = depSolver.solve(timeLimit);

        outputManager.addKpi("state", depSolver.isOptimal() ? "OPTIMAL" : "TIME_LIMIT_REACHED");
        outputManager.addKpi("lower bound", depSolver.getBound());
        outputManager.addKpi("upper bound", depSolver.getObjValue());
        outputManager.addKpi("solution time", depSolver.getSolutionTimeInSeconds());
        outputManager.setSolution(solution);
    }

    final String writeOutput() throws OptException {
        return outputManager.writeOutput();
    }
}
