package floc.solver;

import floc.domain.Scenario;
import floc.lp.LinearProgram;
import floc.lp.LinearSolver;
import floc.lp.SolveOutcome;
import floc.model.MasterModelBuilder;
import floc.registry.ModelData;
import floc.utility.Enums;
import floc.utility.ModelInfeasibleException;
import floc.utility.OptException;
import floc.utility.SolverFailureException;
import floc.utility.SolverTimeoutException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class MasterProblem {
    /**
     * Relaxed first-stage problem: open decisions, one recourse estimate per scenario and the cut pool
     * accumulated by the Benders loop. The MIP is rebuilt from the pool on every solve.
     */
    private final static Logger logger = LogManager.getLogger(MasterProblem.class);
    private final ModelData modelData;
    private final LinearSolver solver;
    private final CutGenerator cutGenerator;
    private final ArrayList<Cut> cuts;

    public MasterProblem(ModelData modelData, LinearSolver solver) {
        this.modelData = modelData;
        this.solver = solver;
        this.cutGenerator = new CutGenerator(modelData);
        this.cuts = new ArrayList<>();
    }

    public void addCut(Cut cut) {
        cuts.add(cut);
        logger.debug("added " + cut);
    }

    public Cut addOptimalityCut(int scenarioIndex, double[] dualsDemand, double[] dualsCapacity, int iteration) {
        return addCut(Enums.CutType.OPTIMALITY, scenarioIndex, dualsDemand, dualsCapacity, iteration);
    }

    public Cut addFeasibilityCut(int scenarioIndex, double[] dualsDemand, double[] dualsCapacity, int iteration) {
        return addCut(Enums.CutType.FEASIBILITY, scenarioIndex, dualsDemand, dualsCapacity, iteration);
    }

    private Cut addCut(Enums.CutType type, int scenarioIndex, double[] dualsDemand, double[] dualsCapacity,
                       int iteration) {
        Scenario scenario = modelData.getScenarios().get(scenarioIndex);
        Cut cut = cutGenerator.buildCut(type, scenario, dualsDemand, dualsCapacity, iteration);
        addCut(cut);
        return cut;
    }

    /**
     * @return cuts in insertion order.
     */
    public List<Cut> getCuts() {
        return Collections.unmodifiableList(cuts);
    }

    public MasterSolution solve(long timeLimitInMillis) throws OptException {
        LinearProgram program = new LinearProgram("master");
        program.setTimeLimitInMillis(timeLimitInMillis);
        MasterModelBuilder builder = new MasterModelBuilder(modelData, program);
        builder.buildFirstStage();
        builder.addTheta();

        for (int k = 0; k < cuts.size(); ++k) {
            Cut cut = cuts.get(k);
            if (cut.isOptimalityCut())
                builder.addOptimalityCut(cut.getScenarioIndex(), cut.getConstant(), cut.getCoefficients(),
                    "opt_cut_" + k);
            else
                builder.addFeasibilityCut(cut.getConstant(), cut.getCoefficients(), "feas_cut_" + k);
        }

        SolveOutcome outcome = solver.solve(program);
        switch (outcome.getStatus()) {
            case OPTIMAL:
                break;
            case INFEASIBLE:
                logger.error("master problem infeasible with " + cuts.size() + " cuts");
                throw new ModelInfeasibleException("no open set satisfies the master constraints");
            case TIMEOUT:
                throw new SolverTimeoutException("time limit reached solving master problem");
            default:
                logger.error("master problem returned " + outcome.getStatus());
                throw new SolverFailureException("error solving master problem");
        }

        MasterSolution solution = new MasterSolution(builder.getOpenValues(outcome),
            builder.getThetaValues(outcome), outcome.getObjectiveValue(), outcome.getObjectiveBound());
        logger.debug("master objective: " + solution.getObjValue() + ", bound: " + solution.getBound());
        return solution;
    }
}
