package floc.model;

import floc.domain.Facility;
import floc.domain.Scenario;
import floc.lp.LinearProgram;
import floc.lp.LpConstraint;
import floc.lp.LpVariable;
import floc.lp.SolveOutcome;
import floc.registry.ModelData;
import floc.utility.Constants;

import java.util.List;

public class MasterModelBuilder {
    private final ModelData modelData;
    private final LinearProgram program;

    private LpVariable[] open; // open[i] = 1 if facilities[i] is opened.
    private LpVariable[] theta; // theta[s] estimates the recourse cost of scenarios[s].

    public MasterModelBuilder(ModelData modelData, LinearProgram program) {
        this.modelData = modelData;
        this.program = program;
    }

    /**
     * Adds the open decisions with their fixed costs and the standing capacity sufficiency row, which keeps
     * the "open everything" decision feasible for every scenario.
     */
    public void buildFirstStage() {
        List<Facility> facilities = modelData.getFacilities();
        open = new LpVariable[facilities.size()];
        for (Facility facility : facilities) {
            LpVariable var = program.addBinaryVariable("open_" + facility.getId());
            program.setObjectiveCoef(var, facility.getFixedCost());
            open[facility.getIndex()] = var;
        }

        LpConstraint sufficiency = program.addGreaterOrEqual("capacity_sufficiency",
            modelData.getMaxTotalDemand());
        for (Facility facility : facilities)
            if (facility.getCapacity() > 0.0)
                sufficiency.addTerm(open[facility.getIndex()], facility.getCapacity());
    }

    /**
     * Adds one recourse estimate per scenario, weighted by its probability. Second-stage costs are
     * non-negative, so the estimates are bounded below by zero.
     */
    public void addTheta() {
        List<Scenario> scenarios = modelData.getScenarios();
        theta = new LpVariable[scenarios.size()];
        for (Scenario scenario : scenarios) {
            LpVariable var = program.addContinuousVariable("theta_" + scenario.getId(), 0.0,
                Double.POSITIVE_INFINITY);
            program.setObjectiveCoef(var, scenario.getProbability());
            theta[scenario.getIndex()] = var;
        }
    }

    /**
     * Adds theta[s] - sum_i coefs[i] * open[i] >= constant.
     */
    public void addOptimalityCut(int scenarioIndex, double constant, double[] coefs, String name) {
        LpConstraint row = program.addGreaterOrEqual(name, cleanValue(constant));
        row.addTerm(theta[scenarioIndex], 1.0);
        for (int i = 0; i < coefs.length; ++i)
            if (Math.abs(coefs[i]) >= Constants.EPS)
                row.addTerm(open[i], -coefs[i]);
    }

    /**
     * Adds sum_i coefs[i] * open[i] <= -constant.
     */
    public void addFeasibilityCut(double constant, double[] coefs, String name) {
        LpConstraint row = program.addLessOrEqual(name, -cleanValue(constant));
        for (int i = 0; i < coefs.length; ++i)
            if (Math.abs(coefs[i]) >= Constants.EPS)
                row.addTerm(open[i], coefs[i]);
    }

    public LpVariable[] getOpen() {
        return open;
    }

    public boolean[] getOpenValues(SolveOutcome outcome) {
        boolean[] values = new boolean[open.length];
        for (int i = 0; i < open.length; ++i)
            values[i] = outcome.getValue(open[i]) > Constants.OPEN_THRESHOLD;
        return values;
    }

    public double[] getThetaValues(SolveOutcome outcome) {
        double[] values = new double[theta.length];
        for (int s = 0; s < theta.length; ++s)
            values[s] = outcome.getValue(theta[s]);
        return values;
    }

    private static double cleanValue(double value) {
        return Math.abs(value) >= Constants.EPS ? value : 0.0;
    }
}
