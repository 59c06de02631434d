package floc.solver;

import floc.utility.Enums;

import java.util.Arrays;

/**
 * Linear inequality over the open decisions, generated from the duals of one scenario subproblem.
 * <p>
 * OPTIMALITY: theta[s] >= constant + sum_i coefficients[i] * open[i].
 * FEASIBILITY: constant + sum_i coefficients[i] * open[i] <= 0.
 */
public class Cut {
    private final Enums.CutType type;
    private final int scenarioIndex;
    private final double constant;
    private final double[] coefficients; // coefficients[i] multiplies the open decision of facility i.
    private final int iteration; // iteration that generated the cut, for logs only.

    public Cut(Enums.CutType type, int scenarioIndex, double constant, double[] coefficients, int iteration) {
        this.type = type;
        this.scenarioIndex = scenarioIndex;
        this.constant = constant;
        this.coefficients = coefficients.clone();
        this.iteration = iteration;
    }

    public Enums.CutType getType() {
        return type;
    }

    public boolean isOptimalityCut() {
        return type == Enums.CutType.OPTIMALITY;
    }

    public int getScenarioIndex() {
        return scenarioIndex;
    }

    public double getConstant() {
        return constant;
    }

    public double[] getCoefficients() {
        return coefficients.clone();
    }

    public int getIteration() {
        return iteration;
    }

    /**
     * @return value of constant + sum_i coefficients[i] * open[i].
     */
    public double evaluate(boolean[] openFacilities) {
        double value = constant;
        for (int i = 0; i < coefficients.length; ++i)
            if (openFacilities[i])
                value += coefficients[i];
        return value;
    }

    /**
     * @param theta recourse estimate of the cut's scenario; ignored for feasibility cuts.
     * @return true if the cut cuts off the given point by more than eps.
     */
    public boolean isViolated(boolean[] openFacilities, double theta, double eps) {
        final double value = evaluate(openFacilities);
        if (isOptimalityCut())
            return theta < value - eps;
        return value > eps;
    }

    @Override
    public String toString() {
        return type + " cut (scenario " + scenarioIndex + ", iteration " + iteration + "): constant "
            + constant + ", coefficients " + Arrays.toString(coefficients);
    }
}
