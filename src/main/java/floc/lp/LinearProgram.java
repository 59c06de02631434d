package floc.lp;

import floc.utility.Constants;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Solver-independent description of a minimization problem with linear rows and continuous or integer
 * columns. Model builders fill it in, a {@link LinearSolver} solves it.
 */
public class LinearProgram {
    private final String name;
    private final ArrayList<LpVariable> variables;
    private final ArrayList<LpConstraint> constraints;
    private long timeLimitInMillis;

    public LinearProgram(String name) {
        this.name = name;
        variables = new ArrayList<>();
        constraints = new ArrayList<>();
        timeLimitInMillis = Constants.NO_TIME_LIMIT;
    }

    public LpVariable addVariable(String varName, double lowerBound, double upperBound, boolean integer) {
        LpVariable variable = new LpVariable(variables.size(), varName, lowerBound, upperBound, integer);
        variables.add(variable);
        return variable;
    }

    public LpVariable addContinuousVariable(String varName, double lowerBound, double upperBound) {
        return addVariable(varName, lowerBound, upperBound, false);
    }

    public LpVariable addBinaryVariable(String varName) {
        return addVariable(varName, 0.0, 1.0, true);
    }

    public LpConstraint addConstraint(String rowName, double lowerBound, double upperBound) {
        LpConstraint constraint = new LpConstraint(constraints.size(), rowName, lowerBound, upperBound);
        constraints.add(constraint);
        return constraint;
    }

    public LpConstraint addGreaterOrEqual(String rowName, double rhs) {
        return addConstraint(rowName, rhs, Double.POSITIVE_INFINITY);
    }

    public LpConstraint addLessOrEqual(String rowName, double rhs) {
        return addConstraint(rowName, Double.NEGATIVE_INFINITY, rhs);
    }

    public void setObjectiveCoef(LpVariable variable, double coef) {
        variable.setObjectiveCoef(coef);
    }

    public String getName() {
        return name;
    }

    public List<LpVariable> getVariables() {
        return Collections.unmodifiableList(variables);
    }

    public List<LpConstraint> getConstraints() {
        return Collections.unmodifiableList(constraints);
    }

    public int getNumVariables() {
        return variables.size();
    }

    public int getNumConstraints() {
        return constraints.size();
    }

    public boolean isMip() {
        for (LpVariable variable : variables)
            if (variable.isInteger())
                return true;
        return false;
    }

    public long getTimeLimitInMillis() {
        return timeLimitInMillis;
    }

    /**
     * @param timeLimitInMillis wall-clock limit for the solve call, {@link Constants#NO_TIME_LIMIT} for none.
     */
    public void setTimeLimitInMillis(long timeLimitInMillis) {
        this.timeLimitInMillis = timeLimitInMillis;
    }
}
