package floc.lp;

import floc.utility.Enums;

public class SolveOutcome {
    /**
     * Result of a solve call. Primal values are present for OPTIMAL outcomes and for TIMEOUT outcomes with a
     * feasible point; dual values only for OPTIMAL continuous problems.
     */
    private final Enums.SolveStatus status;
    private final double objectiveValue;
    private final double objectiveBound;
    private final double[] values;
    private final double[] duals;

    public SolveOutcome(Enums.SolveStatus status, double objectiveValue, double objectiveBound,
                        double[] values, double[] duals) {
        this.status = status;
        this.objectiveValue = objectiveValue;
        this.objectiveBound = objectiveBound;
        this.values = values;
        this.duals = duals;
    }

    public static SolveOutcome withoutSolution(Enums.SolveStatus status) {
        return new SolveOutcome(status, Double.NaN, Double.NaN, null, null);
    }

    public Enums.SolveStatus getStatus() {
        return status;
    }

    public boolean isOptimal() {
        return status == Enums.SolveStatus.OPTIMAL;
    }

    public double getObjectiveValue() {
        return objectiveValue;
    }

    /**
     * @return proven lower bound on the optimum; equals the objective value for continuous problems.
     */
    public double getObjectiveBound() {
        return objectiveBound;
    }

    public boolean hasValues() {
        return values != null;
    }

    public double getValue(LpVariable variable) {
        return values[variable.getIndex()];
    }

    public boolean hasDuals() {
        return duals != null;
    }

    public double getDual(LpConstraint constraint) {
        return duals[constraint.getIndex()];
    }
}
