package floc.solver;

public class SubproblemResult {
    /**
     * Outcome of one scenario subproblem at a fixed open set. For a feasible scenario the duals are the
     * optimal recourse duals; for an infeasible one they come from the phase-one problem and form a ray of
     * the recourse dual.
     */
    private final int scenarioIndex;
    private final boolean feasible;
    private final double objValue; // recourse cost if feasible.
    private final double shortfall; // total unmet demand if infeasible.
    private final double[] dualsDemand; // dualsDemand[j] >= 0, one per customer.
    private final double[] dualsCapacity; // dualsCapacity[i] <= 0, one per facility.
    private final double[][] production; // production[i][j], only for feasible scenarios.

    private SubproblemResult(int scenarioIndex, boolean feasible, double objValue, double shortfall,
                             double[] dualsDemand, double[] dualsCapacity, double[][] production) {
        this.scenarioIndex = scenarioIndex;
        this.feasible = feasible;
        this.objValue = objValue;
        this.shortfall = shortfall;
        this.dualsDemand = dualsDemand;
        this.dualsCapacity = dualsCapacity;
        this.production = production;
    }

    public static SubproblemResult optimal(int scenarioIndex, double objValue, double[] dualsDemand,
                                           double[] dualsCapacity, double[][] production) {
        return new SubproblemResult(scenarioIndex, true, objValue, 0.0, dualsDemand, dualsCapacity,
            production);
    }

    public static SubproblemResult infeasible(int scenarioIndex, double shortfall, double[] dualsDemand,
                                              double[] dualsCapacity) {
        return new SubproblemResult(scenarioIndex, false, Double.NaN, shortfall, dualsDemand, dualsCapacity,
            null);
    }

    public int getScenarioIndex() {
        return scenarioIndex;
    }

    public boolean isFeasible() {
        return feasible;
    }

    public double getObjValue() {
        return objValue;
    }

    public double getShortfall() {
        return shortfall;
    }

    public double[] getDualsDemand() {
        return dualsDemand;
    }

    public double[] getDualsCapacity() {
        return dualsCapacity;
    }

    public double[][] getProduction() {
        return production;
    }
}
