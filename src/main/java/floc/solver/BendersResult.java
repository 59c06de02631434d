package floc.solver;

import floc.output.LocationSolution;
import floc.utility.Enums;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class BendersResult {
    private final Enums.BendersState state;
    private final LocationSolution solution; // null if no incumbent was found.
    private final double lowerBound;
    private final double upperBound;
    private final int iterations;
    private final int numOptimalityCuts;
    private final int numFeasibilityCuts;
    private final int numUnstableCuts; // cuts whose value missed the recourse cost at their open set.
    private final double solutionTime; // seconds
    private final List<Double> lowerBounds; // lower bound after each iteration.
    private final List<Double> upperBounds; // upper bound after each iteration.

    BendersResult(Enums.BendersState state, LocationSolution solution, double lowerBound, double upperBound,
                  int iterations, int numOptimalityCuts, int numFeasibilityCuts, int numUnstableCuts,
                  double solutionTime, ArrayList<Double> lowerBounds, ArrayList<Double> upperBounds) {
        this.state = state;
        this.solution = solution;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        this.iterations = iterations;
        this.numOptimalityCuts = numOptimalityCuts;
        this.numFeasibilityCuts = numFeasibilityCuts;
        this.numUnstableCuts = numUnstableCuts;
        this.solutionTime = solutionTime;
        this.lowerBounds = Collections.unmodifiableList(lowerBounds);
        this.upperBounds = Collections.unmodifiableList(upperBounds);
    }

    public Enums.BendersState getState() {
        return state;
    }

    public boolean hasSolution() {
        return solution != null;
    }

    public LocationSolution getSolution() {
        return solution;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    public double getUpperBound() {
        return upperBound;
    }

    public double getGap() {
        return upperBound - lowerBound;
    }

    /**
     * @return gap relative to the upper bound in percent; infinite while a bound is missing.
     */
    public double getPercentGap() {
        final double gap = getGap();
        if (Double.isInfinite(gap) || Double.isNaN(gap))
            return Double.POSITIVE_INFINITY;
        if (gap <= 0.0)
            return 0.0;
        if (upperBound == 0.0)
            return Double.POSITIVE_INFINITY;
        return gap * 100.0 / Math.abs(upperBound);
    }

    public int getIterations() {
        return iterations;
    }

    public int getNumOptimalityCuts() {
        return numOptimalityCuts;
    }

    public int getNumFeasibilityCuts() {
        return numFeasibilityCuts;
    }

    public int getNumUnstableCuts() {
        return numUnstableCuts;
    }

    public double getSolutionTime() {
        return solutionTime;
    }

    public List<Double> getLowerBounds() {
        return lowerBounds;
    }

    public List<Double> getUpperBounds() {
        return upperBounds;
    }
}
