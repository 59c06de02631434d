package floc.solver;

/**
 * Best open set found so far with its true expected cost.
 */
public class Incumbent {
    private final boolean[] openFacilities;
    private final double expectedCost;
    private final int iteration;

    Incumbent(boolean[] openFacilities, double expectedCost, int iteration) {
        this.openFacilities = openFacilities.clone();
        this.expectedCost = expectedCost;
        this.iteration = iteration;
    }

    public boolean[] getOpenFacilities() {
        return openFacilities.clone();
    }

    public double getExpectedCost() {
        return expectedCost;
    }

    public int getIteration() {
        return iteration;
    }
}
