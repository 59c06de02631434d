package floc.output;

public class LocationSolution {
    /**
     * LocationSolution objects store a first-stage open set together with the second-stage allocation plan
     * and cost of every scenario at that open set.
     */
    private final String name;
    private final boolean[] openFacilities;
    private final double fixedCost;
    private final double[] scenarioCosts; // scenarioCosts[s] is the recourse cost of scenario s.
    private final double expectedCost; // fixed cost plus probability weighted recourse costs.
    private final double[][][] allocations; // allocations[s][i][j] = units shipped from i to j in scenario s.

    public LocationSolution(String name, boolean[] openFacilities, double fixedCost, double[] scenarioCosts,
                            double expectedCost, double[][][] allocations) {
        this.name = name;
        this.openFacilities = openFacilities;
        this.fixedCost = fixedCost;
        this.scenarioCosts = scenarioCosts;
        this.expectedCost = expectedCost;
        this.allocations = allocations;
    }

    public String getName() {
        return name;
    }

    public boolean[] getOpenFacilities() {
        return openFacilities.clone();
    }

    public boolean isOpen(int facilityIndex) {
        return openFacilities[facilityIndex];
    }

    public int getNumOpenFacilities() {
        int count = 0;
        for (boolean open : openFacilities)
            if (open)
                ++count;
        return count;
    }

    public double getFixedCost() {
        return fixedCost;
    }

    public double getScenarioCost(int scenarioIndex) {
        return scenarioCosts[scenarioIndex];
    }

    public double getExpectedCost() {
        return expectedCost;
    }

    public double getAllocation(int scenarioIndex, int facilityIndex, int customerIndex) {
        return allocations[scenarioIndex][facilityIndex][customerIndex];
    }
}
