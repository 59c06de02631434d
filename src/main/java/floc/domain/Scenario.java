package floc.domain;

import java.util.Arrays;

public class Scenario {
    /**
     * Scenario holds probability and customer demand data for a specific second-stage realization.
     */
    private final String id;
    private final int index;
    private final double probability;
    private final double[] demands; // demands[j] is the demand of the customer with index j.
    private final double totalDemand;

    public Scenario(String id, int index, double probability, double[] demands) {
        this.id = id;
        this.index = index;
        this.probability = probability;
        this.demands = demands.clone();
        this.totalDemand = Arrays.stream(demands).sum();
    }

    public String getId() {
        return id;
    }

    public int getIndex() {
        return index;
    }

    public double getProbability() {
        return probability;
    }

    public double getDemand(int customerIndex) {
        return demands[customerIndex];
    }

    public double[] getDemands() {
        return demands.clone();
    }

    public double getTotalDemand() {
        return totalDemand;
    }

    @Override
    public String toString() {
        return "Scenario(" + id + ")";
    }
}
