package floc.registry;

import floc.domain.Customer;
import floc.domain.Facility;
import floc.domain.Scenario;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;

public class ModelData {
    /**
     * Immutable problem instance: facilities, customers, demand scenarios, costs and eligibility.
     * Instances are created by {@link ModelDataBuilder}, which validates them.
     */
    private final List<Facility> facilities;
    private final List<Customer> customers;
    private final List<Scenario> scenarios;
    private final double[][] variableCosts; // variableCosts[i][j] is the unit cost from facility i to customer j.
    private final boolean[][] eligible; // eligible[i][j] is true if facility i may serve customer j.
    private final HashMap<String, Facility> idFacilityMap;
    private final HashMap<String, Customer> idCustomerMap;

    ModelData(ArrayList<Facility> facilities, ArrayList<Customer> customers, ArrayList<Scenario> scenarios,
              double[][] variableCosts, boolean[][] eligible) {
        this.facilities = Collections.unmodifiableList(facilities);
        this.customers = Collections.unmodifiableList(customers);
        this.scenarios = Collections.unmodifiableList(scenarios);
        this.variableCosts = variableCosts;
        this.eligible = eligible;

        idFacilityMap = new HashMap<>();
        for (Facility facility : facilities)
            idFacilityMap.put(facility.getId(), facility);

        idCustomerMap = new HashMap<>();
        for (Customer customer : customers)
            idCustomerMap.put(customer.getId(), customer);
    }

    public List<Facility> getFacilities() {
        return facilities;
    }

    public List<Customer> getCustomers() {
        return customers;
    }

    public List<Scenario> getScenarios() {
        return scenarios;
    }

    public int getNumFacilities() {
        return facilities.size();
    }

    public int getNumCustomers() {
        return customers.size();
    }

    public int getNumScenarios() {
        return scenarios.size();
    }

    public Facility getFacility(String id) {
        return idFacilityMap.get(id);
    }

    public Customer getCustomer(String id) {
        return idCustomerMap.get(id);
    }

    public double getVariableCost(int facilityIndex, int customerIndex) {
        return variableCosts[facilityIndex][customerIndex];
    }

    public boolean isEligible(int facilityIndex, int customerIndex) {
        return eligible[facilityIndex][customerIndex];
    }

    public boolean hasRestrictedEligibility() {
        for (boolean[] row : eligible)
            for (boolean e : row)
                if (!e)
                    return true;
        return false;
    }

    public double getTotalCapacity() {
        double total = 0.0;
        for (Facility facility : facilities)
            total += facility.getCapacity();
        return total;
    }

    /**
     * @return largest total demand over all scenarios, the right-hand side of the capacity sufficiency
     * constraint of the master problem.
     */
    public double getMaxTotalDemand() {
        double max = 0.0;
        for (Scenario scenario : scenarios)
            max = Math.max(max, scenario.getTotalDemand());
        return max;
    }

    public boolean hasSufficientCapacity() {
        return getTotalCapacity() >= getMaxTotalDemand();
    }

    /**
     * @param openFacilities open decision indexed by facility index.
     * @return sum of fixed costs of the open facilities.
     */
    public double getFixedCost(boolean[] openFacilities) {
        double cost = 0.0;
        for (Facility facility : facilities)
            if (openFacilities[facility.getIndex()])
                cost += facility.getFixedCost();
        return cost;
    }

    /**
     * Builds a copy of this instance with the given scenarios, used when demand scenarios are sampled
     * instead of read from the instance file.
     */
    public ModelData withScenarios(List<Scenario> newScenarios) {
        return new ModelData(new ArrayList<>(facilities), new ArrayList<>(customers),
            new ArrayList<>(newScenarios), variableCosts, eligible);
    }
}
