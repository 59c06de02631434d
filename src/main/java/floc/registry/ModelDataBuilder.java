package floc.registry;

import floc.domain.Customer;
import floc.domain.Facility;
import floc.domain.Scenario;
import floc.utility.Constants;
import floc.utility.OptException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Collects instance data keyed by facility and customer ids, then validates it and assigns indices.
 * Variable costs and eligibility may be given in any order relative to facilities and customers.
 */
public class ModelDataBuilder {
    private final static Logger logger = LogManager.getLogger(ModelDataBuilder.class);

    private final LinkedHashMap<String, double[]> facilityData; // id -> {fixedCost, capacity}
    private final ArrayList<String> customerIds;
    private final ArrayList<String> scenarioIds;
    private final ArrayList<Double> probabilities;
    private final ArrayList<Map<String, Double>> scenarioDemands;
    private final HashMap<String, Double> arcCosts;
    private final HashMap<String, HashSet<String>> eligibleCustomers;
    private final ArrayList<String> duplicateFacilityIds;

    public ModelDataBuilder() {
        facilityData = new LinkedHashMap<>();
        customerIds = new ArrayList<>();
        scenarioIds = new ArrayList<>();
        probabilities = new ArrayList<>();
        scenarioDemands = new ArrayList<>();
        arcCosts = new HashMap<>();
        eligibleCustomers = new HashMap<>();
        duplicateFacilityIds = new ArrayList<>();
    }

    public ModelDataBuilder addFacility(String id, double fixedCost, double capacity) {
        if (facilityData.containsKey(id))
            duplicateFacilityIds.add(id);
        facilityData.put(id, new double[]{fixedCost, capacity});
        return this;
    }

    public ModelDataBuilder addCustomer(String id) {
        customerIds.add(id);
        return this;
    }

    public ModelDataBuilder addScenario(String id, double probability, Map<String, Double> demands) {
        scenarioIds.add(id);
        probabilities.add(probability);
        scenarioDemands.add(new HashMap<>(demands));
        return this;
    }

    public ModelDataBuilder setVariableCost(String facilityId, String customerId, double cost) {
        arcCosts.put(arcKey(facilityId, customerId), cost);
        return this;
    }

    /**
     * Sets the same unit cost on every facility-customer arc known so far.
     */
    public ModelDataBuilder setUniformVariableCost(double cost) {
        for (String facilityId : facilityData.keySet())
            for (String customerId : customerIds)
                setVariableCost(facilityId, customerId, cost);
        return this;
    }

    /**
     * Restricts the facility to serve only the given customers. Facilities without a restriction serve
     * every customer.
     */
    public ModelDataBuilder restrictEligibility(String facilityId, Iterable<String> customers) {
        HashSet<String> allowed = new HashSet<>();
        for (String customerId : customers)
            allowed.add(customerId);
        eligibleCustomers.put(facilityId, allowed);
        return this;
    }

    public ModelData build() throws OptException {
        if (facilityData.isEmpty())
            throw invalid("instance has no facilities");
        if (customerIds.isEmpty())
            throw invalid("instance has no customers");
        if (scenarioIds.isEmpty())
            throw invalid("instance has no scenarios");

        ArrayList<Facility> facilities = buildFacilities();
        ArrayList<Customer> customers = buildCustomers();
        boolean[][] eligible = buildEligibility(facilities, customers);
        double[][] variableCosts = buildVariableCosts(facilities, customers, eligible);
        ArrayList<Scenario> scenarios = buildScenarios(customers);

        ModelData modelData = new ModelData(facilities, customers, scenarios, variableCosts, eligible);
        logger.info("built instance with " + facilities.size() + " facilities, " + customers.size()
            + " customers and " + scenarios.size() + " scenarios");
        return modelData;
    }

    private ArrayList<Facility> buildFacilities() throws OptException {
        if (!duplicateFacilityIds.isEmpty())
            throw invalid("duplicate facility id " + duplicateFacilityIds.get(0));

        ArrayList<Facility> facilities = new ArrayList<>();
        for (Map.Entry<String, double[]> entry : facilityData.entrySet()) {
            final double fixedCost = entry.getValue()[0];
            final double capacity = entry.getValue()[1];
            if (!isNonNegative(fixedCost))
                throw invalid("facility " + entry.getKey() + " has invalid fixed cost " + fixedCost);
            if (!isNonNegative(capacity))
                throw invalid("facility " + entry.getKey() + " has invalid capacity " + capacity);
            facilities.add(new Facility(entry.getKey(), facilities.size(), fixedCost, capacity));
        }
        return facilities;
    }

    private ArrayList<Customer> buildCustomers() throws OptException {
        HashSet<String> seen = new HashSet<>();
        ArrayList<Customer> customers = new ArrayList<>();
        for (String id : customerIds) {
            if (!seen.add(id))
                throw invalid("duplicate customer id " + id);
            customers.add(new Customer(id, customers.size()));
        }
        return customers;
    }

    private boolean[][] buildEligibility(ArrayList<Facility> facilities, ArrayList<Customer> customers)
        throws OptException {
        for (Map.Entry<String, HashSet<String>> entry : eligibleCustomers.entrySet()) {
            if (!facilityData.containsKey(entry.getKey()))
                throw invalid("eligibility given for unknown facility " + entry.getKey());
            for (String customerId : entry.getValue())
                if (!customerIds.contains(customerId))
                    throw invalid("facility " + entry.getKey() + " lists unknown customer " + customerId);
        }

        boolean[][] eligible = new boolean[facilities.size()][customers.size()];
        for (Facility facility : facilities) {
            HashSet<String> allowed = eligibleCustomers.get(facility.getId());
            for (Customer customer : customers)
                eligible[facility.getIndex()][customer.getIndex()] =
                    allowed == null || allowed.contains(customer.getId());
        }

        for (Customer customer : customers) {
            boolean served = false;
            for (Facility facility : facilities)
                served |= eligible[facility.getIndex()][customer.getIndex()];
            if (!served)
                throw invalid("customer " + customer.getId() + " cannot be served by any facility");
        }
        return eligible;
    }

    private double[][] buildVariableCosts(ArrayList<Facility> facilities, ArrayList<Customer> customers,
                                          boolean[][] eligible) throws OptException {
        double[][] variableCosts = new double[facilities.size()][customers.size()];
        for (Facility facility : facilities) {
            for (Customer customer : customers) {
                Double cost = arcCosts.get(arcKey(facility.getId(), customer.getId()));
                if (cost == null) {
                    if (eligible[facility.getIndex()][customer.getIndex()])
                        throw invalid("missing variable cost from " + facility.getId() + " to " + customer.getId());
                    cost = 0.0;
                }
                if (!isNonNegative(cost))
                    throw invalid("invalid variable cost " + cost + " from " + facility.getId()
                        + " to " + customer.getId());
                variableCosts[facility.getIndex()][customer.getIndex()] = cost;
            }
        }
        return variableCosts;
    }

    private ArrayList<Scenario> buildScenarios(ArrayList<Customer> customers) throws OptException {
        HashSet<String> seen = new HashSet<>();
        ArrayList<Scenario> scenarios = new ArrayList<>();
        double probabilitySum = 0.0;
        for (int s = 0; s < scenarioIds.size(); ++s) {
            final String id = scenarioIds.get(s);
            if (!seen.add(id))
                throw invalid("duplicate scenario id " + id);

            final double probability = probabilities.get(s);
            if (!(probability > 0.0 && probability <= 1.0))
                throw invalid("scenario " + id + " has probability " + probability + " outside (0,1]");
            probabilitySum += probability;

            Map<String, Double> demandMap = scenarioDemands.get(s);
            for (String customerId : demandMap.keySet())
                if (!customerIds.contains(customerId))
                    throw invalid("scenario " + id + " has demand for unknown customer " + customerId);

            double[] demands = new double[customers.size()];
            Arrays.fill(demands, 0.0);
            for (Customer customer : customers) {
                Double demand = demandMap.get(customer.getId());
                if (demand == null)
                    continue;
                if (!isNonNegative(demand))
                    throw invalid("scenario " + id + " has invalid demand " + demand + " for " + customer.getId());
                demands[customer.getIndex()] = demand;
            }
            scenarios.add(new Scenario(id, s, probability, demands));
        }

        if (Math.abs(probabilitySum - 1.0) > Constants.PROBABILITY_TOLERANCE)
            throw invalid("scenario probabilities sum to " + probabilitySum + " instead of 1");
        return scenarios;
    }

    private static boolean isNonNegative(double value) {
        return !Double.isNaN(value) && !Double.isInfinite(value) && value >= 0.0;
    }

    private static String arcKey(String facilityId, String customerId) {
        return facilityId + "\u0000" + customerId;
    }

    private static OptException invalid(String message) {
        logger.error("invalid instance: " + message);
        return new OptException("invalid instance: " + message);
    }
}
