package floc.dao;

import floc.registry.ModelData;
import floc.registry.ModelDataBuilder;
import floc.utility.Constants;
import floc.utility.OptException;
import floc.utility.Util;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class InstanceDAO {
    /**
     * Used to read facility location instances from YAML (or JSON) files with the keys facilities, customers,
     * variableCosts, scenarios and the optional eligibleCustomers. An empty path reads the instance from
     * standard input.
     */
    private final static Logger logger = LogManager.getLogger(InstanceDAO.class);
    private final String filePath;
    private final ModelData modelData;

    public InstanceDAO(String filePath) throws OptException {
        this.filePath = filePath.isEmpty() ? Constants.STANDARD_STREAM : filePath;
        Object document = filePath.isEmpty()
            ? Util.readFromYaml(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                this.filePath)
            : Util.readFromYaml(filePath);
        Map<String, Object> root = asMap(document, "document root");

        ModelDataBuilder builder = new ModelDataBuilder();
        readFacilities(root, builder);
        readCustomers(root, builder);
        readVariableCosts(root, builder);
        readScenarios(root, builder);
        readEligibility(root, builder);
        modelData = builder.build();
        logger.info("read instance " + this.filePath + ": " + modelData.getNumFacilities() + " facilities, "
            + modelData.getNumCustomers() + " customers, " + modelData.getNumScenarios() + " scenarios");
    }

    public ModelData getModelData() {
        return modelData;
    }

    private void readFacilities(Map<String, Object> root, ModelDataBuilder builder) throws OptException {
        for (Object item : asList(getRequired(root, "facilities"), "facilities")) {
            Map<String, Object> facility = asMap(item, "facility");
            builder.addFacility(asString(getRequired(facility, "id")),
                asDouble(getRequired(facility, "fixedCost"), "fixedCost"),
                asDouble(getRequired(facility, "capacity"), "capacity"));
        }
    }

    private void readCustomers(Map<String, Object> root, ModelDataBuilder builder) throws OptException {
        for (Object item : asList(getRequired(root, "customers"), "customers"))
            builder.addCustomer(asString(item));
    }

    private void readVariableCosts(Map<String, Object> root, ModelDataBuilder builder) throws OptException {
        Map<String, Object> costs = asMap(getRequired(root, "variableCosts"), "variableCosts");
        for (Map.Entry<String, Object> facilityEntry : costs.entrySet()) {
            Map<String, Object> row = asMap(facilityEntry.getValue(), "variableCosts of " + facilityEntry.getKey());
            for (Map.Entry<String, Object> entry : row.entrySet())
                builder.setVariableCost(facilityEntry.getKey(), entry.getKey(),
                    asDouble(entry.getValue(), "variable cost"));
        }
    }

    private void readScenarios(Map<String, Object> root, ModelDataBuilder builder) throws OptException {
        for (Object item : asList(getRequired(root, "scenarios"), "scenarios")) {
            Map<String, Object> scenario = asMap(item, "scenario");
            Map<String, Object> demand = asMap(getRequired(scenario, "demand"), "demand");
            LinkedHashMap<String, Double> demands = new LinkedHashMap<>();
            for (Map.Entry<String, Object> entry : demand.entrySet())
                demands.put(entry.getKey(), asDouble(entry.getValue(), "demand"));

            builder.addScenario(asString(getRequired(scenario, "id")),
                asDouble(getRequired(scenario, "probability"), "probability"), demands);
        }
    }

    private void readEligibility(Map<String, Object> root, ModelDataBuilder builder) throws OptException {
        Object value = root.get("eligibleCustomers");
        if (value == null)
            return;

        Map<String, Object> eligibility = asMap(value, "eligibleCustomers");
        for (Map.Entry<String, Object> entry : eligibility.entrySet()) {
            ArrayList<String> customers = new ArrayList<>();
            for (Object customer : asList(entry.getValue(), "eligibleCustomers of " + entry.getKey()))
                customers.add(asString(customer));
            builder.restrictEligibility(entry.getKey(), customers);
        }
    }

    private Object getRequired(Map<String, Object> map, String key) throws OptException {
        Object value = map.get(key);
        if (value == null) {
            logger.error("missing key " + key + " in " + filePath);
            throw new OptException("missing key " + key + " in instance file");
        }
        return value;
    }

    /**
     * Converts a YAML mapping to a map with string keys; YAML may parse ids such as 1 as integers.
     */
    private Map<String, Object> asMap(Object value, String what) throws OptException {
        if (!(value instanceof Map)) {
            logger.error(what + " in " + filePath + " is not a mapping");
            throw new OptException(what + " must be a mapping");
        }
        LinkedHashMap<String, Object> map = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet())
            map.put(asString(entry.getKey()), entry.getValue());
        return map;
    }

    private List<?> asList(Object value, String what) throws OptException {
        if (!(value instanceof List)) {
            logger.error(what + " in " + filePath + " is not a list");
            throw new OptException(what + " must be a list");
        }
        return (List<?>) value;
    }

    private double asDouble(Object value, String what) throws OptException {
        if (!(value instanceof Number)) {
            logger.error(what + " value " + value + " in " + filePath + " is not a number");
            throw new OptException(what + " must be a number");
        }
        return ((Number) value).doubleValue();
    }

    private static String asString(Object value) {
        return String.valueOf(value);
    }
}
