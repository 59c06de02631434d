package floc.output;

import floc.domain.Customer;
import floc.domain.Facility;
import floc.domain.Scenario;
import floc.registry.ModelData;
import floc.registry.Parameters;
import floc.solver.BendersResult;
import floc.utility.Constants;
import floc.utility.OptException;
import floc.utility.Util;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.TreeMap;

public class OutputManager {
    /**
     * OutputManager objects collect KPIs and the final solution of a run and write them as a YAML document.
     */
    private final static Logger logger = LogManager.getLogger(OutputManager.class);
    private final ModelData modelData;
    private final TreeMap<String, Object> kpis;
    private LocationSolution solution;

    public OutputManager(ModelData modelData) {
        this.modelData = modelData;
        kpis = new TreeMap<>();
    }

    public void addKpi(String key, Object value) {
        kpis.put(key, value);
    }

    public void setSolution(LocationSolution solution) {
        this.solution = solution;
        if (solution != null) {
            addKpi("solution", solution.getName());
            addKpi("objective", solution.getExpectedCost());
            addKpi("fixed cost", solution.getFixedCost());
        }
    }

    public void addBendersResult(BendersResult result) {
        addKpi("state", result.getState().name());
        addKpi("lower bound", result.getLowerBound());
        addKpi("upper bound", result.getUpperBound());
        addKpi("gap", result.getGap());
        addKpi("percent gap", result.getPercentGap());
        addKpi("iterations", result.getIterations());
        addKpi("optimality cuts", result.getNumOptimalityCuts());
        addKpi("feasibility cuts", result.getNumFeasibilityCuts());
        addKpi("unstable cuts", result.getNumUnstableCuts());
        addKpi("solution time", result.getSolutionTime());
        setSolution(result.getSolution());
    }

    public TreeMap<String, Object> buildOutput() {
        TreeMap<String, Object> output = new TreeMap<>(kpis);
        output.put("model", Parameters.getModel().name().toLowerCase());
        if (solution != null) {
            output.put("open facilities", getOpenFacilityIds());
            output.put("scenario costs", getScenarioCosts());
            output.put("allocations", getAllocations());
        }

        TreeMap<String, Object> document = new TreeMap<>();
        document.put("input", getInputKpis());
        document.put("output", output);
        document.put("parameters", new TreeMap<>(Parameters.asMap()));
        return document;
    }

    /**
     * Writes the result document to the output folder, or to standard output if the output name is empty.
     *
     * @return path of the written file, {@link Constants#STANDARD_STREAM} for standard output.
     */
    public String writeOutput() throws OptException {
        if (Parameters.getOutputName().isEmpty()) {
            Util.writeToYaml(buildOutput(), new OutputStreamWriter(System.out, StandardCharsets.UTF_8),
                "standard output");
            logger.info("wrote solution to standard output");
            return Constants.STANDARD_STREAM;
        }

        File folder = new File(Parameters.getOutputPath());
        if (!folder.isDirectory() && !folder.mkdirs()) {
            logger.error("unable to create output folder " + folder.getAbsolutePath());
            throw new OptException("unable to create output folder " + Parameters.getOutputPath());
        }

        final String filePath = new File(folder, Parameters.getOutputName()).getPath();
        Util.writeToYaml(buildOutput(), filePath);
        logger.info("wrote solution to " + filePath);
        return filePath;
    }

    private ArrayList<String> getOpenFacilityIds() {
        ArrayList<String> ids = new ArrayList<>();
        for (Facility facility : modelData.getFacilities())
            if (solution.isOpen(facility.getIndex()))
                ids.add(facility.getId());
        return ids;
    }

    private LinkedHashMap<String, Double> getScenarioCosts() {
        LinkedHashMap<String, Double> costs = new LinkedHashMap<>();
        for (Scenario scenario : modelData.getScenarios())
            costs.put(scenario.getId(), solution.getScenarioCost(scenario.getIndex()));
        return costs;
    }

    /**
     * @return per scenario, the rows {facility, customer, quantity} of arcs with positive flow.
     */
    private LinkedHashMap<String, ArrayList<LinkedHashMap<String, Object>>> getAllocations() {
        LinkedHashMap<String, ArrayList<LinkedHashMap<String, Object>>> allocations = new LinkedHashMap<>();
        for (Scenario scenario : modelData.getScenarios()) {
            ArrayList<LinkedHashMap<String, Object>> rows = new ArrayList<>();
            for (Facility facility : modelData.getFacilities()) {
                for (Customer customer : modelData.getCustomers()) {
                    final double quantity = solution.getAllocation(scenario.getIndex(), facility.getIndex(),
                        customer.getIndex());
                    if (quantity <= Constants.EPS)
                        continue;
                    LinkedHashMap<String, Object> row = new LinkedHashMap<>();
                    row.put("facility", facility.getId());
                    row.put("customer", customer.getId());
                    row.put("quantity", quantity);
                    rows.add(row);
                }
            }
            allocations.put(scenario.getId(), rows);
        }
        return allocations;
    }

    private TreeMap<String, Object> getInputKpis() {
        TreeMap<String, Object> inputKpis = new TreeMap<>();
        final String instancePath = Parameters.getInstancePath();
        inputKpis.put("instance path", instancePath.isEmpty() ? Constants.STANDARD_STREAM : instancePath);
        inputKpis.put("number of facilities", modelData.getNumFacilities());
        inputKpis.put("number of customers", modelData.getNumCustomers());
        inputKpis.put("number of scenarios", modelData.getNumScenarios());
        return inputKpis;
    }
}
