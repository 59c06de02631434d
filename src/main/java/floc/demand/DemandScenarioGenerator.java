package floc.demand;

import floc.domain.Customer;
import floc.domain.Scenario;
import floc.registry.ModelData;
import floc.utility.Enums;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

public class DemandScenarioGenerator {
    /**
     * DemandScenarioGenerator can be used to replace the scenarios of an instance with equiprobable samples
     * drawn around the expected demand of each customer.
     */
    private final static Logger logger = LogManager.getLogger(DemandScenarioGenerator.class);
    private final ModelData modelData;
    private final Enums.DistributionType distributionType;
    private final double coefficientOfVariation;
    private final long seed;

    public DemandScenarioGenerator(ModelData modelData, Enums.DistributionType distributionType,
                                   double coefficientOfVariation, long seed) {
        this.modelData = modelData;
        this.distributionType = distributionType;
        this.coefficientOfVariation = coefficientOfVariation;
        this.seed = seed;
    }

    public List<Scenario> generateScenarios(int numSamples) {
        RandomGenerator rng = new MersenneTwister(seed);
        List<Customer> customers = modelData.getCustomers();
        double[] expectedDemands = getExpectedDemands();

        DemandSampler[] samplers = new DemandSampler[customers.size()];
        for (Customer customer : customers) {
            final int j = customer.getIndex();
            samplers[j] = new DemandSampler(rng, distributionType, expectedDemands[j], coefficientOfVariation);
        }

        final double probability = 1.0 / numSamples;
        ArrayList<Scenario> scenarios = new ArrayList<>();
        for (int k = 0; k < numSamples; ++k) {
            double[] demands = new double[customers.size()];
            for (int j = 0; j < demands.length; ++j)
                demands[j] = samplers[j].sample();
            scenarios.add(new Scenario("sample_" + (k + 1), k, probability, demands));
        }

        logger.info("generated " + numSamples + " " + distributionType + " demand scenarios with seed " + seed);
        return scenarios;
    }

    /**
     * @return a copy of the instance whose scenarios are replaced by generated samples.
     */
    public ModelData generateModelData(int numSamples) {
        return modelData.withScenarios(generateScenarios(numSamples));
    }

    private double[] getExpectedDemands() {
        double[] expectedDemands = new double[modelData.getNumCustomers()];
        for (Scenario scenario : modelData.getScenarios())
            for (int j = 0; j < expectedDemands.length; ++j)
                expectedDemands[j] += scenario.getProbability() * scenario.getDemand(j);
        return expectedDemands;
    }
}
