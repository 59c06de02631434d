package floc.model;

import floc.domain.Customer;
import floc.domain.Facility;
import floc.domain.Scenario;
import floc.lp.LinearProgram;
import floc.lp.LpConstraint;
import floc.lp.LpVariable;
import floc.lp.SolveOutcome;
import floc.registry.ModelData;

import java.util.List;

public class SubModelBuilder {
    /**
     * Builds the distribution rows of one scenario. The same rows serve three programs: the recourse LP at a
     * fixed open decision, its phase-one variant with demand shortfall columns, and the scenario block of the
     * deterministic equivalent where capacities are linked to the master's open columns.
     */
    private final String prefix;
    private final ModelData modelData;
    private final Scenario scenario;
    private final LinearProgram program;
    private final int numFacilities;
    private final int numCustomers;

    private LpVariable[][] production; // production[i][j] = units shipped from facility i to customer j.
    private LpVariable[] shortfall; // shortfall[j] = unmet demand of customer j (phase one only).
    private LpConstraint[] demandConstraints;
    private LpConstraint[] capacityConstraints;

    public SubModelBuilder(ModelData modelData, Scenario scenario, LinearProgram program) {
        this.prefix = "s" + scenario.getIndex() + "_";
        this.modelData = modelData;
        this.scenario = scenario;
        this.program = program;
        numFacilities = modelData.getNumFacilities();
        numCustomers = modelData.getNumCustomers();
    }

    /**
     * Adds production columns for eligible arcs.
     *
     * @param costScale multiplier of the unit shipping costs in the objective: 1 for the recourse LP, the
     *                  scenario probability in the deterministic equivalent, 0 in the phase-one LP.
     */
    public void buildProductionVariables(double costScale) {
        production = new LpVariable[numFacilities][numCustomers];
        for (Facility facility : modelData.getFacilities()) {
            final int i = facility.getIndex();
            for (Customer customer : modelData.getCustomers()) {
                final int j = customer.getIndex();
                if (!modelData.isEligible(i, j))
                    continue;
                LpVariable var = program.addContinuousVariable(
                    prefix + "x_" + facility.getId() + "_" + customer.getId(), 0.0, Double.POSITIVE_INFINITY);
                if (costScale != 0.0)
                    program.setObjectiveCoef(var, costScale * modelData.getVariableCost(i, j));
                production[i][j] = var;
            }
        }
    }

    /**
     * Adds one covering row per customer. With shortfall columns (cost 1 each) the rows can always be met,
     * which turns the program into the phase-one problem used to certify infeasibility.
     */
    public void addDemandConstraints(boolean withShortfall) {
        List<Customer> customers = modelData.getCustomers();
        demandConstraints = new LpConstraint[numCustomers];
        if (withShortfall)
            shortfall = new LpVariable[numCustomers];

        for (Customer customer : customers) {
            final int j = customer.getIndex();
            LpConstraint row = program.addGreaterOrEqual(prefix + "demand_" + customer.getId(),
                scenario.getDemand(j));
            for (int i = 0; i < numFacilities; ++i)
                if (production[i][j] != null)
                    row.addTerm(production[i][j], 1.0);

            if (withShortfall) {
                shortfall[j] = program.addContinuousVariable(prefix + "shortfall_" + customer.getId(), 0.0,
                    Double.POSITIVE_INFINITY);
                program.setObjectiveCoef(shortfall[j], 1.0);
                row.addTerm(shortfall[j], 1.0);
            }
            demandConstraints[j] = row;
        }
    }

    /**
     * Adds capacity rows with the open decision fixed: closed facilities get a zero right-hand side.
     */
    public void addCapacityConstraints(boolean[] openFacilities) {
        capacityConstraints = new LpConstraint[numFacilities];
        for (Facility facility : modelData.getFacilities()) {
            final int i = facility.getIndex();
            final double rhs = openFacilities[i] ? facility.getCapacity() : 0.0;
            capacityConstraints[i] = buildCapacityRow(facility, rhs);
        }
    }

    /**
     * Adds capacity rows linked to the open columns of the deterministic equivalent:
     * sum_j production[i][j] - capacity_i * open[i] <= 0.
     */
    public void linkCapacityConstraints(LpVariable[] open) {
        capacityConstraints = new LpConstraint[numFacilities];
        for (Facility facility : modelData.getFacilities()) {
            final int i = facility.getIndex();
            LpConstraint row = buildCapacityRow(facility, 0.0);
            row.addTerm(open[i], -facility.getCapacity());
            capacityConstraints[i] = row;
        }
    }

    private LpConstraint buildCapacityRow(Facility facility, double rhs) {
        final int i = facility.getIndex();
        LpConstraint row = program.addLessOrEqual(prefix + "capacity_" + facility.getId(), rhs);
        for (int j = 0; j < numCustomers; ++j)
            if (production[i][j] != null)
                row.addTerm(production[i][j], 1.0);
        return row;
    }

    public double[] getDualsDemand(SolveOutcome outcome) {
        double[] duals = new double[numCustomers];
        for (int j = 0; j < numCustomers; ++j)
            duals[j] = outcome.getDual(demandConstraints[j]);
        return duals;
    }

    public double[] getDualsCapacity(SolveOutcome outcome) {
        double[] duals = new double[numFacilities];
        for (int i = 0; i < numFacilities; ++i)
            duals[i] = outcome.getDual(capacityConstraints[i]);
        return duals;
    }

    public double[][] getProductionValues(SolveOutcome outcome) {
        double[][] values = new double[numFacilities][numCustomers];
        for (int i = 0; i < numFacilities; ++i)
            for (int j = 0; j < numCustomers; ++j)
                if (production[i][j] != null)
                    values[i][j] = Math.max(0.0, outcome.getValue(production[i][j]));
        return values;
    }

    /**
     * @return unit-cost weighted sum of the production values, i.e. the unscaled recourse cost.
     */
    public double getShippingCost(SolveOutcome outcome) {
        double cost = 0.0;
        double[][] values = getProductionValues(outcome);
        for (int i = 0; i < numFacilities; ++i)
            for (int j = 0; j < numCustomers; ++j)
                cost += values[i][j] * modelData.getVariableCost(i, j);
        return cost;
    }
}
