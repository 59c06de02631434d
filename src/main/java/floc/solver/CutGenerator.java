package floc.solver;

import floc.domain.Facility;
import floc.domain.Scenario;
import floc.registry.ModelData;
import floc.utility.Enums;

/**
 * Turns subproblem duals into Benders cuts. With demand duals u and capacity duals v of scenario s, the cut
 * expression is sum_j u[j] * demand[j][s] + sum_i v[i] * capacity[i] * open[i].
 */
public class CutGenerator {
    private final ModelData modelData;

    public CutGenerator(ModelData modelData) {
        this.modelData = modelData;
    }

    public Cut generateCut(Scenario scenario, SubproblemResult result, int iteration) {
        final Enums.CutType type = result.isFeasible()
            ? Enums.CutType.OPTIMALITY
            : Enums.CutType.FEASIBILITY;
        return buildCut(type, scenario, result.getDualsDemand(), result.getDualsCapacity(), iteration);
    }

    public Cut buildCut(Enums.CutType type, Scenario scenario, double[] dualsDemand, double[] dualsCapacity,
                        int iteration) {
        double constant = 0.0;
        for (int j = 0; j < dualsDemand.length; ++j)
            constant += dualsDemand[j] * scenario.getDemand(j);

        double[] coefficients = new double[modelData.getNumFacilities()];
        for (Facility facility : modelData.getFacilities()) {
            final int i = facility.getIndex();
            coefficients[i] = dualsCapacity[i] * facility.getCapacity();
        }
        return new Cut(type, scenario.getIndex(), constant, coefficients, iteration);
    }
}
