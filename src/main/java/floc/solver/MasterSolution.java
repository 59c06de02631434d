package floc.solver;

public class MasterSolution {
    private final boolean[] openFacilities;
    private final double[] thetaValues;
    private final double objValue;
    private final double bound; // proven lower bound of the relaxed master, a lower bound of the problem.

    MasterSolution(boolean[] openFacilities, double[] thetaValues, double objValue, double bound) {
        this.openFacilities = openFacilities;
        this.thetaValues = thetaValues;
        this.objValue = objValue;
        this.bound = bound;
    }

    public boolean[] getOpenFacilities() {
        return openFacilities.clone();
    }

    public double[] getThetaValues() {
        return thetaValues.clone();
    }

    public double getObjValue() {
        return objValue;
    }

    public double getBound() {
        return bound;
    }
}
