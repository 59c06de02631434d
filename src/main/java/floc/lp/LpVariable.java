package floc.lp;

public class LpVariable {
    private final int index;
    private final String name;
    private final double lowerBound;
    private final double upperBound;
    private final boolean integer;
    private double objectiveCoef;

    LpVariable(int index, String name, double lowerBound, double upperBound, boolean integer) {
        this.index = index;
        this.name = name;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        this.integer = integer;
        this.objectiveCoef = 0.0;
    }

    public int getIndex() {
        return index;
    }

    public String getName() {
        return name;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    public double getUpperBound() {
        return upperBound;
    }

    public boolean isInteger() {
        return integer;
    }

    public double getObjectiveCoef() {
        return objectiveCoef;
    }

    void setObjectiveCoef(double objectiveCoef) {
        this.objectiveCoef = objectiveCoef;
    }

    @Override
    public String toString() {
        return name;
    }
}
