package floc.lp;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class LpConstraint {
    /**
     * Ranged linear row lb <= sum(coef * var) <= ub. Use infinite bounds for one-sided rows.
     */
    private final int index;
    private final String name;
    private final double lowerBound;
    private final double upperBound;
    private final LinkedHashMap<LpVariable, Double> terms;

    LpConstraint(int index, String name, double lowerBound, double upperBound) {
        this.index = index;
        this.name = name;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        terms = new LinkedHashMap<>();
    }

    /**
     * Adds coef to the coefficient of the variable in this row.
     */
    public LpConstraint addTerm(LpVariable variable, double coef) {
        terms.merge(variable, coef, Double::sum);
        return this;
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

    public Map<LpVariable, Double> getTerms() {
        return Collections.unmodifiableMap(terms);
    }

    @Override
    public String toString() {
        return name;
    }
}
