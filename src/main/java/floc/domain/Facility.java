package floc.domain;

public class Facility {
    /**
     * Candidate facility that can be opened in the first stage.
     */
    private final String id;
    private final int index;
    private final double fixedCost;
    private final double capacity;

    public Facility(String id, int index, double fixedCost, double capacity) {
        this.id = id;
        this.index = index;
        this.fixedCost = fixedCost;
        this.capacity = capacity;
    }

    public String getId() {
        return id;
    }

    public int getIndex() {
        return index;
    }

    public double getFixedCost() {
        return fixedCost;
    }

    public double getCapacity() {
        return capacity;
    }

    @Override
    public String toString() {
        return "Facility(" + id + ")";
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;
        return id.equals(((Facility) obj).id);
    }
}
