package floc.domain;

public class Customer {
    private final String id;
    private final int index;

    public Customer(String id, int index) {
        this.id = id;
        this.index = index;
    }

    public String getId() {
        return id;
    }

    public int getIndex() {
        return index;
    }

    @Override
    public String toString() {
        return "Customer(" + id + ")";
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
        return id.equals(((Customer) obj).id);
    }
}
