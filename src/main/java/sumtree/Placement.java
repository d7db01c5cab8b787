package sumtree;

/**
 * Position of one entry in the cumulative weight space: the range
 * [offset, offset + weight).
 */
public final class Placement {
    private final long weight;
    private final long offset;

    public Placement(final long weight, final long offset) {
        this.weight = weight;
        this.offset = offset;
    }

    public long weight() {
        return weight;
    }

    // sum of the weights of all entries with smaller keys
    public long offset() {
        return offset;
    }

    // exclusive end of the range
    public long end() {
        return offset + weight;
    }

    public boolean contains(final long point) {
        return point >= offset && point < offset + weight;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Placement)) return false;
        Placement other = (Placement) o;
        return weight == other.weight && offset == other.offset;
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(weight) + Long.hashCode(offset);
    }

    @Override
    public String toString() {
        return String.format("Placement[weight=%d, offset=%d]", weight, offset);
    }
}
