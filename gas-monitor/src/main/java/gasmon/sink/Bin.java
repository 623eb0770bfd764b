package gasmon.sink;

import gasmon.Average;

import java.util.ArrayList;
import java.util.List;

/**
 * A half-open time interval {@code [start, end)} collecting the values of the events that fall in it.
 */
public final class Bin {

    private final long start;
    private final long end;
    private final List<Double> values = new ArrayList<>();

    Bin(long start, long end) {
        if (end < start) {
            throw new IllegalArgumentException("Bin end (" + end + ") cannot be before its start (" + start + ").");
        }
        this.start = start;
        this.end = end;
    }

    public long getStart() {
        return start;
    }

    public long getEnd() {
        return end;
    }

    public List<Double> getValues() {
        return List.copyOf(values);
    }

    boolean contains(long timestamp) {
        return timestamp >= start && timestamp < end;
    }

    boolean isEmptyInterval() {
        return start == end;
    }

    void add(double value) {
        values.add(value);
    }

    /**
     * Finalises this bin. A bin without values averages to 0.
     */
    Average toAverage() {
        double average = values.stream()
                .mapToDouble(Double::doubleValue)
                .average()
                .orElse(0.0);
        return new Average(start, end, average);
    }

    @Override
    public String toString() {
        return "Bin[" + start + ", " + end + ") with " + values.size() + " values";
    }
}
