package creational.demo;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Results of one {@link DemoRunner#runAll(DemoContext)} call.
 *
 * <p>The report is successful only if every {@link DemoResult} is.
 */
public final class DemoReport {

    private final List<DemoResult> results;

    public DemoReport(List<DemoResult> results) {
        this.results = List.copyOf(results);
    }

    /**
     * Returns true if all demos passed.
     */
    public boolean success() {
        return results.stream().allMatch(DemoResult::isOk);
    }

    /** Returns the individual results in run order. */
    public List<DemoResult> results() { return results; }

    /** Returns only the failed results. */
    public List<DemoResult> failures() {
        return results.stream().filter(r -> !r.isOk()).collect(Collectors.toList());
    }

    /**
     * Renders one line per demo followed by a summary line.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        for (DemoResult result : results) {
            sb.append(result).append(System.lineSeparator());
        }
        sb.append(String.format("%d demo(s), %d failed", results.size(), failures().size()));
        return sb.toString();
    }
}
