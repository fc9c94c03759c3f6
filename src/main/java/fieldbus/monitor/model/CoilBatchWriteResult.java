package fieldbus.monitor.model;

import java.util.List;

public class CoilBatchWriteResult {
    private final List<CoilWriteResult> results;

    public CoilBatchWriteResult(List<CoilWriteResult> results) {
        this.results = List.copyOf(results);
    }

    /**
     * @return true, если применилась хотя бы одна катушка
     */
    public boolean isSuccess() {
        return results.stream().anyMatch(CoilWriteResult::isSuccess);
    }

    public boolean isAllSuccess() {
        return !results.isEmpty() && results.stream().allMatch(CoilWriteResult::isSuccess);
    }

    public List<CoilWriteResult> getResults() {
        return results;
    }
}
