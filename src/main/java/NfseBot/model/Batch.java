package NfseBot.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Results of one batch run in input order.
 * When {@code cancelled} is true the list only holds the files that completed before cancellation.
 */
public record Batch(List<ProcessingResult> results, boolean cancelled) {

    public Batch {
        results = List.copyOf(results);
    }

    public int size() {
        return results.size();
    }

    public long successCount() {
        return results.stream().filter(ProcessingResult::isSuccess).count();
    }

    public long failureCount() {
        return results.size() - successCount();
    }

    public List<ProcessingResult> failures() {
        return results.stream().filter(r -> !r.isSuccess()).toList();
    }

    /**
     * Sum of {@code totalServiceValue} over the successful results.
     */
    public BigDecimal totalServiceValue() {
        return results.stream()
                .filter(ProcessingResult::isSuccess)
                .map(r -> r.invoice().totalServiceValue())
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
