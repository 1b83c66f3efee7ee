package NfseBot.model;

import java.nio.file.Path;

/**
 * Outcome for one input file: either an invoice or the single reason it failed.
 * Exactly one of {@code invoice} and {@code failure} is non-null.
 */
public record ProcessingResult(Path sourcePath, Invoice invoice, ExtractionFailure failure) {

    public ProcessingResult {
        if (sourcePath == null) {
            throw new IllegalArgumentException("source path is required");
        }
        if ((invoice == null) == (failure == null)) {
            throw new IllegalArgumentException("result must carry either an invoice or a failure");
        }
    }

    public static ProcessingResult success(Path sourcePath, Invoice invoice) {
        return new ProcessingResult(sourcePath, invoice, null);
    }

    public static ProcessingResult failure(Path sourcePath, ExtractionFailure failure) {
        return new ProcessingResult(sourcePath, null, failure);
    }

    public boolean isSuccess() {
        return invoice != null;
    }

    public String getFileName() {
        Path name = sourcePath.getFileName();
        return name != null ? name.toString() : sourcePath.toString();
    }
}
