package NfseBot.model;

/**
 * Thrown inside the processing of a single file; carries the typed failure that ends up in its
 * {@link ProcessingResult}.
 */
public class NfseExtractionException extends Exception {

    private final ExtractionFailure failure;

    public NfseExtractionException(ExtractionFailure failure) {
        super(failure.describe());
        this.failure = failure;
    }

    public NfseExtractionException(ExtractionFailure failure, Throwable cause) {
        super(failure.describe(), cause);
        this.failure = failure;
    }

    public ExtractionFailure getFailure() {
        return failure;
    }
}
