package NfseBot.collector;

import java.nio.file.Path;

/**
 * A directory that could not be listed during collection. Reported separately from per-file failures.
 */
public record CollectionDiagnostic(Path path, String message) {

    @Override
    public String toString() {
        return path + ": " + message;
    }
}
