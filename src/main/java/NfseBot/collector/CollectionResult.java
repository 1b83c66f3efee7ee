package NfseBot.collector;

import java.nio.file.Path;
import java.util.List;

/**
 * Ordered, de-duplicated XML files found for a selection, plus directories that could not be read.
 */
public record CollectionResult(List<Path> files, List<CollectionDiagnostic> diagnostics) {

    public CollectionResult {
        files = List.copyOf(files);
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }
}
