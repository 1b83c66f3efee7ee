package NfseBot.batch;

import NfseBot.model.ProcessingResult;

/**
 * Called once per finished file. May be invoked from worker threads, in completion order.
 */
@FunctionalInterface
public interface BatchProgressListener {

    BatchProgressListener NONE = (completed, total, result) -> { };

    void onFileProcessed(int completed, int total, ProcessingResult result);
}
