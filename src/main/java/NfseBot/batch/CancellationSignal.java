package NfseBot.batch;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation flag shared between the caller (e.g. a "Cancelar" button) and a running batch.
 */
public class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
