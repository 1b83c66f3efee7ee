package NfseBot.batch;

import NfseBot.model.Batch;
import NfseBot.model.ExtractionFailure;
import NfseBot.model.Invoice;
import NfseBot.model.NfseExtractionException;
import NfseBot.model.ProcessingResult;
import NfseBot.parser.InvoiceExtractor;
import NfseBot.xml.XmlNode;
import NfseBot.xml.XmlTreeParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

/*

Processamento em lote: leitura → árvore XML → extração, um resultado por arquivo.

Batch processing: read → XML tree → extraction, one result per file.
 * A failing file never affects the others.
 * Work items carry their input index and write into their own slot, so the returned order is
   the input order whatever order the workers finish in.

*/
@Service
public class BatchProcessor {

    private static final Logger log = LoggerFactory.getLogger(BatchProcessor.class);

    private final XmlTreeParser treeParser;
    private final InvoiceExtractor extractor;
    private final int parallelism;

    public BatchProcessor(XmlTreeParser treeParser,
                          InvoiceExtractor extractor,
                          @Value("${nfse.batch.parallelism:0}") int parallelism) {
        this.treeParser = treeParser;
        this.extractor = extractor;
        this.parallelism = parallelism > 0 ? parallelism : Runtime.getRuntime().availableProcessors();
    }

    public int getParallelism() {
        return parallelism;
    }

    public Batch processBatch(List<Path> paths) {
        return processBatch(paths, new CancellationSignal(), BatchProgressListener.NONE);
    }

    public Batch processBatch(List<Path> paths, CancellationSignal cancellation, BatchProgressListener listener) {
        int total = paths.size();
        int threads = Math.min(parallelism, total);
        log.info("Processing {} file(s) with {} worker(s)", total, Math.max(threads, 1));

        AtomicReferenceArray<ProcessingResult> slots = new AtomicReferenceArray<>(total);
        AtomicInteger completed = new AtomicInteger();

        if (threads <= 1) {
            for (int i = 0; i < total && !cancellation.isCancelled(); i++) {
                runItem(i, paths.get(i), slots, completed, cancellation, listener);
            }
        } else {
            runParallel(paths, threads, slots, completed, cancellation, listener);
        }

        List<ProcessingResult> ordered = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            ProcessingResult result = slots.get(i);
            if (result != null) {
                ordered.add(result);
            }
        }
        Batch batch = new Batch(ordered, cancellation.isCancelled());
        log.info("Batch finished: {} ok, {} failed{}", batch.successCount(), batch.failureCount(),
                batch.cancelled() ? " (cancelled after " + batch.size() + " of " + total + ")" : "");
        return batch;
    }

    private void runParallel(List<Path> paths, int threads, AtomicReferenceArray<ProcessingResult> slots,
                             AtomicInteger completed, CancellationSignal cancellation, BatchProgressListener listener) {
        ExecutorService pool = Executors.newFixedThreadPool(threads, workerThreadFactory());
        try {
            List<Future<?>> futures = new ArrayList<>(paths.size());
            for (int i = 0; i < paths.size(); i++) {
                final int index = i;
                final Path path = paths.get(i);
                futures.add(pool.submit(() -> {
                    if (!cancellation.isCancelled()) {
                        runItem(index, path, slots, completed, cancellation, listener);
                    }
                }));
            }
            for (int i = 0; i < futures.size(); i++) {
                try {
                    futures.get(i).get();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    cancellation.cancel();
                    log.info("Batch interrupted, cancelling remaining files");
                    break;
                } catch (ExecutionException e) {
                    // runItem converts every exception into a result; only errors get here
                    log.error("Worker failed on {}", paths.get(i), e.getCause());
                    ProcessingResult failed = ProcessingResult.failure(paths.get(i),
                            ExtractionFailure.malformedXml("unexpected error: " + e.getCause()));
                    if (!cancellation.isCancelled() && slots.compareAndSet(i, null, failed)) {
                        listener.onFileProcessed(completed.incrementAndGet(), slots.length(), failed);
                    }
                }
            }
        } finally {
            pool.shutdownNow();
        }
    }

    private void runItem(int index, Path path, AtomicReferenceArray<ProcessingResult> slots, AtomicInteger completed,
                         CancellationSignal cancellation, BatchProgressListener listener) {
        ProcessingResult result = processFile(path);
        if (cancellation.isCancelled()) {
            // cancelled while this file was in flight: its work is dropped
            return;
        }
        slots.set(index, result);
        listener.onFileProcessed(completed.incrementAndGet(), slots.length(), result);
    }

    /**
     * Runs the whole pipeline for one file. Never throws: every failure becomes a failed result.
     */
    public ProcessingResult processFile(Path path) {
        try {
            byte[] content = Files.readAllBytes(path);
            XmlNode root = treeParser.parse(content);
            Invoice invoice = extractor.extract(root);
            log.debug("{} → NFS-e {} ({})", path, invoice.number(), invoice.totalServiceValue());
            return ProcessingResult.success(path, invoice);
        } catch (NfseExtractionException e) {
            log.debug("{} → {}", path, e.getFailure().describe());
            return ProcessingResult.failure(path, e.getFailure());
        } catch (NoSuchFileException e) {
            return ProcessingResult.failure(path, ExtractionFailure.ioError("file not found"));
        } catch (AccessDeniedException e) {
            return ProcessingResult.failure(path, ExtractionFailure.ioError("permission denied"));
        } catch (IOException e) {
            return ProcessingResult.failure(path, ExtractionFailure.ioError(
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
        } catch (RuntimeException e) {
            log.warn("Unexpected error while processing {}", path, e);
            return ProcessingResult.failure(path, ExtractionFailure.malformedXml("unexpected error: " + e));
        } catch (StackOverflowError e) {
            log.warn("Stack exhausted while processing {}", path);
            return ProcessingResult.failure(path, ExtractionFailure.malformedXml("document nested too deeply"));
        }
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "nfse-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
