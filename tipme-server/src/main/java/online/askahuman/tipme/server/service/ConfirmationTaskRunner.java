package online.askahuman.tipme.server.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs payment-confirmation waits detached from the HTTP request that started them.
 *
 * <p>Each task owns its deadline; the runner only guarantees that whatever a task throws is
 * logged instead of disappearing into the executor.</p>
 */
public class ConfirmationTaskRunner {

    private static final Logger log = LoggerFactory.getLogger(ConfirmationTaskRunner.class);

    private final Executor executor;

    public ConfirmationTaskRunner(Executor executor) {
        this.executor = executor;
    }

    /**
     * Unbounded pool of daemon threads named {@code tipme-confirm-N}.
     */
    public static ConfirmationTaskRunner cachedDaemonPool() {
        AtomicInteger counter = new AtomicInteger();
        return new ConfirmationTaskRunner(Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "tipme-confirm-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }));
    }

    /**
     * @param name label used in log lines, e.g. {@code "funding pay_id=..."}
     * @param task the confirmation wait and its follow-up
     */
    public void submit(String name, Runnable task) {
        executor.execute(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Confirmation task [{}] failed", name, e);
            } catch (Error e) {
                log.error("Confirmation task [{}] died", name, e);
                throw e;
            }
        });
    }

    /** Interrupts running waits; they treat interruption as cancellation. */
    public void shutdown() {
        if (executor instanceof ExecutorService) {
            ((ExecutorService) executor).shutdownNow();
        }
    }
}
