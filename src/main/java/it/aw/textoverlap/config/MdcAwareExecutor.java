package it.aw.textoverlap.config;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pool fisso di worker che riporta nel thread del worker il contesto MDC
 * del thread chiamante (runId, metricVersion), così i log dei passi restano
 * associati alla run.
 */
public class MdcAwareExecutor implements Executor {

    private final ExecutorService delegate;

    public MdcAwareExecutor(int threads, String namePrefix) {
        if (threads < 1) throw new IllegalArgumentException("threads deve essere >= 1");
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, namePrefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        this.delegate = Executors.newFixedThreadPool(threads, factory);
    }

    @Override
    public void execute(Runnable command) {
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();

        delegate.execute(() -> {
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            }
            try {
                command.run();
            } finally {
                MDC.clear();
            }
        });
    }

    /** Chiamato da Spring allo shutdown del contesto. */
    public void shutdown() throws InterruptedException {
        delegate.shutdownNow();
        delegate.awaitTermination(5, TimeUnit.SECONDS);
    }
}
