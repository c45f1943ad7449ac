package im.arun.scenebridge.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker threads that classify pages in parallel. One pool is shared by every import run
 * in the process; each page walk is CPU bound, so the pool holds one daemon thread per
 * processor, at most 16.
 */
public final class ClassificationPool {
    private static final Logger logger = LoggerFactory.getLogger(ClassificationPool.class);
    private static final int MAX_WORKERS = 16;
    private static final Object LOCK = new Object();

    private static volatile ExecutorService workers;

    private ClassificationPool() {}

    public static ExecutorService workers() {
        ExecutorService current = workers;
        if (current != null) {
            return current;
        }
        synchronized (LOCK) {
            if (workers == null) {
                int size = Math.min(Runtime.getRuntime().availableProcessors(), MAX_WORKERS);
                AtomicInteger pageWorker = new AtomicInteger();
                workers = Executors.newFixedThreadPool(size, task -> {
                    Thread thread = new Thread(task, "page-classifier-" + pageWorker.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                });
                logger.debug("Started {} page classifier threads", size);
            }
            return workers;
        }
    }

    /**
     * Stops the pool once the last import has finished; a later import starts a fresh one.
     */
    public static void shutdown() {
        synchronized (LOCK) {
            if (workers != null) {
                workers.shutdown();
                workers = null;
            }
        }
    }
}
