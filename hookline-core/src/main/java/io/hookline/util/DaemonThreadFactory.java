package io.hookline.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates daemon threads named {@code prefix + n}, e.g. {@code hookline-delivery-1}.
 *
 * <p>Exceptions escaping a thread's task are logged at {@code SEVERE} instead of going
 * to {@code System.err}.
 */
public final class DaemonThreadFactory implements ThreadFactory {
    private static final Logger logger = Logger.getLogger(DaemonThreadFactory.class.getName());

    private static final Thread.UncaughtExceptionHandler LOG_UNCAUGHT = (thread, error) ->
        logger.log(Level.SEVERE, "Uncaught exception in " + thread.getName(), error);

    private final String prefix;
    private final AtomicInteger sequence = new AtomicInteger();

    public DaemonThreadFactory(String prefix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    @Override
    public Thread newThread(Runnable task) {
        Thread worker = new Thread(task, prefix + sequence.incrementAndGet());
        worker.setDaemon(true);
        worker.setUncaughtExceptionHandler(LOG_UNCAUGHT);
        return worker;
    }
}
