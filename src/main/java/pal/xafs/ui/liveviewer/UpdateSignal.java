package pal.xafs.ui.liveviewer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Level-triggered wake for a repeating task. Any number of {@link #raise()} calls made while
 * a pass is running collapse into a single further pass.
 */
public class UpdateSignal {
    private static final Logger logger = LoggerFactory.getLogger(UpdateSignal.class);

    private final Executor executor;
    private final Runnable pass;
    private final AtomicBoolean pending = new AtomicBoolean(false);
    private final AtomicBoolean running = new AtomicBoolean(false);

    public UpdateSignal(Executor executor, Runnable pass) {
        this.executor = executor;
        this.pass = pass;
    }

    public void raise() {
        pending.set(true);
        schedule();
    }

    public boolean isPending() {
        return pending.get();
    }

    private void schedule() {
        if (running.compareAndSet(false, true)) {
            try {
                executor.execute(this::drain);
            } catch (RejectedExecutionException e) {
                // the pending flag survives, so the next raise() retries
                running.set(false);
                logger.warn("Update pass rejected by executor: {}", e.getMessage());
            }
        }
    }

    private void drain() {
        try {
            while (pending.getAndSet(false)) {
                try {
                    pass.run();
                } catch (RuntimeException e) {
                    logger.error("Update pass failed", e);
                }
            }
        } finally {
            running.set(false);
        }
        // a raise between the last check and the reset above
        if (pending.get()) {
            schedule();
        }
    }
}
