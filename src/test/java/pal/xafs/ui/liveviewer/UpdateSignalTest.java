package pal.xafs.ui.liveviewer;

import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class UpdateSignalTest {

    /** Executor whose tasks run only when the test says so. */
    private static final class ManualExecutor implements Executor {
        final Deque<Runnable> tasks = new ArrayDeque<>();

        @Override
        public void execute(Runnable command) {
            tasks.add(command);
        }

        void runAll() {
            while (!tasks.isEmpty()) {
                tasks.poll().run();
            }
        }
    }

    @Test
    void testRaise_BurstCollapsesIntoOnePass() {
        ManualExecutor executor = new ManualExecutor();
        AtomicInteger passes = new AtomicInteger();
        UpdateSignal signal = new UpdateSignal(executor, passes::incrementAndGet);

        signal.raise();
        signal.raise();
        signal.raise();
        assertEquals(1, executor.tasks.size());
        assertTrue(signal.isPending());

        executor.runAll();
        assertEquals(1, passes.get());
        assertFalse(signal.isPending());
    }

    @Test
    void testRaise_DuringPassRunsExactlyOneMore() {
        ManualExecutor executor = new ManualExecutor();
        AtomicInteger passes = new AtomicInteger();
        UpdateSignal[] holder = new UpdateSignal[1];
        holder[0] = new UpdateSignal(executor, () -> {
            if (passes.incrementAndGet() == 1) {
                holder[0].raise();
                holder[0].raise();
            }
        });

        holder[0].raise();
        executor.runAll();
        assertEquals(2, passes.get());
    }

    @Test
    void testFailingPassDoesNotStopLaterPasses() {
        AtomicInteger passes = new AtomicInteger();
        UpdateSignal signal = new UpdateSignal(Runnable::run, () -> {
            passes.incrementAndGet();
            throw new IllegalStateException("bad frame");
        });

        signal.raise();
        signal.raise();
        assertEquals(2, passes.get());
    }

    @Test
    void testRejectedExecution_NextRaiseSchedulesAgain() {
        ManualExecutor executor = new ManualExecutor();
        AtomicInteger rejections = new AtomicInteger(1);
        AtomicInteger passes = new AtomicInteger();
        UpdateSignal signal = new UpdateSignal(command -> {
            if (rejections.getAndDecrement() > 0) {
                throw new RejectedExecutionException("queue full");
            }
            executor.execute(command);
        }, passes::incrementAndGet);

        signal.raise();
        assertTrue(executor.tasks.isEmpty());
        assertTrue(signal.isPending());

        signal.raise();
        executor.runAll();
        assertEquals(1, passes.get());
        assertFalse(signal.isPending());
    }
}
