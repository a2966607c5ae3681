package gp.core.scheduler;

import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ExecutorSchedulerTest {

    /** Executor that queues tasks until the test drains them. */
    private static final class QueueingExecutor implements java.util.concurrent.Executor {
        private final Queue<Runnable> tasks = new ArrayDeque<>();

        @Override
        public void execute(Runnable command) {
            tasks.add(command);
        }

        int drain() {
            int count = 0;
            Runnable task;
            while ((task = tasks.poll()) != null) {
                task.run();
                count++;
            }
            return count;
        }
    }

    @Test
    void testSchedule_runsOnExecutor() throws InterruptedException {
        ExecutorService executor = Executors.newSingleThreadExecutor(r -> new Thread(r, "context"));
        ExecutorScheduler scheduler = new ExecutorScheduler(executor);
        CountDownLatch ran = new CountDownLatch(1);
        List<String> threads = new ArrayList<>();

        scheduler.scheduleImmediate(() -> {
            threads.add(Thread.currentThread().getName());
            ran.countDown();
        });

        assertTrue(ran.await(5, TimeUnit.SECONDS));
        assertEquals(List.of("context"), threads);

        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
    }

    @Test
    void testSchedule_onlyLatestTaskRuns() {
        QueueingExecutor executor = new QueueingExecutor();
        ExecutorScheduler scheduler = new ExecutorScheduler(executor);
        List<String> ran = new ArrayList<>();

        scheduler.scheduleImmediate(() -> ran.add("first"));
        scheduler.scheduleImmediate(() -> ran.add("second"));

        assertEquals(2, executor.drain(), "Both submissions reach the executor");
        assertEquals(List.of("second"), ran);
        assertFalse(scheduler.hasPending());
    }

    @Test
    void testCancel_turnsSubmittedTaskIntoNoOp() {
        QueueingExecutor executor = new QueueingExecutor();
        ExecutorScheduler scheduler = new ExecutorScheduler(executor);
        List<String> ran = new ArrayList<>();

        scheduler.scheduleImmediate(() -> ran.add("task"));
        assertTrue(scheduler.hasPending());
        scheduler.cancel();

        executor.drain();
        assertTrue(ran.isEmpty());
    }

    @Test
    void testSchedule_afterCancelRunsNewTask() {
        QueueingExecutor executor = new QueueingExecutor();
        ExecutorScheduler scheduler = new ExecutorScheduler(executor);
        List<String> ran = new ArrayList<>();

        scheduler.scheduleImmediate(() -> ran.add("cancelled"));
        scheduler.cancel();
        scheduler.scheduleImmediate(() -> ran.add("fresh"));

        executor.drain();
        assertEquals(List.of("fresh"), ran);
    }

    @Test
    void testSchedule_rejectedByShutDownExecutorLeavesNothingPending() {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        executor.shutdown();
        ExecutorScheduler scheduler = new ExecutorScheduler(executor);

        assertThrows(RejectedExecutionException.class, () -> scheduler.scheduleImmediate(() -> { }));
        assertFalse(scheduler.hasPending());
    }

    @Test
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new ExecutorScheduler(null));
        ExecutorScheduler scheduler = new ExecutorScheduler(Runnable::run);
        assertThrows(IllegalArgumentException.class, () -> scheduler.scheduleImmediate(null));
    }
}
