package io.pipewright.core.schedule;

import io.pipewright.core.execution.BoundPipeline;
import io.pipewright.core.execution.result.RunRecord;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Repeatedly runs one bound pipeline according to a {@link ScheduleRule}.
///
/// Each job owns a single timer thread that turns the rule into
/// {@link FireEvent}s and a single worker thread that consumes them, so at
/// most one run of the job executes at a time. Fires arriving during a run
/// wait in a {@link FireQueue} shaped by the configured {@link BacklogPolicy}
/// and are consumed strictly in order.
///
/// ### Lifecycle
/// ```
/// NEW --start()--> STARTED --shutdown()--> SHUTTING_DOWN --> TERMINATED
///  \_____________________shutdown()______________________/
/// ```
///
/// ### Usage
/// {@snippet :
/// ScheduledJob job = ScheduledJob.builder()
///     .rule(ScheduleRule.interval("PT15M"))
///     .target(boundPipeline)
///     .listener(myListener)
///     .build();
/// job.registerShutdownHook();
/// job.start();
/// }
///
/// ### Contracts
/// - **Precondition**: rule and target are set; checked by {@link Builder#build()}
/// - **Invariant**: runs of one job never overlap; run N+1 starts after run N
///   returned its record
/// - **Postcondition** of {@link #shutdown()}: no fire starts afterwards and
///   the run that was active has finished
///
/// A {@link ScheduleListener} may stop its own job from a callback, for
/// example after a number of runs. That call returns at once and the job
/// terminates when the callback has returned.
///
/// @implNote Thread-safe. Shutdown is cooperative: a running pipeline is
/// never interrupted.
public final class ScheduledJob {

    private static final Logger logger = Logger.getLogger(ScheduledJob.class.getName());

    private enum State {
        NEW,
        STARTED,
        SHUTTING_DOWN,
        TERMINATED
    }

    private final String name;
    private final ScheduleRule rule;
    private final BoundPipeline target;
    private final SchedulerConfig config;
    private final ScheduleListener listener;

    private final Object lock = new Object();
    private final FireQueue queue;
    private final ScheduledExecutorService timer;
    private final ExecutorService worker;
    private final CountDownLatch terminated = new CountDownLatch(1);

    private State state = State.NEW;
    private boolean workerActive;
    private volatile Thread workerThread;
    private long sequence;
    private ZonedDateTime lastCronFire;
    private Thread shutdownHook;

    private ScheduledJob(Builder builder) {
        this.name = builder.name != null ? builder.name : builder.target.getPipelineId();
        this.rule = builder.rule;
        this.target = builder.target;
        this.config = builder.config;
        this.listener = builder.listener;
        this.queue = new FireQueue(config.getBacklogPolicy(), config.getMaxPendingFires());
        this.timer =
                Executors.newSingleThreadScheduledExecutor(
                        r -> new Thread(r, "pipewright-timer-" + name));
        this.worker =
                Executors.newSingleThreadExecutor(
                        r -> {
                            Thread thread = new Thread(r, "pipewright-job-" + name);
                            workerThread = thread;
                            return thread;
                        });
    }

    /// Starts the timer.
    ///
    /// @throws IllegalStateException if the job was already started or shut down
    public void start() {
        synchronized (lock) {
            if (state != State.NEW) {
                throw new IllegalStateException(
                        "Job '" + name + "' cannot start from state " + state);
            }
            state = State.STARTED;
        }

        if (rule instanceof ScheduleRule.Interval interval) {
            long period = interval.period().toNanos();
            long initialDelay = interval.fireImmediately() ? 0 : period;
            timer.scheduleAtFixedRate(this::fire, initialDelay, period, TimeUnit.NANOSECONDS);
            logger.info("Job '" + name + "' started, firing every " + interval.period());
        } else if (rule instanceof ScheduleRule.Cron cron) {
            scheduleNextCronFire(cron);
            logger.info("Job '" + name + "' started, cron '" + cron.expression() + "'");
        }
    }

    private void scheduleNextCronFire(ScheduleRule.Cron cron) {
        ZonedDateTime now = ZonedDateTime.ofInstant(config.getClock().instant(), config.getZone());
        ZonedDateTime after;
        synchronized (lock) {
            if (state != State.STARTED) {
                return;
            }
            // The timer may wake slightly early; never fire the same minute twice.
            after = lastCronFire != null && lastCronFire.isAfter(now) ? lastCronFire : now;
        }

        Optional<ZonedDateTime> next = cron.nextFire(after);
        if (next.isEmpty()) {
            logger.warning("Cron '" + cron.expression() + "' of job '" + name + "' never fires");
            return;
        }
        ZonedDateTime fireAt = next.get();
        long delay = Math.max(0, Duration.between(now, fireAt).toMillis());
        try {
            timer.schedule(
                    () -> {
                        synchronized (lock) {
                            lastCronFire = fireAt;
                        }
                        fire();
                        scheduleNextCronFire(cron);
                    },
                    delay,
                    TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            logger.fine("Timer of job '" + name + "' stopped before " + fireAt);
        }
    }

    /// Timer callback: enqueues a fire and wakes the worker when idle.
    private void fire() {
        FireEvent event;
        Optional<FireEvent> dropped;
        synchronized (lock) {
            if (state != State.STARTED) {
                return;
            }
            event = new FireEvent(++sequence, config.getClock().instant());
            dropped = queue.offer(event);
            if (!workerActive) {
                workerActive = true;
                worker.execute(this::drain);
            }
        }
        logger.fine("Job '" + name + "' fired #" + event.sequence());
        dropped.ifPresent(this::reportDropped);
    }

    /// Worker loop: runs pending fires one after another until the queue is empty.
    ///
    /// Whatever escapes a run, the worker is released and re-armed for the
    /// fires still pending, so the job never stalls with a full queue.
    private void drain() {
        boolean finished = false;
        try {
            while (true) {
                FireEvent event;
                synchronized (lock) {
                    Optional<FireEvent> next = queue.poll();
                    if (next.isEmpty()) {
                        workerActive = false;
                        finished = true;
                        break;
                    }
                    event = next.get();
                }
                execute(event);
            }
        } finally {
            if (!finished) {
                rearm();
            }
        }
        synchronized (lock) {
            if (state != State.SHUTTING_DOWN) {
                return;
            }
        }
        markTerminated();
    }

    private void rearm() {
        boolean stopped;
        synchronized (lock) {
            workerActive = false;
            if (queue.size() > 0 && state != State.TERMINATED) {
                try {
                    worker.execute(this::drain);
                    workerActive = true;
                } catch (RejectedExecutionException e) {
                    logger.warning(
                            "Job '" + name + "' cannot resume " + queue.size() + " pending fires");
                }
            }
            stopped = !workerActive && state == State.SHUTTING_DOWN;
        }
        if (stopped) {
            markTerminated();
        }
    }

    private void execute(FireEvent event) {
        RunRecord record;
        try {
            record = target.run();
        } catch (RuntimeException | Error e) {
            logger.log(
                    Level.SEVERE, "Run #" + event.sequence() + " of job '" + name + "' failed", e);
            notifySafely(() -> listener.onRunError(event, e));
            return;
        }
        notifySafely(() -> listener.onRunComplete(event, record));
    }

    private void reportDropped(FireEvent event) {
        logger.info("Job '" + name + "' dropped fire #" + event.sequence());
        notifySafely(() -> listener.onFireDropped(event));
    }

    private void notifySafely(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException | Error e) {
            logger.log(Level.WARNING, "Schedule listener of job '" + name + "' failed", e);
        }
    }

    /// Stops the job and waits until the active run has finished.
    ///
    /// No fire starts after this call begins. Pending fires are executed or
    /// dropped per {@link ShutdownPolicy}. Calling it again, or on a job that
    /// never started, is allowed.
    public void shutdown() {
        shutdown(Duration.ofNanos(Long.MAX_VALUE));
    }

    /// Stops the job and waits at most `timeout` for the active run.
    ///
    /// Called from the job's own worker thread, that is from a
    /// {@link ScheduleListener} run callback, it does not wait: the job
    /// terminates once the callback returns.
    ///
    /// @param timeout maximum wait, not null
    /// @return true if the job terminated within the timeout, false when
    ///         called from the worker thread
    public boolean shutdown(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout must not be null");
        List<FireEvent> discarded = List.of();
        synchronized (lock) {
            if (state == State.NEW) {
                state = State.TERMINATED;
                timer.shutdownNow();
                worker.shutdown();
                terminated.countDown();
                return true;
            }
            if (state == State.STARTED) {
                state = State.SHUTTING_DOWN;
                if (config.getShutdownPolicy() == ShutdownPolicy.DISCARD) {
                    discarded = queue.clear();
                }
                logger.info(
                        "Job '"
                                + name
                                + "' shutting down ("
                                + config.getShutdownPolicy()
                                + ", "
                                + queue.size()
                                + " pending)");
            }
        }

        timer.shutdownNow();
        discarded.forEach(this::reportDropped);
        worker.shutdown();

        if (Thread.currentThread() == workerThread) {
            logger.fine("Job '" + name + "' stopped from its own worker");
            return false;
        }

        boolean done;
        try {
            done = worker.awaitTermination(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        if (done) {
            markTerminated();
        }
        return done;
    }

    private void markTerminated() {
        synchronized (lock) {
            if (state != State.TERMINATED) {
                state = State.TERMINATED;
                logger.info("Job '" + name + "' terminated");
            }
        }
        terminated.countDown();
        removeShutdownHook();
    }

    /// Blocks until the job has terminated.
    ///
    /// @param timeout maximum wait, not null
    /// @return true if the job terminated
    /// @throws InterruptedException if interrupted while waiting
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /// Registers a JVM shutdown hook that calls {@link #shutdown()}, so that
    /// SIGINT and SIGTERM let the active run finish.
    ///
    /// @apiNote **Side effects**: adds a hook to {@link Runtime}; removed
    /// again once the job terminates through an explicit shutdown.
    ///
    /// @return this job
    public ScheduledJob registerShutdownHook() {
        synchronized (lock) {
            if (shutdownHook == null) {
                shutdownHook = new Thread(this::shutdown, "pipewright-shutdown-" + name);
                Runtime.getRuntime().addShutdownHook(shutdownHook);
            }
        }
        return this;
    }

    private void removeShutdownHook() {
        Thread hook;
        synchronized (lock) {
            hook = shutdownHook;
            shutdownHook = null;
        }
        if (hook == null || hook == Thread.currentThread()) {
            return;
        }
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            logger.fine("JVM already shutting down, keeping hook of job '" + name + "'");
        }
    }

    /// Returns whether the job accepts fires.
    ///
    /// @return true between {@link #start()} and {@link #shutdown()}
    public boolean isRunning() {
        synchronized (lock) {
            return state == State.STARTED;
        }
    }

    /// Returns whether the job has fully terminated.
    ///
    /// @return true once shutdown completed
    public boolean isTerminated() {
        return terminated.getCount() == 0;
    }

    /// Returns the number of fires waiting for the active run.
    ///
    /// @return pending fire count
    public int getPendingFires() {
        synchronized (lock) {
            return queue.size();
        }
    }

    public String getName() {
        return name;
    }

    public ScheduleRule getRule() {
        return rule;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builder for {@link ScheduledJob}. All validation happens in {@link #build()}.
    public static final class Builder {
        private String name;
        private ScheduleRule rule;
        private BoundPipeline target;
        private SchedulerConfig config = new SchedulerConfig();
        private ScheduleListener listener = ScheduleListener.NOOP;

        private Builder() {}

        /// Sets the job name used in thread names and logs.
        ///
        /// @param name job name, defaults to the pipeline ID
        /// @return this builder for chaining
        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder rule(ScheduleRule rule) {
            this.rule = rule;
            return this;
        }

        public Builder target(BoundPipeline target) {
            this.target = target;
            return this;
        }

        public Builder config(SchedulerConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        public Builder listener(ScheduleListener listener) {
            this.listener = Objects.requireNonNull(listener, "listener must not be null");
            return this;
        }

        /// Builds the job without starting it.
        ///
        /// @return a new job in the NEW state, never null
        /// @throws ScheduleConfigException if the rule or target is missing
        public ScheduledJob build() {
            if (rule == null) {
                throw new ScheduleConfigException("Scheduled job requires a schedule rule");
            }
            if (target == null) {
                throw new ScheduleConfigException("Scheduled job requires a target pipeline");
            }
            return new ScheduledJob(this);
        }
    }
}
