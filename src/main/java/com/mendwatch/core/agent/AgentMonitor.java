package com.mendwatch.core.agent;

import com.mendwatch.core.config.MendwatchProperties;
import com.mendwatch.core.events.EventBus;
import com.mendwatch.core.events.MendwatchEvent;
import com.mendwatch.core.logging.MdcContext;
import com.mendwatch.core.loop.EventLoop;
import com.mendwatch.core.metrics.MendwatchMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Owns the registry of monitored agents and their sampling threads.
 *
 * <p>Each agent gets a dedicated thread that, while the agent is RUNNING:
 * <ol>
 *   <li>pulls a sample from the {@link MetricsCollector},</li>
 *   <li>applies it to the agent's snapshot under the registry lock (the first sample after start
 *       is discarded as calibration),</li>
 *   <li>submits a security scan to the {@link EventLoop},</li>
 *   <li>sleeps for the sampling interval.</li>
 * </ol>
 *
 * <p>One lock guards the whole registry. Readers get immutable copies. Nothing thrown inside a
 * sampling thread reaches the caller of {@link #startAgent(String)}: failures are written to the
 * agent's log buffer, and an exhausted metrics source moves the agent to ERROR.
 */
public class AgentMonitor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AgentMonitor.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, AgentState> agents = new LinkedHashMap<>();

    private final MetricsCollector collector;
    private final SecurityScanner securityScanner;
    private final ContainerProbe containerProbe;
    private final EventLoop eventLoop;
    private final EventBus eventBus;
    private final MendwatchMetrics metrics;
    private final Clock clock;
    private final Duration sampleInterval;
    private final Duration joinTimeout;
    private final int logCapacity;
    private final int activityCapacity;

    public AgentMonitor(MetricsCollector collector, SecurityScanner securityScanner,
                        ContainerProbe containerProbe, EventLoop eventLoop, EventBus eventBus,
                        MendwatchMetrics metrics, MendwatchProperties.Monitor settings) {
        this(collector, securityScanner, containerProbe, eventLoop, eventBus, metrics, settings, Clock.systemUTC());
    }

    public AgentMonitor(MetricsCollector collector, SecurityScanner securityScanner,
                        ContainerProbe containerProbe, EventLoop eventLoop, EventBus eventBus,
                        MendwatchMetrics metrics, MendwatchProperties.Monitor settings, Clock clock) {
        this.collector = collector;
        this.securityScanner = securityScanner;
        this.containerProbe = containerProbe;
        this.eventLoop = eventLoop;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
        this.sampleInterval = settings.getSampleInterval();
        this.joinTimeout = settings.getJoinTimeout();
        this.logCapacity = settings.getLogCapacity();
        this.activityCapacity = settings.getActivityCapacity();
    }

    // -- Lifecycle -------------------------------------------------------------------------

    /**
     * Registers {@code agentId} and starts its sampling thread.
     *
     * @return false if an agent with this id already exists (running or not)
     */
    public boolean startAgent(String agentId) {
        Thread worker;
        lock.lock();
        try {
            if (agents.containsKey(agentId)) {
                log.warn("Agent {} already exists", agentId);
                return false;
            }
            var state = new AgentState();
            worker = new Thread(() -> runSampler(agentId), threadName(agentId));
            worker.setDaemon(true);
            state.worker = worker;
            agents.put(agentId, state);
            appendLog(state, "INFO", "Agent started");
            addActivity(state, "lifecycle", "started", "Agent started", null);
        } finally {
            lock.unlock();
        }
        worker.start();
        log.info("Started agent {}", agentId);
        eventBus.publish(MendwatchEvent.of("agent.started", agentId, Map.of()));
        return true;
    }

    /**
     * Marks the agent STOPPED and waits a bounded time for its thread to exit. A thread that
     * does not exit in time is abandoned; it ends on its next status check.
     *
     * @return false if the agent does not exist
     */
    public boolean stopAgent(String agentId) {
        Thread worker;
        lock.lock();
        try {
            AgentState state = agents.get(agentId);
            if (state == null) {
                return false;
            }
            if (state.status != AgentStatus.STOPPED) {
                state.status = AgentStatus.STOPPED;
                appendLog(state, "INFO", "Agent stopped");
                addActivity(state, "lifecycle", "stopped", "Agent stopped", null);
            }
            worker = state.worker;
        } finally {
            lock.unlock();
        }
        if (worker != null && worker != Thread.currentThread()) {
            worker.interrupt();
            try {
                worker.join(joinTimeout.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (worker.isAlive()) {
                log.warn("Agent {} sampler did not exit within {}ms, abandoning it", agentId, joinTimeout.toMillis());
            }
        }
        log.info("Stopped agent {}", agentId);
        eventBus.publish(MendwatchEvent.of("agent.stopped", agentId, Map.of()));
        return true;
    }

    /**
     * Forgets a stopped or failed agent so its id can be reused.
     *
     * @return false if the agent does not exist or is still running
     */
    public boolean removeAgent(String agentId) {
        lock.lock();
        try {
            AgentState state = agents.get(agentId);
            if (state == null || state.status == AgentStatus.RUNNING) {
                return false;
            }
            agents.remove(agentId);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** Stops every running agent. */
    @Override
    public void close() {
        for (String agentId : listAgents().keySet()) {
            if (getAgentStatus(agentId).orElse(null) == AgentStatus.RUNNING) {
                stopAgent(agentId);
            }
        }
    }

    // -- Reads -----------------------------------------------------------------------------

    public Optional<AgentStatus> getAgentStatus(String agentId) {
        return read(agentId, state -> state.status);
    }

    public Optional<AgentMetrics> getAgentMetrics(String agentId) {
        return read(agentId, state -> state.metrics);
    }

    public Optional<SecuritySnapshot> getAgentSecurity(String agentId) {
        return read(agentId, state -> state.security);
    }

    /** All retained log entries, oldest first. */
    public List<AgentLogEntry> getAgentLogs(String agentId) {
        return getAgentLogs(agentId, Integer.MAX_VALUE);
    }

    /** The most recent {@code limit} log entries, oldest first. Empty for unknown agents. */
    public List<AgentLogEntry> getAgentLogs(String agentId, int limit) {
        return read(agentId, state -> {
            var all = new ArrayList<>(state.logs);
            return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
        }).orElse(List.of());
    }

    /** The most recent {@code limit} activities, newest first. Empty for unknown agents. */
    public List<AgentActivity> getAgentActivities(String agentId, int limit) {
        return read(agentId, state -> state.activities.stream().limit(limit).toList()).orElse(List.of());
    }

    public List<AgentActivity> getAgentActivities(String agentId) {
        return getAgentActivities(agentId, activityCapacity);
    }

    /**
     * Resource usage of the hosting process, probed on demand. Empty for unknown agents.
     */
    public Optional<ContainerMetrics> getAgentContainer(String agentId) {
        if (getAgentStatus(agentId).isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(containerProbe.probe());
        } catch (RuntimeException e) {
            log.warn("Container probe failed for agent {}: {}", agentId, e.getMessage());
            return Optional.empty();
        }
    }

    /** Agent ids and their status, in start order. */
    public Map<String, AgentStatus> listAgents() {
        lock.lock();
        try {
            var result = new LinkedHashMap<String, AgentStatus>();
            agents.forEach((id, state) -> result.put(id, state.status));
            return Collections.unmodifiableMap(result);
        } finally {
            lock.unlock();
        }
    }

    public boolean isWorkerAlive(String agentId) {
        Thread worker = read(agentId, state -> state.worker).orElse(null);
        return worker != null && worker.isAlive();
    }

    // -- Writes from collaborators ---------------------------------------------------------

    /**
     * Records an activity for the agent; newest first, capped at the activity capacity.
     *
     * @return false if the agent does not exist
     */
    public boolean logActivity(String agentId, String type, String status, String details, String project) {
        lock.lock();
        try {
            AgentState state = agents.get(agentId);
            if (state == null) {
                return false;
            }
            addActivity(state, type, status, details, project);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean log(String agentId, String level, String message) {
        lock.lock();
        try {
            AgentState state = agents.get(agentId);
            if (state == null) {
                return false;
            }
            appendLog(state, level, message);
            return true;
        } finally {
            lock.unlock();
        }
    }

    // -- Sampling loop ---------------------------------------------------------------------

    private void runSampler(String agentId) {
        MdcContext.setAgent(agentId);
        try {
            while (isRunning(agentId)) {
                boolean collected = false;
                try {
                    MetricsSample sample = collector.collect();
                    collected = applySample(agentId, sample);
                } catch (MetricsSourceExhaustedException e) {
                    log.error("Metrics source exhausted for agent {}: {}", agentId, e.getMessage());
                    failAgent(agentId, "Metrics source exhausted: " + e.getMessage());
                    return;
                } catch (RuntimeException e) {
                    log.warn("Failed to collect metrics for agent {}: {}", agentId, e.getMessage());
                    log(agentId, "ERROR", "Failed to collect metrics: " + e.getMessage());
                }
                if (collected) {
                    scheduleSecurityScan(agentId);
                }
                try {
                    Thread.sleep(sampleInterval.toMillis());
                } catch (InterruptedException e) {
                    // this thread is owned by the monitor; the status check decides whether to exit
                    log.debug("Sampler for agent {} interrupted", agentId);
                }
            }
        } catch (RuntimeException e) {
            log.error("Sampler for agent {} failed: {}", agentId, e.getMessage(), e);
            failAgent(agentId, "Sampler failed: " + e.getMessage());
        } finally {
            log.debug("Sampler for agent {} exited", agentId);
            MdcContext.clear();
        }
    }

    private boolean isRunning(String agentId) {
        return getAgentStatus(agentId).orElse(null) == AgentStatus.RUNNING;
    }

    /**
     * Applies one sample. The first sample after start only calibrates and leaves the snapshot
     * untouched.
     *
     * @return false if the agent is gone or no longer running
     */
    private boolean applySample(String agentId, MetricsSample sample) {
        lock.lock();
        try {
            AgentState state = agents.get(agentId);
            if (state == null || state.status != AgentStatus.RUNNING) {
                return false;
            }
            if (!state.calibrated) {
                state.calibrated = true;
                return true;
            }
            state.metrics = AgentMetrics.from(sample, clock.instant());
        } finally {
            lock.unlock();
        }
        metrics.recordAgentSample(agentId);
        return true;
    }

    /**
     * Submits a security scan to the event loop. At most one scan per agent is in flight.
     * A failed scan keeps the previous values and flags them stale.
     */
    private void scheduleSecurityScan(String agentId) {
        AtomicBoolean inFlight = read(agentId, state -> state.scanInFlight).orElse(null);
        if (inFlight == null || !inFlight.compareAndSet(false, true)) {
            return;
        }
        eventLoop.submit(securityScanner::scan).whenComplete((scan, error) -> {
            try {
                applySecurityScan(agentId, scan, error);
            } finally {
                inFlight.set(false);
            }
        });
    }

    private void applySecurityScan(String agentId, SecurityScan scan, Throwable error) {
        lock.lock();
        try {
            AgentState state = agents.get(agentId);
            if (state == null) {
                return;
            }
            if (error != null || scan == null) {
                String reason = error != null ? error.getMessage() : "no result";
                state.security = state.security.markStale();
                appendLog(state, "WARN", "Security scan failed: " + reason);
                return;
            }
            state.security = SecuritySnapshot.of(scan, clock.instant());
        } finally {
            lock.unlock();
        }
        if (scan != null && error == null) {
            metrics.recordSecurityScan(scan.vulnerabilities());
        }
    }

    private void failAgent(String agentId, String reason) {
        lock.lock();
        try {
            AgentState state = agents.get(agentId);
            if (state == null) {
                return;
            }
            appendLog(state, "ERROR", reason);
            if (state.status == AgentStatus.RUNNING) {
                state.status = AgentStatus.ERROR;
                addActivity(state, "lifecycle", "error", reason, null);
            }
        } finally {
            lock.unlock();
        }
        eventBus.publish(MendwatchEvent.of("agent.error", agentId, Map.of("reason", reason)));
    }

    // -- Helpers (callers hold the lock) ---------------------------------------------------

    private void appendLog(AgentState state, String level, String message) {
        state.logs.addLast(new AgentLogEntry(clock.instant(), level, message));
        while (state.logs.size() > logCapacity) {
            state.logs.removeFirst();
        }
    }

    private void addActivity(AgentState state, String type, String status, String details, String project) {
        state.activities.addFirst(new AgentActivity(clock.instant(), type, status, details, project));
        while (state.activities.size() > activityCapacity) {
            state.activities.removeLast();
        }
    }

    private <T> Optional<T> read(String agentId, Function<AgentState, T> reader) {
        lock.lock();
        try {
            AgentState state = agents.get(agentId);
            return state == null ? Optional.empty() : Optional.ofNullable(reader.apply(state));
        } finally {
            lock.unlock();
        }
    }

    static String threadName(String agentId) {
        return "mendwatch-agent-" + agentId;
    }

    /** Mutable per-agent state; only touched while holding {@link #lock}. */
    private static final class AgentState {
        final Deque<AgentLogEntry> logs = new ArrayDeque<>();
        final Deque<AgentActivity> activities = new ArrayDeque<>();
        final AtomicBoolean scanInFlight = new AtomicBoolean(false);
        AgentStatus status = AgentStatus.RUNNING;
        AgentMetrics metrics = AgentMetrics.initial();
        SecuritySnapshot security = SecuritySnapshot.initial();
        boolean calibrated;
        Thread worker;
    }
}
