package com.mendwatch.core.health;

import com.mendwatch.core.agent.AgentMonitor;
import com.mendwatch.core.agent.AgentStatus;
import com.mendwatch.core.loop.EventLoop;
import com.mendwatch.core.security.PathGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;

public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final PathGuard pathGuard;
    private final EventLoop eventLoop;
    private final AgentMonitor agentMonitor;

    public HealthCheckService(PathGuard pathGuard, EventLoop eventLoop, AgentMonitor agentMonitor) {
        this.pathGuard = pathGuard;
        this.eventLoop = eventLoop;
        this.agentMonitor = agentMonitor;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkProject());
        results.add(checkEventLoop());
        results.add(checkAgents());
        return results;
    }

    private HealthStatus checkProject() {
        Path root = pathGuard.projectRoot();
        if (Files.isDirectory(root) && Files.isReadable(root)) {
            return new HealthStatus("project", HealthStatus.Status.UP,
                    "Project root readable", Map.of("root", root.toString()));
        }
        return new HealthStatus("project", HealthStatus.Status.DOWN,
                "Project root not readable", Map.of("root", root.toString()));
    }

    private HealthStatus checkEventLoop() {
        if (!eventLoop.isRunning()) {
            return new HealthStatus("event-loop", HealthStatus.Status.DOWN,
                    "Event loop shut down", Map.of());
        }
        try {
            eventLoop.submit(() -> Boolean.TRUE).get(2, TimeUnit.SECONDS);
            return new HealthStatus("event-loop", HealthStatus.Status.UP,
                    "Event loop responsive", Map.of());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new HealthStatus("event-loop", HealthStatus.Status.DOWN,
                    "Interrupted while probing event loop", Map.of());
        } catch (Exception e) {
            log.warn("Event loop health check failed: {}", e.getMessage());
            return new HealthStatus("event-loop", HealthStatus.Status.DEGRADED,
                    "Event loop not responding: " + e.getClass().getSimpleName(), Map.of());
        }
    }

    private HealthStatus checkAgents() {
        Map<String, AgentStatus> agents = agentMonitor.listAgents();
        var metadata = new TreeMap<String, String>();
        agents.forEach((id, status) -> metadata.put(id, status.name()));
        long failed = agents.values().stream().filter(s -> s == AgentStatus.ERROR).count();
        if (failed > 0) {
            return new HealthStatus("agents", HealthStatus.Status.DEGRADED,
                    failed + " of " + agents.size() + " agent(s) in error", metadata);
        }
        return new HealthStatus("agents", HealthStatus.Status.UP,
                agents.size() + " agent(s)", metadata);
    }
}
