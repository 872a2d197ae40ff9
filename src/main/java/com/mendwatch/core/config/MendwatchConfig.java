package com.mendwatch.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mendwatch.core.agent.AgentMonitor;
import com.mendwatch.core.agent.ContainerProbe;
import com.mendwatch.core.agent.ContentSecurityScanner;
import com.mendwatch.core.agent.JvmContainerProbe;
import com.mendwatch.core.agent.MeterRegistryMetricsCollector;
import com.mendwatch.core.agent.MetricsCollector;
import com.mendwatch.core.agent.SecurityScanner;
import com.mendwatch.core.detect.ContextExtractor;
import com.mendwatch.core.detect.Detector;
import com.mendwatch.core.detect.PatternDetector;
import com.mendwatch.core.engine.ErrorIntake;
import com.mendwatch.core.engine.Orchestrator;
import com.mendwatch.core.errors.ErrorStore;
import com.mendwatch.core.events.EventBus;
import com.mendwatch.core.health.HealthCheckService;
import com.mendwatch.core.loop.EventLoop;
import com.mendwatch.core.metrics.MendwatchMetrics;
import com.mendwatch.core.model.TaskType;
import com.mendwatch.core.remediation.DetectionHandler;
import com.mendwatch.core.remediation.ErrorKind;
import com.mendwatch.core.remediation.FixErrorHandler;
import com.mendwatch.core.remediation.GiveUpRemediation;
import com.mendwatch.core.remediation.RemediationRegistry;
import com.mendwatch.core.remediation.RetryFixRemediation;
import com.mendwatch.core.remediation.TaskHandler;
import com.mendwatch.core.remediation.TaskWorker;
import com.mendwatch.core.remediation.TestExecutionHandler;
import com.mendwatch.core.remediation.TrailingWhitespaceFixStrategy;
import com.mendwatch.core.report.ReportAnalyzer;
import com.mendwatch.core.report.ReportCodec;
import com.mendwatch.core.report.ReportRecorder;
import com.mendwatch.core.report.ReportWriter;
import com.mendwatch.core.security.PathGuard;
import com.mendwatch.core.security.SecurityContext;
import com.mendwatch.core.tasks.TaskQueue;
import com.mendwatch.core.watch.ProjectWatcher;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Wires the engine. Every component is a singleton; shutdown order follows Spring's reverse
 * creation order, so agents stop before the event loop they submit scans to.
 */
@Configuration
@EnableConfigurationProperties(MendwatchProperties.class)
public class MendwatchConfig {

    @Bean
    public SecurityContext securityContext(MendwatchProperties properties) {
        return SecurityContext.create(Path.of(properties.getProject().getRoot()),
                properties.getProject().getAllowedOperations());
    }

    @Bean
    public PathGuard pathGuard(SecurityContext securityContext, MendwatchProperties properties) {
        return new PathGuard(securityContext, properties.getProject().getExclusions());
    }

    @Bean
    public EventBus eventBus() {
        return new EventBus();
    }

    @Bean
    public EventLoop eventLoop() {
        return new EventLoop();
    }

    @Bean
    public MendwatchMetrics mendwatchMetrics(MeterRegistry meterRegistry) {
        return new MendwatchMetrics(meterRegistry);
    }

    @Bean
    public ErrorStore errorStore() {
        return new ErrorStore();
    }

    @Bean
    public TaskQueue taskQueue(MendwatchMetrics metrics, MendwatchProperties properties) {
        return new TaskQueue(metrics, Clock.systemUTC(), properties.getTasks().getStaleAfter(),
                properties.getTasks().getRetainFinished());
    }

    @Bean
    public MetricsCollector metricsCollector(MeterRegistry meterRegistry) {
        return new MeterRegistryMetricsCollector(meterRegistry);
    }

    @Bean
    public SecurityScanner securityScanner(PathGuard pathGuard) {
        return new ContentSecurityScanner(pathGuard);
    }

    @Bean
    public ContainerProbe containerProbe() {
        return new JvmContainerProbe();
    }

    @Bean
    public AgentMonitor agentMonitor(MetricsCollector collector, SecurityScanner securityScanner,
                                     ContainerProbe containerProbe, EventLoop eventLoop, EventBus eventBus,
                                     MendwatchMetrics metrics, MendwatchProperties properties) {
        return new AgentMonitor(collector, securityScanner, containerProbe, eventLoop, eventBus, metrics,
                properties.getMonitor());
    }

    @Bean
    public Detector detector(PathGuard pathGuard) {
        return new PatternDetector(pathGuard);
    }

    @Bean
    public ContextExtractor contextExtractor(PathGuard pathGuard) {
        return new ContextExtractor(pathGuard);
    }

    @Bean
    public ErrorIntake errorIntake(ErrorStore errorStore, TaskQueue taskQueue, EventBus eventBus,
                                   MendwatchMetrics metrics, MendwatchProperties properties) {
        return new ErrorIntake(errorStore, taskQueue, eventBus, metrics, properties.getErrors().getMaxRetries());
    }

    @Bean
    public Orchestrator orchestrator(PathGuard pathGuard, Detector detector, ErrorIntake intake,
                                     TaskQueue taskQueue, EventLoop eventLoop, EventBus eventBus) {
        return new Orchestrator(pathGuard, detector, intake, taskQueue, eventLoop, eventBus);
    }

    @Bean
    public RemediationRegistry remediationRegistry(ErrorStore errorStore, TaskQueue taskQueue, ErrorIntake intake) {
        var retry = new RetryFixRemediation(errorStore, taskQueue, intake);
        var giveUp = new GiveUpRemediation(errorStore);
        return new RemediationRegistry()
                .register(ErrorKind.EXECUTION, retry)
                .register(ErrorKind.TRANSIENT, retry)
                .register(ErrorKind.VALIDATION, giveUp)
                .register(ErrorKind.UNRECOVERABLE, giveUp);
    }

    @Bean
    public TaskWorker taskWorker(PathGuard pathGuard, ErrorStore errorStore, TaskQueue taskQueue,
                                 Detector detector, ErrorIntake intake, RemediationRegistry remediations,
                                 AgentMonitor agentMonitor, MendwatchMetrics metrics, EventBus eventBus,
                                 EventLoop eventLoop, MendwatchProperties properties) {
        var detection = new DetectionHandler(pathGuard, detector, intake);
        Map<TaskType, TaskHandler> handlers = Map.of(
                TaskType.FIX_ERROR, new FixErrorHandler(pathGuard, errorStore,
                        List.of(new TrailingWhitespaceFixStrategy())),
                TaskType.LINTING, detection,
                TaskType.PROJECT_SCAN, detection,
                TaskType.RUN_TESTS, new TestExecutionHandler(pathGuard, properties.getTasks().getTestTimeout()));
        return new TaskWorker(taskQueue, handlers, remediations, agentMonitor, metrics, eventBus, eventLoop,
                properties.getTasks(), pathGuard.projectRoot().toString());
    }

    @Bean
    public ReportCodec reportCodec(ObjectMapper objectMapper) {
        return new ReportCodec(objectMapper);
    }

    @Bean
    public ReportWriter reportWriter(PathGuard pathGuard, ReportCodec codec, MendwatchProperties properties) {
        return new ReportWriter(pathGuard.projectRoot().resolve(properties.getReports().getDirectory()), codec);
    }

    @Bean
    public ReportAnalyzer reportAnalyzer() {
        return new ReportAnalyzer();
    }

    @Bean
    public ReportRecorder reportRecorder(ErrorStore errorStore, ContextExtractor contextExtractor,
                                         ReportWriter writer, EventBus eventBus) {
        var recorder = new ReportRecorder(errorStore, contextExtractor, writer);
        recorder.subscribe(eventBus);
        return recorder;
    }

    @Bean
    public ProjectWatcher projectWatcher(PathGuard pathGuard, Orchestrator orchestrator, MendwatchProperties properties) {
        return new ProjectWatcher(pathGuard, properties.getWatcher().getDebounce(), orchestrator::onFilesChanged);
    }

    @Bean
    public HealthCheckService healthCheckService(PathGuard pathGuard, EventLoop eventLoop, AgentMonitor agentMonitor) {
        return new HealthCheckService(pathGuard, eventLoop, agentMonitor);
    }
}
