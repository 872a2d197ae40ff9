package com.mendwatch.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

@ConfigurationProperties(prefix = "mendwatch")
public class MendwatchProperties {

    private Project project = new Project();
    private Monitor monitor = new Monitor();
    private Tasks tasks = new Tasks();
    private Errors errors = new Errors();
    private Reports reports = new Reports();
    private Watcher watcher = new Watcher();

    public Project getProject() { return project; }
    public void setProject(Project project) { this.project = project; }
    public Monitor getMonitor() { return monitor; }
    public void setMonitor(Monitor monitor) { this.monitor = monitor; }
    public Tasks getTasks() { return tasks; }
    public void setTasks(Tasks tasks) { this.tasks = tasks; }
    public Errors getErrors() { return errors; }
    public void setErrors(Errors errors) { this.errors = errors; }
    public Reports getReports() { return reports; }
    public void setReports(Reports reports) { this.reports = reports; }
    public Watcher getWatcher() { return watcher; }
    public void setWatcher(Watcher watcher) { this.watcher = watcher; }

    public static class Project {
        private String root = ".";
        private List<String> allowedOperations = List.of("read", "write", "analyze");
        /** Extra exclusions on top of the built-in VCS/cache/build list. */
        private List<String> exclusions = List.of();

        public String getRoot() { return root; }
        public void setRoot(String root) { this.root = root; }
        public List<String> getAllowedOperations() { return allowedOperations; }
        public void setAllowedOperations(List<String> allowedOperations) { this.allowedOperations = allowedOperations; }
        public List<String> getExclusions() { return exclusions; }
        public void setExclusions(List<String> exclusions) { this.exclusions = exclusions; }
    }

    public static class Monitor {
        private Duration sampleInterval = Duration.ofMillis(100);
        private Duration joinTimeout = Duration.ofSeconds(2);
        private int logCapacity = 1000;
        private int activityCapacity = 1000;

        public Duration getSampleInterval() { return sampleInterval; }
        public void setSampleInterval(Duration sampleInterval) { this.sampleInterval = sampleInterval; }
        public Duration getJoinTimeout() { return joinTimeout; }
        public void setJoinTimeout(Duration joinTimeout) { this.joinTimeout = joinTimeout; }
        public int getLogCapacity() { return logCapacity; }
        public void setLogCapacity(int logCapacity) { this.logCapacity = logCapacity; }
        public int getActivityCapacity() { return activityCapacity; }
        public void setActivityCapacity(int activityCapacity) { this.activityCapacity = activityCapacity; }
    }

    public static class Tasks {
        private Duration staleAfter = Duration.ofMinutes(5);
        private Duration sweepInterval = Duration.ofMinutes(1);
        private Duration pollInterval = Duration.ofSeconds(1);
        private String workerAgentId = "remediator";
        private Duration testTimeout = Duration.ofMinutes(5);
        /** Completed and failed tasks kept for listing; older ones are dropped. */
        private int retainFinished = 1000;

        public Duration getStaleAfter() { return staleAfter; }
        public void setStaleAfter(Duration staleAfter) { this.staleAfter = staleAfter; }
        public Duration getSweepInterval() { return sweepInterval; }
        public void setSweepInterval(Duration sweepInterval) { this.sweepInterval = sweepInterval; }
        public Duration getPollInterval() { return pollInterval; }
        public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
        public String getWorkerAgentId() { return workerAgentId; }
        public void setWorkerAgentId(String workerAgentId) { this.workerAgentId = workerAgentId; }
        public Duration getTestTimeout() { return testTimeout; }
        public void setTestTimeout(Duration testTimeout) { this.testTimeout = testTimeout; }
        public int getRetainFinished() { return retainFinished; }
        public void setRetainFinished(int retainFinished) { this.retainFinished = retainFinished; }
    }

    public static class Errors {
        private int maxRetries = 3;

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
    }

    public static class Reports {
        /** Resolved against the project root when relative. */
        private String directory = ".mendwatch/reports";

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }
    }

    public static class Watcher {
        private Duration debounce = Duration.ofMillis(500);

        public Duration getDebounce() { return debounce; }
        public void setDebounce(Duration debounce) { this.debounce = debounce; }
    }
}
