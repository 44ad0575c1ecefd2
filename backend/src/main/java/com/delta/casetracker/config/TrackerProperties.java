package com.delta.casetracker.config;

import com.delta.casetracker.tracker.model.LimitPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "tracker")
public class TrackerProperties {
    private static final String DEFAULT_USER_AGENT = "delta-case-tracker/0.1 (+contact)";

    private Limits limits = new Limits();
    private History history = new History();
    private Fetch fetch = new Fetch();
    private Collector collector = new Collector();
    private Cli cli = new Cli();

    public Limits getLimits() {
        return limits;
    }

    public void setLimits(Limits limits) {
        this.limits = limits;
    }

    public History getHistory() {
        return history;
    }

    public void setHistory(History history) {
        this.history = history;
    }

    public Fetch getFetch() {
        return fetch;
    }

    public void setFetch(Fetch fetch) {
        this.fetch = fetch;
    }

    public Collector getCollector() {
        return collector;
    }

    public void setCollector(Collector collector) {
        this.collector = collector;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Limits {
        private int maxNewPerRun = 10;
        private long maxArtifactSizeBytes = 100L * 1024 * 1024;

        public int getMaxNewPerRun() {
            return Math.max(0, maxNewPerRun);
        }

        public void setMaxNewPerRun(int maxNewPerRun) {
            this.maxNewPerRun = Math.max(0, maxNewPerRun);
        }

        public long getMaxArtifactSizeBytes() {
            return Math.max(1L, maxArtifactSizeBytes);
        }

        public void setMaxArtifactSizeBytes(long maxArtifactSizeBytes) {
            this.maxArtifactSizeBytes = Math.max(1L, maxArtifactSizeBytes);
        }

        public LimitPolicy toPolicy() {
            return new LimitPolicy(getMaxNewPerRun(), getMaxArtifactSizeBytes());
        }
    }

    public static class History {
        private String path = "data/case-history.json";
        private boolean cleanupTempFilesOnStartup = true;

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public boolean isCleanupTempFilesOnStartup() {
            return cleanupTempFilesOnStartup;
        }

        public void setCleanupTempFilesOnStartup(boolean cleanupTempFilesOnStartup) {
            this.cleanupTempFilesOnStartup = cleanupTempFilesOnStartup;
        }
    }

    public static class Fetch {
        private int concurrency = 4;
        private String baseUrl = "";
        private String artifactDir = "artifacts";
        private int requestTimeoutSeconds = 30;
        private String userAgent;

        public int getConcurrency() {
            return Math.max(1, concurrency);
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = Math.max(1, concurrency);
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getArtifactDir() {
            return artifactDir;
        }

        public void setArtifactDir(String artifactDir) {
            this.artifactDir = artifactDir;
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }

        public String getUserAgent() {
            return normalizeUserAgent(userAgent);
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = normalizeUserAgent(userAgent);
        }
    }

    public static class Collector {
        private String snapshotCsv = "data/snapshot.csv";

        public String getSnapshotCsv() {
            return snapshotCsv;
        }

        public void setSnapshotCsv(String snapshotCsv) {
            this.snapshotCsv = snapshotCsv;
        }
    }

    public static class Cli {
        private boolean run;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
