package com.eyelevel.invoiceingestion.config;

import com.eyelevel.invoiceingestion.model.SourceKind;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Binds application properties under the "app.ingestion" prefix to a strongly-typed
 * configuration object. This provides centralized control over source polling, retention,
 * queue discipline and notification throughput.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.ingestion")
public class IngestionProperties {

    public static final Set<Integer> ALLOWED_POLLING_FREQUENCIES = Set.of(5, 10, 15, 30, 60, 120, 240, 360, 720, 1440);

    /**
     * Days after which soft-deleted documents may be uploaded again and old documents are cleaned up.
     * {@code null} or a value of zero or less means unlimited.
     */
    private Integer retentionDays;

    @NotBlank
    private String stagingDir = System.getProperty("java.io.tmpdir") + "/invoice-ingestion/staging";

    @Valid
    private Source source = new Source();

    @Valid
    private Remote remote = new Remote();

    @Valid
    private Extraction extraction = new Extraction();

    private Map<String, QueueOverride> queues = new HashMap<>();

    @Valid
    private Notification notification = new Notification();

    @Valid
    private Health health = new Health();

    @Data
    public static class Source {
        private boolean enabled;

        @NotNull
        private SourceKind kind = SourceKind.LOCAL;

        private int pollingFrequencyMinutes = 15;

        @Min(0)
        private long minimumFileAgeMs = 30_000L;

        /**
         * Files whose document was created within this window under the same name are skipped.
         */
        @Min(0)
        private long recentlyProcessedWindowMs = 3_600_000L;

        private Set<String> extensions = Set.of("pdf", "xlsx", "xls");

        @NotBlank
        private String rootPath = "./data/ingestion";

        private FolderStructure folders = new FolderStructure();

        /**
         * When set, each listed sub-folder of {@link #rootPath} is scanned with its own folder structure.
         */
        private boolean multiFolder;

        private List<String> subFolders = new ArrayList<>();

        @AssertTrue(message = "pollingFrequencyMinutes must be one of 5, 10, 15, 30, 60, 120, 240, 360, 720, 1440")
        public boolean isPollingFrequencySupported() {
            return ALLOWED_POLLING_FREQUENCIES.contains(pollingFrequencyMinutes);
        }
    }

    @Data
    public static class FolderStructure {
        private String unprocessed = "unprocessed";
        private String processed = "processed";
        private String failed = "failed";
    }

    @Data
    public static class Remote {
        private String host;
        private int port;
        private String username;
        private String password;
        private boolean passiveMode = true;
        private int connectTimeoutMs = 30_000;

        /**
         * SSH known-hosts file used to verify SFTP servers. Host key checking is disabled when unset.
         */
        private String knownHostsFile;
        private RetryConfig retry = new RetryConfig();
    }

    @Data
    public static class RetryConfig {
        private int attempts = 2;
        private long delayMs = 1_000L;
    }

    @Data
    public static class Extraction {
        @Min(1)
        private int pageCacheSize = 64;
    }

    /**
     * Per-queue overrides. Any field left unset falls back to the queue's built-in default.
     */
    @Data
    public static class QueueOverride {
        private Integer concurrency;
        private Long lockDurationMs;
        private Long stalledIntervalMs;
        private Integer maxStalledCount;
        private Integer attempts;
        private Long backoffDelayMs;
    }

    @Data
    public static class Notification {
        private String defaultProvider = "smtp";
        private String fromAddress = "no-reply@localhost";
        private Map<String, ProviderLimit> providers = new HashMap<>();
    }

    @Data
    public static class ProviderLimit {
        @Min(1)
        private int capacity;
        @Min(1)
        private long refreshPeriodMs;
        @Min(0)
        private long timeoutMs = 120_000L;
    }

    @Data
    public static class Health {
        private int waitingAlertThreshold = 100;
        private int failedAlertDelta = 10;
        private long heartbeatTtlMs = 60_000L;
        private long completedRetentionMs = 3_600_000L;
        private int completedKeepCount = 100;
        private long failedRetentionMs = 86_400_000L;
    }
}
