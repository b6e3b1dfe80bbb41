package com.debtchecker.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "debt-checker")
@Data
public class DebtCheckerProperties {

    private Api api = new Api();
    private Retry retry = new Retry();
    private Throttle throttle = new Throttle();
    private Checkpoint checkpoint = new Checkpoint();
    private Cancellation cancellation = new Cancellation();
    private Input input = new Input();
    private Output output = new Output();
    private Policy policy = new Policy();

    /** Size of the lookup worker pool. */
    private int workerCount = 20;

    private boolean runOnStartup = true;
    private boolean exitOnCompletion = true;

    @Data
    public static class Api {
        private String baseUrl = "https://api-cloud.ru/api/fssp.php";
        private String token;
        private Duration timeout = Duration.ofSeconds(60);
        private Duration connectTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Retry {
        private int maxAttempts = 5;
        private Duration initialBackoff = Duration.ofMillis(500);
        private double multiplier = 2.0;
        private double jitterFactor = 0.5;
        private Duration maxBackoff = Duration.ofSeconds(30);
    }

    @Data
    public static class Throttle {
        private int maxConcurrent = 20;
        private int requestsPerPeriod = 2;
        private Duration refreshPeriod = Duration.ofSeconds(1);
    }

    @Data
    public static class Checkpoint {
        private String dir = "temp_files";
        /** Snapshot after this many completions... */
        private int intervalCompletions = 10;
        /** ...or after this much time since the previous snapshot, whichever comes first. */
        private Duration interval = Duration.ofSeconds(30);
        private boolean resume = true;
        private int progressLogEvery = 50;
    }

    @Data
    public static class Cancellation {
        /** How long in-flight lookups may keep running once a cancel is requested. */
        private Duration gracePeriod = Duration.ofSeconds(30);
    }

    @Data
    public static class Input {
        private String file = "numbers.csv";
        private String identifierColumn = "number";
        private String amountColumn = "Debt Amount";
    }

    @Data
    public static class Output {
        private String file = "numbers_with_debt.csv";
        private boolean includeHeader = true;
    }

    @Data
    public static class Policy {
        private DuplicatePolicy duplicates = DuplicatePolicy.PROCESS_EACH;
        private KnownAmountPolicy knownAmounts = KnownAmountPolicy.SKIP;

        public enum DuplicatePolicy {
            PROCESS_EACH, DEDUPLICATE
        }

        public enum KnownAmountPolicy {
            SKIP, REVERIFY
        }
    }

    @PostConstruct
    public void validate() {
        requirePositive(workerCount, "debt-checker.worker-count");
        requirePositive(retry.getMaxAttempts(), "debt-checker.retry.max-attempts");
        requirePositive(throttle.getMaxConcurrent(), "debt-checker.throttle.max-concurrent");
        requirePositive(throttle.getRequestsPerPeriod(), "debt-checker.throttle.requests-per-period");
        requirePositive(checkpoint.getIntervalCompletions(), "debt-checker.checkpoint.interval-completions");
        requirePositive(checkpoint.getProgressLogEvery(), "debt-checker.checkpoint.progress-log-every");
        if (retry.getMultiplier() < 1.0) {
            throw new IllegalStateException("debt-checker.retry.multiplier must be >= 1.0, got " + retry.getMultiplier());
        }
        if (retry.getJitterFactor() < 0.0 || retry.getJitterFactor() >= 1.0) {
            throw new IllegalStateException("debt-checker.retry.jitter-factor must be in [0, 1), got " + retry.getJitterFactor());
        }
        if (api.getTimeout().isNegative() || api.getTimeout().isZero()) {
            throw new IllegalStateException("debt-checker.api.timeout must be positive");
        }
    }

    private static void requirePositive(int value, String name) {
        if (value < 1) {
            throw new IllegalStateException(name + " must be at least 1, got " + value);
        }
    }
}
