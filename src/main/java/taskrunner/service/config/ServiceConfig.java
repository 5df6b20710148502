package taskrunner.service.config;

import java.time.Duration;
import java.util.Map;

/**
 * Configuration holder for the task runner service.
 * All settings have sensible defaults.
 */
public final class ServiceConfig {

    // Server settings
    private int serverPort = 3000;
    private String serverHost = "0.0.0.0";

    // Simulated work
    private Duration simulatedDuration = Duration.ofMillis(500);
    private int errorPercentage = 20;

    // Retry settings
    private Duration retryDelay = Duration.ofMillis(1000);
    private int maxAttempts = 3;

    // Worker pool
    private Duration workerIdleTimeout = Duration.ofMillis(5000);
    private int workerPoolSize = Math.max(1, Runtime.getRuntime().availableProcessors());

    // Attempt log
    private String logPath = "./logs/task_service.log";
    private Duration statisticsLogInterval = Duration.ofSeconds(10);

    private ServiceConfig() {
    }

    public static ServiceConfig defaults() {
        return new ServiceConfig();
    }

    public static ServiceConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    /**
     * Build a config from an environment map. Unset or blank variables keep their defaults.
     *
     * @throws IllegalArgumentException if a variable is not a number or out of range
     */
    public static ServiceConfig fromEnv(Map<String, String> env) {
        ServiceConfig config = new ServiceConfig();

        Integer port = intVar(env, "SERVER_PORT");
        if (port != null) {
            config.serverPort = port;
        }

        Integer duration = intVar(env, "TASK_SIMULATED_DURATION");
        if (duration != null) {
            config.simulatedDuration = Duration.ofMillis(duration);
        }

        Integer errorPercentage = intVar(env, "TASK_SIMULATED_ERROR_PERCENTAGE");
        if (errorPercentage != null) {
            config.errorPercentage = errorPercentage;
        }

        Integer retryDelay = intVar(env, "TASK_ERROR_RETRY_DELAY");
        if (retryDelay != null) {
            config.retryDelay = Duration.ofMillis(retryDelay);
        }

        Integer idleTimeout = intVar(env, "WORKER_TIMEOUT");
        if (idleTimeout != null) {
            config.workerIdleTimeout = Duration.ofMillis(idleTimeout);
        }

        Integer maxAttempts = intVar(env, "TASK_MAX_RETRIES");
        if (maxAttempts != null) {
            config.maxAttempts = maxAttempts;
        }

        Integer poolSize = intVar(env, "WORKER_POOL_SIZE");
        if (poolSize != null) {
            config.workerPoolSize = poolSize;
        }

        String logPath = env.get("LOG_PATH");
        if (logPath != null && !logPath.isBlank()) {
            config.logPath = logPath;
        }

        Integer statsInterval = intVar(env, "STATISTICS_LOG_INTERVAL");
        if (statsInterval != null) {
            config.statisticsLogInterval = Duration.ofMillis(statsInterval);
        }

        return config.validate();
    }

    private static Integer intVar(Map<String, String> env, String name) {
        String value = env.get(name);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer, got '" + value + "'", e);
        }
    }

    /**
     * Check that all values are in range.
     *
     * @return this config
     * @throws IllegalArgumentException on the first invalid value
     */
    public ServiceConfig validate() {
        if (serverPort < 0 || serverPort > 65535) {
            throw new IllegalArgumentException("SERVER_PORT must be in 0..65535");
        }
        if (simulatedDuration.isNegative()) {
            throw new IllegalArgumentException("TASK_SIMULATED_DURATION must not be negative");
        }
        if (errorPercentage < 0 || errorPercentage > 100) {
            throw new IllegalArgumentException("TASK_SIMULATED_ERROR_PERCENTAGE must be in 0..100");
        }
        if (retryDelay.isNegative()) {
            throw new IllegalArgumentException("TASK_ERROR_RETRY_DELAY must not be negative");
        }
        if (workerIdleTimeout.isNegative() || workerIdleTimeout.isZero()) {
            throw new IllegalArgumentException("WORKER_TIMEOUT must be positive");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("TASK_MAX_RETRIES must be at least 1");
        }
        if (workerPoolSize < 1) {
            throw new IllegalArgumentException("WORKER_POOL_SIZE must be at least 1");
        }
        if (statisticsLogInterval.isNegative()) {
            throw new IllegalArgumentException("STATISTICS_LOG_INTERVAL must not be negative");
        }
        return this;
    }

    // Getters
    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public Duration simulatedDuration() {
        return simulatedDuration;
    }

    public int errorPercentage() {
        return errorPercentage;
    }

    public Duration retryDelay() {
        return retryDelay;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public Duration workerIdleTimeout() {
        return workerIdleTimeout;
    }

    public int workerPoolSize() {
        return workerPoolSize;
    }

    public String logPath() {
        return logPath;
    }

    public Duration statisticsLogInterval() {
        return statisticsLogInterval;
    }

    // Fluent setters for testing/customization
    public ServiceConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public ServiceConfig withSimulatedDuration(Duration duration) {
        this.simulatedDuration = duration;
        return this;
    }

    public ServiceConfig withErrorPercentage(int percentage) {
        this.errorPercentage = percentage;
        return this;
    }

    public ServiceConfig withRetryDelay(Duration delay) {
        this.retryDelay = delay;
        return this;
    }

    public ServiceConfig withMaxAttempts(int attempts) {
        this.maxAttempts = attempts;
        return this;
    }

    public ServiceConfig withWorkerIdleTimeout(Duration timeout) {
        this.workerIdleTimeout = timeout;
        return this;
    }

    public ServiceConfig withWorkerPoolSize(int size) {
        this.workerPoolSize = size;
        return this;
    }

    public ServiceConfig withLogPath(String path) {
        this.logPath = path;
        return this;
    }

    public ServiceConfig withStatisticsLogInterval(Duration interval) {
        this.statisticsLogInterval = interval;
        return this;
    }

    @Override
    public String toString() {
        return "ServiceConfig{" +
                "serverPort=" + serverPort +
                ", simulatedDurationMs=" + simulatedDuration.toMillis() +
                ", errorPercentage=" + errorPercentage +
                ", retryDelayMs=" + retryDelay.toMillis() +
                ", maxAttempts=" + maxAttempts +
                ", workerIdleTimeoutMs=" + workerIdleTimeout.toMillis() +
                ", workerPoolSize=" + workerPoolSize +
                ", logPath='" + logPath + '\'' +
                '}';
    }
}
