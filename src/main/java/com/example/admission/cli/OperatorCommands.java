package com.example.admission.cli;

import com.example.admission.circuit.CircuitBreakerRegistry;
import com.example.admission.circuit.CircuitBreakerSnapshot;
import com.example.admission.circuit.CircuitState;
import com.example.admission.exception.AdmissionException;
import com.example.admission.model.EnvironmentQuotaStatus;
import com.example.admission.model.GlobalQuotaStatus;
import com.example.admission.model.HealthReport;
import com.example.admission.model.HealthStatus;
import com.example.admission.model.QuotaStatusReport;
import com.example.admission.quota.QuotaManager;
import com.example.admission.ratelimit.RateLimiterRegistry;
import com.example.admission.recovery.ErrorRecoveryManager;
import com.example.admission.recovery.RecoveryStatistics;
import com.example.admission.retry.ShutdownSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.time.Duration;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Operator commands, run instead of the web server when the application is started with
 * {@code quota ...} or {@code resilience ...}.
 * <p>
 * Exit codes: {@value #OK} success, {@value #FAILURE} bad usage or failed operation,
 * {@value #CRITICAL} the reported state is denied or critical (quota exhausted, UNHEALTHY, open circuits).
 */
@Component
public class OperatorCommands implements ApplicationRunner, ExitCodeGenerator {

    public static final int OK = 0;
    public static final int FAILURE = 1;
    public static final int CRITICAL = 2;

    static final Duration WATCH_INTERVAL = Duration.ofSeconds(5);

    private static final Logger log = LoggerFactory.getLogger(OperatorCommands.class);

    private final QuotaManager quotaManager;
    private final CircuitBreakerRegistry circuitBreakers;
    private final RateLimiterRegistry rateLimiters;
    private final ErrorRecoveryManager recoveryManager;
    private final ShutdownSignal shutdownSignal;

    private volatile int exitCode = OK;

    public OperatorCommands(QuotaManager quotaManager,
                            CircuitBreakerRegistry circuitBreakers,
                            RateLimiterRegistry rateLimiters,
                            ErrorRecoveryManager recoveryManager,
                            ShutdownSignal shutdownSignal) {
        this.quotaManager = quotaManager;
        this.circuitBreakers = circuitBreakers;
        this.rateLimiters = rateLimiters;
        this.recoveryManager = recoveryManager;
        this.shutdownSignal = shutdownSignal;
    }

    public static boolean isOperatorCommand(String[] args) {
        return args.length > 0 && isCommandGroup(args[0]);
    }

    private static boolean isCommandGroup(String word) {
        return "quota".equals(word) || "resilience".equals(word);
    }

    /**
     * Runs the operator command named by the non-option arguments, if any; a plain service
     * start passes through untouched.
     */
    @Override
    public void run(ApplicationArguments args) {
        List<String> command = args.getNonOptionArgs();
        if (command.isEmpty() || !isCommandGroup(command.get(0))) {
            return;
        }
        exitCode = execute(args, System.out);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    public int execute(ApplicationArguments args, PrintStream out) {
        List<String> command = args.getNonOptionArgs();
        if (command.size() < 2) {
            return usage(out);
        }
        try {
            Map<String, String> options = options(args);
            if ("quota".equals(command.get(0))) {
                return quota(command.get(1), options, out);
            }
            if ("resilience".equals(command.get(0))) {
                return resilience(command.get(1), options, out);
            }
            return usage(out);
        } catch (IllegalArgumentException ex) {
            out.println("Error: " + ex.getMessage());
            return FAILURE;
        } catch (AdmissionException ex) {
            log.error("Operator command {} failed", command, ex);
            out.println("Error: " + ex.getMessage() + " (correlationId=" + ex.getCorrelationId() + ")");
            return FAILURE;
        }
    }

    private int quota(String command, Map<String, String> options, PrintStream out) {
        switch (command) {
            case "status":
                if (options.containsKey("watch")) {
                    return watchQuota(options.get("environment"), out);
                }
                return printQuota(options.get("environment"), out);
            case "allocate": {
                String environment = required(options, "environment");
                long amount = parseAmount(required(options, "amount"));
                EnvironmentQuotaStatus status = quotaManager.allocate(environment, amount);
                out.printf("Allocated %d to %s for %s%n", status.getAllocated(), environment, quotaManager.today());
                return OK;
            }
            case "reset": {
                String environment = options.get("environment");
                quotaManager.reset(environment);
                out.printf("Quota usage reset for %s (%s)%n", environment == null ? "all environments" : environment,
                        quotaManager.today());
                return OK;
            }
            default:
                return usage(out);
        }
    }

    private int watchQuota(String environment, PrintStream out) {
        int code = printQuota(environment, out);
        try {
            while (!shutdownSignal.await(WATCH_INTERVAL)) {
                out.println();
                code = printQuota(environment, out);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
        return code;
    }

    private int printQuota(String environment, PrintStream out) {
        if (environment != null) {
            EnvironmentQuotaStatus status = quotaManager.getUsageStatus(environment);
            GlobalQuotaStatus global = quotaManager.getGlobalStatus();
            out.printf("%s quota for %s on %s%n", quotaManager.getProvider(), environment, quotaManager.today());
            printEnvironment(status, out);
            printGlobal(global, out);
            if (global.isExhausted()) {
                out.println("Quota exhausted, retry after the next UTC day boundary");
                return CRITICAL;
            }
            return OK;
        }
        QuotaStatusReport report = quotaManager.getStatusReport();
        out.printf("%s quota on %s%n", report.getProvider(), report.getDay());
        for (EnvironmentQuotaStatus status : report.getEnvironments()) {
            printEnvironment(status, out);
        }
        printGlobal(report.getGlobal(), out);
        if (report.getGlobal().isExhausted()) {
            out.println("Quota exhausted, retry after the next UTC day boundary");
            return CRITICAL;
        }
        return OK;
    }

    private static void printEnvironment(EnvironmentQuotaStatus status, PrintStream out) {
        out.printf("  %-8s used %4d / %4d  available %4d  priority %d%n", status.getEnvironment(), status.getUsed(),
                status.getAllocated(), status.getAvailable(), status.getPriority());
    }

    private static void printGlobal(GlobalQuotaStatus global, PrintStream out) {
        out.printf("  %-8s used %4d / %4d  available %4d%n", "global", global.getGlobalUsed(),
                global.getTotalDailyLimit(), global.getGlobalAvailable());
    }

    private int resilience(String command, Map<String, String> options, PrintStream out) {
        switch (command) {
            case "status":
                return printBreakers(out);
            case "health":
                return printHealth(out);
            case "reset": {
                String name = options.get("name");
                if (name == null) {
                    circuitBreakers.resetAll();
                    recoveryManager.resetStatistics();
                    out.println("All circuit breakers and recovery statistics reset");
                    return OK;
                }
                if (!circuitBreakers.reset(name)) {
                    out.println("Unknown circuit breaker: " + name);
                    return FAILURE;
                }
                out.println("Circuit breaker " + name + " reset");
                return OK;
            }
            case "recovery":
                return printRecovery(out);
            default:
                return usage(out);
        }
    }

    private int printBreakers(PrintStream out) {
        Map<String, CircuitBreakerSnapshot> snapshots = circuitBreakers.snapshots();
        if (snapshots.isEmpty()) {
            out.println("No circuit breakers registered");
        }
        boolean anyOpen = false;
        for (CircuitBreakerSnapshot snapshot : snapshots.values()) {
            out.printf("  %-24s %-9s calls %d  failures %d  opened %d  failure rate %.1f%%%n", snapshot.getName(),
                    snapshot.getState(), snapshot.getTotalCalls(), snapshot.getTotalFailures(),
                    snapshot.getOpenedCount(), snapshot.getFailureRate() * 100);
            anyOpen |= snapshot.getState() == CircuitState.OPEN;
        }
        rateLimiters.usage().forEach((provider, usage) -> out.printf("  rate limit %-13s %s%n", provider, usage));
        return anyOpen ? CRITICAL : OK;
    }

    private int printHealth(PrintStream out) {
        HealthReport report = circuitBreakers.health();
        out.printf("Health: %s (score %.1f, %d/%d breakers closed)%n", report.getStatus(), report.getScore(),
                report.getHealthy(), report.getTotalBreakers());
        for (String recommendation : report.getRecommendations()) {
            out.println("  - " + recommendation);
        }
        return report.getStatus() == HealthStatus.UNHEALTHY ? CRITICAL : OK;
    }

    private int printRecovery(PrintStream out) {
        Map<String, RecoveryStatistics> statistics = recoveryManager.getStatistics();
        if (statistics.isEmpty()) {
            out.println("No recoveries attempted");
            return OK;
        }
        statistics.forEach((operation, stats) -> out.printf("  %-24s attempts %d  recovered %d  failed %d  strategies %s%n",
                operation, stats.getTotalAttempts(), stats.getSuccessfulRecoveries(), stats.getFailedRecoveries(),
                stats.getStrategyAttempts()));
        return OK;
    }

    /**
     * Accepts both {@code --name=value} and {@code --name value}; {@code --watch} is a flag.
     */
    private static Map<String, String> options(ApplicationArguments args) {
        Map<String, String> options = new HashMap<>();
        List<String> source = Arrays.asList(args.getSourceArgs());
        for (String name : args.getOptionNames()) {
            List<String> values = args.getOptionValues(name);
            if (!values.isEmpty()) {
                options.put(name, values.get(values.size() - 1));
            } else if ("watch".equals(name)) {
                options.put(name, "true");
            } else {
                int at = source.indexOf("--" + name);
                if (at < 0 || at + 1 >= source.size() || source.get(at + 1).startsWith("--")) {
                    throw new IllegalArgumentException("Missing value for --" + name);
                }
                options.put(name, source.get(at + 1));
            }
        }
        return options;
    }

    private static String required(Map<String, String> options, String name) {
        String value = options.get(name);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("--" + name + " is required");
        }
        return value;
    }

    private static long parseAmount(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("--amount must be a number: " + value);
        }
    }

    private static int usage(PrintStream out) {
        out.println("Usage:");
        out.println("  quota status [--environment NAME] [--watch]");
        out.println("  quota allocate --environment NAME --amount N");
        out.println("  quota reset [--environment NAME]");
        out.println("  resilience status|health|recovery");
        out.println("  resilience reset [--name BREAKER]");
        return FAILURE;
    }
}
