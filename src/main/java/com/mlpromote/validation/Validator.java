package com.mlpromote.validation;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mlpromote.serving.ServingEndpointHandle;

/**
 * Runs a validation suite against a live endpoint. Each check runs in isolation: a check that
 * throws is recorded as failed and the remaining checks still run.
 */
public class Validator {
    private static final Logger log = LoggerFactory.getLogger(Validator.class);
    static final String DEFAULT_SUITE_RESOURCE = "/suites/default-suite.json";

    private final EndpointInvoker invoker;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    public Validator(EndpointInvoker invoker) {
        this(invoker, Clock.systemUTC());
    }

    public Validator(EndpointInvoker invoker, Clock clock) {
        this.invoker = Objects.requireNonNull(invoker, "invoker");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.objectMapper = new ObjectMapper();
    }

    public ValidationReport run(ServingEndpointHandle endpoint, ValidationSuite suite) {
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(suite, "suite");
        Instant startedAt = clock.instant();

        List<CheckResult> checkResults = new ArrayList<>();
        Tally total = new Tally();
        for (ValidationSuite.CheckDefinition check : suite.checks()) {
            checkResults.add(runIsolated(endpoint, suite, check, total));
        }

        ValidationMetrics metrics = new ValidationMetrics(
                LatencyPercentiles.percentile(total.latencies, 50),
                LatencyPercentiles.percentile(total.latencies, 95),
                LatencyPercentiles.percentile(total.latencies, 99),
                LatencyPercentiles.mean(total.latencies),
                total.labeled == 0 ? 0.0 : (double) total.correct / total.labeled,
                total.invocations == 0 ? 0.0 : (double) total.failures / total.invocations,
                total.invocations);
        boolean passed = !checkResults.isEmpty() && checkResults.stream().allMatch(CheckResult::passed);

        log.info("validation.completed suite={} endpoint={} passed={} checks={} p95Ms={} accuracy={} errorRate={}",
                suite.name(),
                endpoint.endpointName(),
                passed,
                checkResults.size(),
                String.format(Locale.ROOT, "%.2f", metrics.p95LatencyMs()),
                String.format(Locale.ROOT, "%.4f", metrics.accuracy()),
                String.format(Locale.ROOT, "%.4f", metrics.errorRate()));
        return new ValidationReport(suite.name(), endpoint.endpointName(), passed, metrics, checkResults, startedAt, clock.instant());
    }

    /**
     * Reads a suite from JSON. Without a path, or when the path does not exist, the suite bundled
     * on the classpath is used.
     */
    public ValidationSuite loadSuite(Path suitePath) throws IOException {
        if (suitePath == null) {
            return loadDefaultSuite();
        }
        if (!Files.exists(suitePath)) {
            log.warn("validation.suite.missing path={} fallback={}", suitePath, DEFAULT_SUITE_RESOURCE);
            return loadDefaultSuite();
        }
        return objectMapper.readValue(suitePath.toFile(), ValidationSuite.class);
    }

    public ValidationSuite loadDefaultSuite() throws IOException {
        try (InputStream in = Validator.class.getResourceAsStream(DEFAULT_SUITE_RESOURCE)) {
            if (in == null) {
                throw new IOException("Default validation suite " + DEFAULT_SUITE_RESOURCE + " not found on the classpath");
            }
            return objectMapper.readValue(in, ValidationSuite.class);
        }
    }

    private CheckResult runIsolated(
            ServingEndpointHandle endpoint,
            ValidationSuite suite,
            ValidationSuite.CheckDefinition check,
            Tally total) {
        Tally tally = new Tally();
        try {
            CheckResult result = switch (check.type()) {
                case FUNCTIONAL -> functional(endpoint, suite, check, tally);
                case LATENCY -> latency(endpoint, suite, check, tally);
                case ACCURACY -> accuracy(endpoint, suite, check, tally);
            };
            total.add(tally);
            return result;
        } catch (RuntimeException e) {
            log.warn("validation.check.aborted check={} endpoint={} reason={}", check.id(), endpoint.endpointName(), e.getMessage(), e);
            total.add(tally);
            return new CheckResult(check.id(), check.type(), false, tally.invocations, tally.failures,
                    "check aborted: " + e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private CheckResult functional(
            ServingEndpointHandle endpoint,
            ValidationSuite suite,
            ValidationSuite.CheckDefinition check,
            Tally tally) {
        if (suite.samples().isEmpty()) {
            return new CheckResult(check.id(), check.type(), false, 0, 0, "suite has no samples");
        }
        int blank = 0;
        for (int round = 0; round < check.repetitions(); round++) {
            for (ValidationSuite.Sample sample : suite.samples()) {
                InvocationResult result = invoke(endpoint, sample, tally);
                if (result != null && (result.prediction() == null || result.prediction().isBlank())) {
                    blank++;
                }
            }
        }
        boolean passed = tally.failures == 0 && blank == 0;
        String detail = passed
                ? "all " + tally.invocations + " invocations answered"
                : "failed invocations=" + tally.failures + ", blank predictions=" + blank;
        return new CheckResult(check.id(), check.type(), passed, tally.invocations, tally.failures, detail);
    }

    private CheckResult latency(
            ServingEndpointHandle endpoint,
            ValidationSuite suite,
            ValidationSuite.CheckDefinition check,
            Tally tally) {
        if (suite.samples().isEmpty()) {
            return new CheckResult(check.id(), check.type(), false, 0, 0, "suite has no samples");
        }
        for (int round = 0; round < check.repetitions(); round++) {
            for (ValidationSuite.Sample sample : suite.samples()) {
                invoke(endpoint, sample, tally);
            }
        }
        double p95 = LatencyPercentiles.percentile(tally.latencies, 95);
        List<String> problems = new ArrayList<>();
        if (tally.failures > 0) {
            problems.add("failed invocations=" + tally.failures);
        }
        if (check.maxP95LatencyMs() != null && p95 > check.maxP95LatencyMs()) {
            problems.add(String.format(Locale.ROOT, "p95=%.2fms exceeds %.2fms", p95, check.maxP95LatencyMs()));
        }
        String detail = problems.isEmpty()
                ? String.format(Locale.ROOT, "p95=%.2fms over %d invocations", p95, tally.invocations)
                : String.join(", ", problems);
        return new CheckResult(check.id(), check.type(), problems.isEmpty(), tally.invocations, tally.failures, detail);
    }

    private CheckResult accuracy(
            ServingEndpointHandle endpoint,
            ValidationSuite suite,
            ValidationSuite.CheckDefinition check,
            Tally tally) {
        List<ValidationSuite.Sample> labeled = suite.labeledSamples();
        if (labeled.isEmpty()) {
            return new CheckResult(check.id(), check.type(), false, 0, 0, "suite has no labeled samples");
        }
        for (int round = 0; round < check.repetitions(); round++) {
            for (ValidationSuite.Sample sample : labeled) {
                invoke(endpoint, sample, tally);
            }
        }
        double accuracy = (double) tally.correct / tally.labeled;
        boolean passed = check.minAccuracy() == null || accuracy >= check.minAccuracy();
        String detail = String.format(Locale.ROOT, "accuracy=%.4f (%d/%d)%s",
                accuracy,
                tally.correct,
                tally.labeled,
                check.minAccuracy() == null ? "" : String.format(Locale.ROOT, ", min=%.4f", check.minAccuracy()));
        return new CheckResult(check.id(), check.type(), passed, tally.invocations, tally.failures, detail);
    }

    private InvocationResult invoke(ServingEndpointHandle endpoint, ValidationSuite.Sample sample, Tally tally) {
        tally.invocations++;
        if (sample.labeled()) {
            tally.labeled++;
        }
        if (Thread.currentThread().isInterrupted()) {
            // Validation was abandoned; the remaining invocations count as failures without reaching the endpoint.
            tally.failures++;
            return null;
        }
        try {
            InvocationResult result = invoker.invoke(endpoint, sample.input());
            tally.latencies.add(result.latencyMs());
            if (sample.labeled() && result.prediction() != null && sample.expected().equals(result.prediction().trim())) {
                tally.correct++;
            }
            return result;
        } catch (IOException e) {
            tally.failures++;
            if (e instanceof InterruptedIOException && !(e instanceof SocketTimeoutException)) {
                Thread.currentThread().interrupt();
            }
            log.debug("validation.invocation.failed endpoint={} reason={}", endpoint.endpointName(), e.getMessage());
            return null;
        }
    }

    private static final class Tally {
        private final List<Double> latencies = new ArrayList<>();
        private int invocations;
        private int failures;
        private int labeled;
        private int correct;

        private void add(Tally other) {
            latencies.addAll(other.latencies);
            invocations += other.invocations;
            failures += other.failures;
            labeled += other.labeled;
            correct += other.correct;
        }
    }
}
