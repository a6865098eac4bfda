/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.nosqlbench.progress.listeners;

import io.nosqlbench.progress.ProgressCheck;
import io.nosqlbench.progress.eventing.ProgressListener;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Collects counts and the latest progress snapshot per phase, for monitoring pages and tests.
 *
 * @param <S> the phase type
 */
public class MetricsProgressListener<S> implements ProgressListener<S> {

    public static class PhaseMetrics<S> {
        private final AtomicLong activations = new AtomicLong();
        private final AtomicLong cyclesStarted = new AtomicLong();
        private final AtomicLong checks = new AtomicLong();
        private final AtomicLong readyChecks = new AtomicLong();
        private final AtomicLong transitionsRequested = new AtomicLong();
        private final AtomicLong enteredAt = new AtomicLong();
        private final AtomicLong totalActiveMillis = new AtomicLong();
        private volatile ProgressCheck<S> lastCheck;
        private volatile boolean active;

        public long getActivations() {
            return activations.get();
        }

        public long getCyclesStarted() {
            return cyclesStarted.get();
        }

        public long getChecks() {
            return checks.get();
        }

        public long getReadyChecks() {
            return readyChecks.get();
        }

        public long getTransitionsRequested() {
            return transitionsRequested.get();
        }

        public Optional<ProgressCheck<S>> getLastCheck() {
            return Optional.ofNullable(lastCheck);
        }

        public boolean isActive() {
            return active;
        }

        /**
         * @return milliseconds spent in the phase over all activations, including the current one
         */
        public long getActiveMillis() {
            long total = totalActiveMillis.get();
            if (active) {
                total += Math.max(0, System.currentTimeMillis() - enteredAt.get());
            }
            return total;
        }
    }

    private final Map<S, PhaseMetrics<S>> metricsMap = new ConcurrentHashMap<>();

    @Override
    public void phaseEntered(S phase) {
        PhaseMetrics<S> metrics = metricsFor(phase);
        metrics.activations.incrementAndGet();
        metrics.enteredAt.set(System.currentTimeMillis());
        metrics.active = true;
    }

    @Override
    public void cycleStarted(S phase, long cycle) {
        metricsFor(phase).cyclesStarted.incrementAndGet();
    }

    @Override
    public void progressChecked(ProgressCheck<S> check) {
        PhaseMetrics<S> metrics = metricsFor(check.phase());
        metrics.checks.incrementAndGet();
        if (check.ready()) {
            metrics.readyChecks.incrementAndGet();
        }
        metrics.lastCheck = check;
    }

    @Override
    public void transitionRequested(S from, S to) {
        metricsFor(from).transitionsRequested.incrementAndGet();
    }

    @Override
    public void phaseExited(S phase, long cycles) {
        PhaseMetrics<S> metrics = metricsFor(phase);
        if (metrics.active) {
            metrics.totalActiveMillis.addAndGet(Math.max(0, System.currentTimeMillis() - metrics.enteredAt.get()));
        }
        metrics.active = false;
    }

    public PhaseMetrics<S> getMetrics(S phase) {
        if (phase == null) {
            return null;
        }
        return metricsMap.get(phase);
    }

    public Map<S, PhaseMetrics<S>> getAllMetrics() {
        return new ConcurrentHashMap<>(metricsMap);
    }

    public void clearMetrics() {
        metricsMap.clear();
    }

    public String generateReport() {
        StringBuilder report = new StringBuilder();
        report.append("=== Phase Progress Report ===\n");
        for (Map.Entry<S, PhaseMetrics<S>> entry : metricsMap.entrySet()) {
            PhaseMetrics<S> metrics = entry.getValue();
            report.append("  - ").append(entry.getKey()).append(":\n");
            report.append("    Activations: ").append(metrics.getActivations()).append("\n");
            report.append("    Cycles: ").append(metrics.getCyclesStarted()).append("\n");
            report.append("    Transitions requested: ").append(metrics.getTransitionsRequested()).append("\n");
            report.append("    Time active: ").append(metrics.getActiveMillis()).append(" ms\n");
            metrics.getLastCheck().ifPresent(check ->
                report.append("    Last progress: ").append(check.complete()).append("\n"));
            report.append("    Status: ").append(metrics.isActive() ? "Active" : "Inactive").append("\n");
        }
        return report.toString();
    }

    private PhaseMetrics<S> metricsFor(S phase) {
        return metricsMap.computeIfAbsent(phase, p -> new PhaseMetrics<>());
    }
}
