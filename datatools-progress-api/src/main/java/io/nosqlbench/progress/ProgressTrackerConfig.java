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

package io.nosqlbench.progress;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration of a {@link ProgressTracker}: which phase to track and,
 * optionally, which phase to continue to once all progress in it is complete.
 *
 * <pre>{@code
 * ProgressTrackerConfig<AppState> loading =
 *     ProgressTrackerConfig.forPhase(AppState.LOADING).continueTo(AppState.RUNNING);
 *
 * // readiness is observable, but no automatic transition happens
 * ProgressTrackerConfig<AppState> splash = ProgressTrackerConfig.forPhase(AppState.SPLASH);
 * }</pre>
 *
 * <p>Configurations can also be read from YAML with
 * {@link io.nosqlbench.progress.config.ProgressConfigLoader}.
 *
 * @param <S> the phase type
 */
public final class ProgressTrackerConfig<S> {

    private final S phase;
    private final S nextPhase;

    private ProgressTrackerConfig(S phase, S nextPhase) {
        this.phase = Objects.requireNonNull(phase, "phase");
        this.nextPhase = nextPhase;
    }

    /**
     * Creates a configuration tracking progress during the given phase.
     *
     * @param phase the phase during which progress is tracked
     * @param <S> the phase type
     * @return a configuration without a next phase
     */
    public static <S> ProgressTrackerConfig<S> forPhase(S phase) {
        return new ProgressTrackerConfig<>(phase, null);
    }

    /**
     * Returns a copy of this configuration that moves on to {@code nextPhase} as soon as
     * all progress in the tracked phase is complete.
     *
     * @param nextPhase the phase to transition to
     * @return the new configuration
     */
    public ProgressTrackerConfig<S> continueTo(S nextPhase) {
        return new ProgressTrackerConfig<>(phase, Objects.requireNonNull(nextPhase, "nextPhase"));
    }

    public S getPhase() {
        return phase;
    }

    public Optional<S> getNextPhase() {
        return Optional.ofNullable(nextPhase);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ProgressTrackerConfig<?> that)) {
            return false;
        }
        return phase.equals(that.phase) && Objects.equals(nextPhase, that.nextPhase);
    }

    @Override
    public int hashCode() {
        return Objects.hash(phase, nextPhase);
    }

    @Override
    public String toString() {
        return nextPhase == null ? "track(" + phase + ")" : "track(" + phase + " -> " + nextPhase + ")";
    }
}
