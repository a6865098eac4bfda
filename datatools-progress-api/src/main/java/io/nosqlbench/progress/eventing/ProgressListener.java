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

package io.nosqlbench.progress.eventing;

import io.nosqlbench.progress.ProgressCheck;
import io.nosqlbench.progress.ProgressTracker;
import io.nosqlbench.progress.listeners.LoggingProgressListener;
import io.nosqlbench.progress.listeners.MetricsProgressListener;

/**
 * Receives lifecycle and progress events from a {@link ProgressTracker}. Listeners are the
 * hook for progress bars, monitoring and logging; they observe progress but never change it.
 *
 * <p>Events for one activation of a phase arrive in this order:
 * <ol>
 *   <li>{@link #phaseEntered} once</li>
 *   <li>per cycle: {@link #cycleStarted}, then {@link #progressChecked} when the decision runs,
 *       then {@link #transitionRequested} if the phase is complete and has a next phase</li>
 *   <li>{@link #phaseExited} once</li>
 * </ol>
 *
 * <p>Events are delivered on the thread that drives the tracker (the host's cycle loop), while
 * the tracker holds its lifecycle lock. A listener that throws is logged and skipped; the
 * remaining listeners still receive the event.
 *
 * <p>Available implementations:
 * <ul>
 *   <li>{@link LoggingProgressListener} - writes events to a Log4j 2 logger</li>
 *   <li>{@link MetricsProgressListener} - counts cycles and keeps the latest snapshot</li>
 * </ul>
 *
 * @param <S> the phase type
 * @see ProgressTracker#addListener(ProgressListener)
 */
public interface ProgressListener<S> {

    /**
     * Called after the transition decision of a cycle has read the aggregate.
     *
     * @param check the snapshot and outcome of the decision
     */
    void progressChecked(ProgressCheck<S> check);

    /**
     * Called when the tracked phase is entered and its counter was created.
     *
     * @param phase the tracked phase
     */
    default void phaseEntered(S phase) {
        // No-op by default
    }

    /**
     * Called after the running totals were reset for a new cycle.
     *
     * @param phase the tracked phase
     * @param cycle the number of the cycle that is starting
     */
    default void cycleStarted(S phase, long cycle) {
        // No-op by default
    }

    /**
     * Called just before the tracker asks the host to move to the next phase.
     *
     * @param from the completed phase
     * @param to the requested next phase
     */
    default void transitionRequested(S from, S to) {
        // No-op by default
    }

    /**
     * Called when the tracked phase has exited and its counter is gone.
     *
     * @param phase the tracked phase
     * @param cycles how many cycles ran while the phase was active
     */
    default void phaseExited(S phase, long cycles) {
        // No-op by default
    }
}
