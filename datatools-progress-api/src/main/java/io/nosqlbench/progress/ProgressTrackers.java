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

import io.nosqlbench.progress.eventing.ProgressListener;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A set of {@link ProgressTracker}s, one per tracked phase, sharing the same host. The host
 * publishes its phase events to the registry once instead of to every tracker.
 *
 * <pre>{@code
 * ProgressTrackers<AppState> trackers = new ProgressTrackers<>(phases::requestTransition);
 * trackers.register(ProgressTrackerConfig.forPhase(AppState.SPLASH).continueTo(AppState.MENU));
 * trackers.register(ProgressTrackerConfig.forPhase(AppState.LOADING).continueTo(AppState.PLAYING));
 * phases.addListener(trackers);
 *
 * // every cycle
 * trackers.beginCycle();
 * ...
 * trackers.checkProgress();
 * }</pre>
 *
 * <p>Registration is expected during setup, before the host starts publishing events; it is
 * not synchronized against them.
 *
 * @param <S> the phase type
 */
public final class ProgressTrackers<S> implements PhaseListener<S> {

    private final PhaseTransitions<S> transitions;
    private final Map<S, ProgressTracker<S>> trackers = new LinkedHashMap<>();

    public ProgressTrackers(PhaseTransitions<S> transitions) {
        this.transitions = Objects.requireNonNull(transitions, "transitions");
    }

    /**
     * Creates and registers a tracker for the configured phase.
     *
     * @param config the phase to track
     * @return the new tracker
     * @throws IllegalArgumentException if the phase already has a tracker
     */
    public ProgressTracker<S> register(ProgressTrackerConfig<S> config) {
        Objects.requireNonNull(config, "config");
        if (trackers.containsKey(config.getPhase())) {
            throw new IllegalArgumentException("Phase '" + config.getPhase() + "' is already tracked");
        }
        ProgressTracker<S> tracker = new ProgressTracker<>(config, transitions);
        trackers.put(config.getPhase(), tracker);
        return tracker;
    }

    /**
     * Registers a tracker for every configuration, in order. Trackers registered before a
     * duplicate phase is found stay registered.
     *
     * @return the new trackers
     * @throws IllegalArgumentException if a phase is already tracked or appears twice in
     *     {@code configs}
     */
    public List<ProgressTracker<S>> registerAll(Collection<ProgressTrackerConfig<S>> configs) {
        List<ProgressTracker<S>> created = new ArrayList<>(configs.size());
        for (ProgressTrackerConfig<S> config : configs) {
            created.add(register(config));
        }
        return created;
    }

    /**
     * Adds the listener to every registered tracker.
     */
    public void addListener(ProgressListener<S> listener) {
        trackers.values().forEach(t -> t.addListener(listener));
    }

    @Override
    public void phaseEntered(S phase) {
        ProgressTracker<S> tracker = trackers.get(phase);
        if (tracker != null) {
            tracker.phaseEntered(phase);
        }
    }

    @Override
    public void phaseExited(S phase) {
        ProgressTracker<S> tracker = trackers.get(phase);
        if (tracker != null) {
            tracker.phaseExited(phase);
        }
    }

    /**
     * Starts a new cycle on every active tracker.
     */
    public void beginCycle() {
        for (ProgressTracker<S> tracker : trackers.values()) {
            if (tracker.isActive()) {
                tracker.beginCycle();
            }
        }
    }

    /**
     * Runs the transition decision on every tracker that was active when the call started.
     * A phase entered as a consequence of one of these decisions is not checked until the
     * next cycle.
     *
     * @return the decisions taken, in registration order
     */
    public List<ProgressCheck<S>> checkProgress() {
        List<ProgressCheck<S>> checks = new ArrayList<>();
        for (ProgressTracker<S> tracker : getActive()) {
            if (tracker.isActive()) {
                checks.add(tracker.checkProgress());
            }
        }
        return checks;
    }

    public Optional<ProgressTracker<S>> find(S phase) {
        return Optional.ofNullable(trackers.get(phase));
    }

    /**
     * @throws IllegalArgumentException if the phase has no tracker
     */
    public ProgressTracker<S> get(S phase) {
        ProgressTracker<S> tracker = trackers.get(phase);
        if (tracker == null) {
            throw new IllegalArgumentException("Phase '" + phase + "' is not tracked");
        }
        return tracker;
    }

    /**
     * @return the trackers whose phase is currently active
     */
    public List<ProgressTracker<S>> getActive() {
        List<ProgressTracker<S>> active = new ArrayList<>();
        for (ProgressTracker<S> tracker : trackers.values()) {
            if (tracker.isActive()) {
                active.add(tracker);
            }
        }
        return active;
    }

    public List<ProgressTracker<S>> getTrackers() {
        return new ArrayList<>(trackers.values());
    }

    public int size() {
        return trackers.size();
    }
}
