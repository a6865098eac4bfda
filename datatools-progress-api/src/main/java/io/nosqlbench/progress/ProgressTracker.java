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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Owns the {@link ProgressCounter} of one tracked phase and decides when that phase is complete.
 *
 * <p><strong>Key Responsibilities:</strong></p>
 * <ul>
 *   <li><strong>Lifecycle:</strong> creates the counter when the tracked phase is entered
 *       ({@link #phaseEntered}) and discards it when the phase is exited ({@link #phaseExited}),
 *       whether the exit came from this tracker's own transition request or from elsewhere</li>
 *   <li><strong>Cycle reset:</strong> {@link #beginCycle()} returns the running totals to the
 *       persisted baseline before the tasks of a new cycle run</li>
 *   <li><strong>Transition decision:</strong> {@link #checkProgress()} reads the complete
 *       aggregate once all tasks of the cycle are done and, when {@code done >= total}, asks
 *       the host to continue to the configured next phase</li>
 *   <li><strong>Events:</strong> reports all of the above to registered {@link ProgressListener}s</li>
 * </ul>
 *
 * <p><strong>Cycle Flow:</strong></p>
 * <ol>
 *   <li>Host enters the phase → {@link #phaseEntered}</li>
 *   <li>Every cycle: {@link #beginCycle()} → tasks record into {@link #getCounter()}, possibly in
 *       parallel → {@link #checkProgress()}</li>
 *   <li>Host exits the phase → {@link #phaseExited}</li>
 * </ol>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * ProgressTracker<AppState> tracker = new ProgressTracker<>(
 *     ProgressTrackerConfig.forPhase(AppState.LOADING).continueTo(AppState.RUNNING),
 *     phases::requestTransition);
 * phases.addListener(tracker);
 *
 * // host loop, once per cycle while LOADING is active
 * tracker.beginCycle();
 * runTasksInParallel(tracker.getCounter());
 * tracker.checkProgress();
 * }</pre>
 *
 * <p><strong>Thread Safety:</strong></p>
 * <ul>
 *   <li><strong>Recording:</strong> tasks use the counter directly and never contend with
 *       the tracker</li>
 *   <li><strong>Lifecycle and decision:</strong> entering, exiting, the cycle reset, persisting
 *       and the transition decision are serialized on {@code lifecycleLock}</li>
 *   <li><strong>Ordering:</strong> the decision only sees every contribution of a cycle if the
 *       caller guarantees all recording happened before {@link #checkProgress()}; the tracker
 *       does not wait for tasks itself</li>
 * </ul>
 *
 * @param <S> the phase type
 * @see ProgressCounter
 * @see ProgressTrackerConfig
 * @see ProgressTrackers
 */
public final class ProgressTracker<S> implements PhaseListener<S> {

    private static final Logger logger = LogManager.getLogger(ProgressTracker.class);

    private final ProgressTrackerConfig<S> config;
    private final PhaseTransitions<S> transitions;
    private final String phaseName;
    private final CopyOnWriteArrayList<ProgressListener<S>> listeners = new CopyOnWriteArrayList<>();

    private final Object lifecycleLock = new Object();
    private volatile ProgressCounter counter;
    private volatile long cycle;
    private volatile ProgressCheck<S> lastCheck;

    /**
     * Creates a tracker that only observes progress; transition requests are dropped.
     *
     * @param config the tracked phase
     */
    public ProgressTracker(ProgressTrackerConfig<S> config) {
        this(config, PhaseTransitions.none());
    }

    /**
     * Creates a tracker for the configured phase.
     *
     * @param config the tracked phase and optional next phase
     * @param transitions how to ask the host for a phase change
     */
    public ProgressTracker(ProgressTrackerConfig<S> config, PhaseTransitions<S> transitions) {
        this.config = Objects.requireNonNull(config, "config");
        this.transitions = Objects.requireNonNull(transitions, "transitions");
        this.phaseName = String.valueOf(config.getPhase());
    }

    /**
     * Creates the counter when the tracked phase begins. Other phases are ignored.
     *
     * @param phase the phase the host has entered
     * @throws IllegalStateException if the tracked phase is already active
     */
    @Override
    public void phaseEntered(S phase) {
        if (!tracks(phase)) {
            return;
        }
        synchronized (lifecycleLock) {
            if (counter != null) {
                throw new IllegalStateException("Phase '" + phaseName + "' entered while already active");
            }
            counter = new ProgressCounter(phaseName);
            cycle = 0;
            lastCheck = null;
            logger.debug("Tracking progress for phase '{}'", phaseName);
            notifyListeners(l -> l.phaseEntered(config.getPhase()), "notifying listener of phase entry");
        }
    }

    /**
     * Discards the counter when the tracked phase ends. Other phases are ignored, as is
     * an exit of a phase that is not active.
     *
     * @param phase the phase the host has exited
     */
    @Override
    public void phaseExited(S phase) {
        if (!tracks(phase)) {
            return;
        }
        synchronized (lifecycleLock) {
            ProgressCounter current = counter;
            if (current == null) {
                logger.debug("Ignoring exit of phase '{}', which is not active", phaseName);
                return;
            }
            current.close();
            counter = null;
            long cycles = cycle;
            logger.debug("Stopped tracking progress for phase '{}' after {} cycles", phaseName, cycles);
            notifyListeners(l -> l.phaseExited(config.getPhase(), cycles), "notifying listener of phase exit");
        }
    }

    /**
     * Starts a new cycle: running totals go back to the persisted baseline. Must run before
     * any task of the cycle records progress.
     *
     * @return the number of the cycle that starts, beginning at 1
     * @throws InactivePhaseException if the tracked phase is not active
     */
    public long beginCycle() {
        synchronized (lifecycleLock) {
            ProgressCounter current = requireCounter();
            current.resetToPersisted();
            long started = ++cycle;
            notifyListeners(l -> l.cycleStarted(config.getPhase(), started), "notifying listener of cycle start");
            return started;
        }
    }

    /**
     * Runs the transition decision for the current cycle. Call it once all tasks of the cycle
     * have recorded their progress.
     *
     * <p>The complete aggregate (visible plus hidden) is ready when {@code done >= total}; a
     * phase without any tracked work is therefore ready immediately. When ready and a next phase
     * is configured, {@link PhaseTransitions#requestTransition} is called. Calling this again in
     * the same cycle returns the earlier result without requesting the transition again.
     *
     * @return the decision for this cycle
     * @throws InactivePhaseException if the tracked phase is not active
     */
    public ProgressCheck<S> checkProgress() {
        synchronized (lifecycleLock) {
            ProgressCounter current = requireCounter();
            ProgressCheck<S> previous = lastCheck;
            if (previous != null && previous.cycle() == cycle) {
                return previous;
            }

            Progress visible = current.getProgress();
            Progress complete = current.getCompleteProgress();
            boolean ready = complete.isReady();
            S target = ready ? config.getNextPhase().orElse(null) : null;

            ProgressCheck<S> check = new ProgressCheck<>(config.getPhase(), cycle, visible, complete, ready, target);
            lastCheck = check;
            notifyListeners(l -> l.progressChecked(check), "notifying listener of progress check");

            if (target != null) {
                logger.info("Phase '{}' complete ({}), continuing to '{}'", phaseName, complete, target);
                notifyListeners(l -> l.transitionRequested(config.getPhase(), target),
                    "notifying listener of transition request");
                transitions.requestTransition(target);
            }
            return check;
        }
    }

    /**
     * Returns the counter of the active phase, to be shared by every task of the phase.
     *
     * @return the live counter
     * @throws InactivePhaseException if the tracked phase is not active
     */
    public ProgressCounter getCounter() {
        return requireCounter();
    }

    /**
     * @return the live counter, or empty when the tracked phase is not active
     */
    public Optional<ProgressCounter> findCounter() {
        return Optional.ofNullable(counter);
    }

    /**
     * @return visible progress of the current cycle
     * @throws InactivePhaseException if the tracked phase is not active
     */
    public Progress getProgress() {
        return requireCounter().getProgress();
    }

    /**
     * @return visible plus hidden progress of the current cycle
     * @throws InactivePhaseException if the tracked phase is not active
     */
    public Progress getCompleteProgress() {
        return requireCounter().getCompleteProgress();
    }

    /**
     * Persists progress for the rest of the active phase.
     *
     * @see ProgressCounter#persist(Progress)
     */
    public void persist(Progress progress) {
        synchronized (lifecycleLock) {
            requireCounter().persist(progress);
        }
    }

    /**
     * Persists hidden progress for the rest of the active phase.
     *
     * @see ProgressCounter#persistHidden(HiddenProgress)
     */
    public void persistHidden(HiddenProgress hidden) {
        synchronized (lifecycleLock) {
            requireCounter().persistHidden(hidden);
        }
    }

    public PhaseState getState() {
        return counter != null ? PhaseState.ACTIVE : PhaseState.INACTIVE;
    }

    public boolean isActive() {
        return counter != null;
    }

    /**
     * @return the number of the current cycle, 0 until the first {@link #beginCycle()} of an activation
     */
    public long getCycle() {
        return cycle;
    }

    /**
     * @return the most recent decision of the current or last activation
     */
    public Optional<ProgressCheck<S>> getLastCheck() {
        return Optional.ofNullable(lastCheck);
    }

    public ProgressTrackerConfig<S> getConfig() {
        return config;
    }

    public S getPhase() {
        return config.getPhase();
    }

    /**
     * Adds a listener, ignored if null or already registered.
     */
    public void addListener(ProgressListener<S> listener) {
        if (listener != null) {
            listeners.addIfAbsent(listener);
        }
    }

    public void removeListener(ProgressListener<S> listener) {
        listeners.remove(listener);
    }

    public List<ProgressListener<S>> getListeners() {
        return new ArrayList<>(listeners);
    }

    boolean tracks(S phase) {
        return config.getPhase().equals(phase);
    }

    private ProgressCounter requireCounter() {
        ProgressCounter current = counter;
        if (current == null) {
            throw new InactivePhaseException(phaseName,
                "No ProgressCounter available: phase '" + phaseName + "' is not active");
        }
        return current;
    }

    private void notifyListeners(Consumer<ProgressListener<S>> action, String errorContext) {
        for (ProgressListener<S> listener : listeners) {
            try {
                action.accept(listener);
            } catch (Exception e) {
                logger.warn("Error {}: {}", errorContext, e.getMessage(), e);
            }
        }
    }

    @Override
    public String toString() {
        ProgressCounter current = counter;
        if (current == null) {
            return String.format("ProgressTracker[%s, %s]", config, PhaseState.INACTIVE);
        }
        return String.format("ProgressTracker[%s, cycle %d, complete=%s]", config, cycle, current.getCompleteProgress());
    }
}
