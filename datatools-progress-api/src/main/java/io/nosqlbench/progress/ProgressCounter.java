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
import java.util.concurrent.atomic.AtomicLong;

/**
 * Accumulates the progress reported by all tasks of the active phase during the current cycle.
 * One counter exists per active phase; it is created by the owning {@link ProgressTracker}
 * when the phase is entered and closed when the phase is exited.
 *
 * <p><strong>Running totals:</strong></p>
 * <ul>
 *   <li>Visible done/total, fed by {@link #record(Progress)}</li>
 *   <li>Hidden done/total, fed by {@link #recordHidden(HiddenProgress)}</li>
 * </ul>
 * Every contribution is added to the totals; summation is the only combination rule that
 * does not depend on the order in which tasks run. {@code done} is clamped to {@code total}
 * per contribution, before it is added, so a task reporting {@code (5, 2)} adds {@code (2, 2)}.
 *
 * <p><strong>Persisted baseline:</strong></p>
 * <p>{@link #persist(Progress)} folds a contribution into a baseline that the running totals
 * are reset to at the start of every cycle, so work that is permanently finished keeps
 * counting without being reported again.</p>
 *
 * <p><strong>Reading:</strong></p>
 * <ul>
 *   <li>{@link #getProgress()} for progress bars and other user-facing output (visible only)</li>
 *   <li>{@link #getCompleteProgress()} for anything that must reflect true completion,
 *       including the transition decision (visible plus hidden)</li>
 * </ul>
 * Reads return a correct sum only once every task of the cycle has finished recording. The
 * scheduler running the tasks has to provide that ordering.
 *
 * <p><strong>Thread Safety:</strong></p>
 * <ul>
 *   <li><strong>Recording:</strong> lock-free; each running total is an independent
 *       {@link AtomicLong}, so any number of tasks can record concurrently without lost updates</li>
 *   <li><strong>Baseline:</strong> {@link #persist}, {@link #persistHidden} and the cycle reset are
 *       serialized on {@code baselineLock}. They must still not overlap with recording tasks of
 *       the same cycle; this precondition is not checked</li>
 *   <li><strong>Closing:</strong> after the phase exits every operation throws
 *       {@link InactivePhaseException}</li>
 * </ul>
 *
 * @see ProgressTracker
 * @see ProgressContribution
 */
public final class ProgressCounter {

    private final String phaseName;

    private final AtomicLong done = new AtomicLong();
    private final AtomicLong total = new AtomicLong();
    private final AtomicLong doneHidden = new AtomicLong();
    private final AtomicLong totalHidden = new AtomicLong();

    // Guards the two baseline fields and the reset that copies them into the running totals.
    private final Object baselineLock = new Object();
    private Progress persisted = Progress.NONE;
    private Progress persistedHidden = Progress.NONE;

    private volatile boolean closed = false;

    ProgressCounter(String phaseName) {
        this.phaseName = Objects.requireNonNull(phaseName, "phaseName");
    }

    /**
     * Adds progress to the visible running totals for the current cycle. {@code done}
     * is clamped to {@code total} before it is added.
     *
     * <p>Most tasks never call this directly; they return a {@link ProgressContribution}
     * and let {@link io.nosqlbench.progress.exec.ProgressTasks#track} apply it.</p>
     *
     * @param progress the contribution
     * @throws InactivePhaseException if the phase has exited
     */
    public void record(Progress progress) {
        Objects.requireNonNull(progress, "progress");
        checkNotClosed();
        total.addAndGet(progress.total());
        done.addAndGet(Math.min(progress.done(), progress.total()));
    }

    /**
     * Adds progress to the hidden running totals for the current cycle. Hidden progress
     * counts toward {@link #getCompleteProgress()} but not {@link #getProgress()}.
     *
     * @param hidden the contribution
     * @throws InactivePhaseException if the phase has exited
     */
    public void recordHidden(HiddenProgress hidden) {
        Objects.requireNonNull(hidden, "hidden");
        checkNotClosed();
        Progress progress = hidden.progress();
        totalHidden.addAndGet(progress.total());
        doneHidden.addAndGet(Math.min(progress.done(), progress.total()));
    }

    /**
     * Applies any kind of contribution.
     *
     * @param contribution a {@link Progress}, {@link HiddenProgress} or {@link ProgressPair}
     */
    public void apply(ProgressContribution contribution) {
        Objects.requireNonNull(contribution, "contribution").applyTo(this);
    }

    /**
     * Returns the combined visible progress of all tasks. This does not include hidden
     * progress; use it for progress bars and other user-facing indicators.
     *
     * @return a point-in-time snapshot of the visible totals
     * @throws InactivePhaseException if the phase has exited
     */
    public Progress getProgress() {
        checkNotClosed();
        return new Progress(done.get(), total.get());
    }

    /**
     * Returns the combined progress of all tasks including hidden progress. This is the
     * value the transition decision is based on.
     *
     * @return a point-in-time snapshot of visible plus hidden totals
     * @throws InactivePhaseException if the phase has exited
     */
    public Progress getCompleteProgress() {
        checkNotClosed();
        return new Progress(
            done.get() + doneHidden.get(),
            total.get() + totalHidden.get());
    }

    /**
     * Persists progress for the rest of the phase. The value is recorded for the current
     * cycle and added to the baseline every later cycle starts from.
     *
     * <p>The baseline keeps the contribution as it was recorded, with {@code done} clamped
     * to {@code total}, so later cycles read the same value as the current one.</p>
     *
     * <p>Must not be called while tasks of the current cycle are still recording.</p>
     *
     * @param progress the permanently finished contribution
     * @throws InactivePhaseException if the phase has exited
     */
    public void persist(Progress progress) {
        Objects.requireNonNull(progress, "progress");
        synchronized (baselineLock) {
            record(progress);
            persisted = persisted.plus(progress.clamped());
        }
    }

    /**
     * Persists hidden progress for the rest of the phase.
     *
     * @param hidden the permanently finished contribution
     * @throws InactivePhaseException if the phase has exited
     * @see #persist(Progress)
     */
    public void persistHidden(HiddenProgress hidden) {
        Objects.requireNonNull(hidden, "hidden");
        synchronized (baselineLock) {
            recordHidden(hidden);
            persistedHidden = persistedHidden.plus(hidden.progress().clamped());
        }
    }

    /**
     * @return the visible baseline every cycle starts from
     */
    public Progress getPersistedProgress() {
        synchronized (baselineLock) {
            return persisted;
        }
    }

    /**
     * @return the hidden baseline every cycle starts from
     */
    public HiddenProgress getPersistedHiddenProgress() {
        synchronized (baselineLock) {
            return new HiddenProgress(persistedHidden);
        }
    }

    /**
     * @return the display name of the phase this counter belongs to
     */
    public String getPhaseName() {
        return phaseName;
    }

    /**
     * Resets all running totals to the persisted baselines. Called by the tracker at
     * the start of every cycle, before any task of that cycle runs.
     */
    void resetToPersisted() {
        synchronized (baselineLock) {
            checkNotClosed();
            done.set(persisted.done());
            total.set(persisted.total());
            doneHidden.set(persistedHidden.done());
            totalHidden.set(persistedHidden.total());
        }
    }

    void close() {
        closed = true;
    }

    /**
     * @return true once the owning phase has exited
     */
    public boolean isClosed() {
        return closed;
    }

    private void checkNotClosed() {
        if (closed) {
            throw new InactivePhaseException(phaseName,
                "ProgressCounter for phase '" + phaseName + "' is no longer available: the phase has exited");
        }
    }

    @Override
    public String toString() {
        if (closed) {
            return "ProgressCounter[" + phaseName + ", closed]";
        }
        return String.format("ProgressCounter[%s, visible=%s, complete=%s]",
            phaseName, getProgress(), getCompleteProgress());
    }
}
