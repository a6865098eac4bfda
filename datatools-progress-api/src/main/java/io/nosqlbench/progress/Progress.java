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

/**
 * Progress reported by a task: how many units of work it has completed so far
 * ({@code done}) out of how many it expects in total ({@code total}).
 *
 * <p>When {@code done} reaches {@code total} the value is considered "ready". When the
 * combined progress of every task tracked in a phase is ready, the owning
 * {@link ProgressTracker} requests the transition to the configured next phase.
 *
 * <h2>Usage Examples:</h2>
 * <pre>{@code
 * // a loader that has finished 3 of 5 files
 * Progress loaded = new Progress(3, 5);
 *
 * // pass/fail style tasks
 * Progress connected = Progress.of(client.isConnected());
 *
 * // combining contributions
 * Progress combined = loaded.plus(connected);   // (4, 6) when connected
 * }</pre>
 *
 * <h2>Invariants</h2>
 * <p>{@code done <= total} is expected but not enforced. A task that reports more
 * done units than its total does not corrupt the shared aggregate, because
 * {@link ProgressCounter#record(Progress)} clamps every contribution. Counts are
 * never negative.</p>
 *
 * <h2>Fractions</h2>
 * <p>{@link #fraction()} divides {@code done} by {@code total} without any guard, so a
 * zero total yields {@code NaN} (or infinity). Code rendering progress bars must check
 * {@code total > 0} first; a zero total usually means nothing has been reported yet.</p>
 *
 * @param done units of work completed during this execution of the task
 * @param total units of work expected
 * @see HiddenProgress
 * @see ProgressCounter
 */
public record Progress(long done, long total) implements ProgressContribution {

    /** No work done, no work expected. */
    public static final Progress NONE = new Progress(0, 0);

    private static final Progress READY = new Progress(1, 1);
    private static final Progress NOT_READY = new Progress(0, 1);

    public Progress {
        if (done < 0 || total < 0) {
            throw new IllegalArgumentException(
                "progress counts must not be negative: done=" + done + ", total=" + total);
        }
    }

    /**
     * Converts a pass/fail result into progress: {@code true} is {@code (1, 1)},
     * {@code false} is {@code (0, 1)}.
     *
     * @param ready whether the task is finished
     * @return a single-unit progress value
     */
    public static Progress of(boolean ready) {
        return ready ? READY : NOT_READY;
    }

    /**
     * @return true when {@code done >= total}; {@code (0, 0)} is ready
     */
    public boolean isReady() {
        return done >= total;
    }

    /**
     * Componentwise addition, the fold used to combine contributions.
     *
     * @param other the progress to add
     * @return {@code (done + other.done, total + other.total)}
     */
    public Progress plus(Progress other) {
        return new Progress(done + other.done, total + other.total);
    }

    /**
     * Returns this progress with {@code done} limited to {@code total}.
     *
     * @return the clamped value, or this instance when already consistent
     */
    public Progress clamped() {
        return done <= total ? this : new Progress(total, total);
    }

    /**
     * @return {@code done / total}; not guarded against a zero total
     */
    public double fraction() {
        return (double) done / (double) total;
    }

    /**
     * @return {@code done / total} in single precision; not guarded against a zero total
     */
    public float toFloat() {
        return (float) done / (float) total;
    }

    /**
     * @return this value wrapped so it counts only toward true completion
     */
    public HiddenProgress hidden() {
        return new HiddenProgress(this);
    }

    @Override
    public void applyTo(ProgressCounter counter) {
        counter.record(this);
    }

    @Override
    public String toString() {
        return done + "/" + total;
    }
}
