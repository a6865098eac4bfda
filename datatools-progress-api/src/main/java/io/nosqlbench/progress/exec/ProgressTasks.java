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

package io.nosqlbench.progress.exec;

import io.nosqlbench.progress.ProgressContribution;
import io.nosqlbench.progress.ProgressCounter;
import io.nosqlbench.progress.ProgressTracker;

import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Adapters between {@link ProgressTask}s and the counter of a {@link ProgressTracker}.
 */
public final class ProgressTasks {

    private ProgressTasks() {
    }

    /**
     * Wraps a task so that running it applies its result to the tracker's counter. The counter
     * is looked up on every run, so a task scheduled while the phase is not active fails with
     * {@link io.nosqlbench.progress.InactivePhaseException} instead of reporting into nothing.
     *
     * @param tracker the tracker of the task's phase
     * @param task the task
     * @return a callable returning the applied contribution
     */
    public static Callable<ProgressContribution> track(ProgressTracker<?> tracker, ProgressTask task) {
        Objects.requireNonNull(tracker, "tracker");
        Objects.requireNonNull(task, "task");
        return () -> {
            ProgressCounter counter = tracker.getCounter();
            ProgressContribution contribution = Objects.requireNonNull(task.run(),
                () -> "progress task " + task + " returned null");
            counter.apply(contribution);
            return contribution;
        };
    }

    /**
     * Gives a task a name for logs and failure messages.
     *
     * @param name the display name
     * @param task the task
     * @return a task delegating to {@code task} whose {@code toString()} is {@code name}
     */
    public static ProgressTask named(String name, ProgressTask task) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(task, "task");
        return new ProgressTask() {
            @Override
            public ProgressContribution run() throws Exception {
                return task.run();
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }
}
