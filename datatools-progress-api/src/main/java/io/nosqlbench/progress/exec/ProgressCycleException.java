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

/**
 * Thrown by {@link CycleExecutor#runCycle()} when one or more tasks of a cycle failed. The
 * individual task failures are attached as suppressed exceptions. The transition decision is
 * skipped for such a cycle, because the aggregate lacks the failed tasks' contributions.
 */
public class ProgressCycleException extends RuntimeException {

    private final long cycle;
    private final int failedTasks;

    public ProgressCycleException(String phase, long cycle, int failedTasks, int totalTasks) {
        super(String.format("%d of %d progress tasks failed in cycle %d of phase '%s'",
            failedTasks, totalTasks, cycle, phase));
        this.cycle = cycle;
        this.failedTasks = failedTasks;
    }

    public long getCycle() {
        return cycle;
    }

    public int getFailedTasks() {
        return failedTasks;
    }
}
