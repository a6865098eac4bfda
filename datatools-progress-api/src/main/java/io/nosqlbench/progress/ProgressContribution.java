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
 * Anything a task can hand back to be accounted into the progress of the current cycle.
 *
 * <p>There are exactly two kinds of contribution, {@link Progress} (visible) and
 * {@link HiddenProgress}, plus {@link ProgressPair} for tasks that report one of each
 * (or two of the same kind) in a single run.
 *
 * <pre>{@code
 * ProgressTask task = () -> ProgressContribution.both(
 *     new Progress(assetsLoaded, assetCount),
 *     HiddenProgress.of(shadersCompiled));
 * }</pre>
 */
public sealed interface ProgressContribution permits Progress, HiddenProgress, ProgressPair {

    /**
     * Accounts this value into the running totals of the given counter.
     *
     * @param counter the counter of the active phase
     * @throws InactivePhaseException if the counter's phase has already exited
     */
    void applyTo(ProgressCounter counter);

    /**
     * Combines two contributions so that both are applied, first then second.
     */
    static ProgressContribution both(ProgressContribution first, ProgressContribution second) {
        return new ProgressPair(first, second);
    }
}
