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

/**
 * Phase progress tracking: many tasks report how much of their work is done into one shared
 * counter per cycle, and the phase moves on once everything is complete.
 *
 * <h2>Core Types</h2>
 * <ul>
 *   <li>{@link io.nosqlbench.progress.Progress} - immutable {@code (done, total)} value</li>
 *   <li>{@link io.nosqlbench.progress.HiddenProgress} - progress that gates completion but is
 *       left out of user-facing totals</li>
 *   <li>{@link io.nosqlbench.progress.ProgressCounter} - lock-free per-cycle accumulator with a
 *       persisted baseline</li>
 *   <li>{@link io.nosqlbench.progress.ProgressTracker} - creates and discards the counter with
 *       the phase, resets it every cycle and takes the transition decision</li>
 *   <li>{@link io.nosqlbench.progress.ProgressTrackers} - one tracker per phase behind a single
 *       {@link io.nosqlbench.progress.PhaseListener}</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * ProgressTracker<AppState> tracker = new ProgressTracker<>(
 *     ProgressTrackerConfig.forPhase(AppState.LOADING).continueTo(AppState.RUNNING),
 *     phases::requestTransition);
 *
 * tracker.phaseEntered(AppState.LOADING);
 * while (tracker.isActive()) {
 *     tracker.beginCycle();
 *     ProgressCounter counter = tracker.getCounter();
 *     counter.record(new Progress(filesLoaded, fileCount));
 *     counter.recordHidden(HiddenProgress.of(cacheWarm));
 *     tracker.checkProgress();
 * }
 * }</pre>
 *
 * <p>{@link io.nosqlbench.progress.exec.CycleExecutor} runs the tasks of a cycle in parallel
 * on an {@link java.util.concurrent.ExecutorService} and provides the ordering between the
 * tasks and the decision.
 */
package io.nosqlbench.progress;
