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
 * Running {@link io.nosqlbench.progress.exec.ProgressTask}s against a
 * {@link io.nosqlbench.progress.ProgressTracker}.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link io.nosqlbench.progress.exec.ProgressTask} - a task returning its progress for the cycle</li>
 *   <li>{@link io.nosqlbench.progress.exec.ProgressTasks} - applies task results to the phase's counter</li>
 *   <li>{@link io.nosqlbench.progress.exec.CycleExecutor} - reset, parallel run, wait, decide</li>
 *   <li>{@link io.nosqlbench.progress.exec.CycleStatistics} - thread-safe cycle and task counts</li>
 *   <li>{@link io.nosqlbench.progress.exec.WaitTasks} - tasks that wait for cycles or time</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * ExecutorService pool = Executors.newFixedThreadPool(4);
 * CycleExecutor<AppState> cycles = new CycleExecutor<>(pool, tracker)
 *     .add(() -> new Progress(loader.done(), loader.total()))
 *     .add(() -> HiddenProgress.of(index.isBuilt()));
 *
 * tracker.phaseEntered(AppState.LOADING);
 * cycles.runWhileActive(10_000);
 * }</pre>
 */
package io.nosqlbench.progress.exec;
