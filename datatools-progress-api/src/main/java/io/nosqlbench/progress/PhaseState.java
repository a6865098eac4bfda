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
 * Lifecycle state of a {@link ProgressTracker}.
 *
 * <p>State Transitions:
 * <ul>
 *   <li><strong>INACTIVE → ACTIVE:</strong> the tracked phase is entered and a fresh
 *       {@link ProgressCounter} is created</li>
 *   <li><strong>ACTIVE → ACTIVE:</strong> every cycle reset, running totals return to the
 *       persisted baseline</li>
 *   <li><strong>ACTIVE → INACTIVE:</strong> the tracked phase is exited and the counter is
 *       discarded</li>
 * </ul>
 */
public enum PhaseState {
    /**
     * The tracked phase is not running. No counter exists; any attempt to record or
     * read progress fails with {@link InactivePhaseException}.
     */
    INACTIVE,

    /**
     * The tracked phase is running and its counter accepts progress.
     */
    ACTIVE
}
