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
 * Requests that the host move to another phase at its next safe point. Implemented by
 * the host's phase machine; the {@link ProgressTracker} calls it when all tracked work of
 * the current phase is complete.
 *
 * <pre>{@code
 * ProgressTracker<GameState> tracker = new ProgressTracker<>(
 *     ProgressTrackerConfig.forPhase(GameState.LOADING).continueTo(GameState.PLAYING),
 *     stateMachine::scheduleTransition);
 * }</pre>
 *
 * @param <S> the phase type
 */
@FunctionalInterface
public interface PhaseTransitions<S> {

    /**
     * Asks the host to leave the current phase for {@code target}. The actual exit is
     * reported back through {@link PhaseListener#phaseExited(Object)}.
     *
     * @param target the phase to move to
     */
    void requestTransition(S target);

    /**
     * @return transitions that ignore every request, for trackers used only to observe progress
     */
    static <S> PhaseTransitions<S> none() {
        return target -> {
        };
    }
}
