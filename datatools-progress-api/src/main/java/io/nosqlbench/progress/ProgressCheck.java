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

import java.util.Optional;

/**
 * Outcome of one transition decision, taken by {@link ProgressTracker#checkProgress()}
 * after every task of a cycle has recorded its progress.
 *
 * @param phase the tracked phase
 * @param cycle the cycle number the decision belongs to (1 for the first cycle after entering)
 * @param visible the visible aggregate at decision time
 * @param complete the visible plus hidden aggregate at decision time
 * @param ready whether {@code complete} was ready
 * @param requestedPhase the phase a transition was requested to, or null if none was
 * @param <S> the phase type
 */
public record ProgressCheck<S>(S phase,
                               long cycle,
                               Progress visible,
                               Progress complete,
                               boolean ready,
                               S requestedPhase) {

    public Optional<S> getRequestedPhase() {
        return Optional.ofNullable(requestedPhase);
    }

    public boolean isTransitionRequested() {
        return requestedPhase != null;
    }

    @Override
    public String toString() {
        return String.format("%s cycle %d: visible=%s complete=%s%s",
            phase, cycle, visible, complete,
            ready ? (requestedPhase != null ? " ready -> " + requestedPhase : " ready") : "");
    }
}
