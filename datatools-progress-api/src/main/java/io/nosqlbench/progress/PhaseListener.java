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
 * Phase enter and exit notifications published by the host that owns the phases.
 * Phases are opaque values compared with {@link Object#equals(Object)}; listeners
 * ignore phases they do not track.
 *
 * @param <S> the phase type
 */
public interface PhaseListener<S> {

    void phaseEntered(S phase);

    void phaseExited(S phase);
}
