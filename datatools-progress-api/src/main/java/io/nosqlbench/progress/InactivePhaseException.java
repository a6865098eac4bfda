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
 * Thrown when progress is recorded, read or persisted while the tracked phase is not
 * active. This is a configuration error: some task was scheduled outside the window
 * in which its phase's {@link ProgressCounter} exists.
 */
public class InactivePhaseException extends IllegalStateException {

    private final String phase;

    public InactivePhaseException(String phase, String message) {
        super(message);
        this.phase = phase;
    }

    /**
     * @return the display name of the phase whose counter was requested
     */
    public String getPhase() {
        return phase;
    }
}
