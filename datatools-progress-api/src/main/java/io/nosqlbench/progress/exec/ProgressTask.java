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

import io.nosqlbench.progress.HiddenProgress;
import io.nosqlbench.progress.Progress;
import io.nosqlbench.progress.ProgressContribution;

/**
 * A unit of work that runs once per cycle while its phase is active and reports how far it
 * has come. Return a {@link Progress} for visible work, a {@link HiddenProgress} for work that
 * should not show in progress bars, or {@link ProgressContribution#both} for one of each.
 *
 * <pre>{@code
 * ProgressTask loadTextures = () -> new Progress(textures.loadedCount(), textures.size());
 * ProgressTask connect = () -> Progress.of(client.isConnected());
 * }</pre>
 *
 * <p>Tasks of the same cycle may run concurrently; state a task keeps between cycles belongs to
 * the task instance.
 */
@FunctionalInterface
public interface ProgressTask {

    /**
     * Does this cycle's share of the work.
     *
     * @return the progress to account for this cycle
     * @throws Exception if the work fails; the cycle then fails without a transition decision
     */
    ProgressContribution run() throws Exception;
}
