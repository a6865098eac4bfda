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

import java.util.Objects;

/**
 * Two contributions reported together by one task.
 *
 * @param first applied first
 * @param second applied second
 * @see ProgressContribution#both(ProgressContribution, ProgressContribution)
 */
public record ProgressPair(ProgressContribution first, ProgressContribution second)
    implements ProgressContribution {

    public ProgressPair {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
    }

    @Override
    public void applyTo(ProgressCounter counter) {
        first.applyTo(counter);
        second.applyTo(counter);
    }
}
