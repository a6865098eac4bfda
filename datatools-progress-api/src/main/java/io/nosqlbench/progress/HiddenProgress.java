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
 * "Hidden" progress reported by a task. Works just like {@link Progress}, but is
 * accounted in a separate bucket of the {@link ProgressCounter}.
 *
 * <p>Hidden progress counts toward the true total returned by
 * {@link ProgressCounter#getCompleteProgress()}, which gates the phase transition, but
 * is left out of {@link ProgressCounter#getProgress()}. Use it for work that should not
 * move progress bars or other user-facing indicators, such as warm-up delays.
 *
 * @param progress the wrapped progress value
 */
public record HiddenProgress(Progress progress) implements ProgressContribution {

    public HiddenProgress {
        Objects.requireNonNull(progress, "progress");
    }

    public static HiddenProgress of(long done, long total) {
        return new HiddenProgress(new Progress(done, total));
    }

    public static HiddenProgress of(boolean ready) {
        return new HiddenProgress(Progress.of(ready));
    }

    public boolean isReady() {
        return progress.isReady();
    }

    public HiddenProgress plus(HiddenProgress other) {
        return new HiddenProgress(progress.plus(other.progress));
    }

    @Override
    public void applyTo(ProgressCounter counter) {
        counter.recordHidden(this);
    }

    @Override
    public String toString() {
        return "hidden(" + progress + ")";
    }
}
