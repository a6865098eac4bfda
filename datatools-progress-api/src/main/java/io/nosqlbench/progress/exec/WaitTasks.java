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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Placeholder tasks that hold a phase open for a number of cycles or an amount of time.
 * Handy for testing and debugging. Both report {@link HiddenProgress}, so they delay the
 * transition without showing in progress bars. Each returned task keeps its own state;
 * create a new one per phase activation.
 */
public final class WaitTasks {

    private WaitTasks() {
    }

    /**
     * A task that becomes ready on its {@code cycles + 1}-th run: it reports
     * {@code (0, cycles)} on the first run and one more done unit on each run after that.
     *
     * @param cycles how many cycles to wait
     * @return a new waiting task
     */
    public static ProgressTask waitCycles(int cycles) {
        if (cycles < 0) {
            throw new IllegalArgumentException("cycles must not be negative: " + cycles);
        }
        AtomicInteger count = new AtomicInteger();
        return ProgressTasks.named("wait-" + cycles + "-cycles", () -> {
            int seen = count.updateAndGet(c -> c <= cycles ? c + 1 : c);
            return HiddenProgress.of(seen - 1, cycles);
        });
    }

    /**
     * A task that becomes ready once {@code millis} have passed since its first run.
     *
     * @param millis how long to wait
     * @return a new waiting task using the system clock
     */
    public static ProgressTask waitMillis(long millis) {
        return waitMillis(millis, Clock.systemUTC());
    }

    /**
     * @param millis how long to wait
     * @param clock the time source
     * @return a new waiting task
     * @see #waitMillis(long)
     */
    public static ProgressTask waitMillis(long millis, Clock clock) {
        if (millis < 0) {
            throw new IllegalArgumentException("millis must not be negative: " + millis);
        }
        Objects.requireNonNull(clock, "clock");
        Duration wait = Duration.ofMillis(millis);
        AtomicReference<Instant> deadline = new AtomicReference<>();
        return ProgressTasks.named("wait-" + millis + "ms", () -> {
            Instant end = deadline.updateAndGet(d -> d != null ? d : clock.instant().plus(wait));
            return HiddenProgress.of(clock.instant().isAfter(end));
        });
    }
}
