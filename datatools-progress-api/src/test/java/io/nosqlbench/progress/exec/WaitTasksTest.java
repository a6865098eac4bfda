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
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public class WaitTasksTest {

    @Test
    public void waitCyclesCountsUpToReady() throws Exception {
        ProgressTask wait = WaitTasks.waitCycles(3);
        assertEquals(HiddenProgress.of(0, 3), wait.run());
        assertEquals(HiddenProgress.of(1, 3), wait.run());
        assertEquals(HiddenProgress.of(2, 3), wait.run());
        assertEquals(HiddenProgress.of(3, 3), wait.run());
        assertEquals(HiddenProgress.of(3, 3), wait.run(), "stays ready");
        assertEquals("wait-3-cycles", wait.toString());
    }

    @Test
    public void waitZeroCyclesIsReadyAtOnce() throws Exception {
        ProgressTask wait = WaitTasks.waitCycles(0);
        assertTrue(((HiddenProgress) wait.run()).isReady());
    }

    @Test
    public void waitMillisStartsOnFirstRun() throws Exception {
        ManualClock clock = new ManualClock(Instant.parse("2024-01-01T00:00:00Z"));
        ProgressTask wait = WaitTasks.waitMillis(500, clock);

        clock.advance(Duration.ofSeconds(10));
        assertEquals(HiddenProgress.of(false), wait.run());
        clock.advance(Duration.ofMillis(500));
        assertEquals(HiddenProgress.of(false), wait.run(), "the deadline has to be passed, not reached");
        clock.advance(Duration.ofMillis(1));
        assertEquals(HiddenProgress.of(true), wait.run());
        assertEquals("wait-500ms", wait.toString());
    }

    @Test
    public void negativeWaitsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> WaitTasks.waitCycles(-1));
        assertThrows(IllegalArgumentException.class, () -> WaitTasks.waitMillis(-1));
    }
}
