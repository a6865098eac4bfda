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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ProgressTest {

    @Test
    public void readinessComparesDoneToTotal() {
        assertTrue(new Progress(3, 3).isReady());
        assertFalse(new Progress(2, 3).isReady());
        assertTrue(new Progress(0, 0).isReady(), "a phase with no work is ready");
        assertTrue(new Progress(5, 2).isReady());
    }

    @Test
    public void booleanConversion() {
        assertEquals(new Progress(1, 1), Progress.of(true));
        assertEquals(new Progress(0, 1), Progress.of(false));
        assertTrue(Progress.of(true).isReady());
        assertFalse(Progress.of(false).isReady());
    }

    @Test
    public void additionIsComponentwise() {
        Progress sum = new Progress(1, 2).plus(new Progress(3, 5));
        assertEquals(new Progress(4, 7), sum);
        assertEquals(new Progress(1, 2), new Progress(1, 2).plus(Progress.NONE));
    }

    @Test
    public void fractionOfTotal() {
        assertEquals(0.25, new Progress(1, 4).fraction(), 1e-9);
        assertEquals(0.5f, new Progress(2, 4).toFloat(), 1e-6f);
        assertEquals(1.0, new Progress(4, 4).fraction(), 1e-9);
    }

    @Test
    public void fractionOfZeroTotalIsNotGuarded() {
        assertTrue(Double.isNaN(Progress.NONE.fraction()));
        assertTrue(Double.isInfinite(new Progress(1, 0).fraction()));
    }

    @Test
    public void clampedLimitsDoneToTotal() {
        assertEquals(new Progress(2, 2), new Progress(5, 2).clamped());
        Progress consistent = new Progress(1, 2);
        assertSame(consistent, consistent.clamped());
    }

    @Test
    public void negativeCountsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Progress(-1, 2));
        assertThrows(IllegalArgumentException.class, () -> new Progress(0, -2));
    }

    @Test
    public void hiddenProgressWrapsTheSameArithmetic() {
        HiddenProgress hidden = new Progress(1, 3).hidden();
        assertEquals(new Progress(1, 3), hidden.progress());
        assertFalse(hidden.isReady());
        assertEquals(HiddenProgress.of(3, 4), hidden.plus(HiddenProgress.of(2, 1)));
        assertEquals(new HiddenProgress(new Progress(1, 1)), HiddenProgress.of(true));
        assertThrows(NullPointerException.class, () -> new HiddenProgress(null));
    }

    @Test
    public void toStringShowsDoneOverTotal() {
        assertEquals("3/8", new Progress(3, 8).toString());
        assertEquals("hidden(0/1)", HiddenProgress.of(false).toString());
    }
}
