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

import io.nosqlbench.progress.listeners.MetricsProgressListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ProgressTrackersTest {

    private SimulatedPhaseHost<SamplePhase> host;
    private ProgressTrackers<SamplePhase> trackers;

    @BeforeEach
    public void setUp() {
        host = new SimulatedPhaseHost<>();
        trackers = new ProgressTrackers<>(host);
        trackers.registerAll(List.of(
            ProgressTrackerConfig.forPhase(SamplePhase.SPLASH).continueTo(SamplePhase.LOADING),
            ProgressTrackerConfig.forPhase(SamplePhase.LOADING).continueTo(SamplePhase.RUNNING)));
        host.addListener(trackers);
    }

    @Test
    public void eachPhaseHasOneTracker() {
        assertThat(trackers.size()).isEqualTo(2);
        assertThat(trackers.find(SamplePhase.RUNNING)).isEmpty();
        assertThatThrownBy(() -> trackers.get(SamplePhase.RUNNING))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("RUNNING");
        assertThatThrownBy(() -> trackers.register(ProgressTrackerConfig.forPhase(SamplePhase.SPLASH)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("already tracked");
    }

    @Test
    public void registerAllRejectsRepeatedPhase() {
        ProgressTrackers<SamplePhase> fresh = new ProgressTrackers<>(target -> { });
        assertThatThrownBy(() -> fresh.registerAll(List.of(
            ProgressTrackerConfig.forPhase(SamplePhase.RUNNING),
            ProgressTrackerConfig.forPhase(SamplePhase.RUNNING).continueTo(SamplePhase.PAUSED))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("already tracked");
        assertThat(fresh.size()).isEqualTo(1);
    }

    @Test
    public void eventsReachOnlyTheMatchingTracker() {
        host.enter(SamplePhase.SPLASH);
        assertThat(trackers.getActive()).extracting(ProgressTracker::getPhase).containsExactly(SamplePhase.SPLASH);

        host.enter(SamplePhase.RUNNING);
        assertThat(trackers.getActive()).isEmpty();
    }

    @Test
    public void phasesChainThroughTheHost() {
        MetricsProgressListener<SamplePhase> metrics = new MetricsProgressListener<>();
        trackers.addListener(metrics);
        host.enter(SamplePhase.SPLASH);

        trackers.beginCycle();
        List<ProgressCheck<SamplePhase>> checks = trackers.checkProgress();
        assertThat(checks).singleElement().satisfies(check -> {
            assertThat(check.phase()).isEqualTo(SamplePhase.SPLASH);
            assertThat(check.getRequestedPhase()).contains(SamplePhase.LOADING);
        });
        assertThat(host.applyPendingTransition()).isTrue();
        assertThat(host.getCurrent()).isEqualTo(SamplePhase.LOADING);

        trackers.beginCycle();
        trackers.get(SamplePhase.LOADING).getCounter().record(new Progress(0, 1));
        assertThat(trackers.checkProgress()).singleElement()
            .satisfies(check -> assertThat(check.ready()).isFalse());
        assertThat(host.applyPendingTransition()).isFalse();

        trackers.beginCycle();
        trackers.get(SamplePhase.LOADING).getCounter().record(new Progress(1, 1));
        trackers.checkProgress();
        assertThat(host.applyPendingTransition()).isTrue();

        assertThat(host.getRequests()).containsExactly(SamplePhase.LOADING, SamplePhase.RUNNING);
        assertThat(trackers.getActive()).isEmpty();
        assertThat(metrics.getMetrics(SamplePhase.LOADING).getCyclesStarted()).isEqualTo(2);
        assertThat(metrics.getMetrics(SamplePhase.SPLASH).getTransitionsRequested()).isEqualTo(1);
    }

    @Test
    public void phaseEnteredDuringCheckWaitsForNextCycle() {
        ProgressTrackers<SamplePhase> immediate = new ProgressTrackers<>(target -> { });
        ProgressTracker<SamplePhase> splash = immediate.register(
            ProgressTrackerConfig.forPhase(SamplePhase.SPLASH).continueTo(SamplePhase.LOADING));
        ProgressTracker<SamplePhase> loading = immediate.register(
            ProgressTrackerConfig.forPhase(SamplePhase.LOADING));
        splash.addListener(check -> {
            if (check.isTransitionRequested()) {
                immediate.phaseEntered(SamplePhase.LOADING);
            }
        });

        immediate.phaseEntered(SamplePhase.SPLASH);
        immediate.beginCycle();
        List<ProgressCheck<SamplePhase>> checks = immediate.checkProgress();

        assertThat(checks).extracting(ProgressCheck::phase).containsExactly(SamplePhase.SPLASH);
        assertThat(loading.isActive()).isTrue();
        assertThat(loading.getLastCheck()).isEmpty();
    }
}
