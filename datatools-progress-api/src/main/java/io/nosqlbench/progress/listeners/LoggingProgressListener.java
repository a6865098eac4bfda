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


package io.nosqlbench.progress.listeners;

import io.nosqlbench.progress.ProgressCheck;
import io.nosqlbench.progress.eventing.ProgressListener;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Locale;
import java.util.Objects;

/**
 * A progress listener that writes tracker events to a Log4j 2 logger.
 *
 * <pre>{@code
 * tracker.addListener(new LoggingProgressListener<>("app.loading", Level.DEBUG));
 * // DEBUG app.loading - Phase entered: LOADING
 * // DEBUG app.loading - Phase LOADING cycle 1: 3/8 [37.5%] (complete 4/10)
 * // DEBUG app.loading - Phase LOADING complete, continuing to RUNNING
 * // DEBUG app.loading - Phase exited: LOADING after 12 cycles
 * }</pre>
 *
 * <p>Per-cycle lines are logged one level below the configured level when that level is INFO
 * or higher, so a tracker running every frame does not flood the log.
 *
 * @param <S> the phase type
 */
public class LoggingProgressListener<S> implements ProgressListener<S> {

    private final Logger logger;
    private final Level level;
    private final Level cycleLevel;

    public LoggingProgressListener() {
        this(LogManager.getLogger(LoggingProgressListener.class));
    }

    public LoggingProgressListener(Logger logger) {
        this(logger, Level.INFO);
    }

    public LoggingProgressListener(Logger logger, Level level) {
        this.logger = Objects.requireNonNull(logger, "logger");
        this.level = Objects.requireNonNullElse(level, Level.INFO);
        this.cycleLevel = this.level.isMoreSpecificThan(Level.INFO) ? Level.DEBUG : this.level;
    }

    public LoggingProgressListener(String loggerName) {
        this(LogManager.getLogger(loggerName));
    }

    public LoggingProgressListener(String loggerName, Level level) {
        this(LogManager.getLogger(loggerName), level);
    }

    @Override
    public void phaseEntered(S phase) {
        logger.log(level, "Phase entered: {}", phase);
    }

    @Override
    public void progressChecked(ProgressCheck<S> check) {
        if (!logger.isEnabled(cycleLevel)) {
            return;
        }
        logger.log(cycleLevel, "Phase {} cycle {}: {} [{}] (complete {})",
            check.phase(), check.cycle(), check.visible(), percent(check), check.complete());
    }

    @Override
    public void transitionRequested(S from, S to) {
        logger.log(level, "Phase {} complete, continuing to {}", from, to);
    }

    @Override
    public void phaseExited(S phase, long cycles) {
        logger.log(level, "Phase exited: {} after {} cycles", phase, cycles);
    }

    private static String percent(ProgressCheck<?> check) {
        if (check.visible().total() == 0) {
            return "-";
        }
        return String.format(Locale.ROOT, "%.1f%%", check.visible().fraction() * 100.0);
    }
}
