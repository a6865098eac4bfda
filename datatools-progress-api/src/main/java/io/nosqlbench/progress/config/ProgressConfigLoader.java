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

package io.nosqlbench.progress.config;

import io.nosqlbench.progress.ProgressTrackerConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Reads tracked phase configurations from YAML.
 *
 * <p>The document is either a list of entries or a single entry. Each entry names the tracked
 * {@code phase} and, optionally, the {@code next_phase} to continue to on completion:
 * <pre>{@code
 * - phase: loading
 *   next_phase: running
 * - phase: splash
 * }</pre>
 *
 * <p>Phase names are turned into phase values by the resolver given at construction, see
 * {@link #forEnum(Class)} for enum phases. A phase may appear only once per document.
 *
 * @param <S> the phase type
 */
public final class ProgressConfigLoader<S> {

    private static final Logger logger = LogManager.getLogger(ProgressConfigLoader.class);

    /** Configuration key of the tracked phase. */
    public static final String PHASE = "phase";
    /** Configuration key of the phase to continue to. */
    public static final String NEXT_PHASE = "next_phase";

    private static final Set<String> KEYS = Set.of(PHASE, NEXT_PHASE);

    private final Function<String, S> phaseResolver;

    /**
     * @param phaseResolver maps a phase name to a phase, returning null or throwing
     *     IllegalArgumentException for unknown names
     */
    public ProgressConfigLoader(Function<String, S> phaseResolver) {
        this.phaseResolver = Objects.requireNonNull(phaseResolver, "phaseResolver");
    }

    /**
     * Creates a loader resolving names to constants of an enum, ignoring case.
     *
     * @param type the enum type of the phases
     * @param <E> the phase type
     * @return a loader
     */
    public static <E extends Enum<E>> ProgressConfigLoader<E> forEnum(Class<E> type) {
        Objects.requireNonNull(type, "type");
        return new ProgressConfigLoader<>(name -> {
            for (E constant : type.getEnumConstants()) {
                if (constant.name().equalsIgnoreCase(name.trim())) {
                    return constant;
                }
            }
            return null;
        });
    }

    /**
     * Loads the configurations from a YAML file.
     *
     * @param path the file to read
     * @return the configurations in document order
     * @throws ProgressConfigException if the file cannot be read or is invalid
     */
    public List<ProgressTrackerConfig<S>> load(Path path) {
        try {
            logger.debug("Loading progress tracking config from {}", path);
            return loadFromString(Files.readString(path));
        } catch (IOException e) {
            throw new ProgressConfigException("unable to read progress config " + path, e);
        }
    }

    /**
     * Loads the configurations from YAML text.
     *
     * @param yaml the document
     * @return the configurations in document order, empty for an empty document
     * @throws ProgressConfigException if the document is invalid or names a phase twice
     */
    public List<ProgressTrackerConfig<S>> loadFromString(String yaml) {
        Object document;
        try {
            Load load = new Load(LoadSettings.builder().build());
            document = load.loadFromString(yaml);
        } catch (YamlEngineException e) {
            throw new ProgressConfigException("invalid progress config YAML: " + e.getMessage(), e);
        }

        List<ProgressTrackerConfig<S>> configs = new ArrayList<>();
        if (document == null) {
            return configs;
        }
        if (document instanceof List<?> entries) {
            Set<S> seen = new HashSet<>();
            for (int i = 0; i < entries.size(); i++) {
                ProgressTrackerConfig<S> config = toConfig(entries.get(i), "entry " + i);
                if (!seen.add(config.getPhase())) {
                    throw new ProgressConfigException(
                        "entry " + i + ": phase '" + config.getPhase() + "' is configured more than once");
                }
                configs.add(config);
            }
        } else {
            configs.add(toConfig(document, "document"));
        }
        return configs;
    }

    private ProgressTrackerConfig<S> toConfig(Object entry, String where) {
        if (!(entry instanceof Map<?, ?> map)) {
            throw new ProgressConfigException(where + " must be a mapping with a '" + PHASE + "' key");
        }
        for (Object key : map.keySet()) {
            if (!KEYS.contains(String.valueOf(key))) {
                throw new ProgressConfigException(
                    where + " has unrecognized key '" + key + "', expected one of " + KEYS);
            }
        }
        Object phaseName = map.get(PHASE);
        if (phaseName == null) {
            throw new ProgressConfigException(where + " is missing required key '" + PHASE + "'");
        }

        ProgressTrackerConfig<S> config = ProgressTrackerConfig.forPhase(resolve(phaseName, where));
        Object nextName = map.get(NEXT_PHASE);
        if (nextName != null) {
            config = config.continueTo(resolve(nextName, where));
        }
        return config;
    }

    private S resolve(Object name, String where) {
        if (name instanceof Map<?, ?> || name instanceof List<?>) {
            throw new ProgressConfigException(where + ": phase names must be scalars, got " + name);
        }
        S phase;
        try {
            phase = phaseResolver.apply(String.valueOf(name));
        } catch (IllegalArgumentException e) {
            throw new ProgressConfigException(where + ": unknown phase '" + name + "'", e);
        }
        if (phase == null) {
            throw new ProgressConfigException(where + ": unknown phase '" + name + "'");
        }
        return phase;
    }
}
