/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Seeds.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.seeds.engine.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.seeds.engine.DeadlockStrategy;
import com.hellblazer.seeds.engine.RoundMode;
import com.hellblazer.seeds.engine.TieBreakingStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.function.Consumer;

/**
 * Reads an {@link EngineConfig} from JSON.
 * <p>
 * Every field is optional; an absent field falls back to the builder default and is reported at warn level so a typo
 * in a deployment file does not silently change the economics. Example:
 * <pre>
 * {
 *   "periodDuration": 86400,
 *   "blessingWeight": 1000,
 *   "timeDecayBase": 1000,
 *   "timeDecayMin": 10,
 *   "roundMode": "ROUND_BASED",
 *   "tieBreakingStrategy": "LOWEST_SEED_ID",
 *   "deadlockStrategy": "REVERT",
 *   "treasury": "0x..."
 * }
 * </pre>
 *
 * @author hal.hildebrand
 */
public class EngineConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(EngineConfigLoader.class);

    private final ObjectMapper objectMapper;

    public EngineConfigLoader() {
        this(new ObjectMapper());
    }

    public EngineConfigLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public EngineConfig load(Path file) throws IOException {
        try (var in = Files.newInputStream(file)) {
            log.info("Loading engine configuration from {}", file);
            return load(in);
        }
    }

    public EngineConfig load(InputStream in) throws IOException {
        return fromTree(objectMapper.readTree(in));
    }

    /**
     * Load from a classpath resource.
     *
     * @throws IOException if the resource is absent or unreadable
     */
    public EngineConfig loadResource(String resource) throws IOException {
        try (var in = EngineConfigLoader.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("Configuration resource not found: " + resource);
            }
            log.info("Loading engine configuration from resource {}", resource);
            return load(in);
        }
    }

    public EngineConfig parse(String json) throws IOException {
        return fromTree(objectMapper.readTree(json));
    }

    private EngineConfig fromTree(JsonNode root) {
        var builder = EngineConfig.builder();
        if (root == null || root.isNull() || root.isMissingNode()) {
            log.warn("Engine configuration is empty, using defaults");
            return builder.build();
        }
        if (!root.isObject()) {
            throw new IllegalStateException("Engine configuration root must be a JSON object");
        }

        var decayBase = longField(root, "timeDecayBase", ScoringParameters.defaults().timeDecayBase());
        var decayMin = longField(root, "timeDecayMin", ScoringParameters.defaults().timeDecayMin());
        builder.withTimeDecay(decayBase, decayMin);

        readLong(root, "periodDuration", builder::withPeriodDuration);
        readLong(root, "blessingWeight", builder::withBlessingWeight);
        readLong(root, "commandmentWeight", builder::withCommandmentWeight);
        readLong(root, "blessingCost", builder::withBlessingCost);
        readLong(root, "commandmentCost", builder::withCommandmentCost);
        readInt(root, "blessingsPerUnit", builder::withBlessingsPerUnit);
        readInt(root, "commandmentsPerUnit", builder::withCommandmentsPerUnit);
        readInt(root, "maxTotalSeeds", builder::withMaxTotalSeeds);
        readInt(root, "maxSeedsPerRound", builder::withMaxSeedsPerRound);
        readInt(root, "maxBatchSize", builder::withMaxBatchSize);
        readText(root, "roundMode", v -> builder.withRoundMode(parseEnum(RoundMode.class, "roundMode", v)));
        readText(root, "tieBreakingStrategy", v -> builder.withTieBreakingStrategy(
        parseEnum(TieBreakingStrategy.class, "tieBreakingStrategy", v)));
        readText(root, "deadlockStrategy",
                 v -> builder.withDeadlockStrategy(parseEnum(DeadlockStrategy.class, "deadlockStrategy", v)));
        readText(root, "treasury", builder::withTreasury);
        var reset = root.get("scoreResetOnRoundEnd");
        if (reset == null) {
            missing("scoreResetOnRoundEnd");
        } else {
            builder.withScoreResetOnRoundEnd(reset.asBoolean());
        }

        var config = builder.build();
        log.debug("Loaded {}", config);
        return config;
    }

    private static long longField(JsonNode root, String name, long fallback) {
        var node = root.get(name);
        if (node == null) {
            missing(name);
            return fallback;
        }
        if (!node.canConvertToLong()) {
            throw new IllegalArgumentException("Field " + name + " must be an integer: " + node);
        }
        return node.asLong();
    }

    private static void missing(String name) {
        log.warn("Engine configuration missing field {} -> fallback to default", name);
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String name, String value) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown " + name + ": " + value, e);
        }
    }

    private static void readInt(JsonNode root, String name, Consumer<Integer> setter) {
        var node = root.get(name);
        if (node == null) {
            missing(name);
            return;
        }
        if (!node.canConvertToInt()) {
            throw new IllegalArgumentException("Field " + name + " must be an integer: " + node);
        }
        setter.accept(node.asInt());
    }

    private static void readLong(JsonNode root, String name, Consumer<Long> setter) {
        var node = root.get(name);
        if (node == null) {
            missing(name);
            return;
        }
        setter.accept(longField(root, name, 0L));
    }

    private static void readText(JsonNode root, String name, Consumer<String> setter) {
        var node = root.get(name);
        if (node == null || node.isNull()) {
            missing(name);
            return;
        }
        setter.accept(node.asText());
    }
}
