package me.baddcamden.runnersheet.config;

import me.baddcamden.runnersheet.effect.EffectCatalog;
import me.baddcamden.runnersheet.effect.EffectFormula;
import me.baddcamden.runnersheet.effect.FixedEffect;
import me.baddcamden.runnersheet.effect.ItemEffect;
import me.baddcamden.runnersheet.effect.LinearEffect;
import me.baddcamden.runnersheet.effect.MapEffectCatalog;
import me.baddcamden.runnersheet.effect.StandardEffects;
import me.baddcamden.runnersheet.model.AttributeCode;
import me.baddcamden.runnersheet.model.AttributeLimits;
import me.baddcamden.runnersheet.model.ImprovementSource;
import me.baddcamden.runnersheet.model.ImprovementTarget;
import me.baddcamden.runnersheet.model.Metatype;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Reference data and house rules read from {@code runnersheet.yml}.
 * <p>
 * Three top-level sections are recognised:
 * <ul>
 *     <li>{@code creation}: availability cap, forbidden flag, build point budget, starting
 *     essence and the {@code caps} subsection.</li>
 *     <li>{@code metatypes}: one entry per metatype with {@code bp} and per-attribute
 *     {@code {min, max, aug}} mappings keyed by attribute code.</li>
 *     <li>{@code effects}: extra item effects merged over the built-in table, each with a
 *     {@code source} and a list of formulas ({@code target} plus {@code per-rating} or
 *     {@code value}).</li>
 * </ul>
 * Every key has a default, so an empty file is valid. Malformed entries are logged at
 * {@code WARNING} and skipped; a file that cannot be read or parsed at all raises
 * {@link RulesConfigException}.
 */
public final class RulesConfig {

    public static final String DEFAULT_RESOURCE = "runnersheet.yml";

    private final CreationRules creation;
    private final MetatypeCatalog metatypes;
    private final EffectCatalog effects;

    public RulesConfig(CreationRules creation, MetatypeCatalog metatypes, EffectCatalog effects) {
        this.creation = Objects.requireNonNull(creation, "creation");
        this.metatypes = Objects.requireNonNull(metatypes, "metatypes");
        this.effects = Objects.requireNonNull(effects, "effects");
    }

    public CreationRules creation() {
        return creation;
    }

    public MetatypeCatalog metatypes() {
        return metatypes;
    }

    public EffectCatalog effects() {
        return effects;
    }

    /**
     * Loads the bundled {@value #DEFAULT_RESOURCE} from the classpath.
     */
    public static RulesConfig loadDefault(Logger logger) {
        InputStream stream = RulesConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
        if (stream == null) {
            throw new RulesConfigException("Missing bundled resource " + DEFAULT_RESOURCE);
        }
        try (InputStream input = stream) {
            return load(input, logger);
        } catch (IOException ex) {
            throw new RulesConfigException("Failed to read bundled " + DEFAULT_RESOURCE, ex);
        }
    }

    public static RulesConfig load(Path path, Logger logger) {
        try (InputStream input = Files.newInputStream(path)) {
            return load(input, logger);
        } catch (IOException ex) {
            throw new RulesConfigException("Failed to read rules config " + path, ex);
        }
    }

    /**
     * Parses a YAML document. The stream is not closed.
     */
    public static RulesConfig load(InputStream input, Logger logger) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(logger, "logger");
        Object document;
        try {
            document = new Yaml(new SafeConstructor(new LoaderOptions())).load(input);
        } catch (YAMLException ex) {
            throw new RulesConfigException("Malformed rules config: " + ex.getMessage(), ex);
        }
        if (document == null) {
            return fromSection(ConfigSection.empty(), logger);
        }
        if (!(document instanceof Map<?, ?> root)) {
            throw new RulesConfigException("Rules config root must be a mapping");
        }
        return fromSection(new ConfigSection(root), logger);
    }

    private static RulesConfig fromSection(ConfigSection root, Logger logger) {
        CreationRules creation = creationRules(root, logger);
        MetatypeCatalog metatypes = new MetatypeCatalog(metatypes(root, logger));
        List<ItemEffect> customEffects = effects(root, logger);
        EffectCatalog effects = new MapEffectCatalog(StandardEffects.definitions()).merge(customEffects);
        logger.info("Loaded " + metatypes.all().size() + " metatypes and " + customEffects.size() + " custom effects");
        return new RulesConfig(creation, metatypes, effects);
    }

    private static CreationRules creationRules(ConfigSection root, Logger logger) {
        CreationRules defaults = CreationRules.DEFAULTS;
        try {
            return new CreationRules(
                    root.getInt("creation.max-availability", defaults.maxAvailability()),
                    root.getBoolean("creation.allow-forbidden", defaults.allowForbidden()),
                    root.getInt("creation.build-points", defaults.buildPoints()),
                    root.getDouble("creation.starting-essence", defaults.startingEssence()),
                    root.getInt("creation.caps.positive-qualities", defaults.positiveQualityCap()),
                    root.getInt("creation.caps.negative-qualities", defaults.negativeQualityCap()),
                    root.getInt("creation.caps.resources", defaults.resourcesCap()),
                    root.getInt("creation.caps.skill-rating", defaults.skillRatingCap()));
        } catch (IllegalArgumentException ex) {
            logger.warning("Invalid creation section, using defaults: " + ex.getMessage());
            return defaults;
        }
    }

    private static List<Metatype> metatypes(ConfigSection root, Logger logger) {
        ConfigSection section = root.getSection("metatypes");
        if (section == null) {
            logger.warning("No metatypes section found; only Human will be available.");
            return List.of(new Metatype("Human", 0, Map.of()));
        }

        List<Metatype> metatypes = new ArrayList<>();
        for (String name : section.getKeys()) {
            ConfigSection entry = section.getSection(name);
            if (entry == null) {
                logger.warning("Skipping metatype '" + name + "': expected a mapping");
                continue;
            }
            Map<AttributeCode, AttributeLimits> limits = new EnumMap<>(AttributeCode.class);
            for (String key : entry.getKeys()) {
                if (key.equals("bp")) {
                    continue;
                }
                Optional<AttributeCode> code = AttributeCode.fromCode(key);
                if (code.isEmpty()) {
                    logger.warning("Unknown attribute '" + key + "' for metatype " + name);
                    continue;
                }
                attributeLimits(entry.getSection(key), code.get(), name, logger)
                        .ifPresent(limit -> limits.put(code.get(), limit));
            }
            metatypes.add(new Metatype(name, entry.getInt("bp", 0), limits));
        }
        return metatypes;
    }

    private static Optional<AttributeLimits> attributeLimits(ConfigSection entry, AttributeCode code, String metatype, Logger logger) {
        if (entry == null) {
            logger.warning("Skipping " + code.code() + " limits for " + metatype + ": expected {min, max, aug}");
            return Optional.empty();
        }
        AttributeLimits fallback = AttributeLimits.defaultFor(code);
        int min = entry.getInt("min", fallback.min());
        int max = entry.getInt("max", fallback.max());
        int aug = entry.getInt("aug", Math.max(max, fallback.aug()));
        try {
            return Optional.of(new AttributeLimits(min, max, aug));
        } catch (IllegalArgumentException ex) {
            logger.warning("Skipping " + code.code() + " limits for " + metatype + ": " + ex.getMessage());
            return Optional.empty();
        }
    }

    private static List<ItemEffect> effects(ConfigSection root, Logger logger) {
        ConfigSection section = root.getSection("effects");
        if (section == null) {
            return List.of();
        }

        List<ItemEffect> effects = new ArrayList<>();
        for (String key : section.getKeys()) {
            ConfigSection entry = section.getSection(key);
            if (entry == null) {
                logger.warning("Skipping effect '" + key + "': expected a mapping");
                continue;
            }
            Optional<ImprovementSource> source = parseSource(entry.getString("source", null));
            if (source.isEmpty()) {
                logger.warning("Skipping effect '" + key + "': unknown source " + entry.getString("source", "<none>"));
                continue;
            }
            List<EffectFormula> formulas = new ArrayList<>();
            for (Object raw : entry.getList("effects")) {
                if (!(raw instanceof Map<?, ?> map)) {
                    logger.warning("Skipping formula for effect '" + key + "': expected a mapping");
                    continue;
                }
                formula(new ConfigSection(map), key, logger).ifPresent(formulas::add);
            }
            if (formulas.isEmpty()) {
                logger.warning("Skipping effect '" + key + "': no valid formulas");
                continue;
            }
            effects.add(new ItemEffect(key, source.get(), formulas));
        }
        return effects;
    }

    private static Optional<EffectFormula> formula(ConfigSection entry, String effectKey, Logger logger) {
        Optional<ImprovementTarget> target = ImprovementTarget.fromKey(entry.getString("target", null));
        if (target.isEmpty()) {
            logger.warning("Skipping formula for effect '" + effectKey + "': unknown target "
                    + entry.getString("target", "<none>"));
            return Optional.empty();
        }
        String suffix = entry.getString("suffix", target.get().key());
        String conditional = entry.getString("conditional", null);
        if (entry.isSet("per-rating")) {
            return Optional.of(new LinearEffect(target.get(), suffix, entry.getDouble("per-rating", 1), conditional));
        }
        if (entry.isSet("value")) {
            return Optional.of(new FixedEffect(target.get(), suffix, entry.getDouble("value", 0), conditional));
        }
        logger.warning("Skipping formula for effect '" + effectKey + "': needs per-rating or value");
        return Optional.empty();
    }

    private static Optional<ImprovementSource> parseSource(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(ImprovementSource.valueOf(raw.trim().toUpperCase(Locale.ROOT).replace('-', '_')));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
