package me.baddcamden.runnersheet.api;

import me.baddcamden.runnersheet.compute.AttributeResolver;
import me.baddcamden.runnersheet.compute.DerivedStatsCalculator;
import me.baddcamden.runnersheet.compute.ImprovementAggregator;
import me.baddcamden.runnersheet.config.MetatypeCatalog;
import me.baddcamden.runnersheet.config.RulesConfig;
import me.baddcamden.runnersheet.ledger.CareerLedger;
import me.baddcamden.runnersheet.ledger.EconomyLedger;
import me.baddcamden.runnersheet.ledger.EssenceLedger;
import me.baddcamden.runnersheet.model.Character;
import me.baddcamden.runnersheet.model.DerivedStats;
import me.baddcamden.runnersheet.model.Improvement;
import me.baddcamden.runnersheet.model.Result;
import me.baddcamden.runnersheet.validation.ValidationEngine;
import me.baddcamden.runnersheet.validation.ValidationResult;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Single entry point wiring the rules components together from one {@link RulesConfig}.
 * <p>
 * The engine holds no character state. Every call takes a character snapshot and either reads
 * from it or returns a {@link Result} carrying a new snapshot, so one instance may serve any
 * number of characters from any thread.
 */
public class RulesEngine {

    private final RulesConfig config;
    private final ImprovementAggregator aggregator;
    private final AttributeResolver attributeResolver;
    private final EssenceLedger essenceLedger;
    private final EconomyLedger economyLedger;
    private final CareerLedger careerLedger;
    private final DerivedStatsCalculator calculator;
    private final ValidationEngine validationEngine;

    public RulesEngine(RulesConfig config, Logger logger) {
        this.config = Objects.requireNonNull(config, "config");
        Objects.requireNonNull(logger, "logger");
        this.aggregator = new ImprovementAggregator(config.effects(), logger);
        this.attributeResolver = new AttributeResolver(aggregator);
        this.essenceLedger = new EssenceLedger(config.creation().startingEssence(), logger);
        this.economyLedger = new EconomyLedger(config.creation(), logger);
        this.careerLedger = new CareerLedger(logger);
        this.calculator = new DerivedStatsCalculator(aggregator, attributeResolver, essenceLedger);
        this.validationEngine = new ValidationEngine(config.creation(), aggregator, attributeResolver, essenceLedger);
    }

    /**
     * Engine over the bundled rules file, logging to this class's logger.
     */
    public static RulesEngine withDefaults() {
        Logger logger = Logger.getLogger(RulesEngine.class.getName());
        return new RulesEngine(RulesConfig.loadDefault(logger), logger);
    }

    public static RulesEngine from(RulesConfig config, Logger logger) {
        return new RulesEngine(config, logger);
    }

    /**
     * Starts a blank creation-mode sheet with the configured budget and availability settings,
     * then applies the named metatype.
     *
     * @param name     character name, may be blank
     * @param metatype metatype name, matched case-insensitively
     * @return the new character, or a failure carrying the unapplied sheet for an unknown metatype
     */
    public Result<Character> newCharacter(String name, String metatype) {
        Character blank = Character.builder()
                .name(name)
                .buildPoints(config.creation().buildPoints())
                .settings(config.creation().defaultSettings())
                .build();
        return config.metatypes().apply(blank, metatype);
    }

    public List<Improvement> improvements(Character character) {
        return aggregator.aggregate(character);
    }

    public DerivedStats deriveAll(Character character) {
        return calculator.deriveAll(character);
    }

    public ValidationResult validate(Character character) {
        return validationEngine.validate(character);
    }

    /**
     * Derived statistics, validation and the improvement list in one call.
     */
    public CharacterEvaluation evaluate(Character character) {
        Objects.requireNonNull(character, "character");
        return new CharacterEvaluation(
                calculator.deriveAll(character),
                validationEngine.validate(character),
                aggregator.aggregate(character));
    }

    public RulesConfig config() {
        return config;
    }

    public MetatypeCatalog metatypes() {
        return config.metatypes();
    }

    public AttributeResolver attributes() {
        return attributeResolver;
    }

    public DerivedStatsCalculator calculator() {
        return calculator;
    }

    public ValidationEngine validator() {
        return validationEngine;
    }

    public EssenceLedger essence() {
        return essenceLedger;
    }

    public EconomyLedger economy() {
        return economyLedger;
    }

    public CareerLedger career() {
        return careerLedger;
    }
}
