package me.baddcamden.runnersheet.compute;

import me.baddcamden.runnersheet.ledger.EssenceLedger;
import me.baddcamden.runnersheet.model.AttributeCode;
import me.baddcamden.runnersheet.model.Character;
import me.baddcamden.runnersheet.model.DerivedStats;
import me.baddcamden.runnersheet.model.Improvement;
import me.baddcamden.runnersheet.model.ImprovementTarget;
import me.baddcamden.runnersheet.model.Skill;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static me.baddcamden.runnersheet.model.AttributeCode.AGI;
import static me.baddcamden.runnersheet.model.AttributeCode.BOD;
import static me.baddcamden.runnersheet.model.AttributeCode.CHA;
import static me.baddcamden.runnersheet.model.AttributeCode.INT;
import static me.baddcamden.runnersheet.model.AttributeCode.LOG;
import static me.baddcamden.runnersheet.model.AttributeCode.REA;
import static me.baddcamden.runnersheet.model.AttributeCode.RES;
import static me.baddcamden.runnersheet.model.AttributeCode.STR;
import static me.baddcamden.runnersheet.model.AttributeCode.WIL;

/**
 * Applies the ruleset formulas to a character snapshot.
 * <p>
 * {@link #deriveAll(Character)} aggregates improvements once, resolves every attribute against
 * them and evaluates each formula in turn. Nothing is cached between calls; the caller invokes it
 * again after each edit. The individual formulas are also exposed as static functions over plain
 * numbers so they can be checked in isolation.
 * <p>
 * Rounding follows the ruleset exactly: condition monitors and limits round up, essence in the
 * social limit and the wound modifier round down.
 */
public class DerivedStatsCalculator {

    public static final int ASTRAL_INITIATIVE_DICE = 2;
    public static final int MATRIX_INITIATIVE_DICE = 3;
    public static final String DODGE_SKILL = "Dodge";

    private final ImprovementAggregator aggregator;
    private final AttributeResolver attributeResolver;
    private final EssenceLedger essenceLedger;

    public DerivedStatsCalculator(ImprovementAggregator aggregator,
                                  AttributeResolver attributeResolver,
                                  EssenceLedger essenceLedger) {
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.attributeResolver = Objects.requireNonNull(attributeResolver, "attributeResolver");
        this.essenceLedger = Objects.requireNonNull(essenceLedger, "essenceLedger");
    }

    /**
     * Computes every derived number for a character.
     *
     * @param character character snapshot
     * @return flat snapshot of derived values
     */
    public DerivedStats deriveAll(Character character) {
        Objects.requireNonNull(character, "character");
        List<Improvement> improvements = aggregator.aggregate(character);
        Map<AttributeCode, AttributeStages> attributes = attributeResolver.resolveAll(character, improvements);

        int bod = attributes.get(BOD).resolved();
        int agi = attributes.get(AGI).resolved();
        int rea = attributes.get(REA).resolved();
        int str = attributes.get(STR).resolved();
        int cha = attributes.get(CHA).resolved();
        int intuition = attributes.get(INT).resolved();
        int log = attributes.get(LOG).resolved();
        int wil = attributes.get(WIL).resolved();
        int res = attributes.get(RES).resolved();
        double essence = essenceLedger.essence(character);

        int initiativeBonus = total(improvements, ImprovementTarget.INITIATIVE);
        int woundModifier = woundModifier(character.condition().physicalDamage(), character.condition().stunDamage());
        ArmorTotals armor = armor(character, improvements);
        int wornBallistic = ArmorTotals.worn(character.equipment().armor()).ballistic();

        return new DerivedStats(
                physicalConditionMonitor(bod, total(improvements, ImprovementTarget.PHYSICAL_CM)),
                stunConditionMonitor(wil, total(improvements, ImprovementTarget.STUN_CM)),
                bod,
                woundModifier,
                rea + intuition + initiativeBonus,
                initiativeBonus,
                1 + total(improvements, ImprovementTarget.INITIATIVE_DICE),
                agi * 2,
                agi * 4,
                sprintBonus(character.identity().metatype()),
                physicalLimit(str, bod, rea) + total(improvements, ImprovementTarget.PHYSICAL_LIMIT),
                mentalLimit(log, intuition, wil) + total(improvements, ImprovementTarget.MENTAL_LIMIT),
                socialLimit(cha, wil, essence) + total(improvements, ImprovementTarget.SOCIAL_LIMIT),
                rea + intuition,
                dicePool(character, rea, woundModifier, DODGE_SKILL),
                armor.ballistic(),
                armor.impact(),
                encumbrance(wornBallistic, bod),
                cha + wil + total(improvements, ImprovementTarget.COMPOSURE),
                cha + intuition + total(improvements, ImprovementTarget.JUDGE_INTENTIONS),
                log + wil + total(improvements, ImprovementTarget.MEMORY),
                bod + str,
                total(improvements, ImprovementTarget.DAMAGE_RESISTANCE),
                total(improvements, ImprovementTarget.SPELL_RESISTANCE),
                essence,
                drainResistance(character, wil, log, cha),
                intuition * 2,
                ASTRAL_INITIATIVE_DICE,
                character.isEmerged() ? res + wil : 0,
                intuition + res,
                MATRIX_INITIATIVE_DICE);
    }

    /**
     * Physical condition monitor for a character, improvements included.
     */
    public int physicalConditionMonitor(Character character) {
        List<Improvement> improvements = aggregator.aggregate(character);
        int bod = attributeResolver.resolveAttribute(character, improvements, BOD);
        return physicalConditionMonitor(bod, total(improvements, ImprovementTarget.PHYSICAL_CM));
    }

    /**
     * Skill test dice pool.
     * <p>
     * With the skill: rating + attribute + skill bonus. Without it the character defaults to
     * attribute - 1. The wound modifier applies in both cases and the pool never drops below
     * zero.
     *
     * @param character character rolling
     * @param skillName skill name, matched case-insensitively
     * @param attribute linked attribute
     * @return dice pool
     */
    public int dicePool(Character character, String skillName, AttributeCode attribute) {
        int attributeValue = attributeResolver.resolveAttribute(character, attribute);
        int woundModifier = woundModifier(character.condition().physicalDamage(), character.condition().stunDamage());
        return dicePool(character, attributeValue, woundModifier, skillName);
    }

    /**
     * Armor worn plus armor improvements (dermal plating, orthoskin, mystic armor, bone lacing).
     */
    public ArmorTotals armor(Character character) {
        return armor(character, aggregator.aggregate(character));
    }

    private ArmorTotals armor(Character character, List<Improvement> improvements) {
        return ArmorTotals.worn(character.equipment().armor()).plus(
                total(improvements, ImprovementTarget.ARMOR_BALLISTIC),
                total(improvements, ImprovementTarget.ARMOR_IMPACT));
    }

    private static int dicePool(Character character, int attributeValue, int woundModifier, String skillName) {
        Optional<Skill> skill = character.findSkill(skillName);
        int pool = skill
                .map(found -> found.rating() + attributeValue + found.bonus())
                .orElse(attributeValue - 1);
        return Math.max(0, pool + woundModifier);
    }

    private static int drainResistance(Character character, int wil, int log, int cha) {
        if (!character.isAwakened()) {
            return 0;
        }
        String tradition = character.magic().tradition() == null
                ? ""
                : character.magic().tradition().toLowerCase(Locale.ROOT);
        if (tradition.contains("hermetic") || tradition.contains("chaos")) {
            return wil + log;
        }
        return wil + cha;
    }

    private static int total(List<Improvement> improvements, ImprovementTarget target) {
        return StackResolver.intTotalFor(improvements, target);
    }

    public static int physicalConditionMonitor(int bod, int bonus) {
        return ceilHalf(bod) + 8 + bonus;
    }

    public static int stunConditionMonitor(int wil, int bonus) {
        return ceilHalf(wil) + 8 + bonus;
    }

    /**
     * Every full three boxes of combined physical and stun damage cost one die.
     *
     * @return zero or a negative modifier
     */
    public static int woundModifier(int physicalDamage, int stunDamage) {
        return -Math.floorDiv(physicalDamage + stunDamage, 3);
    }

    public static int physicalLimit(int str, int bod, int rea) {
        return ceilThird(str * 2 + bod + rea);
    }

    public static int mentalLimit(int log, int intuition, int wil) {
        return ceilThird(log * 2 + intuition + wil);
    }

    public static int socialLimit(int cha, int wil, double essence) {
        // graded essence sums can land a hair under a whole number
        return ceilThird(cha * 2 + wil + (int) Math.floor(essence + 1e-9d));
    }

    public static int encumbrance(int wornBallistic, int bod) {
        return Math.max(0, wornBallistic - bod);
    }

    /**
     * Metatype sprint bonus in meters per hit: elves 1, centaurs 2, everyone else 0.
     */
    public static int sprintBonus(String metatype) {
        if (metatype == null) {
            return 0;
        }
        String normalized = metatype.toLowerCase(Locale.ROOT);
        if (normalized.contains("centaur")) {
            return 2;
        }
        if (normalized.contains("elf")) {
            return 1;
        }
        return 0;
    }

    private static int ceilHalf(int value) {
        return -Math.floorDiv(-value, 2);
    }

    private static int ceilThird(int value) {
        return -Math.floorDiv(-value, 3);
    }
}
