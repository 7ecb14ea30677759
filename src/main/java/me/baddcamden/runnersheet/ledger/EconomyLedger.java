package me.baddcamden.runnersheet.ledger;

import me.baddcamden.runnersheet.config.CreationRules;
import me.baddcamden.runnersheet.model.Character;
import me.baddcamden.runnersheet.model.Result;

import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Build point and karma economy.
 * <p>
 * Build points convert into starting nuyen through a fixed tier table; amounts between tiers
 * buy the lower tier. Karma costs are ruleset constants and never derived from the character.
 */
public class EconomyLedger {

    public static final int NEW_SKILL = 4;
    public static final int IMPROVE_SKILL_MULTIPLIER = 2;
    public static final int IMPROVE_ATTRIBUTE_MULTIPLIER = 5;
    public static final int INITIATION_BASE = 10;
    public static final int INITIATION_MULTIPLIER = 3;
    public static final int SPECIALIZATION = 2;
    public static final int NEW_KNOWLEDGE_SKILL = 2;
    public static final int IMPROVE_KNOWLEDGE_SKILL_MULTIPLIER = 1;
    public static final int NEW_SKILL_GROUP = 10;
    public static final int IMPROVE_SKILL_GROUP_MULTIPLIER = 5;
    public static final int NEW_SPELL = 5;
    public static final int NEW_COMPLEX_FORM = 5;

    private static final NavigableMap<Integer, Integer> NUYEN_BY_BP = new TreeMap<>(Map.of(
            0, 0,
            5, 20_000,
            10, 50_000,
            20, 90_000,
            30, 150_000,
            40, 225_000,
            50, 275_000));

    private final CreationRules rules;
    private final Logger logger;

    public EconomyLedger(CreationRules rules, Logger logger) {
        this.rules = Objects.requireNonNull(rules, "rules");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public EconomyLedger() {
        this(CreationRules.DEFAULTS, Logger.getLogger(EconomyLedger.class.getName()));
    }

    /**
     * Nuyen bought by a build point spend: the highest tier whose threshold does not exceed
     * {@code bp}. Below the first tier this is {@code 0}; above the last it stays at the top tier.
     */
    public static int bpToNuyen(int bp) {
        Map.Entry<Integer, Integer> tier = NUYEN_BY_BP.floorEntry(bp);
        return tier == null ? 0 : tier.getValue();
    }

    /**
     * Inverse of {@link #bpToNuyen(int)}: the build point tier a nuyen amount affords, i.e. the
     * highest tier whose nuyen value does not exceed {@code nuyen}.
     */
    public static int nuyenToBp(int nuyen) {
        int bp = 0;
        for (Map.Entry<Integer, Integer> tier : NUYEN_BY_BP.entrySet()) {
            if (tier.getValue() <= nuyen) {
                bp = tier.getKey();
            }
        }
        return bp;
    }

    public static int newSkillCost() {
        return NEW_SKILL;
    }

    public static int skillImprovementCost(int newRating) {
        return newRating * IMPROVE_SKILL_MULTIPLIER;
    }

    public static int attributeImprovementCost(int newRating) {
        return newRating * IMPROVE_ATTRIBUTE_MULTIPLIER;
    }

    public static int initiationCost(int newGrade) {
        return INITIATION_BASE + newGrade * INITIATION_MULTIPLIER;
    }

    public static int specializationCost() {
        return SPECIALIZATION;
    }

    public static int newKnowledgeSkillCost() {
        return NEW_KNOWLEDGE_SKILL;
    }

    public static int knowledgeSkillImprovementCost(int newRating) {
        return newRating * IMPROVE_KNOWLEDGE_SKILL_MULTIPLIER;
    }

    public static int newSkillGroupCost() {
        return NEW_SKILL_GROUP;
    }

    public static int skillGroupImprovementCost(int newRating) {
        return newRating * IMPROVE_SKILL_GROUP_MULTIPLIER;
    }

    public static int newSpellCost() {
        return NEW_SPELL;
    }

    public static int newComplexFormCost() {
        return NEW_COMPLEX_FORM;
    }

    /**
     * Spends build points on resources during creation. The spend is clamped to
     * {@code [0, resources cap]}, recorded in the allocation and converted to starting nuyen,
     * replacing whatever the character had.
     *
     * @param character character in creation mode
     * @param bp        requested build points
     * @return the updated character, or a failure outside creation mode
     */
    public Result<Character> allocateResources(Character character, int bp) {
        Objects.requireNonNull(character, "character");
        if (character.isCareer()) {
            logger.fine("Resource allocation rejected for " + character.id() + ": career mode");
            return Result.failure(character, "Resources can only be allocated in creation mode, not career mode");
        }
        int clamped = Math.max(0, Math.min(rules.resourcesCap(), bp));
        return Result.ok(character
                .withBuildPointsSpent(character.buildPointsSpent().withResources(clamped))
                .withNuyen(bpToNuyen(clamped)));
    }
}
