package me.baddcamden.runnersheet.ledger;

import me.baddcamden.runnersheet.model.AttributeCode;
import me.baddcamden.runnersheet.model.AttributeLimits;
import me.baddcamden.runnersheet.model.AttributeValue;
import me.baddcamden.runnersheet.model.Character;
import me.baddcamden.runnersheet.model.CharacterMode;
import me.baddcamden.runnersheet.model.ExpenseEntry;
import me.baddcamden.runnersheet.model.KnowledgeSkill;
import me.baddcamden.runnersheet.model.Result;
import me.baddcamden.runnersheet.model.Skill;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Post-creation advancement: karma and nuyen awards, spends and karma-bought improvements.
 * <p>
 * Every operation returns a {@link Result}. A successful operation appends an
 * {@link ExpenseEntry} to the character's expense log (gains positive, spends negative). Spends
 * require career mode and are checked in a fixed order: mode, then eligibility (skill present,
 * below maximum, awakened), then karma. Awards are accepted in either mode.
 */
public class CareerLedger {

    public static final int MAX_SKILL_RATING = 6;

    private final Logger logger;

    public CareerLedger(Logger logger) {
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public CareerLedger() {
        this(Logger.getLogger(CareerLedger.class.getName()));
    }

    public Result<Character> enterCareerMode(Character character) {
        Objects.requireNonNull(character, "character");
        if (character.isCareer()) {
            return reject(character, "Character is already in career mode");
        }
        return Result.ok(character.withMode(CharacterMode.CAREER));
    }

    public Result<Character> awardKarma(Character character, int amount, String reason) {
        Objects.requireNonNull(character, "character");
        if (amount <= 0) {
            return reject(character, "Karma award must be positive");
        }
        try {
            return Result.ok(character
                    .withKarma(Math.addExact(character.karma(), amount))
                    .withTotalKarma(Math.addExact(character.totalKarma(), amount))
                    .withExpense(ExpenseEntry.karma(amount, reason)));
        } catch (ArithmeticException e) {
            return reject(character, "Karma award of " + amount + " would overflow the karma balance");
        }
    }

    public Result<Character> awardNuyen(Character character, int amount, String reason) {
        Objects.requireNonNull(character, "character");
        if (amount <= 0) {
            return reject(character, "Nuyen award must be positive");
        }
        try {
            return Result.ok(character
                    .withNuyen(Math.addExact(character.nuyen(), amount))
                    .withExpense(ExpenseEntry.nuyen(amount, reason)));
        } catch (ArithmeticException e) {
            return reject(character, "Nuyen award of " + amount + " would overflow the nuyen balance");
        }
    }

    public Result<Character> spendNuyen(Character character, int amount, String reason) {
        Objects.requireNonNull(character, "character");
        if (!character.isCareer()) {
            return notCareer(character);
        }
        if (amount <= 0) {
            return reject(character, "Nuyen spend must be positive");
        }
        if (amount > character.nuyen()) {
            return reject(character, "Not enough nuyen: requires " + amount + ", available " + character.nuyen());
        }
        return Result.ok(character
                .withNuyen(character.nuyen() - amount)
                .withExpense(ExpenseEntry.nuyen(-amount, reason)));
    }

    /**
     * Raises an attribute's base by one for {@code newRating * 5} karma.
     */
    public Result<Character> improveAttribute(Character character, AttributeCode code) {
        Objects.requireNonNull(character, "character");
        Objects.requireNonNull(code, "code");
        if (!character.isCareer()) {
            return notCareer(character);
        }
        if (code == AttributeCode.MAG && !character.isAwakened()) {
            return reject(character, "Character is not awakened");
        }
        if (code == AttributeCode.RES && !character.isEmerged()) {
            return reject(character, "Character is not a technomancer");
        }
        AttributeValue current = character.attributes().get(code);
        AttributeLimits limits = character.limitsFor(code);
        if (current.base() >= limits.max()) {
            return reject(character, code.displayName() + " is already at maximum (" + limits.max() + ")");
        }
        int newRating = current.base() + 1;
        int cost = EconomyLedger.attributeImprovementCost(newRating);
        if (cost > character.karma()) {
            return notEnoughKarma(character, cost);
        }
        return spendKarma(character.withAttributes(character.attributes().with(code, current.advance(cost))),
                cost, "Improved " + code.displayName() + " to " + newRating);
    }

    /**
     * Raises an active skill by one for {@code newRating * 2} karma.
     */
    public Result<Character> improveSkill(Character character, String skillName) {
        Objects.requireNonNull(character, "character");
        if (!character.isCareer()) {
            return notCareer(character);
        }
        Optional<Skill> skill = character.findSkill(skillName);
        if (skill.isEmpty()) {
            return reject(character, "Skill not found: " + skillName);
        }
        if (skill.get().rating() >= MAX_SKILL_RATING) {
            return reject(character, skill.get().name() + " is already at maximum (" + MAX_SKILL_RATING + ")");
        }
        int newRating = skill.get().rating() + 1;
        int cost = EconomyLedger.skillImprovementCost(newRating);
        if (cost > character.karma()) {
            return notEnoughKarma(character, cost);
        }
        return spendKarma(character.withSkill(skill.get().withRating(newRating)),
                cost, "Improved " + skill.get().name() + " to " + newRating);
    }

    /**
     * Learns a new active skill at rating 1 for 4 karma.
     */
    public Result<Character> learnSkill(Character character, String skillName, AttributeCode attribute) {
        Objects.requireNonNull(character, "character");
        Objects.requireNonNull(skillName, "skillName");
        if (!character.isCareer()) {
            return notCareer(character);
        }
        if (character.findSkill(skillName).isPresent()) {
            return reject(character, "Already has skill: " + skillName);
        }
        int cost = EconomyLedger.newSkillCost();
        if (cost > character.karma()) {
            return notEnoughKarma(character, cost);
        }
        return spendKarma(character.withSkill(Skill.of(skillName, attribute, 1)), cost, "Learned " + skillName);
    }

    /**
     * Adds a specialization to a skill that has none, for 2 karma.
     */
    public Result<Character> addSpecialization(Character character, String skillName, String specialization) {
        Objects.requireNonNull(character, "character");
        if (!character.isCareer()) {
            return notCareer(character);
        }
        Optional<Skill> skill = character.findSkill(skillName);
        if (skill.isEmpty()) {
            return reject(character, "Skill not found: " + skillName);
        }
        if (skill.get().specialization() != null && !skill.get().specialization().isBlank()) {
            return reject(character, skill.get().name() + " already has a specialization");
        }
        int cost = EconomyLedger.specializationCost();
        if (cost > character.karma()) {
            return notEnoughKarma(character, cost);
        }
        return spendKarma(character.withSkill(skill.get().withSpecialization(specialization)),
                cost, "Specialized " + skill.get().name() + " in " + specialization);
    }

    public Result<Character> learnKnowledgeSkill(Character character, String skillName, String category) {
        Objects.requireNonNull(character, "character");
        Objects.requireNonNull(skillName, "skillName");
        if (!character.isCareer()) {
            return notCareer(character);
        }
        if (character.findKnowledgeSkill(skillName).isPresent()) {
            return reject(character, "Already has knowledge skill: " + skillName);
        }
        int cost = EconomyLedger.newKnowledgeSkillCost();
        if (cost > character.karma()) {
            return notEnoughKarma(character, cost);
        }
        return spendKarma(character.withKnowledgeSkill(new KnowledgeSkill(skillName, category, 1)),
                cost, "Learned knowledge skill " + skillName);
    }

    public Result<Character> improveKnowledgeSkill(Character character, String skillName) {
        Objects.requireNonNull(character, "character");
        if (!character.isCareer()) {
            return notCareer(character);
        }
        Optional<KnowledgeSkill> skill = character.findKnowledgeSkill(skillName);
        if (skill.isEmpty()) {
            return reject(character, "Knowledge skill not found: " + skillName);
        }
        if (skill.get().rating() >= MAX_SKILL_RATING) {
            return reject(character, skill.get().name() + " is already at maximum (" + MAX_SKILL_RATING + ")");
        }
        int newRating = skill.get().rating() + 1;
        int cost = EconomyLedger.knowledgeSkillImprovementCost(newRating);
        if (cost > character.karma()) {
            return notEnoughKarma(character, cost);
        }
        return spendKarma(character.withKnowledgeSkill(skill.get().withRating(newRating)),
                cost, "Improved " + skill.get().name() + " to " + newRating);
    }

    public Result<Character> learnSpell(Character character, String spell) {
        Objects.requireNonNull(character, "character");
        Objects.requireNonNull(spell, "spell");
        if (!character.isCareer()) {
            return notCareer(character);
        }
        if (!character.isAwakened()) {
            return reject(character, "Character is not awakened");
        }
        if (character.magic().spells().stream().anyMatch(known -> known.equalsIgnoreCase(spell))) {
            return reject(character, "Already has spell: " + spell);
        }
        int cost = EconomyLedger.newSpellCost();
        if (cost > character.karma()) {
            return notEnoughKarma(character, cost);
        }
        return spendKarma(character.withMagic(character.magic().addSpell(spell)), cost, "Learned spell " + spell);
    }

    public Result<Character> learnComplexForm(Character character, String complexForm) {
        Objects.requireNonNull(character, "character");
        Objects.requireNonNull(complexForm, "complexForm");
        if (!character.isCareer()) {
            return notCareer(character);
        }
        if (!character.isEmerged()) {
            return reject(character, "Character is not a technomancer");
        }
        if (character.resonance().complexForms().stream().anyMatch(known -> known.equalsIgnoreCase(complexForm))) {
            return reject(character, "Already has complex form: " + complexForm);
        }
        int cost = EconomyLedger.newComplexFormCost();
        if (cost > character.karma()) {
            return notEnoughKarma(character, cost);
        }
        return spendKarma(character.withResonance(character.resonance().addComplexForm(complexForm)),
                cost, "Learned complex form " + complexForm);
    }

    /**
     * Raises the initiate grade by one for {@code 10 + newGrade * 3} karma.
     */
    public Result<Character> initiate(Character character) {
        Objects.requireNonNull(character, "character");
        if (!character.isCareer()) {
            return notCareer(character);
        }
        if (!character.isAwakened()) {
            return reject(character, "Character is not awakened");
        }
        int newGrade = character.magic().initiateGrade() + 1;
        int cost = EconomyLedger.initiationCost(newGrade);
        if (cost > character.karma()) {
            return notEnoughKarma(character, cost);
        }
        return spendKarma(character.withMagic(character.magic().withInitiateGrade(newGrade)),
                cost, "Initiated to grade " + newGrade);
    }

    private static Result<Character> spendKarma(Character updated, int cost, String reason) {
        return Result.ok(updated
                .withKarma(updated.karma() - cost)
                .withExpense(ExpenseEntry.karma(-cost, reason)));
    }

    private Result<Character> notCareer(Character character) {
        return reject(character, "Character must be in career mode");
    }

    private Result<Character> notEnoughKarma(Character character, int cost) {
        return reject(character, "Not enough karma: requires " + cost + ", available " + character.karma());
    }

    private Result<Character> reject(Character character, String reason) {
        logger.fine("Career operation rejected for " + character.id() + ": " + reason);
        return Result.failure(character, reason);
    }
}
