package me.baddcamden.runnersheet.validation;

import me.baddcamden.runnersheet.compute.AttributeResolver;
import me.baddcamden.runnersheet.compute.ImprovementAggregator;
import me.baddcamden.runnersheet.config.CreationRules;
import me.baddcamden.runnersheet.ledger.EssenceLedger;
import me.baddcamden.runnersheet.model.AttributeCode;
import me.baddcamden.runnersheet.model.AttributeLimits;
import me.baddcamden.runnersheet.model.Character;
import me.baddcamden.runnersheet.model.Contact;
import me.baddcamden.runnersheet.model.Improvement;
import me.baddcamden.runnersheet.model.ImprovementSource;
import me.baddcamden.runnersheet.model.MagicProfile;
import me.baddcamden.runnersheet.model.Purchasable;
import me.baddcamden.runnersheet.model.Quality;
import me.baddcamden.runnersheet.model.ResonanceProfile;
import me.baddcamden.runnersheet.model.Skill;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Checks a character against creation budgets and legality rules.
 * <p>
 * Checks run in a fixed order: identity, build points, attributes, skills, qualities, magic,
 * resonance, equipment, contacts, availability. Every finding is reported as a
 * {@link ValidationIssue}; nothing here throws on malformed character data. Budget, natural
 * attribute range, skill cap and availability checks only apply in creation mode.
 */
public class ValidationEngine {

    private static final Set<AttributeCode> CHECKED_ATTRIBUTES = EnumSet.of(
            AttributeCode.BOD, AttributeCode.AGI, AttributeCode.REA, AttributeCode.STR,
            AttributeCode.CHA, AttributeCode.INT, AttributeCode.LOG, AttributeCode.WIL,
            AttributeCode.EDG);

    private static final List<String[]> EXCLUSIVE_QUALITIES = List.of(
            new String[]{"magician", "technomancer"},
            new String[]{"adept", "technomancer"},
            new String[]{"mystic adept", "technomancer"},
            new String[]{"immunity (natural)", "allergy"},
            new String[]{"lucky", "unlucky"});

    private static final Set<String> AWAKENED_QUALITIES = Set.of("magician", "adept", "mystic adept");

    private static final double ESSENCE_TOLERANCE = 1e-9d;

    private final CreationRules rules;
    private final ImprovementAggregator aggregator;
    private final AttributeResolver attributeResolver;
    private final EssenceLedger essenceLedger;

    public ValidationEngine(CreationRules rules,
                            ImprovementAggregator aggregator,
                            AttributeResolver attributeResolver,
                            EssenceLedger essenceLedger) {
        this.rules = Objects.requireNonNull(rules, "rules");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.attributeResolver = Objects.requireNonNull(attributeResolver, "attributeResolver");
        this.essenceLedger = Objects.requireNonNull(essenceLedger, "essenceLedger");
    }

    /**
     * Runs every check.
     *
     * @param character character to validate
     * @return all issues in check order with severity counts
     */
    public ValidationResult validate(Character character) {
        Objects.requireNonNull(character, "character");
        List<ValidationIssue> issues = new ArrayList<>();
        List<Improvement> improvements = aggregator.aggregate(character);

        validateIdentity(character, issues);
        validateBuildPoints(character, issues);
        validateAttributes(character, improvements, issues);
        validateSkills(character, issues);
        validateQualities(character, issues);
        validateMagic(character.magic(), issues);
        validateResonance(character.resonance(), issues);
        validateEquipment(character, issues);
        validateContacts(character, issues);
        issues.addAll(validateAvailability(character));

        return ValidationResult.of(issues);
    }

    /**
     * Availability sweep over weapons, armor, cyberware (subsystems included) and gear.
     * <p>
     * In creation mode an item whose rating exceeds the character's availability cap raises
     * {@link IssueCode#AVAIL_TOO_HIGH}, and a forbidden item raises
     * {@link IssueCode#FORBIDDEN_ITEM} unless the character's settings allow them. One item may
     * raise both. Career characters are never checked.
     */
    public List<ValidationIssue> validateAvailability(Character character) {
        Objects.requireNonNull(character, "character");
        if (character.isCareer()) {
            return List.of();
        }

        List<ValidationIssue> issues = new ArrayList<>();
        int maxAvailability = character.settings().maxAvailability();
        for (Purchasable item : character.equipment().availabilityCheckedItems()) {
            Availability availability = AvailabilityParser.parse(item.availability())
                    .withModifier(item.availabilityModifier());
            if (availability.rating() > maxAvailability) {
                issues.add(ValidationIssue.forItem(IssueCode.AVAIL_TOO_HIGH,
                        item.name() + " exceeds availability limit",
                        "Availability: " + availability.rating() + ", Maximum: " + maxAvailability,
                        item.id()));
            }
            if (availability.isForbidden() && !character.settings().allowForbidden()) {
                issues.add(ValidationIssue.forItem(IssueCode.FORBIDDEN_ITEM,
                        item.name() + " is forbidden",
                        "Forbidden items are not allowed during creation",
                        item.id()));
            }
        }
        return issues;
    }

    private void validateIdentity(Character character, List<ValidationIssue> issues) {
        if (character.identity().name().isBlank()) {
            issues.add(ValidationIssue.of(IssueCode.NO_NAME, "Character has no name", "Give your character a name"));
        }
        if (character.identity().metatype().isBlank()) {
            issues.add(ValidationIssue.of(IssueCode.NO_METATYPE, "No metatype selected", "Select a metatype to continue"));
        }
    }

    private void validateBuildPoints(Character character, List<ValidationIssue> issues) {
        if (character.isCareer()) {
            return;
        }

        int spent = character.buildPointsSpent().total();
        if (spent > character.buildPoints()) {
            issues.add(ValidationIssue.of(IssueCode.BP_OVERSPENT,
                    "Overspent by " + (spent - character.buildPoints()) + " BP",
                    "Total spent: " + spent + ", Available: " + character.buildPoints()));
        }

        int positive = 0;
        int negative = 0;
        for (Quality quality : character.qualities()) {
            if (quality.category() == Quality.Category.POSITIVE) {
                positive += quality.bp();
            } else {
                negative += quality.bp();
            }
        }
        negative = Math.abs(negative);
        if (positive > rules.positiveQualityCap()) {
            issues.add(ValidationIssue.of(IssueCode.POSITIVE_QUALITY_CAP,
                    "Positive qualities exceed " + rules.positiveQualityCap() + " BP limit",
                    "Current: " + positive + " BP"));
        }
        if (negative > rules.negativeQualityCap()) {
            issues.add(ValidationIssue.of(IssueCode.NEGATIVE_QUALITY_CAP,
                    "Negative qualities exceed " + rules.negativeQualityCap() + " BP limit",
                    "Current: " + negative + " BP"));
        }

        int resources = character.buildPointsSpent().resources();
        if (resources > rules.resourcesCap()) {
            issues.add(ValidationIssue.of(IssueCode.RESOURCES_CAP,
                    "Resources exceed " + rules.resourcesCap() + " BP maximum",
                    "Current: " + resources + " BP"));
        }
    }

    private void validateAttributes(Character character, List<Improvement> improvements, List<ValidationIssue> issues) {
        boolean creation = !character.isCareer();
        for (AttributeCode code : CHECKED_ATTRIBUTES) {
            AttributeLimits limits = character.limitsFor(code);
            int base = character.attributes().get(code).base();
            String label = code.name();

            if (creation && base < limits.min()) {
                issues.add(ValidationIssue.of(IssueCode.ATTR_BELOW_MIN, label + " below minimum",
                        "Current: " + base + ", Minimum: " + limits.min()));
            }
            if (creation && base > limits.max()) {
                issues.add(ValidationIssue.of(IssueCode.ATTR_ABOVE_MAX, label + " exceeds natural maximum",
                        "Current: " + base + ", Maximum: " + limits.max()));
            }
            int augmented = augmentedValue(character, improvements, code);
            if (augmented > limits.aug()) {
                issues.add(ValidationIssue.of(IssueCode.ATTR_ABOVE_AUG, label + " exceeds augmented maximum",
                        "Current total: " + augmented + ", Augmented max: " + limits.aug()));
            }
        }

        double essence = essenceLedger.essence(character);
        if (character.isAwakened()) {
            int magic = augmentedValue(character, improvements, AttributeCode.MAG);
            AttributeLimits limits = character.limitsFor(AttributeCode.MAG);
            if (magic > limits.aug()) {
                issues.add(ValidationIssue.of(IssueCode.MAG_ABOVE_MAX, "Magic exceeds maximum",
                        "Current: " + magic + ", Maximum: " + limits.aug()));
            }
            int maxMagic = (int) Math.floor(essence + ESSENCE_TOLERANCE);
            if (essence < essenceLedger.startingEssence() && magic > maxMagic) {
                issues.add(ValidationIssue.of(IssueCode.MAG_EXCEEDS_ESSENCE, "Magic cannot exceed Essence",
                        "Magic: " + magic + ", Max (floor of Essence): " + maxMagic));
            }
        }
        if (character.isEmerged()) {
            int resonance = augmentedValue(character, improvements, AttributeCode.RES);
            AttributeLimits limits = character.limitsFor(AttributeCode.RES);
            if (resonance > limits.aug()) {
                issues.add(ValidationIssue.of(IssueCode.RES_ABOVE_MAX, "Resonance exceeds maximum",
                        "Current: " + resonance + ", Maximum: " + limits.aug()));
            }
        }
        if (essence < -ESSENCE_TOLERANCE) {
            issues.add(ValidationIssue.of(IssueCode.ESSENCE_NEGATIVE, "Essence cannot be negative",
                    String.format(Locale.ROOT, "Current: %.2f", essence)));
        }
    }

    /**
     * Highest of the recorded natural total and the improvement-resolved value. Quality bonuses
     * are left out: a quality that raises a rating also raises its limits.
     */
    private int augmentedValue(Character character, List<Improvement> improvements, AttributeCode code) {
        List<Improvement> augmentations = improvements.stream()
                .filter(improvement -> improvement.source() != ImprovementSource.QUALITY)
                .toList();
        return Math.max(
                attributeResolver.resolveNatural(character, code),
                attributeResolver.resolveAttribute(character, augmentations, code));
    }

    private void validateSkills(Character character, List<ValidationIssue> issues) {
        for (Skill skill : character.skills()) {
            if (!character.isCareer() && skill.rating() > rules.skillRatingCap()) {
                issues.add(ValidationIssue.forItem(IssueCode.SKILL_ABOVE_MAX,
                        skill.name() + " exceeds maximum rating of " + rules.skillRatingCap(),
                        "Current rating: " + skill.rating(),
                        skill.name()));
            }
            if (skill.rating() < 0) {
                issues.add(ValidationIssue.forItem(IssueCode.SKILL_NEGATIVE,
                        skill.name() + " has negative rating",
                        "Current rating: " + skill.rating(),
                        skill.name()));
            }
        }
        if (character.findSkill("perception").isEmpty()) {
            issues.add(ValidationIssue.of(IssueCode.NO_PERCEPTION, "No Perception skill",
                    "Consider adding Perception for awareness tests"));
        }
    }

    private void validateQualities(Character character, List<ValidationIssue> issues) {
        List<String> names = character.qualities().stream()
                .map(quality -> quality.name().trim().toLowerCase(Locale.ROOT))
                .toList();

        for (String[] pair : EXCLUSIVE_QUALITIES) {
            if (names.contains(pair[0]) && names.contains(pair[1])) {
                issues.add(ValidationIssue.of(IssueCode.QUALITY_EXCLUSIVE,
                        "Cannot have both " + pair[0] + " and " + pair[1],
                        "These qualities are mutually exclusive"));
            }
        }

        boolean awakened = names.stream()
                .anyMatch(name -> AWAKENED_QUALITIES.contains(name) || name.startsWith("aspected magician"));
        if (awakened && !character.isAwakened()) {
            issues.add(ValidationIssue.of(IssueCode.MAGIC_NOT_INITIALIZED,
                    "Awakened quality selected but Magic not initialized",
                    "Select a tradition to initialize Magic"));
        }

        boolean technomancer = names.stream().anyMatch(name -> name.contains("technomancer"));
        if (technomancer && !character.isEmerged()) {
            issues.add(ValidationIssue.of(IssueCode.RESONANCE_NOT_INITIALIZED,
                    "Technomancer quality selected but Resonance not initialized",
                    "Select a stream to initialize Resonance"));
        }
    }

    private void validateMagic(MagicProfile magic, List<ValidationIssue> issues) {
        if (magic == null) {
            return;
        }
        if (magic.tradition() == null || magic.tradition().isBlank()) {
            issues.add(ValidationIssue.of(IssueCode.NO_TRADITION, "No magical tradition selected",
                    "Select a tradition for your awakened character"));
        }
        if (magic.powerPoints() > 0) {
            if (magic.powerPointsUsed() > magic.powerPoints()) {
                issues.add(ValidationIssue.of(IssueCode.POWER_POINTS_OVERSPENT, "Power points exceeded",
                        "Used: " + magic.powerPointsUsed() + ", Available: " + magic.powerPoints()));
            }
            if (magic.powers().isEmpty()) {
                issues.add(ValidationIssue.of(IssueCode.NO_POWERS, "No adept powers selected",
                        "Consider selecting powers to use your power points"));
            }
        }
    }

    private void validateResonance(ResonanceProfile resonance, List<ValidationIssue> issues) {
        if (resonance == null) {
            return;
        }
        if (resonance.stream() == null || resonance.stream().isBlank()) {
            issues.add(ValidationIssue.of(IssueCode.NO_STREAM, "No technomancer stream selected",
                    "Select a stream for your technomancer"));
        }
        if (resonance.complexForms().isEmpty()) {
            issues.add(ValidationIssue.of(IssueCode.NO_COMPLEX_FORMS, "No complex forms selected",
                    "Consider selecting complex forms for Matrix interactions"));
        }
    }

    private void validateEquipment(Character character, List<ValidationIssue> issues) {
        if (character.equipment().weapons().isEmpty()) {
            issues.add(ValidationIssue.of(IssueCode.NO_WEAPONS, "No weapons purchased",
                    "Consider acquiring weapons for self-defense"));
        }
        if (character.equipment().armor().isEmpty()) {
            issues.add(ValidationIssue.of(IssueCode.NO_ARMOR, "No armor purchased",
                    "Armor is recommended for survival"));
        }
        if (character.equipment().lifestyle() == null) {
            issues.add(ValidationIssue.of(IssueCode.NO_LIFESTYLE, "No lifestyle selected",
                    "A lifestyle is required for between-run survival"));
        }
        if (character.nuyen() < 0) {
            issues.add(ValidationIssue.of(IssueCode.NEGATIVE_NUYEN, "Negative nuyen balance",
                    "Current: " + character.nuyen()));
        }
    }

    private void validateContacts(Character character, List<ValidationIssue> issues) {
        if (character.contacts().isEmpty() && !character.isCareer()) {
            issues.add(ValidationIssue.of(IssueCode.NO_CONTACTS, "No contacts defined",
                    "Contacts are useful for gathering information and acquiring items"));
        }
        for (Contact contact : character.contacts()) {
            if (contact.loyalty() < 1 || contact.loyalty() > 6) {
                issues.add(ValidationIssue.forItem(IssueCode.CONTACT_LOYALTY_INVALID,
                        contact.name() + " has invalid loyalty rating",
                        "Current: " + contact.loyalty() + ", Valid: 1-6",
                        contact.id()));
            }
            if (contact.connection() < 1 || contact.connection() > 6) {
                issues.add(ValidationIssue.forItem(IssueCode.CONTACT_CONNECTION_INVALID,
                        contact.name() + " has invalid connection rating",
                        "Current: " + contact.connection() + ", Valid: 1-6",
                        contact.id()));
            }
        }
    }
}
