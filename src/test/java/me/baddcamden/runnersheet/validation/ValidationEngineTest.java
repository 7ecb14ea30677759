package me.baddcamden.runnersheet.validation;

import me.baddcamden.runnersheet.compute.AttributeResolver;
import me.baddcamden.runnersheet.compute.ImprovementAggregator;
import me.baddcamden.runnersheet.config.CreationRules;
import me.baddcamden.runnersheet.effect.EffectCatalog;
import me.baddcamden.runnersheet.ledger.EssenceLedger;
import me.baddcamden.runnersheet.model.AdeptPower;
import me.baddcamden.runnersheet.model.Armor;
import me.baddcamden.runnersheet.model.AttributeBlock;
import me.baddcamden.runnersheet.model.AttributeCode;
import me.baddcamden.runnersheet.model.AttributeLimits;
import me.baddcamden.runnersheet.model.BuildPointAllocation;
import me.baddcamden.runnersheet.model.Character;
import me.baddcamden.runnersheet.model.CharacterMode;
import me.baddcamden.runnersheet.model.CharacterSettings;
import me.baddcamden.runnersheet.model.Contact;
import me.baddcamden.runnersheet.model.Cyberware;
import me.baddcamden.runnersheet.model.CyberwareGrade;
import me.baddcamden.runnersheet.model.Equipment;
import me.baddcamden.runnersheet.model.Gear;
import me.baddcamden.runnersheet.model.Lifestyle;
import me.baddcamden.runnersheet.model.MagicProfile;
import me.baddcamden.runnersheet.model.Metatype;
import me.baddcamden.runnersheet.model.Quality;
import me.baddcamden.runnersheet.model.ResonanceProfile;
import me.baddcamden.runnersheet.model.Skill;
import me.baddcamden.runnersheet.model.Weapon;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ValidationEngineTest {

    private final ImprovementAggregator aggregator = new ImprovementAggregator(EffectCatalog.standard());
    private final ValidationEngine engine = new ValidationEngine(
            CreationRules.DEFAULTS, aggregator, new AttributeResolver(aggregator), new EssenceLedger());

    private static Character streetSamurai() {
        Equipment equipment = Equipment.EMPTY
                .withWeapons(List.of(new Weapon("pistol", "Ares Predator", "Heavy Pistol", 350, "4R")))
                .withArmor(List.of(new Armor("jacket", "Armor Jacket", 8, 6, true, 900, "5")))
                .withLifestyle(new Lifestyle("low", "Low", 2_000, 1));
        return Character.builder()
                .name("Razor")
                .attributes(AttributeBlock.uniform(3))
                .skills(List.of(Skill.of("Perception", AttributeCode.INT, 2)))
                .contacts(List.of(new Contact("fixer", "Fixer", 3, 2)))
                .equipment(equipment)
                .nuyen(5_000)
                .build()
                .withMetatype(new Metatype("Human", 0, Map.of()));
    }

    private static Character withExtraGear(Character character, Gear gear) {
        return character.withEquipment(character.equipment().withGear(List.of(gear)));
    }

    @Test
    void completeCharacterHasNoIssues() {
        ValidationResult result = engine.validate(streetSamurai());

        assertTrue(result.valid());
        assertEquals(List.of(), result.issues());
    }

    @Test
    void forbiddenHighAvailabilityItemRaisesBothIssuesInCreation() {
        Character character = withExtraGear(streetSamurai(),
                new Gear("launcher", "Grenade Launcher", "Weapon", 0, 1, 5_000, "14F"));

        List<ValidationIssue> issues = engine.validateAvailability(character);

        assertEquals(2, issues.size());
        assertEquals(IssueCode.AVAIL_TOO_HIGH, issues.get(0).code());
        assertEquals(IssueCode.FORBIDDEN_ITEM, issues.get(1).code());
        assertTrue(issues.stream().allMatch(issue -> "launcher".equals(issue.itemId())));
        assertFalse(engine.validate(character).valid());
    }

    @Test
    void careerCharactersSkipAvailability() {
        Character character = withExtraGear(streetSamurai(),
                new Gear("launcher", "Grenade Launcher", "Weapon", 0, 1, 5_000, "14F"))
                .withMode(CharacterMode.CAREER);

        assertTrue(engine.validateAvailability(character).isEmpty());
        assertTrue(engine.validate(character).valid());
    }

    @Test
    void settingsCanAllowForbiddenItemsAndRaiseTheCap() {
        Character character = withExtraGear(streetSamurai(),
                new Gear("launcher", "Grenade Launcher", "Weapon", 0, 1, 5_000, "14F"))
                .withSettings(new CharacterSettings(14, true));

        assertTrue(engine.validateAvailability(character).isEmpty());
    }

    @Test
    void cyberwareGradeAdjustsAvailability() {
        Cyberware used = new Cyberware("cw", "Smartlink", "Eyeware", CyberwareGrade.USED, 0, 0.1, 2_000,
                "13R", List.of(), null);
        Character character = streetSamurai()
                .withEquipment(streetSamurai().equipment().addCyberware(used));

        assertTrue(engine.validateAvailability(character).isEmpty());
        assertTrue(engine.validateAvailability(character.withEquipment(character.equipment()
                .withCyberware(List.of(used.withGrade(CyberwareGrade.STANDARD))))).stream()
                .anyMatch(issue -> issue.code() == IssueCode.AVAIL_TOO_HIGH));
    }

    @Test
    void missingIdentityIsReported() {
        Character anonymous = Character.builder().build();

        ValidationResult result = engine.validate(anonymous);

        assertTrue(result.has(IssueCode.NO_NAME));
        assertTrue(result.has(IssueCode.NO_METATYPE));
        assertEquals(IssueSeverity.WARNING, IssueCode.NO_NAME.severity());
        assertFalse(result.valid());
        assertEquals(result.errorCount(), result.errors().size());
        assertEquals(result.warningCount(), result.warnings().size());
    }

    @Test
    void buildPointBudgetAndCapsAreEnforcedInCreation() {
        Character character = streetSamurai()
                .withBuildPointsSpent(new BuildPointAllocation(0, 250, 100, 0, 55, 10, 0))
                .withQualities(List.of(
                        Quality.positive("Ambidextrous", 20),
                        Quality.positive("Toughness", 20),
                        Quality.negative("Addiction", 40)));

        ValidationResult result = engine.validate(character);

        assertTrue(result.has(IssueCode.BP_OVERSPENT));
        assertTrue(result.has(IssueCode.POSITIVE_QUALITY_CAP));
        assertTrue(result.has(IssueCode.NEGATIVE_QUALITY_CAP));
        assertTrue(result.has(IssueCode.RESOURCES_CAP));
        assertFalse(engine.validate(character.withMode(CharacterMode.CAREER)).has(IssueCode.BP_OVERSPENT));
    }

    @Test
    void naturalLimitsApplyOnlyInCreation() {
        Character troll = streetSamurai()
                .withLimits(Map.of(AttributeCode.BOD, new AttributeLimits(5, 10, 15)))
                .withAttributes(AttributeBlock.uniform(3).withBase(AttributeCode.AGI, 7));

        ValidationResult creation = engine.validate(troll);
        ValidationResult career = engine.validate(troll.withMode(CharacterMode.CAREER));

        assertTrue(creation.has(IssueCode.ATTR_BELOW_MIN));
        assertTrue(creation.has(IssueCode.ATTR_ABOVE_MAX));
        assertFalse(career.has(IssueCode.ATTR_BELOW_MIN));
        assertFalse(career.has(IssueCode.ATTR_ABOVE_MAX));
    }

    @Test
    void augmentedMaximumAppliesInEveryMode() {
        Character character = streetSamurai()
                .withAttributes(AttributeBlock.uniform(3).withBase(AttributeCode.STR, 6))
                .withEquipment(streetSamurai().equipment()
                        .addCyberware(new Cyberware("mr", "Muscle Replacement", "Bodyware", null, 4, 4.0, 100_000,
                                "12R", List.of(), null)));

        assertTrue(engine.validate(character).has(IssueCode.ATTR_ABOVE_AUG));
        assertTrue(engine.validate(character.withMode(CharacterMode.CAREER)).has(IssueCode.ATTR_ABOVE_AUG));
    }

    @Test
    void luckyAllowsEdgeOneAboveTheMetatypeMaximum() {
        Metatype human = new Metatype("Human", 0, Map.of(AttributeCode.EDG, new AttributeLimits(2, 7, 7)));
        Character lucky = streetSamurai()
                .withMetatype(human)
                .withAttributes(AttributeBlock.uniform(3).withBase(AttributeCode.EDG, 7))
                .withQualities(List.of(Quality.positive("Lucky", 20)));

        ValidationResult atSeven = engine.validate(lucky);
        ValidationResult atEight = engine.validate(
                lucky.withAttributes(AttributeBlock.uniform(3).withBase(AttributeCode.EDG, 8)));
        ValidationResult withoutQuality = engine.validate(lucky
                .withQualities(List.of())
                .withAttributes(AttributeBlock.uniform(3).withBase(AttributeCode.EDG, 8)));

        assertFalse(atSeven.has(IssueCode.ATTR_ABOVE_AUG));
        assertFalse(atSeven.has(IssueCode.ATTR_ABOVE_MAX));
        assertFalse(atEight.has(IssueCode.ATTR_ABOVE_AUG));
        assertFalse(atEight.has(IssueCode.ATTR_ABOVE_MAX));
        assertTrue(withoutQuality.has(IssueCode.ATTR_ABOVE_MAX));
        assertTrue(withoutQuality.has(IssueCode.ATTR_ABOVE_AUG));
    }

    @Test
    void magicCannotExceedRemainingEssence() {
        Character mage = streetSamurai()
                .withMagic(MagicProfile.of("Hermetic"))
                .withAttributes(AttributeBlock.uniform(3).withBase(AttributeCode.MAG, 5))
                .withEquipment(streetSamurai().equipment()
                        .addCyberware(Cyberware.of("Cyberarm", 0, 1.5, 15_000, "4")));

        ValidationResult result = engine.validate(mage);

        assertTrue(result.has(IssueCode.MAG_EXCEEDS_ESSENCE));
        assertFalse(result.has(IssueCode.MAG_ABOVE_MAX));
        assertFalse(engine.validate(mage.withAttributes(AttributeBlock.uniform(3).withBase(AttributeCode.MAG, 4)))
                .has(IssueCode.MAG_EXCEEDS_ESSENCE));
    }

    @Test
    void negativeEssenceIsAnError() {
        Character overloaded = streetSamurai().withEquipment(streetSamurai().equipment()
                .addCyberware(Cyberware.of("Full Body Conversion", 0, 7.0, 0, "10")));

        assertTrue(engine.validate(overloaded).has(IssueCode.ESSENCE_NEGATIVE));
    }

    @Test
    void skillChecks() {
        Character character = streetSamurai().withSkills(List.of(
                Skill.of("Pistols", AttributeCode.AGI, 7),
                Skill.of("Sneaking", AttributeCode.AGI, -1)));

        ValidationResult creation = engine.validate(character);

        assertTrue(creation.has(IssueCode.SKILL_ABOVE_MAX));
        assertTrue(creation.has(IssueCode.SKILL_NEGATIVE));
        assertTrue(creation.has(IssueCode.NO_PERCEPTION));
        assertFalse(engine.validate(character.withMode(CharacterMode.CAREER)).has(IssueCode.SKILL_ABOVE_MAX));
    }

    @Test
    void exclusiveQualitiesAndMissingCapabilities() {
        Character character = streetSamurai().withQualities(List.of(
                Quality.positive("Magician", 15),
                Quality.positive("Technomancer", 5),
                Quality.positive("Lucky", 20),
                Quality.negative("Unlucky", 20)));

        ValidationResult result = engine.validate(character);

        assertEquals(2, result.issues().stream().filter(issue -> issue.code() == IssueCode.QUALITY_EXCLUSIVE).count());
        assertTrue(result.has(IssueCode.MAGIC_NOT_INITIALIZED));
        assertTrue(result.has(IssueCode.RESONANCE_NOT_INITIALIZED));
    }

    @Test
    void magicAndResonanceProfilesAreChecked() {
        Character adept = streetSamurai()
                .withAttributes(AttributeBlock.uniform(3).withBase(AttributeCode.MAG, 3))
                .withMagic(new MagicProfile("", List.of(AdeptPower.of("Killing Hands", 1, 0.5)), List.of(), 0.25, 0));
        Character technomancer = streetSamurai()
                .withAttributes(AttributeBlock.uniform(3).withBase(AttributeCode.RES, 3))
                .withResonance(ResonanceProfile.of(" "));

        ValidationResult magic = engine.validate(adept);
        ValidationResult resonance = engine.validate(technomancer);

        assertTrue(magic.has(IssueCode.NO_TRADITION));
        assertTrue(magic.has(IssueCode.POWER_POINTS_OVERSPENT));
        assertFalse(magic.has(IssueCode.NO_POWERS));
        assertTrue(resonance.has(IssueCode.NO_STREAM));
        assertTrue(resonance.has(IssueCode.NO_COMPLEX_FORMS));
        assertEquals(1, resonance.infoCount());
    }

    @Test
    void equipmentAndContactChecks() {
        Character character = streetSamurai()
                .withEquipment(Equipment.EMPTY)
                .withNuyen(-1)
                .withContacts(List.of(new Contact("c1", "Bartender", 0, 7)));

        ValidationResult result = engine.validate(character);

        assertTrue(result.has(IssueCode.NO_WEAPONS));
        assertTrue(result.has(IssueCode.NO_ARMOR));
        assertTrue(result.has(IssueCode.NO_LIFESTYLE));
        assertTrue(result.has(IssueCode.NEGATIVE_NUYEN));
        assertTrue(result.has(IssueCode.CONTACT_LOYALTY_INVALID));
        assertTrue(result.has(IssueCode.CONTACT_CONNECTION_INVALID));
        assertFalse(result.has(IssueCode.NO_CONTACTS));
        assertTrue(engine.validate(streetSamurai().withContacts(List.of())).has(IssueCode.NO_CONTACTS));
    }

    @Test
    void issuesFollowCheckOrder() {
        Character character = withExtraGear(Character.builder().build(),
                new Gear("g", "Thing", "Misc", 0, 1, 0, "20"));

        List<ValidationIssue> issues = engine.validate(character).issues();

        assertEquals(IssueCode.NO_NAME, issues.get(0).code());
        assertEquals(IssueCode.AVAIL_TOO_HIGH, issues.get(issues.size() - 1).code());
    }
}
