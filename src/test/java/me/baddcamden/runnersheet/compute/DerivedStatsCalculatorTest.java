package me.baddcamden.runnersheet.compute;

import me.baddcamden.runnersheet.effect.EffectCatalog;
import me.baddcamden.runnersheet.ledger.EssenceLedger;
import me.baddcamden.runnersheet.model.AdeptPower;
import me.baddcamden.runnersheet.model.Armor;
import me.baddcamden.runnersheet.model.AttributeBlock;
import me.baddcamden.runnersheet.model.AttributeCode;
import me.baddcamden.runnersheet.model.Character;
import me.baddcamden.runnersheet.model.ConditionMonitor;
import me.baddcamden.runnersheet.model.Cyberware;
import me.baddcamden.runnersheet.model.DerivedStats;
import me.baddcamden.runnersheet.model.Equipment;
import me.baddcamden.runnersheet.model.MagicProfile;
import me.baddcamden.runnersheet.model.Quality;
import me.baddcamden.runnersheet.model.ResonanceProfile;
import me.baddcamden.runnersheet.model.Skill;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DerivedStatsCalculatorTest {

    private static final double EPSILON = 1.0E-9;

    private final ImprovementAggregator aggregator = new ImprovementAggregator(EffectCatalog.standard());
    private final AttributeResolver resolver = new AttributeResolver(aggregator);
    private final DerivedStatsCalculator calculator =
            new DerivedStatsCalculator(aggregator, resolver, new EssenceLedger());

    private static Character average() {
        return Character.builder()
                .name("Average")
                .metatype("Human")
                .attributes(AttributeBlock.uniform(3))
                .build();
    }

    @Test
    void physicalMonitorIsHalfBodyRoundedUpPlusEight() {
        int[] expected = {9, 9, 10, 10, 11, 11};
        for (int bod = 1; bod <= 6; bod++) {
            assertEquals(expected[bod - 1], DerivedStatsCalculator.physicalConditionMonitor(bod, 0), "BOD " + bod);
        }
    }

    @Test
    void physicalMonitorIncludesQualityImprovements() {
        Character tough = average().withQualities(List.of(Quality.positive("Toughness", 10)));

        assertEquals(11, calculator.physicalConditionMonitor(tough));
    }

    @Test
    void woundModifierDropsOneDiePerThreeBoxes() {
        assertEquals(0, DerivedStatsCalculator.woundModifier(0, 0));
        assertEquals(0, DerivedStatsCalculator.woundModifier(2, 0));
        assertEquals(-1, DerivedStatsCalculator.woundModifier(3, 0));
        assertEquals(-1, DerivedStatsCalculator.woundModifier(2, 2));
        assertEquals(-2, DerivedStatsCalculator.woundModifier(4, 3));
    }

    @Test
    void baselineCharacterDerivesExpectedValues() {
        DerivedStats stats = calculator.deriveAll(average());

        assertEquals(10, stats.physicalCM());
        assertEquals(10, stats.stunCM());
        assertEquals(3, stats.overflow());
        assertEquals(0, stats.woundModifier());
        assertEquals(6, stats.initiative());
        assertEquals(1, stats.initiativeDice());
        assertEquals(6, stats.walkSpeed());
        assertEquals(12, stats.runSpeed());
        assertEquals(4, stats.physicalLimit());
        assertEquals(4, stats.mentalLimit());
        assertEquals(5, stats.socialLimit());
        assertEquals(6, stats.defense());
        assertEquals(2, stats.dodge());
        assertEquals(6, stats.composure());
        assertEquals(6, stats.judgeIntentions());
        assertEquals(6, stats.memory());
        assertEquals(6, stats.liftCarry());
        assertEquals(6.0, stats.essence(), EPSILON);
        assertEquals(0, stats.drainResistance());
        assertEquals(6, stats.astralInitiative());
        assertEquals(DerivedStatsCalculator.ASTRAL_INITIATIVE_DICE, stats.astralInitiativeDice());
        assertEquals(0, stats.fadingResistance());
        assertEquals(3, stats.matrixInitiative());
        assertEquals(DerivedStatsCalculator.MATRIX_INITIATIVE_DICE, stats.matrixInitiativeDice());
    }

    @Test
    void cyberwareFeedsInitiativeAndEssence() {
        Character wired = average().withEquipment(Equipment.EMPTY
                .addCyberware(Cyberware.of("Wired Reflexes 2", 0, 3.0, 32_000, "12R")));

        DerivedStats stats = calculator.deriveAll(wired);

        assertEquals(8, stats.initiative());
        assertEquals(2, stats.initiativeBonus());
        assertEquals(3, stats.initiativeDice());
        assertEquals(3.0, stats.essence(), EPSILON);
        assertEquals(4, stats.socialLimit());
    }

    @Test
    void socialLimitTreatsNearWholeEssenceAsWhole() {
        assertEquals(5, DerivedStatsCalculator.socialLimit(3, 3, 5.999999999999));
        assertEquals(4, DerivedStatsCalculator.socialLimit(3, 3, 5.5));
    }

    @Test
    void armorLayersTopTwoEquippedPieces() {
        Character armored = average().withEquipment(Equipment.EMPTY
                .addArmor(new Armor("vest", "Armor Vest", 4, 3, true, 600, "4"))
                .addArmor(new Armor("jacket", "Armor Jacket", 8, 6, true, 900, "5"))
                .addArmor(new Armor("coat", "Lined Coat", 6, 4, false, 700, "4")));

        ArmorTotals armor = calculator.armor(armored);
        DerivedStats stats = calculator.deriveAll(armored);

        assertEquals(10, armor.ballistic());
        assertEquals(7, armor.impact());
        assertEquals(7, stats.encumbrance());
    }

    @Test
    void armorImprovementsStackOnWornArmor() {
        Character plated = average().withEquipment(Equipment.EMPTY
                .addArmor(new Armor("jacket", "Armor Jacket", 8, 6, true, 900, "5"))
                .addCyberware(Cyberware.of("Dermal Plating", 2, 1.0, 6_000, "8R")));

        ArmorTotals armor = calculator.armor(plated);

        assertEquals(10, armor.ballistic());
        assertEquals(8, armor.impact());
        assertEquals(5, calculator.deriveAll(plated).encumbrance());
    }

    @Test
    void drainDependsOnTradition() {
        Character base = Character.builder()
                .attributes(AttributeBlock.uniform(3)
                        .withBase(AttributeCode.WIL, 4)
                        .withBase(AttributeCode.LOG, 5)
                        .withBase(AttributeCode.CHA, 2))
                .build();

        assertEquals(9, calculator.deriveAll(base.withMagic(MagicProfile.of("Hermetic"))).drainResistance());
        assertEquals(9, calculator.deriveAll(base.withMagic(MagicProfile.of("Chaos Magic"))).drainResistance());
        assertEquals(6, calculator.deriveAll(base.withMagic(MagicProfile.of("Shamanic"))).drainResistance());
        assertEquals(0, calculator.deriveAll(base).drainResistance());
    }

    @Test
    void technomancersGetFadingAndMatrixInitiative() {
        Character technomancer = average()
                .withResonance(ResonanceProfile.of("Technoshaman"))
                .withAttributes(AttributeBlock.uniform(3).withBase(AttributeCode.RES, 5));

        DerivedStats stats = calculator.deriveAll(technomancer);

        assertEquals(8, stats.fadingResistance());
        assertEquals(8, stats.matrixInitiative());
    }

    @Test
    void dicePoolUsesSkillOrDefaultsAndAppliesWounds() {
        Character shooter = average()
                .withAttributes(AttributeBlock.uniform(3).withBase(AttributeCode.AGI, 5))
                .withSkills(List.of(new Skill("Pistols", AttributeCode.AGI, 4, 1, null)));
        Character hurt = shooter.withCondition(ConditionMonitor.damaged(3, 3));

        assertEquals(10, calculator.dicePool(shooter, "pistols", AttributeCode.AGI));
        assertEquals(4, calculator.dicePool(shooter, "Automatics", AttributeCode.AGI));
        assertEquals(8, calculator.dicePool(hurt, "Pistols", AttributeCode.AGI));
        assertEquals(2, calculator.dicePool(hurt, "Automatics", AttributeCode.AGI));
    }

    @Test
    void dicePoolNeverDropsBelowZero() {
        Character wrecked = average().withCondition(ConditionMonitor.damaged(9, 9));

        assertEquals(0, calculator.dicePool(wrecked, "Pistols", AttributeCode.AGI));
    }

    @Test
    void adeptPowersFeedInitiative() {
        Character adept = average().withMagic(MagicProfile.of("Adept")
                .withPowerPoints(3)
                .withPowers(List.of(AdeptPower.of("Improved Reflexes", 1, 1.5))));

        DerivedStats stats = calculator.deriveAll(adept);

        assertEquals(7, stats.initiative());
        assertEquals(2, stats.initiativeDice());
    }

    @Test
    void sprintBonusFollowsMetatype() {
        assertEquals(1, DerivedStatsCalculator.sprintBonus("Elf"));
        assertEquals(1, DerivedStatsCalculator.sprintBonus("Night One Elf"));
        assertEquals(2, DerivedStatsCalculator.sprintBonus("Centaur"));
        assertEquals(0, DerivedStatsCalculator.sprintBonus("Human"));
        assertEquals(0, DerivedStatsCalculator.sprintBonus(null));
    }

    @Test
    void derivingTwiceGivesTheSameSnapshot() {
        Character wired = average().withEquipment(Equipment.EMPTY
                .addCyberware(Cyberware.of("Wired Reflexes", 1, 2.0, 11_000, "8R")));

        assertEquals(calculator.deriveAll(wired), calculator.deriveAll(wired));
        assertEquals(31, calculator.deriveAll(wired).asMap().size());
    }
}
