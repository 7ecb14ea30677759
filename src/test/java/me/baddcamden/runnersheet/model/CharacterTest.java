package me.baddcamden.runnersheet.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CharacterTest {

    @Test
    void builderStartsFromCreationDefaults() {
        Character character = Character.builder().build();

        assertEquals(CharacterMode.CREATION, character.mode());
        assertEquals(400, character.buildPoints());
        assertEquals(1, character.attributes().get(AttributeCode.EDG).base());
        assertEquals(0, character.attributes().get(AttributeCode.MAG).base());
        assertNull(character.magic());
        assertEquals(CharacterSettings.DEFAULT, character.settings());
        assertEquals(AttributeLimits.SPECIAL, character.limitsFor(AttributeCode.EDG));
        assertNotEquals(Character.builder().build().id(), character.id());
    }

    @Test
    void luckyRaisesOnlyEdgeLimits() {
        Character lucky = Character.builder()
                .qualities(List.of(Quality.positive("Lucky", 20)))
                .build();

        assertEquals(new AttributeLimits(1, 7, 7), lucky.limitsFor(AttributeCode.EDG));
        assertEquals(AttributeLimits.STANDARD, lucky.limitsFor(AttributeCode.BOD));
    }

    @Test
    void editsReturnNewValuesAndKeepTheOriginal() {
        Character original = Character.builder().name("Before").karma(5).build();

        Character edited = original.withName("After").withKarma(9);

        assertEquals("Before", original.identity().name());
        assertEquals(5, original.karma());
        assertEquals("After", edited.identity().name());
        assertEquals(9, edited.karma());
        assertEquals(original.id(), edited.id());
    }

    @Test
    void listsAreCopiedAndUnmodifiable() {
        List<Skill> skills = new ArrayList<>(List.of(Skill.of("Pistols", AttributeCode.AGI, 3)));
        Character character = Character.builder().skills(skills).build();

        skills.clear();

        assertEquals(1, character.skills().size());
        assertThrows(UnsupportedOperationException.class,
                () -> character.skills().add(Skill.of("Sneaking", AttributeCode.AGI, 1)));
    }

    @Test
    void withSkillReplacesByNameOrAppends() {
        Character character = Character.builder()
                .skills(List.of(Skill.of("Pistols", AttributeCode.AGI, 3)))
                .build();

        Character replaced = character.withSkill(Skill.of("pistols", AttributeCode.AGI, 5));
        Character appended = character.withSkill(Skill.of("Sneaking", AttributeCode.AGI, 1));

        assertEquals(1, replaced.skills().size());
        assertEquals(5, replaced.findSkill("Pistols").orElseThrow().rating());
        assertEquals(2, appended.skills().size());
    }

    @Test
    void capabilitiesFollowSubRecords() {
        Character character = Character.builder()
                .qualities(List.of(Quality.negative("Allergy", 10)))
                .build();

        assertTrue(character.withMagic(MagicProfile.of("Hermetic")).isAwakened());
        assertTrue(character.withResonance(ResonanceProfile.of("Sourcerer")).isEmerged());
        assertTrue(character.hasQuality(" allergy "));
        assertEquals(-10, character.qualities().get(0).bp());
    }

    @Test
    void expenseLogAppends() {
        Character character = Character.builder().build()
                .withExpense(ExpenseEntry.karma(5, "Run"))
                .withExpense(ExpenseEntry.karma(-4, "Skill"));

        assertEquals(List.of(ExpenseEntry.karma(5, "Run"), ExpenseEntry.karma(-4, "Skill")), character.expenseLog());
    }

    @Test
    void invalidValuesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new AttributeLimits(3, 2, 9));
        assertThrows(IllegalArgumentException.class, () -> new ConditionMonitor(-1, 0, 0));
        assertThrows(NullPointerException.class, () -> Character.builder().id(null).build());
    }

    @Test
    void implantsRejectNegativeCostAndNonFiniteEssence() {
        assertThrows(IllegalArgumentException.class, () -> Cyberware.of("Datajack", 0, 0.1, -1_000, "2"));
        assertThrows(IllegalArgumentException.class, () -> Cyberware.of("Datajack", 0, Double.NaN, 1_000, "2"));
        assertThrows(IllegalArgumentException.class,
                () -> Cyberware.of("Datajack", 0, Double.POSITIVE_INFINITY, 1_000, "2"));
        assertThrows(IllegalArgumentException.class, () -> Bioware.of("Toxin Extractor", 1, 0.2, -500, "6"));
        assertThrows(IllegalArgumentException.class, () -> Bioware.of("Toxin Extractor", 1, Double.NaN, 500, "6"));
        assertEquals(0, Cyberware.of("Datajack", 0, 0.0, 0, "2").cost());
    }
}
