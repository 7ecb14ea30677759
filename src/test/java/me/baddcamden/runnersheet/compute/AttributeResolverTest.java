package me.baddcamden.runnersheet.compute;

import me.baddcamden.runnersheet.effect.EffectCatalog;
import me.baddcamden.runnersheet.model.AttributeCode;
import me.baddcamden.runnersheet.model.AttributeValue;
import me.baddcamden.runnersheet.model.Bioware;
import me.baddcamden.runnersheet.model.Character;
import me.baddcamden.runnersheet.model.Cyberware;
import me.baddcamden.runnersheet.model.Equipment;
import me.baddcamden.runnersheet.model.ResonanceProfile;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AttributeResolverTest {

    private final ImprovementAggregator aggregator = new ImprovementAggregator(EffectCatalog.standard());
    private final AttributeResolver resolver = new AttributeResolver(aggregator);

    @Test
    void resolvedValueAddsStackedImprovementsToBase() {
        Equipment equipment = Equipment.EMPTY
                .addCyberware(Cyberware.of("Muscle Replacement 2", 0, 2.0, 50_000, "12R"))
                .addBioware(Bioware.of("Muscle Augmentation", 1, 0.2, 7_000, "8R"));
        Character character = Character.builder()
                .attribute(AttributeCode.STR, 4)
                .attribute(AttributeCode.AGI, 3)
                .equipment(equipment)
                .build();

        assertEquals(7, resolver.resolveAttribute(character, AttributeCode.STR));
        assertEquals(5, resolver.resolveAttribute(character, AttributeCode.AGI));
        assertEquals(4, resolver.resolveNatural(character, AttributeCode.STR));
    }

    @Test
    void resolvedValueIsNotClampedToAugmentedMaximum() {
        Character character = Character.builder()
                .attribute(AttributeCode.STR, 6)
                .equipment(Equipment.EMPTY.addCyberware(Cyberware.of("Muscle Replacement", 4, 4.0, 100_000, "12R")))
                .build();

        assertEquals(10, resolver.resolveAttribute(character, AttributeCode.STR));
    }

    @Test
    void specialAttributesReadZeroWithoutTheirSubRecord() {
        Character mundane = Character.builder()
                .attribute(AttributeCode.MAG, 4)
                .attribute(AttributeCode.RES, 3)
                .build();
        Character technomancer = mundane.withResonance(ResonanceProfile.of("Cyberadept"));

        assertEquals(0, resolver.resolveAttribute(mundane, AttributeCode.MAG));
        assertEquals(0, resolver.resolveNatural(mundane, AttributeCode.RES));
        assertEquals(3, resolver.resolveAttribute(technomancer, AttributeCode.RES));
    }

    @Test
    void stagesExposeEveryStep() {
        Character character = Character.builder()
                .attributes(Character.builder().build().attributes()
                        .with(AttributeCode.REA, new AttributeValue(3, 1, 0)))
                .equipment(Equipment.EMPTY.addCyberware(Cyberware.of("Reaction Enhancers", 2, 0.6, 20_000, "10R")))
                .build();

        AttributeStages stages = resolver.stages(character, aggregator.aggregate(character), AttributeCode.REA);

        assertEquals(3, stages.base());
        assertEquals(1, stages.bonus());
        assertEquals(4, stages.natural());
        assertEquals(2, stages.improvementBonus());
        assertEquals(5, stages.resolved());
        assertEquals(List.of(AttributeCode.values()).size(),
                resolver.resolveAll(character, List.of()).size());
    }
}
