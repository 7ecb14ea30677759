package me.baddcamden.runnersheet.effect;

import me.baddcamden.runnersheet.model.ImprovementSource;

import java.util.LinkedHashMap;
import java.util.Map;

import static me.baddcamden.runnersheet.model.ImprovementTarget.AGI;
import static me.baddcamden.runnersheet.model.ImprovementTarget.ARMOR_BALLISTIC;
import static me.baddcamden.runnersheet.model.ImprovementTarget.ARMOR_IMPACT;
import static me.baddcamden.runnersheet.model.ImprovementTarget.DAMAGE_RESISTANCE;
import static me.baddcamden.runnersheet.model.ImprovementTarget.EDG;
import static me.baddcamden.runnersheet.model.ImprovementTarget.INITIATIVE;
import static me.baddcamden.runnersheet.model.ImprovementTarget.INITIATIVE_DICE;
import static me.baddcamden.runnersheet.model.ImprovementTarget.LOG;
import static me.baddcamden.runnersheet.model.ImprovementTarget.MEMORY;
import static me.baddcamden.runnersheet.model.ImprovementTarget.PHYSICAL_CM;
import static me.baddcamden.runnersheet.model.ImprovementTarget.REA;
import static me.baddcamden.runnersheet.model.ImprovementTarget.SPELL_RESISTANCE;
import static me.baddcamden.runnersheet.model.ImprovementTarget.STR;

/**
 * Built-in effect table for augmentations, qualities and adept powers.
 * <p>
 * Entries are keyed by the item's normalized name. Aliases map alternative spellings found in
 * game data onto the same entry. The table is declarative: every rating-dependent bonus is a
 * {@link LinearEffect}, every flat bonus a {@link FixedEffect}.
 */
public final class StandardEffects {

    private StandardEffects() {
    }

    /**
     * Builds the ordered table of built-in effects.
     *
     * @return map of normalized key to entry, aliases included
     */
    public static Map<String, ItemEffect> definitions() {
        Map<String, ItemEffect> definitions = new LinkedHashMap<>();

        // cyberware
        register(definitions, ItemEffect.of("wired reflexes", ImprovementSource.CYBERWARE,
                LinearEffect.of(INITIATIVE, "init", 1),
                LinearEffect.of(INITIATIVE_DICE, "init-dice", 1)));
        register(definitions, ItemEffect.of("move-by-wire", ImprovementSource.CYBERWARE,
                LinearEffect.of(INITIATIVE, "init", 2),
                LinearEffect.of(INITIATIVE_DICE, "init-dice", 1),
                LinearEffect.of(REA, "rea", 1)),
                "move-by-wire system");
        register(definitions, ItemEffect.of("reaction enhancers", ImprovementSource.CYBERWARE,
                LinearEffect.of(REA, "rea", 1)),
                "reaction enhancer");
        register(definitions, ItemEffect.of("muscle replacement", ImprovementSource.CYBERWARE,
                LinearEffect.of(STR, "str", 1),
                LinearEffect.of(AGI, "agi", 1)));
        register(definitions, armorPair("dermal plating", ImprovementSource.CYBERWARE));
        register(definitions, boneLacing("plastic", 1), "bone lacing (plastic)");
        register(definitions, boneLacing("aluminum", 2), "bone lacing (aluminum)");
        register(definitions, boneLacing("titanium", 3), "bone lacing (titanium)");

        // bioware
        register(definitions, ItemEffect.of("synaptic booster", ImprovementSource.BIOWARE,
                LinearEffect.of(INITIATIVE, "init", 1),
                LinearEffect.of(INITIATIVE_DICE, "init-dice", 1)));
        register(definitions, ItemEffect.of("muscle toner", ImprovementSource.BIOWARE,
                LinearEffect.of(AGI, "agi", 1)));
        register(definitions, ItemEffect.of("muscle augmentation", ImprovementSource.BIOWARE,
                LinearEffect.of(STR, "str", 1)));
        register(definitions, ItemEffect.of("cerebral booster", ImprovementSource.BIOWARE,
                LinearEffect.of(LOG, "log", 1)));
        register(definitions, ItemEffect.of("mnemonic enhancer", ImprovementSource.BIOWARE,
                LinearEffect.of(MEMORY, "memory", 1)));
        register(definitions, armorPair("orthoskin", ImprovementSource.BIOWARE));
        register(definitions, ItemEffect.of("platelet factories", ImprovementSource.BIOWARE,
                FixedEffect.of(DAMAGE_RESISTANCE, "dam-res", 1)));
        register(definitions, ItemEffect.of("pain editor", ImprovementSource.BIOWARE,
                new FixedEffect(DAMAGE_RESISTANCE, "pain", 2, "Ignores wound modifiers")));

        // qualities
        register(definitions, ItemEffect.of("toughness", ImprovementSource.QUALITY,
                FixedEffect.of(PHYSICAL_CM, "tough", 1)));
        register(definitions, ItemEffect.of("will to live", ImprovementSource.QUALITY,
                LinearEffect.of(PHYSICAL_CM, "wtl", 1)));
        register(definitions, ItemEffect.of("high pain tolerance", ImprovementSource.QUALITY,
                new LinearEffect(DAMAGE_RESISTANCE, "hpt", 1, "Reduces wound modifiers")));
        register(definitions, ItemEffect.of("natural immunity", ImprovementSource.QUALITY,
                new FixedEffect(DAMAGE_RESISTANCE, "immune", 2, "Toxin/disease resistance")),
                "immunity (natural)");
        register(definitions, ItemEffect.of("magic resistance", ImprovementSource.QUALITY,
                LinearEffect.of(SPELL_RESISTANCE, "mr", 2)));
        register(definitions, ItemEffect.of("lucky", ImprovementSource.QUALITY,
                new FixedEffect(EDG, "luck", 1, "One extra Edge point")));

        // adept powers
        register(definitions, ItemEffect.of("improved reflexes", ImprovementSource.ADEPT_POWER,
                LinearEffect.of(INITIATIVE, "init", 1),
                LinearEffect.of(INITIATIVE_DICE, "init-dice", 1)));
        register(definitions, ItemEffect.of("combat sense", ImprovementSource.ADEPT_POWER,
                new LinearEffect(REA, "cs", 1, "Defense and surprise tests only")));
        register(definitions, armorPair("mystic armor", ImprovementSource.ADEPT_POWER));
        register(definitions, ItemEffect.of("pain resistance", ImprovementSource.ADEPT_POWER,
                new LinearEffect(DAMAGE_RESISTANCE, "pr", 1, "Ignores wound modifiers")));

        return definitions;
    }

    private static ItemEffect armorPair(String key, ImprovementSource source) {
        return ItemEffect.of(key, source,
                LinearEffect.of(ARMOR_BALLISTIC, "armor-b", 1),
                LinearEffect.of(ARMOR_IMPACT, "armor-i", 1));
    }

    private static ItemEffect boneLacing(String material, int armor) {
        return ItemEffect.of(material + " bone lacing", ImprovementSource.CYBERWARE,
                FixedEffect.of(ARMOR_BALLISTIC, "armor-b", armor),
                FixedEffect.of(ARMOR_IMPACT, "armor-i", armor));
    }

    private static void register(Map<String, ItemEffect> definitions, ItemEffect effect, String... aliases) {
        definitions.put(effect.key(), effect);
        for (String alias : aliases) {
            definitions.put(alias, new ItemEffect(alias, effect.source(), effect.effects()));
        }
    }
}
