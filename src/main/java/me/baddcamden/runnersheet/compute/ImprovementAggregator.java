package me.baddcamden.runnersheet.compute;

import me.baddcamden.runnersheet.effect.CatalogKey;
import me.baddcamden.runnersheet.effect.EffectCatalog;
import me.baddcamden.runnersheet.effect.EffectFormula;
import me.baddcamden.runnersheet.effect.ItemEffect;
import me.baddcamden.runnersheet.model.AdeptPower;
import me.baddcamden.runnersheet.model.Bioware;
import me.baddcamden.runnersheet.model.Character;
import me.baddcamden.runnersheet.model.Cyberware;
import me.baddcamden.runnersheet.model.Improvement;
import me.baddcamden.runnersheet.model.Quality;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Collects every improvement a character's augmentations, qualities and adept powers grant.
 * <p>
 * Each item is resolved against the {@link EffectCatalog}: by its explicit effect key when it
 * carries one, otherwise by its normalized display name. Every formula of the matched entry
 * yields one {@link Improvement} with id {@code <itemId>-<suffix>}, filed under the source the
 * catalog entry declares. Items the catalog does not know contribute nothing; they are reported
 * at {@code FINE} and never fail the aggregation.
 * <p>
 * The aggregator does not apply stacking; see {@link StackResolver}.
 */
public class ImprovementAggregator {

    private final EffectCatalog catalog;
    private final Logger logger;

    public ImprovementAggregator(EffectCatalog catalog, Logger logger) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public ImprovementAggregator(EffectCatalog catalog) {
        this(catalog, Logger.getLogger(ImprovementAggregator.class.getName()));
    }

    /**
     * Derives the improvements of a character snapshot.
     *
     * @param character character to inspect
     * @return improvements in item order: cyberware (subsystems after their parent), bioware,
     * qualities, then adept powers
     */
    public List<Improvement> aggregate(Character character) {
        Objects.requireNonNull(character, "character");
        List<Improvement> improvements = new ArrayList<>();

        collectCyberware(character.equipment().cyberware(), improvements);
        for (Bioware implant : character.equipment().bioware()) {
            emit(implant.id(), implant.name(), implant.effectKey(), implant.rating(), improvements);
        }
        for (Quality quality : character.qualities()) {
            emit(quality.id(), quality.name(), null, quality.rating(), improvements);
        }
        if (character.magic() != null) {
            for (AdeptPower power : character.magic().powers()) {
                emit(power.id(), power.name(), power.effectKey(), power.level(), improvements);
            }
        }
        return improvements;
    }

    private void collectCyberware(List<Cyberware> implants, List<Improvement> sink) {
        for (Cyberware implant : implants) {
            emit(implant.id(), implant.name(), implant.effectKey(), implant.rating(), sink);
            collectCyberware(implant.subsystems(), sink);
        }
    }

    private void emit(String itemId, String displayName, String effectKey, int explicitRating, List<Improvement> sink) {
        CatalogKey parsed = CatalogKey.parse(displayName);
        String lookupKey = effectKey == null || effectKey.isBlank() ? parsed.key() : effectKey;
        Optional<ItemEffect> match = catalog.find(lookupKey);
        if (match.isEmpty()) {
            logger.fine("No effect entry for '" + displayName + "' (key '" + lookupKey + "')");
            return;
        }

        ItemEffect entry = match.get();
        int rating = parsed.resolveRating(explicitRating);
        String idPrefix = itemId == null || itemId.isBlank() ? entry.key() : itemId;
        for (EffectFormula formula : entry.effects()) {
            sink.add(new Improvement(
                    idPrefix + "-" + formula.suffix(),
                    entry.source(),
                    displayName,
                    formula.target(),
                    formula.valueFor(rating),
                    formula.conditional()));
        }
    }
}
