package me.baddcamden.runnersheet.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Snapshot of every derived number produced by {@code DerivedStatsCalculator#deriveAll}. The
 * snapshot is only valid for the character it was computed from; any edit to the character calls
 * for a fresh computation.
 *
 * @param physicalCM            physical condition monitor boxes, improvements included
 * @param stunCM                stun condition monitor boxes, improvements included
 * @param overflow              overflow boxes past the physical track
 * @param woundModifier         non-positive dice pool penalty from marked damage
 * @param initiative            resolved REA + INT plus initiative improvements
 * @param initiativeBonus       initiative improvements on their own
 * @param initiativeDice        initiative dice, one plus improvements
 * @param walkSpeed             meters per turn walking
 * @param runSpeed              meters per turn running
 * @param sprintBonus           metatype sprint bonus in meters per hit
 * @param physicalLimit         physical limit
 * @param mentalLimit           mental limit
 * @param socialLimit           social limit, essence rounded down
 * @param defense               REA + INT
 * @param dodge                 Dodge skill pool, or defaulting pool without the skill
 * @param armorBallistic        worn ballistic armor plus armor improvements
 * @param armorImpact           worn impact armor plus armor improvements
 * @param encumbrance           worn ballistic armor in excess of BOD
 * @param composure             CHA + WIL
 * @param judgeIntentions       CHA + INT
 * @param memory                LOG + WIL
 * @param liftCarry             BOD + STR
 * @param damageResistanceBonus stacked damage resistance improvements
 * @param spellResistanceBonus  stacked spell resistance improvements
 * @param essence               remaining essence
 * @param drainResistance       tradition drain pool, zero when mundane
 * @param astralInitiative      INT x 2
 * @param astralInitiativeDice  fixed astral dice
 * @param fadingResistance      RES + WIL for technomancers, zero otherwise
 * @param matrixInitiative      INT + RES
 * @param matrixInitiativeDice  fixed hot-sim dice
 */
public record DerivedStats(int physicalCM,
                           int stunCM,
                           int overflow,
                           int woundModifier,
                           int initiative,
                           int initiativeBonus,
                           int initiativeDice,
                           int walkSpeed,
                           int runSpeed,
                           int sprintBonus,
                           int physicalLimit,
                           int mentalLimit,
                           int socialLimit,
                           int defense,
                           int dodge,
                           int armorBallistic,
                           int armorImpact,
                           int encumbrance,
                           int composure,
                           int judgeIntentions,
                           int memory,
                           int liftCarry,
                           int damageResistanceBonus,
                           int spellResistanceBonus,
                           double essence,
                           int drainResistance,
                           int astralInitiative,
                           int astralInitiativeDice,
                           int fadingResistance,
                           int matrixInitiative,
                           int matrixInitiativeDice) {

    /**
     * Flattens the snapshot into an ordered name to value map, keyed by component name.
     */
    public Map<String, Number> asMap() {
        Map<String, Number> values = new LinkedHashMap<>();
        values.put("physicalCM", physicalCM);
        values.put("stunCM", stunCM);
        values.put("overflow", overflow);
        values.put("woundModifier", woundModifier);
        values.put("initiative", initiative);
        values.put("initiativeBonus", initiativeBonus);
        values.put("initiativeDice", initiativeDice);
        values.put("walkSpeed", walkSpeed);
        values.put("runSpeed", runSpeed);
        values.put("sprintBonus", sprintBonus);
        values.put("physicalLimit", physicalLimit);
        values.put("mentalLimit", mentalLimit);
        values.put("socialLimit", socialLimit);
        values.put("defense", defense);
        values.put("dodge", dodge);
        values.put("armorBallistic", armorBallistic);
        values.put("armorImpact", armorImpact);
        values.put("encumbrance", encumbrance);
        values.put("composure", composure);
        values.put("judgeIntentions", judgeIntentions);
        values.put("memory", memory);
        values.put("liftCarry", liftCarry);
        values.put("damageResistanceBonus", damageResistanceBonus);
        values.put("spellResistanceBonus", spellResistanceBonus);
        values.put("essence", essence);
        values.put("drainResistance", drainResistance);
        values.put("astralInitiative", astralInitiative);
        values.put("astralInitiativeDice", astralInitiativeDice);
        values.put("fadingResistance", fadingResistance);
        values.put("matrixInitiative", matrixInitiative);
        values.put("matrixInitiativeDice", matrixInitiativeDice);
        return Collections.unmodifiableMap(values);
    }
}
