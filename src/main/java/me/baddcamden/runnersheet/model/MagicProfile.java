package me.baddcamden.runnersheet.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Awakened sub-record. Present only on magicians, adepts and mystic adepts.
 *
 * @param tradition     tradition name, e.g. "Hermetic" or "Shamanic"; may be blank before selection
 * @param powers        adept powers bought with power points
 * @param spells        spell names known
 * @param powerPoints   power points available to an adept; {@code 0} for pure magicians
 * @param initiateGrade current initiate grade
 */
public record MagicProfile(String tradition,
                           List<AdeptPower> powers,
                           List<String> spells,
                           double powerPoints,
                           int initiateGrade) {

    public MagicProfile {
        powers = powers == null ? List.of() : List.copyOf(powers);
        spells = spells == null ? List.of() : List.copyOf(spells);
    }

    public static MagicProfile of(String tradition) {
        return new MagicProfile(tradition, List.of(), List.of(), 0.0d, 0);
    }

    public double powerPointsUsed() {
        return powers.stream().mapToDouble(AdeptPower::pointCost).sum();
    }

    public MagicProfile withPowers(List<AdeptPower> newPowers) {
        return new MagicProfile(tradition, newPowers, spells, powerPoints, initiateGrade);
    }

    public MagicProfile withPowerPoints(double newPowerPoints) {
        return new MagicProfile(tradition, powers, spells, newPowerPoints, initiateGrade);
    }

    public MagicProfile addSpell(String spell) {
        List<String> updated = new ArrayList<>(spells);
        updated.add(spell);
        return new MagicProfile(tradition, powers, updated, powerPoints, initiateGrade);
    }

    public MagicProfile withInitiateGrade(int grade) {
        return new MagicProfile(tradition, powers, spells, powerPoints, grade);
    }
}
