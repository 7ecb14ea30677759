package me.baddcamden.runnersheet.ledger;

import me.baddcamden.runnersheet.model.Bioware;
import me.baddcamden.runnersheet.model.BiowareGrade;
import me.baddcamden.runnersheet.model.Character;
import me.baddcamden.runnersheet.model.Cyberware;
import me.baddcamden.runnersheet.model.CyberwareGrade;
import me.baddcamden.runnersheet.model.Equipment;
import me.baddcamden.runnersheet.model.Result;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;
import java.util.logging.Logger;

/**
 * Tracks essence spent on augmentations and gates new installations.
 * <p>
 * Cyberware (with every nested subsystem) and bioware draw from one shared essence budget. Each
 * piece costs its base essence times its grade's essence multiplier. Essence is never stored:
 * it is recomputed from the installed list on every call, so installing and then removing the
 * same piece restores the previous value exactly.
 * <p>
 * {@link #tryInstall(Character, Cyberware, CyberwareGrade)} and its bioware overload are the only
 * operations that enforce the essence and nuyen invariants. A rejected installation returns the
 * character untouched inside a failed {@link Result}.
 */
public class EssenceLedger {

    /** Slack allowed when a purchase would leave essence at exactly zero. */
    private static final double TOLERANCE = 1e-9d;

    private final double startingEssence;
    private final Logger logger;

    public EssenceLedger(double startingEssence, Logger logger) {
        if (startingEssence < 0) {
            throw new IllegalArgumentException("Starting essence cannot be negative");
        }
        this.startingEssence = startingEssence;
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public EssenceLedger() {
        this(6.0d, Logger.getLogger(EssenceLedger.class.getName()));
    }

    public double startingEssence() {
        return startingEssence;
    }

    /**
     * Remaining essence: the starting budget minus every installed piece's graded essence.
     */
    public double essence(Character character) {
        return startingEssence - essenceSpent(character);
    }

    /**
     * Graded essence consumed by installed cyberware (subsystems included) and bioware.
     */
    public double essenceSpent(Character character) {
        Objects.requireNonNull(character, "character");
        double spent = 0.0d;
        for (Cyberware implant : character.equipment().cyberware()) {
            spent += essenceOf(implant);
        }
        for (Bioware implant : character.equipment().bioware()) {
            spent += implant.gradedEssence();
        }
        return spent;
    }

    /**
     * Graded essence of an implant together with all of its subsystems.
     */
    public static double essenceOf(Cyberware implant) {
        double total = implant.gradedEssence();
        for (Cyberware subsystem : implant.subsystems()) {
            total += essenceOf(subsystem);
        }
        return total;
    }

    /**
     * Graded nuyen cost of an implant together with all of its subsystems.
     */
    public static int costOf(Cyberware implant) {
        int total = implant.gradedCost();
        for (Cyberware subsystem : implant.subsystems()) {
            total += costOf(subsystem);
        }
        return total;
    }

    /**
     * Installs a cyberware candidate at the given grade.
     *
     * @param character character receiving the implant
     * @param candidate catalog item; its id is replaced by a fresh one
     * @param grade     grade to install at, or {@code null} to keep the candidate's grade
     * @return the updated character, or a failure carrying the unchanged character when essence
     * or nuyen would run out
     */
    public Result<Character> tryInstall(Character character, Cyberware candidate, CyberwareGrade grade) {
        Objects.requireNonNull(character, "character");
        Objects.requireNonNull(candidate, "candidate");
        Cyberware graded = withFreshIds(grade == null ? candidate : candidate.withGrade(grade));

        Result<Character> check = checkBudget(character, graded.name(), essenceOf(graded), costOf(graded));
        if (check.isFailure()) {
            return check;
        }
        Character updated = character
                .withEquipment(character.equipment().addCyberware(graded))
                .withNuyen(character.nuyen() - costOf(graded));
        return Result.ok(updated);
    }

    /**
     * Installs a bioware candidate at the given grade. Bioware shares the cyberware essence budget.
     */
    public Result<Character> tryInstall(Character character, Bioware candidate, BiowareGrade grade) {
        Objects.requireNonNull(character, "character");
        Objects.requireNonNull(candidate, "candidate");
        Bioware graded = (grade == null ? candidate : candidate.withGrade(grade)).withId(newId());

        Result<Character> check = checkBudget(character, graded.name(), graded.gradedEssence(), graded.gradedCost());
        if (check.isFailure()) {
            return check;
        }
        Character updated = character
                .withEquipment(character.equipment().addBioware(graded))
                .withNuyen(character.nuyen() - graded.gradedCost());
        return Result.ok(updated);
    }

    /**
     * Removes an installed top-level cyberware or bioware piece and refunds its graded cost.
     * Essence is recomputed from the remaining pieces.
     *
     * @param character character to modify
     * @param itemId    id of the installed piece
     * @return the updated character, or a failure when no installed piece has that id
     */
    public Result<Character> remove(Character character, String itemId) {
        Objects.requireNonNull(character, "character");
        Equipment equipment = character.equipment();

        List<Cyberware> cyberware = new ArrayList<>(equipment.cyberware());
        for (int i = 0; i < cyberware.size(); i++) {
            Cyberware implant = cyberware.get(i);
            if (implant.id() != null && implant.id().equals(itemId)) {
                cyberware.remove(i);
                return Result.ok(character
                        .withEquipment(equipment.withCyberware(cyberware))
                        .withNuyen(character.nuyen() + costOf(implant)));
            }
        }

        List<Bioware> bioware = new ArrayList<>(equipment.bioware());
        for (int i = 0; i < bioware.size(); i++) {
            Bioware implant = bioware.get(i);
            if (implant.id() != null && implant.id().equals(itemId)) {
                bioware.remove(i);
                return Result.ok(character
                        .withEquipment(equipment.withBioware(bioware))
                        .withNuyen(character.nuyen() + implant.gradedCost()));
            }
        }

        logger.fine("Remove rejected: no installed augmentation with id " + itemId);
        return Result.failure(character, "Augmentation not found: " + itemId);
    }

    private Result<Character> checkBudget(Character character, String itemName, double essenceCost, int nuyenCost) {
        double available = essence(character);
        if (available - essenceCost < -TOLERANCE) {
            String reason = String.format(Locale.ROOT,
                    "Insufficient essence for %s: requires %.2f, available %.2f", itemName, essenceCost, available);
            logger.fine("Install rejected: " + reason);
            return Result.failure(character, reason);
        }
        if (nuyenCost > character.nuyen()) {
            String reason = "Insufficient nuyen for " + itemName + ": requires " + nuyenCost
                    + ", available " + character.nuyen();
            logger.fine("Install rejected: " + reason);
            return Result.failure(character, reason);
        }
        return Result.ok(character);
    }

    private static Cyberware withFreshIds(Cyberware implant) {
        List<Cyberware> subsystems = new ArrayList<>();
        for (Cyberware subsystem : implant.subsystems()) {
            subsystems.add(withFreshIds(subsystem));
        }
        return implant.withId(newId()).withSubsystems(subsystems);
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }
}
