package me.baddcamden.runnersheet.ledger;

import me.baddcamden.runnersheet.model.Bioware;
import me.baddcamden.runnersheet.model.BiowareGrade;
import me.baddcamden.runnersheet.model.Character;
import me.baddcamden.runnersheet.model.Cyberware;
import me.baddcamden.runnersheet.model.CyberwareGrade;
import me.baddcamden.runnersheet.model.Result;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EssenceLedgerTest {

    private static final double EPSILON = 1.0E-9;

    private final EssenceLedger ledger = new EssenceLedger();

    private static Character withNuyen(int nuyen) {
        return Character.builder().name("Chrome").nuyen(nuyen).build();
    }

    @Test
    void installThenRemoveRestoresEssenceAndNuyen() {
        Character before = withNuyen(20_000);
        Result<Character> installed = ledger.tryInstall(before,
                Cyberware.of("Wired Reflexes", 1, 2.0, 11_000, "8R"), CyberwareGrade.STANDARD);

        assertTrue(installed.success());
        Character after = installed.value();
        assertEquals(4.0, ledger.essence(after), EPSILON);
        assertEquals(9_000, after.nuyen());
        String id = after.equipment().cyberware().get(0).id();
        assertNotNull(id);

        Result<Character> removed = ledger.remove(after, id);

        assertTrue(removed.success());
        assertEquals(ledger.essence(before), ledger.essence(removed.value()), EPSILON);
        assertEquals(20_000, removed.value().nuyen());
        assertTrue(removed.value().equipment().cyberware().isEmpty());
    }

    @Test
    void rejectsInstallThatWouldDropEssenceBelowZero() {
        Character character = withNuyen(100_000);

        Result<Character> result = ledger.tryInstall(character,
                Cyberware.of("Full Body Conversion", 0, 6.5, 50_000, "16F"), CyberwareGrade.STANDARD);

        assertTrue(result.isFailure());
        assertSame(character, result.value());
        assertTrue(result.reason().startsWith("Insufficient essence"));
    }

    @Test
    void allowsSpendingEssenceDownToExactlyZero() {
        Result<Character> result = ledger.tryInstall(withNuyen(0),
                Cyberware.of("Everything", 0, 6.0, 0, "1"), CyberwareGrade.STANDARD);

        assertTrue(result.success());
        assertEquals(0.0, ledger.essence(result.value()), EPSILON);
    }

    @Test
    void toleratesFloatingPointDriftOnRepeatedInstalls() {
        Character character = withNuyen(0);
        for (int i = 0; i < 10; i++) {
            Result<Character> result = ledger.tryInstall(character,
                    Cyberware.of("Implant " + i, 0, 0.6, 0, "2"), CyberwareGrade.STANDARD);
            assertTrue(result.success(), "install " + i);
            character = result.value();
        }

        assertEquals(0.0, ledger.essence(character), EPSILON);
        assertTrue(ledger.tryInstall(character, Cyberware.of("One More", 0, 0.6, 0, "2"), null).isFailure());
    }

    @Test
    void gradeScalesEssenceAndCost() {
        Result<Character> result = ledger.tryInstall(withNuyen(30_000),
                Cyberware.of("Wired Reflexes", 1, 2.0, 11_000, "8R"), CyberwareGrade.ALPHAWARE);

        assertTrue(result.success());
        assertEquals(4.4, ledger.essence(result.value()), EPSILON);
        assertEquals(8_000, result.value().nuyen());
        assertEquals(CyberwareGrade.ALPHAWARE, result.value().equipment().cyberware().get(0).grade());
    }

    @Test
    void rejectsInstallWithoutEnoughNuyen() {
        Character character = withNuyen(5_000);

        Result<Character> result = ledger.tryInstall(character,
                Cyberware.of("Wired Reflexes", 1, 2.0, 11_000, "8R"), CyberwareGrade.STANDARD);

        assertFalse(result.success());
        assertSame(character, result.value());
        assertTrue(result.reason().startsWith("Insufficient nuyen"));
    }

    @Test
    void subsystemsCountTowardsEssenceAndReceiveFreshIds() {
        Cyberware eye = new Cyberware("catalog-eye", "Cybereyes", "Eyeware", CyberwareGrade.STANDARD, 1, 0.2, 4_000,
                "3", List.of(new Cyberware("catalog-lowlight", "Low-Light Vision", "Eyeware", null, 0, 0.1, 500,
                "4", List.of(), null)), null);

        Result<Character> result = ledger.tryInstall(withNuyen(10_000), eye, null);

        Cyberware installed = result.value().equipment().cyberware().get(0);
        assertEquals(5.7, ledger.essence(result.value()), EPSILON);
        assertEquals(5_500, result.value().nuyen());
        assertNotEquals("catalog-eye", installed.id());
        assertNotEquals("catalog-lowlight", installed.subsystems().get(0).id());
        assertNotEquals(installed.id(), installed.subsystems().get(0).id());

        Result<Character> removed = ledger.remove(result.value(), installed.id());
        assertEquals(10_000, removed.value().nuyen());
        assertEquals(6.0, ledger.essence(removed.value()), EPSILON);
    }

    @Test
    void biowareSharesTheEssenceBudget() {
        Character chromed = ledger.tryInstall(withNuyen(100_000),
                Cyberware.of("Muscle Replacement", 4, 4.0, 40_000, "12R"), CyberwareGrade.STANDARD).value();

        Result<Character> tooMuch = ledger.tryInstall(chromed,
                Bioware.of("Suprathyroid Gland", 1, 2.5, 50_000, "20R"), BiowareGrade.STANDARD);
        Result<Character> cultured = ledger.tryInstall(chromed,
                Bioware.of("Muscle Toner", 2, 0.4, 10_000, "8R"), BiowareGrade.CULTURED);

        assertTrue(tooMuch.isFailure());
        assertTrue(cultured.success());
        assertEquals(1.7, ledger.essence(cultured.value()), EPSILON);
        assertEquals(20_000, cultured.value().nuyen());
    }

    @Test
    void removingUnknownItemFails() {
        Character character = withNuyen(0);

        Result<Character> result = ledger.remove(character, "missing");

        assertTrue(result.isFailure());
        assertSame(character, result.value());
        assertEquals("Augmentation not found: missing", result.reason());
    }
}
