package me.baddcamden.runnersheet.validation;

import static me.baddcamden.runnersheet.validation.IssueSeverity.ERROR;
import static me.baddcamden.runnersheet.validation.IssueSeverity.INFO;
import static me.baddcamden.runnersheet.validation.IssueSeverity.WARNING;

/**
 * Every issue the validator can report, with its fixed severity and display category.
 */
public enum IssueCode {
    NO_NAME(WARNING, "Identity"),
    NO_METATYPE(ERROR, "Identity"),

    BP_OVERSPENT(ERROR, "Build Points"),
    POSITIVE_QUALITY_CAP(ERROR, "Qualities"),
    NEGATIVE_QUALITY_CAP(ERROR, "Qualities"),
    RESOURCES_CAP(ERROR, "Resources"),

    ATTR_BELOW_MIN(ERROR, "Attributes"),
    ATTR_ABOVE_MAX(ERROR, "Attributes"),
    ATTR_ABOVE_AUG(ERROR, "Attributes"),
    MAG_ABOVE_MAX(ERROR, "Attributes"),
    RES_ABOVE_MAX(ERROR, "Attributes"),
    ESSENCE_NEGATIVE(ERROR, "Attributes"),
    MAG_EXCEEDS_ESSENCE(ERROR, "Attributes"),

    SKILL_ABOVE_MAX(ERROR, "Skills"),
    SKILL_NEGATIVE(ERROR, "Skills"),
    NO_PERCEPTION(WARNING, "Skills"),

    QUALITY_EXCLUSIVE(ERROR, "Qualities"),
    MAGIC_NOT_INITIALIZED(WARNING, "Magic"),
    RESONANCE_NOT_INITIALIZED(WARNING, "Resonance"),

    NO_TRADITION(WARNING, "Magic"),
    POWER_POINTS_OVERSPENT(ERROR, "Magic"),
    NO_POWERS(INFO, "Magic"),

    NO_STREAM(WARNING, "Resonance"),
    NO_COMPLEX_FORMS(INFO, "Resonance"),

    NO_WEAPONS(INFO, "Equipment"),
    NO_ARMOR(WARNING, "Equipment"),
    NO_LIFESTYLE(WARNING, "Equipment"),
    NEGATIVE_NUYEN(ERROR, "Equipment"),

    NO_CONTACTS(INFO, "Contacts"),
    CONTACT_LOYALTY_INVALID(ERROR, "Contacts"),
    CONTACT_CONNECTION_INVALID(ERROR, "Contacts"),

    AVAIL_TOO_HIGH(ERROR, "Availability"),
    FORBIDDEN_ITEM(ERROR, "Availability");

    private final IssueSeverity severity;
    private final String category;

    IssueCode(IssueSeverity severity, String category) {
        this.severity = severity;
        this.category = category;
    }

    public IssueSeverity severity() {
        return severity;
    }

    public String category() {
        return category;
    }
}
