package me.baddcamden.runnersheet.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Immutable character sheet.
 * <p>
 * Every edit goes through a {@code with...} function returning a new value; the engine never
 * mutates a character in place. Derived numbers (condition monitors, essence, dice pools) are not
 * stored here and are computed on demand from a snapshot. Optional sub-records ({@link #magic()},
 * {@link #resonance()}) are {@code null} on characters without that capability.
 *
 * @param id               stable identifier
 * @param identity         name and metatype
 * @param mode             creation or career play
 * @param attributes       purchased attribute values
 * @param limits           per-attribute metatype limits; missing codes fall back to defaults
 * @param skills           active skills
 * @param knowledgeSkills  knowledge skills
 * @param qualities        positive and negative qualities
 * @param contacts         contact network
 * @param equipment        owned items and installed augmentations
 * @param magic            awakened sub-record, {@code null} when mundane
 * @param resonance        emerged sub-record, {@code null} unless a technomancer
 * @param condition        marked damage and remaining Edge
 * @param nuyen            nuyen on hand
 * @param karma            unspent karma
 * @param totalKarma       karma earned over the character's career
 * @param buildPoints      build point budget for creation
 * @param buildPointsSpent build points spent per category
 * @param settings         creation settings
 * @param expenseLog       career karma and nuyen ledger
 */
public record Character(String id,
                        Identity identity,
                        CharacterMode mode,
                        AttributeBlock attributes,
                        Map<AttributeCode, AttributeLimits> limits,
                        List<Skill> skills,
                        List<KnowledgeSkill> knowledgeSkills,
                        List<Quality> qualities,
                        List<Contact> contacts,
                        Equipment equipment,
                        MagicProfile magic,
                        ResonanceProfile resonance,
                        ConditionMonitor condition,
                        int nuyen,
                        int karma,
                        int totalKarma,
                        int buildPoints,
                        BuildPointAllocation buildPointsSpent,
                        CharacterSettings settings,
                        List<ExpenseEntry> expenseLog) {

    private static final String LUCKY = "lucky";

    public Character {
        Objects.requireNonNull(id, "id");
        identity = identity == null ? Identity.BLANK : identity;
        mode = mode == null ? CharacterMode.CREATION : mode;
        attributes = attributes == null ? AttributeBlock.empty() : attributes;
        EnumMap<AttributeCode, AttributeLimits> limitCopy = new EnumMap<>(AttributeCode.class);
        if (limits != null) {
            limitCopy.putAll(limits);
        }
        limits = Collections.unmodifiableMap(limitCopy);
        skills = skills == null ? List.of() : List.copyOf(skills);
        knowledgeSkills = knowledgeSkills == null ? List.of() : List.copyOf(knowledgeSkills);
        qualities = qualities == null ? List.of() : List.copyOf(qualities);
        contacts = contacts == null ? List.of() : List.copyOf(contacts);
        equipment = equipment == null ? Equipment.EMPTY : equipment;
        condition = condition == null ? ConditionMonitor.UNHARMED : condition;
        buildPointsSpent = buildPointsSpent == null ? BuildPointAllocation.NONE : buildPointsSpent;
        settings = settings == null ? CharacterSettings.DEFAULT : settings;
        expenseLog = expenseLog == null ? List.of() : List.copyOf(expenseLog);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Limits for one attribute, falling back to {@link AttributeLimits#defaultFor(AttributeCode)}
     * when the metatype did not provide an entry. The Lucky quality lifts both Edge maximums by one.
     */
    public AttributeLimits limitsFor(AttributeCode code) {
        AttributeLimits found = limits.getOrDefault(code, AttributeLimits.defaultFor(code));
        if (code == AttributeCode.EDG && hasQuality(LUCKY)) {
            return found.raisedBy(1);
        }
        return found;
    }

    public boolean isAwakened() {
        return magic != null;
    }

    public boolean isEmerged() {
        return resonance != null;
    }

    public boolean isCareer() {
        return mode == CharacterMode.CAREER;
    }

    public Optional<Skill> findSkill(String name) {
        return skills.stream().filter(skill -> skill.matches(name)).findFirst();
    }

    public Optional<KnowledgeSkill> findKnowledgeSkill(String name) {
        return knowledgeSkills.stream().filter(skill -> skill.matches(name)).findFirst();
    }

    public boolean hasQuality(String name) {
        if (name == null) {
            return false;
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return qualities.stream().anyMatch(quality -> quality.name().toLowerCase(Locale.ROOT).equals(normalized));
    }

    public Character withIdentity(Identity newIdentity) {
        return toBuilder().identity(newIdentity).build();
    }

    public Character withName(String name) {
        return withIdentity(identity.withName(name));
    }

    /**
     * Applies a metatype: records its name, replaces every attribute limit and books its build
     * point cost under the metatype category.
     */
    public Character withMetatype(Metatype metatype) {
        Objects.requireNonNull(metatype, "metatype");
        return toBuilder()
                .identity(identity.withMetatype(metatype.name()))
                .limits(metatype.completeLimits())
                .buildPointsSpent(buildPointsSpent.withMetatype(metatype.bp()))
                .build();
    }

    public Character withMode(CharacterMode newMode) {
        return toBuilder().mode(newMode).build();
    }

    public Character withAttributes(AttributeBlock newAttributes) {
        return toBuilder().attributes(newAttributes).build();
    }

    public Character withLimits(Map<AttributeCode, AttributeLimits> newLimits) {
        return toBuilder().limits(newLimits).build();
    }

    public Character withSkills(List<Skill> newSkills) {
        return toBuilder().skills(newSkills).build();
    }

    /**
     * Replaces the skill with the same name, or appends it when the character does not have it.
     */
    public Character withSkill(Skill skill) {
        List<Skill> updated = new ArrayList<>();
        boolean replaced = false;
        for (Skill existing : skills) {
            if (existing.matches(skill.name())) {
                updated.add(skill);
                replaced = true;
            } else {
                updated.add(existing);
            }
        }
        if (!replaced) {
            updated.add(skill);
        }
        return withSkills(updated);
    }

    public Character withKnowledgeSkills(List<KnowledgeSkill> newKnowledgeSkills) {
        return toBuilder().knowledgeSkills(newKnowledgeSkills).build();
    }

    public Character withKnowledgeSkill(KnowledgeSkill skill) {
        List<KnowledgeSkill> updated = new ArrayList<>();
        boolean replaced = false;
        for (KnowledgeSkill existing : knowledgeSkills) {
            if (existing.matches(skill.name())) {
                updated.add(skill);
                replaced = true;
            } else {
                updated.add(existing);
            }
        }
        if (!replaced) {
            updated.add(skill);
        }
        return withKnowledgeSkills(updated);
    }

    public Character withQualities(List<Quality> newQualities) {
        return toBuilder().qualities(newQualities).build();
    }

    public Character withContacts(List<Contact> newContacts) {
        return toBuilder().contacts(newContacts).build();
    }

    public Character withEquipment(Equipment newEquipment) {
        return toBuilder().equipment(newEquipment).build();
    }

    public Character withMagic(MagicProfile newMagic) {
        return toBuilder().magic(newMagic).build();
    }

    public Character withResonance(ResonanceProfile newResonance) {
        return toBuilder().resonance(newResonance).build();
    }

    public Character withCondition(ConditionMonitor newCondition) {
        return toBuilder().condition(newCondition).build();
    }

    public Character withNuyen(int newNuyen) {
        return toBuilder().nuyen(newNuyen).build();
    }

    public Character withKarma(int newKarma) {
        return toBuilder().karma(newKarma).build();
    }

    public Character withTotalKarma(int newTotalKarma) {
        return toBuilder().totalKarma(newTotalKarma).build();
    }

    public Character withBuildPoints(int newBuildPoints) {
        return toBuilder().buildPoints(newBuildPoints).build();
    }

    public Character withBuildPointsSpent(BuildPointAllocation allocation) {
        return toBuilder().buildPointsSpent(allocation).build();
    }

    public Character withSettings(CharacterSettings newSettings) {
        return toBuilder().settings(newSettings).build();
    }

    public Character withExpense(ExpenseEntry entry) {
        List<ExpenseEntry> updated = new ArrayList<>(expenseLog);
        updated.add(entry);
        return toBuilder().expenseLog(updated).build();
    }

    /**
     * Mutable assembler for {@link Character}. Unset fields take the same defaults as a freshly
     * created sheet: creation mode, 400 build points, every core attribute and Edge at 1.
     */
    public static final class Builder {

        private String id = UUID.randomUUID().toString();
        private Identity identity = Identity.BLANK;
        private CharacterMode mode = CharacterMode.CREATION;
        private AttributeBlock attributes = AttributeBlock.uniform(1);
        private Map<AttributeCode, AttributeLimits> limits = Map.of();
        private List<Skill> skills = List.of();
        private List<KnowledgeSkill> knowledgeSkills = List.of();
        private List<Quality> qualities = List.of();
        private List<Contact> contacts = List.of();
        private Equipment equipment = Equipment.EMPTY;
        private MagicProfile magic;
        private ResonanceProfile resonance;
        private ConditionMonitor condition = ConditionMonitor.UNHARMED;
        private int nuyen;
        private int karma;
        private int totalKarma;
        private int buildPoints = 400;
        private BuildPointAllocation buildPointsSpent = BuildPointAllocation.NONE;
        private CharacterSettings settings = CharacterSettings.DEFAULT;
        private List<ExpenseEntry> expenseLog = List.of();

        private Builder() {
        }

        private Builder(Character source) {
            this.id = source.id;
            this.identity = source.identity;
            this.mode = source.mode;
            this.attributes = source.attributes;
            this.limits = source.limits;
            this.skills = source.skills;
            this.knowledgeSkills = source.knowledgeSkills;
            this.qualities = source.qualities;
            this.contacts = source.contacts;
            this.equipment = source.equipment;
            this.magic = source.magic;
            this.resonance = source.resonance;
            this.condition = source.condition;
            this.nuyen = source.nuyen;
            this.karma = source.karma;
            this.totalKarma = source.totalKarma;
            this.buildPoints = source.buildPoints;
            this.buildPointsSpent = source.buildPointsSpent;
            this.settings = source.settings;
            this.expenseLog = source.expenseLog;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder identity(Identity identity) {
            this.identity = identity;
            return this;
        }

        public Builder name(String name) {
            this.identity = identity.withName(name);
            return this;
        }

        public Builder metatype(String metatype) {
            this.identity = identity.withMetatype(metatype);
            return this;
        }

        public Builder mode(CharacterMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder attributes(AttributeBlock attributes) {
            this.attributes = attributes;
            return this;
        }

        public Builder attribute(AttributeCode code, int base) {
            this.attributes = attributes.withBase(code, base);
            return this;
        }

        public Builder limits(Map<AttributeCode, AttributeLimits> limits) {
            this.limits = limits;
            return this;
        }

        public Builder skills(List<Skill> skills) {
            this.skills = skills;
            return this;
        }

        public Builder knowledgeSkills(List<KnowledgeSkill> knowledgeSkills) {
            this.knowledgeSkills = knowledgeSkills;
            return this;
        }

        public Builder qualities(List<Quality> qualities) {
            this.qualities = qualities;
            return this;
        }

        public Builder contacts(List<Contact> contacts) {
            this.contacts = contacts;
            return this;
        }

        public Builder equipment(Equipment equipment) {
            this.equipment = equipment;
            return this;
        }

        public Builder magic(MagicProfile magic) {
            this.magic = magic;
            return this;
        }

        public Builder resonance(ResonanceProfile resonance) {
            this.resonance = resonance;
            return this;
        }

        public Builder condition(ConditionMonitor condition) {
            this.condition = condition;
            return this;
        }

        public Builder nuyen(int nuyen) {
            this.nuyen = nuyen;
            return this;
        }

        public Builder karma(int karma) {
            this.karma = karma;
            return this;
        }

        public Builder totalKarma(int totalKarma) {
            this.totalKarma = totalKarma;
            return this;
        }

        public Builder buildPoints(int buildPoints) {
            this.buildPoints = buildPoints;
            return this;
        }

        public Builder buildPointsSpent(BuildPointAllocation buildPointsSpent) {
            this.buildPointsSpent = buildPointsSpent;
            return this;
        }

        public Builder settings(CharacterSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder expenseLog(List<ExpenseEntry> expenseLog) {
            this.expenseLog = expenseLog;
            return this;
        }

        public Character build() {
            return new Character(id, identity, mode, attributes, limits, skills, knowledgeSkills, qualities,
                    contacts, equipment, magic, resonance, condition, nuyen, karma, totalKarma, buildPoints,
                    buildPointsSpent, settings, expenseLog);
        }
    }
}
