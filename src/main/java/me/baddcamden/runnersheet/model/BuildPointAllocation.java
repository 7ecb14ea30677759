package me.baddcamden.runnersheet.model;

/**
 * Build points spent per creation category. The quality caps are checked against the quality
 * list itself; {@link #qualities()} only feeds the overall total.
 */
public record BuildPointAllocation(int metatype,
                                   int attributes,
                                   int skills,
                                   int qualities,
                                   int resources,
                                   int contacts,
                                   int other) {

    public static final BuildPointAllocation NONE = new BuildPointAllocation(0, 0, 0, 0, 0, 0, 0);

    public int total() {
        return metatype + attributes + skills + qualities + resources + contacts + other;
    }

    public BuildPointAllocation withMetatype(int bp) {
        return new BuildPointAllocation(bp, attributes, skills, qualities, resources, contacts, other);
    }

    public BuildPointAllocation withAttributes(int bp) {
        return new BuildPointAllocation(metatype, bp, skills, qualities, resources, contacts, other);
    }

    public BuildPointAllocation withSkills(int bp) {
        return new BuildPointAllocation(metatype, attributes, bp, qualities, resources, contacts, other);
    }

    public BuildPointAllocation withQualities(int bp) {
        return new BuildPointAllocation(metatype, attributes, skills, bp, resources, contacts, other);
    }

    public BuildPointAllocation withResources(int bp) {
        return new BuildPointAllocation(metatype, attributes, skills, qualities, bp, contacts, other);
    }

    public BuildPointAllocation withContacts(int bp) {
        return new BuildPointAllocation(metatype, attributes, skills, qualities, resources, bp, other);
    }
}
