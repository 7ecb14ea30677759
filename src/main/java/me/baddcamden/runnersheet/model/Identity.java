package me.baddcamden.runnersheet.model;

/**
 * Display name and metatype of a character. Either may be blank on a freshly created sheet.
 */
public record Identity(String name, String metatype) {

    public static final Identity BLANK = new Identity("", "");

    public Identity {
        name = name == null ? "" : name;
        metatype = metatype == null ? "" : metatype;
    }

    public Identity withName(String newName) {
        return new Identity(newName, metatype);
    }

    public Identity withMetatype(String newMetatype) {
        return new Identity(name, newMetatype);
    }
}
