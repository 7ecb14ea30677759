package me.baddcamden.runnersheet.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Emerged sub-record. Present only on technomancers.
 */
public record ResonanceProfile(String stream, List<String> complexForms, int submersionGrade) {

    public ResonanceProfile {
        complexForms = complexForms == null ? List.of() : List.copyOf(complexForms);
    }

    public static ResonanceProfile of(String stream) {
        return new ResonanceProfile(stream, List.of(), 0);
    }

    public ResonanceProfile addComplexForm(String form) {
        List<String> updated = new ArrayList<>(complexForms);
        updated.add(form);
        return new ResonanceProfile(stream, updated, submersionGrade);
    }
}
