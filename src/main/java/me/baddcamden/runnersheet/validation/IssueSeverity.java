package me.baddcamden.runnersheet.validation;

public enum IssueSeverity {
    ERROR,
    WARNING,
    INFO
}
