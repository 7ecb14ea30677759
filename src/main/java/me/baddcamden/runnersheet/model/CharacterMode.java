package me.baddcamden.runnersheet.model;

/**
 * Lifecycle stage of a character. Creation enforces build-point budgets and availability caps;
 * career play spends karma and nuyen instead.
 */
public enum CharacterMode {
    CREATION,
    CAREER
}
