package me.baddcamden.runnersheet.model;

/**
 * Origin category of an improvement. Bonuses only stack across different sources; within one
 * source the highest value wins.
 */
public enum ImprovementSource {
    CYBERWARE,
    BIOWARE,
    QUALITY,
    ADEPT_POWER,
    GEAR,
    SPELL
}
