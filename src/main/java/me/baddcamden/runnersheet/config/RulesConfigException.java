package me.baddcamden.runnersheet.config;

/**
 * Thrown when the rules configuration cannot be read or parsed at all. Individual malformed
 * entries are logged and skipped instead.
 */
public class RulesConfigException extends RuntimeException {

    public RulesConfigException(String message) {
        super(message);
    }

    public RulesConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
