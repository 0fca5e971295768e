package com.pvp.battlesim.config;

/**
 * Exception thrown by MatchupLoader operations.
 */
public class MatchupException extends Exception {
    public MatchupException(String message) {
        super(message);
    }

    public MatchupException(String message, Throwable cause) {
        super(message, cause);
    }
}
