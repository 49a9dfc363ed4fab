package org.gudu0.progression.rewards;

/**
 * Thrown by a {@link RewardGrantService} when a grant could not be applied.
 * The engine keeps the grant pending and retries it later.
 */
public class RewardGrantException extends Exception {
    public RewardGrantException(String message) {
        super(message);
    }

    public RewardGrantException(String message, Throwable cause) {
        super(message, cause);
    }
}
