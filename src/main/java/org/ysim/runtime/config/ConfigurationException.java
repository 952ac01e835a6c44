package org.ysim.runtime.config;

/**
 * Thrown when the configuration cannot describe a valid run.
 * <p>
 * Possible causes include:
 * <ul>
 *   <li>A missing or malformed hourly activity table</li>
 *   <li>Unknown action names or negative likelihoods</li>
 *   <li>Population rates that are out of range or contradict each other</li>
 *   <li>A heavy resource unit that does not fit the configured capacity</li>
 *   <li>Unknown recommender strategy names</li>
 * </ul>
 * <p>
 * This is a RuntimeException because configuration problems are fatal at startup: the
 * simulation never begins.
 */
public class ConfigurationException extends RuntimeException {

    /**
     * Creates a ConfigurationException with the specified message.
     *
     * @param message Description of the configuration problem
     */
    public ConfigurationException(String message) {
        super(message);
    }

    /**
     * Creates a ConfigurationException with the specified message and cause.
     *
     * @param message Description of the configuration problem
     * @param cause The underlying exception that caused the failure
     */
    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
