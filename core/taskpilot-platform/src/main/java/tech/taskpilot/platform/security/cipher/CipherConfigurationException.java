package tech.taskpilot.platform.security.cipher;

import tech.taskpilot.platform.common.errors.InfrastructureException;

/**
 * The encryption key is missing or malformed, or the JCE cannot provide the algorithm.
 */
public class CipherConfigurationException extends InfrastructureException {

    public CipherConfigurationException(String message) {
        super(message, null);
    }

    public CipherConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
