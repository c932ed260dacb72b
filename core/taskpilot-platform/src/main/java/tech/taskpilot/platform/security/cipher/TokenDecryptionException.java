package tech.taskpilot.platform.security.cipher;

import tech.taskpilot.platform.common.errors.InfrastructureException;

/**
 * Stored ciphertext could not be authenticated or decrypted. Distinct from
 * "not found": the row exists but its bytes are unusable under the current key.
 */
public class TokenDecryptionException extends InfrastructureException {

    public TokenDecryptionException(String message) {
        super(message, null);
    }

    public TokenDecryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
