package tech.taskpilot.platform.common.errors;

/**
 * Dynamic client registration or client validation failed.
 */
public class ClientRegistrationException extends RuntimeException {

    public static final String INVALID_CLIENT_METADATA = "invalid_client_metadata";
    public static final String INVALID_REDIRECT_URI = "invalid_redirect_uri";
    public static final String INVALID_CLIENT = "invalid_client";
    public static final String CLIENT_NOT_FOUND = "client_not_found";

    private final String errorCode;

    public ClientRegistrationException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public int getStatus() {
        return CLIENT_NOT_FOUND.equals(errorCode) ? 404 : 400;
    }
}
