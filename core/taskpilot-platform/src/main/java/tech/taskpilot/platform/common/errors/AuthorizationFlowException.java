package tech.taskpilot.platform.common.errors;

/**
 * Failure in the authorize / callback / refresh flow.
 *
 * <p>Carries an OAuth-style error code ({@code invalid_state}, {@code invalid_grant}, ...)
 * and the HTTP status the caller should see.
 */
public class AuthorizationFlowException extends RuntimeException {

    public static final String INVALID_REQUEST = "invalid_request";
    public static final String INVALID_STATE = "invalid_state";
    public static final String INVALID_GRANT = "invalid_grant";
    public static final String INVALID_TOKEN = "invalid_token";
    public static final String ACCESS_DENIED = "access_denied";
    public static final String SESSION_NOT_FOUND = "session_not_found";
    public static final String SERVER_ERROR = "server_error";

    private final String errorCode;
    private final int status;

    public AuthorizationFlowException(String errorCode, String message, int status) {
        super(message);
        this.errorCode = errorCode;
        this.status = status;
    }

    public AuthorizationFlowException(String errorCode, String message, int status, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.status = status;
    }

    public static AuthorizationFlowException badRequest(String errorCode, String message) {
        return new AuthorizationFlowException(errorCode, message, 400);
    }

    public String getErrorCode() {
        return errorCode;
    }

    public int getStatus() {
        return status;
    }
}
