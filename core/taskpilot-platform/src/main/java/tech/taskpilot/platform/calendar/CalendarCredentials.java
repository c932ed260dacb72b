package tech.taskpilot.platform.calendar;

/**
 * Provider tokens of the calling session, decrypted just for this call.
 */
public record CalendarCredentials(String sessionId, String accessToken, String refreshToken) {

    @Override
    public String toString() {
        return "CalendarCredentials[session=" + (sessionId == null ? null : sessionId.substring(0, Math.min(8, sessionId.length()))) + "...]";
    }
}
