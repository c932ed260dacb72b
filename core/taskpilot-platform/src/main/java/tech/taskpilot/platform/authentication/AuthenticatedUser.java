package tech.taskpilot.platform.authentication;

/**
 * Caller identity established from a valid bearer session.
 */
public record AuthenticatedUser(String userId, String sessionId) {}
