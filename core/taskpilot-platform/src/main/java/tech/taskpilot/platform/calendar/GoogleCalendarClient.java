package tech.taskpilot.platform.calendar;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.taskpilot.platform.authentication.oidc.IdentityProviderClient;
import tech.taskpilot.platform.authentication.oidc.IdentityProviderException;
import tech.taskpilot.platform.authentication.session.SessionService;
import tech.taskpilot.platform.shared.SecureTokens;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.function.Function;

/**
 * Google Calendar v3 events client.
 *
 * <p>If the API answers 401 the access token is refreshed once through the
 * identity provider, written back to the session, and the call is retried.
 */
@ApplicationScoped
public class GoogleCalendarClient implements CalendarClient {

    private static final Logger LOG = Logger.getLogger(GoogleCalendarClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final DateTimeFormatter RFC_3339 = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssXXX");

    @Inject
    CalendarConfig config;

    @Inject
    IdentityProviderClient identityProvider;

    @Inject
    SessionService sessionService;

    private final HttpClient httpClient = HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(10))
        .build();

    @Override
    public CalendarEvent createEvent(CalendarCredentials credentials, CalendarEventRequest request)
            throws CalendarException {
        String payload = eventBody(request, config.defaultTimeZone()).toString();
        HttpResponse<String> response = sendWithRefresh(credentials, token -> HttpRequest.newBuilder()
            .uri(eventsUri(""))
            .header("Authorization", "Bearer " + token)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(payload))
            .timeout(config.timeout())
            .build());

        if (response.statusCode() != 200 && response.statusCode() != 201) {
            LOG.warnf("Calendar event creation failed with HTTP %d", response.statusCode());
            throw new CalendarException("Calendar API returned HTTP " + response.statusCode());
        }
        try {
            JsonNode json = MAPPER.readTree(response.body());
            String id = json.path("id").asText(null);
            if (id == null) {
                throw new CalendarException("Calendar API response missing event id");
            }
            return new CalendarEvent(id, json.path("htmlLink").asText(null));
        } catch (CalendarException e) {
            throw e;
        } catch (Exception e) {
            throw new CalendarException("Unreadable calendar API response", e);
        }
    }

    static ObjectNode eventBody(CalendarEventRequest request, ZoneId zone) {
        ObjectNode body = MAPPER.createObjectNode();
        body.put("summary", request.summary());
        body.put("description", request.description());
        body.putObject("start")
            .put("dateTime", RFC_3339.format(request.start().atZone(zone)))
            .put("timeZone", zone.getId());
        body.putObject("end")
            .put("dateTime", RFC_3339.format(request.end().atZone(zone)))
            .put("timeZone", zone.getId());
        return body;
    }

    @Override
    public void deleteEvent(CalendarCredentials credentials, String eventId) throws CalendarException {
        HttpResponse<String> response = sendWithRefresh(credentials, token -> HttpRequest.newBuilder()
            .uri(eventsUri("/" + URLEncoder.encode(eventId, StandardCharsets.UTF_8)))
            .header("Authorization", "Bearer " + token)
            .DELETE()
            .timeout(config.timeout())
            .build());

        // 410: already gone
        if (response.statusCode() != 204 && response.statusCode() != 200 && response.statusCode() != 410) {
            throw new CalendarException("Calendar API returned HTTP " + response.statusCode());
        }
    }

    private HttpResponse<String> sendWithRefresh(CalendarCredentials credentials,
                                                 Function<String, HttpRequest> requestFor)
            throws CalendarException {
        HttpResponse<String> response = send(requestFor.apply(credentials.accessToken()));
        if (response.statusCode() != 401) {
            return response;
        }

        LOG.infof("Calendar access token rejected, refreshing for session %s",
            SecureTokens.abbreviate(credentials.sessionId()));
        IdentityProviderClient.RefreshedAccess refreshed;
        try {
            refreshed = identityProvider.refreshAccess(credentials.refreshToken());
        } catch (IdentityProviderException e) {
            throw new CalendarException("Calendar credentials expired and could not be refreshed", e);
        }
        sessionService.refresh(credentials.sessionId(), refreshed.accessToken(), refreshed.expiresAt());
        return send(requestFor.apply(refreshed.accessToken()));
    }

    private HttpResponse<String> send(HttpRequest request) throws CalendarException {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CalendarException("Interrupted while calling calendar API", e);
        } catch (Exception e) {
            throw new CalendarException("Calendar API call failed: " + e.getMessage(), e);
        }
    }

    private URI eventsUri(String suffix) {
        String calendarId = URLEncoder.encode(config.calendarId(), StandardCharsets.UTF_8);
        return URI.create(config.baseUrl() + "/calendars/" + calendarId + "/events" + suffix);
    }
}
