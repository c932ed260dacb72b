package tech.taskpilot.platform.maintenance;

import jakarta.ws.rs.NotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.taskpilot.platform.authentication.client.ClientRegistrationService;
import tech.taskpilot.platform.authentication.session.SessionService;
import tech.taskpilot.platform.common.errors.AuthenticationException;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MaintenanceResourceTest {

    @Mock
    private SessionService sessionService;

    @Mock
    private ClientRegistrationService clientRegistrationService;

    @InjectMocks
    private MaintenanceResource resource;

    @BeforeEach
    void setUp() {
        resource.maintenanceToken = Optional.of("sweep-token");
    }

    @Test
    @DisplayName("sweep should remove expired sessions and clients when the token matches")
    void sweep_shouldReturnCounts_whenTokenMatches() {
        when(sessionService.cleanupExpired()).thenReturn(4L);
        when(clientRegistrationService.cleanupExpired()).thenReturn(1L);

        MaintenanceResource.SweepResponse response = resource.sweep("sweep-token");

        assertThat(response).isEqualTo(new MaintenanceResource.SweepResponse(4, 1));
    }

    @Test
    @DisplayName("sweep should reject a wrong or missing token without touching the stores")
    void sweep_shouldThrow_whenTokenWrong() {
        assertThatThrownBy(() -> resource.sweep("guess")).isInstanceOf(AuthenticationException.class);
        assertThatThrownBy(() -> resource.sweep(null)).isInstanceOf(AuthenticationException.class);
        verifyNoInteractions(sessionService, clientRegistrationService);
    }

    @Test
    @DisplayName("sweep should not exist when no token is configured")
    void sweep_shouldThrowNotFound_whenDisabled() {
        resource.maintenanceToken = Optional.empty();

        assertThatThrownBy(() -> resource.sweep("anything")).isInstanceOf(NotFoundException.class);
    }
}
