package tech.taskpilot.platform.principal;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.taskpilot.testing.InMemoryUserRepository;

import static org.assertj.core.api.Assertions.*;

class UserServiceTest {

    private UserService service;

    @BeforeEach
    void setUp() {
        service = new UserService();
        service.userRepository = new InMemoryUserRepository();
    }

    @Test
    @DisplayName("upsert should create the user on first login using the provider subject as id")
    void upsert_shouldCreateUser_whenFirstLogin() {
        User user = service.upsert("google-sub-1", "ada@example.com", "Ada");

        assertThat(user.userId).isEqualTo("google-sub-1");
        assertThat(user.createdAt).isEqualTo(user.lastLogin);
        assertThat(service.findById("google-sub-1")).isPresent();
    }

    @Test
    @DisplayName("upsert should refresh email and last login on later logins")
    void upsert_shouldUpdateUser_whenSubjectKnown() {
        // Arrange
        User first = service.upsert("google-sub-1", "ada@example.com", "Ada");

        // Act
        User second = service.upsert("google-sub-1", "ada@newmail.example", null);

        // Assert: name is kept when the provider omits it
        assertThat(second.email).isEqualTo("ada@newmail.example");
        assertThat(second.name).isEqualTo("Ada");
        assertThat(second.lastLogin).isAfterOrEqualTo(first.createdAt);
    }

    @Test
    @DisplayName("upsert should refuse an email that belongs to another subject")
    void upsert_shouldThrow_whenEmailTakenByAnotherSubject() {
        service.upsert("google-sub-1", "ada@example.com", "Ada");

        assertThatThrownBy(() -> service.upsert("google-sub-2", "ada@example.com", "Impostor"))
            .isInstanceOf(UserService.EmailConflictException.class);
    }
}
