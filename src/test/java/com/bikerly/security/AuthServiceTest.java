package com.bikerly.security;

import com.bikerly.observability.AuthMetricsServiceStub;
import com.bikerly.shared.dto.RegisterRequest;
import com.bikerly.shared.error.ApiException;
import com.bikerly.shared.error.ErrorKind;
import com.bikerly.shared.model.Role;
import com.bikerly.shared.model.User;
import com.bikerly.shared.repository.UserRepository;
import com.bikerly.util.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for registration and login flows.
 */
@ExtendWith(MockitoExtension.class)
class AuthServiceTest {

    @Mock
    private UserRepository userRepository;

    private PasswordHasher passwordHasher;
    private TokenService tokenService;
    private AuthService authService;

    @BeforeEach
    void setUp() {
        passwordHasher = spy(new PasswordHasher(4, false));
        tokenService = new TokenService("test-secret-key-for-hmac-signing-0123456789", "HS256", 60,
                new MutableClock(Instant.parse("2026-01-01T10:00:00Z")));
        authService = new AuthService(userRepository, passwordHasher, tokenService, new AuthMetricsServiceStub());
    }

    @Test
    void testRegisterCreatesActiveUnverifiedRider() {
        when(userRepository.findByEmail("alice@example.com")).thenReturn(Optional.empty());
        when(userRepository.insert(any(User.class))).thenAnswer(invocation -> {
            User user = invocation.getArgument(0);
            user.setId("64b000000000000000000001");
            return user;
        });

        User created = authService.register(registerRequest("alice@example.com", "correct-horse"));

        ArgumentCaptor<User> captor = ArgumentCaptor.forClass(User.class);
        verify(userRepository).insert(captor.capture());
        User stored = captor.getValue();
        assertThat(created.getId()).isEqualTo("64b000000000000000000001");
        assertThat(stored.getRole()).isEqualTo(Role.RIDER);
        assertThat(stored.isActive()).isTrue();
        assertThat(stored.isVerified()).isFalse();
        assertThat(stored.getUuid()).isNotBlank().isNotEqualTo(stored.getId());
        assertThat(stored.getHashedPassword()).isNotEqualTo("correct-horse");
        assertThat(passwordHasher.verify("correct-horse", stored.getHashedPassword())).isTrue();
        assertThat(stored.getDisplayName()).isEqualTo("Alice");
        assertThat(stored.getCountryCode()).isEqualTo("+1");
    }

    @Test
    void testRegisterDuplicateEmailIsConflict() {
        when(userRepository.findByEmail("alice@example.com"))
                .thenReturn(Optional.of(new User("alice@example.com", "alice", "hash")));

        assertThatThrownBy(() -> authService.register(registerRequest("alice@example.com", "correct-horse")))
                .isInstanceOf(ApiException.class)
                .extracting(e -> ((ApiException) e).getKind())
                .isEqualTo(ErrorKind.CONFLICT);
        verify(userRepository, never()).insert(any(User.class));
    }

    @Test
    void testRegisterUniqueIndexRaceIsConflict() {
        when(userRepository.findByEmail("alice@example.com")).thenReturn(Optional.empty());
        when(userRepository.insert(any(User.class))).thenThrow(new DuplicateKeyException("E11000 duplicate key"));

        assertThatThrownBy(() -> authService.register(registerRequest("alice@example.com", "correct-horse")))
                .isInstanceOf(ApiException.class)
                .extracting(e -> ((ApiException) e).getKind())
                .isEqualTo(ErrorKind.CONFLICT);
    }

    @Test
    void testRegisterStorageFailureIsGenericDatabaseError() {
        when(userRepository.findByEmail("alice@example.com")).thenReturn(Optional.empty());
        when(userRepository.insert(any(User.class)))
                .thenThrow(new DataAccessResourceFailureException("mongo at 10.1.2.3 unreachable"));

        ApiException error = catchApiException(() ->
                authService.register(registerRequest("alice@example.com", "correct-horse")));

        assertThat(error.getKind()).isEqualTo(ErrorKind.DATABASE);
        assertThat(error.getMessage()).doesNotContain("10.1.2.3");
        assertThat(error.getDetail()).doesNotContain("10.1.2.3");
    }

    @Test
    void testLoginIssuesTokenForValidCredentials() {
        User alice = storedUser("alice@example.com", "correct-horse", true);
        when(userRepository.findByEmail("alice@example.com")).thenReturn(Optional.of(alice));

        String token = authService.login("alice@example.com", "correct-horse");

        TokenClaims claims = tokenService.verify(token);
        assertThat(claims.getSubject()).isEqualTo("alice@example.com");
        assertThat(claims.getRole()).isEqualTo(Role.RIDER);
        assertThat(claims.getUuid()).isEqualTo(alice.getUuid());
    }

    @Test
    void testWrongPasswordAndUnknownEmailFailIdentically() {
        User alice = storedUser("alice@example.com", "correct-horse", true);
        when(userRepository.findByEmail("alice@example.com")).thenReturn(Optional.of(alice));
        when(userRepository.findByEmail("nobody@example.com")).thenReturn(Optional.empty());

        ApiException wrongPassword = catchApiException(() -> authService.login("alice@example.com", "wrong"));
        ApiException unknownEmail = catchApiException(() -> authService.login("nobody@example.com", "correct-horse"));

        assertThat(wrongPassword.getKind()).isEqualTo(ErrorKind.AUTHENTICATION);
        assertThat(unknownEmail.getKind()).isEqualTo(ErrorKind.AUTHENTICATION);
        assertThat(wrongPassword.getMessage()).isEqualTo(unknownEmail.getMessage());
        assertThat(wrongPassword.getDetail()).isEqualTo(unknownEmail.getDetail());
    }

    @Test
    void testUnknownEmailStillRunsPasswordCheck() {
        when(userRepository.findByEmail("nobody@example.com")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> authService.login("nobody@example.com", "correct-horse"))
                .isInstanceOf(ApiException.class);

        verify(passwordHasher).verify(eq("correct-horse"), anyString());
    }

    @Test
    void testInactiveAccountCannotLogIn() {
        User bob = storedUser("bob@example.com", "correct-horse", false);
        when(userRepository.findByEmail("bob@example.com")).thenReturn(Optional.of(bob));

        assertThatThrownBy(() -> authService.login("bob@example.com", "correct-horse"))
                .isInstanceOf(ApiException.class)
                .hasMessage("Account is inactive");
    }

    @Test
    void testInactiveAccountWithWrongPasswordGetsGenericError() {
        User bob = storedUser("bob@example.com", "correct-horse", false);
        when(userRepository.findByEmail("bob@example.com")).thenReturn(Optional.of(bob));

        assertThatThrownBy(() -> authService.login("bob@example.com", "wrong"))
                .isInstanceOf(ApiException.class)
                .hasMessage("Incorrect email or password");
    }

    @Test
    void testCorruptStoredHashFailsClosed() {
        User alice = new User("alice@example.com", "alice", "corrupted-hash-value");
        when(userRepository.findByEmail("alice@example.com")).thenReturn(Optional.of(alice));

        assertThatThrownBy(() -> authService.login("alice@example.com", "anything"))
                .isInstanceOf(ApiException.class)
                .extracting(e -> ((ApiException) e).getKind())
                .isEqualTo(ErrorKind.AUTHENTICATION);
    }

    @Test
    void testLoginLookupFailureIsDatabaseError() {
        when(userRepository.findByEmail("alice@example.com"))
                .thenThrow(new DataAccessResourceFailureException("timeout"));

        assertThatThrownBy(() -> authService.login("alice@example.com", "correct-horse"))
                .isInstanceOf(ApiException.class)
                .extracting(e -> ((ApiException) e).getKind())
                .isEqualTo(ErrorKind.DATABASE);
    }

    private User storedUser(String email, String password, boolean active) {
        User user = new User(email, email.substring(0, email.indexOf('@')), passwordHasher.hash(password));
        user.setId("id-" + email);
        user.setActive(active);
        return user;
    }

    private static RegisterRequest registerRequest(String email, String password) {
        RegisterRequest request = new RegisterRequest();
        request.setEmail(email);
        request.setUserName("alice");
        request.setPhoneNumber("5551234567");
        request.setCountryCode("+1");
        request.setPassword(password);
        request.setDisplayName("Alice");
        return request;
    }

    private static ApiException catchApiException(Runnable action) {
        try {
            action.run();
        } catch (ApiException e) {
            return e;
        }
        throw new AssertionError("Expected ApiException");
    }
}
