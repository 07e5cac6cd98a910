package com.tenantclient.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenantclient.cli.ui.Spinner;
import com.tenantclient.dto.response.LoginResponse;
import com.tenantclient.model.ApiResult;
import com.tenantclient.model.ClassifiedError;
import com.tenantclient.model.ErrorKind;
import com.tenantclient.model.TenantContext;
import com.tenantclient.service.api.SessionService;
import com.tenantclient.service.api.TenantResolver;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AuthCommandTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private SessionService sessionService;
    @Mock
    private TenantResolver tenantResolver;
    @Mock
    private Spinner spinner;

    private AuthCommand authCommand;

    @BeforeEach
    void setUp() {
        authCommand = new AuthCommand(sessionService, tenantResolver, spinner);
    }

    private void spinnerBlocks() {
        when(spinner.await(any())).thenAnswer(invocation -> ((Mono<?>) invocation.getArgument(0)).block());
    }

    @Test
    void login_reportsSuccess() {
        spinnerBlocks();
        when(sessionService.login("ada@example.com", "s3cret"))
                .thenReturn(Mono.just(ApiResult.success(new LoginResponse("a-1", "r-1", null))));

        String output = authCommand.login("ada@example.com", "s3cret");

        assertThat(output).contains("Logged in as 'ada@example.com'");
    }

    @Test
    void login_reportsClassifiedFailure() {
        spinnerBlocks();
        when(sessionService.login("ada@example.com", "wrong"))
                .thenReturn(Mono.just(ApiResult.failure(
                        new ClassifiedError(ErrorKind.UNCLASSIFIED, 401, null, "No active account found", null, null))));

        String output = authCommand.login("ada@example.com", "wrong");

        assertThat(output).contains("[UNCLASSIFIED 401] No active account found");
    }

    @Test
    void logout_endsSession() {
        spinnerBlocks();
        when(sessionService.logout()).thenReturn(Mono.empty());

        assertThat(authCommand.logout()).contains("Logged out");
        verify(sessionService).logout();
    }

    @Test
    void session_showsStatusAndTenant() {
        when(sessionService.isAuthenticated()).thenReturn(true);
        when(tenantResolver.resolve()).thenReturn(Optional.of(TenantContext.of("acme")));

        assertThat(authCommand.session()).contains("Logged in (tenant 'acme')");
    }

    @Test
    void session_whenLoggedOut() {
        when(sessionService.isAuthenticated()).thenReturn(false);
        when(tenantResolver.resolve()).thenReturn(Optional.empty());

        assertThat(authCommand.session()).contains("Not logged in (no active tenant)");
    }

    @Test
    void whoami_printsProfile() {
        spinnerBlocks();
        when(sessionService.getCurrentUser()).thenReturn(Mono.just(ApiResult.<JsonNode>success(
                objectMapper.createObjectNode().put("email", "ada@example.com"))));

        assertThat(authCommand.whoami()).contains("\"email\" : \"ada@example.com\"");
    }

    @Test
    void whoami_reportsExpiredSession() {
        spinnerBlocks();
        when(sessionService.getCurrentUser()).thenReturn(Mono.just(ApiResult.failure(
                new ClassifiedError(ErrorKind.SESSION_EXPIRED, 401, null, "Your session has expired. Please log in again.", null, null))));

        assertThat(authCommand.whoami()).contains("[SESSION_EXPIRED 401]");
    }

    @Test
    void profileUpdate_sendsParsedFields() {
        spinnerBlocks();
        when(sessionService.updateProfile(Map.of("phone", "+49 30 1234", "address", "Unter den Linden 1")))
                .thenReturn(Mono.just(ApiResult.<JsonNode>success(objectMapper.createObjectNode().put("phone", "+49 30 1234"))));

        String output = authCommand.profileUpdate(new String[] {"phone=+49 30 1234", "address = Unter den Linden 1"});

        assertThat(output).contains("+49 30 1234");
    }

    @Test
    void profileUpdate_rejectsMalformedField() {
        assertThat(authCommand.profileUpdate(new String[] {"phone"})).contains("Malformed field 'phone', expected name=value");
        verifyNoInteractions(sessionService);
    }
}
