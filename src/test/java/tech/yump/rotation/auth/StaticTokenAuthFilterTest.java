package tech.yump.rotation.auth;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import tech.yump.rotation.audit.AuditActions;
import tech.yump.rotation.audit.AuditBackend;
import tech.yump.rotation.audit.AuditRecord;
import tech.yump.rotation.config.RotationProperties;

import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class StaticTokenAuthFilterTest {

    private static final String OPERATOR_TOKEN = "operator-token-123";
    private static final String APPROVER_TOKEN = "approver-token-456";

    @Mock
    private AuditBackend mockAuditBackend;
    @Mock
    private FilterChain mockFilterChain;

    @Captor
    private ArgumentCaptor<AuditRecord> recordCaptor;

    private MockHttpServletRequest mockRequest;
    private MockHttpServletResponse mockResponse;
    private StaticTokenAuthFilter filter;

    @BeforeEach
    void setUp() {
        SecurityContextHolder.clearContext();
        mockRequest = new MockHttpServletRequest("POST", "/v1/rotation/database/rotate");
        mockRequest.setRemoteAddr("10.0.0.5");
        mockResponse = new MockHttpServletResponse();
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    private StaticTokenAuthFilter createFilter(boolean enabled) {
        List<RotationProperties.AuthProperties.StaticTokenMapping> mappings = List.of(
                new RotationProperties.AuthProperties.StaticTokenMapping(OPERATOR_TOKEN, "op-alice",
                        Set.of(EngineRole.OPERATOR, EngineRole.AUDITOR)),
                new RotationProperties.AuthProperties.StaticTokenMapping(APPROVER_TOKEN, "approver-bob",
                        Set.of(EngineRole.APPROVER)));
        return new StaticTokenAuthFilter(
                new RotationProperties.AuthProperties.StaticTokenAuthProperties(enabled, enabled ? mappings : Collections.emptyList()),
                mockAuditBackend);
    }

    @Test
    @DisplayName("doFilterInternal: When auth disabled, should proceed without authentication but with a request id")
    void doFilterInternal_whenAuthDisabled_shouldSkipAndProceed() throws ServletException, IOException {
        filter = createFilter(false);

        filter.doFilterInternal(mockRequest, mockResponse, mockFilterChain);

        verify(mockFilterChain).doFilter(mockRequest, mockResponse);
        verifyNoInteractions(mockAuditBackend);
        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        assertThat(mockRequest.getAttribute(StaticTokenAuthFilter.REQUEST_ID_ATTR)).isNotNull();
    }

    @Test
    @DisplayName("doFilterInternal: When no token header, should proceed without authentication or audit")
    void doFilterInternal_whenNoTokenHeader_shouldProceedWithoutAuth() throws ServletException, IOException {
        filter = createFilter(true);

        filter.doFilterInternal(mockRequest, mockResponse, mockFilterChain);

        verify(mockFilterChain).doFilter(mockRequest, mockResponse);
        verifyNoInteractions(mockAuditBackend);
        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
    }

    @Test
    @DisplayName("doFilterInternal: When token is unknown, should audit the failure and proceed unauthenticated")
    void doFilterInternal_whenInvalidToken_shouldLogFailureAndProceed() throws ServletException, IOException {
        filter = createFilter(true);
        mockRequest.addHeader(StaticTokenAuthFilter.VAULT_TOKEN_HEADER, "not-a-token");

        filter.doFilterInternal(mockRequest, mockResponse, mockFilterChain);

        verify(mockFilterChain).doFilter(mockRequest, mockResponse);
        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();

        verify(mockAuditBackend).logRecord(recordCaptor.capture());
        AuditRecord record = recordCaptor.getValue();
        assertThat(record.action()).isEqualTo(AuditActions.AUTH_TOKEN_VALIDATION);
        assertThat(record.result()).isEqualTo(AuditRecord.RESULT_FAILURE);
        assertThat(record.actor()).isNull();
        assertThat(record.data())
                .containsEntry("reason", "invalid_token")
                .containsEntry("method", "POST")
                .containsEntry("path", "/v1/rotation/database/rotate")
                .containsEntry("source_address", "10.0.0.5");
    }

    @Test
    @DisplayName("doFilterInternal: When token is valid, should authenticate the mapped principal with role authorities")
    void doFilterInternal_whenValidToken_shouldAuthenticate() throws ServletException, IOException {
        filter = createFilter(true);
        mockRequest.addHeader(StaticTokenAuthFilter.VAULT_TOKEN_HEADER, " " + OPERATOR_TOKEN + " ");

        filter.doFilterInternal(mockRequest, mockResponse, mockFilterChain);

        verify(mockFilterChain).doFilter(mockRequest, mockResponse);
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        assertThat(auth).isNotNull();
        assertThat(auth.isAuthenticated()).isTrue();
        assertThat(auth.getName()).isEqualTo("op-alice");
        assertThat(auth.getCredentials()).isNull();
        assertThat(auth.getAuthorities())
                .extracting(GrantedAuthority::getAuthority)
                .containsExactlyInAnyOrder("ROLE_OPERATOR", "ROLE_AUDITOR");

        verify(mockAuditBackend).logRecord(recordCaptor.capture());
        AuditRecord record = recordCaptor.getValue();
        assertThat(record.result()).isEqualTo(AuditRecord.RESULT_SUCCESS);
        assertThat(record.actor()).isEqualTo("op-alice");
        assertThat(record.data()).containsEntry("roles", List.of("AUDITOR", "OPERATOR"));
    }

    @Test
    @DisplayName("shouldNotFilter: public paths bypass the filter only when auth is enabled")
    void shouldNotFilter_publicPaths() {
        MockHttpServletRequest health = new MockHttpServletRequest("GET", "/actuator/health");

        assertThat(createFilter(true).shouldNotFilter(health)).isTrue();
        assertThat(createFilter(true).shouldNotFilter(mockRequest)).isFalse();
        assertThat(createFilter(false).shouldNotFilter(health)).isFalse();
    }
}
