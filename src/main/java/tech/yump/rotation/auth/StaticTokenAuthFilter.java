package tech.yump.rotation.auth;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;
import tech.yump.rotation.audit.AuditActions;
import tech.yump.rotation.audit.AuditBackend;
import tech.yump.rotation.audit.AuditRecord;
import tech.yump.rotation.config.RotationProperties;

import java.io.IOException;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Authenticates requests carrying an {@code X-Vault-Token} header against the configured static
 * token mappings. The principal is the mapping's principal name, the authorities its roles.
 * Every request gets a {@code requestId} in the MDC.
 */
@Slf4j
public class StaticTokenAuthFilter extends OncePerRequestFilter {

  public static final String VAULT_TOKEN_HEADER = "X-Vault-Token";
  public static final String REQUEST_ID_ATTR = "auditRequestId";
  public static final String MDC_REQUEST_ID_KEY = "requestId";

  private final boolean staticAuthEnabled;
  private final List<RotationProperties.AuthProperties.StaticTokenMapping> tokenMappings;
  private final List<String> publicPaths = List.of("/", "/actuator/health");
  private final AuditBackend auditBackend;

  public StaticTokenAuthFilter(
          RotationProperties.AuthProperties.StaticTokenAuthProperties staticTokenProps,
          AuditBackend auditBackend
  ) {
    this.staticAuthEnabled = Optional.ofNullable(staticTokenProps)
            .map(RotationProperties.AuthProperties.StaticTokenAuthProperties::enabled)
            .orElse(false);
    this.tokenMappings = Optional.ofNullable(staticTokenProps)
            .map(RotationProperties.AuthProperties.StaticTokenAuthProperties::mappings)
            .orElse(Collections.emptyList());
    this.auditBackend = auditBackend;

    log.debug("StaticTokenAuthFilter initialized. Enabled: {}, Mappings count: {}",
            this.staticAuthEnabled, this.tokenMappings.size());
    if (this.staticAuthEnabled && this.tokenMappings.isEmpty()) {
      log.warn("Static token authentication is enabled but no token mappings are configured!");
    }
  }

  @Override
  protected void doFilterInternal(
          @NonNull HttpServletRequest request,
          @NonNull HttpServletResponse response,
          @NonNull FilterChain filterChain) throws ServletException, IOException {

    String requestId = UUID.randomUUID().toString();
    request.setAttribute(REQUEST_ID_ATTR, requestId);
    MDC.put(MDC_REQUEST_ID_KEY, requestId);

    try {
      if (!staticAuthEnabled) {
        log.trace("Static token authentication is disabled via configuration. Skipping authentication.");
        filterChain.doFilter(request, response);
        return;
      }

      final String tokenHeader = request.getHeader(VAULT_TOKEN_HEADER);
      if (!StringUtils.hasText(tokenHeader) || SecurityContextHolder.getContext().getAuthentication() != null) {
        log.trace("No {} header found or authentication already present for {}. Proceeding.",
                VAULT_TOKEN_HEADER, request.getRequestURI());
        filterChain.doFilter(request, response);
        return;
      }

      final String providedToken = tokenHeader.trim();
      Optional<RotationProperties.AuthProperties.StaticTokenMapping> mapping = tokenMappings.stream()
              .filter(m -> providedToken.equals(m.token()))
              .findFirst();

      if (mapping.isPresent()) {
        List<GrantedAuthority> authorities = mapping.get().roles().stream()
                .map(role -> (GrantedAuthority) new SimpleGrantedAuthority(role.authority()))
                .toList();
        UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                mapping.get().principal(), null, authorities);
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);
        log.debug("Authenticated '{}' for URI: {}. Authorities: {}",
                mapping.get().principal(), request.getRequestURI(), authorities);

        logAuthRecord(AuditRecord.RESULT_SUCCESS, mapping.get().principal(), request,
                Map.of("roles", mapping.get().roles().stream().map(Enum::name).sorted().toList()));
      } else {
        log.warn("Invalid or unknown static token received for URI: {}", request.getRequestURI());
        logAuthRecord(AuditRecord.RESULT_FAILURE, null, request, Map.of("reason", "invalid_token"));
        // Unauthenticated requests are rejected later by the authorization rules
      }

      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_REQUEST_ID_KEY);
    }
  }

  private void logAuthRecord(String result, String principal, HttpServletRequest request, Map<String, Object> details) {
    try {
      Map<String, Object> data = new HashMap<>(details);
      data.put("request_id", request.getAttribute(REQUEST_ID_ATTR));
      data.put("method", request.getMethod());
      data.put("path", request.getRequestURI());
      data.put("source_address", request.getRemoteAddr());
      auditBackend.logRecord(AuditRecord.builder()
              .timestamp(Instant.now())
              .action(AuditActions.AUTH_TOKEN_VALIDATION)
              .actor(principal)
              .result(result)
              .data(data)
              .build());
    } catch (RuntimeException e) {
      log.error("Failed to log audit record in StaticTokenAuthFilter: {}", e.getMessage(), e);
    }
  }

  @Override
  protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
    // Disabled auth still passes through so the request id reaches the MDC
    return staticAuthEnabled && publicPaths.contains(request.getRequestURI());
  }
}
