package tech.yump.rotation.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import tech.yump.rotation.audit.AuditBackend;
import tech.yump.rotation.auth.EngineRole;
import tech.yump.rotation.auth.StaticTokenAuthFilter;

import java.util.Collections;

@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
@Slf4j
public class SecurityConfig {

  private final RotationProperties rotationProperties;
  private final AuditBackend auditBackend;

  @Bean
  public StaticTokenAuthFilter staticTokenAuthFilter() {
    RotationProperties.AuthProperties.StaticTokenAuthProperties staticTokenProps = rotationProperties.auth().staticTokens();

    RotationProperties.AuthProperties.StaticTokenAuthProperties effectiveProps;
    if (staticTokenProps != null && staticTokenProps.enabled()) {
      log.debug("Static token authentication enabled. Creating StaticTokenAuthFilter with configured properties.");
      effectiveProps = staticTokenProps;
    } else {
      log.debug("Static token authentication disabled. Creating pass-through StaticTokenAuthFilter.");
      effectiveProps = new RotationProperties.AuthProperties.StaticTokenAuthProperties(false, Collections.emptyList());
    }
    return new StaticTokenAuthFilter(effectiveProps, auditBackend);
  }

  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
    http
            .csrf(AbstractHttpConfigurer::disable)
            .formLogin(AbstractHttpConfigurer::disable)
            .httpBasic(AbstractHttpConfigurer::disable)
            .logout(AbstractHttpConfigurer::disable)
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .addFilterBefore(staticTokenAuthFilter(), UsernamePasswordAuthenticationFilter.class);

    if (isStaticAuthEnabled()) {
      log.info("Configuring Spring Security for static token authentication with role-based authorization.");
      String operator = EngineRole.OPERATOR.name();
      String approver = EngineRole.APPROVER.name();
      String auditor = EngineRole.AUDITOR.name();
      http
              .exceptionHandling(ex -> ex.authenticationEntryPoint(new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED)))
              .authorizeHttpRequests(authz -> authz
                      .requestMatchers("/", "/actuator/health", "/actuator/health/**").permitAll()
                      .requestMatchers("/v3/api-docs/**", "/swagger-ui/**", "/swagger-ui.html").permitAll()
                      .requestMatchers(HttpMethod.POST, "/v1/rotation/**").hasRole(operator)
                      .requestMatchers(HttpMethod.PUT, "/v1/policies/**").hasRole(operator)
                      .requestMatchers("/v1/approvals/**").hasRole(approver)
                      .requestMatchers("/v1/audit/**").hasRole(auditor)
                      .requestMatchers(HttpMethod.GET, "/v1/**").hasAnyRole(operator, approver, auditor)
                      .anyRequest().authenticated()
              );
    } else {
      log.warn("Static token authentication is disabled via configuration (rotation.auth.static-tokens.enabled=false). All API endpoints are accessible without authentication. THIS IS INSECURE FOR PRODUCTION.");
      http.authorizeHttpRequests(authz -> authz.anyRequest().permitAll());
    }

    return http.build();
  }

  private boolean isStaticAuthEnabled() {
    RotationProperties.AuthProperties.StaticTokenAuthProperties staticTokens = rotationProperties.auth().staticTokens();
    return staticTokens != null && staticTokens.enabled();
  }
}
