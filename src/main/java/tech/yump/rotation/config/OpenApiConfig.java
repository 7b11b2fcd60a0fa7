package tech.yump.rotation.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.yump.rotation.auth.StaticTokenAuthFilter;

@Configuration
public class OpenApiConfig {

    private static final String API_KEY_HEADER_NAME = StaticTokenAuthFilter.VAULT_TOKEN_HEADER;
    private static final String SECURITY_SCHEME_NAME = "StaticTokenAuth";

    @Bean
    public OpenAPI customOpenAPI() {
        SecurityScheme apiKeyScheme = new SecurityScheme()
                .name(API_KEY_HEADER_NAME)
                .type(SecurityScheme.Type.APIKEY)
                .in(SecurityScheme.In.HEADER)
                .description("Static API token ('" + API_KEY_HEADER_NAME + "') mapped to a principal and its roles (OPERATOR, APPROVER, AUDITOR).");

        return new OpenAPI()
                .info(new Info()
                        .title("Rotation Engine API")
                        .description("Scheduled and on-demand rotation of secrets and credentials with approval, validation and rollback.")
                        .version("v1"))
                .components(new Components().addSecuritySchemes(SECURITY_SCHEME_NAME, apiKeyScheme))
                .addSecurityItem(new SecurityRequirement().addList(SECURITY_SCHEME_NAME));
    }
}
