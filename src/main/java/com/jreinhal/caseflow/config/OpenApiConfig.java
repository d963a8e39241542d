package com.jreinhal.caseflow.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Interactive API documentation at /swagger-ui.html.
 */
@Configuration
public class OpenApiConfig {

    @Value("${app.auth-mode:DEV}")
    private String authMode;

    @Bean
    public OpenAPI caseflowOpenAPI() {
        return new OpenAPI()
                .info(apiInfo())
                .components(securityComponents())
                .security(List.of(
                        new SecurityRequirement().addList("gatewayUser").addList("gatewayFirm")
                ))
                .servers(List.of(
                        new Server().url("/").description("Current Server")
                ))
                .tags(List.of(
                        new Tag().name("Pipeline").description("Stage transitions, case closure, kanban and statistics"),
                        new Tag().name("Notes").description("Creator-owned case notes")
                ));
    }

    private Info apiInfo() {
        return new Info()
                .title("Caseflow Case Pipeline API")
                .description("""
                        Moves legal cases through category-specific stages, closes them with an
                        outcome and reports on the firm's pipeline.

                        Identity is asserted by the gateway through `X-User-Id` and `X-Firm-Id`.

                        ## Current Mode: `%s`
                        """.formatted(authMode))
                .version("1.0.0");
    }

    private Components securityComponents() {
        return new Components()
                .addSecuritySchemes("gatewayUser",
                        new SecurityScheme()
                                .type(SecurityScheme.Type.APIKEY)
                                .in(SecurityScheme.In.HEADER)
                                .name("X-User-Id")
                                .description("Verified user id (ObjectId) set by the gateway"))
                .addSecuritySchemes("gatewayFirm",
                        new SecurityScheme()
                                .type(SecurityScheme.Type.APIKEY)
                                .in(SecurityScheme.In.HEADER)
                                .name("X-Firm-Id")
                                .description("Firm id of the caller; absent for solo lawyers"));
    }
}
