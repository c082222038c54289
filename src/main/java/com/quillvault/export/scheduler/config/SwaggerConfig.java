package com.quillvault.export.scheduler.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** OpenAPI description served by springdoc. */
@Configuration
public class SwaggerConfig {

  private final String applicationName;
  private final String serverPort;

  public SwaggerConfig(AppProperties appProps) {
    AppProperties.Swagger swagger = appProps.swagger();
    this.applicationName =
        swagger != null && swagger.applicationName() != null
            ? swagger.applicationName()
            : "export-scheduler";
    this.serverPort =
        swagger != null && swagger.serverPort() != null ? swagger.serverPort() : "3001";
  }

  @Bean
  public OpenAPI customOpenAPI() {
    return new OpenAPI()
        .info(apiInfo())
        .servers(
            List.of(
                new Server()
                    .url("http://localhost:" + serverPort)
                    .description("Local Development Server")))
        .tags(
            List.of(
                new Tag().name("Auth").description("API key registration and verification"),
                new Tag().name("Schedules").description("Scheduled journal exports"),
                new Tag().name("Health").description("Service liveness")))
        .components(
            new Components()
                .addSecuritySchemes(
                    "api-key",
                    new SecurityScheme()
                        .type(SecurityScheme.Type.APIKEY)
                        .in(SecurityScheme.In.HEADER)
                        .name("X-API-Key")
                        .description("Key returned by POST /api/auth/register")));
  }

  private Info apiInfo() {
    return new Info()
        .title(applicationName + " API")
        .description(
            """
                ## Overview
                Schedules delayed, encrypted exports of journal entries. When a schedule's delay
                elapses its entries are decrypted, rendered into a PDF and delivered to every
                recipient by email or SMS.

                ### Schedule lifecycle:
                1. **scheduled**: waiting for its execution time
                2. **running**: claimed by a worker, edits are refused
                3. **executed**: the attempt finished; see the execution logs for the outcome
                4. **deleting**: deletion requested while running

                A reset re-arms an executed schedule for now plus its original delay.
                """)
        .version("v1.0.0");
  }
}
