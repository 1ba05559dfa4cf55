/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.config;

import org.eclipse.microprofile.openapi.annotations.OpenAPIDefinition;
import org.eclipse.microprofile.openapi.annotations.info.Contact;
import org.eclipse.microprofile.openapi.annotations.info.Info;
import org.eclipse.microprofile.openapi.annotations.info.License;
import org.eclipse.microprofile.openapi.annotations.servers.Server;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import jakarta.ws.rs.core.Application;

/**
 * OpenAPI 3.0 configuration for the Weather Summary API.
 *
 * <p>
 * Defines API metadata and the endpoint groupings used by {@code @Tag} on the resources.
 *
 * @see <a href="https://github.com/eclipse/microprofile-open-api">MicroProfile OpenAPI Spec</a>
 */
@OpenAPIDefinition(
        info = @Info(
                title = "Weather Summary API",
                version = "1.0.0",
                description = """
                        Weather summaries for a user's favorite locations.

                        ## Features
                        - **Summary**: favorites whose forecast maximum for tomorrow exceeds a threshold
                        - **Location details**: location metadata and a multi-day forecast

                        ## Rate Limiting
                        Requests are limited per client (hourly and burst) and by a global daily upstream budget.
                        429 responses include a `Retry-After` header with the cooldown in seconds.
                        """,
                contact = @Contact(
                        name = "Village Compute",
                        url = "https://villagecompute.com"),
                license = @License(
                        name = "Proprietary")),
        servers = {@Server(
                url = "http://localhost:8080",
                description = "Local Development")},
        tags = {@Tag(
                name = "Weather",
                description = "Weather summaries for favorite locations"),
                @Tag(
                        name = "Health",
                        description = "Health check operations")})
public class OpenApiConfig extends Application {
}
