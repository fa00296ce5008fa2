package com.bloomcart.scoring.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springdoc.core.customizers.OpenApiCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {
    @Bean
    public OpenAPI customOpenAPI() {
        SecurityScheme adminKeyScheme = new SecurityScheme()
                .type(SecurityScheme.Type.APIKEY)
                .in(SecurityScheme.In.HEADER)
                .name("x-admin-key");

        return new OpenAPI()
                .info(new Info()
                        .title("BloomCart Scoring API")
                        .version("0.1.0")
                        .description("Product sustainability scoring, percentile ranking and reward accounts."))
                .components(new Components().addSecuritySchemes("adminKey", adminKeyScheme));
    }

    @Bean
    public OpenApiCustomizer adminSecurityCustomizer() {
        return openAPI -> {
            if (openAPI.getPaths() == null) return;
            SecurityRequirement adminRequirement = new SecurityRequirement().addList("adminKey");
            openAPI.getPaths().forEach((path, item) -> {
                // Only cache-bust is admin protected
                if (path.startsWith("/api/products/") && path.endsWith("/score")) {
                    Operation delete = item.getDelete();
                    if (delete != null) delete.addSecurityItem(adminRequirement);
                }
            });
        };
    }
}
