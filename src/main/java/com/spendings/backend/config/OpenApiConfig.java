package com.spendings.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI spendingsOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("508 Spendings API")
                        .description("Transactions, recurring payments and read-only shared dashboards. "
                                + "Data is bucketed by an anonymous client_id; there is no login.")
                        .version("v1")
                        .license(new License().name("Private"))
                );
    }
}
