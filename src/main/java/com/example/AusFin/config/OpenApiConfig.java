package com.example.AusFin.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
        info = @Info(
                title = "AusFin API",
                version = "v1",
                description = "Australian personal-finance advice, calculators and offline evaluation"
        )
)
public class OpenApiConfig {
}
