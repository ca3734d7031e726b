package com.company.incidentrisk;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.enums.SecuritySchemeType;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.security.SecurityScheme;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableCaching
@EnableScheduling
@EnableAsync
@OpenAPIDefinition(
        info = @Info(
                title = "Incident Risk Service API",
                version = "1.0.0",
                description = "Telemetry feature pipeline, incident risk scoring and preventive alerting"
        )
)
@SecurityScheme(
        name = "bearer-jwt",
        type = SecuritySchemeType.HTTP,
        scheme = "bearer",
        bearerFormat = "JWT"
)
public class IncidentRiskServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(IncidentRiskServiceApplication.class, args);
    }
}
