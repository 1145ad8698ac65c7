package com.secops.riskengine.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI riskEngineOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Behavior Risk Engine API")
                        .version("1.0.0")
                        .description(
                                "Batch behavior-based security monitoring for platform users.\n\n" +
                                "**Monitoring Run:**\n" +
                                "1. Submit users, login history and event log rows via `POST /monitoring/runs`\n" +
                                "2. Login history is analyzed for anomalies (unusual hours, rapid location change, weekend activity)\n" +
                                "3. Event rows are evaluated against the threshold rules and custom detectors\n" +
                                "4. Each user gets a risk score and level (**none**, **low**, **medium**, **high**, **critical**)\n" +
                                "5. Warnings are correlated with login behavior to rank high-risk users\n\n" +
                                "**Severity points:** critical 40 (rapid location change 50), high 25, medium 15, low 5\n\n" +
                                "The active rule catalog is available under `/rules`.")
                        .contact(new Contact().name("Security Operations Team")));
    }
}
