package com.medwatch.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI medWatchOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("MedWatch Anomaly Engine API")
                        .version("1.0.0")
                        .description(
                                "Anomaly detection for medicine stock, price and demand data.\n\n" +
                                "**Detection Pipeline:**\n" +
                                "1. Submit data points via `POST /api/v1/detector/data-points` or load them from the store\n" +
                                "2. Validate and derive features (ratios, trends, seasonal and location context)\n" +
                                "3. Evaluate all enabled detection rules\n" +
                                "4. Score with the heuristic ensemble (time-series, isolation, price, demand)\n" +
                                "5. Record anomalies and alert on those with confidence >= 0.7\n\n" +
                                "**Alert Policy:**\n" +
                                "- `critical`: email, SMS and Slack immediately, escalated after 15 minutes\n" +
                                "- `high`: email and Slack immediately, escalated after 30 minutes\n" +
                                "- `medium`: email, batched every 15 minutes\n" +
                                "- `low`: email, batched every 60 minutes")
                        .contact(new Contact().name("MedWatch Team")));
    }
}
