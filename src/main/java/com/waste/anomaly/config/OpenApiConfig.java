package com.waste.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI wasteAnomalyOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Waste Submission Anomaly API")
                        .version("1.0.0")
                        .description(
                                "Flags statistically unusual waste-quantity submissions and surfaces them to oversight.\n\n" +
                                "**Submission Pipeline:**\n" +
                                "1. Persist the submission via `POST /submissions` (the only step that can fail the request)\n" +
                                "2. Load the facility's trailing 30-day quantity window\n" +
                                "3. Classify via the detection endpoint (`POST /detect`) under a 5 second deadline\n" +
                                "4. Record an anomaly when |z| >= 2.5 over at least 5 samples\n\n" +
                                "Detection, window and record failures never change the submission response.\n\n" +
                                "**Oversight endpoints** (`/oversight/**`) require the `X-User-Role: OVERSIGHT` header.")
                        .contact(new Contact().name("Waste Compliance Team")));
    }
}
