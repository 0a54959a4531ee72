package com.memory.validation.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI memoryValidationOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Memory Validation API")
                        .version("1.0.0")
                        .description(
                                "Validation and decision engine for emotionally-scored memory records.\n\n" +
                                "**Evaluation Pipeline:**\n" +
                                "1. Receive a record via `POST /api/v1/validation/evaluate` or a batch via `POST /api/v1/validation/batch`\n" +
                                "2. Combine the four confidence signals into one weighted confidence (0-1)\n" +
                                "3. Score emotional significance (0-10) and narrow the automated bands for significant memories\n" +
                                "4. Decide: **AUTO_APPROVE** (> autoApprove), **REVIEW_REQUIRED**, **AUTO_REJECT** (<= autoReject)\n" +
                                "5. Queue review-required and urgent records for humans by priority\n\n" +
                                "**Feedback loop:** reviewers post verdicts to `POST /api/v1/feedback`; quality metrics are " +
                                "refreshed on a schedule and calibration adjusts thresholds in bounded steps.")
                        .contact(new Contact().name("Memory Validation Team")));
    }
}
