package com.gsm.fraud.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI fraudScoringOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("GSM Fraud Scoring API")
                        .version("1.0.0")
                        .description(
                                "Batch fraud scoring for GSM subscriber registrations.\n\n" +
                                "**Scoring Pipeline:**\n" +
                                "1. Upload a CSV via `POST /scoring/upload` (or pre-parsed rows via `POST /scoring/batches`)\n" +
                                "2. Validate the column set (`subscriber_id`, `IMEI`, `registration_date`, `location`, " +
                                "`initial_call_count`, `average_call_duration`, `device_switch_count`)\n" +
                                "3. Build a feature vector per row: standardized numerics + one-hot location\n" +
                                "4. Score with the feed-forward classifier (128-64-32 ReLU, sigmoid output)\n" +
                                "5. Classify: **Fraud** if probability > 0.5, otherwise **Legitimate**\n" +
                                "6. Persist summary and predictions; retrieve later via `GET /results/{resultId}`\n\n" +
                                "Missing or malformed numeric cells are imputed with the fit-time mean; " +
                                "unknown locations encode as an all-zero block. Neither rejects the row.")
                        .contact(new Contact().name("Fraud Analytics Team")));
    }
}
