package com.powerguard.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI powerGuardOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("PowerGuard Anomaly Engine API")
                        .version("1.0.0")
                        .description(
                                "Unsupervised detection of electricity-theft-like consumption patterns in smart-meter data.\n\n" +
                                "**Detection Run:**\n" +
                                "1. Trigger via `POST /api/v1/anomaly/detect`\n" +
                                "2. Extract a 5-feature vector per meter (hourly avg, daily variance, night/peak/weekend share)\n" +
                                "3. Fit the selected detector on the batch and score every meter\n" +
                                "4. Min-max normalize scores within the batch to [0,1]\n" +
                                "5. Classify: **low** (<0.25), **medium** (<0.5), **high** (<0.75), **critical** (>=0.75); " +
                                "flag suspicious at the run threshold (default 0.5)\n" +
                                "6. Explain the top deviating features and persist one result per meter\n\n" +
                                "**Models:**\n" +
                                "- `isolation_forest`: random isolation trees, short paths = anomalous\n" +
                                "- `autoencoder`: dense reconstruction network, high reconstruction error = anomalous\n\n" +
                                "Meters with fewer than 24 readings are skipped.")
                        .contact(new Contact().name("PowerGuard Analytics Team")));
    }
}
