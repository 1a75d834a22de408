package com.pipelineops.compensation.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI triggerCompensationOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Pipeline Trigger Compensation API")
                        .description("Status of the startup job that re-fires pipeline cron triggers missed while the scheduler was down.")
                        .version("1.0.0")
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")));
    }
}
