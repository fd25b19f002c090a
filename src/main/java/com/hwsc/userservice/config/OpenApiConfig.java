package com.hwsc.userservice.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI userServiceOpenAPI(@Value("${spring.application.name:user-service}") String appName) {
        return new OpenAPI()
                .info(new Info().title("HWSC User Service API")
                        .version("0.0.1")
                        .description("Accounts, email verification, auth tokens and signing secrets (" + appName + ")")
                        .contact(new Contact().name("hwsc-org")
                                .url("https://github.com/hwsc-org"))
                        .license(new License().name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0")));
    }
}
