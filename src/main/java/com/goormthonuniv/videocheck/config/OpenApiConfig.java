package com.goormthonuniv.videocheck.config;

import io.swagger.v3.oas.models.ExternalDocumentation;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.*;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Value("${videocheck.api.version:v0.1.0}")
    private String version;

    @Value("${videocheck.api.contact-name:VideoCheck Team}")
    private String contactName;

    // 비어 있으면 문서에 노출하지 않음
    @Value("${videocheck.api.contact-email:}")
    private String contactEmail;

    @Bean
    public OpenAPI openAPI() {
        Contact contact = new Contact().name(contactName);
        if (!contactEmail.isBlank()) {
            contact.email(contactEmail);
        }
        return new OpenAPI()
                .info(new Info()
                        .title("VideoCheck Analysis API")
                        .description("영상 AI 생성/조작/진위 분석 및 종합 신뢰도 API")
                        .version(version)
                        .contact(contact))
                .externalDocs(new ExternalDocumentation().description("Swagger UI").url("/swagger-ui.html"));
    }
}
