package com.goormthonuniv.videocheck;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * 전체 컨텍스트 기동 테스트 (API 키 없이)
 */
@SpringBootTest
@AutoConfigureMockMvc
class VideoCheckApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    @DisplayName("API 키가 없으면 health 는 503, gemini=false")
    void healthWithoutApiKey() throws Exception {
        mockMvc.perform(get("/api/v1/video-analysis/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.healthy").value(false))
                .andExpect(jsonPath("$.services.gemini").value(false))
                .andExpect(jsonPath("$.errors[0]").value("Gemini API key not configured"));
    }

    @Test
    @DisplayName("OpenAPI 문서 노출")
    void openApiDocs() throws Exception {
        mockMvc.perform(get("/v3/api-docs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.info.title").value("VideoCheck Analysis API"))
                .andExpect(jsonPath("$.info.contact.name").value("VideoCheck Team"))
                .andExpect(jsonPath("$.info.contact.email").doesNotExist());
    }

    @Test
    @DisplayName("CORS preflight 허용")
    void corsPreflight() throws Exception {
        mockMvc.perform(options("/api/v1/video-analysis/health")
                        .header("Origin", "https://example.com")
                        .header("Access-Control-Request-Method", "GET"))
                .andExpect(status().isOk())
                .andExpect(header().string("Access-Control-Allow-Origin", "*"));
    }
}
