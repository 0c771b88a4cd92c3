package com.goormthonuniv.videocheck.dto;

import java.util.List;
import java.util.Map;

public record ServiceHealthResponse(
        boolean healthy,
        Map<String, Boolean> services,   // gemini / aiDetection / manipulation / authenticity
        List<String> errors
) {}
