package com.goormthonuniv.videocheck.controller;

import com.goormthonuniv.videocheck.config.AnalysisConfig;
import com.goormthonuniv.videocheck.dto.*;
import com.goormthonuniv.videocheck.exception.AllAnalyzersFailedException;
import com.goormthonuniv.videocheck.service.AnalysisOrchestrator;
import com.goormthonuniv.videocheck.service.AnalysisStatusService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.*;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.*;

@Slf4j
@RestController
@RequestMapping("/api/v1/video-analysis")
@RequiredArgsConstructor
public class VideoAnalysisController {

    static final Set<String> SUPPORTED_MIME_TYPES = Set.of(
            "video/mp4", "video/quicktime", "video/x-msvideo", "video/webm");

    private final AnalysisOrchestrator orchestrator;
    private final AnalysisStatusService statusService;
    private final AnalysisConfig config;

    @Operation(summary = "영상 신뢰도 분석", description = "영상 파일을 업로드하면 AI 생성/조작/진위 분석과 종합 신뢰 점수를 반환합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "분석 성공 (일부 분석기 실패 포함)"),
            @ApiResponse(responseCode = "400", description = "파일/분석 유형 오류"),
            @ApiResponse(responseCode = "413", description = "파일 크기 초과"),
            @ApiResponse(responseCode = "502", description = "모든 분석기 실패")
    })
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<VideoAnalysisResponse> analyze(
            @RequestParam("file") MultipartFile file,
            @RequestParam(required = false) List<String> analysisTypes,
            @RequestParam(required = false) Double durationSeconds,
            @RequestParam(required = false) Long timeoutMs,
            @RequestParam(required = false) Integer retryAttempts) throws IOException {

        // 1) 입력 검증
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("No video file provided");
        }
        String mimeType = file.getContentType();
        if (mimeType == null || !SUPPORTED_MIME_TYPES.contains(mimeType)) {
            throw new IllegalArgumentException("Unsupported file type: " + mimeType
                    + ". Supported types: " + String.join(", ", new TreeSet<>(SUPPORTED_MIME_TYPES)));
        }
        Set<AnalyzerKind> kinds = parseKinds(analysisTypes);
        AnalysisOptions options = new AnalysisOptions(
                timeoutMs != null ? timeoutMs : config.getTimeoutMs(),
                retryAttempts != null ? retryAttempts : config.getRetryAttempts());
        double duration = durationSeconds != null ? durationSeconds : config.getDefaultDurationSeconds();

        // 2) 분석
        String analysisId = "analysis_" + UUID.randomUUID();
        statusService.start(analysisId);
        long startedAt = System.currentTimeMillis();
        log.info("Analysis {} requested: file={}, size={}, types={}",
                analysisId, file.getOriginalFilename(), file.getSize(), kinds);

        VideoAnalysisResult results;
        try {
            results = orchestrator.runAnalysis(file.getBytes(), mimeType, duration, kinds, options,
                    progress -> statusService.update(analysisId, progress));
        } catch (AllAnalyzersFailedException e) {
            statusService.fail(analysisId, e.getMessage());
            throw e;
        }
        statusService.complete(analysisId);

        long processingTime = System.currentTimeMillis() - startedAt;
        return ResponseEntity.ok(new VideoAnalysisResponse(true, analysisId, results, processingTime));
    }

    @Operation(summary = "분석 진행 상태 조회")
    @GetMapping("/{analysisId}/status")
    public ResponseEntity<AnalysisStatusResponse> status(@PathVariable String analysisId) {
        return statusService.get(analysisId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @Operation(summary = "분석 취소", description = "진행 중 분석 취소는 아직 지원하지 않아 항상 cancelled=false 를 반환합니다.")
    @DeleteMapping("/{analysisId}")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String analysisId) {
        boolean cancelled = orchestrator.cancelAnalysis(analysisId);
        return ResponseEntity.ok(Map.of("analysisId", analysisId, "cancelled", cancelled));
    }

    @Operation(summary = "분석 서비스 상태")
    @GetMapping("/health")
    public ResponseEntity<ServiceHealthResponse> health() {
        ServiceHealthResponse health = orchestrator.checkHealth();
        return ResponseEntity.status(health.healthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(health);
    }

    @Operation(summary = "예상 분석 시간(초)")
    @GetMapping("/estimate")
    public ResponseEntity<AnalysisEstimateResponse> estimate(
            @RequestParam long sizeBytes,
            @RequestParam(required = false) Double durationSeconds,
            @RequestParam(required = false) List<String> analysisTypes) {
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("sizeBytes must not be negative: " + sizeBytes);
        }
        Set<AnalyzerKind> kinds = parseKinds(analysisTypes);
        double duration = durationSeconds != null ? durationSeconds : config.getDefaultDurationSeconds();
        long seconds = orchestrator.estimateAnalysisSeconds(sizeBytes, kinds, duration);
        List<String> names = kinds.stream().map(AnalyzerKind::wireName).toList();
        return ResponseEntity.ok(new AnalysisEstimateResponse(sizeBytes, duration, names, seconds));
    }

    // 비어 있으면 전체
    private static Set<AnalyzerKind> parseKinds(List<String> analysisTypes) {
        if (analysisTypes == null || analysisTypes.isEmpty()) {
            return EnumSet.allOf(AnalyzerKind.class);
        }
        Set<AnalyzerKind> kinds = EnumSet.noneOf(AnalyzerKind.class);
        for (String t : analysisTypes) {
            kinds.add(AnalyzerKind.fromWireName(t));
        }
        return kinds;
    }
}
