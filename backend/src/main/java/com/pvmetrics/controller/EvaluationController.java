package com.pvmetrics.controller;

import com.pvmetrics.dto.EvaluationRequest;
import com.pvmetrics.model.EvaluationOptions;
import com.pvmetrics.model.EvaluationResult;
import com.pvmetrics.service.EvaluationService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class EvaluationController {

    private final EvaluationService evaluationService;

    @PostMapping("/evaluations")
    public ResponseEntity<EvaluationResult> evaluate(
            @Valid @RequestBody EvaluationRequest request, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /evaluations | model={} | rows={} | horizons={} | requestId={}",
                 request.getModelName(), request.getRows().size(), request.getHorizons(), requestId);
        EvaluationOptions options = request.getOptions() != null
            ? request.getOptions().applyTo(evaluationService.getDefaultOptions())
            : evaluationService.getDefaultOptions();
        EvaluationResult result = evaluationService.evaluate(request.toTable(), request.getModelName(), options);
        return ResponseEntity.ok()
            .header("X-Request-ID", requestId)
            .body(result);
    }

    @GetMapping("/evaluations/defaults")
    public ResponseEntity<EvaluationOptions> defaults() {
        return ResponseEntity.ok(evaluationService.getDefaultOptions());
    }

    private String resolveRequestId(HttpServletRequest request) {
        String id = request.getHeader("X-Request-ID");
        return (id != null && !id.isBlank()) ? id : UUID.randomUUID().toString();
    }
}
