package com.di.pitnova.controller;

import com.di.pitnova.agent.degradation.DegradationModelService;
import com.di.pitnova.agent.validation.ValidationHarness;
import com.di.pitnova.agent.validation.ValidationReport;
import com.di.pitnova.agent.validation.ValidationResultsRepository;
import com.di.pitnova.controller.dto.ValidationRunRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Historical validation: replay the optimizer at real pit stops and read back saved results.
 */
@RestController
@RequestMapping("/api/validation")
@RequiredArgsConstructor
public class ValidationController {

    private final ValidationHarness validationHarness;
    private final ValidationResultsRepository resultsRepository;
    private final DegradationModelService degradationModelService;

    @PostMapping(value = "/run", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ValidationReport> run(@Valid @RequestBody ValidationRunRequest request) {
        ValidationReport report = validationHarness.runValidation(request.getRaces(), degradationModelService);
        if (request.isSave()) {
            resultsRepository.save(report);
        }
        return ResponseEntity.ok(report);
    }

    @GetMapping(value = "/results", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ValidationReport> results() {
        return ResponseEntity.ok(resultsRepository.load());
    }
}
