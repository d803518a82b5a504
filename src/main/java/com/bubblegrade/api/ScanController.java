package com.bubblegrade.api;

import com.bubblegrade.api.dto.CorrectionRequest;
import com.bubblegrade.config.GradingProperties;
import com.bubblegrade.exception.ScanNotFoundException;
import com.bubblegrade.model.AnswerKey;
import com.bubblegrade.model.ScanResult;
import com.bubblegrade.repository.ScanRepository;
import com.bubblegrade.service.pipeline.ScanPipeline;
import com.bubblegrade.service.review.CorrectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.io.IOException;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping(path = "/api/v1/scans")
@Tag(name = "Scans", description = "Upload, inspect and correct graded answer sheets")
public class ScanController {

    private final ScanPipeline pipeline;
    private final CorrectionService correctionService;
    private final ScanRepository repository;
    private final long maxUploadBytes;

    public ScanController(ScanPipeline pipeline, CorrectionService correctionService, ScanRepository repository,
            GradingProperties properties) {
        this.pipeline = pipeline;
        this.correctionService = correctionService;
        this.repository = repository;
        this.maxUploadBytes = properties.pipeline().maxUploadBytes();
    }

    @Operation(summary = "Upload an answer sheet photograph for grading")
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ScanResult> upload(@RequestPart("file") MultipartFile file,
                                             @RequestParam(name = "answerKey", required = false) String answerKey) {
        if (file == null || file.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Image file is required");
        }
        String contentType = file.getContentType();
        if (contentType == null || !contentType.startsWith("image/")) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "File must be an image");
        }
        if (file.getSize() > maxUploadBytes) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "File too large. Maximum size is " + maxUploadBytes / (1024 * 1024) + "MB");
        }
        AnswerKey key = answerKey == null || answerKey.isBlank() ? null : AnswerKey.parse(answerKey);
        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException exception) {
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "Unable to read upload", exception);
        }
        String filename = file.getOriginalFilename() == null ? "upload" : file.getOriginalFilename();
        ScanResult queued = pipeline.submit(content, filename, key);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(queued);
    }

    @Operation(summary = "Fetch the grading record of a scan")
    @GetMapping("/{id}")
    public ScanResult get(@PathVariable("id") UUID id) {
        return repository.get(id).orElseThrow(() -> new ScanNotFoundException(id));
    }

    @Operation(summary = "Correct the name or CURP of a finished scan")
    @PatchMapping(path = "/{id}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ScanResult correct(@PathVariable("id") UUID id, @Valid @RequestBody CorrectionRequest request) {
        return correctionService.applyCorrections(id, request.toCorrection(), request.reviewer());
    }
}
