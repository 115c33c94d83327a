package teranet.mapdev.loadseries.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import teranet.mapdev.loadseries.dto.ErrorResponseDto;
import teranet.mapdev.loadseries.dto.PipelineRunRequestDto;
import teranet.mapdev.loadseries.dto.PipelineRunResultDto;
import teranet.mapdev.loadseries.exception.InvalidConfigurationException;
import teranet.mapdev.loadseries.model.StageName;
import teranet.mapdev.loadseries.service.QualityPipelineService;

import java.util.Arrays;
import java.util.Locale;

/**
 * Starts pipeline runs over the configured folders.
 */
@RestController
@RequestMapping("/api/v1/pipeline")
@Tag(name = "Pipeline", description = "Cleaning, cohort filtering and anonymization of metric files")
public class PipelineController {

    private static final Logger logger = LoggerFactory.getLogger(PipelineController.class);

    private final QualityPipelineService pipelineService;

    public PipelineController(QualityPipelineService pipelineService) {
        this.pipelineService = pipelineService;
    }

    /**
     * Run every stage in order
     */
    @PostMapping("/run")
    @Operation(
        summary = "Run the full pipeline",
        description = "Preprocess, filter and anonymize all metric files; publish too when enabled. "
                + "Folder paths in the body override the configured ones."
    )
    @ApiResponse(responseCode = "200", description = "Run finished (see processing_status)")
    @ApiResponse(responseCode = "400", description = "Invalid configuration")
    @ApiResponse(responseCode = "500", description = "Processing error")
    public ResponseEntity<?> runPipeline(@RequestBody(required = false) PipelineRunRequestDto request) {
        logger.info("Received full pipeline run request");
        try {
            PipelineRunResultDto result = pipelineService.runAll(request);
            return ResponseEntity.ok(result);

        } catch (InvalidConfigurationException e) {
            logger.warn("Configuration error: {}", e.getMessage());
            return ResponseEntity.badRequest().body(new ErrorResponseDto("Configuration Error", e.getMessage()));

        } catch (Exception e) {
            logger.error("Pipeline run failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new ErrorResponseDto("Processing Error", "Pipeline run failed: " + e.getMessage()));
        }
    }

    /**
     * Run one stage with the configured folders
     */
    @PostMapping("/stages/{stage}")
    @Operation(
        summary = "Run a single stage",
        description = "Stage is one of PREPROCESS, FILTER, ANONYMIZE, PUBLISH (case-insensitive)"
    )
    @ApiResponse(responseCode = "200", description = "Stage finished (see processing_status)")
    @ApiResponse(responseCode = "400", description = "Unknown stage or invalid configuration")
    @ApiResponse(responseCode = "500", description = "Processing error")
    public ResponseEntity<?> runStage(
            @Parameter(description = "Stage name", required = true)
            @PathVariable("stage") String stage) {

        StageName stageName;
        try {
            stageName = StageName.valueOf(stage.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            logger.warn("Unknown stage requested: {}", stage);
            return ResponseEntity.badRequest().body(new ErrorResponseDto("Validation Error",
                    "Unknown stage '" + stage + "', expected one of " + Arrays.toString(StageName.values())));
        }

        logger.info("Received stage run request: {}", stageName);
        try {
            return ResponseEntity.ok(pipelineService.runStage(stageName));

        } catch (InvalidConfigurationException e) {
            logger.warn("Configuration error: {}", e.getMessage());
            return ResponseEntity.badRequest().body(new ErrorResponseDto("Configuration Error", e.getMessage()));

        } catch (Exception e) {
            logger.error("Stage {} failed", stageName, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new ErrorResponseDto("Processing Error", "Stage " + stageName + " failed: " + e.getMessage()));
        }
    }
}
