package teranet.mapdev.loadseries.startup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import teranet.mapdev.loadseries.config.PipelineConfig;
import teranet.mapdev.loadseries.dto.PipelineRunResultDto;
import teranet.mapdev.loadseries.service.QualityPipelineService;

/**
 * Runs the full pipeline once at boot when pipeline.run-on-startup is true.
 */
@Component
public class PipelineStartupRunner implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(PipelineStartupRunner.class);

    private final QualityPipelineService pipelineService;
    private final PipelineConfig pipelineConfig;

    public PipelineStartupRunner(QualityPipelineService pipelineService, PipelineConfig pipelineConfig) {
        this.pipelineService = pipelineService;
        this.pipelineConfig = pipelineConfig;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!pipelineConfig.isRunOnStartup()) {
            logger.debug("Startup run disabled");
            return;
        }
        logger.info("Running pipeline on startup");
        PipelineRunResultDto result = pipelineService.runAll(null);
        logger.info("Startup run {} finished with status {}", result.getRunId(), result.getProcessingStatus());
    }
}
