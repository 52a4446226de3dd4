package edu.harvard.hms.dbmi.avillach.uploader.upload;

import edu.harvard.hms.dbmi.avillach.uploader.exception.DirectoryException;
import edu.harvard.hms.dbmi.avillach.uploader.upload.config.UploaderConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import java.nio.file.Path;
import java.util.List;

/**
 * Sequencing run uploader.
 *
 * Run with:
 * java -jar upload-service.jar \
 *   --uploader.directory=/path/to/runs \
 *   --uploader.mode=FIRST_NEW \
 *   --uploader.parser=NEXTSEQ \
 *   --uploader.base-url=https://samples.example.org \
 *   --uploader.client-id=uploader --uploader.username=user --uploader.password=secret
 *
 * Exits 0 when the attempt succeeded or there was nothing to do, 1 otherwise.
 */
@SpringBootApplication
@ConfigurationPropertiesScan("edu.harvard.hms.dbmi.avillach.uploader.upload.config")
public class UploaderApplication implements CommandLineRunner, ExitCodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(UploaderApplication.class);

    private final UploaderConfig config;
    private final UploadOrchestrator orchestrator;

    private int exitCode = 0;

    public UploaderApplication(UploaderConfig config, UploadOrchestrator orchestrator) {
        this.config = config;
        this.orchestrator = orchestrator;
    }

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(UploaderApplication.class, args)));
    }

    @Override
    public void run(String... args) {
        Path directory = Path.of(config.getDirectory());
        log.info("Starting {} upload of {}", config.getMode(), directory);

        try {
            switch (config.getMode()) {
                case SINGLE -> exitCode = orchestrator.uploadSingleRun(directory).exitCode();
                case FIRST_NEW -> exitCode = orchestrator.uploadFirstNewRun(directory).exitCode();
                case BATCH -> {
                    List<UploadOutcome> outcomes = orchestrator.batchUpload(directory);
                    exitCode = UploadOutcome.exitCode(outcomes);
                }
            }
        } catch (DirectoryException e) {
            log.error("Could not scan {} for runs: {}", e.getDirectory(), e.getMessage());
            exitCode = 1;
        }

        log.info("Uploader finished with exit code {}", exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
