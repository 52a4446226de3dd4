package edu.harvard.hms.dbmi.avillach.uploader.upload.config;

import edu.harvard.hms.dbmi.avillach.uploader.parser.DirectoryScanner;
import edu.harvard.hms.dbmi.avillach.uploader.parser.SampleSheetParser;
import edu.harvard.hms.dbmi.avillach.uploader.progress.StatusStore;
import edu.harvard.hms.dbmi.avillach.uploader.upload.UploadOrchestrator;
import edu.harvard.hms.dbmi.avillach.uploader.upload.api.SampleServiceApi;
import edu.harvard.hms.dbmi.avillach.uploader.upload.api.rest.SampleServiceRestClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class UploaderBeans {

    @Bean
    public SampleSheetParser sampleSheetParser(UploaderConfig config) {
        return config.getParser().create();
    }

    @Bean
    public StatusStore statusStore() {
        return new StatusStore();
    }

    @Bean
    public DirectoryScanner directoryScanner(SampleSheetParser parser, StatusStore statusStore) {
        return new DirectoryScanner(parser, statusStore);
    }

    @Bean
    public SampleServiceApi sampleServiceApi(WebClient.Builder webClientBuilder) {
        return new SampleServiceRestClient(webClientBuilder);
    }

    @Bean
    public UploadOrchestrator uploadOrchestrator(UploaderConfig config, SampleSheetParser parser, DirectoryScanner scanner,
                                                 StatusStore statusStore, SampleServiceApi sampleServiceApi) {
        return new UploadOrchestrator(parser, scanner, statusStore, sampleServiceApi, config.toApiSettings(), config.isForce());
    }
}
