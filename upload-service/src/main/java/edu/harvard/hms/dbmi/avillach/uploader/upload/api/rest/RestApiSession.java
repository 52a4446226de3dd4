package edu.harvard.hms.dbmi.avillach.uploader.upload.api.rest;

import edu.harvard.hms.dbmi.avillach.uploader.data.run.Project;
import edu.harvard.hms.dbmi.avillach.uploader.data.run.Sample;
import edu.harvard.hms.dbmi.avillach.uploader.data.run.SequenceFile;
import edu.harvard.hms.dbmi.avillach.uploader.data.run.SequencingRun;
import edu.harvard.hms.dbmi.avillach.uploader.upload.api.ApiConnectionException;
import edu.harvard.hms.dbmi.avillach.uploader.upload.api.ApiSession;
import edu.harvard.hms.dbmi.avillach.uploader.validation.ErrorKind;
import edu.harvard.hms.dbmi.avillach.uploader.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

class RestApiSession implements ApiSession {
    private static final Logger log = LoggerFactory.getLogger(RestApiSession.class);

    private static final ParameterizedTypeReference<List<SampleResource>> SAMPLE_LIST_TYPE_REFERENCE = new ParameterizedTypeReference<>(){};

    static final String UPLOADING = "UPLOADING";
    static final String COMPLETE = "COMPLETE";

    private final WebClient webClient;
    private final Duration timeout;

    RestApiSession(WebClient webClient, Duration timeout) {
        this.webClient = webClient;
        this.timeout = timeout;
    }

    @Override
    public ValidationResult validateForUpload(SequencingRun run) throws ApiConnectionException {
        ValidationResult result = new ValidationResult();
        for (Project project : run.projects()) {
            if (findProject(project.projectId()).isEmpty()) {
                log.warn("Project {} does not exist on the sample service", project.projectId());
                result.addError(ErrorKind.REMOTE_REJECTED, "Project " + project.projectId()
                    + " does not exist or is not visible to this user", project.projectId());
            }
        }
        return result;
    }

    @Override
    public void uploadSequencingRun(SequencingRun run) throws ApiConnectionException {
        SequencingRunResource remoteRun = createSequencingRun(run);
        log.info("Created sequencing run {} on the sample service", remoteRun.identifier());

        for (Project project : run.projects()) {
            Map<String, SampleResource> existing = new HashMap<>();
            for (SampleResource sample : listSamples(project.projectId())) {
                existing.put(sample.sampleName(), sample);
            }
            for (Sample sample : project.samples()) {
                SampleResource remoteSample = existing.get(sample.sampleName());
                if (remoteSample == null) {
                    remoteSample = createSample(project.projectId(), sample);
                    log.info("Created sample {} in project {}", sample.sampleName(), project.projectId());
                }
                uploadFiles(remoteRun.identifier(), project.projectId(), remoteSample, sample);
            }
        }

        setUploadStatus(remoteRun.identifier(), COMPLETE);
    }

    private Optional<ProjectResource> findProject(String projectId) throws ApiConnectionException {
        return Optional.ofNullable(RestCalls.block(webClient.get()
                .uri("/api/projects/{projectId}", projectId)
                .retrieve()
                .bodyToMono(ProjectResource.class)
                .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.empty()),
            timeout, "looking up project " + projectId));
    }

    private List<SampleResource> listSamples(String projectId) throws ApiConnectionException {
        List<SampleResource> samples = RestCalls.block(webClient.get()
                .uri("/api/projects/{projectId}/samples", projectId)
                .retrieve()
                .bodyToMono(SAMPLE_LIST_TYPE_REFERENCE),
            timeout, "listing samples of project " + projectId);
        return samples == null ? List.of() : samples;
    }

    private SampleResource createSample(String projectId, Sample sample) throws ApiConnectionException {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("sampleName", sample.sampleName());
        body.put("description", sample.description());
        SampleResource created = RestCalls.block(webClient.post()
                .uri("/api/projects/{projectId}/samples", projectId)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(SampleResource.class),
            timeout, "creating sample " + sample.sampleName());
        if (created == null || created.identifier() == null) {
            throw new ApiConnectionException("Sample service did not return the identifier of new sample " + sample.sampleName());
        }
        return created;
    }

    private SequencingRunResource createSequencingRun(SequencingRun run) throws ApiConnectionException {
        Map<String, Object> body = new LinkedHashMap<>(run.metadata().values());
        body.put("layoutType", run.metadata().layoutType().name());
        body.put("readLengths", run.metadata().readLengths());
        body.put("uploadStatus", UPLOADING);
        SequencingRunResource created = RestCalls.block(webClient.post()
                .uri("/api/sequencingrun/{platform}", run.platform())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(SequencingRunResource.class),
            timeout, "creating the sequencing run");
        if (created == null || created.identifier() == null) {
            throw new ApiConnectionException("Sample service did not return the identifier of the new sequencing run");
        }
        return created;
    }

    private void uploadFiles(String runId, String projectId, SampleResource remoteSample, Sample sample) throws ApiConnectionException {
        MultipartBodyBuilder parts = new MultipartBodyBuilder();
        for (SequenceFile file : sample.sequenceFiles()) {
            parts.part("file", new FileSystemResource(file.path()));
        }
        parts.part("sequencingRunId", runId);
        parts.part("pairedEnd", String.valueOf(sample.isPairedEnd()));

        log.info("Uploading {} files of sample {}", sample.sequenceFiles().size(), sample.sampleName());
        RestCalls.block(webClient.post()
                .uri("/api/projects/{projectId}/samples/{sampleId}/sequenceFiles", projectId, remoteSample.identifier())
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(parts.build()))
                .retrieve()
                .toBodilessEntity(),
            timeout, "uploading files of sample " + sample.sampleName());
    }

    private void setUploadStatus(String runId, String status) throws ApiConnectionException {
        RestCalls.block(webClient.patch()
                .uri("/api/sequencingrun/{runId}", runId)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("uploadStatus", status))
                .retrieve()
                .toBodilessEntity(),
            timeout, "marking sequencing run " + runId + " " + status);
    }
}
