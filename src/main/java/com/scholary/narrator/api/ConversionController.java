package com.scholary.narrator.api;

import com.scholary.narrator.api.VoiceListResponse.VoiceInfo;
import com.scholary.narrator.extraction.UnsupportedDocumentException;
import com.scholary.narrator.job.ConversionJob;
import com.scholary.narrator.monitoring.KibanaUrlGenerator;
import com.scholary.narrator.service.ConversionRequest;
import com.scholary.narrator.service.ConversionService;
import com.scholary.narrator.service.UploadStorage;
import com.scholary.narrator.tts.VoiceCatalog;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * REST API for document to MP3 conversion.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Uploading a document (returns job ID immediately)
 *   <li>Job status polling and cancellation
 *   <li>Downloading the finished MP3
 *   <li>Listing the available voices
 * </ul>
 *
 * <p>All conversions are asynchronous; progress can also be followed in Kibana.
 */
@RestController
@RequestMapping("/api")
@Tag(name = "Conversion", description = "Document to MP3 conversion API")
public class ConversionController {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConversionController.class);

  private static final MediaType AUDIO_MPEG = MediaType.parseMediaType("audio/mpeg");

  private final ConversionService conversionService;
  private final UploadStorage uploadStorage;
  private final VoiceCatalog voiceCatalog;
  private final KibanaUrlGenerator kibanaUrlGenerator;
  private final boolean chunkingByDefault;

  public ConversionController(
      ConversionService conversionService,
      UploadStorage uploadStorage,
      VoiceCatalog voiceCatalog,
      KibanaUrlGenerator kibanaUrlGenerator,
      @Value("${narrator.chunking.enabled:true}") boolean chunkingByDefault) {
    this.conversionService = conversionService;
    this.uploadStorage = uploadStorage;
    this.voiceCatalog = voiceCatalog;
    this.kibanaUrlGenerator = kibanaUrlGenerator;
    this.chunkingByDefault = chunkingByDefault;
  }

  /** Start an asynchronous conversion. */
  @PostMapping(value = "/conversions", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @Operation(
      summary = "Convert document",
      description =
          "Upload an EPUB or PDF and start converting it to a single MP3. "
              + "Returns a job ID for status polling.")
  public ResponseEntity<AsyncJobResponse> convert(
      @RequestParam("file") MultipartFile file,
      @RequestParam(value = "voice", required = false) String voice,
      @RequestParam(value = "chunking", required = false) Boolean chunking)
      throws IOException {

    String originalFilename = file.getOriginalFilename();
    if (file.isEmpty() || originalFilename == null || originalFilename.isBlank()) {
      throw new UnsupportedDocumentException("No file selected");
    }

    LOGGER.info(
        "Conversion request: file={}, size={} bytes, voice={}",
        originalFilename,
        file.getSize(),
        voice);

    Path staged;
    try (InputStream in = file.getInputStream()) {
      staged = uploadStorage.store(in, originalFilename);
    }

    boolean chunkingEnabled = chunking == null ? chunkingByDefault : chunking;
    String jobId =
        conversionService.submit(
            new ConversionRequest(staged, originalFilename, voice, chunkingEnabled));

    return ResponseEntity.accepted()
        .body(
            new AsyncJobResponse(
                jobId, "/api/jobs/" + jobId, kibanaUrlGenerator.generateJobUrl(jobId)));
  }

  /** Get job status. */
  @GetMapping("/jobs/{id}")
  @Operation(summary = "Get job status", description = "Check the status of a conversion job")
  public ResponseEntity<JobStatusResponse> getJobStatus(@PathVariable String id) {
    ConversionJob job = conversionService.getStatus(id);
    return ResponseEntity.ok(JobStatusResponse.from(job, kibanaUrlGenerator.generateJobUrl(id)));
  }

  /** Download the MP3 of a completed job. */
  @GetMapping("/jobs/{id}/download")
  @Operation(summary = "Download MP3", description = "Download the audio of a completed job")
  public ResponseEntity<Resource> download(@PathVariable String id) {
    Path result = conversionService.getResult(id);
    if (!Files.isRegularFile(result)) {
      LOGGER.warn("Output of job {} is missing on disk: {}", id, result);
      return ResponseEntity.notFound().build();
    }

    ContentDisposition disposition =
        ContentDisposition.attachment().filename(result.getFileName().toString()).build();
    return ResponseEntity.ok()
        .contentType(AUDIO_MPEG)
        .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
        .body(new FileSystemResource(result));
  }

  /** Cancel a queued or running job. */
  @DeleteMapping("/jobs/{id}")
  @Operation(summary = "Cancel job", description = "Cancel a queued or running conversion")
  public ResponseEntity<JobStatusResponse> cancel(@PathVariable String id) {
    ConversionJob job = conversionService.cancel(id);
    return ResponseEntity.ok(JobStatusResponse.from(job, kibanaUrlGenerator.generateJobUrl(id)));
  }

  /** List the voices a conversion can use. */
  @GetMapping("/voices")
  @Operation(summary = "List voices", description = "Voices available for narration")
  public VoiceListResponse voices() {
    return new VoiceListResponse(
        voiceCatalog.defaultVoice(),
        voiceCatalog.voices().stream()
            .map(voice -> new VoiceInfo(voice.displayName(), voice.shortName()))
            .toList());
  }
}
