package com.scholary.narrator.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.narrator.extraction.DocumentTextExtractor;
import com.scholary.narrator.extraction.EpubTextExtractor;
import com.scholary.narrator.extraction.PdfTextExtractor;
import com.scholary.narrator.job.ConversionJob;
import com.scholary.narrator.job.ErrorDetail;
import com.scholary.narrator.job.FailureStage;
import com.scholary.narrator.job.JobProgress;
import com.scholary.narrator.job.JobState;
import com.scholary.narrator.service.ConversionService;
import com.scholary.narrator.service.UploadStorage;
import com.scholary.narrator.testutil.TestProperties;
import com.scholary.narrator.tts.VoiceCatalog;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

@ExtendWith(MockitoExtension.class)
class ConvertCommandRunnerTest {

  @Mock private ConversionService conversionService;
  @Mock private UploadStorage uploadStorage;

  @TempDir Path tempDir;

  private final ByteArrayOutputStream output = new ByteArrayOutputStream();
  private ConvertCommandRunner runner;

  @BeforeEach
  void setUp() {
    VoiceCatalog voiceCatalog = new VoiceCatalog(TestProperties.narrator(tempDir));
    runner =
        new ConvertCommandRunner(
            conversionService,
            uploadStorage,
            voiceCatalog,
            true,
            1,
            new PrintStream(output, true, StandardCharsets.UTF_8));
  }

  @Test
  void run_shouldListVoices() throws Exception {
    runner.run(new DefaultApplicationArguments("--list-voices"));

    assertThat(printed())
        .contains("en-US-SteffanNeural")
        .contains("(default)")
        .contains("en-US-AriaNeural");
    assertThat(runner.getExitCode()).isZero();
  }

  @Test
  void run_shouldRequireInput() throws Exception {
    runner.run(new DefaultApplicationArguments());

    assertThat(printed()).contains("--input");
    assertThat(runner.getExitCode()).isEqualTo(2);
  }

  @Test
  void run_shouldRejectMissingInputFile() throws Exception {
    runner.run(new DefaultApplicationArguments(tempDir.resolve("missing.pdf").toString()));

    assertThat(printed()).contains("Input file not found");
    assertThat(runner.getExitCode()).isEqualTo(2);
    verify(conversionService, never()).submit(any());
  }

  @Test
  void run_shouldRejectUnsupportedExtension() throws Exception {
    Path input = Files.writeString(tempDir.resolve("notes.txt"), "plain text");
    UploadStorage realStorage =
        new UploadStorage(
            new DocumentTextExtractor(List.of(new PdfTextExtractor(), new EpubTextExtractor())),
            TestProperties.narrator(tempDir));
    ConvertCommandRunner cli =
        new ConvertCommandRunner(
            conversionService,
            realStorage,
            new VoiceCatalog(TestProperties.narrator(tempDir)),
            true,
            1,
            new PrintStream(output, true, StandardCharsets.UTF_8));

    cli.run(new DefaultApplicationArguments("--input=" + input));

    assertThat(printed())
        .contains("ERROR: Unsupported file type: notes.txt")
        .contains("Only .pdf and .epub are supported");
    assertThat(cli.getExitCode()).isEqualTo(2);
    verify(conversionService, never()).submit(any());
  }

  @Test
  void run_shouldReplaceNonMp3OutputExtension() throws Exception {
    Path input = Files.writeString(tempDir.resolve("book.pdf"), "pdf");
    Path result = Files.writeString(tempDir.resolve("book_abcdef12.mp3"), "mp3");
    when(uploadStorage.store(input)).thenReturn(tempDir.resolve("staged.pdf"));
    when(conversionService.submit(any())).thenReturn("job-3");
    when(conversionService.getStatus("job-3"))
        .thenReturn(job(JobState.COMPLETE, JobProgress.merging(1), result, null));

    runner.run(
        new DefaultApplicationArguments(
            "--input=" + input, "--output=" + tempDir.resolve("audio.wav")));

    assertThat(tempDir.resolve("audio.mp3")).hasContent("mp3");
    assertThat(tempDir.resolve("audio.wav")).doesNotExist();
    assertThat(printed()).contains("Output extension was not .mp3");
    assertThat(runner.getExitCode()).isZero();
  }

  @Test
  void run_shouldConvertAndMoveResultToOutput() throws Exception {
    Path input = Files.writeString(tempDir.resolve("book.epub"), "epub");
    Path staged = tempDir.resolve("staged.epub");
    Path result = Files.writeString(tempDir.resolve("book_12345678.mp3"), "mp3");
    Path target = tempDir.resolve("out").resolve("book.mp3");
    when(uploadStorage.store(input)).thenReturn(staged);
    when(conversionService.submit(any())).thenReturn("job-1");
    when(conversionService.getStatus("job-1"))
        .thenReturn(job(JobState.PROCESSING, JobProgress.synthesizing(1, 2), null, null))
        .thenReturn(job(JobState.COMPLETE, JobProgress.merging(2), result, null));

    runner.run(
        new DefaultApplicationArguments(
            "--input=" + input, "--output=" + target, "--voice=en-US-AriaNeural", "--no-chunking"));

    assertThat(target).hasContent("mp3");
    assertThat(printed())
        .contains("STATUS: Converting chunk 1/2 to audio...")
        .contains("STATUS: Merging 2 audio chunks...")
        .contains("STATUS: Conversion complete");
    assertThat(runner.getExitCode()).isZero();
    verify(conversionService)
        .submit(
            argThat(
                request ->
                    request.sourceFile().equals(staged)
                        && request.originalFilename().equals("book.epub")
                        && "en-US-AriaNeural".equals(request.voice())
                        && !request.chunkingEnabled()));
  }

  @Test
  void run_shouldExitWithOneWhenConversionFails() throws Exception {
    Path input = Files.writeString(tempDir.resolve("book.pdf"), "pdf");
    when(uploadStorage.store(input)).thenReturn(tempDir.resolve("staged.pdf"));
    when(conversionService.submit(any())).thenReturn("job-2");
    ErrorDetail detail =
        new ErrorDetail(
            FailureStage.SYNTHESIS,
            "Synthesis failed for chunk index 0: SERVICE_ERROR (bad voice)",
            List.of(0),
            tempDir.resolve("tts_chunks_job-2"));
    when(conversionService.getStatus("job-2"))
        .thenReturn(job(JobState.ERROR, JobProgress.synthesizing(1, 1), null, detail));

    runner.run(new DefaultApplicationArguments(input.toString()));

    assertThat(printed())
        .contains("ERROR: Synthesis failed for chunk index 0")
        .contains("tts_chunks_job-2");
    assertThat(runner.getExitCode()).isEqualTo(1);
  }

  private String printed() {
    return output.toString(StandardCharsets.UTF_8);
  }

  private static ConversionJob job(
      JobState state, JobProgress progress, Path result, ErrorDetail error) {
    Instant now = Instant.now();
    return new ConversionJob(
        "job", state, progress, result, error, "v", true, "book", "book.mp3", now, now, 1);
  }
}
