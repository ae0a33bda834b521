package com.scholary.narrator.synthesis;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.narrator.chunking.TextChunk;
import com.scholary.narrator.config.NarratorProperties.SynthesisProperties;
import com.scholary.narrator.testutil.FakeSpeechSynthesizer;
import com.scholary.narrator.testutil.TestExecutors;
import com.scholary.narrator.testutil.TestProperties;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.IntStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

class ChunkSequencerTest {

  @TempDir Path workDir;

  private FakeSpeechSynthesizer synthesizer;
  private ThreadPoolTaskExecutor callExecutor;
  private ThreadPoolTaskExecutor synthesisExecutor;

  @BeforeEach
  void setUp() {
    synthesizer = new FakeSpeechSynthesizer();
    callExecutor = TestExecutors.cached("tts-call-");
    synthesisExecutor = TestExecutors.fixed("synthesis-", 4);
  }

  @AfterEach
  void tearDown() {
    synthesisExecutor.shutdown();
    callExecutor.shutdown();
  }

  @Test
  void synthesizeAll_shouldReturnSegmentsInIndexOrderWhateverCompletionOrder() throws Exception {
    synthesizer.withRandomLatency(40);
    ChunkSequencer sequencer =
        sequencer(TestProperties.synthesis(1, 5, 4, FailurePolicy.FAIL_FAST));
    List<TextChunk> chunks = chunks(12);

    SequenceResult result =
        sequencer.synthesizeAll(chunks, workDir, SequenceProgressListener.NONE);

    assertThat(result.succeeded()).isTrue();
    assertThat(result.segments())
        .extracting(SynthesizedSegment::sequenceIndex)
        .containsExactlyElementsOf(IntStream.range(0, 12).boxed().toList());
    for (int i = 0; i < 12; i++) {
      assertThat(Files.readAllBytes(result.audioPaths().get(i)))
          .isEqualTo(FakeSpeechSynthesizer.audioFor(chunks.get(i).text()));
    }
  }

  @Test
  void synthesizeAll_shouldNotifyListenerInOrder() {
    synthesizer.withRandomLatency(20);
    ChunkSequencer sequencer =
        sequencer(TestProperties.synthesis(1, 5, 3, FailurePolicy.FAIL_FAST));
    List<String> events = new CopyOnWriteArrayList<>();

    sequencer.synthesizeAll(
        chunks(3),
        workDir,
        new SequenceProgressListener() {
          @Override
          public void onChunkStarted(int sequenceIndex, int totalChunks) {
            events.add("start " + sequenceIndex + "/" + totalChunks);
          }

          @Override
          public void onSegmentCompleted(
              SynthesizedSegment segment, int completed, int totalChunks) {
            events.add("done " + segment.sequenceIndex() + " " + completed + "/" + totalChunks);
          }
        });

    assertThat(events)
        .containsExactly(
            "start 0/3", "done 0 1/3", "start 1/3", "done 1 2/3", "start 2/3", "done 2 3/3");
  }

  @Test
  void synthesizeAll_shouldStopAtFirstFailureWhenFailingFast() {
    synthesizer.failWhen("Chunk 2 ");
    ChunkSequencer sequencer =
        sequencer(TestProperties.synthesis(1, 5, 1, FailurePolicy.FAIL_FAST));

    SequenceResult result =
        sequencer.synthesizeAll(chunks(5), workDir, SequenceProgressListener.NONE);

    assertThat(result.succeeded()).isFalse();
    assertThat(result.failedIndices()).containsExactly(2);
    assertThat(result.segments()).hasSize(3);
    assertThat(synthesizer.calls()).hasSize(3).noneMatch(text -> text.startsWith("Chunk 3 "));
    assertThat(workDir.resolve("chunk_0001.mp3")).exists();
    assertThat(workDir.resolve("chunk_0002.mp3")).exists();
    assertThat(workDir.resolve("chunk_0003.mp3")).doesNotExist();
  }

  @Test
  void synthesizeAll_shouldReportLowestFailingIndexUnderParallelism() {
    synthesizer.failWhen("Chunk 1 ").failWhen("Chunk 4 ").withRandomLatency(30);
    ChunkSequencer sequencer =
        sequencer(TestProperties.synthesis(1, 5, 4, FailurePolicy.FAIL_FAST));

    SequenceResult result =
        sequencer.synthesizeAll(chunks(8), workDir, SequenceProgressListener.NONE);

    assertThat(result.failedIndices()).containsExactly(1);
    assertThat(result.segments())
        .extracting(SynthesizedSegment::sequenceIndex)
        .containsExactly(0, 1);
  }

  @Test
  void synthesizeAll_shouldCollectEveryFailureWhenCompletingAll() {
    synthesizer.failWhen("Chunk 1 ").failWhen("Chunk 3 ");
    ChunkSequencer sequencer =
        sequencer(TestProperties.synthesis(1, 5, 2, FailurePolicy.FAIL_COMPLETE));

    SequenceResult result =
        sequencer.synthesizeAll(chunks(5), workDir, SequenceProgressListener.NONE);

    assertThat(result.failedIndices()).containsExactly(1, 3);
    assertThat(result.segments()).hasSize(5);
    assertThat(result.segments().get(4).isSucceeded()).isTrue();
    assertThat(result.failures())
        .allSatisfy(segment -> assertThat(segment.failure().kind())
            .isEqualTo(FailureKind.SERVICE_ERROR));
  }

  private ChunkSequencer sequencer(SynthesisProperties synthesis) {
    var properties = TestProperties.narrator(workDir, 4500, synthesis);
    SpeechSynthesisInvoker invoker =
        new SpeechSynthesisInvoker(synthesizer, properties, callExecutor);
    return new ChunkSequencer(invoker, properties, synthesisExecutor);
  }

  private static List<TextChunk> chunks(int count) {
    return IntStream.range(0, count)
        .mapToObj(i -> new TextChunk(i, "Chunk " + i + " text.", TestProperties.DEFAULT_VOICE))
        .toList();
  }
}
