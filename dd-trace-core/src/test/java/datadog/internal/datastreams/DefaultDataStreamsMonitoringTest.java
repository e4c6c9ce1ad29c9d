package datadog.internal.datastreams;

import static datadog.internal.common.sink.EventListener.EventType.BAD_PAYLOAD;
import static datadog.internal.common.sink.EventListener.EventType.DOWNGRADED;
import static datadog.internal.common.sink.EventListener.EventType.ERROR;
import static java.util.Arrays.asList;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import datadog.internal.api.WellKnownTags;
import datadog.internal.api.time.ControllableTimeSource;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DefaultDataStreamsMonitoringTest {
  static final long BUCKET_DURATION_NANOS = TimeUnit.SECONDS.toNanos(10);
  static final long START = TimeUnit.SECONDS.toNanos(1_700_000_000L);

  ControllableTimeSource timeSource;
  CapturingSink sink;
  List<Collection<StatsBucket>> flushed;
  DefaultDataStreamsMonitoring monitoring;

  @BeforeEach
  void setup() {
    timeSource = new ControllableTimeSource();
    timeSource.set(START);
    sink = new CapturingSink();
    flushed = new CopyOnWriteArrayList<>();
    monitoring =
        new DefaultDataStreamsMonitoring(
            sink,
            timeSource,
            new WellKnownTags("host", "prod", "service", null, "java"),
            flushed::add,
            BUCKET_DURATION_NANOS);
  }

  @AfterEach
  void cleanup() {
    monitoring.close();
  }

  private static StatsPoint point(long timestampNanos, long hash) {
    return new StatsPoint(asList("type:kafka"), hash, 0, timestampNanos, 1_000, 1_000);
  }

  private List<StatsBucket> flushAll() {
    monitoring.flush();
    List<StatsBucket> buckets = new ArrayList<>();
    for (Collection<StatsBucket> payload : flushed) {
      buckets.addAll(payload);
    }
    flushed.clear();
    return buckets;
  }

  @Test
  void testSameKeyInSameWindowMerges() {
    monitoring.add(point(START, 1));
    monitoring.add(point(START + BUCKET_DURATION_NANOS - 1, 1));

    List<StatsBucket> buckets = flushAll();
    assertEquals(1, buckets.size());
    assertEquals(START, buckets.get(0).getStartTimeNanos());
    assertEquals(BUCKET_DURATION_NANOS, buckets.get(0).getBucketDurationNanos());
    assertEquals(1, buckets.get(0).getGroups().size());
    StatsGroup group = buckets.get(0).getGroups().iterator().next();
    assertEquals(2, group.getPathwayLatency().getCount());
  }

  @Test
  void testDifferentWindowsNeverMerge() {
    monitoring.add(point(START, 1));
    monitoring.add(point(START + BUCKET_DURATION_NANOS, 1));

    List<StatsBucket> buckets = flushAll();
    assertEquals(2, buckets.size());
    for (StatsBucket bucket : buckets) {
      assertEquals(1, bucket.getGroups().size());
      assertEquals(1, bucket.getGroups().iterator().next().getPathwayLatency().getCount());
    }
  }

  @Test
  void testBucketStartIsFlooredToTheDuration() {
    monitoring.add(point(START + 1234, 1));

    assertEquals(START, flushAll().get(0).getStartTimeNanos());
  }

  @Test
  void testProduceOffsetHighWaterMark() {
    for (long offset : new long[] {5, 3, 9}) {
      monitoring.trackProduce("orders", 0, offset);
    }
    monitoring.trackCommit("billing", "orders", 0, 2);
    monitoring.trackCommit("billing", "orders", 0, 1);

    List<StatsBucket> buckets = flushAll();
    assertEquals(1, buckets.size());
    assertEquals(
        9L, buckets.get(0).getLatestProduceOffsets().get(new TopicPartition("orders", 0)));
    assertEquals(
        2L,
        buckets
            .get(0)
            .getLatestCommitOffsets()
            .get(new TopicPartitionGroup("billing", "orders", 0)));
  }

  @Test
  void testFlushDrainsEveryBucket() {
    monitoring.add(point(START, 1));
    monitoring.trackProduce("orders", 0, 1, START + 3 * BUCKET_DURATION_NANOS);
    assertEquals(2, monitoring.pendingBuckets());

    monitoring.flush();

    assertEquals(1, flushed.size());
    assertEquals(2, flushed.get(0).size());
    assertEquals(0, monitoring.pendingBuckets());

    // nothing left, nothing sent
    monitoring.flush();
    assertEquals(1, flushed.size());

    // later writes land in a fresh bucket
    monitoring.add(point(START, 1));
    assertEquals(1, monitoring.pendingBuckets());
  }

  @Test
  void testDowngradeDisablesRecordingForGood() {
    monitoring.add(point(START, 1));

    sink.publish(DOWNGRADED, "could not find endpoint");

    assertFalse(monitoring.isEnabled());
    assertEquals(0, monitoring.pendingBuckets());
    monitoring.add(point(START, 1));
    monitoring.trackProduce("orders", 0, 1);
    monitoring.trackCommit("billing", "orders", 0, 1);
    monitoring.setCheckpoint(asList("type:kafka"));
    assertEquals(0, monitoring.pendingBuckets());
  }

  @Test
  void testNothingIsRecordedOnceDowngradeReturns() throws Exception {
    int threads = 4;
    CountDownLatch running = new CountDownLatch(threads);
    AtomicBoolean stop = new AtomicBoolean();
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int t = 0; t < threads; t++) {
        int partition = t;
        futures.add(
            executor.submit(
                () -> {
                  running.countDown();
                  long offset = 0;
                  while (!stop.get()) {
                    offset++;
                    monitoring.add(point(START + (offset % 3) * BUCKET_DURATION_NANOS, partition));
                    monitoring.trackProduce("orders", partition, offset, START);
                  }
                }));
      }
      assertTrue(running.await(5, TimeUnit.SECONDS));

      sink.publish(DOWNGRADED, "could not find endpoint");
      assertEquals(0, monitoring.pendingBuckets());

      stop.set(true);
      for (Future<?> future : futures) {
        future.get(5, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }
    assertEquals(0, monitoring.pendingBuckets());
  }

  @Test
  void testOtherFailuresKeepRecording() {
    sink.publish(BAD_PAYLOAD, "bad request");
    sink.publish(ERROR, "internal error");

    assertTrue(monitoring.isEnabled());
    monitoring.add(point(START, 1));
    assertEquals(1, monitoring.pendingBuckets());
  }

  @Test
  void testClear() {
    monitoring.add(point(START, 1));
    monitoring.clear();

    assertEquals(0, monitoring.pendingBuckets());
    assertTrue(flushAll().isEmpty());
  }

  @Test
  void testCheckpointUsesPathwayOfCurrentThread() throws Exception {
    assertNull(monitoring.currentPathwayContext());

    PathwayContext first = monitoring.setCheckpoint(asList("direction:out", "type:kafka"));
    long firstHash = first.getHash();
    PathwayContext second = monitoring.setCheckpoint(asList("direction:in", "type:kafka"));

    assertSame(first, second);
    assertSame(first, monitoring.currentPathwayContext());
    assertEquals(1, monitoring.pendingBuckets());
    List<StatsBucket> buckets = flushAll();
    assertEquals(2, buckets.get(0).getGroups().size());
    boolean chained = false;
    for (StatsGroup group : buckets.get(0).getGroups()) {
      chained |= group.getParentHash() == firstHash;
    }
    assertTrue(chained);

    // another thread starts its own pathway
    ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      Future<PathwayContext> other =
          executor.submit(
              () -> {
                assertNull(monitoring.currentPathwayContext());
                return monitoring.setCheckpoint(asList("type:kafka"));
              });
      assertNotSame(first, other.get(5, TimeUnit.SECONDS));
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void testDecodeReplacesPathwayOfCurrentThread() throws Exception {
    DefaultPathwayContext upstream =
        DefaultPathwayContext.newPathway(timeSource, "producer", "prod");
    upstream.setCheckpoint(asList("direction:out"), point -> {});

    monitoring.setCheckpoint(asList("type:local"));
    PathwayContext decoded = monitoring.decode(upstream.encode());

    assertEquals(upstream.getHash(), decoded.getHash());
    assertSame(decoded, monitoring.currentPathwayContext());

    PathwayContext fromBase64 = monitoring.decodeBase64(upstream.encodeBase64());
    assertEquals(upstream.getHash(), fromBase64.getHash());
    assertSame(fromBase64, monitoring.currentPathwayContext());
  }

  @Test
  void testMalformedDataStartsNewPathway() {
    PathwayContext current = monitoring.setCheckpoint(asList("type:local"));
    timeSource.advance(TimeUnit.SECONDS.toNanos(1));

    PathwayContext decoded = monitoring.decode(new byte[] {1, 2, 3});
    PathwayContext decodedBase64 = monitoring.decodeBase64("%%%");

    assertEquals(0, decoded.getHash());
    long nowMillis = TimeUnit.NANOSECONDS.toMillis(timeSource.getCurrentTimeNanos());
    assertEquals(nowMillis, decoded.getPathwayStartMillis());
    assertEquals(decoded.getPathwayStartMillis(), decoded.getEdgeStartMillis());
    assertEquals(0, decodedBase64.getHash());
    // the thread keeps its pathway
    assertSame(current, monitoring.currentPathwayContext());
  }

  @Test
  void testConcurrentRecording() throws Exception {
    int threads = 8;
    int pointsPerThread = 1_000;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<?>> futures = new ArrayList<>();
    try {
      for (int t = 0; t < threads; t++) {
        futures.add(
            executor.submit(
                () -> {
                  start.await();
                  for (int i = 0; i < pointsPerThread; i++) {
                    monitoring.add(point(START + (i % 2) * BUCKET_DURATION_NANOS, 1));
                    if (i % 100 == 0) {
                      monitoring.flush();
                    }
                  }
                  return null;
                }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get(30, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    // points racing with flushes are reported exactly once
    double total = 0;
    for (StatsBucket bucket : flushAll()) {
      for (StatsGroup group : bucket.getGroups()) {
        total += group.getPathwayLatency().getCount();
      }
    }
    assertEquals(threads * pointsPerThread, total);
  }

  @Test
  void testCloseFlushesOutstandingBuckets() {
    monitoring.start();
    monitoring.add(point(START, 1));

    monitoring.close();

    assertEquals(1, flushed.size());
    assertEquals(0, monitoring.pendingBuckets());
  }

  @Test
  void testTimerFlushesAndKeepsRunningAfterFailure() throws Exception {
    AtomicInteger attempts = new AtomicInteger();
    CountDownLatch failed = new CountDownLatch(1);
    CountDownLatch reported = new CountDownLatch(1);
    List<List<StatsBucket>> delivered = new CopyOnWriteArrayList<>();
    DefaultDataStreamsMonitoring timed =
        new DefaultDataStreamsMonitoring(
            sink,
            timeSource,
            new WellKnownTags("host", "prod", "service", null, "java"),
            buckets -> {
              if (attempts.incrementAndGet() == 1) {
                failed.countDown();
                throw new IllegalStateException("agent unavailable");
              }
              delivered.add(new ArrayList<>(buckets));
              reported.countDown();
            },
            TimeUnit.MILLISECONDS.toNanos(50));
    try {
      timed.start();
      timed.add(point(START, 1));
      assertTrue(failed.await(5, TimeUnit.SECONDS));
      // the failed payload is dropped
      assertEquals(0, timed.pendingBuckets());

      timed.add(point(START, 2));
      assertTrue(reported.await(5, TimeUnit.SECONDS));

      assertEquals(1, delivered.size());
      List<StatsBucket> buckets = delivered.get(0);
      assertEquals(1, buckets.size());
      assertEquals(1, buckets.get(0).getGroups().size());
      assertEquals(0, timed.pendingBuckets());
    } finally {
      timed.close();
    }
    assertEquals(2, attempts.get());
  }

  @Test
  void testInvalidBucketDuration() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new DefaultDataStreamsMonitoring(
                sink,
                timeSource,
                new WellKnownTags("host", null, "service", null, "java"),
                flushed::add,
                0));
  }
}
