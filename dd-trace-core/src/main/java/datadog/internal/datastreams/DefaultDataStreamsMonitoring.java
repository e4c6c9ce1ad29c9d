package datadog.internal.datastreams;

import static datadog.internal.util.AgentThreadFactory.AgentThread.DATA_STREAMS_MONITORING;
import static datadog.internal.util.AgentThreadFactory.THREAD_JOIN_TIMOUT_MS;

import datadog.internal.api.Config;
import datadog.internal.api.TracerInfo;
import datadog.internal.api.WellKnownTags;
import datadog.internal.api.time.SystemTimeSource;
import datadog.internal.api.time.TimeSource;
import datadog.internal.common.sink.EventListener;
import datadog.internal.common.sink.HttpSink;
import datadog.internal.common.sink.Sink;
import datadog.internal.communication.http.HttpRetryPolicy;
import datadog.internal.communication.http.OkHttpTransportClient;
import datadog.internal.util.AgentThreadFactory;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class DefaultDataStreamsMonitoring implements DataStreamsMonitoring, EventListener {
  private static final Logger log = LoggerFactory.getLogger(DefaultDataStreamsMonitoring.class);

  public static final String V01_DATASTREAMS_ENDPOINT = "v0.1/pipeline_stats";

  // guarded by timeToBucket
  private final Map<Long, StatsBucket> timeToBucket = new HashMap<>();
  private final DatastreamsPayloadWriter payloadWriter;
  private final TimeSource timeSource;
  private final WellKnownTags wellKnownTags;
  private final long bucketDurationNanos;
  private final PathwayContextHolder pathwayContexts = new PathwayContextHolder();
  private volatile boolean enabled = true;
  private ScheduledExecutorService executor;
  private ScheduledFuture<?> cancellation;

  /** Builds the monitoring configured by {@code config}, reporting to the agent over HTTP. */
  public static DataStreamsMonitoring create(Config config) {
    if (!config.isDataStreamsEnabled()) {
      log.debug("Data streams is disabled");
      return new NoopDataStreamsMonitoring(config.getServiceName(), config.getEnv());
    }
    return new DefaultDataStreamsMonitoring(config, SystemTimeSource.INSTANCE);
  }

  public DefaultDataStreamsMonitoring(Config config, TimeSource timeSource) {
    this(
        new HttpSink(
            new OkHttpTransportClient(
                config.getAgentUrl(), V01_DATASTREAMS_ENDPOINT, config.getAgentTimeout()),
            HttpRetryPolicy.Factory.withinInterval(
                config.getDataStreamsRetryAttempts(),
                TimeUnit.NANOSECONDS.toMillis(config.getDataStreamsBucketDurationNanoseconds()))),
        timeSource,
        config.getWellKnownTags(),
        config.getDataStreamsBucketDurationNanoseconds());
  }

  public DefaultDataStreamsMonitoring(
      Sink sink, TimeSource timeSource, WellKnownTags wellKnownTags, long bucketDurationNanos) {
    this(
        sink,
        timeSource,
        wellKnownTags,
        new MsgPackDatastreamsPayloadWriter(sink, wellKnownTags, TracerInfo.VERSION),
        bucketDurationNanos);
  }

  public DefaultDataStreamsMonitoring(
      Sink sink,
      TimeSource timeSource,
      WellKnownTags wellKnownTags,
      DatastreamsPayloadWriter payloadWriter,
      long bucketDurationNanos) {
    if (bucketDurationNanos <= 0) {
      throw new IllegalArgumentException("Invalid bucket duration: " + bucketDurationNanos);
    }
    this.timeSource = timeSource;
    this.wellKnownTags = wellKnownTags;
    this.payloadWriter = payloadWriter;
    this.bucketDurationNanos = bucketDurationNanos;
    sink.register(this);
  }

  @Override
  public synchronized void start() {
    if (executor != null) {
      return;
    }
    executor =
        Executors.newSingleThreadScheduledExecutor(
            new AgentThreadFactory(DATA_STREAMS_MONITORING));
    cancellation =
        executor.scheduleAtFixedRate(
            new ReportTask(this), bucketDurationNanos, bucketDurationNanos, TimeUnit.NANOSECONDS);
  }

  @Override
  public boolean isEnabled() {
    return enabled;
  }

  @Override
  public PathwayContext newPathwayContext() {
    return DefaultPathwayContext.newPathway(
        timeSource, wellKnownTags.getService(), wellKnownTags.getEnv());
  }

  @Override
  public PathwayContext decode(byte[] data) {
    try {
      DefaultPathwayContext pathwayContext =
          DefaultPathwayContext.decode(
              timeSource, wellKnownTags.getService(), wellKnownTags.getEnv(), data);
      // every decoded pathway replaces the one of the current thread
      pathwayContexts.set(pathwayContext);
      return pathwayContext;
    } catch (IOException e) {
      log.debug("Unable to decode pathway context, starting a new pathway", e);
      return newPathwayContext();
    }
  }

  @Override
  public PathwayContext decodeBase64(String data) {
    try {
      DefaultPathwayContext pathwayContext =
          DefaultPathwayContext.decodeBase64(
              timeSource, wellKnownTags.getService(), wellKnownTags.getEnv(), data);
      pathwayContexts.set(pathwayContext);
      return pathwayContext;
    } catch (IOException e) {
      log.debug("Unable to decode pathway context, starting a new pathway", e);
      return newPathwayContext();
    }
  }

  @Override
  public PathwayContext setCheckpoint(List<String> tags) {
    PathwayContext pathwayContext = pathwayContexts.get();
    if (pathwayContext == null) {
      pathwayContext = newPathwayContext();
      pathwayContexts.set(pathwayContext);
    }
    pathwayContext.setCheckpoint(tags, this::add);
    return pathwayContext;
  }

  /** The pathway the calling thread is part of, if any. */
  PathwayContext currentPathwayContext() {
    return pathwayContexts.get();
  }

  @Override
  public void add(StatsPoint statsPoint) {
    if (!enabled) {
      return;
    }
    long bucket = currentBucket(statsPoint.getTimestampNanos());
    synchronized (timeToBucket) {
      // checked again under the lock, a downgrade clears the buckets while holding it
      if (!enabled) {
        return;
      }
      getOrCreateBucket(bucket).addPoint(statsPoint);
    }
  }

  @Override
  public void trackProduce(String topic, int partition, long offset) {
    trackProduce(topic, partition, offset, timeSource.getCurrentTimeNanos());
  }

  @Override
  public void trackProduce(String topic, int partition, long offset, long timestampNanos) {
    if (!enabled) {
      return;
    }
    log.debug("Tracking produce offset {} of {}-{}", offset, topic, partition);
    TopicPartition key = new TopicPartition(topic, partition);
    long bucket = currentBucket(timestampNanos);
    synchronized (timeToBucket) {
      if (!enabled) {
        return;
      }
      getOrCreateBucket(bucket).addProduceOffset(key, offset);
    }
  }

  @Override
  public void trackCommit(String group, String topic, int partition, long offset) {
    trackCommit(group, topic, partition, offset, timeSource.getCurrentTimeNanos());
  }

  @Override
  public void trackCommit(
      String group, String topic, int partition, long offset, long timestampNanos) {
    if (!enabled) {
      return;
    }
    log.debug("Tracking commit offset {} of {}/{}-{}", offset, group, topic, partition);
    TopicPartitionGroup key = new TopicPartitionGroup(group, topic, partition);
    long bucket = currentBucket(timestampNanos);
    synchronized (timeToBucket) {
      if (!enabled) {
        return;
      }
      getOrCreateBucket(bucket).addCommitOffset(key, offset);
    }
  }

  // callers must hold the lock on timeToBucket
  private StatsBucket getOrCreateBucket(long bucket) {
    StatsBucket statsBucket = timeToBucket.get(bucket);
    if (statsBucket == null) {
      statsBucket = new StatsBucket(bucket, bucketDurationNanos);
      timeToBucket.put(bucket, statsBucket);
    }
    return statsBucket;
  }

  private long currentBucket(long timestampNanos) {
    return timestampNanos - (timestampNanos % bucketDurationNanos);
  }

  @Override
  public void flush() {
    List<StatsBucket> includedBuckets;
    synchronized (timeToBucket) {
      if (timeToBucket.isEmpty()) {
        return;
      }
      includedBuckets = new ArrayList<>(timeToBucket.values());
      timeToBucket.clear();
    }
    log.debug("Flushing {} buckets", includedBuckets.size());
    payloadWriter.writePayload(includedBuckets);
  }

  void report() {
    try {
      flush();
    } catch (Exception e) {
      log.debug("Error reporting data streams stats", e);
    }
  }

  /** Number of buckets waiting for the next flush. */
  int pendingBuckets() {
    synchronized (timeToBucket) {
      return timeToBucket.size();
    }
  }

  @Override
  public void clear() {
    synchronized (timeToBucket) {
      timeToBucket.clear();
    }
  }

  @Override
  public void close() {
    ScheduledExecutorService executor;
    synchronized (this) {
      executor = this.executor;
      if (cancellation != null) {
        cancellation.cancel(false);
      }
    }
    // final flush on the calling thread, outstanding buckets are not dropped
    report();
    if (executor != null) {
      executor.shutdown();
      try {
        if (!executor.awaitTermination(THREAD_JOIN_TIMOUT_MS, TimeUnit.MILLISECONDS)) {
          executor.shutdownNow();
        }
      } catch (InterruptedException e) {
        executor.shutdownNow();
        Thread.currentThread().interrupt();
      }
    }
  }

  @Override
  public void onEvent(EventType eventType, String message) {
    switch (eventType) {
      case DOWNGRADED:
        if (enabled) {
          log.info("Disabling data streams reporting because it is not supported by the agent");
        }
        synchronized (timeToBucket) {
          enabled = false;
          timeToBucket.clear();
        }
        break;
      case BAD_PAYLOAD:
        log.debug("bad data streams payload sent to trace agent: {}", message);
        break;
      case ERROR:
        log.debug("trace agent errored receiving data streams payload: {}", message);
        break;
      default:
    }
  }

  private static final class ReportTask implements Runnable {
    private final DefaultDataStreamsMonitoring target;

    private ReportTask(DefaultDataStreamsMonitoring target) {
      this.target = target;
    }

    @Override
    public void run() {
      target.report();
    }
  }
}
