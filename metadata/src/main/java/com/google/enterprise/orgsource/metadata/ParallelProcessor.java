/*
 * Copyright © 2017 Google Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.google.enterprise.orgsource.metadata;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.enterprise.orgsource.sdk.batch.ChunkedExecutor;
import com.google.enterprise.orgsource.sdk.batch.ProcessingResult;
import com.google.enterprise.orgsource.sdk.batch.ProcessingStats;
import com.google.enterprise.orgsource.sdk.config.Configuration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.ToIntFunction;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs type listings and arbitrary requests with bounded concurrency.
 *
 * <p>Work is split into chunks of at most the concurrency limit; a chunk starts once the previous
 * one has finished. Individual failures and timeouts are collected in the result and never stop
 * the rest of the batch.
 *
 * <p>Optional configuration parameters:
 *
 * <ul>
 *   <li>{@value #MAX_CONCURRENCY} - default concurrency, 1 to 10. Default {@value
 *       #DEFAULT_CONCURRENCY}.
 *   <li>{@value #TIMEOUT} - default per request timeout in milliseconds, at least 1000. Default
 *       {@value #DEFAULT_TIMEOUT_MILLIS}.
 * </ul>
 */
public class ParallelProcessor {
  private static final Logger logger = Logger.getLogger(ParallelProcessor.class.getName());

  public static final String MAX_CONCURRENCY = "processor.maxConcurrency";
  public static final String TIMEOUT = "processor.timeout";
  public static final int DEFAULT_CONCURRENCY = 5;
  public static final long DEFAULT_TIMEOUT_MILLIS = 30000;

  private final TypeRegistry registry;
  private final ChunkedExecutor executor;
  private volatile int defaultConcurrency;
  private volatile long defaultTimeoutMillis;

  public ParallelProcessor(TypeRegistry registry, ChunkedExecutor executor) {
    this(registry, executor, DEFAULT_CONCURRENCY, DEFAULT_TIMEOUT_MILLIS);
  }

  public ParallelProcessor(TypeRegistry registry, ChunkedExecutor executor,
      int defaultConcurrency, long defaultTimeoutMillis) {
    this.registry = checkNotNull(registry, "registry can not be null");
    this.executor = checkNotNull(executor, "executor can not be null");
    setDefaultConcurrency(defaultConcurrency);
    setDefaultTimeout(defaultTimeoutMillis);
  }

  public static ParallelProcessor fromConfiguration(
      TypeRegistry registry, ChunkedExecutor executor) {
    checkState(Configuration.isInitialized(), "Configuration not initialized");
    return new ParallelProcessor(registry, executor,
        Configuration.getInteger(MAX_CONCURRENCY, DEFAULT_CONCURRENCY).get(),
        Configuration.getLong(TIMEOUT, DEFAULT_TIMEOUT_MILLIS).get());
  }

  /**
   * Lists the items of each requested type. Without {@code parallel} the types are listed one
   * after another in the given order. Types without handler are reported as failures.
   */
  public ProcessingResult<TypeItems> processTypes(
      String targetId, String targetIdentifier, QueryOptions options) {
    checkNotNull(options, "options can not be null");
    int concurrency = options.getMaxConcurrency() > 0
        ? HandlerConfig.clampConcurrency(options.getMaxConcurrency())
        : defaultConcurrency;
    logger.log(Level.FINE, "Listing {0} for {1} with concurrency {2}",
        new Object[] {options.getTypeNames(), targetIdentifier, concurrency});
    return executor.process(options.getTypeNames(), concurrency, options.isParallel(),
        type -> new TypeItems(
            type, registry.requireHandler(type).listItems(targetId, targetIdentifier, type)));
  }

  /**
   * Applies {@code processor} to each request. With a priority function, requests are started
   * in descending priority. A request that exceeds the timeout is recorded as a failure with the
   * message {@value ChunkedExecutor#REQUEST_TIMEOUT}.
   */
  public <T, R> ProcessingResult<R> batchProcessRequests(
      List<T> requests, ChunkedExecutor.Task<T, R> processor, BatchOptions<T> options) {
    checkNotNull(requests, "requests can not be null");
    checkNotNull(processor, "processor can not be null");
    checkNotNull(options, "options can not be null");
    int concurrency = options.getMaxConcurrency() > 0
        ? HandlerConfig.clampConcurrency(options.getMaxConcurrency())
        : defaultConcurrency;
    long timeout = options.getTimeoutMillis() > 0
        ? Math.max(HandlerConfig.MIN_TIMEOUT_MILLIS, options.getTimeoutMillis())
        : defaultTimeoutMillis;
    List<T> ordered = new ArrayList<>(requests);
    if (options.getPriority().isPresent()) {
      ToIntFunction<T> priority = options.getPriority().get();
      Comparator<T> byPriority = Comparator.comparingInt(priority);
      ordered.sort(byPriority.reversed());
    }
    return executor.process(ordered, concurrency, true, timeout, processor);
  }

  public ProcessingStats getProcessingStats(ProcessingResult<?> result) {
    return ProcessingStats.of(checkNotNull(result));
  }

  /** Sets the default concurrency, clamped to 1..10. */
  public void setDefaultConcurrency(int concurrency) {
    this.defaultConcurrency = HandlerConfig.clampConcurrency(concurrency);
  }

  /** Sets the default request timeout, at least 1000 ms. */
  public void setDefaultTimeout(long timeoutMillis) {
    this.defaultTimeoutMillis = Math.max(HandlerConfig.MIN_TIMEOUT_MILLIS, timeoutMillis);
  }

  public int getDefaultConcurrency() {
    return defaultConcurrency;
  }

  public long getDefaultTimeoutMillis() {
    return defaultTimeoutMillis;
  }
}
