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
package com.google.enterprise.orgsource.sdk.batch;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.common.base.Stopwatch;
import com.google.common.collect.Lists;
import com.google.common.util.concurrent.ExecutionError;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.SimpleTimeLimiter;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.TimeLimiter;
import com.google.common.util.concurrent.UncheckedExecutionException;
import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a task over a list of inputs with bounded concurrency and collects a
 * {@link ProcessingResult}.
 *
 * <p>In parallel mode the inputs are split into chunks of at most {@code chunkSize}. All inputs
 * of a chunk run at once and the next chunk starts only after every input of the current chunk
 * has finished. A failing input is recorded as a {@link ProcessingResult.Failure} and never
 * affects its siblings. Success values keep the input order.
 */
public class ChunkedExecutor implements Closeable {
  private static final Logger logger = Logger.getLogger(ChunkedExecutor.class.getName());

  public static final String REQUEST_TIMEOUT = "Request timeout";
  static final String INTERRUPTED = "Interrupted";
  static final String NO_RESULT = "No result";
  /** Passed as timeout to run without a time limit. */
  public static final long NO_TIMEOUT = 0;

  private final ExecutorService delegate;
  private final ListeningExecutorService executor;
  private final TimeLimiter timeLimiter;

  /** Creates an executor backed by a cached pool of daemon threads named after {@code name}. */
  public ChunkedExecutor(String name) {
    this(Executors.newCachedThreadPool(
        new ThreadFactoryBuilder().setNameFormat(name + "-%d").setDaemon(true).build()));
  }

  @VisibleForTesting
  ChunkedExecutor(ExecutorService executorService) {
    this.delegate = checkNotNull(executorService);
    this.executor = MoreExecutors.listeningDecorator(executorService);
    this.timeLimiter = SimpleTimeLimiter.create(executorService);
  }

  /** Work applied to each input. */
  public interface Task<I, O> {
    O process(I input) throws Exception;
  }

  /** Same as {@link #process(List, int, boolean, long, Task)} without a time limit. */
  public <I, O> ProcessingResult<O> process(
      List<I> inputs, int chunkSize, boolean parallel, Task<I, O> task) {
    return process(inputs, chunkSize, parallel, NO_TIMEOUT, task);
  }

  /**
   * Applies {@code task} to every input.
   *
   * @param inputs inputs in processing order
   * @param chunkSize maximum number of inputs running at once
   * @param parallel {@code false} to process one input at a time in order
   * @param timeoutMillis per input time limit, or {@link #NO_TIMEOUT}. An input that runs out
   *     of time is interrupted and recorded with the error {@value #REQUEST_TIMEOUT}.
   * @param task work to apply
   */
  public <I, O> ProcessingResult<O> process(
      List<I> inputs, int chunkSize, boolean parallel, long timeoutMillis, Task<I, O> task) {
    checkNotNull(inputs, "inputs can not be null");
    checkNotNull(task, "task can not be null");
    checkArgument(chunkSize > 0, "chunk size must be positive");
    checkArgument(timeoutMillis >= 0, "timeout can not be negative");
    Stopwatch stopwatch = Stopwatch.createStarted();
    ProcessingResult.Builder<O> result = new ProcessingResult.Builder<>();
    if (!parallel || chunkSize == 1) {
      for (I input : inputs) {
        Outcome<O> outcome = Thread.currentThread().isInterrupted()
            ? Outcome.failed(INTERRUPTED)
            : runOne(input, timeoutMillis, task);
        outcome.addTo(result, input);
      }
    } else {
      boolean interrupted = false;
      for (List<I> chunk : Lists.partition(inputs, chunkSize)) {
        if (interrupted) {
          chunk.forEach(input -> result.addFailure(input, INTERRUPTED));
          continue;
        }
        interrupted = !runChunk(chunk, timeoutMillis, task, result);
      }
    }
    return result.build(stopwatch.elapsed(TimeUnit.MILLISECONDS));
  }

  /** Returns {@code false} if the calling thread was interrupted while waiting. */
  private <I, O> boolean runChunk(
      List<I> chunk, long timeoutMillis, Task<I, O> task, ProcessingResult.Builder<O> result) {
    List<ListenableFuture<Outcome<O>>> futures = new ArrayList<>(chunk.size());
    for (I input : chunk) {
      futures.add(executor.submit(() -> runOne(input, timeoutMillis, task)));
    }
    boolean completed = true;
    try {
      Futures.successfulAsList(futures).get();
    } catch (InterruptedException e) {
      logger.log(Level.WARNING, "Interrupted while waiting for a chunk of " + chunk.size(), e);
      Thread.currentThread().interrupt();
      completed = false;
    } catch (ExecutionException e) {
      // successfulAsList does not fail; individual futures are inspected below
      logger.log(Level.FINE, "Unexpected chunk failure", e);
    }
    for (int i = 0; i < chunk.size(); i++) {
      ListenableFuture<Outcome<O>> future = futures.get(i);
      Outcome<O> outcome;
      if (future.isDone() && !future.isCancelled()) {
        try {
          outcome = Futures.getDone(future);
        } catch (ExecutionException e) {
          outcome = Outcome.failed(messageOf(e.getCause()));
        }
      } else {
        future.cancel(true);
        outcome = Outcome.failed(INTERRUPTED);
      }
      outcome.addTo(result, chunk.get(i));
    }
    return completed;
  }

  private <I, O> Outcome<O> runOne(I input, long timeoutMillis, Task<I, O> task) {
    try {
      O value = timeoutMillis > 0
          ? timeLimiter.callWithTimeout(() -> task.process(input), timeoutMillis,
              TimeUnit.MILLISECONDS)
          : task.process(input);
      return value == null ? Outcome.failed(NO_RESULT) : Outcome.succeeded(value);
    } catch (TimeoutException e) {
      logger.log(Level.WARNING, String.format("Processing %s timed out, limit %d ms", input,
          timeoutMillis));
      return Outcome.failed(REQUEST_TIMEOUT);
    } catch (InterruptedException e) {
      logger.log(Level.WARNING, String.format("Interrupted while processing %s", input), e);
      Thread.currentThread().interrupt();
      return Outcome.failed(INTERRUPTED);
    } catch (ExecutionException | UncheckedExecutionException | ExecutionError e) {
      logger.log(Level.WARNING, String.format("Failed to process %s", input), e.getCause());
      return Outcome.failed(messageOf(e.getCause()));
    } catch (Exception e) {
      logger.log(Level.WARNING, String.format("Failed to process %s", input), e);
      return Outcome.failed(messageOf(e));
    }
  }

  @VisibleForTesting
  static String messageOf(Throwable t) {
    if (t == null) {
      return "Unknown error";
    }
    return Strings.isNullOrEmpty(t.getMessage()) ? t.toString() : t.getMessage();
  }

  @Override
  public void close() {
    if (delegate.isShutdown()) {
      return;
    }
    delegate.shutdown();
    try {
      delegate.awaitTermination(10L, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      logger.log(Level.WARNING, "Interrupted during executor termination.", e);
      Thread.currentThread().interrupt();
    }
    delegate.shutdownNow();
  }

  private static final class Outcome<O> {
    private final O value;
    private final String error;

    private Outcome(O value, String error) {
      this.value = value;
      this.error = error;
    }

    static <O> Outcome<O> succeeded(O value) {
      return new Outcome<>(value, null);
    }

    static <O> Outcome<O> failed(String error) {
      return new Outcome<>(null, error);
    }

    void addTo(ProcessingResult.Builder<O> result, Object input) {
      if (error == null) {
        result.addSuccess(value);
      } else {
        result.addFailure(input, error);
      }
    }
  }
}
