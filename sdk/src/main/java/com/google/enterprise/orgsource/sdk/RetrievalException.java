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
package com.google.enterprise.orgsource.sdk;

import java.io.IOException;
import java.util.Optional;

/**
 * Failure while listing or fetching artifacts from a remote org.
 *
 * <p>The message carries the raw error text reported by the external tool where there is one.
 */
public class RetrievalException extends IOException {

  private final ErrorType errorType;
  private final Optional<Integer> exitCode;

  /** Where a retrieval failed. */
  public enum ErrorType {
    /** Enumerating artifacts of a type failed. */
    LISTING,
    /** Fetching the content of a single artifact failed. */
    CONTENT,
    /** A command did not finish within its timeout. */
    TIMEOUT,
    /** The command line tool exited abnormally or reported a non-zero status. */
    EXTERNAL_TOOL,
    /** No handler is registered for the requested type. */
    UNREGISTERED_TYPE,
    UNKNOWN
  }

  private RetrievalException(Builder builder) {
    super(builder.message, builder.cause);
    this.errorType = builder.errorType;
    this.exitCode = builder.exitCode;
  }

  public ErrorType getErrorType() {
    return errorType;
  }

  /** Exit code of the external process, if one was observed. */
  public Optional<Integer> getExitCode() {
    return exitCode;
  }

  @Override
  public String toString() {
    return "RetrievalException[type=" + errorType
        + exitCode.map(code -> ", exitCode=" + code).orElse("")
        + ", message=" + getMessage()
        + ((getCause() != null) ? ", cause=" + getCause() : "") + "]";
  }

  /** Builder for creating {@link RetrievalException} */
  public static class Builder {
    private String message;
    private Throwable cause;
    private ErrorType errorType = ErrorType.UNKNOWN;
    private Optional<Integer> exitCode = Optional.empty();

    public Builder setErrorMessage(String errorMessage) {
      this.message = errorMessage;
      return this;
    }

    public Builder setErrorType(ErrorType errorType) {
      this.errorType = errorType == null ? ErrorType.UNKNOWN : errorType;
      return this;
    }

    public Builder setCause(Throwable cause) {
      this.cause = cause;
      return this;
    }

    public Builder setExitCode(int exitCode) {
      this.exitCode = Optional.of(exitCode);
      return this;
    }

    public RetrievalException build() {
      return new RetrievalException(this);
    }
  }
}
