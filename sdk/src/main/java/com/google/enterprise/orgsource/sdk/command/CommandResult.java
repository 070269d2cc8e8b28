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
package com.google.enterprise.orgsource.sdk.command;

import com.google.common.base.Strings;
import com.google.enterprise.orgsource.sdk.RetrievalException;
import com.google.enterprise.orgsource.sdk.RetrievalException.ErrorType;

/** Exit code and captured output of a finished command. */
public final class CommandResult {
  private final int exitCode;
  private final String stdout;
  private final String stderr;

  public CommandResult(int exitCode, String stdout, String stderr) {
    this.exitCode = exitCode;
    this.stdout = Strings.nullToEmpty(stdout);
    this.stderr = Strings.nullToEmpty(stderr);
  }

  public int getExitCode() {
    return exitCode;
  }

  public String getStdout() {
    return stdout;
  }

  public String getStderr() {
    return stderr;
  }

  public boolean isSuccess() {
    return exitCode == 0;
  }

  /**
   * Returns this result if the exit code is zero.
   *
   * @throws RetrievalException of type {@link ErrorType#EXTERNAL_TOOL} otherwise
   */
  public CommandResult checkSuccess() throws RetrievalException {
    if (isSuccess()) {
      return this;
    }
    throw new RetrievalException.Builder()
        .setErrorType(ErrorType.EXTERNAL_TOOL)
        .setExitCode(exitCode)
        .setErrorMessage(String.format("Command failed with code %d: %s", exitCode, stderr.trim()))
        .build();
  }

  @Override
  public String toString() {
    return "CommandResult[exitCode=" + exitCode + ", stdout=" + stdout.length()
        + " chars, stderr=" + stderr.length() + " chars]";
  }
}
