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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.enterprise.orgsource.sdk.RetrievalException;
import com.google.enterprise.orgsource.sdk.RetrievalException.ErrorType;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Finds the first allowed command line executable that answers {@code --version}.
 *
 * <p>The executables are tried in the order they are allowed, so {@code sf} is preferred over
 * the older {@code sfdx}. The first one that answers is remembered.
 */
public class CliLocator {
  private static final Logger logger = Logger.getLogger(CliLocator.class.getName());

  static final long VERSION_TIMEOUT_MILLIS = 5000;
  static final String CLI_NOT_FOUND =
      "Salesforce CLI not found. Please install the Salesforce CLI (sf) and make sure it is "
          + "available on the PATH.";

  private final CommandExecutor executor;
  private final AtomicReference<String> located = new AtomicReference<>();

  public CliLocator(CommandExecutor executor) {
    this.executor = checkNotNull(executor);
  }

  /**
   * Returns the executable to use.
   *
   * @throws RetrievalException of type {@link ErrorType#EXTERNAL_TOOL} if none is available
   */
  public String locate() throws RetrievalException {
    String cached = located.get();
    if (cached != null) {
      return cached;
    }
    for (String cli : executor.getAllowedCommands()) {
      try {
        CommandResult result =
            executor.execute(CliCommands.version(cli), null, VERSION_TIMEOUT_MILLIS);
        if (result.isSuccess()) {
          logger.log(Level.INFO, "Using command line tool {0}: {1}",
              new Object[] {cli, result.getStdout().trim()});
          located.set(cli);
          return cli;
        }
        logger.log(Level.FINE, "{0} --version exited with {1}",
            new Object[] {cli, result.getExitCode()});
      } catch (RetrievalException e) {
        logger.log(Level.FINE, "Version check of " + cli + " failed", e);
      }
    }
    throw new RetrievalException.Builder()
        .setErrorType(ErrorType.EXTERNAL_TOOL)
        .setErrorMessage(CLI_NOT_FOUND)
        .build();
  }

  /** Forgets the remembered executable. */
  public void reset() {
    located.set(null);
  }
}
