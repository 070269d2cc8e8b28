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

import com.google.api.client.json.GenericJson;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.jackson2.JacksonFactory;
import com.google.api.client.util.Key;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Longs;
import com.google.enterprise.orgsource.sdk.ExceptionHandler;
import com.google.enterprise.orgsource.sdk.RetrievalException;
import com.google.enterprise.orgsource.sdk.RetrievalException.ErrorType;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * JSON envelope printed by the command line tool when invoked with {@code --json}.
 *
 * <pre>{@code {"status": 0, "result": [...] | {...}, "message": "..."}}</pre>
 */
public class CliResponse extends GenericJson {
  static final JsonFactory JSON_FACTORY = JacksonFactory.getDefaultInstance();
  static final String DEFAULT_FAILURE_MESSAGE = "SF CLI command failed";
  private static final int PREVIEW_LENGTH = 100;

  @Key private Integer status;
  @Key private Object result;
  @Key private String message;

  /** Required by the JSON parser. */
  public CliResponse() {
    setFactory(JSON_FACTORY);
  }

  /**
   * Parses {@code stdout} and checks its status.
   *
   * @throws RetrievalException of type {@link ErrorType#EXTERNAL_TOOL} if the text is not JSON
   *     or the status is non-zero. The message is the tool's own message where it gave one.
   */
  public static CliResponse parse(String stdout) throws RetrievalException {
    String text = Strings.nullToEmpty(stdout).trim();
    CliResponse response;
    try {
      response = JSON_FACTORY.fromString(text, CliResponse.class);
    } catch (IOException | IllegalArgumentException e) {
      throw new RetrievalException.Builder()
          .setErrorType(ErrorType.EXTERNAL_TOOL)
          .setErrorMessage("Invalid JSON response: "
              + text.substring(0, Math.min(PREVIEW_LENGTH, text.length())) + "...")
          .setCause(e)
          .build();
    }
    if (response == null) {
      throw new RetrievalException.Builder()
          .setErrorType(ErrorType.EXTERNAL_TOOL)
          .setErrorMessage("Invalid JSON response: empty output")
          .build();
    }
    if (response.getStatus() != 0) {
      throw new RetrievalException.Builder()
          .setErrorType(ErrorType.EXTERNAL_TOOL)
          .setExitCode(response.getStatus())
          .setErrorMessage(
              Strings.isNullOrEmpty(response.message) ? DEFAULT_FAILURE_MESSAGE : response.message)
          .build();
    }
    return response;
  }

  /**
   * Runs {@code command} through {@code executor}, retrying as {@code retryPolicy} allows, and
   * parses its output. A failed command without output is reported with its exit code and
   * standard error.
   */
  public static CliResponse run(CommandExecutor executor, List<String> command,
      @Nullable Path workingDirectory, long timeoutMillis, ExceptionHandler retryPolicy)
      throws RetrievalException {
    return CommandExecutor.callWithRetry(
        () -> {
          CommandResult result = executor.execute(command, workingDirectory, timeoutMillis);
          if (!result.isSuccess() && result.getStdout().trim().isEmpty()) {
            result.checkSuccess();
          }
          return parse(result.getStdout());
        },
        retryPolicy);
  }

  /** Status reported by the tool; a missing status counts as success. */
  public int getStatus() {
    return status == null ? 0 : status;
  }

  @Nullable
  public String getMessage() {
    return message;
  }

  @Nullable
  public Object getResult() {
    return result;
  }

  /**
   * Returns the result as a list of records.
   *
   * <p>An array result is returned element by element, a query result's {@code records} array
   * is unwrapped and any other single object becomes a one-element list. A missing result is an
   * empty list.
   */
  public List<Map<String, Object>> getRecords() {
    Object value = result;
    if (value instanceof Map && ((Map<?, ?>) value).get("records") instanceof Collection) {
      value = ((Map<?, ?>) value).get("records");
    }
    ImmutableList.Builder<Map<String, Object>> records = ImmutableList.builder();
    if (value instanceof Collection) {
      for (Object element : (Collection<?>) value) {
        if (element instanceof Map) {
          records.add(asRecord(element));
        }
      }
    } else if (value instanceof Map) {
      records.add(asRecord(value));
    }
    return records.build();
  }

  /** Returns the result object, or an empty map if the result is not an object. */
  public Map<String, Object> getResultObject() {
    return result instanceof Map ? asRecord(result) : ImmutableMap.of();
  }

  /** Returns {@code record.get(key)} as a string, or {@code null} if absent. */
  @Nullable
  public static String getString(Map<String, Object> record, String key) {
    Object value = record.get(key);
    return value == null ? null : value.toString();
  }

  /** Returns a numeric or numeric text field, or {@code defaultValue} if absent or malformed. */
  public static long getLong(Map<String, Object> record, String key, long defaultValue) {
    Object value = record.get(key);
    if (value instanceof Number) {
      return ((Number) value).longValue();
    }
    Long parsed = value == null ? null : Longs.tryParse(value.toString().trim());
    return parsed == null ? defaultValue : parsed;
  }

  /** Returns {@code true} only for a boolean {@code true} or the text {@code "true"}. */
  public static boolean getBoolean(Map<String, Object> record, String key) {
    Object value = record.get(key);
    if (value instanceof Boolean) {
      return (Boolean) value;
    }
    return value != null && "true".equalsIgnoreCase(value.toString());
  }

  /** Returns the object elements of an array field, or an empty list. */
  public static List<Map<String, Object>> getRecords(Map<String, Object> record, String key) {
    Object value = record.get(key);
    ImmutableList.Builder<Map<String, Object>> records = ImmutableList.builder();
    if (value instanceof Collection) {
      for (Object element : (Collection<?>) value) {
        if (element instanceof Map) {
          records.add(asRecord(element));
        }
      }
    }
    return records.build();
  }

  /** Returns the non-null elements of an array field as strings, or an empty list. */
  public static List<String> getStrings(Map<String, Object> record, String key) {
    Object value = record.get(key);
    ImmutableList.Builder<String> strings = ImmutableList.builder();
    if (value instanceof Collection) {
      for (Object element : (Collection<?>) value) {
        if (element != null) {
          strings.add(element.toString());
        }
      }
    }
    return strings.build();
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> asRecord(Object value) {
    return (Map<String, Object>) value;
  }

  @Override
  public CliResponse set(String fieldName, Object value) {
    return (CliResponse) super.set(fieldName, value);
  }

  @Override
  public CliResponse clone() {
    return (CliResponse) super.clone();
  }
}
