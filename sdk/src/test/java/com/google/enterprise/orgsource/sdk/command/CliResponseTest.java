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

import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.enterprise.orgsource.sdk.BackoffExceptionHandler;
import com.google.enterprise.orgsource.sdk.RetrievalException;
import com.google.enterprise.orgsource.sdk.RetrievalException.ErrorType;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;
import org.junit.runner.RunWith;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

/** Tests for {@link CliResponse}. */
@RunWith(MockitoJUnitRunner.class)
public class CliResponseTest {

  @Rule public ExpectedException thrown = ExpectedException.none();

  @Mock private CommandExecutor mockExecutor;

  @Test
  public void parse_arrayResult_recordsInOrder() throws Exception {
    CliResponse response = CliResponse.parse(
        "{\"status\":0,\"result\":[{\"fullName\":\"B\"},{\"fullName\":\"A\"}]}");
    List<Map<String, Object>> records = response.getRecords();
    assertEquals(2, records.size());
    assertEquals("B", CliResponse.getString(records.get(0), "fullName"));
    assertEquals("A", CliResponse.getString(records.get(1), "fullName"));
  }

  @Test
  public void parse_queryResult_unwrapsRecords() throws Exception {
    CliResponse response = CliResponse.parse(
        "{\"status\":0,\"result\":{\"totalSize\":1,\"records\":[{\"Body\":\"class A {}\"}]}}");
    assertEquals("class A {}", CliResponse.getString(response.getRecords().get(0), "Body"));
  }

  @Test
  public void parse_singleObject_oneRecord() throws Exception {
    CliResponse response = CliResponse.parse("{\"status\":0,\"result\":{\"id\":\"x\"}}");
    assertEquals(1, response.getRecords().size());
    assertEquals("x", CliResponse.getString(response.getResultObject(), "id"));
  }

  @Test
  public void fieldAccessors_typedValues() throws Exception {
    CliResponse response = CliResponse.parse("{\"status\":0,\"result\":{"
        + "\"NumLinesCovered\":42,\"Length\":\"17\",\"Active\":true,\"Custom\":\"TRUE\","
        + "\"fields\":[{\"name\":\"A__c\"},\"skipped\"],\"referenceTo\":[\"Account\"]}}");
    Map<String, Object> result = response.getResultObject();
    assertEquals(42, CliResponse.getLong(result, "NumLinesCovered", 0));
    assertEquals(17, CliResponse.getLong(result, "Length", 0));
    assertEquals(-1, CliResponse.getLong(result, "Missing", -1));
    assertTrue(CliResponse.getBoolean(result, "Active"));
    assertTrue(CliResponse.getBoolean(result, "Custom"));
    assertFalse(CliResponse.getBoolean(result, "Missing"));
    assertEquals(1, CliResponse.getRecords(result, "fields").size());
    assertEquals("A__c", CliResponse.getString(CliResponse.getRecords(result, "fields").get(0),
        "name"));
    assertEquals(ImmutableList.of("Account"), CliResponse.getStrings(result, "referenceTo"));
    assertTrue(CliResponse.getStrings(result, "Missing").isEmpty());
  }

  @Test
  public void parse_missingResult_noRecords() throws Exception {
    CliResponse response = CliResponse.parse("{\"status\":0}");
    assertTrue(response.getRecords().isEmpty());
    assertTrue(response.getResultObject().isEmpty());
  }

  @Test
  public void parse_nonZeroStatus_usesToolMessage() throws Exception {
    try {
      CliResponse.parse("{\"status\":1,\"message\":\"No authorization found\"}");
      fail("expected RetrievalException");
    } catch (RetrievalException e) {
      assertEquals("No authorization found", e.getMessage());
      assertEquals(ErrorType.EXTERNAL_TOOL, e.getErrorType());
      assertEquals(Integer.valueOf(1), e.getExitCode().get());
    }
  }

  @Test
  public void parse_nonZeroStatusWithoutMessage_defaultMessage() throws Exception {
    thrown.expect(RetrievalException.class);
    thrown.expectMessage(CliResponse.DEFAULT_FAILURE_MESSAGE);
    CliResponse.parse("{\"status\":2}");
  }

  @Test
  public void parse_notJson_previewInMessage() throws Exception {
    String output = "Warning: " + Strings.repeat("x", 200);
    try {
      CliResponse.parse(output);
      fail("expected RetrievalException");
    } catch (RetrievalException e) {
      assertEquals("Invalid JSON response: " + output.substring(0, 100) + "...", e.getMessage());
    }
  }

  @Test
  public void parse_emptyOutput_throwsException() throws Exception {
    try {
      CliResponse.parse("  ");
      fail("expected RetrievalException");
    } catch (RetrievalException e) {
      assertThat(e.getMessage(), startsWith("Invalid JSON response"));
    }
  }

  @Test
  public void run_failureWithoutOutput_reportsStderr() throws Exception {
    List<String> command = ImmutableList.of("sf", "--version");
    when(mockExecutor.execute(eq(command), any(), anyLong()))
        .thenReturn(new CommandResult(127, "", "not found"));
    try {
      CliResponse.run(mockExecutor, command, null, 1000,
          new BackoffExceptionHandler(1, 0, TimeUnit.MILLISECONDS));
      fail("expected RetrievalException");
    } catch (RetrievalException e) {
      assertEquals("Command failed with code 127: not found", e.getMessage());
    }
    verify(mockExecutor, times(2)).execute(eq(command), any(), anyLong());
  }

  @Test
  public void run_failureWithJson_usesJsonMessage() throws Exception {
    List<String> command = ImmutableList.of("sf", "org", "list");
    when(mockExecutor.execute(eq(command), any(), anyLong()))
        .thenReturn(new CommandResult(1, "{\"status\":1,\"message\":\"expired\"}", ""));
    thrown.expect(RetrievalException.class);
    thrown.expectMessage("expired");
    CliResponse.run(mockExecutor, command, null, 1000,
        new BackoffExceptionHandler(0, 0, TimeUnit.MILLISECONDS));
  }
}
