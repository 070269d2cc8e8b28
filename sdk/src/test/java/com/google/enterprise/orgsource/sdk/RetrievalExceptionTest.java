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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import com.google.enterprise.orgsource.sdk.RetrievalException.ErrorType;
import java.util.Optional;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.junit.MockitoJUnitRunner;

/** Tests for {@link RetrievalException}. */
@RunWith(MockitoJUnitRunner.class)
public class RetrievalExceptionTest {

  @Test
  public void build_noData_unknownType() {
    RetrievalException exception = new RetrievalException.Builder().build();
    assertEquals(ErrorType.UNKNOWN, exception.getErrorType());
    assertNull(exception.getMessage());
    assertFalse(exception.getExitCode().isPresent());
  }

  @Test
  public void build_withMessageAndCause() {
    RetrievalException exception = new RetrievalException.Builder()
        .setErrorMessage("error message")
        .setCause(new Throwable("cause"))
        .build();
    assertEquals("error message", exception.getMessage());
    assertEquals("cause", exception.getCause().getMessage());
  }

  @Test
  public void build_withTypeAndExitCode() {
    RetrievalException exception = new RetrievalException.Builder()
        .setErrorType(ErrorType.EXTERNAL_TOOL)
        .setExitCode(1)
        .build();
    assertEquals(ErrorType.EXTERNAL_TOOL, exception.getErrorType());
    assertEquals(Optional.of(1), exception.getExitCode());
    assertTrue(exception.toString().contains("exitCode=1"));
  }

  @Test
  public void setErrorType_null_unknown() {
    RetrievalException exception = new RetrievalException.Builder().setErrorType(null).build();
    assertEquals(ErrorType.UNKNOWN, exception.getErrorType());
  }
}
