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
package com.google.enterprise.orgsource.metadata.handlers;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.enterprise.orgsource.metadata.BuiltinTypes;
import com.google.enterprise.orgsource.metadata.HandlerConfig;
import com.google.enterprise.orgsource.metadata.HandlerContext;
import com.google.enterprise.orgsource.metadata.TargetWorkspace;
import com.google.enterprise.orgsource.metadata.analysis.ObjectAnalysis;
import com.google.enterprise.orgsource.metadata.analysis.ObjectAnalysis.FieldDescription;
import com.google.enterprise.orgsource.metadata.analysis.ObjectAnalysis.ObjectDescription;
import com.google.enterprise.orgsource.metadata.analysis.ObjectAnalysis.ValidationRuleDescription;
import com.google.enterprise.orgsource.sdk.batch.ChunkedExecutor;
import com.google.enterprise.orgsource.sdk.command.CliCommands;
import com.google.enterprise.orgsource.sdk.command.CliLocator;
import com.google.enterprise.orgsource.sdk.command.CommandExecutor;
import com.google.enterprise.orgsource.sdk.command.CommandResult;
import java.util.List;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

/** Tests for the object descriptions of {@link CustomObjectHandler}. */
@RunWith(MockitoJUnitRunner.class)
public class CustomObjectHandlerTest {
  private static final String TARGET_ID = "org1";
  private static final String USERNAME = "dev@example.com";
  private static final String INVOICE_DESCRIBE = "{\"status\":0,\"result\":{"
      + "\"label\":\"Invoice\",\"fields\":["
      + "{\"name\":\"Id\",\"label\":\"Record ID\",\"type\":\"id\",\"custom\":false},"
      + "{\"name\":\"Account__c\",\"label\":\"Account\",\"type\":\"reference\","
      + "\"custom\":true,\"nillable\":false,\"defaultedOnCreate\":false,"
      + "\"referenceTo\":[\"Account\"]},"
      + "{\"name\":\"Number__c\",\"label\":\"Number\",\"type\":\"string\",\"custom\":true,"
      + "\"nillable\":true,\"unique\":true,\"referenceTo\":[]},"
      + "{\"name\":\"Status__c\",\"label\":\"Status\",\"type\":\"picklist\",\"custom\":true,"
      + "\"nillable\":false,\"defaultedOnCreate\":true}]}}";
  private static final String INVOICE_RULES = "{\"status\":0,\"result\":{\"records\":["
      + "{\"ValidationName\":\"Positive_Amount\",\"Active\":true,"
      + "\"ErrorMessage\":\"Amount must be positive\",\"Description\":\"Amounts\"},"
      + "{\"ValidationName\":\"Legacy_Check\",\"Active\":false}]}}";

  @Rule public TemporaryFolder temporaryFolder = new TemporaryFolder();

  @Mock private CommandExecutor mockExecutor;
  @Mock private CliLocator mockLocator;

  private ChunkedExecutor chunkedExecutor;
  private CustomObjectHandler handler;

  @Before
  public void setUp() throws Exception {
    lenient().when(mockLocator.locate()).thenReturn("sf");
    chunkedExecutor = new ChunkedExecutor("test");
    HandlerContext context = new HandlerContext(mockExecutor, mockLocator,
        new TargetWorkspace(temporaryFolder.getRoot().toPath()), chunkedExecutor, "58.0", 0);
    handler = new CustomObjectHandler(BuiltinTypes.get(BuiltinTypes.CUSTOM_OBJECT),
        new HandlerConfig(true, true, 2, 0, 30000), context);
  }

  @After
  public void tearDown() {
    chunkedExecutor.close();
  }

  private void whenCommand(List<String> command, CommandResult result) throws Exception {
    when(mockExecutor.execute(eq(command), any(), anyLong())).thenReturn(result);
  }

  private static CommandResult success(String stdout) {
    return new CommandResult(0, stdout, "");
  }

  private static String rulesQuery(String objectName) {
    return "SELECT Id, ValidationName, Active, Description, ErrorMessage FROM ValidationRule "
        + "WHERE EntityDefinition.QualifiedApiName = '" + objectName + "'";
  }

  @Test
  public void describe_customFieldsAndRules() throws Exception {
    whenCommand(CliCommands.describeSObject("sf", "Invoice__c", USERNAME),
        success(INVOICE_DESCRIBE));
    whenCommand(CliCommands.toolingQuery("sf", rulesQuery("Invoice__c"), USERNAME),
        success(INVOICE_RULES));

    ObjectDescription invoice = handler.describe("Invoice__c", USERNAME);

    assertEquals("Invoice", invoice.getLabel());
    assertEquals(3, invoice.getFields().size());
    FieldDescription account = invoice.getFields().get(0);
    assertEquals("Account__c", account.getName());
    assertEquals("reference", account.getType());
    assertTrue(account.isRequired());
    assertFalse(account.isUnique());
    assertEquals(ImmutableList.of("Account"), account.getReferenceTo());
    FieldDescription number = invoice.getFields().get(1);
    assertFalse(number.isRequired());
    assertTrue(number.isUnique());
    assertFalse(invoice.getFields().get(2).isRequired());
    ValidationRuleDescription rule = invoice.getValidationRules().get(0);
    assertEquals("Positive_Amount", rule.getName());
    assertTrue(rule.isActive());
    assertEquals("Amount must be positive", rule.getErrorMessage());
    assertFalse(invoice.getValidationRules().get(1).isActive());
  }

  @Test
  public void describe_rulesQueryFails_fieldsKept() throws Exception {
    whenCommand(CliCommands.describeSObject("sf", "Invoice__c", USERNAME),
        success(INVOICE_DESCRIBE));
    whenCommand(CliCommands.toolingQuery("sf", rulesQuery("Invoice__c"), USERNAME),
        new CommandResult(1, "", "INVALID_TYPE: sObject type 'ValidationRule' is not supported"));

    ObjectDescription invoice = handler.describe("Invoice__c", USERNAME);

    assertEquals(3, invoice.getFields().size());
    assertTrue(invoice.getValidationRules().isEmpty());
  }

  @Test
  public void analyze_undescribableObjectKeptEmpty() throws Exception {
    whenCommand(CliCommands.listMetadata("sf", "CustomObject", USERNAME),
        success("{\"status\":0,\"result\":[{\"fullName\":\"Invoice__c\"},"
            + "{\"fullName\":\"Broken__c\"}]}"));
    whenCommand(CliCommands.describeSObject("sf", "Invoice__c", USERNAME),
        success(INVOICE_DESCRIBE));
    whenCommand(CliCommands.toolingQuery("sf", rulesQuery("Invoice__c"), USERNAME),
        success(INVOICE_RULES));
    whenCommand(CliCommands.describeSObject("sf", "Broken__c", USERNAME),
        new CommandResult(1, "", "The requested resource does not exist"));

    ObjectAnalysis analysis = handler.analyze(TARGET_ID, USERNAME);

    assertEquals(2, analysis.getObjects().size());
    ObjectDescription broken = analysis.getObjects().get(0);
    assertEquals("Broken__c", broken.getName());
    assertEquals("Broken__c", broken.getLabel());
    assertTrue(broken.getFields().isEmpty());
    assertEquals(3, analysis.getFieldCount());
    assertEquals(1, analysis.getRequiredFieldCount());
    assertEquals(1, analysis.getUniqueFieldCount());
    assertEquals(2, analysis.getValidationRuleCount());
    assertEquals(1, analysis.getActiveValidationRuleCount());
    assertEquals(ImmutableMap.of("Invoice__c", ImmutableList.of("Account")),
        analysis.getRelationships());
  }
}
