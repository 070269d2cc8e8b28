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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.enterprise.orgsource.sdk.RetrievalException;
import com.google.enterprise.orgsource.sdk.RetrievalException.ErrorType;
import com.google.enterprise.orgsource.sdk.batch.ChunkedExecutor;
import com.google.enterprise.orgsource.sdk.batch.ProcessingResult;
import java.util.List;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

/** Tests for {@link TypeRegistry}. */
@RunWith(MockitoJUnitRunner.class)
public class TypeRegistryTest {
  private static final String TARGET_ID = "org1";
  private static final String USERNAME = "dev@example.com";

  @Mock private MetadataHandler apexHandler;
  @Mock private MetadataHandler lwcHandler;

  private ChunkedExecutor executor;
  private TypeRegistry registry;

  @Before
  public void setUp() {
    lenient().when(apexHandler.getDefinition())
        .thenReturn(BuiltinTypes.get(BuiltinTypes.APEX_CLASS));
    lenient().when(apexHandler.getSupportedTypes()).thenReturn(ImmutableSet.of("ApexClass"));
    lenient().when(lwcHandler.getDefinition())
        .thenReturn(BuiltinTypes.get(BuiltinTypes.LIGHTNING_COMPONENT_BUNDLE));
    executor = new ChunkedExecutor("test");
    registry = new TypeRegistry(executor);
  }

  @After
  public void tearDown() {
    executor.close();
  }

  private static Item item(String type, String name) {
    return new Item.Builder(TARGET_ID, type, name).build();
  }

  @Test
  public void newRegistry_definitionsWithoutHandlers() {
    assertTrue(registry.listSupportedTypes().isEmpty());
    assertTrue(registry.getDefinition("Flow").isPresent());
    assertEquals(BuiltinTypes.all().size(), registry.getAllDefinitions().size());
    assertFalse(registry.isTypeSupported("Flow"));
  }

  @Test
  public void queries_overSupportedTypes() {
    registry.register(apexHandler);
    registry.registerHandler("LightningComponentBundle", lwcHandler);
    assertEquals(ImmutableList.of("ApexClass", "LightningComponentBundle"),
        registry.listSupportedTypes());
    assertEquals(ImmutableList.of("LightningComponentBundle"), registry.getBundleTypes());
    assertEquals(ImmutableList.of("ApexClass"),
        registry.getTypesByOperation(SupportedOperation.QUERY));
    assertEquals(ImmutableList.of("ApexClass"),
        registry.getTypesByStrategy(RetrievalStrategy.TOOLING_QUERY));
    assertEquals(2, registry.getAllHandlers().size());
  }

  @Test
  public void registerHandler_customType_definitionAdded() {
    TypeDefinition custom = new TypeDefinition.Builder("Territory2").build();
    when(lwcHandler.getDefinition()).thenReturn(custom);
    registry.registerHandler("Territory2", lwcHandler);
    assertEquals(custom, registry.getDefinition("Territory2").get());
  }

  @Test
  public void registerHandler_again_replaces() {
    registry.registerHandler("ApexClass", apexHandler);
    registry.registerHandler("ApexClass", lwcHandler);
    assertEquals(lwcHandler, registry.getHandler("ApexClass").get());
    assertEquals(BuiltinTypes.get("ApexClass"), registry.getDefinition("ApexClass").get());
  }

  @Test
  public void requireHandler_missing_unregisteredType() {
    try {
      registry.requireHandler("Flow");
      fail("expected RetrievalException");
    } catch (RetrievalException e) {
      assertEquals(ErrorType.UNREGISTERED_TYPE, e.getErrorType());
      assertEquals(TypeRegistry.NO_HANDLER + "Flow", e.getMessage());
    }
  }

  @Test
  public void unregisterHandler_definitionKept() {
    registry.register(apexHandler);
    assertEquals(apexHandler, registry.unregisterHandler("ApexClass").get());
    assertFalse(registry.isTypeSupported("ApexClass"));
    assertTrue(registry.getDefinition("ApexClass").isPresent());
    assertFalse(registry.unregisterHandler("ApexClass").isPresent());
  }

  @Test
  public void getFilesForTypes_sharedHandler_listedPerType() throws Exception {
    when(apexHandler.getSupportedTypes())
        .thenReturn(ImmutableSet.of("ApexClass", "ApexTrigger"));
    registry.register(apexHandler);
    Item apexClass = item("ApexClass", "A");
    Item apexTrigger = item("ApexTrigger", "T");
    when(apexHandler.listItems(TARGET_ID, USERNAME, "ApexClass"))
        .thenReturn(ImmutableList.of(apexClass));
    when(apexHandler.listItems(TARGET_ID, USERNAME, "ApexTrigger"))
        .thenReturn(ImmutableList.of(apexTrigger));
    ProcessingResult<TypeItems> result = registry.getFilesForTypes(TARGET_ID, USERNAME,
        ImmutableList.of("ApexClass", "ApexTrigger"));
    assertEquals(ImmutableList.of(
            new TypeItems("ApexClass", ImmutableList.of(apexClass)),
            new TypeItems("ApexTrigger", ImmutableList.of(apexTrigger))),
        result.getSuccess());
    assertEquals(1, registry.getAllHandlers().size());
  }

  @Test
  public void getFilesForTypes_failuresIsolated() throws Exception {
    registry.register(apexHandler);
    registry.registerHandler("LightningComponentBundle", lwcHandler);
    Item apex = item("ApexClass", "A");
    when(apexHandler.listItems(TARGET_ID, USERNAME, "ApexClass"))
        .thenReturn(ImmutableList.of(apex));
    when(lwcHandler.listItems(TARGET_ID, USERNAME, "LightningComponentBundle")).thenThrow(
        new RetrievalException.Builder().setErrorMessage("boom").build());
    ProcessingResult<TypeItems> result = registry.getFilesForTypes(TARGET_ID, USERNAME,
        ImmutableList.of("ApexClass", "LightningComponentBundle", "Flow"));
    assertEquals(ImmutableList.of(new TypeItems("ApexClass", ImmutableList.of(apex))),
        result.getSuccess());
    assertEquals(2, result.getFailures().size());
    assertEquals("boom", result.getFailures().get(0).getError());
    assertEquals(TypeRegistry.NO_HANDLER + "Flow", result.getFailures().get(1).getError());
  }

  @Test
  public void getContentForFiles_groupsByType() {
    registry.register(apexHandler);
    Item a = item("ApexClass", "A");
    Item b = item("ApexClass", "B");
    Item flow = item("Flow", "F");
    ProcessingResult<ItemContent> apexResult = new ProcessingResult.Builder<ItemContent>()
        .addSuccess(new ItemContent(a, TextContent.of("a")))
        .addFailure(b, "No ApexClass found with name: B")
        .build(5);
    when(apexHandler.fetchContentBatch(eq(TARGET_ID), eq(USERNAME), anyList()))
        .thenReturn(apexResult);

    ProcessingResult<ItemContent> result =
        registry.getContentForFiles(TARGET_ID, USERNAME, ImmutableList.of(a, flow, b));

    verify(apexHandler).fetchContentBatch(TARGET_ID, USERNAME, ImmutableList.of(a, b));
    assertEquals(ImmutableList.of(new ItemContent(a, TextContent.of("a"))), result.getSuccess());
    List<ProcessingResult.Failure> failures = result.getFailures();
    assertEquals(2, failures.size());
    assertTrue(failures.contains(
        new ProcessingResult.Failure(b, "No ApexClass found with name: B")));
    assertTrue(failures.contains(
        new ProcessingResult.Failure(flow, TypeRegistry.NO_HANDLER + "Flow")));
  }

  @Test
  public void clear_restoresBuiltins() {
    registry.registerDefinition(new TypeDefinition.Builder("Territory2").build());
    registry.register(apexHandler);
    registry.clear();
    assertTrue(registry.listSupportedTypes().isEmpty());
    assertFalse(registry.getDefinition("Territory2").isPresent());
    assertTrue(registry.getDefinition("ApexClass").isPresent());
  }
}
