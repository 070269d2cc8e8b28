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
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.enterprise.orgsource.metadata.HandlerConfig.Priority;
import com.google.enterprise.orgsource.metadata.handlers.ApexHandler;
import com.google.enterprise.orgsource.metadata.handlers.AuraHandler;
import com.google.enterprise.orgsource.metadata.handlers.CustomObjectHandler;
import com.google.enterprise.orgsource.metadata.handlers.GeneralMetadataHandler;
import com.google.enterprise.orgsource.metadata.handlers.LwcHandler;
import com.google.enterprise.orgsource.metadata.retrieval.InMemorySettingsStore;
import com.google.enterprise.orgsource.metadata.retrieval.ManifestSettings;
import com.google.enterprise.orgsource.metadata.retrieval.SourceRetrievalCoordinator;
import com.google.enterprise.orgsource.metadata.retrieval.Target;
import com.google.enterprise.orgsource.sdk.RetrievalException;
import com.google.enterprise.orgsource.sdk.batch.ChunkedExecutor;
import com.google.enterprise.orgsource.sdk.batch.ProcessingResult;
import com.google.enterprise.orgsource.sdk.command.CliLocator;
import com.google.enterprise.orgsource.sdk.command.CommandExecutor;
import com.google.enterprise.orgsource.sdk.command.CommandResult;
import com.google.enterprise.orgsource.sdk.config.Configuration.ResetConfigRule;
import com.google.enterprise.orgsource.sdk.config.Configuration.SetupConfigRule;
import java.util.Properties;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

/** Tests for {@link OrgSourceManager}. */
@RunWith(MockitoJUnitRunner.class)
public class OrgSourceManagerTest {
  @Rule public TemporaryFolder temporaryFolder = new TemporaryFolder();
  @Rule public ExpectedException thrown = ExpectedException.none();
  @Rule public ResetConfigRule resetConfig = new ResetConfigRule();
  @Rule public SetupConfigRule setupConfig = SetupConfigRule.uninitialized();

  @Mock private CommandExecutor mockExecutor;
  @Mock private CliLocator mockLocator;

  private ChunkedExecutor chunkedExecutor;
  private HandlerContext context;
  private TypeRegistry registry;
  private OrgSourceManager manager;

  @Before
  public void setUp() throws Exception {
    chunkedExecutor = new ChunkedExecutor("test");
    context = new HandlerContext(mockExecutor, mockLocator,
        new TargetWorkspace(temporaryFolder.getRoot().toPath()), chunkedExecutor, "58.0", 0);
    registry = new TypeRegistry(chunkedExecutor);
    ManifestSettings settings = new ManifestSettings(new InMemorySettingsStore(), "58.0");
    manager = new OrgSourceManager(chunkedExecutor, MoreExecutors.newDirectExecutorService(),
        context, HandlerSettings.defaults(), registry,
        new ParallelProcessor(registry, chunkedExecutor),
        new SourceRetrievalCoordinator(context, settings, MoreExecutors.newDirectExecutorService(),
            60000, 0),
        settings);
  }

  @After
  public void tearDown() {
    manager.close();
  }

  @Test
  public void createBuiltinHandler_perType() {
    assertHandler(ApexHandler.class, BuiltinTypes.APEX_CLASS);
    assertHandler(LwcHandler.class, BuiltinTypes.LIGHTNING_COMPONENT_BUNDLE);
    assertHandler(AuraHandler.class, BuiltinTypes.AURA_DEFINITION_BUNDLE);
    assertHandler(CustomObjectHandler.class, BuiltinTypes.CUSTOM_OBJECT);
    assertHandler(GeneralMetadataHandler.class, BuiltinTypes.PERMISSION_SET);
    assertFalse(OrgSourceManager.createBuiltinHandler(
        new TypeDefinition.Builder(BuiltinTypes.CUSTOM_FIELD).build(), HandlerConfig.DEFAULT,
        context).isPresent());
  }

  private void assertHandler(Class<?> expected, String typeName) {
    MetadataHandler handler = OrgSourceManager.createBuiltinHandler(
        BuiltinTypes.get(typeName), HandlerConfig.DEFAULT, context).get();
    assertEquals(expected, handler.getClass());
    assertEquals(typeName, handler.getDefinition().getName());
  }

  @Test
  public void createBuiltinHandler_apexTrigger_sharedApexHandler() {
    MetadataHandler handler = OrgSourceManager.createBuiltinHandler(
        BuiltinTypes.get(BuiltinTypes.APEX_TRIGGER), HandlerConfig.DEFAULT, context).get();
    assertEquals(ApexHandler.class, handler.getClass());
    assertTrue(handler.supports(BuiltinTypes.APEX_CLASS));
    assertTrue(handler.supports(BuiltinTypes.APEX_TRIGGER));
  }

  @Test
  public void registerBuiltinHandlers_apexTypesShareOneHandler() {
    OrgSourceManager.registerBuiltinHandlers(registry, context, HandlerConfig::defaultsFor);
    assertSame(registry.getHandler("ApexClass").get(), registry.getHandler("ApexTrigger").get());
  }

  @Test
  public void registerBuiltinHandlers_apexTriggerDisabled_classesOnly() {
    OrgSourceManager.registerBuiltinHandlers(registry, context,
        type -> "ApexTrigger".equals(type)
            ? HandlerConfig.defaultsFor(type).withEnabled(false)
            : HandlerConfig.defaultsFor(type));
    assertTrue(registry.isTypeSupported("ApexClass"));
    assertFalse(registry.isTypeSupported("ApexTrigger"));
  }

  @Test
  public void registerBuiltinHandlers_skipsDisabled() {
    OrgSourceManager.registerBuiltinHandlers(registry, context, HandlerConfig::defaultsFor);
    assertTrue(manager.isTypeSupported("ApexClass"));
    assertTrue(manager.isTypeSupported("Flow"));
    assertFalse(manager.isTypeSupported("Profile"));
    assertFalse(manager.isTypeSupported("Report"));
    assertFalse(manager.isTypeSupported("CustomField"));
    assertTrue(manager.getTypeDefinition("Report").isPresent());
    assertEquals(ImmutableList.of("AuraDefinitionBundle", "LightningComponentBundle"),
        registry.getBundleTypes());
  }

  @Test
  public void listItems_invalidIdentifier_throwsException() {
    thrown.expect(IllegalArgumentException.class);
    thrown.expectMessage("Invalid org identifier");
    try {
      manager.listItems(new Target("org1", "-rf", null),
          QueryOptions.forTypes(ImmutableList.of("ApexClass")));
    } finally {
      verifyNoInteractions(mockExecutor);
    }
  }

  @Test
  public void listItems_throughRegisteredHandlers() throws Exception {
    OrgSourceManager.registerBuiltinHandlers(registry, context, HandlerConfig::defaultsFor);
    when(mockLocator.locate()).thenReturn("sf");
    when(mockExecutor.execute(anyList(), any(), anyLong())).thenReturn(new CommandResult(0,
        "{\"status\":0,\"result\":[{\"fullName\":\"Onboard\"}]}", ""));
    ProcessingResult<TypeItems> result = manager.listItems(new Target("org1", "dev@x.com", null),
        QueryOptions.forTypes(ImmutableList.of("Flow", "Profile")));
    assertEquals("Onboard.flow-meta.xml",
        result.getSuccess().get(0).getItems().get(0).getName());
    assertEquals(TypeRegistry.NO_HANDLER + "Profile", result.getFailures().get(0).getError());
    assertEquals(50.0, manager.getProcessingStats(result).getSuccessRate(), 0.001);
  }

  @Test
  public void setProcessorSettings_clamped() {
    manager.setProcessorConcurrency(100);
    manager.setProcessorTimeout(1);
    assertEquals(10, manager.getProcessor().getDefaultConcurrency());
    assertEquals(1000, manager.getProcessor().getDefaultTimeoutMillis());
  }

  @Test
  public void enableType_registersHandler() {
    OrgSourceManager.registerBuiltinHandlers(registry, context, HandlerConfig::defaultsFor);
    assertFalse(manager.isTypeSupported("Profile"));
    assertTrue(manager.enableType("Profile"));
    assertTrue(manager.isTypeSupported("Profile"));
    assertTrue(manager.getHandlerSettings().get("Profile").isEnabled());
    assertEquals(GeneralMetadataHandler.class, registry.getHandler("Profile").get().getClass());
  }

  @Test
  public void enableType_reusesSharedHandler() {
    OrgSourceManager.registerBuiltinHandlers(registry, context,
        type -> "ApexTrigger".equals(type)
            ? HandlerConfig.defaultsFor(type).withEnabled(false)
            : HandlerConfig.defaultsFor(type));
    assertTrue(manager.enableType("ApexTrigger"));
    assertSame(registry.getHandler("ApexClass").get(), registry.getHandler("ApexTrigger").get());
  }

  @Test
  public void disableType_removesHandler() {
    OrgSourceManager.registerBuiltinHandlers(registry, context, HandlerConfig::defaultsFor);
    assertTrue(manager.disableType("Flow"));
    assertFalse(manager.isTypeSupported("Flow"));
    assertFalse(manager.getHandlerSettings().get("Flow").isEnabled());
    assertTrue(manager.getTypeDefinition("Flow").isPresent());
  }

  @Test
  public void enableAndDisableType_unknownType_false() {
    assertFalse(manager.enableType("Unknown"));
    assertFalse(manager.disableType("Unknown"));
    assertFalse(manager.isTypeSupported("Unknown"));
  }

  @Test
  public void getTypesByPriority_enabledTypesOnly() {
    assertEquals(ImmutableList.of("CustomLabels", "CustomMetadata"),
        manager.getTypesByPriority(Priority.LOW));
  }

  @Test
  public void getConfigurationSummary_counts() {
    OrgSourceManager.registerBuiltinHandlers(registry, context, HandlerConfig::defaultsFor);
    ConfigurationSummary summary = manager.getConfigurationSummary();
    assertEquals(BuiltinTypes.all().size(), summary.getTotalTypes());
    assertEquals(11, summary.getSupportedTypes());
    assertEquals(10, summary.getHandlerCount());
    assertEquals(BuiltinTypes.all().size(), summary.getSettings().getTotal());
    assertEquals(11, summary.getSettings().getEnabled());
    assertEquals(4, summary.getSettings().getCount(Priority.HIGH));
  }

  @Test
  public void validateConfiguration_defaults_noProblems() {
    assertEquals(ImmutableList.of(), manager.validateConfiguration());
  }

  @Test
  public void analyzeTarget_countsEnabledTypes() throws Exception {
    OrgSourceManager.registerBuiltinHandlers(registry, context, HandlerConfig::defaultsFor);
    for (String type : ImmutableList.copyOf(manager.getHandlerSettings().getEnabledTypes())) {
      if (!"Flow".equals(type) && !"Layout".equals(type)) {
        manager.disableType(type);
      }
    }
    when(mockLocator.locate()).thenReturn("sf");
    when(mockExecutor.execute(anyList(), any(), anyLong())).thenReturn(new CommandResult(0,
        "{\"status\":0,\"result\":[{\"fullName\":\"Onboard\"},{\"fullName\":\"Exit\"}]}",
        ""));
    Target target = new Target("org1", "dev@x.com", null);
    TargetAnalysis analysis = manager.analyzeTarget(target);
    assertEquals(target, analysis.getTarget());
    assertEquals(2, analysis.getTypeCount());
    assertEquals(4, analysis.getTotalItems());
    assertEquals(ImmutableMap.of("Flow", 2, "Layout", 2), analysis.getItemsByType());
  }

  @Test
  public void discoverTargets_authorizedOrgs() throws Exception {
    when(mockLocator.locate()).thenReturn("sf");
    when(mockExecutor.getDefaultTimeoutMillis()).thenReturn(60000L);
    when(mockExecutor.execute(anyList(), any(), anyLong())).thenReturn(new CommandResult(0,
        "{\"status\":0,\"result\":{\"nonScratchOrgs\":[{\"username\":\"dev@x.com\","
            + "\"orgId\":\"00D000000000001AAA\",\"alias\":\"dev\"}]}}",
        ""));
    assertEquals(ImmutableList.of(new Target("00D000000000001AAA", "dev@x.com", "dev")),
        manager.discoverTargets());
  }

  @Test
  public void analyzeApex_noHandler_throwsException() throws Exception {
    thrown.expect(RetrievalException.class);
    thrown.expectMessage(TypeRegistry.NO_HANDLER + "ApexClass");
    manager.analyzeApex(new Target("org1", "dev@x.com", null));
  }

  @Test
  public void getBundleStructure_notABundle_throwsException() throws Exception {
    OrgSourceManager.registerBuiltinHandlers(registry, context, HandlerConfig::defaultsFor);
    thrown.expect(RetrievalException.class);
    thrown.expectMessage("Flow items are not component bundles");
    manager.getBundleStructure(new Target("org1", "dev@x.com", null),
        new Item.Builder("org1", "Flow", "Onboard").build());
  }

  @Test
  public void getComponentDependencies_lwcHandlerForAura_throwsException() throws Exception {
    registry.registerHandler(BuiltinTypes.AURA_DEFINITION_BUNDLE, OrgSourceManager
        .createBuiltinHandler(BuiltinTypes.get(BuiltinTypes.LIGHTNING_COMPONENT_BUNDLE),
            HandlerConfig.DEFAULT, context).get());
    thrown.expect(RetrievalException.class);
    thrown.expectMessage("AuraDefinitionBundle is served by LwcHandler, not AuraHandler");
    manager.getComponentDependencies(new Target("org1", "dev@x.com", null),
        new Item.Builder("org1", "AuraDefinitionBundle", "card").build());
  }

  @Test
  public void fromConfiguration_wiresEnabledHandlers() throws Exception {
    Properties properties = new Properties();
    properties.put(TargetWorkspace.ROOT_DIRECTORY, temporaryFolder.getRoot().toString());
    properties.put("metadata.Profile.enabled", "true");
    properties.put("metadata.Flow.enabled", "false");
    properties.put(ParallelProcessor.MAX_CONCURRENCY, "2");
    properties.put("metadata.Flow.maxConcurrency", "0");
    properties.put(HandlerSettings.TUNING, "largeOrg");
    setupConfig.initConfig(properties);
    try (OrgSourceManager configured = OrgSourceManager.fromConfiguration()) {
      assertTrue(configured.isTypeSupported("Profile"));
      assertEquals(ImmutableList.of(
          new HandlerSettings.Problem("Flow", "Max concurrency must be at least 1")),
          configured.validateConfiguration());
      assertEquals(5, configured.getHandlerSettings().get("Profile").getRetryCount());
      assertFalse(configured.isTypeSupported("Flow"));
      assertEquals(2, configured.getProcessor().getDefaultConcurrency());
      assertEquals("58.0",
          configured.getManifestSettings().getConfig("org1").getApiVersion());
    }
  }

  @Test
  public void fromConfiguration_notInitialized_throwsException() throws Exception {
    thrown.expect(IllegalStateException.class);
    OrgSourceManager.fromConfiguration();
  }
}
