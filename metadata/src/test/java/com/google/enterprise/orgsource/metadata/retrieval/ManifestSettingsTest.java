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
package com.google.enterprise.orgsource.metadata.retrieval;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.enterprise.orgsource.metadata.retrieval.ManifestSettings.ManifestStats;
import com.google.enterprise.orgsource.metadata.retrieval.ManifestTypes.ManifestType;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.stream.Collectors;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;
import org.junit.rules.TemporaryFolder;

/** Tests for {@link ManifestSettings}. */
public class ManifestSettingsTest {
  private static final Instant NOW = Instant.parse("2024-03-01T10:15:30Z");
  private static final String TARGET_ID = "00D000000000001";

  @Rule public ExpectedException thrown = ExpectedException.none();
  @Rule public TemporaryFolder temporaryFolder = new TemporaryFolder();

  private InMemorySettingsStore store;
  private ManifestSettings settings;

  @Before
  public void setUp() throws IOException {
    store = new InMemorySettingsStore();
    settings = new ManifestSettings(store, "58.0", Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private ManifestSettings reload() throws IOException {
    return new ManifestSettings(store, "58.0", Clock.fixed(Instant.EPOCH, ZoneOffset.UTC));
  }

  @Test
  public void getConfig_unknownTarget_defaultsNotSaved() throws IOException {
    TargetManifestConfig config = settings.getConfig(TARGET_ID);
    assertEquals(ManifestTypes.defaultEnabledNames(), config.getEnabledTypes());
    assertEquals("58.0", config.getApiVersion());
    assertTrue(config.getCustomMembers().isEmpty());
    assertEquals(null, store.get(ManifestSettings.STORE_KEY, null));
  }

  @Test
  public void setEnabledTypes_persistedAndReloaded() throws IOException {
    settings.setEnabledTypes(TARGET_ID, ImmutableList.of("Flow", "ApexClass"));
    settings.setAlias(TARGET_ID, "prod");
    ManifestSettings reloaded = reload();
    TargetManifestConfig config = reloaded.getConfig(TARGET_ID);
    assertEquals(ImmutableList.of("Flow", "ApexClass"), config.getEnabledTypes());
    assertEquals("prod", config.getAlias().get());
    assertEquals(NOW, config.getLastModified());
    assertEquals(ImmutableList.of(TARGET_ID), reloaded.getConfiguredTargetIds());
  }

  @Test
  public void setEnabledTypes_unknownType_throwsException() throws IOException {
    thrown.expect(IllegalArgumentException.class);
    thrown.expectMessage("Unknown manifest type: Widget");
    settings.setEnabledTypes(TARGET_ID, ImmutableList.of("Flow", "Widget"));
  }

  @Test
  public void getEnabledTypes_catalogueOrder() throws IOException {
    settings.setEnabledTypes(TARGET_ID, ImmutableList.of("Profile", "ApexTrigger"));
    assertEquals(ImmutableList.of("ApexTrigger", "Profile"),
        settings.getEnabledTypes(TARGET_ID).stream()
            .map(ManifestType::getName)
            .collect(Collectors.toList()));
  }

  @Test
  public void setMembers_emptyListRestoresWildcard() throws IOException {
    settings.setMembers(TARGET_ID, "ApexClass", ImmutableList.of("AccountService"));
    assertThat(settings.generateManifest(TARGET_ID),
        containsString("<members>AccountService</members>\n        <name>ApexClass</name>"));
    settings.setMembers(TARGET_ID, "ApexClass", ImmutableList.of());
    assertFalse(reload().getConfig(TARGET_ID).getCustomMembers().containsKey("ApexClass"));
    assertThat(settings.generateManifest(TARGET_ID),
        containsString("<members>*</members>\n        <name>ApexClass</name>"));
  }

  @Test
  public void writeManifest_usesApiVersion() throws IOException {
    settings.enableCoreTypesOnly(TARGET_ID);
    settings.setApiVersion(TARGET_ID, "60.0");
    Path file = settings.writeManifest(
        TARGET_ID, temporaryFolder.getRoot().toPath().resolve("package.xml"));
    String xml = new String(Files.readAllBytes(file), UTF_8);
    assertThat(xml, containsString("<version>60.0</version>"));
    assertThat(xml, containsString("<name>CustomObject</name>"));
  }

  @Test
  public void resetToDefault_dropsMembersAndVersion() throws IOException {
    settings.enableAll(TARGET_ID);
    settings.setMembers(TARGET_ID, "Flow", ImmutableList.of("Onboard"));
    settings.setApiVersion(TARGET_ID, "61.0");
    settings.resetToDefault(TARGET_ID);
    TargetManifestConfig config = settings.getConfig(TARGET_ID);
    assertEquals(ManifestTypes.defaultEnabledNames(), config.getEnabledTypes());
    assertTrue(config.getCustomMembers().isEmpty());
    assertEquals("58.0", config.getApiVersion());
  }

  @Test
  public void getStats_countsCategories() throws IOException {
    ManifestStats stats = settings.getStats(TARGET_ID);
    assertEquals(29, stats.getTotalAvailableTypes());
    assertEquals(9, stats.getEnabledTypes());
    assertEquals(20, stats.getDisabledTypes());
    assertEquals(6, stats.getCategoriesUsed());
    settings.enableAll(TARGET_ID);
    assertEquals(11, settings.getStats(TARGET_ID).getCategoriesUsed());
    assertEquals(NOW, settings.getStats(TARGET_ID).getLastModified());
  }

  @Test
  public void removeTarget_forgetsSettings() throws IOException {
    settings.setApiVersion(TARGET_ID, "59.0");
    settings.removeTarget(TARGET_ID);
    settings.removeTarget("never-configured");
    assertTrue(reload().getConfiguredTargetIds().isEmpty());
  }

  @Test
  public void load_storedFormWithMissingFields() throws IOException {
    store.set(ManifestSettings.STORE_KEY,
        "{\"targets\":{\"org2\":{\"enabledMetadataTypes\":[\"Flow\"],"
            + "\"customMembers\":{\"Flow\":[\"A\",\"B\"]}}}}");
    TargetManifestConfig config = reload().getConfig("org2");
    assertEquals(ImmutableList.of("Flow"), config.getEnabledTypes());
    assertEquals(ImmutableMap.of("Flow", ImmutableList.of("A", "B")), config.getCustomMembers());
    assertEquals("58.0", config.getApiVersion());
    assertEquals(Instant.EPOCH, config.getLastModified());
    assertFalse(config.getAlias().isPresent());
  }

  @Test
  public void load_malformed_throwsException() throws IOException {
    store.set(ManifestSettings.STORE_KEY, "{\"targets\": [1, 2");
    thrown.expect(IOException.class);
    reload();
  }
}
