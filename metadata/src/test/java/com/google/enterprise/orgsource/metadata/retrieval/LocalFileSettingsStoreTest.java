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
import static org.junit.Assert.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

import com.google.enterprise.orgsource.metadata.TargetWorkspace;
import com.google.enterprise.orgsource.metadata.retrieval.LocalFileSettingsStore.FileHelper;
import com.google.enterprise.orgsource.sdk.config.Configuration.ResetConfigRule;
import com.google.enterprise.orgsource.sdk.config.Configuration.SetupConfigRule;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;
import org.junit.rules.TemporaryFolder;

/** Tests for {@link LocalFileSettingsStore}. */
public class LocalFileSettingsStoreTest {
  @Rule public TemporaryFolder temporaryFolder = new TemporaryFolder();
  @Rule public ExpectedException thrown = ExpectedException.none();
  @Rule public ResetConfigRule resetConfig = new ResetConfigRule();
  @Rule public SetupConfigRule setupConfig = SetupConfigRule.uninitialized();

  private Path settingsFile;

  @Before
  public void setUp() {
    settingsFile = temporaryFolder.getRoot().toPath().resolve("nested/settings.json");
  }

  @Test
  public void get_missingFile_defaultValue() throws IOException {
    LocalFileSettingsStore store = new LocalFileSettingsStore(settingsFile);
    assertEquals("fallback", store.get("orgManifestConfigs", "fallback"));
    assertNull(store.get("orgManifestConfigs", null));
  }

  @Test
  public void set_createsFileAndKeepsOtherKeys() throws IOException {
    LocalFileSettingsStore store = new LocalFileSettingsStore(settingsFile);
    store.set("theme", "dark");
    store.set("orgManifestConfigs", "{\"targets\":{}}");
    String text = new String(Files.readAllBytes(settingsFile), UTF_8);
    assertThat(text, containsString("\"theme\" : \"dark\""));

    LocalFileSettingsStore reopened = new LocalFileSettingsStore(settingsFile);
    assertEquals("dark", reopened.get("theme", null));
    assertEquals("{\"targets\":{}}", reopened.get("orgManifestConfigs", null));
  }

  @Test
  public void set_null_removesKey() throws IOException {
    LocalFileSettingsStore store = new LocalFileSettingsStore(settingsFile);
    store.set("theme", "dark");
    store.set("theme", null);
    assertNull(store.get("theme", null));
  }

  @Test
  public void set_nullForAbsentKey_doesNotWrite() throws IOException {
    FileHelper fileHelper = spy(new FileHelper());
    LocalFileSettingsStore store = new LocalFileSettingsStore(settingsFile, fileHelper);
    store.set("theme", null);
    verify(fileHelper, never()).writeFile(any(File.class), any(byte[].class));
    assertFalse(Files.exists(settingsFile));
  }

  @Test
  public void get_blankFile_empty() throws IOException {
    Files.createDirectories(settingsFile.getParent());
    Files.write(settingsFile, "  \n".getBytes(UTF_8));
    assertNull(new LocalFileSettingsStore(settingsFile).get("theme", null));
  }

  @Test
  public void set_writeFails_propagates() throws IOException {
    FileHelper fileHelper = spy(new FileHelper());
    doThrow(new IOException("disk full")).when(fileHelper)
        .writeFile(any(File.class), any(byte[].class));
    LocalFileSettingsStore store = new LocalFileSettingsStore(settingsFile, fileHelper);
    thrown.expect(IOException.class);
    thrown.expectMessage("disk full");
    store.set("theme", "dark");
  }

  @Test
  public void get_emptyKey_throwsException() throws IOException {
    thrown.expect(IllegalArgumentException.class);
    new LocalFileSettingsStore(settingsFile).get("", null);
  }

  @Test
  public void fromConfiguration_defaultUnderRetrievalRoot() {
    Properties properties = new Properties();
    properties.put(TargetWorkspace.ROOT_DIRECTORY, temporaryFolder.getRoot().toString());
    setupConfig.initConfig(properties);
    assertEquals(
        temporaryFolder.getRoot().toPath().resolve(LocalFileSettingsStore.DEFAULT_FILE_NAME),
        LocalFileSettingsStore.fromConfiguration().getSettingsFile());
  }

  @Test
  public void fromConfiguration_explicitFile() {
    Properties properties = new Properties();
    properties.put(LocalFileSettingsStore.SETTINGS_FILE, settingsFile.toString());
    setupConfig.initConfig(properties);
    assertEquals(settingsFile, LocalFileSettingsStore.fromConfiguration().getSettingsFile());
  }
}
