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
package com.google.enterprise.orgsource.sdk.config;

import static java.nio.charset.StandardCharsets.ISO_8859_1;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.Mockito.verify;

import com.google.enterprise.orgsource.sdk.InvalidConfigurationException;
import com.google.enterprise.orgsource.sdk.config.Configuration.Parser;
import com.google.enterprise.orgsource.sdk.config.Configuration.ResetConfigRule;
import com.google.enterprise.orgsource.sdk.config.Configuration.SetupConfigRule;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.mockito.Mockito;
import org.mockito.junit.MockitoJUnitRunner;

/** Tests for {@link Configuration}. */
@RunWith(MockitoJUnitRunner.class)
public class ConfigurationTest {

  @Rule public ExpectedException thrown = ExpectedException.none();
  @Rule public ResetConfigRule resetConfig = new ResetConfigRule();
  @Rule public SetupConfigRule setupConfig = SetupConfigRule.uninitialized();
  @Rule public TemporaryFolder temporaryFolder = new TemporaryFolder();

  @Test
  public void getConfig_notInitialized_throwsIllegalState() {
    thrown.expect(IllegalStateException.class);
    Configuration.getConfig();
  }

  @Test
  public void initConfig_callTwiceWithDifferentProperties_throwsException() {
    Properties config = new Properties();
    config.setProperty("cli.timeout", "1000");
    Properties config2 = new Properties();
    config2.setProperty("cli.timeout", "2000");
    Configuration.initConfig(config);
    thrown.expect(IllegalStateException.class);
    Configuration.initConfig(config2);
  }

  @Test
  public void initConfig_callTwiceWithEqualProperties_succeeds() {
    Properties config1 = new Properties();
    config1.setProperty("foo", "bar");
    Properties config2 = new Properties();
    config2.setProperty("foo", "bar");
    Configuration.initConfig(config1);
    Configuration.initConfig(config2);
    assertTrue(Configuration.isInitialized());
  }

  @Test
  public void get_beforeInitConfig_throwsIllegalState() {
    ConfigValue<Boolean> booleanParam = Configuration.getBoolean("metadata.enabled", true);
    thrown.expect(IllegalStateException.class);
    booleanParam.get();
  }

  @Test
  public void getBoolean_configured_overridesDefaultIgnoringCase() {
    ConfigValue<Boolean> booleanParam = Configuration.getBoolean("metadata.enabled", true);
    assertFalse(booleanParam.isInitialized());
    assertEquals(true, booleanParam.getDefault());
    Properties config = new Properties();
    config.put("metadata.enabled", "FALSE");
    Configuration.initConfig(config);
    assertFalse(booleanParam.get());
  }

  @Test
  public void initConfig_malformedBoolean_throwsInvalidConfiguration() {
    Configuration.getBoolean("metadata.enabled", true);
    Properties config = new Properties();
    config.put("metadata.enabled", "other");
    thrown.expect(InvalidConfigurationException.class);
    Configuration.initConfig(config);
  }

  @Test
  public void getInteger_afterInitMalformed_throwsInvalidConfiguration() {
    Properties config = new Properties();
    config.put("processor.maxConcurrency", "5ABC");
    Configuration.initConfig(config);
    thrown.expect(InvalidConfigurationException.class);
    Configuration.getInteger("processor.maxConcurrency", 5);
  }

  @Test
  public void getLong_configured_returnsParsedValue() {
    Properties config = new Properties();
    config.put("cli.timeout", "120000");
    Configuration.initConfig(config);
    assertEquals(Long.valueOf(120000), Configuration.getLong("cli.timeout", 60000L).get());
  }

  @Test
  public void getOverriden_keyMissing_usesFallback() {
    Properties config = new Properties();
    config.put("metadata.retryCount", "7");
    Configuration.initConfig(config);
    ConfigValue<Integer> global = Configuration.getInteger("metadata.retryCount", 3);
    ConfigValue<Integer> perType = Configuration.getOverriden("metadata.Flow.retryCount", global);
    assertEquals(Integer.valueOf(7), perType.get());
  }

  @Test
  public void getOverriden_keyPresent_usesOwnValue() {
    Properties config = new Properties();
    config.put("metadata.retryCount", "7");
    config.put("metadata.Flow.retryCount", "1");
    ConfigValue<Integer> global = Configuration.getInteger("metadata.retryCount", 3);
    ConfigValue<Integer> perType = Configuration.getOverriden("metadata.Flow.retryCount", global);
    Configuration.initConfig(config);
    assertEquals(Integer.valueOf(1), perType.get());
  }

  @Test
  public void getString_requiredKeyMissing_throwsInvalidConfiguration() {
    Configuration.initConfig(new Properties());
    thrown.expect(InvalidConfigurationException.class);
    Configuration.getString("retrieval.rootDirectory", null);
  }

  @Test
  public void getMultiValue_blankEntries_areDropped() {
    List<String> expected = Arrays.asList("sf", "sfdx");
    Properties config = new Properties();
    config.put("cli.allowedCommands", "sf, ,sfdx,");
    Configuration.initConfig(config);
    ConfigValue<List<String>> multiValue =
        Configuration.getMultiValue(
            "cli.allowedCommands", Collections.emptyList(), Configuration.STRING_PARSER);
    assertEquals(expected, multiValue.get());
  }

  @Test
  public void getMultiValue_emptyString_usesDefault() {
    Properties config = new Properties();
    config.put("cli.allowedCommands", "");
    Configuration.initConfig(config);
    ConfigValue<List<String>> multiValue =
        Configuration.getMultiValue(
            "cli.allowedCommands", Collections.singletonList("sf"), Configuration.STRING_PARSER);
    assertEquals(Collections.singletonList("sf"), multiValue.get());
  }

  @Test
  public void initConfig_parseError_leavesEverythingUninitialized() {
    Properties config = new Properties();
    config.put("config.key", "abc");
    config.put("config.valid.key", "valid");
    @SuppressWarnings("unchecked")
    Parser<String> mockParser = Mockito.mock(Parser.class);
    ConfigValue<String> stringParam =
        Configuration.getValue("config.valid.key", "some", mockParser);
    ConfigValue<Integer> intParam = Configuration.getInteger("config.key", 10);
    try {
      Configuration.initConfig(config);
      fail("Missing InvalidConfigurationException");
    } catch (InvalidConfigurationException expected) {
      assertFalse(Configuration.isInitialized());
    }
    assertFalse(stringParam.isInitialized());
    assertFalse(intParam.isInitialized());
    verify(mockParser).parse("valid");
  }

  @Test
  public void initConfig_fileAndArguments_argumentsWin() throws IOException {
    File tmpfile = temporaryFolder.newFile("orgsource.properties");
    Files.write(tmpfile.toPath(),
        "cli.timeout=90000\nprocessor.timeout= 45000 \n".getBytes(ISO_8859_1));
    String[] args = {"-Dconfig=" + tmpfile.getAbsolutePath(), "-Dcli.timeout=30000"};
    Configuration.initConfig(args);
    assertEquals(Long.valueOf(30000), Configuration.getLong("cli.timeout", 60000L).get());
    assertEquals(Long.valueOf(45000), Configuration.getLong("processor.timeout", 1L).get());
  }

  @Test
  public void initConfig_missingFile_usesDefaults() throws IOException {
    String[] args = {"-Dconfig=" + new File(temporaryFolder.getRoot(), "missing").getPath()};
    Configuration.initConfig(args);
    assertEquals(Integer.valueOf(5),
        Configuration.getInteger("processor.maxConcurrency", 5).get());
  }

  @Test
  public void checkConfiguration_false_throwsInvalidConfiguration() {
    thrown.expect(InvalidConfigurationException.class);
    thrown.expectMessage("bad value 3");
    Configuration.checkConfiguration(false, "bad value %d", 3);
  }
}
