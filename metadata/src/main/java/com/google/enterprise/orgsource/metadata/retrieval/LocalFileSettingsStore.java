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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.api.client.json.GenericJson;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.jackson2.JacksonFactory;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.common.io.ByteStreams;
import com.google.enterprise.orgsource.metadata.TargetWorkspace;
import com.google.enterprise.orgsource.sdk.config.Configuration;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import javax.annotation.Nullable;

/**
 * {@link SettingsStore} backed by a single JSON object on local disk.
 *
 * <p>Optional configuration parameters:
 *
 * <ul>
 *   <li>{@value #SETTINGS_FILE} - path of the settings file. Default {@value
 *       #DEFAULT_FILE_NAME} under the retrieval root directory.
 * </ul>
 */
public class LocalFileSettingsStore implements SettingsStore {
  public static final String SETTINGS_FILE = "retrieval.settingsFile";
  @VisibleForTesting static final String DEFAULT_FILE_NAME = "manifest-settings.json";
  private static final JsonFactory JSON_FACTORY = JacksonFactory.getDefaultInstance();

  private final Path settingsFile;
  private final FileHelper fileHelper;

  public LocalFileSettingsStore(Path settingsFile) {
    this(settingsFile, new FileHelper());
  }

  @VisibleForTesting
  LocalFileSettingsStore(Path settingsFile, FileHelper fileHelper) {
    this.settingsFile = checkNotNull(settingsFile, "settings file can not be null");
    this.fileHelper = checkNotNull(fileHelper);
  }

  public static LocalFileSettingsStore fromConfiguration() {
    checkState(Configuration.isInitialized(), "Configuration not initialized");
    String configured = Configuration.getString(SETTINGS_FILE, "").get();
    Path file = Strings.isNullOrEmpty(configured)
        ? TargetWorkspace.fromConfiguration().getRoot().resolve(DEFAULT_FILE_NAME)
        : Paths.get(configured);
    return new LocalFileSettingsStore(file);
  }

  @VisibleForTesting
  Path getSettingsFile() {
    return settingsFile;
  }

  @Override
  @Nullable
  public synchronized String get(String key, @Nullable String defaultValue) throws IOException {
    checkArgument(!Strings.isNullOrEmpty(key), "key can not be null or empty");
    Object value = load().get(key);
    return value == null ? defaultValue : value.toString();
  }

  @Override
  public synchronized void set(String key, @Nullable String value) throws IOException {
    checkArgument(!Strings.isNullOrEmpty(key), "key can not be null or empty");
    GenericJson settings = load();
    if (value == null) {
      if (settings.remove(key) == null) {
        return;
      }
    } else {
      settings.set(key, value);
    }
    settings.setFactory(JSON_FACTORY);
    fileHelper.writeFile(fileHelper.getFile(settingsFile),
        settings.toPrettyString().getBytes(UTF_8));
  }

  private GenericJson load() throws IOException {
    File file = fileHelper.getFile(settingsFile);
    if (!file.exists()) {
      return new GenericJson();
    }
    checkArgument(file.isFile(), "settings file is not pointing to a file");
    String text = new String(fileHelper.readFile(file), UTF_8);
    if (text.trim().isEmpty()) {
      return new GenericJson();
    }
    return JSON_FACTORY.fromString(text, GenericJson.class);
  }

  /** Helper utility to wrap File operations and testing */
  static class FileHelper {

    File getFile(Path filePath) {
      return filePath.toFile();
    }

    byte[] readFile(File file) throws IOException {
      try (FileInputStream inputStream = new FileInputStream(file)) {
        return ByteStreams.toByteArray(inputStream);
      }
    }

    void writeFile(File file, byte[] content) throws IOException {
      File parent = file.getAbsoluteFile().getParentFile();
      if (parent != null && !parent.isDirectory() && !parent.mkdirs()) {
        throw new IOException("Failed to create directory " + parent);
      }
      try (FileOutputStream outputStream = new FileOutputStream(file, false)) {
        outputStream.write(content);
        outputStream.flush();
      }
    }
  }
}
