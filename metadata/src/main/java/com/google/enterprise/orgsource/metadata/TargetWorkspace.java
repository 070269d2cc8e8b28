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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.api.client.json.GenericJson;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.jackson2.JacksonFactory;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import com.google.enterprise.orgsource.sdk.config.Configuration;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Local directories that hold retrieved sources, one set per target org, under a shared root.
 *
 * <p>Each target gets {@code org-<targetId>} for whole-org retrievals and {@code
 * org-<targetId>-items} for single artifact retrievals. Both are project directories the command
 * line tool accepts. Directories are created when missing and never cleared implicitly.
 *
 * <p>Optional configuration parameters:
 *
 * <ul>
 *   <li>{@value #ROOT_DIRECTORY} - shared root. Default {@code ${java.io.tmpdir}/sf-org-compare}.
 * </ul>
 */
public class TargetWorkspace {
  private static final Logger logger = Logger.getLogger(TargetWorkspace.class.getName());
  private static final JsonFactory JSON_FACTORY = JacksonFactory.getDefaultInstance();

  public static final String ROOT_DIRECTORY = "retrieval.rootDirectory";
  static final String DEFAULT_ROOT_NAME = "sf-org-compare";
  static final String PROJECT_FILE = "sfdx-project.json";
  static final String PACKAGE_DIRECTORY = "force-app";
  /** Locations the command line tool writes retrieved sources to, most recent layout first. */
  static final List<String> SOURCE_ROOTS =
      ImmutableList.of("force-app/main/default", "src", "unpackaged");

  private final Path root;

  public TargetWorkspace(Path root) {
    this.root = checkNotNull(root).toAbsolutePath();
  }

  public static TargetWorkspace fromConfiguration() {
    checkState(Configuration.isInitialized(), "Configuration not initialized");
    String configured = Configuration.getString(ROOT_DIRECTORY, "").get();
    return new TargetWorkspace(
        Strings.isNullOrEmpty(configured) ? defaultRoot() : Paths.get(configured));
  }

  @VisibleForTesting
  static Path defaultRoot() {
    return Paths.get(System.getProperty("java.io.tmpdir"), DEFAULT_ROOT_NAME);
  }

  public Path getRoot() {
    return root;
  }

  /** Directory for whole-org retrievals of {@code targetId}. */
  public Path targetDirectory(String targetId) {
    return root.resolve("org-" + directoryName(targetId));
  }

  /** Directory for single artifact retrievals of {@code targetId}. */
  public Path itemDirectory(String targetId) {
    return root.resolve("org-" + directoryName(targetId) + "-items");
  }

  /**
   * Creates {@code directory} with a project descriptor and the default package directory if they
   * do not exist yet. Existing files are left untouched.
   */
  public Path ensureProject(Path directory, String apiVersion) throws IOException {
    Files.createDirectories(directory.resolve(PACKAGE_DIRECTORY).resolve("main/default"));
    Path projectFile = directory.resolve(PROJECT_FILE);
    if (!Files.exists(projectFile)) {
      GenericJson packageDirectory = new GenericJson()
          .set("path", PACKAGE_DIRECTORY)
          .set("default", true);
      GenericJson project = new GenericJson()
          .set("packageDirectories", ImmutableList.of(packageDirectory))
          .set("namespace", "")
          .set("sfdcLoginUrl", "https://login.salesforce.com")
          .set("sourceApiVersion", apiVersion);
      project.setFactory(JSON_FACTORY);
      Files.write(projectFile, project.toPrettyString().getBytes(UTF_8));
      logger.log(Level.FINE, "Created project descriptor {0}", projectFile);
    }
    return directory;
  }

  /**
   * Returns the first source directory under {@code directory} that holds retrieved files.
   * Directories created by {@link #ensureProject} but left empty by the tool do not count.
   */
  public static Optional<Path> findSourceRoot(Path directory) {
    return SOURCE_ROOTS.stream()
        .map(directory::resolve)
        .filter(TargetWorkspace::hasEntries)
        .findFirst();
  }

  private static boolean hasEntries(Path directory) {
    if (!Files.isDirectory(directory)) {
      return false;
    }
    try (Stream<Path> entries = Files.list(directory)) {
      return entries.findAny().isPresent();
    } catch (IOException e) {
      logger.log(Level.WARNING, "Failed to list " + directory, e);
      return false;
    }
  }

  /**
   * Returns the first existing file among {@code relativePaths}, each tried under every source
   * root of {@code directory}.
   */
  public static Optional<Path> findRetrievedFile(Path directory, List<String> relativePaths) {
    for (String sourceRoot : SOURCE_ROOTS) {
      for (String relative : relativePaths) {
        Path candidate = directory.resolve(sourceRoot).resolve(relative);
        if (Files.isRegularFile(candidate)) {
          return Optional.of(candidate);
        }
      }
    }
    return Optional.empty();
  }

  /** Returns the first existing directory {@code relativePath} under a source root. */
  public static Optional<Path> findRetrievedDirectory(Path directory, String relativePath) {
    return SOURCE_ROOTS.stream()
        .map(sourceRoot -> directory.resolve(sourceRoot).resolve(relativePath))
        .filter(Files::isDirectory)
        .findFirst();
  }

  /** Deletes {@code directory} and everything below it. Missing directories are ignored. */
  public void delete(Path directory) throws IOException {
    checkArgument(directory.toAbsolutePath().startsWith(root),
        "refusing to delete %s outside of %s", directory, root);
    if (Files.exists(directory)) {
      MoreFiles.deleteRecursively(directory, RecursiveDeleteOption.ALLOW_INSECURE);
      logger.log(Level.FINE, "Deleted {0}", directory);
    }
  }

  @VisibleForTesting
  static String directoryName(String targetId) {
    checkArgument(!Strings.isNullOrEmpty(targetId), "targetId can not be null or empty");
    return targetId.replaceAll("[^A-Za-z0-9._-]", "_");
  }
}
