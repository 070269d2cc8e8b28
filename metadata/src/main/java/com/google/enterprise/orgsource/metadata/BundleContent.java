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
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A multi-file artifact such as a Lightning web component. Files are kept in insertion order and
 * the main file is always one of them, possibly with empty text.
 */
public final class BundleContent extends Content {

  /** Component model of a bundle. */
  public enum BundleKind {
    LWC,
    AURA,
    GENERIC
  }

  private final ImmutableMap<String, String> files;
  private final String mainFile;
  private final BundleKind kind;

  private BundleContent(Map<String, String> files, String mainFile, BundleKind kind) {
    this.files = ImmutableMap.copyOf(files);
    this.mainFile = mainFile;
    this.kind = kind;
  }

  /**
   * Creates a bundle. If {@code mainFile} is not among {@code files} it is added with empty
   * text.
   *
   * @throws IllegalArgumentException if a file name is empty or contains a path separator
   */
  public static BundleContent of(Map<String, String> files, String mainFile, BundleKind kind) {
    checkNotNull(files, "files can not be null");
    checkNotNull(kind, "kind can not be null");
    checkFileName(mainFile);
    Map<String, String> copy = new LinkedHashMap<>();
    for (Map.Entry<String, String> file : files.entrySet()) {
      copy.put(checkFileName(file.getKey()), checkNotNull(file.getValue()));
    }
    copy.putIfAbsent(mainFile, "");
    return new BundleContent(copy, mainFile, kind);
  }

  /** Bundle holding only an empty main file. Returned when a bundle cannot be fetched. */
  public static BundleContent empty(String mainFile, BundleKind kind) {
    return of(ImmutableMap.of(), mainFile, kind);
  }

  /**
   * Reads the regular files directly inside {@code directory} in name order.
   *
   * @throws IOException if the directory or one of its files cannot be read
   */
  public static BundleContent readFrom(Path directory, String mainFile, BundleKind kind)
      throws IOException {
    return readFrom(directory, mainFile, kind, name -> true);
  }

  /** Like {@link #readFrom(Path, String, BundleKind)}, reading only names accepted by filter. */
  public static BundleContent readFrom(
      Path directory, String mainFile, BundleKind kind, Predicate<String> filter)
      throws IOException {
    List<Path> paths;
    try (Stream<Path> children = Files.list(directory)) {
      paths = children
          .filter(Files::isRegularFile)
          .filter(path -> filter.test(path.getFileName().toString()))
          .sorted()
          .collect(Collectors.toList());
    }
    Map<String, String> files = new LinkedHashMap<>();
    for (Path path : paths) {
      files.put(path.getFileName().toString(), new String(Files.readAllBytes(path), UTF_8));
    }
    return of(files, mainFile, kind);
  }

  /**
   * Writes every file of the bundle into {@code directory}, creating it if needed and replacing
   * files of the same name.
   */
  public void writeTo(Path directory) throws IOException {
    Files.createDirectories(directory);
    for (Map.Entry<String, String> file : files.entrySet()) {
      Files.write(directory.resolve(file.getKey()), file.getValue().getBytes(UTF_8));
    }
  }

  public Map<String, String> getFiles() {
    return files;
  }

  public String getMainFile() {
    return mainFile;
  }

  public String getMainFileText() {
    return files.get(mainFile);
  }

  public BundleKind getKind() {
    return kind;
  }

  @Override
  public boolean isBundle() {
    return true;
  }

  @Override
  public BundleContent asBundle() {
    return this;
  }

  @Override
  public boolean isEmpty() {
    return files.values().stream().allMatch(String::isEmpty);
  }

  private static String checkFileName(String name) {
    checkArgument(!Strings.isNullOrEmpty(name), "file name can not be null or empty");
    checkArgument(name.indexOf('/') < 0 && name.indexOf('\\') < 0 && !name.equals("..")
        && !name.equals("."), "invalid bundle file name: %s", name);
    return name;
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) {
      return true;
    }
    if (!(obj instanceof BundleContent)) {
      return false;
    }
    BundleContent other = (BundleContent) obj;
    return files.equals(other.files) && mainFile.equals(other.mainFile) && kind == other.kind;
  }

  @Override
  public int hashCode() {
    return Objects.hash(files, mainFile, kind);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("kind", kind)
        .add("mainFile", mainFile)
        .add("files", files.keySet())
        .toString();
  }
}
