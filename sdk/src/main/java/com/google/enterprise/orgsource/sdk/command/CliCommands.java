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
package com.google.enterprise.orgsource.sdk.command;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Argument vectors for the command line tool operations used during retrieval.
 *
 * <p>Every value taken from the caller is validated here so that it cannot be read as an option
 * or smuggle control characters into the invocation.
 */
public final class CliCommands {
  static final Pattern ORG_IDENTIFIER = Pattern.compile("^[a-zA-Z0-9._@-]+$");
  static final Pattern SALESFORCE_ID = Pattern.compile("^[a-zA-Z0-9]{15}([a-zA-Z0-9]{3})?$");
  static final Pattern METADATA_NAME = Pattern.compile("^[a-zA-Z0-9_]+$");
  static final int MAX_QUERY_LENGTH = 4000;

  private CliCommands() {}

  public static List<String> version(String cli) {
    return ImmutableList.of(cli, "--version");
  }

  /** {@code org list}: every org the tool is authorized against. */
  public static List<String> orgList(String cli) {
    return ImmutableList.of(cli, "org", "list", "--json");
  }

  /** {@code sobject describe} for one object. */
  public static List<String> describeSObject(String cli, String objectName, String targetOrg) {
    return ImmutableList.of(
        cli,
        "sobject", "describe",
        "--sobject", checkMetadataName(objectName),
        "--target-org", checkOrgIdentifier(targetOrg),
        "--json");
  }

  /** {@code org list metadata} for one type. */
  public static List<String> listMetadata(String cli, String typeName, String targetOrg) {
    return ImmutableList.of(
        cli,
        "org", "list", "metadata",
        "--metadata-type", checkMetadataName(typeName),
        "--target-org", checkOrgIdentifier(targetOrg),
        "--json");
  }

  /** {@code data query} against the tooling API. */
  public static List<String> toolingQuery(String cli, String soql, String targetOrg) {
    return ImmutableList.of(
        cli,
        "data", "query",
        "--query", checkQuery(soql),
        "--target-org", checkOrgIdentifier(targetOrg),
        "--use-tooling-api",
        "--json");
  }

  /** {@code project retrieve start} for a single {@code Type:Member}. */
  public static List<String> retrieveMetadata(
      String cli, String typeName, String memberName, String targetOrg) {
    return ImmutableList.of(
        cli,
        "project", "retrieve", "start",
        "--metadata", checkMetadataName(typeName) + ":" + checkMemberName(memberName),
        "--target-org", checkOrgIdentifier(targetOrg),
        "--json");
  }

  /** {@code project retrieve start} driven by a {@code package.xml} manifest. */
  public static List<String> retrieveManifest(String cli, Path manifest, String targetOrg) {
    checkNotNull(manifest, "manifest can not be null");
    return ImmutableList.of(
        cli,
        "project", "retrieve", "start",
        "--manifest", manifest.toString(),
        "--target-org", checkOrgIdentifier(targetOrg),
        "--json");
  }

  /** Accepts usernames, aliases and org ids. */
  public static String checkOrgIdentifier(String identifier) {
    checkArgument(!Strings.isNullOrEmpty(identifier) && ORG_IDENTIFIER.matcher(identifier).matches()
            && !identifier.startsWith("-"),
        "Invalid org identifier: %s", identifier);
    return identifier;
  }

  public static boolean isSalesforceId(String value) {
    return !Strings.isNullOrEmpty(value) && SALESFORCE_ID.matcher(value).matches();
  }

  /** Accepts API names of metadata types, e.g. {@code ApexClass}. */
  public static String checkMetadataName(String name) {
    checkArgument(!Strings.isNullOrEmpty(name) && METADATA_NAME.matcher(name).matches(),
        "Invalid metadata name: %s", name);
    return name;
  }

  /**
   * Accepts member names. These are looser than type names since layouts and reports contain
   * spaces, dashes, dots and slashes.
   */
  public static String checkMemberName(String name) {
    checkArgument(!Strings.isNullOrEmpty(name), "Member name can not be empty");
    checkArgument(!name.startsWith("-") && CharMatcher.javaIsoControl().matchesNoneOf(name)
            && name.indexOf(':') < 0,
        "Invalid member name: %s", name);
    return name;
  }

  static String checkQuery(String soql) {
    checkArgument(!Strings.isNullOrEmpty(soql), "Query can not be empty");
    String trimmed = soql.trim();
    checkArgument(trimmed.regionMatches(true, 0, "SELECT ", 0, 7), "Query must be a SELECT: %s",
        soql);
    checkArgument(trimmed.length() <= MAX_QUERY_LENGTH, "Query exceeds %s characters",
        MAX_QUERY_LENGTH);
    return trimmed;
  }

  /** Escapes a value for use inside a single-quoted SOQL string literal. */
  public static String escapeSoqlLiteral(String value) {
    return checkNotNull(value).replace("\\", "\\\\").replace("'", "\\'");
  }
}
