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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.enterprise.orgsource.metadata.AbstractMetadataHandler;
import com.google.enterprise.orgsource.metadata.BundleContent;
import com.google.enterprise.orgsource.metadata.BundleContent.BundleKind;
import com.google.enterprise.orgsource.metadata.Content;
import com.google.enterprise.orgsource.metadata.HandlerConfig;
import com.google.enterprise.orgsource.metadata.HandlerContext;
import com.google.enterprise.orgsource.metadata.Item;
import com.google.enterprise.orgsource.metadata.ItemContent;
import com.google.enterprise.orgsource.metadata.TypeDefinition;
import com.google.enterprise.orgsource.metadata.analysis.AuraAnalysis;
import com.google.enterprise.orgsource.metadata.analysis.BundleStructure;
import com.google.enterprise.orgsource.metadata.analysis.ComponentDependencies;
import com.google.enterprise.orgsource.sdk.RetrievalException;
import com.google.enterprise.orgsource.sdk.batch.ProcessingResult;
import com.google.enterprise.orgsource.sdk.command.CliCommands;
import com.google.enterprise.orgsource.sdk.command.CliResponse;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Handler for Aura component bundles. The files of a bundle are read from the tooling API's
 * {@code AuraDefinition} rows, one row per file.
 */
public class AuraHandler extends AbstractMetadataHandler {
  private static final Logger logger = Logger.getLogger(AuraHandler.class.getName());
  static final String ID_INFIX = "aura";

  private static final Pattern EXTENDS = Pattern.compile("\\bextends=\"([^\"]+)\"");
  private static final Pattern IMPLEMENTS = Pattern.compile("\\bimplements=\"([^\"]+)\"");
  private static final Pattern REGISTERED_EVENT =
      Pattern.compile("<aura:registerEvent\\b[^>]*?\\bname=\"([^\"]+)\"");
  private static final Pattern CHILD_COMPONENT = Pattern.compile("<c:(\\w+)");

  /** File name suffix of each definition type, appended to the bundle name. */
  private static final ImmutableMap<String, String> DEF_TYPE_SUFFIXES =
      new ImmutableMap.Builder<String, String>()
          .put("COMPONENT", ".cmp")
          .put("CONTROLLER", "Controller.js")
          .put("HELPER", "Helper.js")
          .put("STYLE", ".css")
          .put("RENDERER", "Renderer.js")
          .put("DESIGN", ".design")
          .put("SVG", ".svg")
          .put("DOCUMENTATION", ".auradoc")
          .put("APPLICATION", ".app")
          .put("EVENT", ".evt")
          .put("INTERFACE", ".intf")
          .build();

  /** Role of each file suffix within a bundle. */
  private static final ImmutableMap<String, String> SUFFIX_ROLES =
      new ImmutableMap.Builder<String, String>()
          .put(".cmp", BundleStructure.CMP)
          .put("Controller.js", BundleStructure.CONTROLLER)
          .put("Helper.js", BundleStructure.HELPER)
          .put(".css", BundleStructure.STYLE)
          .put("Renderer.js", BundleStructure.RENDERER)
          .put(".design", BundleStructure.DESIGN)
          .put(".svg", BundleStructure.SVG)
          .put(".auradoc", BundleStructure.DOCUMENTATION)
          .build();

  public AuraHandler(TypeDefinition definition, HandlerConfig config, HandlerContext context) {
    super(definition, config, context);
  }

  @Override
  public List<Item> listItems(String targetId, String targetIdentifier)
      throws RetrievalException {
    List<Item> items = new ArrayList<>();
    for (Map<String, Object> record :
        listMetadataRecords(definition.getCliTypeName(), targetIdentifier)) {
      String fullName = CliResponse.getString(record, "fullName");
      if (fullName != null) {
        items.add(new Item.Builder(targetId, definition.getName(), fullName)
            .setIdInfix(ID_INFIX)
            .build());
      }
    }
    return sortedByName(items);
  }

  @Override
  protected Content retrieveContent(String targetId, String targetIdentifier, Item item)
      throws RetrievalException {
    String bundleName = item.getFullName();
    String query = String.format(
        "SELECT Id, DefType, Source FROM AuraDefinition WHERE AuraDefinitionBundleId IN "
            + "(SELECT Id FROM AuraDefinitionBundle WHERE DeveloperName = '%s')",
        CliCommands.escapeSoqlLiteral(bundleName));
    List<Map<String, Object>> records =
        runCli(CliCommands.toolingQuery(cli(), query, targetIdentifier), null).getRecords();
    if (records.isEmpty()) {
      throw contentFailure("No Aura definitions found for bundle " + bundleName);
    }
    Map<String, String> files = new LinkedHashMap<>();
    for (Map<String, Object> record : records) {
      String defType = CliResponse.getString(record, "DefType");
      if (Strings.isNullOrEmpty(defType)) {
        continue;
      }
      files.put(fileName(bundleName, defType),
          Strings.nullToEmpty(CliResponse.getString(record, "Source")));
    }
    return BundleContent.of(files, mainFile(item), BundleKind.AURA);
  }

  @Override
  protected Content emptyContent(Item item) {
    return BundleContent.empty(mainFile(item), BundleKind.AURA);
  }

  /**
   * Fetches every bundle of the target and summarizes its files and complexity. Bundles that
   * cannot be fetched are logged and left out.
   *
   * @throws RetrievalException if the bundles cannot be listed
   */
  public AuraAnalysis analyze(String targetId, String targetIdentifier)
      throws RetrievalException {
    ProcessingResult<ItemContent> fetched =
        fetchContentBatch(targetId, targetIdentifier, listItems(targetId, targetIdentifier));
    for (ProcessingResult.Failure failure : fetched.getFailures()) {
      logger.log(Level.WARNING, "Skipping Aura bundle {0}: {1}",
          new Object[] {((Item) failure.getInput()).getFullName(), failure.getError()});
    }
    List<AuraAnalysis.Component> components = new ArrayList<>();
    for (ItemContent content : fetched.getSuccess()) {
      String name = content.getItem().getFullName();
      BundleContent bundle = content.getContent().asBundle();
      String markup = bundle.getMainFileText();
      components.add(new AuraAnalysis.Component(name,
          ImmutableList.copyOf(bundle.getFiles().keySet()),
          bundle.getFiles().containsKey(name + ".evt") || markup.contains("aura:event"),
          bundle.getFiles().containsKey(name + ".app") || markup.contains("aura:application")));
    }
    return new AuraAnalysis(components);
  }

  /**
   * Fetches {@code item} and tells which file is its markup, controller, helper, style,
   * renderer, design, icon and documentation.
   *
   * @throws RetrievalException if the bundle cannot be fetched
   */
  public BundleStructure getBundleStructure(String targetId, String targetIdentifier, Item item)
      throws RetrievalException {
    return structureOf(item.getFullName(),
        retrieveContent(targetId, targetIdentifier, item).asBundle());
  }

  @VisibleForTesting
  static BundleStructure structureOf(String name, BundleContent bundle) {
    Map<String, String> roles = new LinkedHashMap<>();
    for (Map.Entry<String, String> suffix : SUFFIX_ROLES.entrySet()) {
      String file = name + suffix.getKey();
      if (bundle.getFiles().containsKey(file)) {
        roles.put(suffix.getValue(), file);
      }
    }
    return new BundleStructure(name, roles);
  }

  /**
   * Reads what the markup of {@code item} extends, implements, registers and contains. Returns
   * {@link ComponentDependencies#NONE} when the bundle cannot be fetched.
   */
  public ComponentDependencies getComponentDependencies(
      String targetId, String targetIdentifier, Item item) {
    return dependenciesOf(fetchContent(targetId, targetIdentifier, item).asBundle()
        .getMainFileText());
  }

  @VisibleForTesting
  static ComponentDependencies dependenciesOf(String markup) {
    if (markup.isEmpty()) {
      return ComponentDependencies.NONE;
    }
    List<String> interfaces = new ArrayList<>();
    for (String value : matches(IMPLEMENTS, markup)) {
      interfaces.addAll(Splitter.on(',').trimResults().omitEmptyStrings().splitToList(value));
    }
    return new ComponentDependencies(matches(EXTENDS, markup),
        ImmutableSet.copyOf(interfaces).asList(), matches(REGISTERED_EVENT, markup),
        matches(CHILD_COMPONENT, markup));
  }

  /** Distinct first groups of every match, in order of appearance. */
  private static List<String> matches(Pattern pattern, String text) {
    Set<String> found = new LinkedHashSet<>();
    Matcher matcher = pattern.matcher(text);
    while (matcher.find()) {
      found.add(matcher.group(1));
    }
    return ImmutableList.copyOf(found);
  }

  /** Maps a definition type such as {@code CONTROLLER} to its file name. */
  @VisibleForTesting
  static String fileName(String bundleName, String defType) {
    String suffix = DEF_TYPE_SUFFIXES.get(defType);
    return bundleName + (suffix != null ? suffix : "." + defType.toLowerCase(Locale.ROOT));
  }

  private static String mainFile(Item item) {
    return item.getFullName() + ".cmp";
  }
}
