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

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.escape.Escaper;
import com.google.common.xml.XmlEscapers;
import java.util.List;
import java.util.Map;

/** Writes {@code package.xml} manifests. */
public final class ManifestBuilder {
  static final String XML_DECLARATION = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>";
  static final String NAMESPACE = "http://soap.sforce.com/2006/04/metadata";
  static final String WILDCARD = "*";

  private static final Escaper ESCAPER = XmlEscapers.xmlContentEscaper();

  private ManifestBuilder() {}

  /**
   * Builds a manifest with one {@code <types>} block per entry of {@code typeNames}, in order.
   * Types without explicit members in {@code members} use the {@value #WILDCARD} member.
   */
  public static String build(
      List<String> typeNames, Map<String, ? extends List<String>> members, String apiVersion) {
    checkNotNull(typeNames, "typeNames can not be null");
    checkNotNull(members, "members can not be null");
    checkArgument(!Strings.isNullOrEmpty(apiVersion), "apiVersion can not be null or empty");
    StringBuilder xml = new StringBuilder(XML_DECLARATION)
        .append('\n')
        .append("<Package xmlns=\"").append(NAMESPACE).append("\">");
    for (String typeName : typeNames) {
      checkArgument(!Strings.isNullOrEmpty(typeName), "type name can not be null or empty");
      List<String> typeMembers = members.get(typeName);
      if (typeMembers == null || typeMembers.isEmpty()) {
        typeMembers = ImmutableList.of(WILDCARD);
      }
      xml.append("\n    <types>");
      for (String member : typeMembers) {
        xml.append("\n        <members>").append(ESCAPER.escape(member)).append("</members>");
      }
      xml.append("\n        <name>").append(ESCAPER.escape(typeName)).append("</name>");
      xml.append("\n    </types>");
    }
    xml.append("\n    <version>").append(ESCAPER.escape(apiVersion)).append("</version>");
    xml.append("\n</Package>");
    return xml.toString();
  }
}
