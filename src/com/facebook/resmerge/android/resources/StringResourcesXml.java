/*
 * Copyright 2019-present Facebook, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may
 * not use this file except in compliance with the License. You may obtain
 * a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */

package com.facebook.resmerge.android.resources;

import com.facebook.resmerge.io.ProjectFilesystem;
import com.facebook.resmerge.util.xml.XmlDomParser;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.function.Predicate;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.SAXException;

/** Filters the string entries of a {@code values-*} resource file. */
public class StringResourcesXml {

  private static final ImmutableSet<String> STRING_ELEMENTS =
      ImmutableSet.of("string", "plurals", "string-array");

  /** Utility class: do not instantiate. */
  private StringResourcesXml() {}

  /**
   * Removes the {@code <string>}, {@code <plurals>} and {@code <string-array>} children of {@code
   * <resources>} whose name does not satisfy {@code keep}. Everything else, including the order of
   * the remaining entries, is preserved. The file is only rewritten if an entry was removed.
   *
   * @return the number of removed entries.
   */
  public static int filter(ProjectFilesystem filesystem, Path path, Predicate<String> keep)
      throws IOException {
    Document document;
    try (InputStream input = filesystem.newFileInputStream(path)) {
      document = XmlDomParser.parse(input);
    } catch (SAXException e) {
      throw new IOException(String.format("Could not parse %s", filesystem.resolve(path)), e);
    }

    Element resources = document.getDocumentElement();
    if (resources == null || !resources.getTagName().equals("resources")) {
      return 0;
    }

    ImmutableList.Builder<Element> unwanted = ImmutableList.builder();
    for (Node child = resources.getFirstChild(); child != null; child = child.getNextSibling()) {
      if (child.getNodeType() != Node.ELEMENT_NODE) {
        continue;
      }
      Element element = (Element) child;
      if (STRING_ELEMENTS.contains(element.getTagName())
          && !keep.test(element.getAttribute("name"))) {
        unwanted.add(element);
      }
    }

    ImmutableList<Element> removed = unwanted.build();
    for (Element element : removed) {
      Node previous = element.getPreviousSibling();
      if (previous != null
          && previous.getNodeType() == Node.TEXT_NODE
          && previous.getTextContent().trim().isEmpty()) {
        resources.removeChild(previous);
      }
      resources.removeChild(element);
    }

    if (!removed.isEmpty()) {
      write(document, filesystem, path);
    }
    return removed.size();
  }

  private static void write(Document document, ProjectFilesystem filesystem, Path path)
      throws IOException {
    document.setXmlStandalone(true);
    try (OutputStream output = filesystem.newFileOutputStream(path)) {
      Transformer transformer = TransformerFactory.newInstance().newTransformer();
      transformer.setOutputProperty(OutputKeys.ENCODING, "utf-8");
      transformer.transform(new DOMSource(document), new StreamResult(output));
    } catch (TransformerException e) {
      throw new IOException(String.format("Could not write %s", filesystem.resolve(path)), e);
    }
  }
}
