/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */
package exm.fortx.frontend.xml;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;
import org.w3c.dom.Document;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import exm.fortx.common.Logging;
import exm.fortx.common.exceptions.ParseException;
import exm.fortx.frontend.Frontend;
import exm.fortx.frontend.FrontendAdapter;
import exm.fortx.frontend.FrontendOptions;
import exm.fortx.ir.Units.FileNode;

/**
 * Frontend running an external parser that prints an XML tree for the
 * file on stdout.  The command is a template: {file} becomes the source
 * path and {includes} one "-I dir" pair per include directory.
 */
public class XmlFrontend implements FrontendAdapter {

  public static final String FILE_PLACEHOLDER = "{file}";
  public static final String INCLUDES_PLACEHOLDER = "{includes}";

  private final Logger logger = Logging.getLogger();

  @Override
  public Frontend frontend() {
    return Frontend.XML;
  }

  @Override
  public FileNode parse(String path, String text, FrontendOptions options)
                                                  throws ParseException {
    if (StringUtils.isBlank(options.xmlCommand())) {
      throw new ParseException(path, 0, 0,
              "no command configured for the XML frontend");
    }
    List<String> cmd = command(options.xmlCommand(), path,
                               options.includePath());
    String xml;
    try {
      options.processLimiter().acquire();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ParseException(path, "interrupted waiting to run " +
                               "frontend command", e);
    }
    try {
      xml = runCommand(path, cmd);
    } finally {
      options.processLimiter().release();
    }
    return parseXml(path, text, xml);
  }

  /**
   * Map XML already produced for a source file
   * @param path source file path
   * @param text source text the XML line numbers refer to
   * @param xml
   */
  public FileNode parseXml(String path, String text, String xml)
                                                  throws ParseException {
    Document doc;
    try {
      DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
      factory.setNamespaceAware(false);
      factory.setIgnoringComments(true);
      DocumentBuilder builder = factory.newDocumentBuilder();
      doc = builder.parse(new InputSource(new StringReader(xml)));
    } catch (ParserConfigurationException e) {
      throw new ParseException(path, "XML parser unavailable", e);
    } catch (SAXException e) {
      throw new ParseException(path, "frontend output is not valid XML: "
                               + e.getMessage(), e);
    } catch (IOException e) {
      throw new ParseException(path, "error reading frontend output: "
                               + e.getMessage(), e);
    }
    return new XmlNormalizer(path, text).normalize(doc.getDocumentElement());
  }

  /**
   * Expand the command template into an argument list
   */
  static List<String> command(String template, String path,
                              List<String> includePath) {
    List<String> cmd = new ArrayList<String>();
    for (String word: StringUtils.split(template)) {
      if (word.equals(INCLUDES_PLACEHOLDER)) {
        for (String dir: includePath) {
          cmd.add("-I");
          cmd.add(dir);
        }
      } else {
        cmd.add(word.replace(FILE_PLACEHOLDER, path));
      }
    }
    return cmd;
  }

  private String runCommand(String path, List<String> cmd)
                                                  throws ParseException {
    String cmdString = StringUtils.join(cmd, ' ');
    File stderrFile = null;
    Process proc = null;
    try {
      logger.debug("Running XML frontend: " + cmdString);
      stderrFile = File.createTempFile("fortx-xml", ".err");
      ProcessBuilder pb = new ProcessBuilder(cmd);
      pb.redirectError(ProcessBuilder.Redirect.to(stderrFile));
      proc = pb.start();
      proc.getOutputStream().close();

      String stdout;
      InputStream in = proc.getInputStream();
      try {
        stdout = IOUtils.toString(in, StandardCharsets.UTF_8);
      } finally {
        in.close();
      }
      int exitCode = proc.waitFor();
      String stderr = FileUtils.readFileToString(stderrFile,
                                                 StandardCharsets.UTF_8);
      logger.debug("XML frontend exit code: " + exitCode);

      if (exitCode != 0) {
        throw new ParseException(path, 0, 0, "frontend command " +
            cmdString + " failed with exit code " + exitCode + ": " +
            stderr.trim());
      } else if (stderr.length() != 0) {
        logger.warn("XML frontend warnings for " + path + ":\n" + stderr);
      }
      return stdout;
    } catch (IOException e) {
      throw new ParseException(path, "I/O error running frontend command " +
                               cmdString + ": " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ParseException(path, "interrupted running frontend command "
                               + cmdString, e);
    } finally {
      if (proc != null) {
        // No-op once the process has exited
        proc.destroy();
      }
      if (stderrFile != null) {
        FileUtils.deleteQuietly(stderrFile);
      }
    }
  }
}
