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
package exm.fortx.frontend.line;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import exm.fortx.common.Logging;
import exm.fortx.common.exceptions.ParseException;
import exm.fortx.frontend.Frontend;
import exm.fortx.frontend.FrontendAdapter;
import exm.fortx.frontend.FrontendOptions;
import exm.fortx.frontend.line.LineReader.LogicalLine;
import exm.fortx.ir.Units.FileNode;

/**
 * Line-oriented frontend: statements are read line by line, classified
 * by pattern and parsed one at a time.  Optionally splices INCLUDE files
 * into the statement stream.
 */
public class LineFrontend implements FrontendAdapter {

  /** Guards against include cycles */
  public static final int MAX_INCLUDE_DEPTH = 16;

  private final Logger logger = Logging.getLogger();

  @Override
  public Frontend frontend() {
    return Frontend.LINE;
  }

  @Override
  public FileNode parse(String path, String text, FrontendOptions options)
                                                  throws ParseException {
    List<LogicalLine> lines = new LineReader().read(text);
    if (options.expandIncludes()) {
      lines = expandIncludes(path, lines, options, 0);
    }
    SyntaxNode tree = new StatementClassifier(path).classify(lines);
    if (logger.isTraceEnabled()) {
      logger.trace("Statement tree for " + path + ":\n" + tree.printTree());
    }
    return new LineNormalizer(path, text).normalize(tree);
  }

  private List<LogicalLine> expandIncludes(String path,
          List<LogicalLine> lines, FrontendOptions options, int depth)
                                                  throws ParseException {
    List<LogicalLine> result = new ArrayList<LogicalLine>(lines.size());
    for (LogicalLine line: lines) {
      Matcher m = line.comment ? null :
                  StatementClassifier.INCLUDE.matcher(line.text);
      if (m == null || !m.matches()) {
        result.add(line);
        continue;
      }
      if (depth >= MAX_INCLUDE_DEPTH) {
        throw new ParseException(path, line.firstLine, 0,
              "includes nested more than " + MAX_INCLUDE_DEPTH + " deep");
      }
      File file = findInclude(path, m.group(2), options.includePath());
      if (file == null) {
        throw new ParseException(path, line.firstLine, 0,
                                 "include file not found: " + m.group(2));
      }
      logger.debug("Including " + file + " at " + path + ":"
                   + line.firstLine);
      String included;
      try {
        included = FileUtils.readFileToString(file, StandardCharsets.UTF_8);
      } catch (IOException e) {
        throw new ParseException(path, "could not read include file " +
                                 file + ": " + e.getMessage(), e);
      }
      List<LogicalLine> nested = expandIncludes(file.getPath(),
          new LineReader().read(included), options, depth + 1);
      for (LogicalLine n: nested) {
        // Placed on the include line of the outermost file
        result.add(n.asIncluded(line.firstLine));
      }
    }
    return result;
  }

  /**
   * Look in the directory of the including file, then the include path
   * @return the file, or null if not found
   */
  static File findInclude(String path, String name,
                          List<String> includePath) {
    File direct = new File(name);
    if (direct.isAbsolute()) {
      return direct.isFile() ? direct : null;
    }
    File dir = new File(path).getAbsoluteFile().getParentFile();
    if (dir != null) {
      File candidate = new File(dir, name);
      if (candidate.isFile()) {
        return candidate;
      }
    }
    for (String d: includePath) {
      File candidate = new File(d, name);
      if (candidate.isFile()) {
        return candidate;
      }
    }
    return null;
  }
}
