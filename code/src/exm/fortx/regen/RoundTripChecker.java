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
package exm.fortx.regen;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.apache.log4j.Logger;

import exm.fortx.common.Logging;
import exm.fortx.common.exceptions.ParseException;
import exm.fortx.common.exceptions.RegenerationException;
import exm.fortx.frontend.Frontend;
import exm.fortx.frontend.FrontendAdapter;
import exm.fortx.frontend.FrontendOptions;
import exm.fortx.frontend.FrontendSelector;
import exm.fortx.ir.Node;
import exm.fortx.ir.Nodes;
import exm.fortx.ir.SourceUnit;
import exm.fortx.ir.Units.FileNode;

/**
 * Checks that regenerated text parses back, with the frontend the unit
 * was loaded with, to a tree equivalent to the one it was printed from.
 */
public class RoundTripChecker {

  private final Logger logger = Logging.getLogger();

  private final FrontendSelector frontends;
  private final FrontendOptions options;

  public RoundTripChecker(FrontendSelector frontends,
                          FrontendOptions options) {
    this.frontends = frontends;
    this.options = options;
  }

  /**
   * @param unit unit whose current tree was regenerated
   * @param text regenerated text
   * @throws RegenerationException if the text doesn't parse or means
   *         something else
   */
  public void check(SourceUnit unit, String text)
                                      throws RegenerationException {
    FileNode reparsed = reparse(unit, text);
    FileNode current = unit.root();
    if (!Nodes.equivalent(current, reparsed)) {
      if (logger.isTraceEnabled()) {
        logger.trace("In memory:\n" + Nodes.dump(current));
        logger.trace("Re-parsed:\n" + Nodes.dump(reparsed));
      }
      throw new RegenerationException(unit.path(),
          "regenerated text differs from the transformed tree" +
          firstDifference(current, reparsed));
    }
    logger.debug("Round trip OK: " + unit.path());
  }

  private FileNode reparse(SourceUnit unit, String text)
                                      throws RegenerationException {
    FrontendAdapter adapter = frontends.adapter(unit.frontend());
    if (unit.frontend() != Frontend.XML) {
      try {
        return adapter.parse(unit.path(), text, options);
      } catch (ParseException e) {
        throw new RegenerationException(unit.path(),
            "regenerated text does not parse: " + e.getMessage(), e);
      }
    }

    // The external parser reads files, not text
    File tmp = null;
    try {
      tmp = File.createTempFile("fortx-regen",
                        "." + FilenameUtils.getExtension(unit.path()));
      FileUtils.writeStringToFile(tmp, text, StandardCharsets.UTF_8);
      return adapter.parse(tmp.getPath(), text, options);
    } catch (IOException e) {
      throw new RegenerationException(unit.path(),
          "could not write regenerated text for re-parsing: " +
          e.getMessage(), e);
    } catch (ParseException e) {
      throw new RegenerationException(unit.path(),
          "regenerated text does not parse: " + e.getMessage(), e);
    } finally {
      if (tmp != null) {
        FileUtils.deleteQuietly(tmp);
      }
    }
  }

  /**
   * @return description of the first top-level unit that differs
   */
  private static String firstDifference(FileNode a, FileNode b) {
    int n = Math.min(a.body().size(), b.body().size());
    for (int i = 0; i < n; i++) {
      Node x = a.body().get(i);
      Node y = b.body().get(i);
      if (!Nodes.equivalent(x, y)) {
        return " in " + x.kind().toString().toLowerCase() + " " +
               x.label();
      }
    }
    return "";
  }
}
