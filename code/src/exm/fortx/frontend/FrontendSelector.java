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
package exm.fortx.frontend;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.io.FilenameUtils;
import org.apache.log4j.Logger;

import exm.fortx.common.Logging;
import exm.fortx.common.Settings;
import exm.fortx.common.exceptions.InvalidOptionException;
import exm.fortx.frontend.antlr.AntlrFrontend;
import exm.fortx.frontend.line.LineFrontend;
import exm.fortx.frontend.xml.XmlFrontend;

/**
 * Chooses the frontend for each source file from the session settings:
 * the first fortx.frontend.&lt;glob&gt; key whose glob matches the file
 * name or path, in key order, else fortx.frontend.default.
 */
public class FrontendSelector {

  private final Logger logger = Logging.getLogger();

  private final Frontend defaultFrontend;
  private final List<String> globs = new ArrayList<String>();
  private final List<Frontend> choices = new ArrayList<Frontend>();

  private final FrontendAdapter antlr = new AntlrFrontend();
  private final FrontendAdapter line = new LineFrontend();
  private final FrontendAdapter xml = new XmlFrontend();

  public FrontendSelector(Settings settings) throws InvalidOptionException {
    this.defaultFrontend = Frontend.fromString(
                              settings.get(Settings.FRONTEND_DEFAULT));
    for (String key: settings.getKeys()) {
      if (key.startsWith(Settings.FRONTEND_OVERRIDE_PREFIX) &&
          !Settings.isReservedFrontendKey(key)) {
        String glob = key.substring(
                          Settings.FRONTEND_OVERRIDE_PREFIX.length());
        globs.add(glob);
        choices.add(Frontend.fromString(settings.get(key)));
      }
    }
  }

  public Frontend select(String path) {
    String name = FilenameUtils.getName(path);
    for (int i = 0; i < globs.size(); i++) {
      String glob = globs.get(i);
      if (FilenameUtils.wildcardMatch(name, glob) ||
          FilenameUtils.wildcardMatch(path, glob)) {
        logger.debug("Frontend for " + path + ": " + choices.get(i) +
                     " (matched " + glob + ")");
        return choices.get(i);
      }
    }
    return defaultFrontend;
  }

  public FrontendAdapter adapter(Frontend frontend) {
    switch (frontend) {
      case ANTLR:
        return antlr;
      case LINE:
        return line;
      case XML:
        return xml;
      default:
        throw new IllegalArgumentException("Unknown frontend " + frontend);
    }
  }

  public FrontendAdapter adapterFor(String path) {
    return adapter(select(path));
  }
}
