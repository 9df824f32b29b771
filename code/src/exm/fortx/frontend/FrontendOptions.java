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

import java.util.Collections;
import java.util.List;
import java.util.concurrent.Semaphore;

import exm.fortx.common.Settings;
import exm.fortx.common.exceptions.InvalidOptionException;

/**
 * Backend options shared by all frontends of a session
 */
public class FrontendOptions {
  private final List<String> includePath;
  private final boolean expandIncludes;
  private final String xmlCommand;
  /** Bounds concurrent external frontend processes */
  private final Semaphore processLimiter;

  public FrontendOptions(List<String> includePath, boolean expandIncludes,
                         String xmlCommand, Semaphore processLimiter) {
    this.includePath = Collections.unmodifiableList(includePath);
    this.expandIncludes = expandIncludes;
    this.xmlCommand = xmlCommand;
    this.processLimiter = processLimiter;
  }

  public static FrontendOptions fromSettings(Settings settings,
              Semaphore processLimiter) throws InvalidOptionException {
    return new FrontendOptions(settings.getIncludePath(),
        settings.getBoolean(Settings.FRONTEND_LINE_EXPAND_INCLUDES),
        settings.get(Settings.FRONTEND_XML_COMMAND), processLimiter);
  }

  /**
   * Options with no include path, for parsing text in isolation
   */
  public static FrontendOptions defaults() {
    return new FrontendOptions(Collections.<String>emptyList(), false, "",
                               new Semaphore(1));
  }

  public List<String> includePath() {
    return includePath;
  }

  public boolean expandIncludes() {
    return expandIncludes;
  }

  public String xmlCommand() {
    return xmlCommand;
  }

  public Semaphore processLimiter() {
    return processLimiter;
  }
}
