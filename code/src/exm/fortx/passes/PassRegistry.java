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
package exm.fortx.passes;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;

import exm.fortx.common.Settings;
import exm.fortx.common.exceptions.InvalidOptionException;
import exm.fortx.sched.Pass;

/**
 * Passes available to a session, by name
 */
public class PassRegistry {
  private final Map<String, Pass> passes = new LinkedHashMap<String, Pass>();

  /**
   * @return registry holding the built-in passes, configured from settings
   */
  public static PassRegistry standard(Settings settings) {
    PassRegistry r = new PassRegistry();
    r.register(LoopPragmaPass.fromSettings(settings));
    r.register(new RoutineSeqPass());
    r.register(RemoveCallsPass.fromSettings(settings));
    r.register(DuplicateKernelPass.fromSettings(settings));
    r.register(new PurityPass());
    return r;
  }

  /**
   * Add a pass, replacing any pass of the same name
   */
  public void register(Pass pass) {
    passes.put(pass.name(), pass);
  }

  public Pass get(String name) throws InvalidOptionException {
    Pass p = passes.get(name.trim());
    if (p == null) {
      throw new InvalidOptionException("Unknown pass '" + name + "', " +
          "expected one of: " + StringUtils.join(passes.keySet(), ", "));
    }
    return p;
  }

  /**
   * @return passes named in fortx.passes, in that order
   */
  public List<Pass> selected(Settings settings) throws InvalidOptionException {
    List<Pass> result = new ArrayList<Pass>();
    for (String name: settings.getList(Settings.PASSES)) {
      result.add(get(name));
    }
    return result;
  }

  public List<String> names() {
    return new ArrayList<String>(passes.keySet());
  }
}
