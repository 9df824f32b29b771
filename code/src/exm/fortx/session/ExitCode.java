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
package exm.fortx.session;

/**
 * Exit codes of the command line driver
 */
public enum ExitCode {
  SUCCESS(0),
  /** Error reading sources or writing output */
  ERROR_IO(2),
  /** A source file did not parse */
  ERROR_PARSER(3),
  /** A pass marked fatal failed */
  ERROR_TRANSFORM(4),
  /** Bad command line argument or setting */
  ERROR_COMMAND(5),
  /** Recursive routines did not converge, or the run timed out */
  ERROR_SCHEDULING(6),
  /** Regenerated text failed the round trip check */
  ERROR_REGENERATION(7),
  /** Lint found errors, nothing else went wrong */
  ERROR_LINT(8),
  /** Internal error in fortx */
  ERROR_INTERNAL(90);

  final int code;

  ExitCode(int code)
  {
    this.code = code;
  }

  public int code()
  {
    return code;
  }
}
