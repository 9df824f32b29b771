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
package exm.fortx.frontend.antlr;

import org.antlr.runtime.ANTLRStringStream;
import org.antlr.runtime.CharStream;

/**
 * Character stream that the lexer sees in lower case.  Token text is
 * taken from the underlying buffer, so it keeps the case as written.
 */
public class CaseInsensitiveStream extends ANTLRStringStream {

  public CaseInsensitiveStream(String input) {
    super(input);
  }

  @Override
  public int LA(int i) {
    int c = super.LA(i);
    if (c == CharStream.EOF || c == 0) {
      return c;
    }
    return Character.toLowerCase(c);
  }
}
