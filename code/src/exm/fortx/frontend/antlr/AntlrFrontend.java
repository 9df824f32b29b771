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

import java.util.List;

import org.antlr.runtime.CommonTokenStream;
import org.antlr.runtime.RecognitionException;
import org.antlr.runtime.Token;
import org.antlr.runtime.tree.CommonTreeAdaptor;
import org.antlr.runtime.tree.RewriteCardinalityException;
import org.apache.log4j.Logger;

import exm.fortx.common.Logging;
import exm.fortx.common.exceptions.FortxRuntimeError;
import exm.fortx.common.exceptions.ParseException;
import exm.fortx.frontend.Frontend;
import exm.fortx.frontend.FrontendAdapter;
import exm.fortx.frontend.FrontendOptions;
import exm.fortx.ir.Units.FileNode;

/**
 * Frontend using the ANTLR grammar in Fortran.g
 */
public class AntlrFrontend implements FrontendAdapter {

  private final Logger logger = Logging.getLogger();

  @Override
  public Frontend frontend() {
    return Frontend.ANTLR;
  }

  @Override
  public FileNode parse(String path, String text, FrontendOptions options)
                                                  throws ParseException {
    // Grammar expects every statement to be terminated
    String input = text.endsWith("\n") ? text : text + "\n";

    FortranLexer lexer = new FortranLexer(new CaseInsensitiveStream(input));
    CommonTokenStream tokens = new CommonTokenStream(lexer);
    FortranParser parser = new FortranParser(tokens);
    parser.setTreeAdaptor(new FortranTreeAdaptor());

    FortranParser.file_return file;
    try {
      file = parser.file();
    } catch (RecognitionException e) {
      throw new ParseException(path, e.line, e.charPositionInLine + 1,
                               "Parsing failed: internal error");
    } catch (RewriteCardinalityException e) {
      // Tree construction failed: report where the parser stopped
      Token at = tokens.LT(-1) != null ? tokens.LT(-1) : tokens.LT(1);
      int line = at == null ? 0 : at.getLine();
      int column = at == null ? 0 : at.getCharPositionInLine() + 1;
      throw new ParseException(path, line, column,
                               "could not build tree: " + e.getMessage());
    }

    /* NOTE: the antlr lexer and parser recover from errors and carry on,
     *    so errors are detected through the flags they set.
     */
    if (lexer.lexerError) {
      throw new ParseException(path, lexer.errorLine, lexer.errorColumn,
                               firstMessage(lexer.errors));
    }
    if (parser.parserError) {
      throw new ParseException(path, parser.errorLine, parser.errorColumn,
                               firstMessage(parser.errors));
    }
    if (file == null || file.getTree() == null) {
      throw new FortxRuntimeError("Parser returned no tree for " + path);
    }

    FortranTree tree = (FortranTree)file.getTree();
    if (logger.isTraceEnabled()) {
      logger.trace("ANTLR tree for " + path + ":\n" + tree.printTree());
    }
    List<? extends Token> tokenList = tokens.getTokens();
    return new AntlrNormalizer(path, text, tokenList).normalize(tree);
  }

  private static String firstMessage(List<String> errors) {
    if (errors.isEmpty()) {
      return "syntax error";
    }
    String first = errors.get(0);
    // Messages are prefixed with line:col, which the exception adds again
    int sep = first.indexOf(": ");
    return sep < 0 ? first : first.substring(sep + 2);
  }

  public static class FortranTreeAdaptor extends CommonTreeAdaptor {
    @Override
    public Object create(Token t) {
      return new FortranTree(t);
    }
  }
}
