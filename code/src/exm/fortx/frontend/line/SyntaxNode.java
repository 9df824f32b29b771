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

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Raw tree built by the statement classifier.  Node types are named
 * after the syntax rules of the Fortran standard.  Constructs wrap their
 * opening statement, their body and their closing statement.
 */
public class SyntaxNode {
  /* Constructs */
  public static final String PROGRAM = "Program";
  public static final String MODULE = "Module";
  public static final String SUBROUTINE_SUBPROGRAM = "Subroutine_Subprogram";
  public static final String FUNCTION_SUBPROGRAM = "Function_Subprogram";
  public static final String IF_CONSTRUCT = "If_Construct";
  public static final String BLOCK_NONLABEL_DO_CONSTRUCT =
                                      "Block_Nonlabel_Do_Construct";
  public static final String BLOCK_LABEL_DO_CONSTRUCT =
                                      "Block_Label_Do_Construct";
  public static final String BLOCK_CONSTRUCT = "Block_Construct";

  /* Statements */
  public static final String MODULE_STMT = "Module_Stmt";
  public static final String END_MODULE_STMT = "End_Module_Stmt";
  public static final String SUBROUTINE_STMT = "Subroutine_Stmt";
  public static final String END_SUBROUTINE_STMT = "End_Subroutine_Stmt";
  public static final String FUNCTION_STMT = "Function_Stmt";
  public static final String END_FUNCTION_STMT = "End_Function_Stmt";
  /** Bare END closing whichever program unit is open */
  public static final String END_STMT = "End_Stmt";
  public static final String CONTAINS_STMT = "Contains_Stmt";
  public static final String IF_THEN_STMT = "If_Then_Stmt";
  public static final String ELSE_IF_STMT = "Else_If_Stmt";
  public static final String ELSE_STMT = "Else_Stmt";
  public static final String END_IF_STMT = "End_If_Stmt";
  public static final String IF_STMT = "If_Stmt";
  public static final String NONLABEL_DO_STMT = "Nonlabel_Do_Stmt";
  public static final String LABEL_DO_STMT = "Label_Do_Stmt";
  public static final String END_DO_STMT = "End_Do_Stmt";
  public static final String BLOCK_STMT = "Block_Stmt";
  public static final String END_BLOCK_STMT = "End_Block_Stmt";
  public static final String USE_STMT = "Use_Stmt";
  public static final String TYPE_DECLARATION_STMT = "Type_Declaration_Stmt";
  public static final String ASSIGNMENT_STMT = "Assignment_Stmt";
  public static final String POINTER_ASSIGNMENT_STMT =
                                      "Pointer_Assignment_Stmt";
  public static final String CALL_STMT = "Call_Stmt";
  public static final String CONTINUE_STMT = "Continue_Stmt";
  public static final String INCLUDE_STMT = "Include_Stmt";
  /** Any other statement, kept as text */
  public static final String OTHER_STMT = "Other_Stmt";
  public static final String COMMENT = "Comment";

  private final String type;
  private final String text;
  private final String label;
  private final int firstLine;
  private int lastLine;
  private final boolean included;
  private final List<SyntaxNode> children = new ArrayList<SyntaxNode>();

  public SyntaxNode(String type, String text, String label, int firstLine,
                    int lastLine, boolean included) {
    this.type = type;
    this.text = text;
    this.label = label;
    this.firstLine = firstLine;
    this.lastLine = lastLine;
    this.included = included;
  }

  public String type() {
    return type;
  }

  public boolean is(String t) {
    return type.equals(t);
  }

  /** @return statement text without label, or null for constructs */
  public String text() {
    return text;
  }

  /** @return statement label, or for a labelled DO its terminal label */
  public String label() {
    return label;
  }

  public int firstLine() {
    return firstLine;
  }

  public int lastLine() {
    return lastLine;
  }

  void extendTo(int line) {
    this.lastLine = Math.max(lastLine, line);
  }

  public boolean included() {
    return included;
  }

  public void add(SyntaxNode child) {
    children.add(child);
  }

  public List<SyntaxNode> children() {
    return Collections.unmodifiableList(children);
  }

  public SyntaxNode first() {
    return children.get(0);
  }

  public SyntaxNode last() {
    return children.get(children.size() - 1);
  }

  public String printTree() {
    StringWriter sw = new StringWriter();
    PrintWriter writer = new PrintWriter(sw);
    printTree(writer, 0);
    writer.flush();
    return sw.toString();
  }

  private void printTree(PrintWriter writer, int indent) {
    for (int i = 0; i < indent; i++) {
      writer.print(' ');
    }
    writer.print(type);
    if (text != null) {
      writer.print(": " + text);
    }
    writer.println();
    for (SyntaxNode child: children) {
      child.printTree(writer, indent + 2);
    }
  }

  @Override
  public String toString() {
    return type + "@" + firstLine;
  }
}
