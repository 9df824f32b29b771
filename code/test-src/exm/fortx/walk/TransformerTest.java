package exm.fortx.walk;

import static exm.fortx.Fixtures.parseAntlr;
import static exm.fortx.Fixtures.source;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import exm.fortx.ir.Node;
import exm.fortx.ir.NodeKind;
import exm.fortx.ir.Statements.CallStatement;
import exm.fortx.ir.Statements.Comment;
import exm.fortx.ir.Statements.Loop;
import exm.fortx.ir.Units.FileNode;
import exm.fortx.ir.Units.Routine;

public class TransformerTest {

  private static final String TEXT = source(
      "subroutine s(n)",
      "  integer, intent(in) :: n",
      "  integer :: i",
      "  call setup()",
      "  do i = 1, n",
      "    call step(i)",
      "  end do",
      "end subroutine s");

  private static Routine routine() throws Exception {
    return parseAntlr(TEXT).routines().get(0);
  }

  @Test
  public void testNothingChanged() throws Exception {
    FileNode root = parseAntlr(TEXT);
    Node result = new Transformer(Transformer.Order.PRE) {
      @Override
      public Replacement transform(Node node, WalkContext context) {
        return Replacement.keep();
      }
    }.apply(root);
    assertSame(root, result);
    assertNotNull(result.span());
  }

  @Test
  public void testDeleteLosesOnlyPathSpans() throws Exception {
    Routine r = routine();
    Routine result = new Transformer(Transformer.Order.PRE,
                                     NodeFilter.of(NodeKind.CALL)) {
      @Override
      public Replacement transform(Node node, WalkContext context) {
        if (((CallStatement)node).name().equals("step")) {
          return Replacement.delete();
        }
        return Replacement.keep();
      }
    }.applyTyped(r);

    assertNull(result.span());
    Loop loop = (Loop)result.body().get(1);
    assertTrue(loop.body().isEmpty());
    assertNull(loop.span());
    // Untouched siblings are shared
    assertSame(r.body().get(0), result.body().get(0));
    assertNotNull(result.body().get(0).span());
  }

  @Test
  public void testInsertBefore() throws Exception {
    Routine result = new Transformer(Transformer.Order.POST,
                                     NodeFilter.of(NodeKind.LOOP)) {
      @Override
      public Replacement transform(Node node, WalkContext context) {
        return Replacement.of(Arrays.asList(
            new Comment(null, "! loop follows"), node));
      }
    }.applyTyped(routine());
    assertEquals(3, result.body().size());
    assertEquals(NodeKind.COMMENT, result.body().get(1).kind());
    assertEquals(NodeKind.LOOP, result.body().get(2).kind());
  }

  @Test
  public void testContextDepth() throws Exception {
    final List<String> seen = new ArrayList<String>();
    Walker.preOrder(routine(), NodeFilter.of(NodeKind.CALL),
        new Visitor() {
          @Override
          public void visit(Node node, WalkContext context) {
            seen.add(((CallStatement)node).name() + ":" +
                     context.countEnclosing(NodeKind.LOOP) + ":" +
                     context.enclosingRoutine().name());
          }
        });
    assertEquals(Arrays.asList("setup:0:s", "step:1:s"), seen);
  }
}
