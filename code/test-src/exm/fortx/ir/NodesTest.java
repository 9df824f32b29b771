package exm.fortx.ir;

import static exm.fortx.Fixtures.parseAntlr;
import static exm.fortx.Fixtures.source;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import exm.fortx.ir.Units.FileNode;

public class NodesTest {

  @Test
  public void testEquivalenceIgnoresLayout() throws Exception {
    FileNode a = parseAntlr(source(
        "SUBROUTINE S(X)",
        "  REAL, INTENT(IN) :: X",
        "  Y = (X + 1)",
        "END SUBROUTINE S"));
    FileNode b = parseAntlr(source(
        "subroutine s(x)",
        "",
        "      real, intent(in) :: x",
        "      y = x + 1",
        "end subroutine s"));
    assertTrue(Nodes.equivalent(a, b));
    assertFalse(Nodes.fingerprint(a).equals(Nodes.fingerprint(b)));
  }

  @Test
  public void testDifferentValues() throws Exception {
    FileNode a = parseAntlr(source("subroutine s()", "  y = 1",
                                   "end subroutine s"));
    FileNode b = parseAntlr(source("subroutine s()", "  y = 2",
                                   "end subroutine s"));
    assertFalse(Nodes.equivalent(a, b));
    assertFalse(Nodes.fingerprint(a).equals(Nodes.fingerprint(b)));
  }

  @Test
  public void testDeepCopy() throws Exception {
    FileNode a = parseAntlr(source("subroutine s()", "  call f(1)",
                                   "end subroutine s"));
    Node copy = Nodes.deepCopy(a);
    assertNotSame(a, copy);
    assertNotSame(a.routines().get(0), ((FileNode)copy).routines().get(0));
    assertTrue(Nodes.equivalent(a, copy));
    assertEquals(Nodes.fingerprint(a), Nodes.fingerprint(copy));
  }
}
