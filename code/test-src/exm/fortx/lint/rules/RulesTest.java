package exm.fortx.lint.rules;

import static exm.fortx.Fixtures.source;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.fortx.Fixtures;
import exm.fortx.common.Settings;
import exm.fortx.common.exceptions.InvalidOptionException;
import exm.fortx.lint.Diagnostic;
import exm.fortx.session.Session;

/**
 * Each built-in rule run on its own
 */
public class RulesTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static List<Diagnostic> lint(String rule, String text,
                            String ...keyValues) throws Exception {
    String[] kvs = new String[keyValues.length + 2];
    kvs[0] = Settings.RULES;
    kvs[1] = rule;
    System.arraycopy(keyValues, 0, kvs, 2, keyValues.length);
    try (Session session = Fixtures.session(kvs)) {
      session.addSource("r.f90", text);
      session.resolve();
      return session.lint();
    }
  }

  private static List<String> messages(List<Diagnostic> ds) {
    List<String> result = new ArrayList<String>();
    for (Diagnostic d: ds) {
      result.add(d.message());
    }
    return result;
  }

  @Test
  public void testImplicitNone() throws Exception {
    List<Diagnostic> ds = lint(ImplicitNoneRule.ID, source(
        "module m",
        "contains",
        "  subroutine inner()",
        "  end subroutine inner",
        "end module m",
        "function f(x)",
        "  implicit none",
        "  real :: x, f",
        "  f = x",
        "end function f",
        "subroutine g()",
        "end subroutine g"));
    assertEquals(messages(ds).toString(), 2, ds.size());
    assertEquals("module m has no implicit none", ds.get(0).message());
    assertEquals(1, ds.get(0).line());
    assertEquals("subroutine g has no implicit none", ds.get(1).message());
  }

  private static final String DEEP = source(
      "subroutine deep(n)",
      "  integer, intent(in) :: n",
      "  integer :: i, j, k",
      "  do i = 1, n",
      "    do j = 1, n",
      "      if (i > j) then",
      "        do k = 1, n",
      "          call work(i, j, k)",
      "        end do",
      "      else if (i < j) then",
      "        call other()",
      "      end if",
      "    end do",
      "  end do",
      "end subroutine deep");

  @Test
  public void testNestingDepth() throws Exception {
    List<Diagnostic> ds = lint(NestingDepthRule.ID, DEEP);
    assertEquals(messages(ds).toString(), 1, ds.size());
    assertEquals("nesting depth 4 exceeds 3", ds.get(0).message());
    assertEquals(7, ds.get(0).line());
  }

  @Test
  public void testNestingDepthConfigured() throws Exception {
    assertTrue(lint(NestingDepthRule.ID, DEEP,
                    NestingDepthRule.MAX_KEY, "4").isEmpty());
    List<Diagnostic> ds = lint(NestingDepthRule.ID, DEEP,
                               NestingDepthRule.MAX_KEY, "2");
    assertEquals(1, ds.size());
    assertEquals("nesting depth 3 exceeds 2", ds.get(0).message());
    assertEquals(6, ds.get(0).line());
  }

  @Test
  public void testBannedStatements() throws Exception {
    List<Diagnostic> ds = lint(BannedStatementsRule.ID, source(
        "subroutine s(x)",
        "  real, intent(in) :: x",
        "  print *, x",
        "  go to 10",
        "  stop",
        "end subroutine s"));
    assertEquals(messages(ds).toString(), 3, ds.size());
    assertEquals(3, ds.get(0).line());
    assertEquals(4, ds.get(1).line());
    assertEquals(5, ds.get(2).line());
  }

  @Test
  public void testBannedStatementsConfigured() throws Exception {
    List<Diagnostic> ds = lint(BannedStatementsRule.ID, source(
        "subroutine s(x)",
        "  real, intent(in) :: x",
        "  print *, x",
        "  stop",
        "end subroutine s"), BannedStatementsRule.KEYWORDS_KEY, "stop");
    assertEquals(1, ds.size());
    assertEquals("banned statement: stop", ds.get(0).message());
  }

  @Test
  public void testMaxDummyArgs() throws Exception {
    String text = source(
        "subroutine many(a, b, c)",
        "  real, intent(in) :: a, b, c",
        "end subroutine many");
    assertTrue(lint(MaxDummyArgsRule.ID, text).isEmpty());
    List<Diagnostic> ds = lint(MaxDummyArgsRule.ID, text,
                               MaxDummyArgsRule.MAX_KEY, "2");
    assertEquals(1, ds.size());
    assertEquals("many has 3 dummy arguments, more than 2",
                 ds.get(0).message());
  }

  @Test
  public void testNegativeLimit() throws Exception {
    exception.expect(InvalidOptionException.class);
    exception.expectMessage(MaxDummyArgsRule.MAX_KEY);
    lint(MaxDummyArgsRule.ID, "", MaxDummyArgsRule.MAX_KEY, "-1");
  }

  @Test
  public void testUnresolvedCall() throws Exception {
    List<Diagnostic> ds = lint(UnresolvedCallRule.ID, source(
        "subroutine s()",
        "  use io_mod, only: emit",
        "  call known()",
        "  call emit()",
        "  call nowhere()",
        "end subroutine s",
        "subroutine known()",
        "end subroutine known"));
    assertEquals(messages(ds).toString(), 2, ds.size());
    assertEquals("call to emit from module io_mod, which is not loaded",
                 ds.get(0).message());
    assertEquals("call to unresolved routine nowhere", ds.get(1).message());
  }
}
