package exm.fortx.resolve;

import static exm.fortx.Fixtures.source;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import exm.fortx.Fixtures;
import exm.fortx.ir.SourceUnit;
import exm.fortx.ir.Statements.Assignment;
import exm.fortx.ir.Statements.BlockConstruct;
import exm.fortx.ir.Statements.CallStatement;
import exm.fortx.ir.UnitId;
import exm.fortx.ir.Units.Routine;
import exm.fortx.session.Session;

public class ResolverTest {

  private static final String SHADOWING = source(
      "module m",
      "  integer :: x",
      "contains",
      "  subroutine s()",
      "    real :: x",
      "    x = 1.0",
      "    block",
      "      logical :: x",
      "      x = .true.",
      "    end block",
      "  end subroutine s",
      "  subroutine t()",
      "    x = 2",
      "  end subroutine t",
      "end module m");

  @Test
  public void testShadowing() throws Exception {
    try (Session session = Fixtures.session()) {
      SourceUnit unit = session.addSource("m.f90", SHADOWING);
      session.resolve();
      Resolution r = unit.resolution();

      Routine s = (Routine)unit.find(UnitId.parse("m#s"));
      Symbol routineX = r.symbol(((Assignment)s.body().get(0)).target());
      assertEquals(ScopeKind.ROUTINE, routineX.scope().kind());
      assertEquals("real", routineX.type().base());

      BlockConstruct block = (BlockConstruct)s.body().get(1);
      Symbol blockX = r.symbol(((Assignment)block.body().get(0)).target());
      assertEquals(ScopeKind.BLOCK, blockX.scope().kind());
      assertEquals("logical", blockX.type().base());

      Routine t = (Routine)unit.find(UnitId.parse("m#t"));
      Symbol moduleX = r.symbol(((Assignment)t.body().get(0)).target());
      assertEquals(ScopeKind.MODULE, moduleX.scope().kind());
      assertEquals("integer", moduleX.type().base());
      assertEquals(SymbolKind.VARIABLE, moduleX.kind());
    }
  }

  @Test
  public void testUseAcrossFiles() throws Exception {
    try (Session session = Fixtures.session()) {
      session.addSource("consts.f90", source(
          "module consts",
          "  real, parameter :: pi = 3.14",
          "end module consts"));
      SourceUnit user = session.addSource("user.f90", source(
          "subroutine area(r, a)",
          "  use consts",
          "  real, intent(in) :: r",
          "  real, intent(out) :: a",
          "  a = pi * r * r",
          "end subroutine area"));
      session.resolve();

      Routine area = (Routine)user.find(UnitId.external("area"));
      Scope scope = user.resolution().unitScope(UnitId.external("area"));
      Symbol pi = scope.lookup("pi");
      assertNotNull(pi);
      assertEquals(SymbolKind.PARAMETER, pi.kind());
      assertEquals("consts", pi.scope().name());
      assertEquals(SymbolKind.DUMMY, scope.lookup("r").kind());
      assertNotNull(area);
      assertTrue(user.resolution().warnings().isEmpty());
    }
  }

  @Test
  public void testUnloadedModule() throws Exception {
    try (Session session = Fixtures.session()) {
      SourceUnit unit = session.addSource("u.f90", source(
          "subroutine s()",
          "  use missing_mod, only: helper",
          "  call helper()",
          "  y = 1",
          "end subroutine s"));
      session.resolve();

      Routine s = (Routine)unit.find(UnitId.external("s"));
      Symbol helper = unit.resolution().symbol(s.body().get(0));
      assertEquals(SymbolKind.IMPORTED, helper.kind());
      assertTrue(helper.hasAttribute("use:missing_mod"));

      Symbol y = unit.resolution().symbol(
                          ((Assignment)s.body().get(1)).target());
      assertEquals(SymbolKind.UNRESOLVED, y.kind());
      assertEquals(2, unit.resolution().warnings().size());
    }
  }

  @Test
  public void testExternalCallResolved() throws Exception {
    try (Session session = Fixtures.session()) {
      SourceUnit a = session.addSource("a.f90", source(
          "subroutine a()",
          "  call b()",
          "  call nowhere()",
          "end subroutine a"));
      session.addSource("b.f90", source(
          "subroutine b()",
          "end subroutine b"));
      session.resolve();

      Routine routine = (Routine)a.find(UnitId.external("a"));
      CallStatement toB = (CallStatement)routine.body().get(0);
      assertEquals(UnitId.external("b"), a.resolution().symbol(toB).unitId());
      CallStatement toNowhere = (CallStatement)routine.body().get(1);
      Symbol missing = a.resolution().symbol(toNowhere);
      assertEquals(SymbolKind.UNRESOLVED, missing.kind());
      assertNull(missing.unitId());
    }
  }

  @Test
  public void testContainedRoutineSeesHost() throws Exception {
    try (Session session = Fixtures.session()) {
      SourceUnit unit = session.addSource("h.f90", source(
          "subroutine host()",
          "  integer :: counter",
          "  call bump()",
          "contains",
          "  subroutine bump()",
          "    counter = counter + 1",
          "  end subroutine bump",
          "end subroutine host"));
      session.resolve();

      UnitId bumpId = UnitId.external("host").member("bump");
      Routine bump = (Routine)unit.find(bumpId);
      Symbol counter = unit.resolution().symbol(
                          ((Assignment)bump.body().get(0)).target());
      assertEquals("host", counter.scope().name());
      Routine host = (Routine)unit.find(UnitId.external("host"));
      assertEquals(bumpId,
                   unit.resolution().symbol(host.body().get(0)).unitId());
    }
  }

  @Test
  public void testReplacedModuleRoutineKeepsHostScope() throws Exception {
    try (Session session = Fixtures.session()) {
      SourceUnit unit = session.addSource("m.f90", SHADOWING);
      session.resolve();
      UnitId sId = UnitId.parse("m#s");
      UnitId tId = UnitId.parse("m#t");
      Scope hostBefore = unit.resolution().unitScope(UnitId.module("m"));

      Routine s = (Routine)unit.find(sId);
      Routine changed = s.withBody(s.body().subList(0, 1));
      session.program().replaceRoutine(sId, changed);

      Resolution r = unit.resolution();
      Scope host = r.unitScope(UnitId.module("m"));
      assertSame(hostBefore, host);
      assertSame(host, r.unitScope(tId).parent());
      Routine current = (Routine)unit.find(sId);
      assertSame(current, host.lookupLocal("s").declaration());
      assertEquals(1, current.body().size());

      Routine t = (Routine)unit.find(tId);
      Symbol moduleX = r.symbol(((Assignment)t.body().get(0)).target());
      assertEquals(ScopeKind.MODULE, moduleX.scope().kind());
    }
  }
}
