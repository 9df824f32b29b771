package exm.fortx.passes;

import static exm.fortx.Fixtures.source;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.fortx.Fixtures;
import exm.fortx.common.Settings;
import exm.fortx.common.exceptions.InvalidOptionException;
import exm.fortx.ir.Node;
import exm.fortx.ir.NodeKind;
import exm.fortx.ir.Nodes;
import exm.fortx.ir.SourceUnit;
import exm.fortx.ir.Statements.CallStatement;
import exm.fortx.ir.Statements.Import;
import exm.fortx.ir.Statements.Pragma;
import exm.fortx.ir.UnitId;
import exm.fortx.ir.Units.Routine;
import exm.fortx.sched.ScheduleResult;
import exm.fortx.session.Session;

public class PassesTest {

  private static final String KERNELS = source(
      "module kernels",
      "contains",
      "  subroutine axpy(n, a, x, y)",
      "    integer, intent(in) :: n",
      "    real, intent(in) :: a",
      "    real, intent(in) :: x(n)",
      "    real, intent(inout) :: y(n)",
      "    integer :: i",
      "    do i = 1, n",
      "      y(i) = y(i) + scale(a, x(i))",
      "    end do",
      "    call log_event(n)",
      "  end subroutine axpy",
      "  function scale(a, b) result(r)",
      "    real, intent(in) :: a, b",
      "    real :: r",
      "    r = a * b",
      "  end function scale",
      "end module kernels");

  private static final String ALL_PASSES =
      "remove-calls,loop-pragmas,routine-seq,infer-pure";

  private static final UnitId AXPY = UnitId.parse("kernels#axpy");
  private static final UnitId SCALE = UnitId.parse("kernels#scale");

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static Session kernelSession(String passes) throws Exception {
    Session session = Fixtures.session(Settings.PASSES, passes,
        Settings.REMOVE_CALLS_NAMES, "log_event");
    session.addSource("kernels.f90", KERNELS);
    session.resolve();
    return session;
  }

  @Test
  public void testAllPasses() throws Exception {
    try (Session session = kernelSession(ALL_PASSES)) {
      ScheduleResult result = session.runPasses();
      assertFalse(result.isAborted());
      assertTrue(result.failures().isEmpty());

      Routine axpy = session.program().routine(AXPY);
      assertEquals(NodeKind.PRAGMA, axpy.body().get(0).kind());
      assertEquals("!$acc parallel loop", ((Pragma)axpy.body().get(0)).text());
      assertEquals(NodeKind.LOOP, axpy.body().get(1).kind());
      assertEquals(2, axpy.body().size());
      assertTrue(axpy.hasPrefix("pure"));

      Routine scale = session.program().routine(SCALE);
      assertTrue(RoutineSeqPass.isMarked(scale));
      assertTrue(scale.hasPrefix("pure"));

      // One diagnostic per change
      assertEquals(5, result.diagnostics().size());
    }
  }

  /**
   * Running the passes on their own output, re-read from text, changes
   * nothing
   */
  @Test
  public void testIdempotent() throws Exception {
    String rewritten;
    try (Session session = kernelSession(ALL_PASSES)) {
      session.runPasses();
      SourceUnit unit = session.program().sources().get(0);
      rewritten = session.regenerate(unit);
      assertTrue(session.report().regenerationFailures().isEmpty());
    }

    try (Session session = Fixtures.session(Settings.PASSES, ALL_PASSES,
                              Settings.REMOVE_CALLS_NAMES, "log_event")) {
      SourceUnit unit = session.addSource("kernels.f90", rewritten);
      session.resolve();
      Node before = unit.root();
      ScheduleResult result = session.runPasses();
      assertTrue(result.diagnostics().toString(),
                 result.diagnostics().isEmpty());
      assertTrue(Nodes.equivalent(before, unit.root()));
      assertEquals(rewritten, session.regenerate(unit));
    }
  }

  @Test
  public void testLoopPragmaOnlyOutermost() throws Exception {
    try (Session session = Fixtures.session(Settings.PASSES, "loop-pragmas",
                       Settings.LOOP_PRAGMA_TEXT, "!$omp parallel do")) {
      session.addSource("nest.f90", source(
          "subroutine nest(a)",
          "  real, intent(inout) :: a(10, 10)",
          "  integer :: i, j",
          "  do j = 1, 10",
          "    do i = 1, 10",
          "      a(i, j) = 0.0",
          "    end do",
          "  end do",
          "end subroutine nest"));
      session.resolve();
      session.runPasses();
      Routine nest = session.program().routine(UnitId.external("nest"));
      assertEquals(2, nest.body().size());
      assertEquals("omp", ((Pragma)nest.body().get(0)).family());
    }
  }

  @Test
  public void testRemoveCallsDropsEmptyInlineIf() throws Exception {
    try (Session session = Fixtures.session(Settings.PASSES, "remove-calls",
                          Settings.REMOVE_CALLS_NAMES, "trace, flush_log")) {
      session.addSource("t.f90", source(
          "subroutine work(debug)",
          "  logical, intent(in) :: debug",
          "  if (debug) call trace('work')",
          "  call compute()",
          "  call FLUSH_LOG()",
          "end subroutine work"));
      session.resolve();
      ScheduleResult result = session.runPasses();
      Routine work = session.program().routine(UnitId.external("work"));
      assertEquals(1, work.body().size());
      assertEquals("compute", work.body().get(0).label());
      assertEquals(2, result.diagnostics().size());
    }
  }

  @Test
  public void testRoutineSeqAfterUse() throws Exception {
    try (Session session = Fixtures.session(Settings.PASSES, "routine-seq")) {
      session.addSource("d.f90", source(
          "subroutine driver()",
          "  !$acc routine seq",
          "  call leaf()",
          "end subroutine driver",
          "subroutine leaf()",
          "  use iso_fortran_env",
          "  integer :: k",
          "  k = 1",
          "end subroutine leaf"));
      session.resolve();
      session.runPasses();
      Routine leaf = session.program().routine(UnitId.external("leaf"));
      List<Node> spec = leaf.spec();
      assertEquals(NodeKind.IMPORT, spec.get(0).kind());
      assertEquals(NodeKind.PRAGMA, spec.get(1).kind());
      assertEquals(RoutineSeqPass.DIRECTIVE, ((Pragma)spec.get(1)).text());
    }
  }

  @Test
  public void testImpureNotMarked() throws Exception {
    try (Session session = Fixtures.session(Settings.PASSES, "infer-pure")) {
      session.addSource("p.f90", source(
          "subroutine noisy(x)",
          "  real, intent(in) :: x",
          "  print *, x",
          "end subroutine noisy",
          "subroutine loose(x)",
          "  real :: x",
          "  x = 1.0",
          "end subroutine loose",
          "function twice(x)",
          "  real, intent(in) :: x",
          "  real :: twice",
          "  twice = 2.0 * x",
          "end function twice"));
      session.resolve();
      session.runPasses();
      assertFalse(session.program().routine(UnitId.external("noisy"))
                                                      .hasPrefix("pure"));
      assertFalse(session.program().routine(UnitId.external("loose"))
                                                      .hasPrefix("pure"));
      assertTrue(session.program().routine(UnitId.external("twice"))
                                                      .hasPrefix("pure"));
    }
  }

  private static final String DRIVER = source(
      "module kernels",
      "contains",
      "  subroutine kern(n, x)",
      "    integer, intent(in) :: n",
      "    real, intent(inout) :: x(n)",
      "    x = 2.0 * x",
      "  end subroutine kern",
      "end module kernels",
      "subroutine driver(n, x)",
      "  use kernels, only: kern",
      "  integer, intent(in) :: n",
      "  real, intent(inout) :: x(n)",
      "  call kern(n, x)",
      "end subroutine driver");

  private static final UnitId KERN = UnitId.parse("kernels#kern");
  private static final UnitId KERN_COPY =
                              UnitId.parse("kernels#kern_duplicated");
  private static final UnitId DRIVER_ID = UnitId.external("driver");

  private static Session driverSession(String text) throws Exception {
    Session session = Fixtures.session(Settings.PASSES, "duplicate-kernel",
        Settings.DUPLICATE_KERNEL_NAMES, "kern");
    session.addSource("driver.f90", text);
    session.resolve();
    return session;
  }

  @Test
  public void testDuplicateKernel() throws Exception {
    try (Session session = driverSession(DRIVER)) {
      ScheduleResult result = session.runPasses();
      assertTrue(result.failures().isEmpty());

      Routine copy = session.program().routine(KERN_COPY);
      assertEquals("kern_duplicated", copy.name());
      assertEquals(session.program().routine(KERN).dummies(),
                   copy.dummies());
      assertEquals(session.program().routine(KERN).body().size(),
                   copy.body().size());

      Routine driver = session.program().routine(DRIVER_ID);
      assertEquals(2, driver.body().size());
      assertEquals("kern", ((CallStatement)driver.body().get(0)).name());
      CallStatement added = (CallStatement)driver.body().get(1);
      assertEquals("kern_duplicated", added.name());
      assertEquals(2, added.args().size());
      Import use = (Import)driver.spec().get(0);
      assertEquals(Arrays.asList("kern", "kern_duplicated"), use.symbols());

      assertEquals(Arrays.asList(KERN, KERN_COPY),
                   session.callGraph().callees(DRIVER_ID));
      assertTrue(session.callGraph().unresolvedEdges(
                   session.program().routineIds()).isEmpty());
      assertEquals(1, result.diagnostics().size());
    }
  }

  @Test
  public void testDuplicateKernelIdempotent() throws Exception {
    String rewritten;
    try (Session session = driverSession(DRIVER)) {
      session.runPasses();
      SourceUnit unit = session.program().sources().get(0);
      rewritten = session.regenerate(unit);
      assertTrue(session.report().regenerationFailures().isEmpty());
      assertTrue(rewritten, rewritten.contains("kern_duplicated"));
    }

    try (Session session = driverSession(rewritten)) {
      SourceUnit unit = session.program().sources().get(0);
      Node before = unit.root();
      ScheduleResult result = session.runPasses();
      assertTrue(result.diagnostics().toString(),
                 result.diagnostics().isEmpty());
      assertTrue(Nodes.equivalent(before, unit.root()));
      assertEquals(2, session.program().routine(DRIVER_ID).body().size());
      assertEquals(rewritten, session.regenerate(unit));
    }
  }

  @Test
  public void testDuplicateExternalKernel() throws Exception {
    try (Session session = Fixtures.session(Settings.PASSES,
          "duplicate-kernel", Settings.DUPLICATE_KERNEL_NAMES, "step",
          Settings.DUPLICATE_KERNEL_SUFFIX, "_gpu")) {
      session.addSource("s.f90", source(
          "subroutine run(flag)",
          "  logical, intent(in) :: flag",
          "  call step()",
          "  if (flag) call missing_kernel()",
          "end subroutine run",
          "subroutine step()",
          "end subroutine step"));
      session.resolve();
      session.runPasses();

      UnitId copy = UnitId.external("step_gpu");
      assertEquals("step_gpu", session.program().routine(copy).name());
      assertEquals(Arrays.asList(UnitId.external("step"), copy),
          session.callGraph().callees(UnitId.external("run")));
      // Placed right after the original
      List<Routine> routines =
          session.program().sources().get(0).root().routines();
      assertEquals("step_gpu", routines.get(2).name());
    }
  }

  @Test
  public void testBadDuplicateSuffix() throws Exception {
    exception.expect(InvalidOptionException.class);
    Fixtures.session(Settings.DUPLICATE_KERNEL_SUFFIX, "-copy");
  }

  @Test
  public void testUnknownPass() throws Exception {
    exception.expect(InvalidOptionException.class);
    exception.expectMessage("no-such-pass");
    PassRegistry.standard(Fixtures.settings()).selected(
        Fixtures.settings(Settings.PASSES, "loop-pragmas, no-such-pass"));
  }

  @Test
  public void testNoPassesSelected() throws Exception {
    try (Session session = Fixtures.session()) {
      session.addSource("d.f90", KERNELS);
      session.resolve();
      ScheduleResult result = session.runPasses(
          Collections.<UnitId>emptyList(),
          PassRegistry.standard(session.settings()).selected(
                                                  session.settings()));
      assertEquals(0, result.executed());
    }
  }
}
