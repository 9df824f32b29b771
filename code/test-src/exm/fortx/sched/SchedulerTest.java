package exm.fortx.sched;

import static exm.fortx.Fixtures.source;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.junit.Test;

import exm.fortx.Fixtures;
import exm.fortx.common.Settings;
import exm.fortx.common.exceptions.SchedulingException;
import exm.fortx.common.exceptions.TransformException;
import exm.fortx.ir.Node;
import exm.fortx.ir.NodeKind;
import exm.fortx.ir.Statements.Comment;
import exm.fortx.ir.UnitId;
import exm.fortx.ir.Units.Routine;
import exm.fortx.passes.PurityPass;
import exm.fortx.sched.Pass.RoutinePass;
import exm.fortx.session.ExitCode;
import exm.fortx.session.Session;

public class SchedulerTest {

  private static final String CHAIN = source(
      "subroutine a()",
      "  call b()",
      "end subroutine a",
      "subroutine b()",
      "  call c()",
      "end subroutine b",
      "subroutine c()",
      "end subroutine c");

  private static final String RECURSIVE = source(
      "subroutine ping(n)",
      "  integer, intent(in) :: n",
      "  if (n > 0) call pong(n - 1)",
      "end subroutine ping",
      "subroutine pong(n)",
      "  integer, intent(in) :: n",
      "  if (n > 0) call ping(n - 1)",
      "end subroutine pong");

  private static final UnitId A = UnitId.external("a");
  private static final UnitId B = UnitId.external("b");
  private static final UnitId C = UnitId.external("c");

  /**
   * Records the routines it sees, changes nothing
   */
  private static class RecordingPass extends RoutinePass {
    final List<String> visited =
                Collections.synchronizedList(new ArrayList<String>());

    RecordingPass(PassOrder order) {
      super("record", order);
    }

    @Override
    public PassResult apply(Routine routine, PassContext context) {
      visited.add(routine.name());
      return PassResult.of(routine);
    }
  }

  /**
   * Appends a comment once; fails on one routine
   */
  private static class TagPass extends RoutinePass {
    private final String failOn;
    private final boolean fatal;

    TagPass(String failOn, boolean fatal) {
      super("tag", PassOrder.NONE);
      this.failOn = failOn;
      this.fatal = fatal;
    }

    @Override
    public boolean fatalOnError() {
      return fatal;
    }

    @Override
    public PassResult apply(Routine routine, PassContext context)
                                                throws TransformException {
      if (routine.name().equals(failOn)) {
        throw new TransformException("cannot tag " + routine.name());
      }
      if (isTagged(routine)) {
        return PassResult.of(routine);
      }
      List<Node> body = new ArrayList<Node>(routine.body());
      body.add(new Comment(null, "! tagged"));
      return PassResult.of(routine.withBody(body));
    }
  }

  /**
   * Rewrites a routine on every call
   */
  private static class RestlessPass extends RoutinePass {
    RestlessPass() {
      super("restless", PassOrder.CALLEE_FIRST);
    }

    @Override
    public boolean dependsOnCallees() {
      return true;
    }

    @Override
    public PassResult apply(Routine routine, PassContext context) {
      List<Node> body = new ArrayList<Node>(routine.body());
      body.add(new Comment(null, "! again"));
      return PassResult.of(routine.withBody(body));
    }
  }

  /**
   * Blocks on one routine well past the run timeout
   */
  private static class SlowPass extends RoutinePass {
    private final String slowOn;

    SlowPass(String slowOn) {
      super("slow", PassOrder.CALLEE_FIRST);
      this.slowOn = slowOn;
    }

    @Override
    public PassResult apply(Routine routine, PassContext context) {
      if (routine.name().equals(slowOn)) {
        try {
          Thread.sleep(3000);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
      }
      return PassResult.of(routine);
    }
  }

  private static boolean isTagged(Routine routine) {
    for (Node n: routine.body()) {
      if (n.kind() == NodeKind.COMMENT &&
          ((Comment)n).text().equals("! tagged")) {
        return true;
      }
    }
    return false;
  }

  private static List<UnitId> all() {
    return Collections.<UnitId>emptyList();
  }

  @Test
  public void testCalleeFirst() throws Exception {
    try (Session session = Fixtures.session()) {
      session.addSource("chain.f90", CHAIN);
      session.resolve();
      RecordingPass pass = new RecordingPass(PassOrder.CALLEE_FIRST);
      session.runPasses(all(), Arrays.<Pass>asList(pass));
      assertEquals(Arrays.asList("c", "b", "a"), pass.visited);
    }
  }

  @Test
  public void testCallerFirst() throws Exception {
    try (Session session = Fixtures.session()) {
      session.addSource("chain.f90", CHAIN);
      session.resolve();
      RecordingPass pass = new RecordingPass(PassOrder.CALLER_FIRST);
      session.runPasses(all(), Arrays.<Pass>asList(pass));
      assertEquals(Arrays.asList("a", "b", "c"), pass.visited);
    }
  }

  @Test
  public void testRootsLimitReach() throws Exception {
    try (Session session = Fixtures.session()) {
      session.addSource("chain.f90", CHAIN);
      session.resolve();
      RecordingPass pass = new RecordingPass(PassOrder.CALLEE_FIRST);
      session.runPasses(Arrays.asList(B), Arrays.<Pass>asList(pass));
      assertEquals(Arrays.asList("c", "b"), pass.visited);
    }
  }

  @Test
  public void testCacheSkipsUnchanged() throws Exception {
    try (Session session = Fixtures.session()) {
      session.addSource("chain.f90", CHAIN);
      session.resolve();
      RecordingPass pass = new RecordingPass(PassOrder.CALLEE_FIRST);
      List<Pass> passes = Arrays.<Pass>asList(pass);

      ScheduleResult first = session.runPasses(all(), passes);
      assertEquals(3, first.executed());
      ScheduleResult second = session.runPasses(all(), passes);
      assertEquals(0, second.executed());
      assertEquals(3, second.cacheHits());
      assertEquals(3, pass.visited.size());
    }
  }

  @Test
  public void testCacheAfterRewrite() throws Exception {
    try (Session session = Fixtures.session()) {
      session.addSource("chain.f90", CHAIN);
      session.resolve();
      List<Pass> passes = Arrays.<Pass>asList(new TagPass(null, false));

      ScheduleResult first = session.runPasses(all(), passes);
      assertEquals(3, first.executed());
      assertTrue(isTagged(session.program().routine(A)));

      ScheduleResult second = session.runPasses(all(), passes);
      assertEquals(0, second.executed());
      assertEquals(3, second.cacheHits());
    }
  }

  @Test
  public void testFatalFailureAborts() throws Exception {
    try (Session session = Fixtures.session()) {
      session.addSource("chain.f90", CHAIN);
      session.resolve();
      RecordingPass after = new RecordingPass(PassOrder.NONE);
      ScheduleResult result = session.runPasses(all(),
          Arrays.<Pass>asList(new TagPass("b", true), after));

      assertTrue(result.isAborted());
      assertNotNull(result.fatal());
      assertEquals(B, result.fatal().unit());
      assertTrue(after.visited.isEmpty());
      assertTrue(result.incomplete().contains("record:" + A));
      assertEquals(ExitCode.ERROR_TRANSFORM, session.report().exitCode());
    }
  }

  @Test
  public void testNonFatalFailureIsolated() throws Exception {
    try (Session session = Fixtures.session()) {
      session.addSource("chain.f90", CHAIN);
      session.resolve();
      RecordingPass after = new RecordingPass(PassOrder.NONE);
      ScheduleResult result = session.runPasses(all(),
          Arrays.<Pass>asList(new TagPass("b", false), after));

      assertFalse(result.isAborted());
      assertNull(result.fatal());
      assertEquals(1, result.failures().size());
      assertEquals(B, result.failures().get(0).unit());
      assertTrue(isTagged(session.program().routine(A)));
      assertFalse(isTagged(session.program().routine(B)));
      assertTrue(isTagged(session.program().routine(C)));
      assertEquals(3, after.visited.size());
    }
  }

  @Test
  public void testMutualRecursionConverges() throws Exception {
    try (Session session = Fixtures.session()) {
      session.addSource("rec.f90", RECURSIVE);
      session.resolve();
      UnitId ping = UnitId.external("ping");
      assertEquals(Arrays.asList(UnitId.external("pong")),
                   session.callGraph().callees(ping));

      ScheduleResult result = session.runPasses(all(),
          Arrays.<Pass>asList(new PurityPass(), new TagPass(null, false)));
      assertFalse(result.isAborted());
      assertFalse(session.program().routine(ping).hasPrefix("pure"));
      assertTrue(isTagged(session.program().routine(ping)));
    }
  }

  @Test
  public void testMutualRecursionWithoutFixedPoint() throws Exception {
    String first = nonConvergingMessage();
    String second = nonConvergingMessage();
    assertTrue(first, first.contains("fixed point"));
    assertTrue(first, first.contains("#ping"));
    assertEquals(first, second);
  }

  private String nonConvergingMessage() throws Exception {
    try (Session session = Fixtures.session(
                              Settings.SCHEDULE_MAX_ROUNDS, "3")) {
      session.addSource("rec.f90", RECURSIVE);
      session.resolve();
      try {
        session.runPasses(all(), Arrays.<Pass>asList(new RestlessPass()));
        fail("Expected SchedulingException");
      } catch (SchedulingException e) {
        assertNotNull(session.report().schedulingError());
        assertEquals(ExitCode.ERROR_SCHEDULING, session.report().exitCode());
        return e.getMessage();
      }
      return null;
    }
  }

  @Test
  public void testTimeoutLeavesRestIncomplete() throws Exception {
    try (Session session = Fixtures.session(Settings.TIMEOUT_MS, "200")) {
      session.addSource("chain.f90", CHAIN);
      session.resolve();
      RecordingPass after = new RecordingPass(PassOrder.NONE);
      ScheduleResult result = session.runPasses(all(),
          Arrays.<Pass>asList(new SlowPass("c"), after));

      assertTrue(result.timedOut());
      assertTrue(result.isAborted());
      assertNull(result.fatal());
      assertTrue(after.visited.isEmpty());
      Set<String> expected = new TreeSet<String>(Arrays.asList(
          "slow:" + A, "slow:" + B, "slow:" + C,
          "record:" + A, "record:" + B, "record:" + C));
      assertEquals(expected, result.incomplete());
    }
  }

  @Test
  public void testNoTimeoutByDefault() throws Exception {
    try (Session session = Fixtures.session()) {
      session.addSource("chain.f90", CHAIN);
      session.resolve();
      ScheduleResult result = session.runPasses(all(),
          Arrays.<Pass>asList(new RecordingPass(PassOrder.CALLEE_FIRST)));
      assertFalse(result.timedOut());
      assertTrue(result.incomplete().isEmpty());
    }
  }

  @Test
  public void testUnresolvedCallKeptAsEdge() throws Exception {
    try (Session session = Fixtures.session()) {
      session.addSource("u.f90", source(
          "subroutine a()",
          "  call b()",
          "  call missing(1)",
          "end subroutine a",
          "subroutine b()",
          "end subroutine b"));
      session.resolve();

      List<CallEdge> edges = session.callGraph().edges(A);
      assertEquals(2, edges.size());
      assertEquals(B, edges.get(0).callee());
      CallEdge missing = edges.get(1);
      assertFalse(missing.isResolved());
      assertEquals("missing", missing.name());
      assertEquals(3, missing.line());
      assertEquals(Arrays.asList(B), session.callGraph().callees(A));

      ScheduleResult result = session.runPasses(all(),
          Arrays.<Pass>asList(new RecordingPass(PassOrder.CALLEE_FIRST)));
      assertEquals(1, result.unresolvedEdges().size());
      assertEquals("missing", result.unresolvedEdges().get(0).name());
    }
  }
}
