package exm.fortx.frontend;

import static exm.fortx.Fixtures.parseAntlr;
import static exm.fortx.Fixtures.parseLine;
import static exm.fortx.Fixtures.source;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.SystemUtils;
import org.junit.Assume;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;
import org.junit.rules.TemporaryFolder;

import exm.fortx.common.exceptions.ParseException;
import exm.fortx.frontend.xml.XmlFrontend;
import exm.fortx.ir.Intent;
import exm.fortx.ir.NodeKind;
import exm.fortx.ir.Nodes;
import exm.fortx.ir.Statements.CallStatement;
import exm.fortx.ir.Statements.Conditional;
import exm.fortx.ir.Statements.Declaration;
import exm.fortx.ir.Statements.Loop;
import exm.fortx.ir.Units.FileNode;
import exm.fortx.ir.Units.Routine;

public class FrontendEquivalenceTest {

  private static final String SOURCE = source(
      "subroutine s(n, a)",
      "  integer, intent(in) :: n",
      "  a = 0",
      "  do i = 1, n",
      "    call f(i)",
      "  end do",
      "end subroutine s");

  /** Same routine as the external parser would describe it */
  private static final String XML =
      "<file>" +
      "<subroutine name='s' line_begin='1' line_end='7'>" +
      " <header line_begin='1' line_end='1'>" +
      "  <arguments><argument name='n'/><argument name='a'/></arguments>" +
      " </header>" +
      " <body>" +
      "  <declaration line_begin='2' line_end='2'>" +
      "   <type name='integer'/><intent type='in'/>" +
      "   <variables><variable name='n'/></variables>" +
      "  </declaration>" +
      "  <assignment line_begin='3' line_end='3'>" +
      "   <target><name id='a'/></target>" +
      "   <value><literal type='integer' value='0'/></value>" +
      "  </assignment>" +
      "  <loop type='do' variable='i' line_begin='4' line_end='6'>" +
      "   <lower><literal type='integer' value='1'/></lower>" +
      "   <upper><name id='n'/></upper>" +
      "   <body>" +
      "    <call name='f' line_begin='5' line_end='5'><name id='i'/></call>" +
      "   </body>" +
      "  </loop>" +
      " </body>" +
      "</subroutine>" +
      "</file>";

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  @Test
  public void testAntlrAndLineAgree() throws ParseException {
    FileNode antlr = parseAntlr(SOURCE);
    FileNode line = parseLine(SOURCE);
    assertTrue("ANTLR:\n" + Nodes.dump(antlr) + "LINE:\n" + Nodes.dump(line),
               Nodes.equivalent(antlr, line));
    assertEquals(Nodes.sexpr(antlr.routines().get(0)),
                 Nodes.sexpr(line.routines().get(0)));
  }

  @Test
  public void testEmptyBodies() throws ParseException {
    String text = source(
        "module m",
        "contains",
        "  subroutine g()",
        "  end subroutine g",
        "end module m",
        "subroutine h(x)",
        "  real, intent(in) :: x",
        "  if (x > 0.0) then",
        "  else",
        "  end if",
        "  do while (.false.)",
        "  end do",
        "end subroutine h");
    FileNode antlr = parseAntlr(text);
    Routine g = antlr.modules().get(0).routines().get(0);
    assertEquals("g", g.name());
    assertTrue(g.spec().isEmpty());
    assertTrue(g.body().isEmpty());
    Conditional c = (Conditional)antlr.routines().get(0).body().get(0);
    assertTrue(c.thenBody().isEmpty());
    assertTrue(c.elseBody().isEmpty());
    assertTrue(Nodes.equivalent(antlr, parseLine(text)));
  }

  @Test
  public void testIfInsideElseIsNotElseIf() throws ParseException {
    String text = source(
        "subroutine s(a, b)",
        "  integer, intent(inout) :: a, b",
        "  if (a > 0) then",
        "    a = 1",
        "  else",
        "    if (b > 0) then",
        "      b = 1",
        "    end if",
        "  end if",
        "end subroutine s");
    FileNode antlr = parseAntlr(text);
    Conditional outer = (Conditional)antlr.routines().get(0).body().get(0);
    Conditional inner = (Conditional)outer.elseBody().get(0);
    assertFalse(inner.isElseIf());
    assertTrue(Nodes.equivalent(antlr, parseLine(text)));
  }

  @Test
  public void testCallWithoutArguments() throws ParseException {
    String text = source(
        "subroutine s(a, b)",
        "  integer, intent(in) :: a, b",
        "  call f()",
        "  if (a == b) call f()",
        "end subroutine s");
    FileNode line = parseLine(text);
    CallStatement call = (CallStatement)line.routines().get(0).body().get(0);
    assertEquals("f", call.name());
    assertTrue(call.args().isEmpty());
    assertTrue(Nodes.equivalent(parseAntlr(text), line));
  }

  @Test
  public void testRoutineStructure() throws ParseException {
    Routine s = parseAntlr(SOURCE).routines().get(0);
    assertEquals("s", s.name());
    assertEquals(2, s.dummies().size());
    assertEquals(1, s.spec().size());
    assertEquals(Intent.IN, ((Declaration)s.spec().get(0)).intent());
    assertEquals(2, s.body().size());
    assertEquals(NodeKind.ASSIGNMENT, s.body().get(0).kind());
    Loop loop = (Loop)s.body().get(1);
    assertEquals("i", loop.variable());
    assertEquals(NodeKind.CALL, loop.body().get(0).kind());

    // Whole-line statements keep their source position
    assertEquals(4, loop.span().startLine());
    assertEquals(6, loop.span().endLine());
  }

  @Test
  public void testXmlAgrees() throws ParseException {
    FileNode xml = new XmlFrontend().parseXml("test.f90", SOURCE, XML);
    FileNode antlr = parseAntlr(SOURCE);
    assertTrue("XML:\n" + Nodes.dump(xml) + "ANTLR:\n" + Nodes.dump(antlr),
               Nodes.equivalent(antlr, xml));
    Routine s = xml.routines().get(0);
    assertEquals(3, s.body().get(0).span().startLine());
  }

  @Test
  public void testXmlThroughCommand() throws Exception {
    Assume.assumeTrue(SystemUtils.IS_OS_UNIX);
    File xmlFile = tmp.newFile("s.xml");
    FileUtils.writeStringToFile(xmlFile, XML, StandardCharsets.UTF_8);
    FrontendOptions options = new FrontendOptions(
        Collections.<String>emptyList(), false, "cat " + xmlFile.getPath(),
        new Semaphore(1));
    FileNode xml = new XmlFrontend().parse("s.f90", SOURCE, options);
    assertTrue(Nodes.equivalent(parseAntlr(SOURCE), xml));
  }

  @Test
  public void testCommandWaitsForProcessPermit() throws Exception {
    Assume.assumeTrue(SystemUtils.IS_OS_UNIX);
    File xmlFile = tmp.newFile("s.xml");
    FileUtils.writeStringToFile(xmlFile, XML, StandardCharsets.UTF_8);
    Semaphore limiter = new Semaphore(1);
    final FrontendOptions options = new FrontendOptions(
        Collections.<String>emptyList(), false, "cat " + xmlFile.getPath(),
        limiter);
    ExecutorService pool = Executors.newSingleThreadExecutor();
    try {
      limiter.acquire();
      Future<FileNode> parsed = pool.submit(new Callable<FileNode>() {
        @Override
        public FileNode call() throws ParseException {
          return new XmlFrontend().parse("s.f90", SOURCE, options);
        }
      });
      try {
        parsed.get(300, TimeUnit.MILLISECONDS);
        fail("Command ran without a free process permit");
      } catch (TimeoutException e) {
        assertFalse(parsed.isDone());
      }
      limiter.release();
      FileNode xml = parsed.get(30, TimeUnit.SECONDS);
      assertEquals(1, xml.routines().size());
      assertEquals(1, limiter.availablePermits());
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  public void testXmlCommandFailure() throws Exception {
    Assume.assumeTrue(SystemUtils.IS_OS_UNIX);
    FrontendOptions options = new FrontendOptions(
        Collections.<String>emptyList(), false, "false {file}",
        new Semaphore(1));
    exception.expect(ParseException.class);
    new XmlFrontend().parse("s.f90", SOURCE, options);
  }

  @Test
  public void testXmlWithoutCommand() throws ParseException {
    exception.expect(ParseException.class);
    exception.expectMessage("no command configured");
    new XmlFrontend().parse("s.f90", SOURCE, FrontendOptions.defaults());
  }

  @Test
  public void testSyntaxErrorReported() throws ParseException {
    exception.expect(ParseException.class);
    parseAntlr(source("subroutine s(", "end subroutine s"));
  }

  @Test
  public void testCommentsKept() throws ParseException {
    String text = source(
        "! leading comment",
        "subroutine s()",
        "  ! inside",
        "  x = 1",
        "end subroutine s");
    FileNode antlr = parseAntlr(text);
    FileNode line = parseLine(text);
    assertEquals(NodeKind.COMMENT, antlr.body().get(0).kind());
    assertEquals(NodeKind.COMMENT, line.body().get(0).kind());
    assertTrue(Nodes.equivalent(antlr, line));
  }

  @Test
  public void testDottedOperatorsNormalized() throws ParseException {
    FileNode dotted = parseAntlr(source(
        "subroutine s(a, b)",
        "  if (a .eq. b) call f()",
        "end subroutine s"));
    FileNode symbolic = parseLine(source(
        "subroutine s(a, b)",
        "  if (a == b) call f()",
        "end subroutine s"));
    assertTrue(Nodes.equivalent(dotted, symbolic));
  }
}
