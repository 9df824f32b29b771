package exm.fortx.ir;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

public class UnitIdTest {

  @Test
  public void testExternal() {
    UnitId id = UnitId.external("Solve");
    assertEquals("#solve", id.toString());
    assertEquals("solve", id.name());
    assertFalse(id.isModule());
    assertNull(id.host());
    assertEquals(Arrays.asList("", "solve"), id.parts());
  }

  @Test
  public void testModuleMembers() {
    UnitId inner = UnitId.module("Kernels").member("axpy").member("Helper");
    assertEquals("kernels#axpy#helper", inner.toString());
    assertEquals(UnitId.parse("kernels#axpy"), inner.host());
    assertEquals(UnitId.module("kernels"), inner.host().host());
    assertTrue(inner.host().host().isModule());
    assertEquals(inner, UnitId.parse(" KERNELS#Axpy#helper "));
  }

  @Test
  public void testOrdering() {
    assertTrue(UnitId.external("a").compareTo(UnitId.module("a")) < 0);
    assertTrue(UnitId.parse("m#a").compareTo(UnitId.parse("m#b")) < 0);
  }
}
