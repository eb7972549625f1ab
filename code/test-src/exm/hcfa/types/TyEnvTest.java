package exm.hcfa.types;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class TyEnvTest {

  @Test
  public void testInitial() {
    assertEquals("Integer -> Integer -> Integer",
                 TyEnv.INITIAL.lookup("+").get().toString());
    assertEquals("Double -> Double -> Double",
                 TyEnv.INITIAL.lookup("/").get().toString());
    assertEquals("Char -> Integer",
                 TyEnv.INITIAL.lookup("ord").get().toString());
    assertEquals(10, TyEnv.INITIAL.names().size());
    assertFalse(TyEnv.INITIAL.lookup("foo").isPresent());
  }

  @Test
  public void testExtend() {
    TyEnv env = TyEnv.EMPTY.extend("id",
                        Types.arrow(Types.INTEGER, Types.INTEGER));
    assertTrue(env.contains("id"));
    assertFalse(TyEnv.EMPTY.contains("id"));
    TyEnv shadowed = TyEnv.INITIAL.extend("+", Types.INTEGER);
    assertEquals(Types.INTEGER, shadowed.lookup("+").get());
    assertEquals(10, shadowed.names().size());
    // Original unchanged
    assertEquals("Integer -> Integer -> Integer",
                 TyEnv.INITIAL.lookup("+").get().toString());
  }
}
