package exm.hcfa.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.After;
import org.junit.Test;

import exm.hcfa.common.exceptions.InvalidOptionException;

public class SettingsTest {

  @After
  public void cleanup() {
    Settings.reset(Settings.LINEARIZE_VERIFY);
    Settings.reset(Settings.LOG_TRACE);
    System.clearProperty(Settings.LOG_TRACE);
  }

  @Test
  public void testDefaults() throws InvalidOptionException {
    assertTrue(Settings.getBoolean(Settings.LINEARIZE_VERIFY));
    assertFalse(Settings.getBoolean(Settings.LOG_TRACE));
    assertEquals("", Settings.get(Settings.LOG_FILE));
    assertTrue(Settings.getKeys().contains(Settings.LINEARIZE_VERIFY));
  }

  @Test
  public void testBooleanParsing() throws InvalidOptionException {
    Settings.set(Settings.LINEARIZE_VERIFY, " FALSE ");
    assertFalse(Settings.getBoolean(Settings.LINEARIZE_VERIFY));
    Settings.reset(Settings.LINEARIZE_VERIFY);
    assertTrue(Settings.getBoolean(Settings.LINEARIZE_VERIFY));
  }

  @Test(expected=InvalidOptionException.class)
  public void testBadBoolean() throws InvalidOptionException {
    Settings.set(Settings.LINEARIZE_VERIFY, "yes");
    Settings.getBoolean(Settings.LINEARIZE_VERIFY);
  }

  @Test(expected=InvalidOptionException.class)
  public void testMissingKey() throws InvalidOptionException {
    Settings.getBoolean("hcfa.no.such.key");
  }

  @Test
  public void testSystemOverride() throws InvalidOptionException {
    System.setProperty(Settings.LOG_TRACE, "true");
    Settings.initProperties();
    assertTrue(Settings.getBoolean(Settings.LOG_TRACE));
  }

  @Test(expected=InvalidOptionException.class)
  public void testSystemOverrideValidated() throws InvalidOptionException {
    System.setProperty(Settings.LOG_TRACE, "maybe");
    Settings.initProperties();
  }
}
