package com.github.fsmcompiler;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Properties;

import org.junit.Test;

import com.github.fsmcompiler.AutomatonException.Code;
import com.github.fsmcompiler.CompilerConfiguration.CompilerConfigurationBuilder;

/**
 * Tests for building and validating the compiler configuration.
 */
public class CompilerConfigurationTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  @Test
  public void testDefaults() throws AutomatonException {
    final CompilerConfiguration defaults = CompilerConfiguration.defaults();
    assertEquals("localhost", defaults.getClientHost());
    assertEquals(65432, defaults.getClientPort());
    assertEquals("fsm_core", defaults.getRuntimeModule());
    assertEquals("# Enter code here:", defaults.getActionPlaceholder());

    final CompilerConfiguration built = CompilerConfigurationBuilder.newBuilder().build();
    assertEquals(defaults.toString(), built.toString());
  }

  @Test
  public void testLoadDefaultReadsBundledResource() throws AutomatonException {
    final CompilerConfiguration loaded = CompilerConfiguration.loadDefault();
    assertEquals(CompilerConfiguration.defaults().toString(), loaded.toString());
  }

  @Test
  public void testFromProperties() throws AutomatonException {
    final Properties properties = new Properties();
    properties.setProperty(CompilerConfiguration.HOST_KEY, " editor.local ");
    properties.setProperty(CompilerConfiguration.PORT_KEY, "7000");
    final CompilerConfiguration config = CompilerConfiguration.fromProperties(properties);
    assertEquals("editor.local", config.getClientHost());
    assertEquals(7000, config.getClientPort());
    // absent keys fall back
    assertEquals("fsm_core", config.getRuntimeModule());
  }

  @Test
  public void testNonNumericPortProperty() {
    final Properties properties = new Properties();
    properties.setProperty(CompilerConfiguration.PORT_KEY, "eighty");
    try {
      CompilerConfiguration.fromProperties(properties);
      fail("Expected INVALID_COMPILER_CONFIG");
    } catch (AutomatonException expected) {
      assertEquals(Code.INVALID_COMPILER_CONFIG, expected.getCode());
      assertTrue(expected.getCause() instanceof NumberFormatException);
    }
  }

  @Test
  public void testInvalidValuesAreAllReported() {
    try {
      CompilerConfigurationBuilder.newBuilder().clientHost(" ").clientPort(70000)
          .runtimeModule("fsm-core").build();
      fail("Expected INVALID_COMPILER_CONFIG");
    } catch (AutomatonException expected) {
      assertEquals(Code.INVALID_COMPILER_CONFIG, expected.getCode());
      assertTrue(expected.getMessage().contains("clientHost"));
      assertTrue(expected.getMessage().contains("clientPort"));
      assertTrue(expected.getMessage().contains("runtimeModule"));
    }
  }

  @Test
  public void testHostCannotBreakOutOfLiteral() {
    try {
      CompilerConfigurationBuilder.newBuilder().clientHost("evil'host").build();
      fail("Expected INVALID_COMPILER_CONFIG");
    } catch (AutomatonException expected) {
      assertEquals(Code.INVALID_COMPILER_CONFIG, expected.getCode());
    }
  }

  @Test
  public void testNullPlaceholderIsRejected() {
    try {
      CompilerConfigurationBuilder.newBuilder().actionPlaceholder(null).clientPort(0).build();
      fail("Expected INVALID_COMPILER_CONFIG");
    } catch (AutomatonException expected) {
      assertTrue(expected.getMessage().contains("actionPlaceholder"));
      assertTrue(expected.getMessage().contains("clientPort"));
    }
  }
}
