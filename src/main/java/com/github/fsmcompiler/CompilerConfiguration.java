package com.github.fsmcompiler;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.regex.Pattern;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * This class encapsulates all the configuration parameters of the compiler. Use the
 * {@code CompilerConfigurationBuilder} to build it.
 * 
 * Notes:<br>
 * 1. clientHost and clientPort are baked into the generated script, which connects to the editor's
 * runtime client on that address before running the machine. If not set, localhost:65432 is
 * used.<br>
 * 2. runtimeModule is the module the generated script imports FSM, State and Transition from.<br>
 * 3. actionPlaceholder is the comment the editor seeds new states with. An action consisting of
 * just that comment generates a no-op function.<br>
 */
public final class CompilerConfiguration {
  private static final Logger logger =
      LogManager.getLogger(CompilerConfiguration.class.getSimpleName());

  static final String DEFAULT_RESOURCE = "fsm-compiler.properties";
  static final String HOST_KEY = "fsm.client.host";
  static final String PORT_KEY = "fsm.client.port";
  static final String RUNTIME_MODULE_KEY = "fsm.runtime.module";
  static final String PLACEHOLDER_KEY = "fsm.action.placeholder";

  static final String DEFAULT_HOST = "localhost";
  static final int DEFAULT_PORT = 65432;
  static final String DEFAULT_RUNTIME_MODULE = "fsm_core";
  static final String DEFAULT_PLACEHOLDER = "# Enter code here:";

  private static final Pattern MODULE_NAME =
      Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)*");

  private final String clientHost;
  private final int clientPort;
  private final String runtimeModule;
  private final String actionPlaceholder;

  public String getClientHost() {
    return clientHost;
  }

  public int getClientPort() {
    return clientPort;
  }

  public String getRuntimeModule() {
    return runtimeModule;
  }

  public String getActionPlaceholder() {
    return actionPlaceholder;
  }

  public static CompilerConfiguration defaults() {
    return new CompilerConfiguration(DEFAULT_HOST, DEFAULT_PORT, DEFAULT_RUNTIME_MODULE,
        DEFAULT_PLACEHOLDER);
  }

  /**
   * Builds a configuration from properties, falling back to the defaults for absent keys.
   */
  public static CompilerConfiguration fromProperties(final Properties properties)
      throws AutomatonException {
    final CompilerConfigurationBuilder builder = CompilerConfigurationBuilder.newBuilder();
    builder.clientHost(properties.getProperty(HOST_KEY, DEFAULT_HOST).trim());
    final String port = properties.getProperty(PORT_KEY, Integer.toString(DEFAULT_PORT)).trim();
    try {
      builder.clientPort(Integer.parseInt(port));
    } catch (NumberFormatException problem) {
      throw new AutomatonException(AutomatonException.Code.INVALID_COMPILER_CONFIG,
          PORT_KEY + " is not a number: " + port, problem);
    }
    builder
        .runtimeModule(properties.getProperty(RUNTIME_MODULE_KEY, DEFAULT_RUNTIME_MODULE).trim());
    builder
        .actionPlaceholder(properties.getProperty(PLACEHOLDER_KEY, DEFAULT_PLACEHOLDER).trim());
    return builder.build();
  }

  /**
   * Loads {@value #DEFAULT_RESOURCE} from the classpath, or returns the defaults if it is absent.
   */
  public static CompilerConfiguration loadDefault() throws AutomatonException {
    final Properties properties = new Properties();
    try (InputStream stream =
        CompilerConfiguration.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
      if (stream == null) {
        logger.info("No " + DEFAULT_RESOURCE + " on the classpath, using defaults");
        return defaults();
      }
      properties.load(stream);
    } catch (IOException problem) {
      throw new AutomatonException(AutomatonException.Code.INVALID_COMPILER_CONFIG,
          "Failed to read " + DEFAULT_RESOURCE, problem);
    }
    return fromProperties(properties);
  }

  public final static class CompilerConfigurationBuilder {
    private String clientHost = DEFAULT_HOST;
    private int clientPort = DEFAULT_PORT;
    private String runtimeModule = DEFAULT_RUNTIME_MODULE;
    private String actionPlaceholder = DEFAULT_PLACEHOLDER;

    public static CompilerConfigurationBuilder newBuilder() {
      return new CompilerConfigurationBuilder();
    }

    public CompilerConfigurationBuilder clientHost(final String clientHost) {
      this.clientHost = clientHost;
      return this;
    }

    public CompilerConfigurationBuilder clientPort(final int clientPort) {
      this.clientPort = clientPort;
      return this;
    }

    public CompilerConfigurationBuilder runtimeModule(final String runtimeModule) {
      this.runtimeModule = runtimeModule;
      return this;
    }

    public CompilerConfigurationBuilder actionPlaceholder(final String actionPlaceholder) {
      this.actionPlaceholder = actionPlaceholder;
      return this;
    }

    public CompilerConfiguration build() throws AutomatonException {
      final CompilerConfiguration config =
          new CompilerConfiguration(clientHost, clientPort, runtimeModule, actionPlaceholder);
      config.validate();
      return config;
    }

    private CompilerConfigurationBuilder() {}
  }

  private void validate() throws AutomatonException {
    StringBuilder messages = new StringBuilder();
    if (clientHost == null || clientHost.trim().isEmpty()) {
      messages.append("clientHost cannot be blank. ");
    } else if (clientHost.indexOf('\'') >= 0 || clientHost.indexOf('\\') >= 0) {
      messages.append("clientHost cannot contain quotes or backslashes. ");
    }
    if (clientPort < 1 || clientPort > 65535) {
      messages.append("clientPort must be within 1..65535. ");
    }
    if (runtimeModule == null || !MODULE_NAME.matcher(runtimeModule).matches()) {
      messages.append("runtimeModule must be a dotted module name. ");
    }
    if (actionPlaceholder == null) {
      messages.append("actionPlaceholder cannot be null. ");
    }
    if (messages.length() > 0) {
      throw new AutomatonException(AutomatonException.Code.INVALID_COMPILER_CONFIG,
          messages.toString().trim());
    }
  }

  @Override
  public String toString() {
    return "CompilerConfiguration [clientHost=" + clientHost + ", clientPort=" + clientPort
        + ", runtimeModule=" + runtimeModule + ", actionPlaceholder=" + actionPlaceholder + "]";
  }

  private CompilerConfiguration(final String clientHost, final int clientPort,
      final String runtimeModule, final String actionPlaceholder) {
    this.clientHost = clientHost;
    this.clientPort = clientPort;
    this.runtimeModule = runtimeModule;
    this.actionPlaceholder = actionPlaceholder;
  }

}
