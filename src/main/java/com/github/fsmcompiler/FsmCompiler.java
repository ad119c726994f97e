package com.github.fsmcompiler;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.fsmcompiler.CompilerConfiguration.CompilerConfigurationBuilder;

/**
 * Entry point the editor talks to: parse a specification, serialize it back, or generate the
 * runnable script from it. Every operation works on the caller's automaton synchronously and
 * assumes nobody mutates it meanwhile.
 */
public final class FsmCompiler {
  private static final Logger logger = LogManager.getLogger(FsmCompiler.class.getSimpleName());

  private final CompilerConfiguration config;
  private final AutomatonParser parser = new AutomatonParser();
  private final AutomatonSerializer serializer = new AutomatonSerializer();
  private final ScriptGenerator generator;

  public FsmCompiler() {
    this(CompilerConfiguration.defaults());
  }

  public FsmCompiler(final CompilerConfiguration config) {
    this.config = config;
    this.generator = new ScriptGenerator(config);
  }

  public CompilerConfiguration getConfiguration() {
    return config;
  }

  public ParseResult parse(final String text) {
    return parser.parse(text);
  }

  public ParseResult parseFile(final Path file) throws AutomatonException {
    return parser.parseFile(file);
  }

  public String serialize(final Automaton automaton) {
    return serializer.serialize(automaton);
  }

  public String serialize(final Automaton automaton, final Map<String, NodeLayout> layouts) {
    return serializer.serialize(automaton, layouts);
  }

  public void save(final Automaton automaton, final Map<String, NodeLayout> layouts,
      final Path file) throws AutomatonException {
    serializer.writeFile(automaton, layouts, file);
  }

  public String generate(final Automaton automaton) {
    return generator.generate(automaton);
  }

  public void generate(final Automaton automaton, final Path outputFile)
      throws AutomatonException {
    generator.generate(automaton, outputFile);
  }

  public static void main(String[] args) {
    final int status = run(args);
    if (status != 0) {
      System.exit(status);
    }
  }

  /**
   * Command line driver. Returns 0 on success, 1 on a compile or I/O failure and 2 on bad usage.
   */
  static int run(final String[] args) {
    Path input = null;
    Path output = null;
    boolean checkOnly = false;
    final CompilerConfigurationBuilder builder;
    try {
      final CompilerConfiguration defaults = CompilerConfiguration.loadDefault();
      builder = CompilerConfigurationBuilder.newBuilder().clientHost(defaults.getClientHost())
          .clientPort(defaults.getClientPort()).runtimeModule(defaults.getRuntimeModule())
          .actionPlaceholder(defaults.getActionPlaceholder());
    } catch (AutomatonException problem) {
      logger.error("Failed to load default configuration", problem);
      return 1;
    }
    for (int i = 0; i < args.length; i++) {
      final String flag = args[i];
      if (flag.equals("--check")) {
        checkOnly = true;
        continue;
      }
      if (i + 1 >= args.length) {
        usage();
        return 2;
      }
      final String value = args[++i];
      switch (flag) {
        case "-i":
          input = Paths.get(value);
          break;
        case "-o":
          output = Paths.get(value);
          break;
        case "--host":
          builder.clientHost(value);
          break;
        case "--port":
          try {
            builder.clientPort(Integer.parseInt(value));
          } catch (NumberFormatException problem) {
            usage();
            return 2;
          }
          break;
        case "--runtime":
          builder.runtimeModule(value);
          break;
        default:
          usage();
          return 2;
      }
    }
    if (input == null || (output == null && !checkOnly)) {
      usage();
      return 2;
    }
    try {
      final FsmCompiler compiler = new FsmCompiler(builder.build());
      final ParseResult result = compiler.parseFile(input);
      for (ParseDiagnostic diagnostic : result.getDiagnostics()) {
        System.err.println(input + ":" + diagnostic);
      }
      if (checkOnly) {
        return result.isClean() ? 0 : 1;
      }
      compiler.generate(result.getAutomaton(), output);
      return 0;
    } catch (AutomatonException problem) {
      logger.error("Compilation of " + input + " failed with " + problem.getCode(), problem);
      return 1;
    }
  }

  private static void usage() {
    System.out.println("Usage:");
    System.out.println("  -i <spec.fsm> -o <script.py> [--host <host>] [--port <port>]"
        + " [--runtime <module>]");
    System.out.println("  -i <spec.fsm> --check");
  }
}
