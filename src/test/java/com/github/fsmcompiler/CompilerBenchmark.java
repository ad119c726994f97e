package com.github.fsmcompiler;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;

/**
 * Throughput of the three compiler passes over a small worker automaton.
 */
@State(Scope.Benchmark)
public class CompilerBenchmark {
  private final FsmCompiler compiler = new FsmCompiler();
  private Automaton automaton;

  @Setup
  public void setup() {
    automaton = compiler.parse(AutomatonParserTest.WORKER_SPEC).getAutomaton();
  }

  @Benchmark
  public ParseResult parse() {
    return compiler.parse(AutomatonParserTest.WORKER_SPEC);
  }

  @Benchmark
  public String serialize() {
    return compiler.serialize(automaton);
  }

  @Benchmark
  public String generate() {
    return compiler.generate(automaton);
  }

  public static void main(String args[]) {
    final CompilerBenchmark benchmark = new CompilerBenchmark();
    benchmark.setup();
    benchmark.parse();
    benchmark.serialize();
    benchmark.generate();
  }

}
