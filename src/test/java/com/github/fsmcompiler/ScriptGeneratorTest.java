package com.github.fsmcompiler;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.github.fsmcompiler.CompilerConfiguration.CompilerConfigurationBuilder;
import com.github.fsmcompiler.VariableInfo.VarDataType;

/**
 * Tests for the script generator: function table, condition rewriting and the driver section.
 */
public class ScriptGeneratorTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private static final Logger logger =
      LogManager.getLogger(ScriptGeneratorTest.class.getSimpleName());

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private final ScriptGenerator generator = new ScriptGenerator();

  /**
   * START s1, FINISH [s2], s1 without action, s2 incrementing x, one guarded delayed transition.
   */
  static Automaton counter() throws AutomatonException {
    final Automaton automaton = new Automaton();
    automaton.setName("Counter");
    automaton.setDescription("Counts once");
    automaton.addState("s1");
    automaton.addState("s2", "x = x + 1");
    automaton.setStartState("s1");
    automaton.addFinalState("s2");
    automaton.addVariable("x", "0", VarDataType.INT);
    automaton.addTransition(new Transition("s1", "s2", "x == 0", 100));
    return automaton;
  }

  @Test
  public void testCounterScript() throws AutomatonException {
    final String script = generator.generate(counter());
    logger.info("\n" + script);

    assertTrue(script.startsWith("from fsm_core import FSM, State, Transition\n"));
    assertTrue(script.contains("# --- FSM Name: Counter ---\n# Description: Counts once\n"));

    // 1. exactly one condition function, reading x through the store
    assertEquals(1, occurrences(script, "def condition_"));
    assertTrue(script.contains("def condition_x_eq_0(fsm, variables):\n"
        + "    return (fsm.get_variable(\"x\") == 0)\n"));

    // 2. one real action for s2, a no-op for s1
    assertTrue(script.contains("def action_s2(fsm, variables):\n"
        + "    x = fsm.get_variable(\"x\")\n"
        + "    x = x + 1\n"
        + "    fsm.set_variable(\"x\", x)\n"));
    assertTrue(script.contains("def action_s1(fsm, variables):\n    pass\n"));
    assertTrue(script.contains("def always_true_condition(fsm, variables):\n    return True\n"));

    // 3. driver: two states, one transition
    assertEquals(2, occurrences(script, " = State(\n"));
    assertEquals(1, occurrences(script, " = Transition(\n"));
    assertTrue(script.contains("    state_s1 = State(\n"
        + "        name=\"s1\",\n"
        + "        action=action_s1,\n"
        + "        is_start_state=True,\n"
        + "        is_finish_state=False\n"
        + "    )\n"));
    assertTrue(script.contains("    state_s2 = State(\n"
        + "        name=\"s2\",\n"
        + "        action=action_s2,\n"
        + "        is_start_state=False,\n"
        + "        is_finish_state=True\n"
        + "    )\n"));
    assertTrue(script.contains("    tr_s1_to_s2_0 = Transition(\n"
        + "        target_state_name=\"s2\",\n"
        + "        condition=condition_x_eq_0,\n"
        + "        delay=100\n"
        + "    )\n"));
    assertTrue(script.contains("    state_s1.add_transition(tr_s1_to_s2_0)\n"));
    assertTrue(script.contains("    Counter.add_state(state_s1)\n    Counter.add_state(state_s2)\n"));
    assertTrue(script.contains("    Counter.set_variable(\"x\", 0)\n"));
  }

  @Test
  public void testFunctionsAreSorted() throws AutomatonException {
    final String script = generator.generate(counter());
    final List<Integer> positions = Arrays.asList(script.indexOf("def action_s1"),
        script.indexOf("def action_s2"), script.indexOf("def always_true_condition"),
        script.indexOf("def condition_x_eq_0"), script.indexOf("if __name__"));
    final List<Integer> sorted = new ArrayList<>(positions);
    Collections.sort(sorted);
    assertEquals(sorted, positions);
    assertFalse(positions.contains(-1));
  }

  @Test
  public void testSharedConditionGeneratesOneFunction() throws AutomatonException {
    final Automaton automaton = counter();
    automaton.addState("s3");
    automaton.addTransition(new Transition("s2", "s3", "x == 0", 0));
    automaton.addTransition(new Transition("s3", "s1"));
    final String script = generator.generate(automaton);

    assertEquals(1, occurrences(script, "def condition_x_eq_0("));
    assertEquals(2, occurrences(script, "condition=condition_x_eq_0,"));
    assertEquals(1, occurrences(script, "condition=always_true_condition,"));
    assertTrue(script.contains("tr_s1_to_s2_0 = Transition("));
    assertTrue(script.contains("tr_s2_to_s3_1 = Transition("));
    assertTrue(script.contains("tr_s3_to_s1_2 = Transition("));
  }

  @Test
  public void testGenerationIsDeterministic() throws AutomatonException {
    final Automaton automaton = counter();
    automaton.addTransition(new Transition("s2", "s1", "x >= 10", 5));
    final String first = generator.generate(automaton);
    final String second = generator.generate(automaton);
    assertEquals(first, second);
    // the transition counter restarts per call
    assertEquals(1, occurrences(second, "tr_s2_to_s1_1 = Transition("));
  }

  @Test
  public void testConditionRewriteMatchesWholeTokensOnly() throws AutomatonException {
    final List<VariableInfo> variables = Arrays.asList(
        new VariableInfo("x", "0", VarDataType.INT),
        new VariableInfo("xx", "0", VarDataType.INT),
        new VariableInfo("max", "0", VarDataType.INT));
    assertEquals("fsm.get_variable(\"xx\") > fsm.get_variable(\"x\") and max_x < 3",
        ScriptGenerator.rewriteCondition("xx > x and max_x < 3", variables));
    // string literals and attribute names stay untouched
    assertEquals("name == \"x\" and obj.x and fsm.get_variable(\"max\")('x', 2)",
        ScriptGenerator.rewriteCondition("name == \"x\" and obj.x and max('x', 2)", variables));
    assertEquals("a == 'it\\'s x' or fsm.get_variable(\"x\")",
        ScriptGenerator.rewriteCondition("a == 'it\\'s x' or x", variables));
    assertEquals("y > 1",
        ScriptGenerator.rewriteCondition("y > 1", Collections.<VariableInfo>emptyList()));
  }

  @Test
  public void testActionNameDirectiveAndPlaceholder() throws AutomatonException {
    final Automaton automaton = new Automaton();
    automaton.setName("Lamp");
    automaton.addState("on", "#name=blink_led\nled = 1\n");
    automaton.addState("off", "# Enter code here:\n");
    automaton.addState("dim", "# Enter code here:\nled = 0.5\n");
    automaton.addState("idle", "# just a note\n\n");
    automaton.setStartState("off");
    final String script = generator.generate(automaton);

    assertTrue(script.contains("def blink_led(fsm, variables):\n    led = 1\n"));
    assertFalse(script.contains("#name="));
    assertTrue(script.contains("        action=blink_led,\n"));
    assertTrue(script.contains("def action_off(fsm, variables):\n    pass\n"));
    assertTrue(script.contains("def action_dim(fsm, variables):\n    led = 0.5\n"));
    assertTrue(script.contains("def action_idle(fsm, variables):\n    pass\n"));
    assertFalse(script.contains("Enter code here"));
  }

  @Test
  public void testIndentedActionIsDedented() throws AutomatonException {
    final Automaton automaton = new Automaton();
    automaton.addState("s", "    if x:\n        y = 1\n\n    z = 2\n");
    final String script = generator.generate(automaton);
    assertTrue(script.contains(
        "def action_s(fsm, variables):\n    if x:\n        y = 1\n\n    z = 2\n"));
    // unnamed automaton
    assertTrue(script.contains("    _empty_name_placeholder_ = FSM()\n"));
  }

  @Test
  public void testVariableSeedsAreClassified() throws AutomatonException {
    final Automaton automaton = new Automaton();
    automaton.setName("seeds");
    automaton.addVariable("count", "7", VarDataType.INT);
    automaton.addVariable("ratio", "0.25", VarDataType.DOUBLE);
    automaton.addVariable("label", "say \"hi\"", VarDataType.STRING);
    automaton.addVariable("flag", "TRUE", VarDataType.STRING);
    automaton.addVariable("unset", "", VarDataType.INT);
    automaton.addVariable("my var", "1", VarDataType.INT);
    automaton.addState("s", "count += 1");
    final String script = generator.generate(automaton);

    assertTrue(script.contains("    seeds.set_variable(\"count\", 7)\n"));
    assertTrue(script.contains("    seeds.set_variable(\"ratio\", 0.25)\n"));
    assertTrue(script.contains("    seeds.set_variable(\"label\", \"say \\\"hi\\\"\")\n"));
    assertTrue(script.contains("    seeds.set_variable(\"flag\", True)\n"));
    assertTrue(script.contains("    seeds.set_variable(\"unset\", None)\n"));
    // locals use sanitized names, the store keeps the declared name
    assertTrue(script.contains("    my_var = fsm.get_variable(\"my var\")\n"));
    assertTrue(script.contains("    fsm.set_variable(\"my var\", my_var)\n"));
  }

  @Test
  public void testMissingStartStateIsNotValidated() throws AutomatonException {
    final Automaton automaton = counter();
    automaton.setStartState("ghost");
    automaton.addTransition(new Transition("nowhere", "s1"));
    final String script = generator.generate(automaton);
    assertFalse(script.contains("is_start_state=True"));
    assertTrue(script.contains("state_nowhere.add_transition(tr_nowhere_to_s1_1)"));
  }

  @Test
  public void testDriverAlwaysStopsTheMachine() throws AutomatonException {
    final String script = generator.generate(counter());
    assertTrue(script.contains("    if Counter._client_socket:\n"
        + "        try:\n"
        + "            Counter.run()\n"
        + "        except KeyboardInterrupt:\n"));
    assertTrue(script.contains("        except Exception as e:\n"));
    assertTrue(script.contains("        finally:\n            Counter.stop()\n"));
    assertTrue(script.contains("    client_host = 'localhost'\n    client_port = 65432\n"));
    assertTrue(script.contains("    print(\"Starting FSM 'Counter'...\")\n"));
  }

  @Test
  public void testConfigurationReachesScript() throws AutomatonException {
    final CompilerConfiguration config = CompilerConfigurationBuilder.newBuilder()
        .clientHost("127.0.0.1").clientPort(9898).runtimeModule("runtime.fsm_core").build();
    final String script = new ScriptGenerator(config).generate(counter());
    assertTrue(script.startsWith("from runtime.fsm_core import FSM, State, Transition\n"));
    assertTrue(script.contains("    client_host = '127.0.0.1'\n    client_port = 9898\n"));
  }

  @Test
  public void testEngineNameNeverShadowsDriverNames() throws AutomatonException {
    final Automaton automaton = counter();
    automaton.setName("print");
    String script = generator.generate(automaton);
    assertTrue(script.contains("    print_var = FSM()\n"));
    assertTrue(script.contains("            print_var.stop()\n"));
    assertTrue(script.contains("    print(\"Starting FSM 'print'...\")\n"));

    automaton.setName("client_port");
    script = generator.generate(automaton);
    assertTrue(script.contains("    client_port_var = FSM()\n"));
    assertTrue(script.contains("    client_port = 65432\n"));

    automaton.setName("action_s2");
    script = generator.generate(automaton);
    assertTrue(script.contains("    action_s2_var = FSM()\n"));
    assertTrue(script.contains("        action=action_s2,\n"));

    automaton.setName("state_s1");
    assertTrue(generator.generate(automaton).contains("    state_s1_var = FSM()\n"));

    automaton.setName("tr_s1_to_s2_0");
    assertTrue(generator.generate(automaton).contains("    tr_s1_to_s2_0_var = FSM()\n"));

    // bound by the driver's exception handler
    automaton.setName("e");
    script = generator.generate(automaton);
    assertTrue(script.contains("    e_var = FSM()\n"));
    assertTrue(script.contains("            e_var.stop()\n"));
  }

  @Test
  public void testGenerateToFile() throws Exception {
    final Path output = folder.getRoot().toPath().resolve("interpret").resolve("output.py");
    generator.generate(counter(), output);
    final String written = new String(Files.readAllBytes(output), StandardCharsets.UTF_8);
    assertEquals(generator.generate(counter()), written);
  }

  private static int occurrences(final String text, final String needle) {
    int count = 0;
    int from = 0;
    while ((from = text.indexOf(needle, from)) >= 0) {
      count++;
      from += needle.length();
    }
    return count;
  }
}
