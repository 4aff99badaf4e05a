package FAMin;

import FAMin.Interop.BAFormat;
import FAMin.Model.AutomatonKind;
import FAMin.Model.ConversionResult;
import FAMin.Model.DA;
import FAMin.Model.FiniteAutomaton;
import FAMin.Model.InvalidAutomatonException;
import FAMin.Model.MinimizationResult;
import FAMin.Model.NA;
import FAMin.Model.ValidationReport;
import FAMin.Record.AutomatonJson;
import FAMin.Record.AutomatonRecords;
import FAMin.Record.MalformedRecordException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public class FAMinCommandLine {
  static final int EXIT_OK = 0;
  static final int EXIT_INVALID = 1;
  static final int EXIT_USAGE = 2;

  private static final String DEBUG_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";

  public static void main(String[] args) {
    int code = run(args, System.out, System.err);
    if (code != EXIT_OK) {
      System.exit(code);
    }
  }

  /**
   * Parse the arguments and run one operation.
   * @param args - command-line arguments
   * @param out - report output
   * @param err - error messages and usage
   * @return process exit code: 0 on success, 1 for an invalid automaton, malformed or unreadable input,
   * 2 for a usage error
   */
  static int run(String[] args, PrintStream out, PrintStream err) {
    String jsonOutput = null;
    String baOutput = null;
    int maxStates = -1;
    List<String> words = new ArrayList<>();
    List<String> positional = new ArrayList<>(2);

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if ("--debug".equalsIgnoreCase(arg)) {
        // must happen before the first logger is created
        System.setProperty(DEBUG_PROPERTY, "debug");
      } else if ("--write".equalsIgnoreCase(arg) || "--writeBA".equalsIgnoreCase(arg)
          || "--max-states".equalsIgnoreCase(arg) || "--word".equalsIgnoreCase(arg)) {
        // Require a value that isn't another flag
        if (i + 1 >= args.length || args[i + 1].startsWith("-")) {
          err.println("Missing value for " + arg);
          printUsage(err);
          return EXIT_USAGE;
        }
        String value = args[++i]; // consume the value
        switch (arg.toLowerCase(Locale.ROOT)) {
          case "--write" -> jsonOutput = value;
          case "--writeba" -> baOutput = value;
          case "--word" -> words.add(value);
          default -> {
            try {
              maxStates = Integer.parseInt(value);
            } catch (NumberFormatException e) {
              err.println("Not a number for --max-states: " + value);
              printUsage(err);
              return EXIT_USAGE;
            }
          }
        }
      } else if (arg.startsWith("-")) {
        err.println("Unknown option: " + arg);
        printUsage(err);
        return EXIT_USAGE;
      } else {
        positional.add(arg);
      }
    }

    if (positional.size() != 2) {
      printUsage(err);
      return EXIT_USAGE;
    }
    String operation = positional.get(0).toLowerCase(Locale.ROOT);
    Path input = Path.of(positional.get(1));

    Logger log = LoggerFactory.getLogger(FAMinCommandLine.class);
    log.debug("Operation {} on {}", operation, input);

    try {
      FiniteAutomaton result;
      switch (operation) {
        case "validate" -> {
          FiniteAutomaton automaton = load(input, false);
          ValidationReport report = AutomatonValidator.validate(automaton);
          printReport(out, report);
          if (!report.isValid()) {
            return EXIT_INVALID;
          }
          result = automaton;
        }
        case "stats" -> {
          FiniteAutomaton automaton = load(input, true);
          printStatistics(out, automaton);
          printWords(out, "input", automaton, words);
          result = automaton;
        }
        case "determinize" -> {
          FiniteAutomaton automaton = load(input, true);
          printStatistics(out, automaton);
          printWords(out, "input", automaton, words);
          result = determinize(out, automaton, maxStates);
          printWords(out, "result", result, words);
        }
        case "minimize" -> {
          FiniteAutomaton automaton = load(input, true);
          printStatistics(out, automaton);
          printWords(out, "input", automaton, words);
          DA dfa = determinize(out, automaton, maxStates);
          long before = System.currentTimeMillis();
          MinimizationResult summary = MooreMinimizer.minimizeWithSummary(dfa);
          long after = System.currentTimeMillis();
          out.println(summary);
          out.println("minimize duration: " + ((after - before) / 1000f) + "s");
          printEquivalenceTable(out, summary.equivalenceTable());
          result = summary.minimized();
          printWords(out, "result", result, words);
        }
        default -> {
          err.println("Unknown operation: " + positional.get(0));
          printUsage(err);
          return EXIT_USAGE;
        }
      }

      if (jsonOutput != null) {
        out.println("Writing to file: " + jsonOutput);
        AutomatonJson.write(Path.of(jsonOutput), result, true);
      }
      if (baOutput != null) {
        if (!(result instanceof DA dfa)) {
          err.println("--writeBA needs a deterministic result; use determinize or minimize");
          return EXIT_USAGE;
        }
        out.println("Writing to file: " + baOutput);
        BAFormat.write(Path.of(baOutput), dfa);
      }
      return EXIT_OK;
    } catch (MalformedRecordException e) {
      err.println("Malformed automaton: " + e.getMessage());
      return EXIT_INVALID;
    } catch (InvalidAutomatonException e) {
      err.println("Invalid automaton:");
      for (String problem : e.getProblems()) {
        err.println("  " + problem);
      }
      return EXIT_INVALID;
    } catch (IOException e) {
      err.println("I/O error: " + e.getMessage());
      log.debug("I/O failure", e);
      return EXIT_INVALID;
    }
  }

  private static void printUsage(PrintStream err) {
    err.println(
        "FAMin [--debug] [--write <JSON output file>] [--writeBA <BA output file>] [--max-states <n>]"
            + " [--word <w>]... <operation> <input file>");
    err.println("[--debug] : Additional debug/progress output");
    err.println("[--write <JSON output file>] : Write the resulting automaton, with metadata");
    err.println("[--writeBA <BA output file>] : Write the resulting DA in the BA format");
    err.println("[--max-states <n>] : Refuse to determinize an NA with more than n states");
    err.println("[--word <w>] : Report whether the word is accepted, one symbol per character; repeatable");
    err.println();
    err.println("<operation> : one of the choices below:");
    err.println("  validate: Report structural errors and warnings.");
    err.println("  stats: Print statistics of the automaton.");
    err.println("  determinize: Subset construction (an NA becomes a DA; a DA is kept).");
    err.println("  minimize: Moore minimization (an NA is determinized first).");
    err.println();
    err.println("<input file> : automaton as JSON, or in the BA format if the name ends in .ba");
  }

  /**
   * @param validate - whether to reject structurally invalid automata right away
   */
  private static FiniteAutomaton load(Path input, boolean validate) throws IOException, MalformedRecordException {
    String name = input.getFileName() == null ? "" : input.getFileName().toString();
    if (name.toLowerCase(Locale.ROOT).endsWith(".ba")) {
      return BAFormat.read(input);
    }
    if (validate) {
      return AutomatonJson.read(input);
    }
    return AutomatonRecords.build(AutomatonJson.readRecord(input));
  }

  private static DA determinize(PrintStream out, FiniteAutomaton automaton, int maxStates) {
    if (automaton instanceof DA dfa) {
      out.println("Input is already deterministic");
      return dfa;
    }
    NA nfa = (NA) automaton;
    if (maxStates >= 0 && nfa.size() > maxStates) {
      throw new InvalidAutomatonException("NA has " + nfa.size() + " states, more than --max-states " + maxStates);
    }
    long before = System.currentTimeMillis();
    ConversionResult summary = SubsetDeterminizer.determinizeWithSummary(nfa);
    long after = System.currentTimeMillis();
    out.println(summary);
    out.println("determinize duration: " + ((after - before) / 1000f) + "s");
    return summary.dfa();
  }

  private static void printStatistics(PrintStream out, FiniteAutomaton automaton) {
    out.println(automaton.statistics());
    out.println("Reachable states: " + automaton.reachableStates().size());
    if (automaton.kind() == AutomatonKind.DA) {
      out.println("Complete: " + ((DA) automaton).isComplete());
    }
  }

  private static void printReport(PrintStream out, ValidationReport report) {
    out.println(report.isValid() ? "Valid " + report.kind() : "Invalid " + report.kind());
    for (String error : report.errors()) {
      out.println("  error: " + error);
    }
    for (String warning : report.warnings()) {
      out.println("  warning: " + warning);
    }
    out.println(report.statistics());
  }

  private static void printEquivalenceTable(PrintStream out, Map<String, String> table) {
    out.println("Equivalence table:");
    for (Map.Entry<String, String> entry : table.entrySet()) {
      out.println("  " + entry.getKey() + " -> " + entry.getValue());
    }
  }

  private static void printWords(PrintStream out, String label, FiniteAutomaton automaton, List<String> words) {
    for (String word : words) {
      out.println(label + " \"" + word + "\": " + (automaton.acceptsWord(word) ? "accept" : "reject"));
    }
  }
}
