package FAMin.Interop;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import FAMin.Model.DA;
import FAMin.Model.NA;
import FAMin.Record.MalformedRecordException;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.exception.FormatException;
import net.automatalib.serialization.ba.BAParsers;
import net.automatalib.serialization.ba.BAWriter;

/**
 * BA (Büchi automaton) text format, read and written through AutomataLib.
 * Read as a finite automaton, a BA file is an NA; several initial states are joined through a fresh start
 * state with epsilon moves.
 */
public final class BAFormat {

    private BAFormat() {
    }

    public static NA read(InputStream is) throws IOException, MalformedRecordException {
        final CompactNFA<String> automaton;
        try {
            automaton = BAParsers.nfa().readModel(is).model;
        } catch (FormatException e) {
            throw new MalformedRecordException("not a valid BA file: " + e.getMessage(), e);
        }
        return AutomataLibBridge.fromNFA(automaton);
    }

    public static NA read(Path path) throws IOException, MalformedRecordException {
        try (InputStream is = Files.newInputStream(path)) {
            return read(is);
        }
    }

    /*
    The writer lists missing transitions as nothing, so a partial DA stays partial.
     */
    public static void write(OutputStream os, DA dfa) throws IOException {
        final CompactDFA<String> compact = AutomataLibBridge.toCompactDFA(dfa);
        new BAWriter<String>().writeModel(os, compact, compact.getInputAlphabet());
    }

    public static void write(Path path, DA dfa) throws IOException {
        try (OutputStream os = Files.newOutputStream(path)) {
            write(os, dfa);
        }
    }
}
