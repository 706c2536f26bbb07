package net.littleredcomputer.sat;

import com.google.common.base.Ascii;
import com.google.common.base.Stopwatch;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.BufferedReader;
import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.time.Duration;

/**
 * Command-line front end. Reads a DIMACS cnf file (or standard input for "-") and
 * prints the verdict in the usual competition format.
 */
public class Main {
    static Options options() {
        return new Options()
                .addOption("problem", true, "filename of DIMACS cnf problem, or - for standard input")
                .addOption("algorithm", true, "cdcl (default) or backtracking")
                .addOption("polarity", true, "decision polarity: true, false or saved (default)")
                .addOption("restart", true, "restart strategy: geometric (default), luby or never")
                .addOption("maxdecisions", true, "give up after this many decisions")
                .addOption("timelimit", true, "give up after this long, in ISO-8601 format")
                .addOption("loginterval", true, "interval between progress log entries in ISO-8601 format");
    }

    private static Reader problem(CommandLine cmd) throws FileNotFoundException {
        if (!cmd.hasOption("problem")) throw new IllegalArgumentException("Must specify -problem");
        String p = cmd.getOptionValue("problem");
        return new BufferedReader(p.equals("-") ? new InputStreamReader(System.in) : new FileReader(p));
    }

    static SolverKind solverKind(CommandLine cmd) {
        String a = cmd.getOptionValue("algorithm", "cdcl");
        switch (a) {
            case "cdcl": return SolverKind.CDCL;
            case "backtracking": return SolverKind.BACKTRACKING;
            default: throw new IllegalArgumentException("Unknown algorithm: " + a);
        }
    }

    static SolverConfig config(CommandLine cmd) {
        SolverConfig.Builder b = SolverConfig.builder();
        if (cmd.hasOption("polarity")) {
            b.decisionPolarityDefault(SolverConfig.Polarity.valueOf(Ascii.toUpperCase(cmd.getOptionValue("polarity"))));
        }
        if (cmd.hasOption("restart")) {
            b.restartStrategy(RestartStrategy.valueOf(Ascii.toUpperCase(cmd.getOptionValue("restart"))));
        }
        if (cmd.hasOption("maxdecisions")) b.maxDecisions(Long.parseLong(cmd.getOptionValue("maxdecisions")));
        if (cmd.hasOption("timelimit")) b.timeLimit(Duration.parse(cmd.getOptionValue("timelimit")));
        b.logInterval(Duration.parse(cmd.getOptionValue("loginterval", "PT1S")));
        return b.build();
    }

    /** Solve the problem the command line names and print the outcome. Returns the verdict. */
    static Result run(CommandLine cmd, Reader problem, PrintStream out) {
        Formula f = Formula.parseFrom(problem);
        Stopwatch sw = Stopwatch.createStarted();
        Result r = solverKind(cmd).solve(f, config(cmd));
        sw.stop();
        out.println("c " + sw);
        switch (r.status()) {
            case SATISFIABLE: {
                out.println("s SATISFIABLE");
                out.print("v ");
                boolean[] bs = r.assignment().get();
                for (int i = 0; i < bs.length; ++i) out.printf("%d ", bs[i] ? i+1 : -i-1);
                out.println("0");
                break;
            }
            case UNSATISFIABLE:
                out.println("s UNSATISFIABLE");
                break;
            case UNKNOWN:
                out.println("s UNKNOWN");
                out.println("c " + r.reason().orElse(""));
                break;
            default:
                out.println("c invalid input: " + r.reason().orElse(""));
                out.println("s UNKNOWN");
        }
        Statistics s = r.statistics();
        out.printf("c decisions %d conflicts %d propagations %d%n", s.decisions(), s.conflicts(), s.propagations());
        out.printf("c learned %d deleted %d restarts %d%n", s.learnedClauses(), s.deletedClauses(), s.restarts());
        return r;
    }

    public static void main(String[] args) throws ParseException, FileNotFoundException {
        CommandLine cmd = new DefaultParser().parse(options(), args);
        Result r = run(cmd, problem(cmd), System.out);
        System.exit(r.isSatisfiable() ? 10 : r.isUnsatisfiable() ? 20 : 0);
    }
}
