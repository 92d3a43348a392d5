package org.compacttz.app;

import org.compacttz.tz.Tz;
import org.compacttz.tz.TzDatabase;
import org.compacttz.tz.TzOffset;

import java.io.PrintStream;
import java.util.Optional;

/**
 * Command line front end over the embedded timezone database.
 *
 * <pre>
 * list                            print every canonical zone name
 * offset &lt;zone&gt; &lt;epochSeconds&gt;   print the offset in minutes and as +HH:MM
 * </pre>
 */
public class Main {
    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_UNKNOWN_ZONE = 2;

    /**
     * Runs one command and exits with its status.
     *
     * @param args command-line arguments.
     */
    public static void main(String[] args) {
        System.exit(run(args, TzDatabase.embedded(), System.out, System.err));
    }

    /**
     * Runs one command.
     *
     * @return process exit status.
     */
    static int run(String[] args, TzDatabase database, PrintStream out, PrintStream err) {
        if (args.length == 1 && "list".equals(args[0])) {
            for (String name : database.listTimezones()) {
                out.println(name);
            }
            return EXIT_OK;
        }
        if (args.length == 3 && "offset".equals(args[0])) {
            long epochSeconds;
            try {
                epochSeconds = Long.parseLong(args[2]);
            } catch (NumberFormatException ex) {
                err.println("Invalid epoch seconds: " + args[2]);
                return EXIT_USAGE;
            }
            Optional<Tz> tz = database.tryParse(args[1]);
            if (tz.isEmpty()) {
                err.println("Unknown timezone: " + args[1]);
                return EXIT_UNKNOWN_ZONE;
            }
            TzOffset offset = tz.get().offsetAt(epochSeconds);
            out.println(tz.get().name() + " " + offset.totalMinutes() + " " + offset);
            return EXIT_OK;
        }
        err.println("usage: list | offset <zone> <epochSeconds>");
        return EXIT_USAGE;
    }
}
