package com.storedsafe.lookup;

import com.storedsafe.client.StoredSafeException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Command-line entry point, for host tools that shell out instead of embedding the
 * library.
 *
 * <p>Usage: {@code java -jar storedsafe-lookup.jar [--var name=value]... <objectid>/<fieldname>...}
 *
 * <p>{@code --var} supplies framework variables such as
 * {@code storedsafe_server}; environment variables still take precedence. Each
 * value is printed on its own line, in argument order.
 */
public class StoredSafeLookupCli {

    static final int EXIT_OK = 0;
    static final int EXIT_LOOKUP_FAILED = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        System.exit(execute(args, new StoredSafeLookup(), System.out, System.err));
    }

    static int execute(String[] args, StoredSafeLookup lookup, PrintStream out, PrintStream err) {
        Map<String, String> vars = new LinkedHashMap<>();
        List<String> terms = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--var".equals(arg)) {
                String assignment = i + 1 < args.length ? args[++i] : null;
                int eq = assignment != null ? assignment.indexOf('=') : -1;
                if (eq <= 0) {
                    printUsage(err, "--var requires name=value");
                    return EXIT_USAGE;
                }
                vars.put(assignment.substring(0, eq), assignment.substring(eq + 1));
            } else if ("--help".equals(arg) || "-h".equals(arg)) {
                printUsage(out, null);
                return EXIT_OK;
            } else if (arg.startsWith("--")) {
                printUsage(err, "Unknown option " + arg);
                return EXIT_USAGE;
            } else {
                terms.add(arg);
            }
        }

        if (terms.isEmpty()) {
            printUsage(err, "No lookup terms given");
            return EXIT_USAGE;
        }

        try {
            for (String value : lookup.run(terms, vars)) {
                out.println(value);
            }
            return EXIT_OK;
        } catch (StoredSafeException e) {
            err.println("ERROR [" + e.getPhase() + "]: " + e.getMessage());
            return EXIT_LOOKUP_FAILED;
        }
    }

    private static void printUsage(PrintStream stream, String problem) {
        if (problem != null) {
            stream.println("Error: " + problem);
        }
        stream.println("Usage:");
        stream.println("  StoredSafeLookupCli [--var <name>=<value>]... <objectid>/<fieldname>...");
        stream.println("  Use <objectid>/download to print the content of a file object.");
    }
}
