// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.heap;

import com.google.common.base.Splitter;
import com.google.common.base.Stopwatch;
import com.google.common.primitives.Ints;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public class Main {
    private static final Logger log = LogManager.getFormatterLogger(Main.class);
    private static final Splitter commaSplitter = Splitter.on(',').trimResults().omitEmptyStrings();

    private static Options options() {
        return new Options()
                .addOption("task", true, "one of drain, nth, search, validate")
                .addOption("elements", true, "comma-separated integers")
                .addOption("priority", true, "max (default) or min")
                .addOption("n", true, "zero-based rank for the nth task")
                .addOption("value", true, "value to look for in the search task");
    }

    private static int intOption(CommandLine cmd, String name) {
        if (!cmd.hasOption(name)) throw new IllegalArgumentException("Must specify -" + name);
        Integer i = Ints.tryParse(cmd.getOptionValue(name).trim());
        if (i == null) throw new IllegalArgumentException("not an integer: -" + name + " " + cmd.getOptionValue(name));
        return i;
    }

    static List<Integer> elements(CommandLine cmd) {
        if (!cmd.hasOption("elements")) throw new IllegalArgumentException("Must specify -elements");
        List<Integer> es = new ArrayList<>();
        for (String s : commaSplitter.split(cmd.getOptionValue("elements"))) {
            Integer i = Ints.tryParse(s);
            if (i == null) throw new IllegalArgumentException("not an integer: " + s);
            es.add(i);
        }
        return es;
    }

    static void run(String[] args, PrintStream out) throws ParseException {
        CommandLine cmd = new DefaultParser().parse(options(), args);
        if (!cmd.hasOption("task")) throw new IllegalArgumentException("Must specify -task");
        String task = cmd.getOptionValue("task");
        Priority priority = Priority.parse(cmd.getOptionValue("priority", "max"));
        List<Integer> es = elements(cmd);
        Stopwatch sw = Stopwatch.createStarted();
        switch (task) {
            case "drain": {
                // Show the extraction order growing one element at a time.
                BinaryHeap<Integer> h = new BinaryHeap<>(es, priority);
                List<Integer> result = new ArrayList<>(h.size());
                while (!h.isEmpty()) {
                    result.add(h.remove().get());
                    out.println(result);
                }
                break;
            }
            case "nth": {
                Optional<Integer> v = Heaps.nthSmallest(es, intOption(cmd, "n"));
                out.println(v.isPresent() ? v.get().toString() : "none");
                break;
            }
            case "search": {
                BinaryHeap<Integer> h = new BinaryHeap<>(es, priority);
                out.println(h);
                out.println(h.indexOf(intOption(cmd, "value")));
                break;
            }
            case "validate":
                out.println("min-heap " + Heaps.isMinHeap(es));
                out.println(priority.name().toLowerCase(Locale.ROOT) + "-heap " + Heaps.isHeap(es, priority));
                break;
            default:
                throw new IllegalArgumentException("unknown task: " + task);
        }
        log.info("%s over %d elements took %s", task, es.size(), sw.stop());
    }

    public static void main(String[] args) throws ParseException {
        run(args, System.out);
    }
}
