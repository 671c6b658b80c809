/**
 * GirasolOptions.java
 *
 * 命令行解析：girasol [--home DIR] <subcommand> [options]。
 * 全局选项在子命令之前解析，子命令之后的参数使用该子命令自己的选项集合。
 */
package club.ppmc.girasol.util;

import club.ppmc.girasol.model.GirasolCommand;
import java.io.PrintWriter;
import java.util.Arrays;
import java.util.List;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

public final class GirasolOptions {

    public static final String APPLICATION_NAME = "girasol";

    private static final String SUBCOMMANDS = "endpoint | list | add | check | remove | local";

    private final Options globalOptions = new Options()
            .addOption(null, "home", true, "Directory holding the catalog and trace output (default ~/.girasol).")
            .addOption("h", "help", false, "Display help message.");

    private final Options endpointOptions = new Options()
            .addOption(Option.builder("s").longOpt("server").hasArg().argName("host:port").required()
                    .desc("Address the daemon listens on.").build());

    private final Options listOptions = new Options()
            .addOption("d", "detail", false, "Print every definition as JSON.");

    private final Options addOptions = new Options()
            .addOption("e", "editor", true, "Editor command (default $EDITOR, then vi).");

    private final Options localOptions = new Options()
            .addOption("r", "round", true, "Iteration count; the definition's lasting is used when absent or zero.")
            .addOption("p", "pattern", true, "Regular expression selecting reported output lines.");

    private final Options emptyOptions = new Options();

    private String home;

    /**
     * 解析命令行参数。
     *
     * @throws ParseException 参数不合法，调用方应打印帮助并以状态码 2 退出。
     */
    public GirasolCommand parseArgs(String[] args) throws ParseException {
        CommandLineParser parser = new DefaultParser();
        CommandLine global = parser.parse(globalOptions, args, true);
        home = global.getOptionValue("home");
        if (global.hasOption("help")) {
            return new GirasolCommand.Help();
        }
        List<String> rest = global.getArgList();
        if (rest.isEmpty()) {
            throw new ParseException("missing subcommand: " + SUBCOMMANDS);
        }
        String subcommand = rest.get(0);
        String[] subArgs = rest.subList(1, rest.size()).toArray(new String[0]);
        switch (subcommand) {
            case "endpoint": {
                CommandLine line = parser.parse(endpointOptions, subArgs);
                expectPositional(line, 0, subcommand);
                return parseServer(line.getOptionValue("server"));
            }
            case "list": {
                CommandLine line = parser.parse(listOptions, subArgs);
                expectPositional(line, 0, subcommand);
                return new GirasolCommand.ListTraces(line.hasOption("detail"));
            }
            case "add": {
                CommandLine line = parser.parse(addOptions, subArgs);
                expectPositional(line, 0, subcommand);
                return new GirasolCommand.Add(line.getOptionValue("editor"));
            }
            case "check": {
                CommandLine line = parser.parse(emptyOptions, subArgs);
                return new GirasolCommand.Check(expectPositional(line, 1, subcommand));
            }
            case "remove": {
                CommandLine line = parser.parse(emptyOptions, subArgs);
                return new GirasolCommand.Remove(expectPositional(line, 1, subcommand));
            }
            case "local": {
                CommandLine line = parser.parse(localOptions, subArgs);
                String name = expectPositional(line, 1, subcommand);
                long round = parseRound(line.getOptionValue("round", "0"));
                return new GirasolCommand.Local(name, round, line.getOptionValue("pattern", ""));
            }
            default:
                throw new ParseException("unknown subcommand '" + subcommand + "', expected one of: " + SUBCOMMANDS);
        }
    }

    /**
     * @return --home 的值，没有指定时为 null。
     */
    public String home() {
        return home;
    }

    public void printHelp(PrintWriter out) {
        var formatter = new HelpFormatter();
        String syntax = APPLICATION_NAME + " [--home DIR] <" + SUBCOMMANDS + "> [options]";
        formatter.printHelp(out, HelpFormatter.DEFAULT_WIDTH, syntax, "Global options:", globalOptions,
                HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null);
        printSection(formatter, out, "endpoint --server host:port", endpointOptions);
        printSection(formatter, out, "list [--detail]", listOptions);
        printSection(formatter, out, "add [--editor CMD]", addOptions);
        printSection(formatter, out, "check NAME", emptyOptions);
        printSection(formatter, out, "remove NAME", emptyOptions);
        printSection(formatter, out, "local NAME [--round N] [--pattern P]", localOptions);
        out.flush();
    }

    private static void printSection(HelpFormatter formatter, PrintWriter out, String syntax, Options options) {
        out.println();
        if (options.getOptions().isEmpty()) {
            out.println(APPLICATION_NAME + " " + syntax);
            return;
        }
        formatter.printHelp(out, HelpFormatter.DEFAULT_WIDTH, APPLICATION_NAME + " " + syntax, null, options,
                HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null);
    }

    private static String expectPositional(CommandLine line, int count, String subcommand) throws ParseException {
        List<String> positional = line.getArgList();
        if (positional.size() != count) {
            throw new ParseException(subcommand + " expects " + count + " argument(s), got "
                    + Arrays.toString(positional.toArray()));
        }
        return count == 0 ? null : positional.get(0);
    }

    private static GirasolCommand.Endpoint parseServer(String server) throws ParseException {
        int separator = server.lastIndexOf(':');
        if (separator <= 0 || separator == server.length() - 1) {
            throw new ParseException("--server must look like host:port, got '" + server + "'");
        }
        String host = server.substring(0, separator);
        int port;
        try {
            port = Integer.parseInt(server.substring(separator + 1));
        } catch (NumberFormatException e) {
            throw new ParseException("invalid port in --server: '" + server + "'");
        }
        if (port < 0 || port > 65535) {
            throw new ParseException("port out of range in --server: " + port);
        }
        return new GirasolCommand.Endpoint(host, port);
    }

    private static long parseRound(String value) throws ParseException {
        try {
            long round = Long.parseLong(value);
            if (round < 0) {
                throw new ParseException("--round must not be negative: " + value);
            }
            return round;
        } catch (NumberFormatException e) {
            throw new ParseException("--round must be a number: '" + value + "'");
        }
    }
}
