package com.tidewatch.app;

import com.tidewatch.calendar.SettlementCalendar;
import com.tidewatch.config.Config;
import com.tidewatch.core.error.CalendarDataGapException;
import com.tidewatch.core.error.DataUnavailableException;
import com.tidewatch.core.error.FetchException;
import com.tidewatch.core.error.ScanInProgressException;
import com.tidewatch.core.error.TideWatchException;
import com.tidewatch.data.ZhituClient;
import com.tidewatch.guard.MarketGuard;
import com.tidewatch.risk.FinancialRiskScanner;
import com.tidewatch.risk.RiskRecord;
import com.tidewatch.risk.ScanStats;
import com.tidewatch.status.GlobalStatusAggregator;
import com.tidewatch.strategy.StrategyRunner;
import com.tidewatch.strategy.StrategySignal;
import com.tidewatch.timing.TimingFunnel;
import com.tidewatch.timing.TimingSignal;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.OptionGroup;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Command-line entry point. Every command prints one JSON document on stdout; failures print
 * {@code {"error": ...}} and exit non-zero.
 */
public final class TideWatchApplication {
    private static final Logger LOG = LogManager.getLogger(TideWatchApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_DATA_UNAVAILABLE = 3;
    static final int EXIT_SCAN_IN_PROGRESS = 4;

    public static void main(String[] args) {
        int exit = new TideWatchApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("tidewatch", options);
            printError(e.getMessage(), "usage");
            return EXIT_USAGE;
        }

        if (cmd.hasOption("help") || cmd.getOptions().length == 0) {
            new HelpFormatter().printHelp("tidewatch", options);
            return EXIT_OK;
        }

        try (AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext(TideWatchBootstrapConfig.class)) {
            Object result = dispatch(cmd, context);
            System.out.println(render(result));
            return EXIT_OK;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Command interrupted");
            printError("interrupted", "interrupted");
            return EXIT_FAILURE;
        } catch (Exception e) {
            int exit = exitCodeFor(e);
            Throwable root = rootCause(e);
            if (exit == EXIT_FAILURE) {
                LOG.error("Command failed", e);
            } else {
                LOG.warn("Command failed: {}", root.getMessage());
            }
            printError(root.getMessage(), causeLabel(e));
            return exit;
        }
    }

    private Object dispatch(CommandLine cmd, AnnotationConfigApplicationContext context) throws Exception {
        Config config = context.getBean(Config.class);
        Clock clock = context.getBean(Clock.class);
        LocalDate today = LocalDate.now(clock.withZone(config.getZone("app.zone")));

        if (cmd.hasOption("timing")) {
            TimingFunnel funnel = context.getBean(TimingFunnel.class);
            String raw = cmd.getOptionValue("timing");
            TimingSignal signal = raw == null ? funnel.today() : funnel.timingFor(parseDate(raw));
            return signal.toJson();
        }
        if (cmd.hasOption("timing-range")) {
            String[] bounds = cmd.getOptionValues("timing-range");
            LocalDate start = parseDate(bounds[0]);
            LocalDate end = parseDate(bounds[1]);
            if (end.isBefore(start)) {
                throw new IllegalArgumentException("range end " + end + " is before start " + start);
            }
            JSONArray out = new JSONArray();
            for (TimingSignal signal : context.getBean(TimingFunnel.class).evaluateRange(start, end)) {
                out.put(signal.toJson());
            }
            return out;
        }
        if (cmd.hasOption("calendar")) {
            LocalDate date = dateOrToday(cmd.getOptionValue("calendar"), today);
            return context.getBean(SettlementCalendar.class).calendarToday(date).toJson();
        }
        if (cmd.hasOption("guard")) {
            return context.getBean(MarketGuard.class).confirm().toJson();
        }
        if (cmd.hasOption("risk-scan")) {
            FinancialRiskScanner scanner = context.getBean(FinancialRiskScanner.class);
            ScanStats stats = scanner.scan(context.getBean(ZhituClient.class).listings());
            return stats.toJson();
        }
        if (cmd.hasOption("risk-check")) {
            return riskCheck(context.getBean(FinancialRiskScanner.class), cmd.getOptionValue("risk-check"));
        }
        if (cmd.hasOption("risk-list")) {
            JSONArray out = new JSONArray();
            for (RiskRecord record : context.getBean(FinancialRiskScanner.class).riskList()) {
                out.put(record.toJson());
            }
            return out;
        }
        if (cmd.hasOption("global-status")) {
            LocalDate date = dateOrToday(cmd.getOptionValue("global-status"), today);
            return context.getBean(GlobalStatusAggregator.class).aggregate(date).toJson();
        }
        if (cmd.hasOption("run-strategy")) {
            return runStrategy(context.getBean(StrategyRunner.class), cmd.getOptionValue("run-strategy"),
                    dateOrToday(cmd.getOptionValue("date"), today));
        }
        throw new IllegalArgumentException("no command given, see --help");
    }

    private JSONObject riskCheck(FinancialRiskScanner scanner, String raw) {
        List<String> codes = new ArrayList<>();
        for (String part : raw.split(",")) {
            if (!part.trim().isEmpty()) {
                codes.add(part.trim());
            }
        }
        if (codes.isEmpty()) {
            throw new IllegalArgumentException("--risk-check needs at least one code");
        }
        if (codes.size() == 1) {
            return scanner.riskCheck(codes.get(0)).toJson();
        }
        JSONObject flagged = new JSONObject();
        for (Map.Entry<String, RiskRecord> entry : scanner.riskCheckBatch(codes).entrySet()) {
            flagged.put(entry.getKey(), entry.getValue().toJson());
        }
        JSONObject out = new JSONObject();
        out.put("checked", codes.size());
        out.put("flagged", flagged);
        return out;
    }

    private JSONObject runStrategy(StrategyRunner runner, String name, LocalDate date) {
        JSONObject out = new JSONObject();
        out.put("date", date.toString());
        if ("all".equalsIgnoreCase(name.trim())) {
            for (Map.Entry<String, List<StrategySignal>> entry : runner.runAll(date).entrySet()) {
                out.put(entry.getKey(), signalsJson(entry.getValue()));
            }
            return out;
        }
        String key = name.trim().toLowerCase(Locale.ROOT);
        out.put(key, signalsJson(runner.run(key, date)));
        return out;
    }

    private static JSONArray signalsJson(List<StrategySignal> signals) {
        JSONArray out = new JSONArray();
        for (StrategySignal signal : signals) {
            out.put(signal.toJson());
        }
        return out;
    }

    static int exitCodeFor(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof ScanInProgressException) {
                return EXIT_SCAN_IN_PROGRESS;
            }
            if (t instanceof DataUnavailableException
                    || t instanceof CalendarDataGapException
                    || t instanceof FetchException) {
                return EXIT_DATA_UNAVAILABLE;
            }
            if (t instanceof DateTimeParseException || t instanceof IllegalArgumentException) {
                return EXIT_USAGE;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return EXIT_FAILURE;
    }

    static String causeLabel(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof TideWatchException) {
                return ((TideWatchException) t).causeCode().label();
            }
            if (t instanceof FetchException) {
                return ((FetchException) t).causeCode().label();
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return exitCodeFor(error) == EXIT_USAGE ? "usage" : "internal";
    }

    static LocalDate parseDate(String raw) {
        return LocalDate.parse(raw.trim());
    }

    private static LocalDate dateOrToday(String raw, LocalDate today) {
        return raw == null || raw.trim().isEmpty() ? today : parseDate(raw);
    }

    private static Throwable rootCause(Throwable error) {
        Throwable current = error;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }

    private static String render(Object result) {
        if (result instanceof JSONObject) {
            return ((JSONObject) result).toString(2);
        }
        if (result instanceof JSONArray) {
            return ((JSONArray) result).toString(2);
        }
        return String.valueOf(result);
    }

    private static void printError(String message, String cause) {
        JSONObject out = new JSONObject();
        out.put("error", message == null ? "unknown error" : message);
        out.put("cause", cause);
        System.out.println(out.toString(2));
    }

    private Options buildOptions() {
        Options options = new Options();
        OptionGroup commands = new OptionGroup();
        commands.addOption(Option.builder().longOpt("timing").hasArg().optionalArg(true).argName("date")
                .desc("Timing signal for a date (default: now)").build());
        commands.addOption(Option.builder().longOpt("timing-range").numberOfArgs(2).argName("start end")
                .desc("Timing signals for every trading day in [start, end]").build());
        commands.addOption(Option.builder().longOpt("calendar").hasArg().optionalArg(true).argName("date")
                .desc("Settlement calendar overview (default: today)").build());
        commands.addOption(Option.builder().longOpt("guard")
                .desc("Evaluate the market guard against a fresh snapshot").build());
        commands.addOption(Option.builder().longOpt("risk-scan")
                .desc("Run a full financial risk scan").build());
        commands.addOption(Option.builder().longOpt("risk-check").hasArg().argName("code[,code...]")
                .desc("Look up financial risk for one or more codes").build());
        commands.addOption(Option.builder().longOpt("risk-list")
                .desc("List the current risk records").build());
        commands.addOption(Option.builder().longOpt("global-status").hasArg().optionalArg(true).argName("date")
                .desc("Timing, calendar and risk summary in one document").build());
        commands.addOption(Option.builder().longOpt("run-strategy").hasArg().argName("name|all")
                .desc("Run one strategy or all enabled strategies").build());
        commands.addOption(Option.builder("h").longOpt("help").desc("Show help").build());
        options.addOptionGroup(commands);
        options.addOption(Option.builder().longOpt("date").hasArg().argName("date")
                .desc("Run date for --run-strategy (default: today)").build());
        return options;
    }
}
