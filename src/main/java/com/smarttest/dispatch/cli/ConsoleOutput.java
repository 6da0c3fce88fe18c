package com.smarttest.dispatch.cli;

import com.smarttest.core.model.QualityMetric;
import com.smarttest.core.model.RunState;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the SmartTest CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) SMARTTEST v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SMARTTEST]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void state(RunState state) {
        String label = "State: " + state.wireName();
        switch (state) {
            case COMPLETED -> success(label);
            case FAILED -> error(label);
            case AWAITING_APPROVAL, REPORT_READY -> System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|fg(yellow),bold [WAITING]|@ " + label));
            default -> info(label);
        }
    }

    public static void metric(QualityMetric metric) {
        if (metric == null) {
            return;
        }
        String comparison = metric.name().lowerIsBetter() ? "<=" : ">=";
        String value = String.format("%.1f%%", metric.value() * 100);
        String colored = metric.passed() ? "@|fg(green) " + value + "|@" : "@|fg(red) " + value + "|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + metric.name() + ": " + colored
                        + String.format(" (threshold %s %.1f%%)", comparison, metric.threshold() * 100)));
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
