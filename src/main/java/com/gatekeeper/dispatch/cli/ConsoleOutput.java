package com.gatekeeper.dispatch.cli;

import com.gatekeeper.core.model.RiskLevel;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Gatekeeper CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) GATEKEEPER v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [GATEKEEPER]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void commitHeader(String id) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) " + id + "|@"));
    }

    public static void branch(String name, boolean current, String detail) {
        String marker = current ? "@|fg(green) * " + name + "|@" : "  " + name;
        System.out.println(CommandLine.Help.Ansi.AUTO.string("  " + marker + " " + detail));
    }

    public static void risk(String label, RiskLevel level, String detail) {
        String color = switch (level) {
            case LOW -> "fg(green)";
            case MEDIUM -> "fg(yellow)";
            case HIGH -> "fg(red)";
            case CRITICAL -> "fg(red),bold";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + label + " @|" + color + " " + level.label().toUpperCase() + "|@ " + detail));
    }

    public static void decision(boolean requiresApproval, String detail) {
        if (requiresApproval) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(red),bold [APPROVAL REQUIRED]|@ " + detail));
        } else {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(green),bold [AUTO-APPROVABLE]|@ " + detail));
        }
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
