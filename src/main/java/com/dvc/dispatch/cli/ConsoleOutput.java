package com.dvc.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the DVC CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold,fg(red) DVC ENGINE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(cyan) [DVC]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(red) x|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(yellow) !|@ " + message));
    }

    /**
     * Prints one session as returned by the sessions API.
     */
    public static void session(JsonNode s) {
        String status = text(s, "status");
        String color = switch (status) {
            case "RUNNING" -> "fg(green)";
            case "STARTING", "STOPPING" -> "fg(yellow)";
            case "ERROR" -> "fg(red)";
            default -> "fg(white)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|bold " + text(s, "session_id") + "|@  " + text(s, "challenge_id")
                        + "  @|" + color + " " + status + "|@"
                        + "  user=" + text(s, "user_id")
                        + "  health=" + text(s, "health_status")));
        if (s.hasNonNull("access_url")) {
            System.out.println("      url: " + s.get("access_url").asText());
        }
        if (s.hasNonNull("remaining_seconds") && s.get("remaining_seconds").asLong() > 0) {
            System.out.println("      expires in: " + formatSeconds(s.get("remaining_seconds").asLong()));
        }
        if (s.hasNonNull("error")) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("      @|fg(red) " + s.get("error").asText() + "|@"));
        }
    }

    public static void challenge(String id, String name, String category, String difficulty, int points) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                "  @|bold %-20s|@ %-28s %-14s %-13s %4d pts", id, truncate(name, 28), category, difficulty, points)));
    }

    static String formatSeconds(long seconds) {
        if (seconds < 60) return seconds + "s";
        if (seconds < 3600) return (seconds / 60) + "m " + (seconds % 60) + "s";
        return (seconds / 3600) + "h " + ((seconds % 3600) / 60) + "m";
    }

    private static String text(JsonNode node, String field) {
        return node.hasNonNull(field) ? node.get(field).asText() : "-";
    }

    private static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
