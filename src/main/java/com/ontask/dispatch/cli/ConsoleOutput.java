package com.ontask.dispatch.cli;

import com.ontask.core.model.RankedTask;
import com.ontask.core.model.TaskLine;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the OnTask CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) ONTASK v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [ONTASK]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void document(String documentId) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(blue) " + documentId + "|@"));
    }

    public static void task(RankedTask ranked) {
        TaskLine task = ranked.task();
        String marker = ranked.top() ? "@|bold,fg(yellow) *|@" : " ";
        String rank = ranked.isRanked() ? " @|faint (rank " + ranked.rank() + ")|@" : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                " " + marker + " " + statusToken(task.statusSymbol()) + " " + escape(task.text())
                + " @|faint :" + task.lineNumber() + "|@" + rank));
    }

    public static void topTask(RankedTask top) {
        TaskLine task = top.task();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) TOP|@ " + statusToken(task.statusSymbol()) + " " + escape(task.text())));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "    @|faint " + escape(task.documentId()) + ":" + task.lineNumber() + "|@"));
    }

    private static String statusToken(char status) {
        String color = switch (status) {
            case '/' -> "fg(red)";
            case '!' -> "fg(red),bold";
            case '+' -> "fg(magenta)";
            case 'x', 'X' -> "fg(green)";
            case '?' -> "fg(yellow)";
            default -> "fg(white)";
        };
        return "@|" + color + " [" + escape(String.valueOf(status)) + "]|@";
    }

    /** Keeps user text from being read as picocli markup. */
    private static String escape(String text) {
        return text.replace("@|", "@ |");
    }
}
