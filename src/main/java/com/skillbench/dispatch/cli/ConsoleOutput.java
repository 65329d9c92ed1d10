package com.skillbench.dispatch.cli;

import com.skillbench.core.model.ResultStatus;
import com.skillbench.core.model.Round;
import com.skillbench.core.model.RunProgress;
import com.skillbench.core.model.SkillSummary;
import com.skillbench.core.model.TaskOutcome;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Skillbench CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) SKILLBENCH v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SKILLBENCH]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void progress(RunProgress p) {
        TaskOutcome last = p.lastResult();
        String tail = "";
        if (last != null) {
            String status = last.status() == ResultStatus.COMPLETED
                    ? "@|fg(green) OK|@" : "@|fg(red) FAIL|@";
            tail = "  " + status + " " + last.skillId() + "/" + last.caseId()
                    + (last.score() != null ? " (" + last.score() + ")" : "");
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(blue) [" + p.completedTasks() + "+" + p.failedTasks() + "/" + p.totalTasks() + "]|@" + tail));
    }

    public static void ranking(SkillSummary s) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                "  @|bold #%d|@ %-30s avg @|fg(yellow) %5.1f|@  scored %d, failed %d",
                s.rank(), s.skillName(), s.avgScore(), s.scoredCases(), s.failedCases())));
    }

    public static void round(Round r) {
        String delta = r.scoreDelta() == null ? "" : String.format(" (%+.1f)", r.scoreDelta());
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                "@|bold,fg(yellow) [ROUND %d]|@ %s %s avg %.1f%s plateau %d",
                r.round(), r.strategy(), r.skillName(),
                r.avgScore() == null ? 0.0 : r.avgScore(), delta,
                r.plateauLevel() == null ? 0 : r.plateauLevel())));
    }

    static String rootCauseMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
