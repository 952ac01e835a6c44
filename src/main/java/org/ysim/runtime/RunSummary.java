package org.ysim.runtime;

import org.ysim.runtime.model.ActionKind;
import org.ysim.runtime.model.ActionResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-day, per-kind counts of action outcomes plus the day-boundary reports.
 * <p>
 * Timed-out actions count as failed. Idle counts active actors that elected not to act.
 * Written by the orchestration thread only.
 */
public class RunSummary {

    /**
     * Outcome counts of one action kind on one day.
     */
    public static final class Counts {
        private int succeeded;
        private int failed;
        private int skipped;

        public int getSucceeded() {
            return succeeded;
        }

        public int getFailed() {
            return failed;
        }

        public int getSkipped() {
            return skipped;
        }

        public int getTotal() {
            return succeeded + failed + skipped;
        }
    }

    private final Map<Integer, EnumMap<ActionKind, Counts>> byDay = new TreeMap<>();
    private final Map<Integer, Integer> idleByDay = new TreeMap<>();
    private final List<PopulationManager.DayReport> dayReports = new ArrayList<>();

    public void record(List<ActionResult> results) {
        for (ActionResult result : results) {
            Counts counts = byDay.computeIfAbsent(result.day(), d -> new EnumMap<>(ActionKind.class))
                    .computeIfAbsent(result.kind(), k -> new Counts());
            switch (result.status()) {
                case SUCCEEDED -> counts.succeeded++;
                case FAILED, TIMED_OUT -> counts.failed++;
                case SKIPPED -> counts.skipped++;
            }
        }
    }

    public void recordIdle(int day, int idle) {
        if (idle > 0) {
            idleByDay.merge(day, idle, Integer::sum);
        }
    }

    public void addDay(PopulationManager.DayReport report) {
        dayReports.add(report);
        record(report.followResults());
    }

    /**
     * @return counts for a day and kind; all zero if nothing was recorded
     */
    public Counts get(int day, ActionKind kind) {
        EnumMap<ActionKind, Counts> perDay = byDay.get(day);
        Counts counts = perDay != null ? perDay.get(kind) : null;
        return counts != null ? counts : new Counts();
    }

    public int getIdle(int day) {
        return idleByDay.getOrDefault(day, 0);
    }

    public List<PopulationManager.DayReport> getDayReports() {
        return Collections.unmodifiableList(dayReports);
    }

    /**
     * @return totals over all days and kinds as {@code [succeeded, failed, skipped]}
     */
    public int[] totals() {
        int[] totals = new int[3];
        for (EnumMap<ActionKind, Counts> day : byDay.values()) {
            for (Counts c : day.values()) {
                totals[0] += c.succeeded;
                totals[1] += c.failed;
                totals[2] += c.skipped;
            }
        }
        return totals;
    }

    /**
     * Renders the summary as a plain-text table.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-5s %-8s %10s %8s %8s%n", "day", "action", "succeeded", "failed", "skipped"));
        for (Map.Entry<Integer, EnumMap<ActionKind, Counts>> day : byDay.entrySet()) {
            for (Map.Entry<ActionKind, Counts> kind : day.getValue().entrySet()) {
                Counts c = kind.getValue();
                sb.append(String.format("%-5d %-8s %10d %8d %8d%n", day.getKey(), kind.getKey().configKey(),
                        c.succeeded, c.failed, c.skipped));
            }
            int idle = getIdle(day.getKey());
            if (idle > 0) {
                sb.append(String.format("%-5d %-8s %10d%n", day.getKey(), "(idle)", idle));
            }
        }
        int[] t = totals();
        sb.append(String.format("%-14s %10d %8d %8d%n", "total", t[0], t[1], t[2]));
        if (!dayReports.isEmpty()) {
            sb.append(String.format("%n%-5s %8s %8s %10s %8s%n", "day", "before", "churned", "recruited", "after"));
            for (PopulationManager.DayReport r : dayReports) {
                sb.append(String.format("%-5d %8d %8d %10d %8d%n", r.day(), r.before(), r.churned(),
                        r.recruited(), r.after()));
                for (PopulationManager.PhaseFailure f : r.failures()) {
                    sb.append("      ").append(f.phase()).append(": ").append(f.message()).append(System.lineSeparator());
                }
            }
        }
        return sb.toString();
    }
}
