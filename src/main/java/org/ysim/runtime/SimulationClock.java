package org.ysim.runtime;

import org.ysim.runtime.model.SlotTime;

/**
 * Discrete simulation clock over {@code totalDays * slotsPerDay} slots.
 * <p>
 * The slot only ever increases by one. Once the day would reach {@code totalDays} the clock
 * becomes terminal and stays there. Not thread-safe: owned by the orchestration loop.
 */
public class SimulationClock {

    private final int slotsPerDay;
    private final int totalDays;
    private long currentSlot;
    private boolean terminal;

    /**
     * @param slotsPerDay slots per simulated day, &gt; 0
     * @param totalDays   days to simulate, &gt; 0
     */
    public SimulationClock(int slotsPerDay, int totalDays) {
        this(slotsPerDay, totalDays, 0L);
    }

    /**
     * Creates a clock positioned at a given slot, e.g. to continue an interrupted run.
     */
    public SimulationClock(int slotsPerDay, int totalDays, long startSlot) {
        if (slotsPerDay <= 0) {
            throw new IllegalArgumentException("slotsPerDay must be > 0, got " + slotsPerDay);
        }
        if (totalDays <= 0) {
            throw new IllegalArgumentException("totalDays must be > 0, got " + totalDays);
        }
        if (startSlot < 0 || startSlot >= (long) slotsPerDay * totalDays) {
            throw new IllegalArgumentException("startSlot " + startSlot + " is outside the run");
        }
        this.slotsPerDay = slotsPerDay;
        this.totalDays = totalDays;
        this.currentSlot = startSlot;
    }

    /**
     * @return the current slot with its day and hour
     * @throws IllegalStateException if the clock is terminal
     */
    public SlotTime current() {
        if (terminal) {
            throw new IllegalStateException("Clock is terminal after " + totalDays + " days");
        }
        return SlotTime.of(currentSlot, slotsPerDay);
    }

    /**
     * Moves to the next slot.
     *
     * @return {@code true} if the clock now points at a valid slot, {@code false} if the run is over
     */
    public boolean advance() {
        if (terminal) {
            return false;
        }
        long next = currentSlot + 1;
        if (next / slotsPerDay >= totalDays) {
            terminal = true;
            return false;
        }
        currentSlot = next;
        return true;
    }

    public boolean isTerminal() {
        return terminal;
    }

    /**
     * @return whether the current slot is the last one of its day
     */
    public boolean isLastSlotOfDay() {
        return currentSlot % slotsPerDay == slotsPerDay - 1;
    }

    public int getSlotsPerDay() {
        return slotsPerDay;
    }

    public int getTotalDays() {
        return totalDays;
    }
}
