package org.ysim.runtime.model;

/**
 * Snapshot of the simulation clock: absolute slot number plus the derived day and hour.
 * <p>
 * A boundary time stands for the day boundary that follows a slot. It carries that slot's
 * numbers but is not a slot itself: work done at a boundary never shares a slot with the actions
 * of the slot before it.
 *
 * @param slot     absolute slot number, starting at 0
 * @param day      {@code slot / slotsPerDay}
 * @param hour     {@code slot % slotsPerDay}
 * @param boundary {@code true} for the day boundary after {@code slot}
 */
public record SlotTime(long slot, int day, int hour, boolean boundary) {

    public SlotTime {
        if (slot < 0 || day < 0 || hour < 0) {
            throw new IllegalArgumentException("Slot time components must be >= 0, got slot=" + slot
                    + " day=" + day + " hour=" + hour);
        }
    }

    public SlotTime(long slot, int day, int hour) {
        this(slot, day, hour, false);
    }

    /**
     * Derives the slot time for an absolute slot.
     *
     * @param slot        absolute slot
     * @param slotsPerDay slots per simulated day
     * @return the slot time
     */
    public static SlotTime of(long slot, int slotsPerDay) {
        return new SlotTime(slot, (int) (slot / slotsPerDay), (int) (slot % slotsPerDay));
    }

    /**
     * @return the day boundary following this slot
     */
    public SlotTime boundaryAfter() {
        return new SlotTime(slot, day, hour, true);
    }

    @Override
    public String toString() {
        String time = "slot " + slot + " (day " + day + ", hour " + hour + ")";
        return boundary ? "day boundary after " + time : time;
    }
}
