package org.ysim.runtime.spi;

import org.ysim.runtime.Simulation;

/**
 * Interface for plugins that execute once per simulation slot.
 * <p>
 * Slot plugins run at the beginning of each slot, before the live population is snapshotted and
 * sampled. They are executed sequentially in registration order on the orchestration thread.
 * A failing plugin is logged and skipped; it never aborts the slot.
 * </p>
 */
public interface ISlotPlugin {

    /**
     * Executes the plugin logic for the current slot.
     *
     * @param simulation the simulation, positioned at the slot about to run
     * @throws Exception any failure, reported and ignored by the simulation
     */
    void onSlot(Simulation simulation) throws Exception;
}
