package org.ysim.client;

import org.ysim.runtime.Simulation;
import org.ysim.runtime.model.SlotTime;
import org.ysim.runtime.spi.IContentService;
import org.ysim.runtime.spi.ISlotPlugin;

import java.util.Objects;

/**
 * Moves the content service clock to the slot about to run.
 */
public final class ServerTimeSync implements ISlotPlugin {

    private final IContentService content;

    public ServerTimeSync(IContentService content) {
        this.content = Objects.requireNonNull(content, "content");
    }

    @Override
    public void onSlot(Simulation simulation) throws Exception {
        SlotTime time = simulation.getCurrentTime();
        content.updateTime(time);
    }
}
