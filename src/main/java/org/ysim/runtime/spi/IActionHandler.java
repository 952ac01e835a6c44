package org.ysim.runtime.spi;

/**
 * Executes one kind of action for one actor in one slot.
 * <p>
 * Handlers are stateless and shared by all worker threads. Everything they need arrives through
 * the {@link ActionContext}; they may write only the acting actor's own fields.
 */
@FunctionalInterface
public interface IActionHandler {

    /**
     * @param context the acting actor, the slot, its random stream and the collaborators
     * @throws GatewayException if an external call fails
     */
    void execute(ActionContext context) throws GatewayException;
}
