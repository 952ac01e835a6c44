package org.ysim.runtime.actions;

import org.ysim.runtime.model.ActionKind;
import org.ysim.runtime.spi.IActionHandler;

import java.util.EnumMap;

/**
 * Binds every {@link ActionKind} to the handler that executes it.
 * <p>
 * The table is always complete: construction fails if a kind has no handler, so dispatch never
 * meets an unbound action at run time.
 */
public final class ActionTable {

    private final EnumMap<ActionKind, IActionHandler> handlers;

    private ActionTable(EnumMap<ActionKind, IActionHandler> handlers) {
        for (ActionKind kind : ActionKind.values()) {
            if (!handlers.containsKey(kind)) {
                throw new IllegalStateException("No handler bound for action " + kind);
            }
        }
        this.handlers = handlers;
    }

    /**
     * @return the production bindings
     */
    public static ActionTable standard() {
        EnumMap<ActionKind, IActionHandler> map = new EnumMap<>(ActionKind.class);
        map.put(ActionKind.POST, new PostAction());
        map.put(ActionKind.COMMENT, new CommentAction());
        map.put(ActionKind.READ, new ReadAction());
        map.put(ActionKind.SHARE, new ShareAction());
        map.put(ActionKind.REPLY, new ReplyAction());
        map.put(ActionKind.SEARCH, new SearchAction());
        map.put(ActionKind.FOLLOW, new FollowAction());
        map.put(ActionKind.CAST, new CastAction());
        map.put(ActionKind.REACT, new ReactAction());
        map.put(ActionKind.NEWS, new NewsAction());
        return new ActionTable(map);
    }

    /**
     * Binds the same handler to every kind. Used to drive the dispatcher with scripted behaviour.
     */
    public static ActionTable uniform(IActionHandler handler) {
        EnumMap<ActionKind, IActionHandler> map = new EnumMap<>(ActionKind.class);
        for (ActionKind kind : ActionKind.values()) {
            map.put(kind, handler);
        }
        return new ActionTable(map);
    }

    /**
     * @return a copy of this table with one binding replaced
     */
    public ActionTable with(ActionKind kind, IActionHandler handler) {
        EnumMap<ActionKind, IActionHandler> copy = new EnumMap<>(handlers);
        copy.put(kind, handler);
        return new ActionTable(copy);
    }

    public IActionHandler handlerFor(ActionKind kind) {
        return handlers.get(kind);
    }
}
