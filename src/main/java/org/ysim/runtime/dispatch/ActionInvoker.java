package org.ysim.runtime.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.ysim.runtime.actions.ActionEnvironment;
import org.ysim.runtime.actions.ActionTable;
import org.ysim.runtime.model.ActionIntent;
import org.ysim.runtime.model.ActionKind;
import org.ysim.runtime.model.ActionResult;
import org.ysim.runtime.model.ActionStatus;
import org.ysim.runtime.model.Actor;
import org.ysim.runtime.model.SlotTime;
import org.ysim.runtime.spi.ActionContext;
import org.ysim.runtime.spi.GatewayException;
import org.ysim.runtime.spi.IActionHandler;
import org.ysim.runtime.spi.IRandomProvider;

/**
 * Wraps every action execution: resolves the handler, times it, retries transient failures of
 * idempotent actions, converts failures into results and records telemetry.
 * <p>
 * Never throws for a failing action. Safe to call concurrently for distinct actors.
 */
public class ActionInvoker {

    private static final Logger LOG = LoggerFactory.getLogger(ActionInvoker.class);

    private final ActionTable table;
    private final ActionEnvironment environment;
    private final IRandomProvider random;
    private final int lightRetries;
    private final TelemetryRecorder telemetry;

    /**
     * @param table        handler bindings
     * @param environment  collaborators handed to every handler
     * @param random       run-level random provider, only ever derived from
     * @param lightRetries additional attempts for idempotent actions after a transient failure
     * @param telemetry    sink for every result
     */
    public ActionInvoker(ActionTable table, ActionEnvironment environment, IRandomProvider random,
                         int lightRetries, TelemetryRecorder telemetry) {
        if (lightRetries < 0) {
            throw new IllegalArgumentException("lightRetries must be >= 0, got " + lightRetries);
        }
        this.table = table;
        this.environment = environment;
        this.random = random;
        this.lightRetries = lightRetries;
        this.telemetry = telemetry;
    }

    /**
     * Executes one intent.
     *
     * @return the result; {@link ActionStatus#SUCCEEDED}, {@link ActionStatus#FAILED} or
     *         {@link ActionStatus#TIMED_OUT}
     */
    public ActionResult invoke(SlotTime time, Actor actor, ActionIntent intent) {
        ActionKind kind = intent.kind();
        IActionHandler handler = table.handlerFor(kind);
        int maxAttempts = kind.isIdempotent() ? 1 + lightRetries : 1;
        long start = System.nanoTime();
        int attempts = 0;
        ActionResult result;
        while (true) {
            attempts++;
            // Every attempt replays the same random stream.
            IRandomProvider rng = random.deriveFor(time.boundary() ? "boundary" : "action", time.slot())
                    .deriveFor("actor", actor.getId());
            try {
                handler.execute(new ActionContext(time, actor, intent, rng, environment));
                result = ActionResult.succeeded(actor, kind, time, System.nanoTime() - start, attempts);
                break;
            } catch (GatewayException e) {
                if (e.isTransient() && attempts < maxAttempts) {
                    LOG.debug("Retrying {} of {} at {} after transient failure ({}/{}): {}",
                            kind, actor, time, attempts, maxAttempts, e.getMessage());
                    continue;
                }
                ActionStatus status = e.isTimeout() ? ActionStatus.TIMED_OUT : ActionStatus.FAILED;
                LOG.warn("{} of {} {} at {}: {}", kind, actor, status == ActionStatus.TIMED_OUT
                        ? "timed out" : "failed", time, e.getMessage());
                result = ActionResult.failed(actor, kind, time, status, System.nanoTime() - start, attempts, e);
                break;
            } catch (RuntimeException e) {
                LOG.warn("{} of {} failed at {} with unexpected error: {}", kind, actor, time, e.toString());
                result = ActionResult.failed(actor, kind, time, ActionStatus.FAILED,
                        System.nanoTime() - start, attempts, e);
                break;
            }
        }
        actor.recordActivity(time.slot());
        telemetry.record(result);
        return result;
    }

    /**
     * Records an intent the heavy pool did not admit.
     */
    public ActionResult skip(SlotTime time, Actor actor, ActionIntent intent, String reason) {
        ActionResult result = ActionResult.skipped(actor, intent.kind(), time, reason);
        telemetry.record(result);
        return result;
    }
}
