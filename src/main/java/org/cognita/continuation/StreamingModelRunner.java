package org.cognita.continuation;

import org.cognita.runtime.VirtualMachine;
import org.cognita.runtime.model.BehaviorModel;
import org.cognita.runtime.model.ContinuationPoint;
import org.cognita.runtime.model.EvaluationStatus;
import org.cognita.runtime.model.ExtensionModel;
import org.cognita.runtime.model.ModelCorruptionException;
import org.cognita.runtime.services.BehaviorModelReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Drives a {@link VirtualMachine} through continuation points: every pause opens a continuation
 * in the engine, and the evaluation resumes with the attached extension or, after the deadline,
 * with the point's default flow.
 * <p>
 * Two driving styles are offered. {@link #evaluateBlocking} waits on the calling thread;
 * {@link #begin} and {@link #tick} poll once per frame and never block.
 */
public class StreamingModelRunner {

    private static final Logger LOG = LoggerFactory.getLogger(StreamingModelRunner.class);

    private final VirtualMachine vm;
    private final ContinuationEngine engine;
    private final BehaviorModelReader reader;
    private volatile String pendingId;
    private volatile String lastResolvedId;

    public StreamingModelRunner(VirtualMachine vm, ContinuationEngine engine) {
        this(vm, engine, new BehaviorModelReader());
    }

    public StreamingModelRunner(VirtualMachine vm, ContinuationEngine engine, BehaviorModelReader reader) {
        this.vm = vm;
        this.engine = engine;
        this.reader = reader;
    }

    /**
     * Evaluates the model to completion, waiting at each continuation point until an extension
     * arrives or the point times out.
     * @return Always {@link EvaluationStatus#COMPLETED}.
     * @throws InterruptedException if the calling thread is interrupted while waiting.
     */
    public EvaluationStatus evaluateBlocking(double[] input, double[] output, long seed) throws InterruptedException {
        EvaluationStatus status = vm.evaluate(input, output, seed);
        while (status == EvaluationStatus.PAUSED) {
            String id = openForPause();
            Resolution resolution;
            try {
                resolution = engine.awaitResolution(id);
            } catch (InterruptedException e) {
                engine.discard(id);
                pendingId = null;
                throw e;
            }
            status = resume(resolution, input, output);
        }
        return status;
    }

    /**
     * Starts an evaluation without blocking.
     * @return {@link EvaluationStatus#PAUSED} if a continuation is now pending.
     */
    public EvaluationStatus begin(double[] input, double[] output, long seed) {
        if (pendingId != null) {
            engine.discard(pendingId);
            pendingId = null;
        }
        EvaluationStatus status = vm.evaluate(input, output, seed);
        if (status == EvaluationStatus.PAUSED) {
            openForPause();
        }
        return status;
    }

    /**
     * Advances a paused evaluation by at most one resolution.
     * @return {@link EvaluationStatus#PAUSED} while the pending continuation is still open.
     */
    public EvaluationStatus tick(double[] input, double[] output) {
        String id = pendingId;
        if (id == null) {
            return EvaluationStatus.COMPLETED;
        }
        engine.poll();
        if (!engine.isResolvable(id)) {
            return EvaluationStatus.PAUSED;
        }
        EvaluationStatus status = resume(engine.resolve(id), input, output);
        if (status == EvaluationStatus.PAUSED) {
            openForPause();
        }
        return status;
    }

    /**
     * Offers a serialized extension model for the pending continuation point.
     * @param pointName The continuation point the extension is meant for.
     * @param modelBytes The binary extension model.
     * @return {@link AttachResult#MISMATCHED} if the bytes are not a valid extension of this model
     *         for that point (including one writing more outputs than the model declares),
     *         {@link AttachResult#ALREADY_RESOLVED} if the last continuation at that point has
     *         already been resolved, otherwise the engine's attach result.
     */
    public AttachResult deliver(String pointName, byte[] modelBytes) {
        String id = pendingId;
        if (id == null) {
            String last = lastResolvedId;
            if (last != null && engine.getResolved(last).filter(c -> c.pointName().equals(pointName)).isPresent()) {
                return engine.attachExtension(last, modelBytes);
            }
            LOG.debug("Extension for '{}' arrived while no continuation is pending", pointName);
            return AttachResult.NOT_FOUND;
        }
        BehaviorModel parsed;
        try {
            parsed = reader.read(modelBytes);
        } catch (ModelCorruptionException e) {
            LOG.warn("Rejected extension for '{}': {}", pointName, e.getMessage());
            return AttachResult.MISMATCHED;
        }
        BehaviorModel base = vm.getModel();
        int index = base.continuationPointIndexOf(pointName);
        if (!(parsed instanceof ExtensionModel extension) || index < 0
                || !extension.targets(base, base.getContinuationPoints().get(index))) {
            LOG.warn("Rejected extension for '{}': not an extension of model {} at that point", pointName, base.getId());
            return AttachResult.MISMATCHED;
        }
        return engine.attachExtension(id, extension, extension.getAttachPointHash());
    }

    public boolean isPaused() {
        return pendingId != null;
    }

    public String getPendingContinuationId() {
        return pendingId;
    }

    private String openForPause() {
        ContinuationPoint point = vm.getPendingContinuationPoint();
        PendingContinuation continuation = engine.open(point.name(), Duration.ofMillis(point.timeoutMs()),
                Integer.toString(point.defaultFlowOffset()));
        pendingId = continuation.id();
        return pendingId;
    }

    private EvaluationStatus resume(Resolution resolution, double[] input, double[] output) {
        lastResolvedId = resolution.continuation().id();
        pendingId = null;
        if (resolution.extended()) {
            return vm.resumeWithExtension(resolution.extension(ExtensionModel.class), input, output);
        }
        return vm.resumeWithDefault(input, output);
    }
}
