package com.phillippitts.phiredaction.service.detect.slow;

import com.phillippitts.phiredaction.exception.DetectorUnavailableException;

import java.util.List;

/**
 * Contract for contextual PHI models used by the slow lane.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>Model is constructed with configuration</li>
 *   <li>{@link #initialize()} loads resources (may throw {@link DetectorUnavailableException})</li>
 *   <li>{@link #annotate(String)} labels spans of a whole buffer</li>
 *   <li>{@link #close()} releases resources; {@link #initialize()} may be called again afterwards
 *       by the watchdog to restart the model</li>
 * </ol>
 *
 * <p>Thread Safety: implementations must support concurrent {@code annotate} calls from different
 * sessions. Long-running implementations should honour thread interruption, which is how an
 * abandoned pass is cancelled.
 */
public interface ContextModel extends AutoCloseable {

    /**
     * Loads the model.
     *
     * @throws DetectorUnavailableException if the model cannot be loaded
     */
    void initialize();

    /**
     * Annotates PHI-like spans in {@code text}.
     *
     * @param text full buffer text
     * @return annotations with offsets into {@code text}
     * @throws DetectorUnavailableException if the model is not initialized or has failed
     */
    List<ModelAnnotation> annotate(String text);

    /**
     * Returns the name of this model for logging, events and the watchdog.
     */
    String getModelName();

    /**
     * Checks if the model is loaded and usable.
     */
    boolean isHealthy();

    @Override
    void close();
}
