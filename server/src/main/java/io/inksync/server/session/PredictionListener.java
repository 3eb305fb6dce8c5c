// file: server/src/main/java/io/inksync/server/session/PredictionListener.java
package io.inksync.server.session;

import io.inksync.core.predict.Prediction;

import java.util.List;

/**
 * Receives the predictions computed for a whiteboard on each prediction tick.
 * Called from the prediction scheduler thread; must not block.
 */
@FunctionalInterface
public interface PredictionListener {

    void onPredictions(String whiteboardId, List<Prediction> predictions);
}
