// file: core/src/main/java/io/inksync/core/predict/PredictionAccuracy.java
package io.inksync.core.predict;

/**
 * @param evaluated predictions whose outcome was reported
 * @param correct   of those, how many actually turned into a conflict
 */
public record PredictionAccuracy(long evaluated, long correct) {

    public double rate() {
        return evaluated == 0 ? 0.0 : (double) correct / evaluated;
    }
}
