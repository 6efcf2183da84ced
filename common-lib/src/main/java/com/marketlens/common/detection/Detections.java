package com.marketlens.common.detection;

import java.util.List;

public final class Detections {

    private Detections() {}

    /**
     * Keeps the {@code cap} most recent entries of an oldest-first list, dropping the oldest.
     */
    public static <T extends Detection> List<T> keepMostRecent(List<T> detections, int cap) {
        if (detections.size() <= cap) {
            return List.copyOf(detections);
        }
        return List.copyOf(detections.subList(detections.size() - cap, detections.size()));
    }
}
