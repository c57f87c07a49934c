package com.jasmin.trafficinsights.detectors;

import java.util.List;

/**
 * Scans all records of one site at once and reports the ones that stand out.
 *
 * @param <T> record type
 * @param <R> result type
 */
public interface Detector<T, R> {
    R detect(List<T> records);
}
