package com.questrail.synop.model;

/**
 * Present and past weather (7wwW1W2).
 *
 * @param present        present weather (code table 4677)
 * @param past1          first past weather (code table 4561)
 * @param past2          second past weather (code table 4561)
 * @param timeBeforeObs  period covered by past weather
 */
public record Weather(
    Observation<Integer> present,
    Observation<Integer> past1,
    Observation<Integer> past2,
    TimeBeforeObservation timeBeforeObs
) {
}
