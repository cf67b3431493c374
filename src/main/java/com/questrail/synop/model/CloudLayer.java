package com.questrail.synop.model;

/**
 * One individual cloud layer or mass (8NsChshs).
 */
public record CloudLayer(
    Observation<CloudCover> cover,
    Observation<String> genus,
    Observation<CloudHeight> height
) {
}
