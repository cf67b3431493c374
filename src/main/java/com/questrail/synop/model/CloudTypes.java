package com.questrail.synop.model;

/**
 * Amount and types of low, middle and high cloud (8NhCLCMCH).
 */
public record CloudTypes(
    Observation<CloudCover> amount,
    Observation<Integer> lowCloudType,
    Observation<Integer> middleCloudType,
    Observation<Integer> highCloudType
) {
    /**
     * Which cloud level the reported amount refers to: low cloud when a low
     * cloud type is present, otherwise middle cloud.
     */
    public String amountLevel() {
        if (lowCloudType != null && lowCloudType.available() && lowCloudType.value() != 0) {
            return "low";
        }
        if (middleCloudType != null && middleCloudType.available()) {
            return "middle";
        }
        return "unknown";
    }
}
