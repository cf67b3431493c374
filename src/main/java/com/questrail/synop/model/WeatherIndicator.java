package com.questrail.synop.model;

/**
 * Station operation and weather group indicator (ix).
 */
public record WeatherIndicator(int code, boolean automatic)
{
    public static WeatherIndicator of(int code) {
        return new WeatherIndicator(code, code >= 4);
    }
}
