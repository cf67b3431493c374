package com.questrail.synop.model;

/**
 * Character and time of precipitation reported by Region I stations (0TgTgRcRt).
 */
public record LocalPrecipitation(Observation<Integer> character, Observation<Integer> time)
{
}
