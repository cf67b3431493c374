package com.questrail.synop.model;

/**
 * Cause of ice accretion on a ship (code table 1751).
 */
public record IceAccretionSource(boolean spray, boolean fog, boolean rain)
{
}
