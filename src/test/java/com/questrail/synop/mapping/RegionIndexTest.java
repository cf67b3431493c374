package com.questrail.synop.mapping;

import com.questrail.synop.model.Region;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class RegionIndexTest
{
    @Test
    void stationIndexesMapToTheirRegion()
    {
        assertEquals(Region.VI, RegionIndex.lookup(3772).orElseThrow());
        assertEquals(Region.I, RegionIndex.lookup(67005).orElseThrow());
        assertEquals(Region.II, RegionIndex.lookup(47662).orElseThrow());
        assertEquals(Region.III, RegionIndex.lookup(88889).orElseThrow());
        assertEquals(Region.IV, RegionIndex.lookup(72503).orElseThrow());
        assertEquals(Region.V, RegionIndex.lookup(94767).orElseThrow());
        assertEquals(Region.ANTARCTIC, RegionIndex.lookup(89646).orElseThrow());
    }

    @Test
    void blocksAreNotContiguous()
    {
        assertEquals(Region.VI, RegionIndex.lookup(20150).orElseThrow());
        assertEquals(Region.II, RegionIndex.lookup(20250).orElseThrow());
        assertEquals(Region.V, RegionIndex.lookup(48650).orElseThrow());
        assertEquals(Region.II, RegionIndex.lookup(48900).orElseThrow());
    }

    @Test
    void unallocatedIndexesHaveNoRegion()
    {
        assertTrue(RegionIndex.lookup(0).isEmpty());
        assertTrue(RegionIndex.lookup(19999).isEmpty());
        assertTrue(RegionIndex.lookup(99999).isEmpty());
    }
}
