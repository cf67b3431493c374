package com.questrail.synop.internal.decode;

import com.questrail.synop.model.Observation;
import com.questrail.synop.model.SwellWaves;
import com.questrail.synop.model.WindDirection;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the swell groups of Section 2 (3dddd, 4PPHH, 5PPHH), which arrive
 * separately but describe at most two swell systems.
 */
final class SwellAccumulator
{
    private record WaveGroup(Observation<Integer> period, Observation<Double> height) {}

    @SuppressWarnings("unchecked")
    private final Observation<WindDirection>[] directions = new Observation[2];
    private final WaveGroup[] waves = new WaveGroup[2];
    private boolean directionGroup;

    void directions(Observation<WindDirection> first, Observation<WindDirection> second) {
        directions[0] = first;
        directions[1] = second;
        directionGroup = true;
    }

    void waves(int index, Observation<Integer> period, Observation<Double> height) {
        waves[index] = new WaveGroup(period, height);
    }

    /**
     * The swell systems in order. A trailing system with no wave group and no
     * known direction is dropped, except the first one when a 3dddd group was
     * present.
     */
    List<SwellWaves> build() {
        List<SwellWaves> swells = new ArrayList<>(2);
        for (int i = 0; i < 2; i++) {
            WaveGroup wave = waves[i];
            swells.add(new SwellWaves(
                    directions[i],
                    wave == null ? null : wave.period(),
                    wave == null ? null : wave.height()));
        }
        int keep = directionGroup ? 1 : 0;
        while (swells.size() > keep) {
            SwellWaves last = swells.get(swells.size() - 1);
            boolean knownDirection = last.direction() != null && last.direction().available();
            if (last.hasWaveGroup() || knownDirection) {
                break;
            }
            swells.remove(swells.size() - 1);
        }
        return swells;
    }
}
