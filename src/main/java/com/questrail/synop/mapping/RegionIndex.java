package com.questrail.synop.mapping;

import com.questrail.synop.model.Region;

import java.util.List;
import java.util.Optional;

/**
 * RegionIndex
 * -----------------------------------------------------------------------------
 * Maps a five-digit land station index (IIiii) to its WMO Regional
 * Association.
 *
 * <p>Block numbers are not allocated to regions in contiguous runs, so the
 * mapping is a list of inclusive index ranges. Indexes outside every range
 * have no region.</p>
 */
public final class RegionIndex
{
    private record Span(int from, int to, Region region) {}

    private static final List<Span> SPANS = List.of(
        new Span(1, 19998, Region.VI),
        new Span(20000, 20099, Region.II),
        new Span(20100, 20199, Region.VI),
        new Span(20200, 21998, Region.II),
        new Span(22001, 22998, Region.VI),
        new Span(23001, 25998, Region.II),
        new Span(26001, 27998, Region.VI),
        new Span(28001, 32998, Region.II),
        new Span(33001, 34998, Region.VI),
        new Span(35001, 36998, Region.II),
        new Span(37001, 37998, Region.VI),
        new Span(38001, 39998, Region.II),
        new Span(40001, 40349, Region.VI),
        new Span(40350, 48599, Region.II),
        new Span(48600, 48799, Region.V),
        new Span(48800, 49998, Region.II),
        new Span(50001, 59998, Region.II),
        new Span(60000, 69998, Region.I),
        new Span(70001, 79998, Region.IV),
        new Span(80001, 88998, Region.III),
        new Span(89001, 89998, Region.ANTARCTIC),
        new Span(90001, 98998, Region.V)
    );

    private RegionIndex() {}

    public static Optional<Region> lookup(int stationIndex) {
        for (Span span : SPANS) {
            if (stationIndex >= span.from() && stationIndex <= span.to()) {
                return Optional.of(span.region());
            }
        }
        return Optional.empty();
    }
}
