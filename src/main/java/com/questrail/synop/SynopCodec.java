package com.questrail.synop;

import com.questrail.synop.codec.SynopDecoder;
import com.questrail.synop.codec.SynopEncoder;
import com.questrail.synop.codec.impl.DefaultSynopDecoder;
import com.questrail.synop.codec.impl.DefaultSynopEncoder;
import com.questrail.synop.config.SynopCodecConfig;
import com.questrail.synop.json.SynopJsonWriter;
import com.questrail.synop.model.SynopReport;

import java.time.Clock;
import java.util.Objects;

/**
 * SynopCodec
 * =============================================================================
 * Entry point for decoding and encoding SYNOP telegrams.
 *
 * <pre>
 *   SynopCodec codec = SynopCodec.create();
 *   SynopReport report = codec.decode("AAXX 01004 88889 12782 61506 10094");
 *   String telegram = codec.encode(report);
 * </pre>
 *
 * <p>A codec is immutable and may be shared between threads. All per-telegram
 * state lives inside a single {@link #decode} or {@link #encode} call.</p>
 */
public final class SynopCodec
{
    private final SynopDecoder decoder;
    private final SynopEncoder encoder;
    private final SynopJsonWriter jsonWriter = new SynopJsonWriter();

    private SynopCodec(SynopDecoder decoder, SynopEncoder encoder) {
        this.decoder = decoder;
        this.encoder = encoder;
    }

    public static SynopCodec create() {
        return create(SynopCodecConfig.defaults());
    }

    public static SynopCodec create(SynopCodecConfig config) {
        return create(config, Clock.systemUTC());
    }

    public static SynopCodec create(SynopCodecConfig config, Clock clock) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(clock, "clock");
        return new SynopCodec(new DefaultSynopDecoder(config, clock), new DefaultSynopEncoder(config, clock));
    }

    /**
     * @see SynopDecoder#decode(String)
     */
    public SynopReport decode(String telegram) {
        return decoder.decode(telegram);
    }

    /**
     * @see SynopEncoder#encode(SynopReport)
     */
    public String encode(SynopReport report) {
        return encoder.encode(report);
    }

    /**
     * Renders a report as compact JSON.
     */
    public String toJson(SynopReport report) {
        return jsonWriter.write(report);
    }
}
