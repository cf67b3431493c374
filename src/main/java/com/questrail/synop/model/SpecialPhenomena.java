package com.questrail.synop.model;

/**
 * SpecialPhenomena
 * -----------------------------------------------------------------------------
 * Values decoded from the 9SpSpspsp groups of section 3.
 *
 * <p>Each nested record corresponds to one group family, keyed by its
 * three-character prefix.</p>
 */
public final class SpecialPhenomena
{
    private SpecialPhenomena() {}

    /** 909Rtdc: time and character of precipitation. */
    public record PrecipitationTime(Observation<ValueRange> time, Observation<ValueRange> character) {}

    /**
     * 910ff / 911ff with optional 915dd.
     *
     * @param measurePeriodMinutes 10 for 910ff, {@code null} for 911ff
     * @param timeBeforeObs        period covered by 911ff, {@code null} for 910ff
     */
    public record HighestGust(
        Observation<Integer> speed,
        Observation<WindDirection> direction,
        Integer measurePeriodMinutes,
        Observation<TimeBeforeObservation> timeBeforeObs
    ) {}

    /** 924SV: state of the sea and visibility seawards. */
    public record SeaCondition(Observation<Integer> state, Observation<ValueRange> visibility) {}

    /** 927S6Tw: frozen deposit. */
    public record FrozenDeposit(Observation<Integer> deposit, Observation<Integer> variation) {}

    /** 928S7S'7: character and regularity of snow cover. */
    public record SnowCoverRegularity(Observation<Integer> cover, Observation<Integer> regularity) {}

    /** 929S8S'8: drift snow. */
    public record DriftSnow(Observation<Integer> phenomena, Observation<Integer> evolution) {}

    /** 931ss: depth of newly fallen snow. */
    public record SnowFall(Observation<Amount> amount, Observation<TimeBeforeObservation> timeBeforeObs) {}

    /** 933RR to 937RR: diameter of a deposit. */
    public record DepositDiameter(DepositType type, Observation<Amount> diameter) {}

    public enum DepositType
    {
        SOLID(3),
        GLAZE(4),
        RIME(5),
        COMPOUND(6),
        WET_SNOW(7);

        private final int code;

        DepositType(int code) {
            this.code = code;
        }

        public int code() {
            return code;
        }

        public static DepositType fromCode(int code) {
            for (DepositType type : values()) {
                if (type.code == code) {
                    return type;
                }
            }
            throw new IllegalArgumentException("No deposit type for code " + code);
        }
    }

    /** 940Cn3: evolution of clouds. */
    public record CloudEvolution(Observation<String> genus, Observation<Integer> evolution) {}

    /** 944CDp: location of maximum concentration of low cloud. */
    public record LowCloudConcentration(Observation<Integer> cloudType, Observation<CardinalDirection> direction) {}

    /** 950Nmn3: cloud conditions over mountains and passes. */
    public record MountainCondition(Observation<Integer> conditions, Observation<Integer> evolution) {}

    /** 951Nvn4: fog, mist or low cloud in valleys. */
    public record ValleyClouds(Observation<Integer> condition, Observation<Integer> evolution) {}

    /** 98DvVV: visibility towards a direction; direction 0 is towards the sea. */
    public record VisibilityDirection(Observation<String> direction, Observation<Visibility> visibility) {}

    /** 990Z0i0: optical phenomena. */
    public record OpticalPhenomena(Observation<String> phenomena, Observation<String> intensity) {}

    /** 991ADa: mirage. */
    public record Mirage(Observation<Integer> mirageType, Observation<CardinalDirection> direction) {}

    /** 992Nttw: condensation trails. */
    public record CondensationTrails(Observation<Integer> trail, Observation<Integer> time) {}

    /** 993CsDa: special clouds. */
    public record SpecialClouds(Observation<Integer> cloudType, Observation<CardinalDirection> direction) {}

    /** 994A3Da: day darkness. */
    public record DayDarkness(Observation<Integer> darkness, Observation<CardinalDirection> direction) {}
}
