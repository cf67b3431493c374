package com.questrail.synop.config;

import java.util.Map;
import java.util.Objects;

/**
 * StandardUnitConverter
 * -----------------------------------------------------------------------------
 * The default {@link UnitConverter}.
 *
 * <ul>
 *   <li>Temperature: {@code Cel}, {@code degF}, {@code K}</li>
 *   <li>Speed: {@code m/s}, {@code KT}, {@code km/h}</li>
 *   <li>Length: metric units by SI prefix ({@code mm}, {@code cm}, {@code m},
 *       {@code km}) and {@code ft}</li>
 *   <li>Pressure: metric units by SI prefix ({@code Pa}, {@code hPa},
 *       {@code kPa})</li>
 *   <li>Time: {@code s}, {@code min}, {@code h}, {@code day}</li>
 * </ul>
 *
 * Values are converted through the base unit of their dimension. Converting
 * between dimensions is rejected.
 */
public final class StandardUnitConverter implements UnitConverter
{
    public static final StandardUnitConverter INSTANCE = new StandardUnitConverter();

    private enum Dimension { LENGTH, PRESSURE, SPEED, TIME }

    private record Factor(Dimension dimension, double toBase) {}

    private static final Map<String, Factor> FACTORS = Map.ofEntries(
            Map.entry("mm", new Factor(Dimension.LENGTH, 0.001)),
            Map.entry("cm", new Factor(Dimension.LENGTH, 0.01)),
            Map.entry("dm", new Factor(Dimension.LENGTH, 0.1)),
            Map.entry("m", new Factor(Dimension.LENGTH, 1)),
            Map.entry("km", new Factor(Dimension.LENGTH, 1000)),
            Map.entry("ft", new Factor(Dimension.LENGTH, 0.3048)),
            Map.entry("gpm", new Factor(Dimension.LENGTH, 1)),
            Map.entry("Pa", new Factor(Dimension.PRESSURE, 1)),
            Map.entry("hPa", new Factor(Dimension.PRESSURE, 100)),
            Map.entry("kPa", new Factor(Dimension.PRESSURE, 1000)),
            Map.entry("m/s", new Factor(Dimension.SPEED, 1)),
            Map.entry("KT", new Factor(Dimension.SPEED, 0.514444)),
            Map.entry("km/h", new Factor(Dimension.SPEED, 1 / 3.6)),
            Map.entry("s", new Factor(Dimension.TIME, 1)),
            Map.entry("min", new Factor(Dimension.TIME, 60)),
            Map.entry("h", new Factor(Dimension.TIME, 3600)),
            Map.entry("day", new Factor(Dimension.TIME, 86400)));

    private StandardUnitConverter() {}

    @Override
    public double convert(double value, String fromUnit, String toUnit) {
        Objects.requireNonNull(fromUnit, "fromUnit");
        Objects.requireNonNull(toUnit, "toUnit");
        if (fromUnit.equals(toUnit)) {
            return value;
        }
        if (isTemperature(fromUnit) && isTemperature(toUnit)) {
            return fromKelvin(toKelvin(value, fromUnit), toUnit);
        }
        Factor from = FACTORS.get(fromUnit);
        Factor to = FACTORS.get(toUnit);
        if (from == null || to == null || from.dimension() != to.dimension()) {
            throw new IllegalArgumentException(
                    "Cannot convert " + value + " from " + fromUnit + " to " + toUnit);
        }
        return value * from.toBase() / to.toBase();
    }

    private static boolean isTemperature(String unit) {
        return unit.equals("Cel") || unit.equals("degF") || unit.equals("K");
    }

    private static double toKelvin(double value, String unit) {
        return switch (unit) {
            case "Cel" -> value + 273.15;
            case "degF" -> (value - 32) * 5 / 9 + 273.15;
            default -> value;
        };
    }

    private static double fromKelvin(double kelvin, String unit) {
        return switch (unit) {
            case "Cel" -> kelvin - 273.15;
            case "degF" -> (kelvin - 273.15) * 9 / 5 + 32;
            default -> kelvin;
        };
    }
}
