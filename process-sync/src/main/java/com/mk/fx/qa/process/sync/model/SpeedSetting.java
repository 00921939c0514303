package com.mk.fx.qa.process.sync.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/** The fixed set of worker speed multipliers offered to the observer. */
public enum SpeedSetting {
  X0_1(0.1, "0.1x"),
  X0_25(0.25, "0.25x"),
  X0_5(0.5, "0.5x"),
  X1(1.0, "1x"),
  X2(2.0, "2x"),
  X5(5.0, "5x"),
  X10(10.0, "10x");

  private final double multiplier;
  private final String label;

  SpeedSetting(double multiplier, String label) {
    this.multiplier = multiplier;
    this.label = label;
  }

  public double multiplier() {
    return multiplier;
  }

  @JsonValue
  public String label() {
    return label;
  }

  /**
   * Parses a speed given as a label ({@code "2x"}), a bare multiplier ({@code "2"}, {@code
   * "0.25"}) or an enum name ({@code "X2"}).
   *
   * @throws IllegalArgumentException if the value is not one of the offered speeds
   */
  @JsonCreator
  public static SpeedSetting fromValue(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Speed must not be blank. Allowed: " + labels());
    }
    String trimmed = value.trim();
    for (SpeedSetting setting : values()) {
      if (setting.label.equalsIgnoreCase(trimmed) || setting.name().equalsIgnoreCase(trimmed)) {
        return setting;
      }
    }
    String numeric =
        trimmed.toLowerCase(Locale.ROOT).endsWith("x")
            ? trimmed.substring(0, trimmed.length() - 1)
            : trimmed;
    try {
      return fromMultiplier(Double.parseDouble(numeric));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(
          "Unsupported speed: " + value + ". Allowed: " + labels(), ex);
    }
  }

  public static SpeedSetting fromMultiplier(double multiplier) {
    return Arrays.stream(values())
        .filter(setting -> Double.compare(setting.multiplier, multiplier) == 0)
        .findFirst()
        .orElseThrow(
            () ->
                new IllegalArgumentException(
                    "Unsupported speed: " + multiplier + ". Allowed: " + labels()));
  }

  public static List<String> labels() {
    return Arrays.stream(values()).map(SpeedSetting::label).toList();
  }
}
