package com.gt.vsrs.scheduling;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "vsrs.scheduling")
public record SchedulingProps(
        @DefaultValue("2.5") double initialEase,
        @DefaultValue("1.3") double easeFloor,
        @DefaultValue("3.5") double easeCeiling,
        @DefaultValue("0.2") double lapsePenalty,
        @DefaultValue("-0.15") double hardEaseDelta,
        @DefaultValue("0.15") double easyEaseDelta,
        @DefaultValue("10") int relapseIntervalMinutes,
        @DefaultValue("1") double firstSeedDays,
        @DefaultValue("4") double easySeedDays,
        @DefaultValue("6") double secondSeedDays,
        @DefaultValue("1.2") double hardMultiplier,
        @DefaultValue("1.3") double easyBonus,
        @DefaultValue("36500") double maxIntervalDays
) {
    public static final SchedulingProps DEFAULTS = new SchedulingProps(2.5, 1.3, 3.5, 0.2, -0.15, 0.15, 10, 1, 4, 6, 1.2, 1.3, 36500);
}
