package org.coursesched.data;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import lombok.experimental.Accessors;

@Getter
@Setter
@ToString
@Accessors(chain = true)
public class ScoringWeights {
    public static final int EARLY_CLASS_THRESHOLD = 10 * 60;
    public static final int LATE_CLASS_THRESHOLD = 18 * 60;
    public static final double EARLY_LATE_PENALTY_PER_MINUTE = 0.2;
    public static final int ACTIVE_DAY_IDEAL_MIN = 3;
    public static final int ACTIVE_DAY_IDEAL_MAX = 4;
    public static final double ACTIVE_DAY_BONUS = 100;
    public static final double ACTIVE_DAY_PENALTY_PER_DAY = 50;
    public static final double DISTRIBUTION_WEIGHT = 20;
    public static final double IDLE_TIME_PENALTY = 0.05;
    public static final double SPAN_PENALTY = 0.05;

    private int earlyClassThreshold = EARLY_CLASS_THRESHOLD;
    private int lateClassThreshold = LATE_CLASS_THRESHOLD;
    private double earlyLatePenaltyPerMinute = EARLY_LATE_PENALTY_PER_MINUTE;
    private int activeDayIdealMin = ACTIVE_DAY_IDEAL_MIN;
    private int activeDayIdealMax = ACTIVE_DAY_IDEAL_MAX;
    private double activeDayBonus = ACTIVE_DAY_BONUS;
    private double activeDayPenaltyPerDay = ACTIVE_DAY_PENALTY_PER_DAY;
    private double distributionWeight = DISTRIBUTION_WEIGHT;
    private double idleTimePenalty = IDLE_TIME_PENALTY;
    private double spanPenalty = SPAN_PENALTY;

    public ScoringWeights copy() {
        return new ScoringWeights()
                .setEarlyClassThreshold(earlyClassThreshold)
                .setLateClassThreshold(lateClassThreshold)
                .setEarlyLatePenaltyPerMinute(earlyLatePenaltyPerMinute)
                .setActiveDayIdealMin(activeDayIdealMin)
                .setActiveDayIdealMax(activeDayIdealMax)
                .setActiveDayBonus(activeDayBonus)
                .setActiveDayPenaltyPerDay(activeDayPenaltyPerDay)
                .setDistributionWeight(distributionWeight)
                .setIdleTimePenalty(idleTimePenalty)
                .setSpanPenalty(spanPenalty);
    }
}
