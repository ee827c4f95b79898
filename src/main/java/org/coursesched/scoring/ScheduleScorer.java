package org.coursesched.scoring;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.coursesched.data.MeetingTime;
import org.coursesched.data.ScheduleCandidate;
import org.coursesched.data.ScoringWeights;
import org.coursesched.data.Weekday;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RequiredArgsConstructor
public class ScheduleScorer {
    private final ScoringWeights weights;
    private final List<PenaltyHook> penalties;

    public ScheduleScorer(ScoringWeights weights) {
        this(weights, List.of());
    }

    public double score(ScheduleCandidate candidate) {
        if (candidate.isEmpty()) return Double.NEGATIVE_INFINITY;

        var score = 0.0;
        final var days = new EnumMap<Weekday, List<MeetingTime>>(Weekday.class);

        for (final var meeting : candidate.getMeetingTimes()) {
            days.computeIfAbsent(meeting.getDay(), d -> new ArrayList<>()).add(meeting);
            if (meeting.getBeginTime() < weights.getEarlyClassThreshold()) {
                score -= (weights.getEarlyClassThreshold() - meeting.getBeginTime()) * weights.getEarlyLatePenaltyPerMinute();
            }
            if (meeting.getEndTime() > weights.getLateClassThreshold()) {
                score -= (meeting.getEndTime() - weights.getLateClassThreshold()) * weights.getEarlyLatePenaltyPerMinute();
            }
        }

        score += activeDayScore(days.size());

        if (days.size() > 1) {
            score -= sampleStandardDeviation(days) * weights.getDistributionWeight();
        }

        var spanSum = 0.0;
        for (final var dayMeetings : days.values()) {
            final var span = span(dayMeetings);
            final var busy = dayMeetings.stream().mapToInt(MeetingTime::getDurationMinutes).sum();
            score -= (span - busy) * weights.getIdleTimePenalty();
            spanSum += span;
        }
        if (!days.isEmpty()) {
            score -= spanSum / days.size() * weights.getSpanPenalty();
        }

        score = applyPenalties(candidate, score);

        return round(score);
    }

    private double activeDayScore(int activeDays) {
        if (activeDays >= weights.getActiveDayIdealMin() && activeDays <= weights.getActiveDayIdealMax()) {
            return weights.getActiveDayBonus();
        }
        return -Math.abs(activeDays - weights.getActiveDayIdealMax()) * weights.getActiveDayPenaltyPerDay();
    }

    private double applyPenalties(ScheduleCandidate candidate, double score) {
        var total = score;
        for (final var penalty : penalties) {
            try {
                final var value = penalty.apply(candidate);
                if (Double.isFinite(value) && Double.isFinite(total + value)) {
                    total += value;
                } else {
                    log.warn("Penalty hook {} returned {}; ignoring.", penalty, value);
                }
            } catch (RuntimeException e) {
                log.error("Penalty hook " + penalty + " failed; ignoring.", e);
            }
        }
        return total;
    }

    private static int span(List<MeetingTime> dayMeetings) {
        var start = Integer.MAX_VALUE;
        var end = Integer.MIN_VALUE;
        for (final var meeting : dayMeetings) {
            start = Math.min(start, meeting.getBeginTime());
            end = Math.max(end, meeting.getEndTime());
        }
        return end - start;
    }

    private static double sampleStandardDeviation(Map<Weekday, List<MeetingTime>> days) {
        final var counts = days.values().stream().mapToInt(List::size).toArray();
        var mean = 0.0;
        for (final var count : counts) mean += count;
        mean /= counts.length;
        var squares = 0.0;
        for (final var count : counts) squares += (count - mean) * (count - mean);
        return Math.sqrt(squares / (counts.length - 1));
    }

    static double round(double score) {
        if (!Double.isFinite(score)) return score;
        return new BigDecimal(score).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
    }
}
