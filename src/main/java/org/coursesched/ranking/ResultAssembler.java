package org.coursesched.ranking;

import lombok.experimental.UtilityClass;
import org.coursesched.data.MeetingTime;
import org.coursesched.data.MeetingView;
import org.coursesched.data.ScheduleView;
import org.coursesched.data.ScoredSchedule;
import org.coursesched.data.Section;
import org.coursesched.data.SectionView;
import org.coursesched.utils.TimeUtils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@UtilityClass
public class ResultAssembler {
    public static final String LABEL_PREFIX = "Schedule ";

    /**
     * Labels ranked schedules {@code Schedule 1}, {@code Schedule 2}, ... in rank order.
     */
    public static Map<String, ScheduleView> assemble(List<ScoredSchedule> ranked) {
        final var result = new LinkedHashMap<String, ScheduleView>();
        var counter = 1;
        for (final var entry : ranked) {
            result.put(LABEL_PREFIX + counter++, toView(entry));
        }
        return result;
    }

    public static ScheduleView toView(ScoredSchedule scored) {
        return new ScheduleView(
                scored.getScore(),
                scored.getCandidate().getSections().stream().map(ResultAssembler::toView).toList());
    }

    private static SectionView toView(Section section) {
        return new SectionView(
                section.getCrn(),
                section.getCourse().getCode(),
                section.getCourse().getTitle(),
                section.getMeetingTimes().stream().map(ResultAssembler::toView).toList());
    }

    private static MeetingView toView(MeetingTime meetingTime) {
        return new MeetingView(
                meetingTime.getDay().getLongName(),
                TimeUtils.minutesToHhmm(meetingTime.getBeginTime()),
                TimeUtils.minutesToHhmm(meetingTime.getEndTime()));
    }
}
