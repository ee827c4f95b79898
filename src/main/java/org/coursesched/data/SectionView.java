package org.coursesched.data;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.util.List;

@Getter
@ToString
@RequiredArgsConstructor
@JsonPropertyOrder({"id", "course_code", "title", "meetings"})
@SuppressWarnings("ClassCanBeRecord")
public class SectionView {
    @JsonProperty("id")
    private final String id;
    @JsonProperty("course_code")
    private final String courseCode;
    @JsonProperty("title")
    private final String title;
    @JsonProperty("meetings")
    private final List<MeetingView> meetings;
}
