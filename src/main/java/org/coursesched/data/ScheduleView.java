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
@JsonPropertyOrder({"score", "sections"})
@SuppressWarnings("ClassCanBeRecord")
public class ScheduleView {
    @JsonProperty("score")
    private final double score;
    @JsonProperty("sections")
    private final List<SectionView> sections;
}
