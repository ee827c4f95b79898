package org.coursesched.data;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
@JsonPropertyOrder({"day_name", "begin", "end"})
@SuppressWarnings("ClassCanBeRecord")
public class MeetingView {
    @JsonProperty("day_name")
    private final String dayName;
    @JsonProperty("begin")
    private final String begin;
    @JsonProperty("end")
    private final String end;
}
