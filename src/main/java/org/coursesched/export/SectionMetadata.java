package org.coursesched.export;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.time.LocalDate;

@Getter
@ToString
@RequiredArgsConstructor
@SuppressWarnings("ClassCanBeRecord")
public class SectionMetadata {
    private final String crn;
    private final LocalDate startDate;
    private final LocalDate endDate;
    private final String location;
}
