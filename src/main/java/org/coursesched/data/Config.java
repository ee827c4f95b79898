package org.coursesched.data;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import lombok.experimental.Accessors;

import java.time.LocalDate;

@Getter
@Setter
@AllArgsConstructor
@Accessors(chain = true)
@ToString
@SuppressWarnings("ClassCanBeRecord")
public class Config {
    public static final String CONFIG_FILE_NAME = "application.properties";
    public static final String CATALOG_PATH = "catalogPath";
    public static final String CATALOG_FILENAME_START = "catalogFileNameStart";
    public static final String RESULTS_PATH = "resultsPath";
    public static final String CALENDAR_OUTPUT_PATH = "calendarOutputPath";
    public static final String TERM_START = "termStart";
    public static final String TERM_END = "termEnd";
    public static final String TIMEZONE = "timezone";
    public static final String REQUIREMENT_NAMES = "requirementNames";
    public static final String REQUIREMENT_PREFIX = "requirements.";
    public static final String ELECTIVE_SUBJECT = "electiveSubject";
    public static final String MAX_SCHEDULES = "maxSchedules";
    public static final String MIN_SEATS_AVAILABLE = "minSeatsAvailable";
    public static final String INCLUDE_SUBJECTS = "includeSubjects";
    public static final String EXCLUDE_SUBJECTS = "excludeSubjects";
    public static final String MAX_FRONTIER_SIZE = "maxFrontierSize";
    public static final String SCORING_PREFIX = "scoring.";

    public static final String DEFAULT_CATALOG_PATH = "data";
    public static final String DEFAULT_CATALOG_FILENAME_START = "courses";
    public static final String DEFAULT_RESULTS_PATH = "courses_optimized.json";
    public static final String DEFAULT_TIMEZONE = "America/New_York";

    public final String catalogPath;
    public final String catalogFileNameStart;
    public final String resultsPath;
    /** Blank disables calendar export. */
    public final String calendarOutputPath;
    public final LocalDate termStart;
    public final LocalDate termEnd;
    public final String timezone;
    public final OptimizationOptions options;
}
