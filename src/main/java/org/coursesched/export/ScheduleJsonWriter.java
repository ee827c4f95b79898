package org.coursesched.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.coursesched.data.ScheduleView;
import org.coursesched.exceptions.ScheduleExportException;
import org.coursesched.utils.FileUtils;

import java.nio.file.Path;
import java.util.Map;

@Slf4j
@UtilityClass
public class ScheduleJsonWriter {
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public static String toJson(Map<String, ScheduleView> schedules) {
        try {
            return MAPPER.writeValueAsString(schedules);
        } catch (Exception e) {
            throw new ScheduleExportException("Failed to serialize schedules.", e);
        }
    }

    public static void write(Map<String, ScheduleView> schedules, Path path) {
        try {
            FileUtils.ensureParentDirectory(path);
            MAPPER.writeValue(path.toFile(), schedules);
            log.info("Wrote {} schedules to {}", schedules.size(), path.toAbsolutePath());
        } catch (Exception e) {
            log.error("Failed to save schedules to " + path.toAbsolutePath(), e);
            throw new ScheduleExportException("Failed to save schedules to " + path.toAbsolutePath(), e);
        }
    }
}
