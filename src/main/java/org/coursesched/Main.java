package org.coursesched;

import lombok.extern.slf4j.Slf4j;
import org.coursesched.export.CalendarExporter;
import org.coursesched.export.ScheduleJsonWriter;
import org.coursesched.export.SectionMetadataReader;
import org.coursesched.loaders.CatalogLoader;
import org.coursesched.loaders.ConfigLoader;

import java.nio.file.Path;

@Slf4j
public class Main {
    public static void main(String[] args) {
        final var config = ConfigLoader.loadConfig();
        log.info("Config loaded.");

        final var records = CatalogLoader.loadRecords(Path.of(config.catalogPath), config.catalogFileNameStart);
        log.info("Catalog loaded.");

        final var schedules = new ScheduleOptimizer().optimize(records, config.options);
        log.info("Schedule calculation complete, {} schedules selected.", schedules.size());

        ScheduleJsonWriter.write(schedules, Path.of(config.resultsPath));

        if (!config.calendarOutputPath.isEmpty() && !schedules.isEmpty()) {
            new CalendarExporter(config.timezone).export(
                    schedules,
                    Path.of(config.calendarOutputPath),
                    config.termStart,
                    config.termEnd,
                    SectionMetadataReader.read(records));
            log.info("Calendar export complete.");
        }
    }
}
