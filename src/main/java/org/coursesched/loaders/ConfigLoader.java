package org.coursesched.loaders;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.coursesched.Main;
import org.coursesched.data.Config;
import org.coursesched.data.OptimizationOptions;
import org.coursesched.data.ScoringWeights;
import org.coursesched.exceptions.ConfigLoadException;
import org.coursesched.utils.TimeUtils;

import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

import static org.coursesched.data.Config.*;

@Slf4j
@UtilityClass
public class ConfigLoader {
    private static final String GROUP_SEPARATOR = "\\|";
    private static final String LIST_SEPARATOR = ",";

    public static Config loadConfig() {
        final var currentFolder = getCurrentFolder();
        if (currentFolder != null) {
            final var config = loadPropsFromCurrentDirectory(currentFolder);
            if (config != null) return config;
        }

        return loadPropsFromClasspath(CONFIG_FILE_NAME);
    }

    static Config loadPropsFromClasspath(String resourceName) {
        final var loader = Thread.currentThread().getContextClassLoader();
        final var resourceStream = loader.getResourceAsStream(resourceName);
        if (resourceStream == null) throw new ConfigLoadException(resourceName + " not found on classpath.");
        try (resourceStream) {
            final var props = new Properties();
            props.load(resourceStream);
            return getConfig(props);
        } catch (ConfigLoadException e) {
            log.error("Failed to load config.", e);
            throw e;
        } catch (Exception e) {
            log.error("Failed to load config.", e);
            throw new ConfigLoadException("Failed to load config.", e);
        }
    }

    private static Config loadPropsFromCurrentDirectory(Path currentFolder) {
        final var configPath = currentFolder.resolve(CONFIG_FILE_NAME);
        log.info("Application properties path: " + configPath);
        if (configPath.toFile().isFile()) {
            try (final var propsReader = Files.newBufferedReader(configPath)) {
                final var props = new Properties();
                props.load(propsReader);
                return getConfig(props);
            } catch (Exception ex) {
                log.warn("Failed to read application.properties from current directory, will try to use inner.", ex);
            }
        }
        return null;
    }

    private static Path getCurrentFolder() {
        final var mainClass = Main.class;
        final var classResource = mainClass.getResource(mainClass.getSimpleName() + ".class");
        if (classResource == null) throw new ConfigLoadException("class resource is null");

        final var url = classResource.toString();
        if (url.startsWith("jar:file:")) {
            final var path = url.replaceAll("^jar:(file:.*[.]jar)!/.*", "$1");
            try {
                return Paths.get(new URL(path).toURI()).getParent();
            } catch (Exception e) {
                throw new ConfigLoadException("Invalid Jar File URL String", e);
            }
        }
        return null;
    }

    public static Config getConfig(Properties props) {
        try {
            return new Config(
                    props.getProperty(CATALOG_PATH, DEFAULT_CATALOG_PATH),
                    props.getProperty(CATALOG_FILENAME_START, DEFAULT_CATALOG_FILENAME_START),
                    props.getProperty(RESULTS_PATH, DEFAULT_RESULTS_PATH),
                    props.getProperty(CALENDAR_OUTPUT_PATH, "").trim(),
                    getDate(props, TERM_START),
                    getDate(props, TERM_END),
                    props.getProperty(TIMEZONE, DEFAULT_TIMEZONE).trim(),
                    getOptions(props));
        } catch (RuntimeException e) {
            throw new ConfigLoadException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    static OptimizationOptions getOptions(Properties props) {
        final var options = new OptimizationOptions();
        final var requirementNames = getList(props, REQUIREMENT_NAMES);
        if (!requirementNames.isEmpty()) {
            options.setRequirementsSpec(getRequirementsSpec(props, requirementNames));
        }
        return options
                .setElectiveSubject(props.getProperty(ELECTIVE_SUBJECT, OptimizationOptions.DEFAULT_ELECTIVE_SUBJECT).trim())
                .setMaxSchedules(getInt(props, MAX_SCHEDULES, OptimizationOptions.DEFAULT_MAX_SCHEDULES))
                .setMinSeatsAvailable(getInt(props, MIN_SEATS_AVAILABLE, OptimizationOptions.DEFAULT_MIN_SEATS_AVAILABLE))
                .setIncludeSubjects(Set.copyOf(getList(props, INCLUDE_SUBJECTS)))
                .setExcludeSubjects(Set.copyOf(getList(props, EXCLUDE_SUBJECTS)))
                .setMaxFrontierSize(getInt(props, MAX_FRONTIER_SIZE, 0))
                .setScoring(getScoringWeights(props));
    }

    private static Map<String, List<List<String>>> getRequirementsSpec(Properties props, List<String> requirementNames) {
        final var spec = new LinkedHashMap<String, List<List<String>>>();
        for (final var name : requirementNames) {
            final var value = props.getProperty(REQUIREMENT_PREFIX + name);
            if (value == null || value.isBlank()) {
                throw new ConfigLoadException("Requirement " + name + " has no groups configured.");
            }
            final var groups = new ArrayList<List<String>>();
            for (final var group : value.split(GROUP_SEPARATOR)) {
                final var codes = splitList(group);
                if (!codes.isEmpty()) groups.add(codes);
            }
            spec.put(name, groups);
        }
        return spec;
    }

    private static ScoringWeights getScoringWeights(Properties props) {
        return new ScoringWeights()
                .setEarlyClassThreshold(getTime(props, SCORING_PREFIX + "earlyClassThreshold", ScoringWeights.EARLY_CLASS_THRESHOLD))
                .setLateClassThreshold(getTime(props, SCORING_PREFIX + "lateClassThreshold", ScoringWeights.LATE_CLASS_THRESHOLD))
                .setEarlyLatePenaltyPerMinute(getDouble(props, SCORING_PREFIX + "earlyLatePenaltyPerMinute", ScoringWeights.EARLY_LATE_PENALTY_PER_MINUTE))
                .setActiveDayIdealMin(getInt(props, SCORING_PREFIX + "activeDayIdealMin", ScoringWeights.ACTIVE_DAY_IDEAL_MIN))
                .setActiveDayIdealMax(getInt(props, SCORING_PREFIX + "activeDayIdealMax", ScoringWeights.ACTIVE_DAY_IDEAL_MAX))
                .setActiveDayBonus(getDouble(props, SCORING_PREFIX + "activeDayBonus", ScoringWeights.ACTIVE_DAY_BONUS))
                .setActiveDayPenaltyPerDay(getDouble(props, SCORING_PREFIX + "activeDayPenaltyPerDay", ScoringWeights.ACTIVE_DAY_PENALTY_PER_DAY))
                .setDistributionWeight(getDouble(props, SCORING_PREFIX + "distributionWeight", ScoringWeights.DISTRIBUTION_WEIGHT))
                .setIdleTimePenalty(getDouble(props, SCORING_PREFIX + "idleTimePenalty", ScoringWeights.IDLE_TIME_PENALTY))
                .setSpanPenalty(getDouble(props, SCORING_PREFIX + "spanPenalty", ScoringWeights.SPAN_PENALTY));
    }

    private static String getValue(Properties props, String key) {
        final var value = props.getProperty(key);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static int getInt(Properties props, String key, int defaultValue) {
        final var value = getValue(props, key);
        return value == null ? defaultValue : Integer.parseInt(value);
    }

    private static double getDouble(Properties props, String key, double defaultValue) {
        final var value = getValue(props, key);
        return value == null ? defaultValue : Double.parseDouble(value);
    }

    private static int getTime(Properties props, String key, int defaultValue) {
        final var value = getValue(props, key);
        return value == null ? defaultValue : TimeUtils.hhmmToMinutes(value);
    }

    private static LocalDate getDate(Properties props, String key) {
        final var value = getValue(props, key);
        return value == null ? null : LocalDate.parse(value);
    }

    private static List<String> getList(Properties props, String key) {
        final var value = getValue(props, key);
        return value == null ? List.of() : splitList(value);
    }

    private static List<String> splitList(String value) {
        return Arrays.stream(value.split(LIST_SEPARATOR))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
