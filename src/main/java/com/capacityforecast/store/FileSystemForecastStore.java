package com.capacityforecast.store;

import com.capacityforecast.exception.ForecastStoreException;
import com.capacityforecast.exception.InputException;
import com.capacityforecast.model.ForecastResult;
import com.capacityforecast.model.ForecastRun;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * JSON files under one directory per planning area. A configured latest-forecast directory
 * takes the place of the export directory for both reads and writes of the latest run.
 */
@Slf4j
@Component
public class FileSystemForecastStore implements ForecastStore {

    static final String STAGED_FILE = "staged_forecast.json";
    static final String LATEST_FILE = "latest_forecast.json";
    private static final Pattern AREA = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private final ObjectMapper objectMapper;
    private final Path stagingDirectory;
    private final Path exportDirectory;

    public FileSystemForecastStore(ObjectMapper objectMapper,
                                   @Value("${store.staging-dir:./forecast-data/staging}") String stagingDir,
                                   @Value("${store.export-dir:./forecast-data/exports}") String exportDir,
                                   @Value("${store.latest-forecast-dir:}") String latestForecastDir) {
        this.objectMapper = objectMapper;
        this.stagingDirectory = Paths.get(stagingDir);
        this.exportDirectory = Paths.get(latestForecastDir == null || latestForecastDir.isBlank() ? exportDir : latestForecastDir);
    }

    @Override
    public Optional<ForecastResult> loadStaged(String area) {
        return read(stagingDirectory.resolve(area(area)).resolve(STAGED_FILE), ForecastResult.class);
    }

    @Override
    public void saveStaged(String area, ForecastResult forecast) {
        Path target = write(stagingDirectory.resolve(area(area)).resolve(STAGED_FILE), forecast);
        log.info("Forecast staged | area={} | model={} | path={}", area, forecast.getModelId().key(), target);
    }

    @Override
    public Optional<ForecastRun> loadLatest(String area) {
        return read(exportDirectory.resolve(area(area)).resolve(LATEST_FILE), ForecastRun.class);
    }

    @Override
    public Path exportRun(String area, ForecastRun run) {
        Path target = write(exportDirectory.resolve(area(area)).resolve(LATEST_FILE), run);
        log.info("Forecast run exported | area={} | results={} | path={}", area, run.getResults().size(), target);
        return target;
    }

    @Override
    public Path exportDirectory() {
        return exportDirectory;
    }

    private <T> Optional<T> read(Path file, Class<T> type) {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), type));
        } catch (IOException ex) {
            throw new ForecastStoreException("Failed to read " + file, ex);
        }
    }

    private Path write(Path file, Object value) {
        try {
            Files.createDirectories(file.getParent());
            Path temp = Files.createTempFile(file.getParent(), file.getFileName().toString(), ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), value);
            return Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException ex) {
            throw new ForecastStoreException("Failed to write " + file, ex);
        }
    }

    private static String area(String area) {
        if (area == null || !AREA.matcher(area).matches()) {
            throw new InputException("Invalid planning area '" + area + "'");
        }
        return area;
    }
}
