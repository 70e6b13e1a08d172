package com.eyelevel.mediadownloader.service.index;

import com.eyelevel.mediadownloader.model.MediaContainer;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Snapshot of the file names present in the output directory when a run starts.
 * <p>
 * Built once and never modified afterwards, so any number of workers may query it without
 * synchronization. Files written during the run are deliberately not reflected.
 */
@Slf4j
public final class ExistingOutputIndex {

    private static final List<String> OUTPUT_SUFFIXES = Arrays.stream(MediaContainer.values())
            .map(MediaContainer::suffix)
            .toList();

    private final Set<String> fileNames;

    private ExistingOutputIndex(Set<String> fileNames) {
        this.fileNames = Set.copyOf(fileNames);
    }

    /**
     * Indexes the regular files directly inside {@code directory}.
     *
     * @param directory The output directory.
     * @return the index; empty when the directory does not exist yet.
     * @throws IOException if the directory exists but cannot be listed.
     */
    public static ExistingOutputIndex build(Path directory) throws IOException {
        try (Stream<Path> entries = Files.list(directory)) {
            Set<String> names = entries.filter(Files::isRegularFile)
                    .map(path -> path.getFileName().toString())
                    .collect(Collectors.toSet());
            log.info("Indexed {} existing file(s) in {}", names.size(), directory);
            return new ExistingOutputIndex(names);
        } catch (NoSuchFileException e) {
            log.debug("Output directory {} does not exist yet; starting with an empty index.", directory);
            return empty();
        }
    }

    public static ExistingOutputIndex empty() {
        return new ExistingOutputIndex(Set.of());
    }

    /**
     * Checks whether output for {@code logicalName} is already present, under any container
     * extension this downloader can produce or under the bare name.
     */
    public boolean contains(String logicalName) {
        for (String suffix : OUTPUT_SUFFIXES) {
            if (fileNames.contains(logicalName + suffix)) {
                return true;
            }
        }
        return fileNames.contains(logicalName);
    }

    public int size() {
        return fileNames.size();
    }
}
