package com.scholary.songgen.output;

import com.scholary.songgen.config.GenerationProperties;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Finds the audio an inference run left behind.
 *
 * <p>The inference script is not consistent about where it writes, so discovery is tiered: the top
 * level of the output directory, then the configured nested directory, then a full recursive walk.
 * The first tier that yields anything wins. Only files with a configured audio extension count;
 * the genre and lyrics scratch files are never mistaken for output.
 */
@Component
public class OutputLocator {

  private static final Logger LOGGER = LoggerFactory.getLogger(OutputLocator.class);

  private final Set<String> audioExtensions;
  private final String nestedDir;

  @Autowired
  public OutputLocator(GenerationProperties properties) {
    this(properties.output().audioExtensions(), properties.output().nestedDir());
  }

  public OutputLocator(List<String> audioExtensions, String nestedDir) {
    this.audioExtensions =
        audioExtensions.stream()
            .map(ext -> ext.startsWith(".") ? ext.substring(1) : ext)
            .map(ext -> ext.toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
    this.nestedDir = nestedDir;
  }

  /**
   * Audio files under {@code outputDir}, sorted by path. Empty if the directory does not exist.
   *
   * @throws UncheckedIOException if the directory cannot be listed
   */
  public List<Path> findAudioArtifacts(Path outputDir) {
    if (!Files.isDirectory(outputDir)) {
      return List.of();
    }

    List<Path> topLevel = listAudio(outputDir, 1);
    if (!topLevel.isEmpty()) {
      return topLevel;
    }

    Path nested = outputDir.resolve(nestedDir);
    if (Files.isDirectory(nested)) {
      List<Path> nestedAudio = listAudio(nested, 1);
      if (!nestedAudio.isEmpty()) {
        LOGGER.debug("Found {} audio files in nested directory {}", nestedAudio.size(), nested);
        return nestedAudio;
      }
    }

    List<Path> anywhere = listAudio(outputDir, Integer.MAX_VALUE);
    if (!anywhere.isEmpty()) {
      LOGGER.debug("Found {} audio files by recursive search in {}", anywhere.size(), outputDir);
    }
    return anywhere;
  }

  /** Picks the largest file; ties go to the first path in sort order. */
  public Path selectPrimary(List<Path> audioFiles) {
    if (audioFiles.isEmpty()) {
      throw new IllegalArgumentException("No audio files to choose from");
    }
    return audioFiles.stream()
        .sorted()
        .max(Comparator.comparingLong(OutputLocator::sizeOf))
        .orElseThrow();
  }

  public boolean isAudio(Path file) {
    String name = file.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 && audioExtensions.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
  }

  private List<Path> listAudio(Path dir, int depth) {
    try (Stream<Path> files = Files.walk(dir, depth)) {
      return files.filter(Files::isRegularFile).filter(this::isAudio).sorted().toList();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to list output directory " + dir, e);
    }
  }

  private static long sizeOf(Path file) {
    try {
      return Files.size(file);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read size of " + file, e);
    }
  }
}
