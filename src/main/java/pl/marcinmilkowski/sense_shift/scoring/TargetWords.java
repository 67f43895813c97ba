package pl.marcinmilkowski.sense_shift.scoring;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads target word lists: one word per line; blank lines and lines starting with '#' are ignored.
 * Anything after the first tab or space on a line is dropped.
 */
public final class TargetWords {

    private TargetWords() {
    }

    public static List<String> load(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("Target word file not found: " + file);
        }
        Set<String> words = new LinkedHashSet<>();
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            String[] parts = trimmed.split("[\\t ]", 2);
            words.add(parts[0]);
        }
        return new ArrayList<>(words);
    }
}
