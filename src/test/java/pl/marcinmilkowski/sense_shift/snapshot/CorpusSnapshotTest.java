package pl.marcinmilkowski.sense_shift.snapshot;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import pl.marcinmilkowski.sense_shift.config.SenseShiftConfig;
import pl.marcinmilkowski.sense_shift.corpus.Corpus;
import pl.marcinmilkowski.sense_shift.corpus.Document;
import pl.marcinmilkowski.sense_shift.sampling.PartitionInitializer;
import pl.marcinmilkowski.sense_shift.tagging.LuceneCorpusTokenizer;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class CorpusSnapshotTest {

    @TempDir
    Path tempDir;

    private Corpus corpus;

    @BeforeEach
    void setUp() throws Exception {
        SenseShiftConfig config = SenseShiftConfig.load(Paths.get("src/test/resources/test-config.json"));
        corpus = Corpus.load(config, new LuceneCorpusTokenizer(),
            Paths.get("src/test/resources/reference.txt"), Paths.get("src/test/resources/focus.txt"));
        new PartitionInitializer(config).initializeAll(corpus.documents());
    }

    @Test
    @DisplayName("Snapshots are numbered by the corpus save counter")
    void numberedSnapshots() throws IOException {
        CorpusSnapshotWriter writer = new CorpusSnapshotWriter(tempDir.resolve("snapshots"));

        Path first = writer.save(corpus);
        Path second = writer.save(corpus);

        assertEquals("corpus_1.json", first.getFileName().toString());
        assertEquals("corpus_2.json", second.getFileName().toString());
        assertEquals(2, corpus.saveCounter());
        assertFalse(Files.exists(tempDir.resolve("snapshots").resolve("corpus_2.json.tmp")));
    }

    @Test
    @DisplayName("Reading a snapshot restores the corpus")
    void readBack() throws IOException {
        Document first = corpus.documents().get(0);
        int[] senses = new int[first.partition().clusterCount()];
        for (int c = 0; c < senses.length; c++) {
            senses[c] = c + 3;
        }
        first.assignSenses(senses);

        Path file = new CorpusSnapshotWriter(tempDir).save(corpus);
        Corpus restored = CorpusSnapshotReader.read(file);

        assertEquals(corpus.config(), restored.config());
        assertEquals(corpus.weighting(), restored.weighting());
        assertEquals(1, restored.saveCounter());
        assertEquals(corpus.vocabulary().words(), restored.vocabulary().words());
        assertEquals(corpus.vocabulary().counts(), restored.vocabulary().counts());
        assertEquals(corpus.sentences(), restored.sentences());

        assertEquals(corpus.documents().size(), restored.documents().size());
        for (int d = 0; d < corpus.documents().size(); d++) {
            Document original = corpus.documents().get(d);
            Document copy = restored.documents().get(d);
            assertEquals(original.index(), copy.index());
            assertEquals(original.side(), copy.side());
            assertEquals(original.partition().toString(), copy.partition().toString());
            assertEquals(original.hasSenses(), copy.hasSenses());
        }
        assertArrayEquals(senses, restored.documents().get(0).senseMapping());

        assertEquals(corpus.associations().nonZeroCount(), restored.associations().nonZeroCount());
        corpus.associations().forEachNonZero(
            (i, j, v) -> assertEquals(v, restored.associations().get(i, j), 1e-12));
    }

    @Test
    @DisplayName("An existing snapshot is never overwritten")
    void noOverwrite() throws IOException {
        Path existing = tempDir.resolve(CorpusSnapshotWriter.fileName(1));
        Files.writeString(existing, "keep me");

        assertThrows(FileAlreadyExistsException.class, () -> new CorpusSnapshotWriter(tempDir).save(corpus));
        assertEquals("keep me", Files.readString(existing));
    }

    @Test
    @DisplayName("Foreign files and unknown versions are rejected")
    void rejectsUnsupported() throws IOException {
        JSONObject future = CorpusSnapshotWriter.toJson(corpus);
        future.put("version", CorpusSnapshotWriter.VERSION + 1);
        Path futureFile = tempDir.resolve("future.json");
        Files.writeString(futureFile, future.toJSONString());

        Path foreign = tempDir.resolve("foreign.json");
        Files.writeString(foreign, "{\"name\": \"something else\"}");

        IOException ex = assertThrows(IOException.class, () -> CorpusSnapshotReader.read(futureFile));
        assertTrue(ex.getMessage().contains("version"));
        assertThrows(IOException.class, () -> CorpusSnapshotReader.read(foreign));
        assertThrows(IOException.class, () -> CorpusSnapshotReader.read(tempDir.resolve("missing.json")));
    }

    @Test
    @DisplayName("A snapshot with a broken partition is rejected")
    void brokenPartition() throws IOException {
        JSONObject json = CorpusSnapshotWriter.toJson(corpus);
        JSONObject doc = json.getJSONArray("documents").getJSONObject(0);
        doc.getJSONArray("partition").getJSONArray(0).add(0);
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, json.toJSONString());

        assertThrows(IllegalStateException.class, () -> CorpusSnapshotReader.read(file));
    }

    @Test
    @DisplayName("A sense mapping that does not match the partition is rejected")
    void staleSenseMapping() throws IOException {
        JSONObject json = CorpusSnapshotWriter.toJson(corpus);
        JSONObject doc = json.getJSONArray("documents").getJSONObject(0);
        JSONArray senses = new JSONArray();
        for (int c = 0; c <= doc.getJSONArray("partition").size(); c++) {
            senses.add(0);
        }
        doc.put("senses", senses);
        Path file = tempDir.resolve("stale.json");
        Files.writeString(file, json.toJSONString());

        assertThrows(IllegalStateException.class, () -> CorpusSnapshotReader.read(file));
    }
}
