package pl.marcinmilkowski.sense_shift.snapshot;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.sense_shift.config.AssociationWeighting;
import pl.marcinmilkowski.sense_shift.config.SenseShiftConfig;
import pl.marcinmilkowski.sense_shift.cooccurrence.AssociationMatrix;
import pl.marcinmilkowski.sense_shift.corpus.Corpus;
import pl.marcinmilkowski.sense_shift.corpus.CorpusSide;
import pl.marcinmilkowski.sense_shift.corpus.Document;
import pl.marcinmilkowski.sense_shift.corpus.Partition;
import pl.marcinmilkowski.sense_shift.corpus.Vocabulary;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Restores a corpus from a snapshot written by {@link CorpusSnapshotWriter}.
 */
public final class CorpusSnapshotReader {

    private static final Logger log = LoggerFactory.getLogger(CorpusSnapshotReader.class);

    private CorpusSnapshotReader() {
    }

    /**
     * @throws IOException if the file is missing or not a snapshot of a supported version
     * @throws IllegalStateException if the restored documents or partitions are inconsistent
     */
    public static Corpus read(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("Snapshot not found: " + file);
        }
        JSONObject root = JSON.parseObject(Files.readString(file, StandardCharsets.UTF_8));
        if (root == null || !CorpusSnapshotWriter.FORMAT.equals(root.getString("format"))) {
            throw new IOException("Not a corpus snapshot: " + file);
        }
        int version = root.getIntValue("version", -1);
        if (version != CorpusSnapshotWriter.VERSION) {
            throw new IOException("Unsupported snapshot version " + version + " in " + file
                + " (expected " + CorpusSnapshotWriter.VERSION + ")");
        }

        SenseShiftConfig config = SenseShiftConfig.fromJson(root.getJSONObject("config"));
        AssociationWeighting weighting = AssociationWeighting.parse(root.getString("weighting"));
        Vocabulary vocabulary = readVocabulary(root.getJSONObject("vocabulary"));

        JSONArray docsArray = root.getJSONArray("documents");
        List<Document> documents = new ArrayList<>(docsArray.size());
        for (int i = 0; i < docsArray.size(); i++) {
            documents.add(readDocument(docsArray.getJSONObject(i)));
        }

        AssociationMatrix matrix = readMatrix(root.getJSONObject("matrix"));
        Corpus corpus = new Corpus(config, vocabulary, documents, matrix, weighting,
            root.getIntValue("save_counter", 0));

        log.info("Snapshot read from {}: {}", file, corpus);
        return corpus;
    }

    private static Vocabulary readVocabulary(JSONObject obj) throws IOException {
        JSONArray words = obj.getJSONArray("words");
        JSONArray counts = obj.getJSONArray("counts");
        if (words.size() != counts.size()) {
            throw new IOException("Vocabulary has " + words.size() + " words but " + counts.size() + " counts");
        }
        LinkedHashMap<String, Long> wordCounts = new LinkedHashMap<>();
        for (int i = 0; i < words.size(); i++) {
            wordCounts.put(words.getString(i), counts.getLongValue(i));
        }
        return new Vocabulary(wordCounts);
    }

    private static Document readDocument(JSONObject obj) {
        Document doc = new Document(
            obj.getIntValue("index"),
            toIntArray(obj.getJSONArray("words")),
            CorpusSide.fromLabel(obj.getString("side")));

        Partition partition = doc.partition();
        JSONArray clusters = obj.getJSONArray("partition");
        for (int c = 0; c < clusters.size(); c++) {
            int[] members = toIntArray(clusters.getJSONArray(c));
            if (members.length == 0) {
                throw new IllegalStateException("Document " + doc.index() + " has an empty cluster " + c);
            }
            int index = partition.openCluster(members[0]);
            for (int m = 1; m < members.length; m++) {
                partition.add(index, members[m]);
            }
        }
        if (!partition.isEmpty()) {
            partition.validate(doc.length());
        }

        JSONArray senses = obj.getJSONArray("senses");
        if (senses != null) {
            doc.assignSenses(toIntArray(senses));
            doc.validateSenses();
        }
        return doc;
    }

    private static AssociationMatrix readMatrix(JSONObject obj) {
        AssociationMatrix.Builder builder = AssociationMatrix.builder(obj.getIntValue("size"));
        JSONArray rows = obj.getJSONArray("rows");
        for (int r = 0; r < rows.size(); r++) {
            JSONObject row = rows.getJSONObject(r);
            int index = row.getIntValue("row");
            JSONArray columns = row.getJSONArray("columns");
            JSONArray values = row.getJSONArray("values");
            for (int i = 0; i < columns.size(); i++) {
                builder.set(index, columns.getIntValue(i), values.getDoubleValue(i));
            }
        }
        return builder.build();
    }

    private static int[] toIntArray(JSONArray arr) {
        int[] out = new int[arr.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = arr.getIntValue(i);
        }
        return out;
    }
}
