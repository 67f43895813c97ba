package pl.marcinmilkowski.sense_shift.snapshot;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.sense_shift.cooccurrence.AssociationMatrix;
import pl.marcinmilkowski.sense_shift.corpus.Corpus;
import pl.marcinmilkowski.sense_shift.corpus.Document;
import pl.marcinmilkowski.sense_shift.corpus.Partition;
import pl.marcinmilkowski.sense_shift.corpus.Vocabulary;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Locale;

/**
 * Writes numbered JSON snapshots of a corpus: {@code corpus_1.json}, {@code corpus_2.json}, ...
 *
 * A snapshot holds the configuration, vocabulary with counts, every document with its
 * partition and sense mapping (when assigned), and the association matrix. It is written to
 * a temporary file under an exclusive lock and then moved into place, so readers never see a
 * partial file and an existing snapshot is never overwritten.
 *
 * Layout:
 * {
 *   "format": "sense-shift-corpus",
 *   "version": 1,
 *   "save_counter": 3,
 *   "config": { ... },
 *   "weighting": "raw_count",
 *   "vocabulary": { "words": ["cat", ...], "counts": [2, ...] },
 *   "documents": [ { "index": 0, "side": "reference", "words": [0, 1],
 *                    "partition": [[0], [1]], "senses": [4, 0] }, ... ],
 *   "matrix": { "size": 5, "rows": [ { "row": 0, "columns": [1], "values": [2.0] }, ... ] }
 * }
 */
public final class CorpusSnapshotWriter {

    static final String FORMAT = "sense-shift-corpus";
    static final int VERSION = 1;

    private static final Logger log = LoggerFactory.getLogger(CorpusSnapshotWriter.class);

    private final Path outputDir;

    public CorpusSnapshotWriter(Path outputDir) {
        this.outputDir = outputDir;
    }

    public static String fileName(int saveNumber) {
        return String.format(Locale.ROOT, "corpus_%d.json", saveNumber);
    }

    /**
     * Advance the corpus save counter and write the next snapshot.
     *
     * @return path of the written snapshot
     * @throws IOException if the snapshot cannot be written or already exists
     */
    public Path save(Corpus corpus) throws IOException {
        Files.createDirectories(outputDir);
        int saveNumber = corpus.nextSaveNumber();
        Path target = outputDir.resolve(fileName(saveNumber));
        if (Files.exists(target)) {
            throw new FileAlreadyExistsException(target.toString(), null, "Snapshot already exists");
        }

        byte[] bytes = toJson(corpus).toJSONString().getBytes(StandardCharsets.UTF_8);
        Path tmp = outputDir.resolve(fileName(saveNumber) + ".tmp");

        try {
            try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                 FileLock lock = channel.lock()) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            if (Files.exists(target)) {
                throw new FileAlreadyExistsException(target.toString(), null, "Snapshot appeared while writing");
            }
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            Files.deleteIfExists(tmp);
            throw e;
        }

        log.info("Snapshot {} written: {} ({} bytes)", saveNumber, target, bytes.length);
        return target;
    }

    static JSONObject toJson(Corpus corpus) {
        JSONObject root = new JSONObject();
        root.put("format", FORMAT);
        root.put("version", VERSION);
        root.put("save_counter", corpus.saveCounter());
        root.put("config", corpus.config().toJson());
        root.put("weighting", corpus.weighting().name().toLowerCase(Locale.ROOT));

        Vocabulary vocabulary = corpus.vocabulary();
        JSONObject vocab = new JSONObject();
        JSONArray words = new JSONArray();
        JSONArray counts = new JSONArray();
        for (String word : vocabulary.words()) {
            words.add(word);
            counts.add(vocabulary.count(word));
        }
        vocab.put("words", words);
        vocab.put("counts", counts);
        root.put("vocabulary", vocab);

        JSONArray documents = new JSONArray();
        for (Document doc : corpus.documents()) {
            documents.add(documentJson(doc));
        }
        root.put("documents", documents);

        root.put("matrix", matrixJson(corpus.associations()));
        return root;
    }

    private static JSONObject documentJson(Document doc) {
        JSONObject obj = new JSONObject();
        obj.put("index", doc.index());
        obj.put("side", doc.side().label());
        obj.put("words", intArray(doc.words()));

        Partition partition = doc.partition();
        JSONArray clusters = new JSONArray();
        for (int c = 0; c < partition.clusterCount(); c++) {
            clusters.add(intArray(partition.cluster(c)));
        }
        obj.put("partition", clusters);

        if (doc.hasSenses()) {
            obj.put("senses", intArray(doc.senseMapping()));
        }
        return obj;
    }

    private static JSONObject matrixJson(AssociationMatrix matrix) {
        JSONObject obj = new JSONObject();
        obj.put("size", matrix.size());
        JSONArray rows = new JSONArray();
        for (int r = 0; r < matrix.size(); r++) {
            AssociationMatrix.Row row = matrix.row(r);
            if (row.size() == 0) {
                continue;
            }
            JSONArray columns = new JSONArray();
            JSONArray values = new JSONArray();
            for (int i = 0; i < row.size(); i++) {
                columns.add(row.column(i));
                values.add(row.value(i));
            }
            JSONObject rowObj = new JSONObject();
            rowObj.put("row", r);
            rowObj.put("columns", columns);
            rowObj.put("values", values);
            rows.add(rowObj);
        }
        obj.put("rows", rows);
        return obj;
    }

    private static JSONArray intArray(int[] values) {
        JSONArray arr = new JSONArray(values.length);
        for (int v : values) {
            arr.add(v);
        }
        return arr;
    }
}
