package pl.marcinmilkowski.sense_shift.sampling;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pl.marcinmilkowski.sense_shift.corpus.CorpusSide;
import pl.marcinmilkowski.sense_shift.corpus.Document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PartitionInitializerTest {

    private static List<Document> documents(int count) {
        List<Document> docs = new ArrayList<>();
        for (int d = 0; d < count; d++) {
            int length = 5 + d % 17;
            int[] words = new int[length];
            for (int i = 0; i < length; i++) {
                words[i] = (d + i) % 11;
            }
            docs.add(new Document(d, words, d % 2 == 0 ? CorpusSide.REFERENCE : CorpusSide.FOCUS));
        }
        return docs;
    }

    private static List<String> partitions(List<Document> docs) {
        List<String> out = new ArrayList<>();
        for (Document doc : docs) {
            out.add(doc.partition().toString());
        }
        return out;
    }

    @Test
    @DisplayName("Every document is partitioned")
    void allDocumentsPartitioned() throws InterruptedException {
        List<Document> docs = documents(30);

        new PartitionInitializer(1.0, 42L, 1).initializeAll(docs);

        for (Document doc : docs) {
            doc.partition().validate(doc.length());
        }
    }

    @Test
    @DisplayName("Result does not depend on thread count or processing order")
    void independentOfThreadsAndOrder() throws InterruptedException {
        List<Document> sequential = documents(60);
        new PartitionInitializer(1.0, 42L, 1).initializeAll(sequential);

        List<Document> parallel = documents(60);
        new PartitionInitializer(1.0, 42L, 4).initializeAll(parallel);

        List<Document> shuffled = documents(60);
        List<Document> order = new ArrayList<>(shuffled);
        Collections.reverse(order);
        new PartitionInitializer(1.0, 42L, 1).initializeAll(order);

        assertEquals(partitions(sequential), partitions(parallel));
        assertEquals(partitions(sequential), partitions(shuffled));
    }

    @Test
    @DisplayName("Different run seeds give different partitions")
    void seedMatters() throws InterruptedException {
        List<Document> a = documents(40);
        List<Document> b = documents(40);

        new PartitionInitializer(1.0, 1L, 1).initializeAll(a);
        new PartitionInitializer(1.0, 2L, 1).initializeAll(b);

        assertNotEquals(partitions(a), partitions(b));
    }

    @Test
    @DisplayName("Per-document seeds are distinct")
    void documentSeeds() {
        assertNotEquals(PartitionInitializer.documentSeed(42L, 0), PartitionInitializer.documentSeed(42L, 1));
        assertNotEquals(PartitionInitializer.documentSeed(42L, 0), PartitionInitializer.documentSeed(43L, 0));
        assertEquals(PartitionInitializer.documentSeed(42L, 5), PartitionInitializer.documentSeed(42L, 5));
    }

    @Test
    @DisplayName("Failures in worker threads reach the caller")
    void workerFailurePropagates() throws InterruptedException {
        List<Document> docs = documents(10);
        new PartitionInitializer(1.0, 42L, 1).initialize(docs.get(3));

        assertThrows(IllegalStateException.class, () -> new PartitionInitializer(1.0, 42L, 3).initializeAll(docs));
    }
}
