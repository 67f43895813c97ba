package pl.marcinmilkowski.sense_shift.corpus;

import java.util.Arrays;

/**
 * One sentence of the reference or focus corpus as a sequence of word ids.
 *
 * The partition is filled once by the CRP initializer and afterwards changed only by the
 * sense sampler. The cluster-to-sense mapping stays unset until the sampler assigns it.
 */
public final class Document {

    private final int index;
    private final int[] words;
    private final CorpusSide side;
    private final Partition partition = new Partition();
    private int[] clusterToSense;

    public Document(int index, int[] words, CorpusSide side) {
        if (words.length == 0) {
            throw new IllegalArgumentException("Document " + index + " has no tokens");
        }
        this.index = index;
        this.words = words.clone();
        this.side = side;
    }

    public int index() {
        return index;
    }

    public int length() {
        return words.length;
    }

    /** Word id at a token position. */
    public int wordAt(int position) {
        return words[position];
    }

    public int[] words() {
        return words.clone();
    }

    public CorpusSide side() {
        return side;
    }

    public Partition partition() {
        return partition;
    }

    /**
     * Record the global sense of every local cluster. Called by the sense sampler.
     *
     * @param mapping sense id per cluster index
     */
    public void assignSenses(int[] mapping) {
        this.clusterToSense = mapping.clone();
    }

    public boolean hasSenses() {
        return clusterToSense != null;
    }

    /**
     * Global sense id of a local cluster.
     *
     * @throws IllegalStateException if the sampler has not assigned senses yet, or the cluster is unmapped
     */
    public int senseOf(int cluster) {
        if (clusterToSense == null) {
            throw new IllegalStateException("Document " + index + " has no sense assignment yet");
        }
        if (cluster < 0 || cluster >= clusterToSense.length) {
            throw new IllegalStateException("Document " + index + " has no sense for cluster " + cluster
                + " (" + clusterToSense.length + " mapped)");
        }
        return clusterToSense[cluster];
    }

    /**
     * The cluster-to-sense mapping as a copy.
     *
     * @throws IllegalStateException if the sampler has not assigned senses yet
     */
    public int[] senseMapping() {
        if (clusterToSense == null) {
            throw new IllegalStateException("Document " + index + " has no sense assignment yet");
        }
        return clusterToSense.clone();
    }

    /**
     * Check that the sense mapping covers exactly the current clusters.
     *
     * @throws IllegalStateException if no mapping is assigned, or it no longer matches the partition
     */
    public void validateSenses() {
        if (clusterToSense == null) {
            throw new IllegalStateException("Document " + index + " has no sense assignment yet");
        }
        if (clusterToSense.length != partition.clusterCount()) {
            throw new IllegalStateException("Document " + index + " maps " + clusterToSense.length
                + " clusters to senses but its partition has " + partition.clusterCount());
        }
    }

    @Override
    public String toString() {
        return String.format("Document[%d %s %s]", index, side.label(), Arrays.toString(words));
    }
}
