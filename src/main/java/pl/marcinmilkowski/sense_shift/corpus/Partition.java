package pl.marcinmilkowski.sense_shift.corpus;

import gnu.trove.list.array.TIntArrayList;

import java.util.ArrayList;
import java.util.List;

/**
 * Grouping of a document's token positions into clusters ("tables").
 *
 * Clusters keep creation order; members keep insertion order. The sense sampler mutates the
 * partition through {@link #add}, {@link #openCluster} and {@link #move}; {@link #validate}
 * checks that the clusters still cover every position exactly once.
 */
public final class Partition {

    private final List<TIntArrayList> clusters = new ArrayList<>();

    public int clusterCount() {
        return clusters.size();
    }

    public boolean isEmpty() {
        return clusters.isEmpty();
    }

    /**
     * Members of a cluster, as a copy.
     */
    public int[] cluster(int index) {
        return clusters.get(index).toArray();
    }

    public int clusterSize(int index) {
        return clusters.get(index).size();
    }

    /**
     * Open a new cluster holding one position.
     *
     * @return index of the new cluster
     */
    public int openCluster(int position) {
        TIntArrayList cluster = new TIntArrayList();
        cluster.add(position);
        clusters.add(cluster);
        return clusters.size() - 1;
    }

    public void add(int clusterIndex, int position) {
        clusters.get(clusterIndex).add(position);
    }

    /**
     * Index of the cluster holding a position, or -1.
     */
    public int clusterOf(int position) {
        for (int i = 0; i < clusters.size(); i++) {
            if (clusters.get(i).contains(position)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Move a position into another cluster, or into a new one when {@code target == clusterCount()}.
     * A cluster left empty is removed, shifting the indices of later clusters down by one.
     *
     * @return the index of the cluster now holding the position
     */
    public int move(int position, int target) {
        int source = clusterOf(position);
        if (source < 0) {
            throw new IllegalStateException("Position " + position + " is not in any cluster");
        }
        if (target < 0 || target > clusters.size()) {
            throw new IllegalArgumentException("Cluster index out of range: " + target);
        }
        if (source == target) {
            return target;
        }

        TIntArrayList from = clusters.get(source);
        from.remove(position);

        int result;
        if (target == clusters.size()) {
            clusters.add(new TIntArrayList(new int[] {position}));
            result = clusters.size() - 1;
        } else {
            clusters.get(target).add(position);
            result = target;
        }

        if (from.isEmpty()) {
            clusters.remove(source);
            if (result > source) {
                result--;
            }
        }
        return result;
    }

    /**
     * Check that the clusters are a true partition of {@code [0, length)}.
     *
     * @throws IllegalStateException on a missing, duplicated or out-of-range position, or an empty cluster
     */
    public void validate(int length) {
        boolean[] seen = new boolean[length];
        int covered = 0;
        for (int c = 0; c < clusters.size(); c++) {
            TIntArrayList cluster = clusters.get(c);
            if (cluster.isEmpty()) {
                throw new IllegalStateException("Cluster " + c + " is empty");
            }
            for (int i = 0; i < cluster.size(); i++) {
                int position = cluster.get(i);
                if (position < 0 || position >= length) {
                    throw new IllegalStateException("Cluster " + c + " holds position " + position
                        + " outside document of length " + length);
                }
                if (seen[position]) {
                    throw new IllegalStateException("Position " + position + " appears in more than one cluster");
                }
                seen[position] = true;
                covered++;
            }
        }
        if (covered != length) {
            throw new IllegalStateException("Partition covers " + covered + " of " + length + " positions");
        }
    }

    @Override
    public String toString() {
        return clusters.toString();
    }
}
