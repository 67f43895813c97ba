package pl.marcinmilkowski.sense_shift.cooccurrence;

import gnu.trove.map.hash.TLongDoubleHashMap;

import java.util.Arrays;

/**
 * Immutable sparse square matrix over word ids, stored as compressed rows with sorted columns.
 *
 * Only non-zero cells are kept. Rows are addressed by the context word, columns by the center word.
 */
public final class AssociationMatrix {

    private final int size;
    private final int[] rowStart;
    private final int[] columns;
    private final double[] values;

    private AssociationMatrix(int size, int[] rowStart, int[] columns, double[] values) {
        this.size = size;
        this.rowStart = rowStart;
        this.columns = columns;
        this.values = values;
    }

    public static Builder builder(int size) {
        return new Builder(size);
    }

    /** Number of rows (and columns). */
    public int size() {
        return size;
    }

    public int nonZeroCount() {
        return values.length;
    }

    public double get(int row, int column) {
        checkIndex(row);
        checkIndex(column);
        int from = rowStart[row];
        int to = rowStart[row + 1];
        int pos = Arrays.binarySearch(columns, from, to, column);
        return pos >= 0 ? values[pos] : 0.0;
    }

    /**
     * Read-only view of one row.
     */
    public Row row(int row) {
        checkIndex(row);
        return new Row(row, rowStart[row], rowStart[row + 1]);
    }

    /** Sum of all cells. */
    public double total() {
        double total = 0;
        for (double v : values) {
            total += v;
        }
        return total;
    }

    /**
     * Visit every non-zero cell, row by row, columns ascending.
     */
    public void forEachNonZero(CellVisitor visitor) {
        for (int r = 0; r < size; r++) {
            for (int i = rowStart[r]; i < rowStart[r + 1]; i++) {
                visitor.visit(r, columns[i], values[i]);
            }
        }
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("Index " + index + " outside matrix of size " + size);
        }
    }

    @Override
    public String toString() {
        return String.format("AssociationMatrix[%dx%d, %d non-zero]", size, size, values.length);
    }

    @FunctionalInterface
    public interface CellVisitor {
        void visit(int row, int column, double value);
    }

    /**
     * A single row of the matrix: the association of one word with every other word.
     */
    public final class Row {
        private final int row;
        private final int from;
        private final int to;

        private Row(int row, int from, int to) {
            this.row = row;
            this.from = from;
            this.to = to;
        }

        public int index() {
            return row;
        }

        /** Number of non-zero cells. */
        public int size() {
            return to - from;
        }

        public int column(int i) {
            return columns[from + i];
        }

        public double value(int i) {
            return values[from + i];
        }

        public double get(int column) {
            int pos = Arrays.binarySearch(columns, from, to, column);
            return pos >= 0 ? values[pos] : 0.0;
        }

        public double sum() {
            double sum = 0;
            for (int i = from; i < to; i++) {
                sum += values[i];
            }
            return sum;
        }

        /** Dense copy of this row, of length {@link AssociationMatrix#size()}. */
        public double[] toDense() {
            double[] dense = new double[size];
            for (int i = from; i < to; i++) {
                dense[columns[i]] = values[i];
            }
            return dense;
        }
    }

    /**
     * Accumulates cells, keyed by packed (row, column), then freezes them into a matrix.
     */
    public static final class Builder {
        private final int size;
        private final TLongDoubleHashMap cells = new TLongDoubleHashMap();

        private Builder(int size) {
            if (size < 0) {
                throw new IllegalArgumentException("Matrix size must be >= 0, got " + size);
            }
            this.size = size;
        }

        public Builder add(int row, int column, double delta) {
            check(row, column);
            cells.adjustOrPutValue(key(row, column), delta, delta);
            return this;
        }

        public Builder set(int row, int column, double value) {
            check(row, column);
            cells.put(key(row, column), value);
            return this;
        }

        private void check(int row, int column) {
            if (row < 0 || row >= size || column < 0 || column >= size) {
                throw new IndexOutOfBoundsException(
                    "Cell (" + row + ", " + column + ") outside matrix of size " + size);
            }
        }

        /**
         * Freeze the accumulated cells. Cells equal to zero are dropped.
         */
        public AssociationMatrix build() {
            long[] keys = cells.keys();
            Arrays.sort(keys);

            int nonZero = 0;
            for (long k : keys) {
                if (cells.get(k) != 0.0) {
                    nonZero++;
                }
            }

            int[] rowStart = new int[size + 1];
            int[] columns = new int[nonZero];
            double[] values = new double[nonZero];
            int i = 0;
            for (long k : keys) {
                double v = cells.get(k);
                if (v == 0.0) {
                    continue;
                }
                int row = (int) (k >>> 32);
                columns[i] = (int) k;
                values[i] = v;
                rowStart[row + 1]++;
                i++;
            }
            for (int r = 0; r < size; r++) {
                rowStart[r + 1] += rowStart[r];
            }
            return new AssociationMatrix(size, rowStart, columns, values);
        }

        private static long key(int row, int column) {
            return (((long) row) << 32) | (column & 0xffffffffL);
        }
    }
}
