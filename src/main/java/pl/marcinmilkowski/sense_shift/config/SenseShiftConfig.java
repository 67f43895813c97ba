package pl.marcinmilkowski.sense_shift.config;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Run configuration, built once at startup and handed to every component that needs it.
 *
 * Expected JSON structure (every key optional):
 * {
 *   "floor": 1,
 *   "window_size": 10,
 *   "alpha": 1.0,
 *   "gamma": 1.0,
 *   "eta": 0.1,
 *   "max_iterations": 25,
 *   "snapshot_interval": 5,
 *   "seed": 42,
 *   "top_k": 50,
 *   "threads": 1,
 *   "language": "english",
 *   "lowercase": false,
 *   "association_weighting": "raw_count"
 * }
 *
 * @param floor minimum number of occurrences a word needs beyond one to stay in the vocabulary
 * @param windowSize span of neighbouring tokens considered around each center token
 * @param alpha document-level concentration parameter
 * @param gamma corpus-level concentration parameter, consumed by the sense sampler
 * @param eta topic-word smoothing, consumed by the sense sampler
 * @param maxIterations number of sampling sweeps
 * @param snapshotInterval write a snapshot every this many sweeps
 * @param seed run seed from which per-document seeds are derived
 * @param topK number of words reported in the novelty ranking
 * @param threads worker threads for partition initialization
 * @param language stopword list to load
 * @param lowercase whether tokens are lowercased before counting
 * @param associationWeighting which matrix the corpus keeps
 */
public record SenseShiftConfig(
    int floor,
    int windowSize,
    double alpha,
    double gamma,
    double eta,
    int maxIterations,
    int snapshotInterval,
    long seed,
    int topK,
    int threads,
    String language,
    boolean lowercase,
    AssociationWeighting associationWeighting
) {

    private static final Logger logger = LoggerFactory.getLogger(SenseShiftConfig.class);

    public static final int DEFAULT_FLOOR = 1;
    public static final int DEFAULT_WINDOW_SIZE = 10;
    public static final double DEFAULT_ALPHA = 1.0;
    public static final double DEFAULT_GAMMA = 1.0;
    public static final double DEFAULT_ETA = 0.1;
    public static final int DEFAULT_MAX_ITERATIONS = 25;
    public static final int DEFAULT_SNAPSHOT_INTERVAL = 5;
    public static final long DEFAULT_SEED = 42L;
    public static final int DEFAULT_TOP_K = 50;

    public SenseShiftConfig {
        if (floor < 0) {
            throw new IllegalArgumentException("floor must be >= 0, got " + floor);
        }
        if (windowSize < 1) {
            throw new IllegalArgumentException("window_size must be >= 1, got " + windowSize);
        }
        if (!(alpha > 0) || !(gamma > 0) || !(eta > 0)) {
            throw new IllegalArgumentException(
                "alpha, gamma and eta must be positive, got " + alpha + ", " + gamma + ", " + eta);
        }
        if (maxIterations < 0) {
            throw new IllegalArgumentException("max_iterations must be >= 0, got " + maxIterations);
        }
        if (snapshotInterval < 1) {
            throw new IllegalArgumentException("snapshot_interval must be >= 1, got " + snapshotInterval);
        }
        if (topK < 1) {
            throw new IllegalArgumentException("top_k must be >= 1, got " + topK);
        }
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1, got " + threads);
        }
        if (language == null || language.isBlank()) {
            throw new IllegalArgumentException("language must not be blank");
        }
        if (associationWeighting == null) {
            throw new IllegalArgumentException("association_weighting must not be null");
        }
    }

    /**
     * The configuration used when no file is given.
     */
    public static SenseShiftConfig defaults() {
        return new SenseShiftConfig(DEFAULT_FLOOR, DEFAULT_WINDOW_SIZE, DEFAULT_ALPHA, DEFAULT_GAMMA,
            DEFAULT_ETA, DEFAULT_MAX_ITERATIONS, DEFAULT_SNAPSHOT_INTERVAL, DEFAULT_SEED, DEFAULT_TOP_K,
            1, "english", false, AssociationWeighting.RAW_COUNT);
    }

    /**
     * Load a configuration from a JSON file. Keys that are absent take their defaults.
     *
     * @param configPath Path to the JSON file
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if a value is invalid
     */
    public static SenseShiftConfig load(Path configPath) throws IOException {
        if (!Files.exists(configPath)) {
            throw new IOException("Config file not found: " + configPath);
        }
        JSONObject root = JSON.parseObject(Files.readString(configPath));
        if (root == null) {
            throw new IllegalArgumentException("Config file is empty: " + configPath);
        }
        SenseShiftConfig config = fromJson(root);
        logger.info("Loaded config from {}: floor={}, window={}, alpha={}, iterations={}, weighting={}",
            configPath, config.floor(), config.windowSize(), config.alpha(), config.maxIterations(),
            config.associationWeighting());
        return config;
    }

    public static SenseShiftConfig fromJson(JSONObject root) {
        SenseShiftConfig d = defaults();
        return new SenseShiftConfig(
            root.getIntValue("floor", d.floor()),
            root.getIntValue("window_size", d.windowSize()),
            doubleValue(root, "alpha", d.alpha()),
            doubleValue(root, "gamma", d.gamma()),
            doubleValue(root, "eta", d.eta()),
            root.getIntValue("max_iterations", d.maxIterations()),
            root.getIntValue("snapshot_interval", d.snapshotInterval()),
            root.containsKey("seed") ? root.getLongValue("seed") : d.seed(),
            root.getIntValue("top_k", d.topK()),
            root.getIntValue("threads", d.threads()),
            root.containsKey("language") ? root.getString("language") : d.language(),
            root.containsKey("lowercase") ? root.getBooleanValue("lowercase") : d.lowercase(),
            AssociationWeighting.parse(root.getString("association_weighting"))
        );
    }

    private static double doubleValue(JSONObject root, String key, double defaultValue) {
        return root.containsKey(key) ? root.getDoubleValue(key) : defaultValue;
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("floor", floor);
        obj.put("window_size", windowSize);
        obj.put("alpha", alpha);
        obj.put("gamma", gamma);
        obj.put("eta", eta);
        obj.put("max_iterations", maxIterations);
        obj.put("snapshot_interval", snapshotInterval);
        obj.put("seed", seed);
        obj.put("top_k", topK);
        obj.put("threads", threads);
        obj.put("language", language);
        obj.put("lowercase", lowercase);
        obj.put("association_weighting", associationWeighting.name().toLowerCase(Locale.ROOT));
        return obj;
    }

    public SenseShiftConfig withFloor(int newFloor) {
        return new SenseShiftConfig(newFloor, windowSize, alpha, gamma, eta, maxIterations, snapshotInterval,
            seed, topK, threads, language, lowercase, associationWeighting);
    }

    public SenseShiftConfig withWindowSize(int newWindowSize) {
        return new SenseShiftConfig(floor, newWindowSize, alpha, gamma, eta, maxIterations, snapshotInterval,
            seed, topK, threads, language, lowercase, associationWeighting);
    }

    public SenseShiftConfig withAlpha(double newAlpha) {
        return new SenseShiftConfig(floor, windowSize, newAlpha, gamma, eta, maxIterations, snapshotInterval,
            seed, topK, threads, language, lowercase, associationWeighting);
    }

    public SenseShiftConfig withSeed(long newSeed) {
        return new SenseShiftConfig(floor, windowSize, alpha, gamma, eta, maxIterations, snapshotInterval,
            newSeed, topK, threads, language, lowercase, associationWeighting);
    }

    public SenseShiftConfig withThreads(int newThreads) {
        return new SenseShiftConfig(floor, windowSize, alpha, gamma, eta, maxIterations, snapshotInterval,
            seed, topK, newThreads, language, lowercase, associationWeighting);
    }

    public SenseShiftConfig withMaxIterations(int newMaxIterations) {
        return new SenseShiftConfig(floor, windowSize, alpha, gamma, eta, newMaxIterations, snapshotInterval,
            seed, topK, threads, language, lowercase, associationWeighting);
    }

    public SenseShiftConfig withAssociationWeighting(AssociationWeighting weighting) {
        return new SenseShiftConfig(floor, windowSize, alpha, gamma, eta, maxIterations, snapshotInterval,
            seed, topK, threads, language, lowercase, weighting);
    }
}
