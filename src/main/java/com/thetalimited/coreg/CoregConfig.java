package com.thetalimited.coreg;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

import com.thetalimited.coreg.engine.WindowFunction;
import com.thetalimited.coreg.geo.ResamplingMethod;
import com.thetalimited.coreg.io.RasterFormats;
import com.thetalimited.coreg.io.RasterSource;
import com.thetalimited.coreg.raster.BinaryMask;

/**
 * Caller facing settings of a co-registration run. Build with
 * {@link #builder()}; every threshold has a documented default.
 */
public final class CoregConfig
{
    // nodata fraction of a window at or above which it is rejected; 1.0 = only all-nodata windows
    public static final double DEFAULT_MAX_NODATA_FRACTION = 1.0;
    // cloud/quality masked fraction of a window above which it is rejected
    public static final double DEFAULT_MAX_OBSCURED_FRACTION = 0.25;
    // caller window sizes below this get a "rather small" advisory
    public static final int DEFAULT_SMALL_WINDOW_THRESHOLD = 128;
    // reliability (percent) below which a shift is flagged as unreliable
    public static final double DEFAULT_MIN_RELIABILITY = 30.0;
    // second peak / main peak ratio at which the estimate counts as ambiguous
    public static final double DEFAULT_AMBIGUITY_RATIO = 0.9;
    public static final int DEFAULT_MAX_ITERATIONS = 5;
    // default max shift in pixels of the analysis grid
    public static final double DEFAULT_MAX_SHIFT_PX = 5.0;
    public static final int MIN_WINDOW_SIZE = 32;
    public static final int DEFAULT_MAX_AUTO_WINDOW_SIZE = 1024;
    public static final double DEFAULT_AUTO_WINDOW_FRACTION = 0.125;

    public static final String PATH_OUT_AUTO = "auto";
    public static final String DEFAULT_FORMAT_OUT = RasterFormats.GTIFF;

    private final Integer windowWidth, windowHeight;
    private final WindowPosition windowPosition;
    private final Double maxShift;
    private final boolean alignGrids;
    private final String pathOut;
    private final String formatOut;
    private final Map<String, String> creationOptions;
    private final BinaryMask badDataMaskRef, badDataMaskTgt;
    private final BinaryMask cloudMaskRef, cloudMaskTgt;
    private final int refBand, tgtBand;
    private final Double nodataRef, nodataTgt;
    private final ResamplingMethod resamplingCalc, resamplingDeshift;
    private final WindowFunction windowFunction;
    private final int maxIterations;
    private final double maxNodataFraction, maxObscuredFraction;
    private final int smallWindowThreshold;
    private final double minReliability, ambiguityRatio;
    private final double autoWindowFraction;
    private final int maxAutoWindowSize;
    private final boolean ignoreErrors, verbose;
    private final ProgressListener progress;
    private final CoregDiagnostics diagnostics;

    private CoregConfig(Builder b)
    {
        this.windowWidth = b.windowWidth;
        this.windowHeight = b.windowHeight;
        this.windowPosition = b.windowPosition;
        this.maxShift = b.maxShift;
        this.alignGrids = b.alignGrids;
        this.pathOut = b.pathOut;
        this.formatOut = b.formatOut;
        this.creationOptions = Collections.unmodifiableMap(new LinkedHashMap<>(b.creationOptions));
        this.badDataMaskRef = b.badDataMaskRef;
        this.badDataMaskTgt = b.badDataMaskTgt;
        this.cloudMaskRef = b.cloudMaskRef;
        this.cloudMaskTgt = b.cloudMaskTgt;
        this.refBand = b.refBand;
        this.tgtBand = b.tgtBand;
        this.nodataRef = b.nodataRef;
        this.nodataTgt = b.nodataTgt;
        this.resamplingCalc = b.resamplingCalc;
        this.resamplingDeshift = b.resamplingDeshift;
        this.windowFunction = b.windowFunction;
        this.maxIterations = b.maxIterations;
        this.maxNodataFraction = b.maxNodataFraction;
        this.maxObscuredFraction = b.maxObscuredFraction;
        this.smallWindowThreshold = b.smallWindowThreshold;
        this.minReliability = b.minReliability;
        this.ambiguityRatio = b.ambiguityRatio;
        this.autoWindowFraction = b.autoWindowFraction;
        this.maxAutoWindowSize = b.maxAutoWindowSize;
        this.ignoreErrors = b.ignoreErrors;
        this.verbose = b.verbose;
        this.progress = b.progress;
        this.diagnostics = b.diagnostics;
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public static CoregConfig defaults()
    {
        return builder().build();
    }

    /**
     * Load a configuration from a {@code .properties} file with {@code coreg.*} keys.
     * Mask paths in the file are resolved against the file's directory.
     */
    public static CoregConfig fromProperties(Path file) throws IOException
    {
        Properties p = new Properties();
        try (InputStream in = Files.newInputStream(file)) {
            p.load(in);
        }
        Path base = file.toAbsolutePath().getParent();
        return builder().fromProperties(p, base).build();
    }

    // null when the window size is chosen automatically
    public Integer getWindowWidth() { return windowWidth; }
    public Integer getWindowHeight() { return windowHeight; }
    public boolean isAutoWindowSize() { return windowWidth == null; }
    public WindowPosition getWindowPosition() { return windowPosition; }

    // map units; null means DEFAULT_MAX_SHIFT_PX pixels of the analysis grid
    public Double getMaxShift() { return maxShift; }
    public boolean isAlignGrids() { return alignGrids; }
    public String getPathOut() { return pathOut; }
    public boolean isAutoPathOut() { return PATH_OUT_AUTO.equalsIgnoreCase(pathOut); }
    public String getFormatOut() { return formatOut; }
    public Map<String, String> getCreationOptions() { return creationOptions; }
    public BinaryMask getBadDataMaskRef() { return badDataMaskRef; }
    public BinaryMask getBadDataMaskTgt() { return badDataMaskTgt; }
    public BinaryMask getCloudMaskRef() { return cloudMaskRef; }
    public BinaryMask getCloudMaskTgt() { return cloudMaskTgt; }

    // 1-based band numbers
    public int getRefBand() { return refBand; }
    public int getTgtBand() { return tgtBand; }
    public Double getNodataRef() { return nodataRef; }
    public Double getNodataTgt() { return nodataTgt; }
    public ResamplingMethod getResamplingCalc() { return resamplingCalc; }
    public ResamplingMethod getResamplingDeshift() { return resamplingDeshift; }
    public WindowFunction getWindowFunction() { return windowFunction; }
    public int getMaxIterations() { return maxIterations; }
    public double getMaxNodataFraction() { return maxNodataFraction; }
    public double getMaxObscuredFraction() { return maxObscuredFraction; }
    public int getSmallWindowThreshold() { return smallWindowThreshold; }
    public double getMinReliability() { return minReliability; }
    public double getAmbiguityRatio() { return ambiguityRatio; }
    public double getAutoWindowFraction() { return autoWindowFraction; }
    public int getMaxAutoWindowSize() { return maxAutoWindowSize; }
    public boolean isIgnoreErrors() { return ignoreErrors; }
    public boolean isVerbose() { return verbose; }
    public ProgressListener getProgress() { return progress; }
    public CoregDiagnostics getDiagnostics() { return diagnostics; }

    public Builder toBuilder()
    {
        Builder b = new Builder();
        b.windowWidth = windowWidth;
        b.windowHeight = windowHeight;
        b.windowPosition = windowPosition;
        b.maxShift = maxShift;
        b.alignGrids = alignGrids;
        b.pathOut = pathOut;
        b.formatOut = formatOut;
        b.creationOptions.putAll(creationOptions);
        b.badDataMaskRef = badDataMaskRef;
        b.badDataMaskTgt = badDataMaskTgt;
        b.cloudMaskRef = cloudMaskRef;
        b.cloudMaskTgt = cloudMaskTgt;
        b.refBand = refBand;
        b.tgtBand = tgtBand;
        b.nodataRef = nodataRef;
        b.nodataTgt = nodataTgt;
        b.resamplingCalc = resamplingCalc;
        b.resamplingDeshift = resamplingDeshift;
        b.windowFunction = windowFunction;
        b.maxIterations = maxIterations;
        b.maxNodataFraction = maxNodataFraction;
        b.maxObscuredFraction = maxObscuredFraction;
        b.smallWindowThreshold = smallWindowThreshold;
        b.minReliability = minReliability;
        b.ambiguityRatio = ambiguityRatio;
        b.autoWindowFraction = autoWindowFraction;
        b.maxAutoWindowSize = maxAutoWindowSize;
        b.ignoreErrors = ignoreErrors;
        b.verbose = verbose;
        b.progress = progress;
        b.diagnostics = diagnostics;
        return b;
    }

    public static final class Builder
    {
        private Integer windowWidth, windowHeight;
        private WindowPosition windowPosition;
        private Double maxShift;
        private boolean alignGrids = false;
        private String pathOut;
        private String formatOut = DEFAULT_FORMAT_OUT;
        private final Map<String, String> creationOptions = new LinkedHashMap<>();
        private BinaryMask badDataMaskRef, badDataMaskTgt;
        private BinaryMask cloudMaskRef, cloudMaskTgt;
        private int refBand = 1, tgtBand = 1;
        private Double nodataRef, nodataTgt;
        private ResamplingMethod resamplingCalc = ResamplingMethod.CUBIC;
        private ResamplingMethod resamplingDeshift = ResamplingMethod.CUBIC;
        private WindowFunction windowFunction = WindowFunction.HANN;
        private int maxIterations = DEFAULT_MAX_ITERATIONS;
        private double maxNodataFraction = DEFAULT_MAX_NODATA_FRACTION;
        private double maxObscuredFraction = DEFAULT_MAX_OBSCURED_FRACTION;
        private int smallWindowThreshold = DEFAULT_SMALL_WINDOW_THRESHOLD;
        private double minReliability = DEFAULT_MIN_RELIABILITY;
        private double ambiguityRatio = DEFAULT_AMBIGUITY_RATIO;
        private double autoWindowFraction = DEFAULT_AUTO_WINDOW_FRACTION;
        private int maxAutoWindowSize = DEFAULT_MAX_AUTO_WINDOW_SIZE;
        private boolean ignoreErrors = false;
        private boolean verbose = false;
        private ProgressListener progress = ProgressListener.NONE;
        private CoregDiagnostics diagnostics = CoregDiagnostics.NONE;

        private Builder() {}

        public Builder windowSize(int size) { return windowSize(size, size); }
        public Builder windowSize(int width, int height) { windowWidth = width; windowHeight = height; return this; }
        public Builder autoWindowSize() { windowWidth = null; windowHeight = null; return this; }
        public Builder windowPosition(WindowPosition position) { windowPosition = position; return this; }
        public Builder maxShift(Double mapUnits) { maxShift = mapUnits; return this; }
        public Builder alignGrids(boolean align) { alignGrids = align; return this; }
        public Builder pathOut(String path) { pathOut = path; return this; }
        public Builder formatOut(String format) { formatOut = format; return this; }
        public Builder creationOption(String key, String value) { creationOptions.put(key, value); return this; }
        public Builder creationOptions(Map<String, String> options) { creationOptions.putAll(options); return this; }
        public Builder badDataMaskRef(BinaryMask mask) { badDataMaskRef = mask; return this; }
        public Builder badDataMaskTgt(BinaryMask mask) { badDataMaskTgt = mask; return this; }
        public Builder cloudMaskRef(BinaryMask mask) { cloudMaskRef = mask; return this; }
        public Builder cloudMaskTgt(BinaryMask mask) { cloudMaskTgt = mask; return this; }
        public Builder refBand(int band) { refBand = band; return this; }
        public Builder tgtBand(int band) { tgtBand = band; return this; }
        public Builder nodataRef(Double value) { nodataRef = value; return this; }
        public Builder nodataTgt(Double value) { nodataTgt = value; return this; }
        public Builder resamplingCalc(ResamplingMethod method) { resamplingCalc = method; return this; }
        public Builder resamplingDeshift(ResamplingMethod method) { resamplingDeshift = method; return this; }
        public Builder windowFunction(WindowFunction function) { windowFunction = function; return this; }
        public Builder maxIterations(int n) { maxIterations = n; return this; }
        public Builder maxNodataFraction(double f) { maxNodataFraction = f; return this; }
        public Builder maxObscuredFraction(double f) { maxObscuredFraction = f; return this; }
        public Builder smallWindowThreshold(int px) { smallWindowThreshold = px; return this; }
        public Builder minReliability(double percent) { minReliability = percent; return this; }
        public Builder ambiguityRatio(double ratio) { ambiguityRatio = ratio; return this; }
        public Builder autoWindowFraction(double f) { autoWindowFraction = f; return this; }
        public Builder maxAutoWindowSize(int px) { maxAutoWindowSize = px; return this; }
        public Builder ignoreErrors(boolean ignore) { ignoreErrors = ignore; return this; }
        public Builder verbose(boolean v) { verbose = v; return this; }
        public Builder progress(ProgressListener listener) { progress = listener; return this; }
        public Builder diagnostics(CoregDiagnostics d) { diagnostics = d; return this; }

        /**
         * Apply {@code coreg.*} keys. Unknown keys starting with {@code coreg.}
         * are rejected so that typos do not pass silently. Mask entries name
         * raster files whose first band is turned into a mask (non-zero = set).
         *
         * @param base directory relative mask paths are resolved against, may be null
         */
        public Builder fromProperties(Properties p, Path base) throws IOException
        {
            for (String key : p.stringPropertyNames()) {
                if (!key.startsWith("coreg.")) continue;
                String v = p.getProperty(key).trim();
                try {
                    apply(key.substring("coreg.".length()), v, base);
                } catch (IllegalArgumentException e) {
                    throw new CoregException(FailureKind.CONFIGURATION,
                                             "bad value for " + key + "='" + v + "': " + e.getMessage(), e);
                }
            }
            return this;
        }

        private void apply(String key, String v, Path base) throws IOException
        {
            switch (key) {
            case "windowSize": {
                int[] s = parseInts(v);
                if (s.length == 1) windowSize(s[0]);
                else if (s.length == 2) windowSize(s[0], s[1]);
                else throw new IllegalArgumentException("expected 'size' or 'width,height'");
                break;
            }
            case "windowPosition": {
                double[] d = parsePair(v);
                windowPosition(WindowPosition.ofMap(d[0], d[1]));
                break;
            }
            case "windowPositionPixel": {
                double[] d = parsePair(v);
                windowPosition(WindowPosition.ofPixel(d[0], d[1]));
                break;
            }
            case "maxShift": maxShift(Double.valueOf(v)); break;
            case "alignGrids": alignGrids(parseBoolean(v)); break;
            case "pathOut": pathOut(v); break;
            case "formatOut": formatOut(v); break;
            case "creationOptions":
                // KEY=VALUE pairs separated by ';' or ','
                for (String kv : v.split("[;,]")) {
                    if (kv.trim().isEmpty()) continue;
                    int eq = kv.indexOf('=');
                    if (eq <= 0) throw new IllegalArgumentException("creation option '" + kv + "' is not KEY=VALUE");
                    creationOption(kv.substring(0, eq).trim(), kv.substring(eq + 1).trim());
                }
                break;
            case "refBand": refBand(Integer.parseInt(v)); break;
            case "tgtBand": tgtBand(Integer.parseInt(v)); break;
            case "nodataRef": nodataRef(Double.valueOf(v)); break;
            case "nodataTgt": nodataTgt(Double.valueOf(v)); break;
            case "resamplingCalc": resamplingCalc(ResamplingMethod.fromName(v)); break;
            case "resamplingDeshift": resamplingDeshift(ResamplingMethod.fromName(v)); break;
            case "windowFunction": windowFunction(WindowFunction.fromName(v)); break;
            case "maxIterations": maxIterations(Integer.parseInt(v)); break;
            case "maxNodataFraction": maxNodataFraction(Double.parseDouble(v)); break;
            case "maxObscuredFraction": maxObscuredFraction(Double.parseDouble(v)); break;
            case "smallWindowThreshold": smallWindowThreshold(Integer.parseInt(v)); break;
            case "minReliability": minReliability(Double.parseDouble(v)); break;
            case "ambiguityRatio": ambiguityRatio(Double.parseDouble(v)); break;
            case "autoWindowFraction": autoWindowFraction(Double.parseDouble(v)); break;
            case "maxAutoWindowSize": maxAutoWindowSize(Integer.parseInt(v)); break;
            case "ignoreErrors": ignoreErrors(parseBoolean(v)); break;
            case "verbose": verbose(parseBoolean(v)); break;
            case "badDataMaskRef": badDataMaskRef(loadMask(v, base)); break;
            case "badDataMaskTgt": badDataMaskTgt(loadMask(v, base)); break;
            case "cloudMaskRef": cloudMaskRef(loadMask(v, base)); break;
            case "cloudMaskTgt": cloudMaskTgt(loadMask(v, base)); break;
            default:
                throw new IllegalArgumentException("unknown key");
            }
        }

        public CoregConfig build()
        {
            if (windowWidth != null && (windowWidth < 4 || windowHeight < 4)) {
                fail("window size must be at least 4x4 pixels, got " + windowWidth + "x" + windowHeight);
            }
            if (maxShift != null && !(maxShift > 0)) fail("maxShift must be positive, got " + maxShift);
            if (refBand < 1 || tgtBand < 1) fail("band numbers are 1-based, got ref=" + refBand + " tgt=" + tgtBand);
            if (!RasterFormats.isSupported(formatOut)) {
                fail("unknown output format '" + formatOut + "', supported: "
                     + String.join(", ", RasterFormats.supportedFormats()));
            }
            if (maxIterations < 1) fail("maxIterations must be >= 1, got " + maxIterations);
            if (!(maxNodataFraction > 0 && maxNodataFraction <= 1)) {
                fail("maxNodataFraction must be in (0, 1], got " + maxNodataFraction);
            }
            if (!(maxObscuredFraction >= 0 && maxObscuredFraction <= 1)) {
                fail("maxObscuredFraction must be in [0, 1], got " + maxObscuredFraction);
            }
            if (!(autoWindowFraction > 0 && autoWindowFraction <= 1)) {
                fail("autoWindowFraction must be in (0, 1], got " + autoWindowFraction);
            }
            if (maxAutoWindowSize < MIN_WINDOW_SIZE) {
                fail("maxAutoWindowSize must be >= " + MIN_WINDOW_SIZE + ", got " + maxAutoWindowSize);
            }
            if (resamplingCalc == null || resamplingDeshift == null || windowFunction == null) {
                fail("resampling methods and window function must be set");
            }
            if (progress == null) progress = ProgressListener.NONE;
            if (diagnostics == null) diagnostics = CoregDiagnostics.NONE;
            return new CoregConfig(this);
        }

        private static void fail(String message)
        {
            throw new CoregException(FailureKind.CONFIGURATION, message);
        }

        private static BinaryMask loadMask(String file, Path base) throws IOException
        {
            Path p = Paths.get(file);
            if (!p.isAbsolute() && base != null) p = base.resolve(p);
            return BinaryMask.fromRaster(RasterSource.fromPath(p).toMemory(), null);
        }

        private static int[] parseInts(String v)
        {
            String[] parts = v.split("[,x\\s]+");
            int[] out = new int[parts.length];
            for (int i = 0; i < parts.length; i++) out[i] = Integer.parseInt(parts[i].trim());
            return out;
        }

        private static double[] parsePair(String v)
        {
            String[] parts = v.split("[,\\s]+");
            if (parts.length != 2) throw new IllegalArgumentException("expected 'x,y'");
            return new double[] { Double.parseDouble(parts[0]), Double.parseDouble(parts[1]) };
        }

        private static boolean parseBoolean(String v)
        {
            if (v.equalsIgnoreCase("true") || v.equalsIgnoreCase("yes") || v.equals("1")) return true;
            if (v.equalsIgnoreCase("false") || v.equalsIgnoreCase("no") || v.equals("0")) return false;
            throw new IllegalArgumentException("expected true or false");
        }
    }
}
