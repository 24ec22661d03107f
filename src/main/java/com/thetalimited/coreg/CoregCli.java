package com.thetalimited.coreg;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import com.thetalimited.coreg.io.RasterSource;

// Command line front end: detect the shift between two GeoTIFFs and optionally write the corrected target.
public class CoregCli
{
    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private static void usage()
    {
        System.out.println("Usage: java -jar coreg.jar [options] <reference.tif> <target.tif>");
        System.out.println("  -ws <size>|<w,h>        matching window size in pixels (default: auto)");
        System.out.println("  -wp <x,y>               window centre in map units of the reference");
        System.out.println("  -wpp <col,row>          window centre in reference pixel coordinates");
        System.out.println("  -max_shift <units>      largest plausible shift in map units");
        System.out.println("  -align_grids            resample the output onto the reference grid");
        System.out.println("  -o <path>|auto          write the corrected target");
        System.out.println("  -fmt <GTiff|ENVI>       output format (default GTiff)");
        System.out.println("  -co <KEY=VALUE>         creation option, may be repeated");
        System.out.println("  -br <n> / -bs <n>       1-based band of reference / target (default 1)");
        System.out.println("  -nodata <ref,tgt>       nodata values overriding the file metadata");
        System.out.println("  -r_calc <method>        resampling for shift detection (nearest, bilinear, cubic)");
        System.out.println("  -r_deshift <method>     resampling for the correction");
        System.out.println("  -window <hann|none>     apodization window");
        System.out.println("  -max_iter <n>           maximum phase correlation iterations");
        System.out.println("  -ignore_errors          report failures instead of exiting with an error");
        System.out.println("  -config <file>          .properties file with coreg.* settings");
        System.out.println("  -diag <dir>             write matching windows and correlation surfaces to <dir>");
        System.out.println("  -v                      verbose output");
    }

    public static void main(String[] args)
    {
        System.exit(run(args));
    }

    static int run(String[] args)
    {
        Properties options = new Properties();
        List<String> creationOptions = new ArrayList<>();
        List<String> files = new ArrayList<>();
        Path configFile = null;
        Path diagDir = null;

        try {
            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                switch (a) {
                case "-ws": options.setProperty("coreg.windowSize", next(args, ++i, a)); break;
                case "-wp": options.setProperty("coreg.windowPosition", next(args, ++i, a)); break;
                case "-wpp": options.setProperty("coreg.windowPositionPixel", next(args, ++i, a)); break;
                case "-max_shift": options.setProperty("coreg.maxShift", next(args, ++i, a)); break;
                case "-align_grids": options.setProperty("coreg.alignGrids", "true"); break;
                case "-o": options.setProperty("coreg.pathOut", next(args, ++i, a)); break;
                case "-fmt": options.setProperty("coreg.formatOut", next(args, ++i, a)); break;
                case "-co": creationOptions.add(next(args, ++i, a)); break;
                case "-br": options.setProperty("coreg.refBand", next(args, ++i, a)); break;
                case "-bs": options.setProperty("coreg.tgtBand", next(args, ++i, a)); break;
                case "-nodata": {
                    String[] nd = next(args, ++i, a).split(",");
                    if (nd.length != 2) throw new IllegalArgumentException("-nodata expects <ref,tgt>");
                    options.setProperty("coreg.nodataRef", nd[0]);
                    options.setProperty("coreg.nodataTgt", nd[1]);
                    break;
                }
                case "-r_calc": options.setProperty("coreg.resamplingCalc", next(args, ++i, a)); break;
                case "-r_deshift": options.setProperty("coreg.resamplingDeshift", next(args, ++i, a)); break;
                case "-window": options.setProperty("coreg.windowFunction", next(args, ++i, a)); break;
                case "-max_iter": options.setProperty("coreg.maxIterations", next(args, ++i, a)); break;
                case "-ignore_errors": options.setProperty("coreg.ignoreErrors", "true"); break;
                case "-v": options.setProperty("coreg.verbose", "true"); break;
                case "-config": configFile = Paths.get(next(args, ++i, a)); break;
                case "-diag": diagDir = Paths.get(next(args, ++i, a)); break;
                case "-h":
                case "-help":
                    usage();
                    return EXIT_OK;
                default:
                    if (a.startsWith("-") && a.length() > 1 && !isNumber(a)) {
                        throw new IllegalArgumentException("unknown option " + a);
                    }
                    files.add(a);
                }
            }
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            usage();
            return EXIT_USAGE;
        }
        if (files.size() != 2) {
            usage();
            return EXIT_USAGE;
        }
        if (!creationOptions.isEmpty()) {
            options.setProperty("coreg.creationOptions", String.join(";", creationOptions));
        }

        RasterSource reference = RasterSource.fromPath(Paths.get(files.get(0)));
        RasterSource target = RasterSource.fromPath(Paths.get(files.get(1)));
        try {
            CoregConfig.Builder builder = CoregConfig.builder();
            if (configFile != null) {
                Properties fromFile = new Properties();
                try (InputStream in = Files.newInputStream(configFile)) {
                    fromFile.load(in);
                }
                builder.fromProperties(fromFile, configFile.toAbsolutePath().getParent());
            }
            builder.fromProperties(options, null);
            if (diagDir != null) {
                builder.diagnostics(new GeoTiffDiagnostics(diagDir, reference.toMemory().getProjection()));
            }
            CoregConfig config = builder.build();

            Coreg cr = new Coreg(reference, target, config);
            ShiftResult shift = cr.calculateSpatialShifts();
            printShift(shift);
            if (!shift.isSuccess()) {
                return EXIT_FAILED;
            }
            if (config.getPathOut() != null) {
                DeshiftResult out = cr.correctShifts();
                System.out.println("Corrected image written to " + out.getPathOut());
            }
            return EXIT_OK;
        } catch (CoregException e) {
            System.err.println("Co-registration failed: " + e.getMessage());
            return EXIT_FAILED;
        } catch (IOException | UncheckedIOException e) {
            System.err.println("I/O error: " + e.getMessage());
            return EXIT_FAILED;
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid option: " + e.getMessage());
            return EXIT_FAILED;
        }
    }

    static void printShift(ShiftResult shift)
    {
        if (!shift.isSuccess()) {
            System.out.println("No shift detected: " + shift.getFailureKind() + ": " + shift.getMessage());
        } else {
            System.out.printf("Detected shift: x = %.4f px, y = %.4f px%n", shift.getDxPx(), shift.getDyPx());
            System.out.printf("                x = %.4f, y = %.4f map units%n", shift.getDxMap(), shift.getDyMap());
            System.out.printf("Vector length %.4f, angle %.2f deg, reliability %.1f%%%s%n",
                              shift.getVectorLength(), shift.getVectorAngle(), shift.getReliability(),
                              shift.isReliable() ? "" : " (UNRELIABLE)");
        }
        for (String advisory : shift.getAdvisories()) {
            System.out.println("Warning: " + advisory);
        }
    }

    private static String next(String[] args, int i, String option)
    {
        if (i >= args.length) throw new IllegalArgumentException(option + " needs a value");
        return args[i];
    }

    private static boolean isNumber(String s)
    {
        try {
            Double.parseDouble(s);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }
} // CoregCli
