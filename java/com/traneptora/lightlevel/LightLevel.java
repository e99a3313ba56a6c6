package com.traneptora.lightlevel;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Random;

import com.traneptora.lightlevel.analysis.ActiveAreaConsensus;
import com.traneptora.lightlevel.analysis.ActiveAreaVote;
import com.traneptora.lightlevel.analysis.BatchScheduler;
import com.traneptora.lightlevel.analysis.ConsensusResult;
import com.traneptora.lightlevel.analysis.FileResult;
import com.traneptora.lightlevel.color.ColorSpace;
import com.traneptora.lightlevel.color.LuminanceTable;
import com.traneptora.lightlevel.color.RangePolicy;
import com.traneptora.lightlevel.io.FileCollector;
import com.traneptora.lightlevel.io.FileLists;
import com.traneptora.lightlevel.io.FrameDecoder;
import com.traneptora.lightlevel.io.Loggers;
import com.traneptora.lightlevel.io.ProcessedLog;
import com.traneptora.lightlevel.io.ResultWriter;
import com.traneptora.lightlevel.io.TiffFrameDecoder;
import com.traneptora.lightlevel.util.Region;

public class LightLevel {

    public static final String LIGHTLEVEL_VERSION = "0.1.0";

    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_CONFIG = 1;
    public static final int EXIT_IO = 2;
    public static final int EXIT_ABORTED = 3;
    public static final int EXIT_BUG = 4;

    private static final List<String> yesOptions = Arrays.asList("", "yes", "true");
    private static final List<String> noOptions = Arrays.asList("no", "false");

    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("_MMddyy_HHmm");

    private static void usage(boolean success) {
        String[] lines = new String[]{
            "lightlevel, version: " + LIGHTLEVEL_VERSION,
            "Usage: java -jar lightlevel.jar [options...] [--] [folder]",
            "",
            "Options: ",
            "    --help",
            "        print this message",
            "    --info",
            "        print progress information",
            "    --info=verbose, --verbose",
            "        print per-file results as they are computed",
            "    --debug",
            "        print stack traces on errors",
            "",
            "    --range=<full|legal>",
            "        signal range of the frames, default full",
            "    --colorspace=<2020|p3>",
            "        color primaries of the frames, default 2020",
            "    --y-offset=N",
            "        first row of the active picture",
            "    --y-length=N",
            "        number of rows in the active picture",
            "        if neither is given, the active area is detected from a sample of the files",
            "    --sample-size=N",
            "        number of files to sample for active area detection, default 10",
            "",
            "    --log-list=FILE",
            "        append processed file names to FILE",
            "    --file-list=FILE",
            "        only process the files named in FILE",
            "    --processed-files=FILE",
            "        skip the files named in FILE",
            "    --result-file=FILE",
            "        append results to FILE",
            "    --threads=N",
            "        analyze N files at a time, default 4",
            "    --yes",
            "        do not ask for confirmation on warnings",
            "",
            "If the folder is not provided, the current directory is scanned for TIFF files.",
        };
        System.err.println(String.join(String.format("%n"), lines));
        System.exit(success ? EXIT_SUCCESS : EXIT_CONFIG);
    }

    private static boolean parseFlag(String name, String valueL) {
        if (yesOptions.contains(valueL))
            return true;
        if (noOptions.contains(valueL))
            return false;
        throw new InvalidParameterException(String.format("Unknown --%s flag: %s", name, valueL));
    }

    private static int parseInt(String name, String value, int min) {
        int result;
        try {
            result = Integer.parseInt(value);
        } catch (NumberFormatException nfe) {
            throw new InvalidParameterException(String.format("Not an integer: --%s=%s", name, value), nfe);
        }
        if (result < min)
            throw new InvalidParameterException(String.format("Illegal value: --%s=%s, must be at least %d",
                name, value, min));
        return result;
    }

    private static String parseFile(String name, String value) {
        if (value.isEmpty())
            throw new InvalidParameterException(String.format("Missing file name: --%s", name));
        return value;
    }

    private static void parseOption(LightLevelOptions options, String arg, boolean foundMM) {
        if (foundMM || !arg.startsWith("--")) {
            if (options.input == null) {
                options.input = arg;
                return;
            }
            throw new InvalidParameterException(String.format("Invalid trailing argument: %s", arg));
        }
        if (arg.equals("--"))
            return;
        int indexEq = arg.indexOf("=");
        String key = indexEq >= 0 ? arg.substring(2, indexEq) : arg.substring(2);
        String value = indexEq >= 0 ? arg.substring(indexEq + 1) : "";
        String keyL = key.toLowerCase();
        String valueL = value.toLowerCase();
        switch (keyL) {
            case "help":
                usage(true);
                return;
            case "debug":
                options.debug = parseFlag(key, valueL);
                return;
            case "yes":
                options.assumeYes = parseFlag(key, valueL);
                return;
            case "info":
                if (Arrays.asList("", "info", "yes", "true").contains(valueL)) {
                    options.verbosity = Loggers.LOG_INFO;
                } else if (Arrays.asList("no", "false").contains(valueL)) {
                    options.verbosity = Loggers.LOG_BASE;
                } else if (Arrays.asList("v", "verbose").contains(valueL)) {
                    options.verbosity = Loggers.LOG_VERBOSE;
                } else if (valueL.equals("trace")) {
                    options.verbosity = Loggers.LOG_TRACE;
                } else {
                    throw new InvalidParameterException(String.format("Unknown --info flag: %s", value));
                }
                return;
            case "verbose":
                options.verbosity = parseFlag(key, valueL) ? Loggers.LOG_VERBOSE : Loggers.LOG_BASE;
                return;
            case "range":
                options.range = RangePolicy.fromFlagName(value);
                if (options.range == null)
                    throw new InvalidParameterException(String.format("Unknown --range: %s, expected full or legal", value));
                return;
            case "colorspace":
                options.colorSpace = ColorSpace.fromFlagName(value);
                if (options.colorSpace == null)
                    throw new InvalidParameterException(String.format("Unknown --colorspace: %s, expected 2020 or p3", value));
                return;
            case "y-offset":
                options.yOffset = parseInt(key, value, 0);
                return;
            case "y-length":
                options.yLength = parseInt(key, value, 0);
                return;
            case "sample-size":
                options.sampleSize = parseInt(key, value, 1);
                return;
            case "threads":
                options.threads = parseInt(key, value, 1);
                if (options.threads > 65536)
                    throw new InvalidParameterException(String.format("Illegal number of threads: %s", value));
                return;
            case "log-list":
                options.logList = parseFile(key, value);
                return;
            case "file-list":
                options.fileList = parseFile(key, value);
                return;
            case "processed-files":
                options.processedFiles = parseFile(key, value);
                return;
            case "result-file":
                options.resultFile = parseFile(key, value);
                return;
            default:
                throw new InvalidParameterException(String.format("Unknown arg: %s", arg));
        }
    }

    /**
     * @throws InvalidParameterException on any unknown or malformed argument
     */
    public static LightLevelOptions parseOptions(String... args) {
        LightLevelOptions options = new LightLevelOptions();
        boolean foundMM = false;
        for (String arg : args) {
            parseOption(options, arg, foundMM);
            if (arg.equals("--"))
                foundMM = true;
        }
        return options;
    }

    private static Path defaultOutput(String prefix) {
        return Path.of("").toAbsolutePath().resolve(prefix + LocalDateTime.now().format(FILE_STAMP) + ".txt");
    }

    private final LightLevelOptions options;
    private final Loggers loggers;
    private final Confirmation confirmation;
    private final FrameDecoder decoder;
    private final Random random;

    public LightLevel(LightLevelOptions options, Loggers loggers, Confirmation confirmation,
            FrameDecoder decoder, Random random) {
        this.options = new LightLevelOptions(options);
        this.loggers = loggers;
        this.confirmation = confirmation;
        this.decoder = decoder;
        this.random = random;
    }

    private List<Path> collectFiles(Path scanPath) throws IOException {
        loggers.log(Loggers.LOG_BASE, "Scanning Files... ");
        List<Path> files = FileCollector.findTiffFiles(scanPath);
        loggers.log(Loggers.LOG_INFO, "Found %d TIFF files", files.size());
        return files;
    }

    private List<String> readNonEmptyList(String listFile, String description) {
        Path path = FileCollector.resolveUserPath(listFile);
        List<String> list;
        try {
            list = FileLists.readList(path);
        } catch (IOException ex) {
            throw new InvalidParameterException(String.format("Unable to open the %s: %s", description, path), ex);
        }
        if (list.isEmpty())
            throw new InvalidParameterException(String.format("The %s is empty: %s", description, path));
        return list;
    }

    /**
     * @return the files to analyze, or null if the operator aborted
     */
    private List<Path> filterFiles(List<Path> files) throws IOException {
        if (options.fileList != null || options.processedFiles != null) {
            for (String name : FileLists.duplicateBaseNames(files))
                loggers.log(Loggers.LOG_BASE, "Warning: more than one file is named %s, the lists apply to all of them", name);
        }
        if (options.fileList != null) {
            FileLists.Selection selection = FileLists.selectMandatory(files,
                readNonEmptyList(options.fileList, "mandatory file list"));
            for (String name : selection.missing)
                loggers.log(Loggers.LOG_BASE, "Can't find the following file in the list: %s", name);
            if (!selection.missing.isEmpty() && !confirmation.confirm(String.format(
                    "%d FILE(S) ARE MISSING! DO YOU WANT TO CONTINUE? (Y)es or (N)o?", selection.missing.size())))
                return null;
            files = selection.files;
        }
        if (options.processedFiles != null) {
            files = FileLists.removeProcessed(files, readNonEmptyList(options.processedFiles, "processed file log"));
        }
        return files;
    }

    /**
     * @return the active area to measure, or null if the operator aborted
     */
    private Region determineRegion(List<Path> files) throws IOException {
        int yOffset;
        int yLength;
        if (options.hasExplicitRegion()) {
            yOffset = Math.max(options.yOffset, 0);
            yLength = Math.max(options.yLength, 0);
        } else {
            loggers.log(Loggers.LOG_BASE, "Scanning Active Dimensions... ");
            ConsensusResult consensus = new ActiveAreaConsensus(decoder, loggers)
                .vote(files, options.sampleSize, random);
            if (consensus.isDisagreement()) {
                loggers.log(Loggers.LOG_BASE, "!!!!! NOT ALL OF THE FILES HAVE THE SAME ACTIVE DIMENSION AREA!!!!!");
                loggers.log(Loggers.LOG_BASE, "THE FOLLOWING DIMENSION COUNTS WERE FOUND!!!");
                for (ActiveAreaVote vote : consensus.tally.values())
                    loggers.log(Loggers.LOG_BASE, "%s", vote);
                if (!confirmation.confirm("DO YOU WANT TO CONTINUE AND USE THE HIGHEST COUNT? "
                        + "OTHERWISE PRESS N AND RESTART SPECIFYING --y-offset AND --y-length."))
                    return null;
            }
            Region region = consensus.getRegion();
            yOffset = region != null ? region.rowOffset : 0;
            yLength = region != null ? region.rowCount : 0;
        }
        if (yLength == 0)
            throw new InvalidParameterException("You must specify a vertical pixel length greater than 0, i.e. --y-length=1600");
        return new Region(yOffset, yLength);
    }

    private void logParameters(Path scanPath, Region region, Path logList, Path resultFile) {
        loggers.log(Loggers.LOG_BASE, "Will begin processing the path %s:", scanPath);
        loggers.log(Loggers.LOG_BASE, "The following parameters:");
        loggers.log(Loggers.LOG_BASE, "\tUse %s Range", options.range == RangePolicy.FULL ? "Full" : "Legal");
        loggers.log(Loggers.LOG_BASE, "\tUse %s Color Space", options.colorSpace.flagName);
        loggers.log(Loggers.LOG_BASE, "\tyOffset %d", region.rowOffset);
        loggers.log(Loggers.LOG_BASE, "\ty length %d", region.rowCount);
        loggers.log(Loggers.LOG_BASE, "\tloglistFilePath %s", logList);
        if (options.processedFiles != null)
            loggers.log(Loggers.LOG_BASE, "\tprocessedFilesFilePath %s", FileCollector.resolveUserPath(options.processedFiles));
        loggers.log(Loggers.LOG_BASE, "\tresultFilePath %s", resultFile);
        loggers.log(Loggers.LOG_BASE, "\tnumberOfThreads %d", options.threads);
    }

    private void analyze(List<Path> files, Region region, LuminanceTable table, Path logList,
            Path resultFile) throws IOException {
        try (BatchScheduler scheduler = new BatchScheduler(decoder, options.threads, region,
                    options.colorSpace, table, loggers);
                ProcessedLog log = ProcessedLog.append(logList);
                ResultWriter results = ResultWriter.append(resultFile)) {
            Iterator<FileResult> iter = scheduler.run(files);
            while (iter.hasNext()) {
                FileResult result = iter.next();
                results.write(result);
                log.record(result.path);
                results.flush();
                log.flush();
            }
        }
    }

    /**
     * @return the process exit code
     */
    public int run() throws IOException {
        if (options.threads <= 0)
            throw new InvalidParameterException("You must specify a number of threads greater than 0");

        Path scanPath = FileCollector.resolveUserPath(options.input != null ? options.input : "");
        if (!Files.exists(scanPath)) {
            loggers.log(Loggers.LOG_BASE, "%s does not exist.", scanPath);
            return EXIT_CONFIG;
        }
        if (!Files.isDirectory(scanPath)) {
            loggers.log(Loggers.LOG_BASE, "%s is not a folder path.", scanPath);
            return EXIT_CONFIG;
        }
        Path logList = options.logList != null ? FileCollector.resolveUserPath(options.logList) : defaultOutput("hdr_log");
        Path resultFile = options.resultFile != null ? FileCollector.resolveUserPath(options.resultFile)
            : defaultOutput("hdr_results");

        // fail on a bad range before touching any file
        LuminanceTable table = LuminanceTable.forRange(options.range);

        loggers.log(Loggers.LOG_BASE, "Starting!");
        List<Path> files = filterFiles(collectFiles(scanPath));
        if (files == null)
            return EXIT_ABORTED;
        if (files.isEmpty()) {
            loggers.log(Loggers.LOG_BASE, "No files to process.");
            return EXIT_SUCCESS;
        }

        Region region = determineRegion(files);
        if (region == null)
            return EXIT_ABORTED;

        logParameters(scanPath, region, logList, resultFile);
        loggers.log(Loggers.LOG_BASE, "Ready to process: %d files.", files.size());
        analyze(files, region, table, logList, resultFile);
        loggers.log(Loggers.LOG_BASE, "Finished!");
        return EXIT_SUCCESS;
    }

    public static void main(String[] args) {
        LightLevelOptions options = null;
        try {
            options = parseOptions(args);
        } catch (InvalidParameterException ex) {
            System.err.format("lightlevel: %s%n%n", ex.getMessage());
            usage(false);
        }

        Loggers loggers = Loggers.stderr(options.verbosity);
        Confirmation confirmation = options.assumeYes ? Confirmation.ALWAYS
            : Confirmation.interactive(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                loggers.err);
        LightLevel lightLevel = new LightLevel(options, loggers, confirmation, new TiffFrameDecoder(), new Random());

        int code;
        try {
            code = lightLevel.run();
        } catch (InvalidParameterException ex) {
            System.err.format("lightlevel: %s%n", ex.getMessage());
            if (options.debug)
                ex.printStackTrace();
            code = EXIT_CONFIG;
        } catch (IOException ioe) {
            System.err.format("lightlevel: I/O error occurred: %s%n", ioe.getMessage());
            if (options.debug)
                ioe.printStackTrace();
            code = EXIT_IO;
        } catch (Exception re) {
            System.err.println("lightlevel: BUG: " + re.getMessage());
            re.printStackTrace();
            code = EXIT_BUG;
        }
        System.exit(code);
    }
}
