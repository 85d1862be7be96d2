package usx2usfx;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

import javax.xml.stream.XMLStreamException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;

/**
 * Convert a directory of USX books (one book per file) into a single USFX document.
 *
 * Usage:
 *   Usx2UsfxConverter <usxDir> <usfxFile> [--debug|-v] [--report <path>]
 *
 * Files with a .usx extension are read from usxDir and from the directories directly
 * below it, so that an unzipped Digital Bible Library bundle can be dropped in as is.
 */
public class Usx2UsfxConverter
{
    private static final Logger LOG = LoggerFactory.getLogger(Usx2UsfxConverter.class);

    public static final String USX_EXTENSION = ".usx";

    public static final String DEBUG_PROPERTY = "usx2usfx.debug";

    /** Enable verbose debug logging with -v/--debug or -Dusx2usfx.debug=true. */
    private static boolean DEBUG = Boolean.getBoolean(DEBUG_PROPERTY);

    public static void main(String[] args) throws Exception
    {
        if (args.length < 2)
        {
            System.err.println("Usage: Usx2UsfxConverter <usxDir> <usfxFile> [--debug|-v] [--report <path>]");
            System.exit(1);
        }

        Path usxDir = Paths.get(args[0]);
        Path usfxFile = Paths.get(args[1]);
        Path reportPath = null;

        for (int i = 2; i < args.length; i++)
        {
            String a = args[i];
            if ("-v".equals(a) || "--debug".equals(a))
            {
                DEBUG = true;
            }
            else if ("--report".equals(a))
            {
                if (i + 1 >= args.length)
                {
                    throw new IllegalArgumentException("--report requires a path argument");
                }
                reportPath = Paths.get(args[++i]);
            }
            else
            {
                throw new IllegalArgumentException("Unknown argument: " + a);
            }
        }

        ConversionReport report = new ConversionReport();
        boolean ok = convert(usxDir, usfxFile, report);

        if (reportPath != null)
        {
            report.writeJson(reportPath);
            LOG.debug("Report written to {}", reportPath.toAbsolutePath());
        }

        if (!ok)
        {
            System.exit(1);
        }
    }

    /**
     * Convert all USX files in usxDir and up to one directory below it to USFX in usfxFile.
     *
     * Debug logging is switched on here when -v/--debug was given on the command line or the
     * usx2usfx.debug system property is true.
     *
     * @return false if the directory could not be read or the destination could not be written;
     *         individual files that fail are reported but do not fail the conversion
     */
    public static boolean convert(Path usxDir, Path usfxFile, ConversionReport report)
    {
        if (DEBUG || Boolean.getBoolean(DEBUG_PROPERTY))
        {
            enableDebugLogging();
        }
        report.runStarted(usxDir.toString(), usfxFile.toString());

        if (!Files.isDirectory(usxDir))
        {
            report.error(usxDir.toString(), "", "USX directory does not exist or is not a directory: " + usxDir);
            report.runFinished(false);
            return false;
        }

        LOG.debug("Input:  {}", usxDir.toAbsolutePath());
        LOG.debug("Output: {}", usfxFile.toAbsolutePath());

        try (ConversionRun run = ConversionRun.open(usfxFile, report))
        {
            for (Path usx : findUsxFiles(usxDir))
            {
                run.transcode(usx);
            }
        }
        catch (IOException | XMLStreamException ex)
        {
            report.error(usxDir.toString(), "",
                "Error converting USX files in " + usxDir + " to " + usfxFile + ": " + ex.getMessage());
            report.runFinished(false);
            return false;
        }

        LOG.info("Converted {} book(s) to {} ({} duplicate(s) skipped, {} file(s) failed)",
            report.getBooksConverted().size(), usfxFile, report.getDuplicatesSkipped().size(),
            report.getFilesFailed().size());
        report.runFinished(true);
        return true;
    }

    static void enableDebugLogging()
    {
        Logger base = LoggerFactory.getLogger("usx2usfx");
        if (base instanceof ch.qos.logback.classic.Logger)
        {
            ((ch.qos.logback.classic.Logger) base).setLevel(Level.DEBUG);
        }
    }

    /**
     * USX files directly in dir, followed by those in each immediate subdirectory.
     * Both levels are sorted by name so repeated runs read files in the same order.
     */
    static List<Path> findUsxFiles(Path dir) throws IOException
    {
        List<Path> result = new ArrayList<>(listUsx(dir));
        for (Path sub : listSorted(dir))
        {
            if (Files.isDirectory(sub))
            {
                result.addAll(listUsx(sub));
            }
        }
        return result;
    }

    private static List<Path> listUsx(Path dir) throws IOException
    {
        List<Path> result = new ArrayList<>();
        for (Path p : listSorted(dir))
        {
            if (Files.isRegularFile(p) && isUsx(p))
            {
                result.add(p);
            }
        }
        return result;
    }

    private static List<Path> listSorted(Path dir) throws IOException
    {
        List<Path> entries = new ArrayList<>();
        try (Stream<Path> s = Files.list(dir))
        {
            s.forEach(entries::add);
        }
        Collections.sort(entries);
        return entries;
    }

    static boolean isUsx(Path file)
    {
        Path name = file.getFileName();
        return name != null && name.toString().toLowerCase(Locale.ROOT).endsWith(USX_EXTENSION);
    }
}
