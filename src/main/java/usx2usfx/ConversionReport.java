package usx2usfx;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Diagnostic channel and summary of one conversion run.
 * <p>
 * Every anomaly is logged as a single line the moment it is recorded. The collected
 * summary can be written as JSON after the run.
 */
@JsonPropertyOrder({ "source", "destination", "succeeded", "booksConverted", "duplicatesSkipped", "filesFailed",
    "errorCount", "warningCount", "issues" })
public final class ConversionReport
{
    private static final Logger LOG = LoggerFactory.getLogger(ConversionReport.class);

    private String source = "";
    private String destination = "";
    private boolean succeeded;
    private final List<String> booksConverted = new ArrayList<>();
    private final List<String> duplicatesSkipped = new ArrayList<>();
    private final List<String> filesFailed = new ArrayList<>();
    private final List<ConversionIssue> issues = new ArrayList<>();

    public void error(String file, String location, String message)
    {
        record(new ConversionIssue(Severity.ERROR, file, location, message));
    }

    public void warning(String file, String location, String message)
    {
        record(new ConversionIssue(Severity.WARNING, file, location, message));
    }

    public void info(String file, String location, String message)
    {
        record(new ConversionIssue(Severity.INFO, file, location, message));
    }

    private void record(ConversionIssue issue)
    {
        this.issues.add(issue);
        switch (issue.severity)
        {
            case ERROR:
                LOG.error("{}", issue);
                break;
            case WARNING:
                LOG.warn("{}", issue);
                break;
            default:
                LOG.info("{}", issue);
                break;
        }
    }

    void bookConverted(String code)
    {
        this.booksConverted.add(code);
    }

    void duplicateSkipped(String code)
    {
        this.duplicatesSkipped.add(code);
    }

    void fileFailed(String file)
    {
        this.filesFailed.add(file);
    }

    void runStarted(String source, String destination)
    {
        this.source = source;
        this.destination = destination;
    }

    void runFinished(boolean succeeded)
    {
        this.succeeded = succeeded;
    }

    public String getSource()
    {
        return this.source;
    }

    public String getDestination()
    {
        return this.destination;
    }

    public boolean isSucceeded()
    {
        return this.succeeded;
    }

    public List<String> getBooksConverted()
    {
        return Collections.unmodifiableList(this.booksConverted);
    }

    public List<String> getDuplicatesSkipped()
    {
        return Collections.unmodifiableList(this.duplicatesSkipped);
    }

    public List<String> getFilesFailed()
    {
        return Collections.unmodifiableList(this.filesFailed);
    }

    public List<ConversionIssue> getIssues()
    {
        return Collections.unmodifiableList(this.issues);
    }

    public int getErrorCount()
    {
        return count(Severity.ERROR);
    }

    public int getWarningCount()
    {
        return count(Severity.WARNING);
    }

    @JsonIgnore
    public List<ConversionIssue> getErrors()
    {
        List<ConversionIssue> result = new ArrayList<>();
        for (ConversionIssue i : this.issues)
        {
            if (i.severity == Severity.ERROR)
            {
                result.add(i);
            }
        }
        return result;
    }

    private int count(Severity severity)
    {
        int c = 0;
        for (ConversionIssue i : this.issues)
        {
            if (i.severity == severity)
            {
                c++;
            }
        }
        return c;
    }

    public void writeJson(Path path) throws IOException
    {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null)
        {
            Files.createDirectories(parent);
        }
        try (OutputStream out = Files.newOutputStream(path))
        {
            writeJson(out);
        }
    }

    public void writeJson(OutputStream out) throws IOException
    {
        ObjectMapper om = new ObjectMapper();
        om.enable(SerializationFeature.INDENT_OUTPUT);
        om.writeValue(out, this);
    }
}
