package usx2usfx;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One anomaly found while converting a file.
 */
@JsonPropertyOrder({ "severity", "file", "location", "message" })
public final class ConversionIssue
{
    public final Severity severity;
    public final String file;
    public final String location;
    public final String message;

    public ConversionIssue(Severity severity, String file, String location, String message)
    {
        this.severity = Objects.requireNonNull(severity, "severity");
        this.file = Objects.requireNonNull(file, "file");
        this.location = Objects.requireNonNull(location, "location");
        this.message = Objects.requireNonNull(message, "message");
    }

    @Override
    public String toString()
    {
        StringBuilder sb = new StringBuilder();
        sb.append(this.severity).append(' ').append(this.file);
        if (!this.location.isEmpty())
        {
            sb.append(" [").append(this.location).append(']');
        }
        sb.append(": ").append(this.message);
        return sb.toString();
    }
}
