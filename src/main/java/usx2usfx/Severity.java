package usx2usfx;

public enum Severity
{
    ERROR,
    WARNING,
    INFO
}
