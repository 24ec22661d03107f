package com.thetalimited.coreg;

/**
 * Fatal outcome of a co-registration stage. The {@link FailureKind} tells the
 * caller which check rejected the inputs.
 */
public class CoregException extends RuntimeException
{
    private static final long serialVersionUID = 1L;

    private final FailureKind kind;

    public CoregException(FailureKind kind, String message)
    {
        super(message);
        this.kind = kind;
    }

    public CoregException(FailureKind kind, String message, Throwable cause)
    {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind getKind()
    {
        return kind;
    }

    @Override
    public String getMessage()
    {
        return kind + ": " + super.getMessage();
    }

    // message without the kind prefix
    public String getReason()
    {
        return super.getMessage();
    }
}
