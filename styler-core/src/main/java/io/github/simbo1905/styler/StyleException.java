package io.github.simbo1905.styler;

/// A rule failed while styling a file. Wraps the rule's own exception as the cause.
@SuppressWarnings("serial")
public final class StyleException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String rule;
    private final String file;

    /// @param rule the name of the failing rule
    /// @param file the file being styled, as given by the parser
    /// @param cause what the rule threw
    public StyleException(String rule, String file, Throwable cause) {
        super("Error running rule " + rule + " on " + file + ": " + cause, cause);
        this.rule = rule;
        this.file = file;
    }

    public String rule() {
        return rule;
    }

    public String file() {
        return file;
    }
}
