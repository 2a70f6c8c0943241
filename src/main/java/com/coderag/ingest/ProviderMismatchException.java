package com.coderag.ingest;

/**
 * The project's collection was built by a different embedding provider than the active one.
 */
public class ProviderMismatchException extends IllegalStateException {
    private final String storedProvider;
    private final String activeProvider;

    public ProviderMismatchException(String projectPath, String storedProvider, String activeProvider) {
        super("Embedding provider mismatch: collection was indexed with '" + storedProvider
                + "' but current provider is '" + activeProvider + "'. Re-index the project to switch providers: "
                + projectPath);
        this.storedProvider = storedProvider;
        this.activeProvider = activeProvider;
    }

    public String storedProvider() {
        return storedProvider;
    }

    public String activeProvider() {
        return activeProvider;
    }
}
