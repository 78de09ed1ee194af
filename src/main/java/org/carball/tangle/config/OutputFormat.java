package org.carball.tangle.config;

public enum OutputFormat {
    JSON,
    MARKDOWN,
    BOTH
}
