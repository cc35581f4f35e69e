package com.clausesplit.config;

import java.util.Set;
import java.util.TreeSet;

public class UnsupportedLanguageException extends RuntimeException {
    private final String language;
    private final Set<String> supported;

    public UnsupportedLanguageException(String language, Set<String> supported) {
        super("Unsupported language '" + language + "'. Supported: " + new TreeSet<>(supported));
        this.language = language;
        this.supported = Set.copyOf(supported);
    }

    public String getLanguage() {
        return language;
    }

    public Set<String> getSupported() {
        return supported;
    }
}
