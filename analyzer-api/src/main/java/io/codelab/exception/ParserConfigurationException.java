package io.codelab.exception;

/** No parser is registered for a requested language, or none accepts a file name. */
public class ParserConfigurationException extends RuntimeException {
    public ParserConfigurationException(String message) {
        super(message);
    }

    public static ParserConfigurationException forLanguage(String languageId) {
        return new ParserConfigurationException("No parser registered for language: " + languageId);
    }

    public static ParserConfigurationException forFile(String filename) {
        return new ParserConfigurationException("No parser found for file: " + filename);
    }
}
