package com.spinemlgen.core;

/**
 * Base type for every failure raised while translating a SpineML component.
 *
 * Translation is fail-fast: the first error aborts the whole component (and any network
 * build driving it). Messages name the component URL and the offending node so the fragment
 * can be located in the source document.
 */
public class TranslationException extends RuntimeException {

    public TranslationException(String message) { super(message); }
    public TranslationException(String message, Throwable cause) { super(message, cause); }

    /** Malformed or wrong-kind document node, missing Dynamics, missing required child. */
    public static class ConfigurationException extends TranslationException {
        public ConfigurationException(String message) { super(message); }
        public ConfigurationException(String message, Throwable cause) { super(message, cause); }
    }

    /** A name (target regime, population) that does not resolve. */
    public static class ReferenceException extends TranslationException {
        public ReferenceException(String message) { super(message); }
        public ReferenceException(String message, Throwable cause) { super(message, cause); }
    }

    /** A construct that has no translation policy, e.g. a delay that is not a single fixed value. */
    public static class UnsupportedFeatureException extends TranslationException {
        public UnsupportedFeatureException(String message) { super(message); }
        public UnsupportedFeatureException(String message, Throwable cause) { super(message, cause); }
    }
}
