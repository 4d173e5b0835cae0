package com.gt.vsrs.model;

public enum Language {
    Dutch("NL"),
    English("EN");

    private final String code;

    Language(String code) {
        this.code = code;
    }

    // Two letter code used by the translation API
    public String getCode() {
        return code;
    }

    public Language getTranslationTarget() {
        return this == Dutch ? English : Dutch;
    }

    public static Language fromName(String name) {
        for (Language language : values()) {
            if (language.name().equalsIgnoreCase(name)) {
                return language;
            }
        }

        throw new IllegalArgumentException("Unknown language " + name);
    }
}
