package com.phillippitts.mindscribe.domain;

/** Container format of an uploaded segment. */
public enum AudioEncoding {
    WAV("audio/wav", "wav"),
    MP3("audio/mpeg", "mp3");

    private final String mediaType;
    private final String extension;

    AudioEncoding(String mediaType, String extension) {
        this.mediaType = mediaType;
        this.extension = extension;
    }

    public String mediaType() {
        return mediaType;
    }

    public String extension() {
        return extension;
    }
}
