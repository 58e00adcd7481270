package com.switchboard.realtime;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RealtimeAudioFormat {
    PCM16("pcm16"),
    G711_ULAW("g711_ulaw"),
    G711_ALAW("g711_alaw");

    private final String wireName;

    RealtimeAudioFormat(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
