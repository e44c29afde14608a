package com.musicinsights.librarysync.infrastructure.remote.export;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * {@code mirror-outbox.ndjson}에 기록되는 원격 쓰기 요청 한 건.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OutboxEntry {

    public static final String CREATE_PLAYLIST = "CREATE_PLAYLIST";
    public static final String ADD_TRACKS = "ADD_TRACKS";

    /** 요청 종류 */
    @JsonProperty("op")
    public String op;

    /** 대상 플레이리스트 원격 id */
    @JsonProperty("playlistId")
    public String playlistId;

    /** 생성 요청일 때 제목 */
    @JsonProperty("title")
    public String title;

    /** 추가 요청일 때 트랙 원격 id 목록 */
    @JsonProperty("trackIds")
    public List<String> trackIds;

    /** 기록 시각(ISO-8601) */
    @JsonProperty("at")
    public String at;

    static OutboxEntry createPlaylist(String playlistId, String title, String at) {
        OutboxEntry e = new OutboxEntry();
        e.op = CREATE_PLAYLIST;
        e.playlistId = playlistId;
        e.title = title;
        e.at = at;
        return e;
    }

    static OutboxEntry addTracks(String playlistId, List<String> trackIds, String at) {
        OutboxEntry e = new OutboxEntry();
        e.op = ADD_TRACKS;
        e.playlistId = playlistId;
        e.trackIds = trackIds;
        e.at = at;
        return e;
    }
}
