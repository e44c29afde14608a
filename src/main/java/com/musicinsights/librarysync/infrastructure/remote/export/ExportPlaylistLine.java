package com.musicinsights.librarysync.infrastructure.remote.export;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * {@code playlists.ndjson}의 한 줄(= 플레이리스트 하나와 트랙 목록).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExportPlaylistLine {

    /** 원격 플레이리스트 id */
    @JsonProperty("id")
    public String id;

    /** 제목 */
    @JsonProperty("title")
    public String title;

    /** 원격 순서의 트랙 목록 */
    @JsonProperty("tracks")
    public List<ExportTrackLine> tracks;
}
