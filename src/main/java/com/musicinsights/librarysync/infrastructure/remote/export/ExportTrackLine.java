package com.musicinsights.librarysync.infrastructure.remote.export;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * export의 트랙 항목.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExportTrackLine {

    /** 원격 트랙 id */
    @JsonProperty("id")
    public String id;

    /** 트랙 제목 */
    @JsonProperty("name")
    public String name;

    /** 소속 앨범(없을 수 있음) */
    @JsonProperty("album")
    public ExportAlbumLine album;

    /** 참여 아티스트 */
    @JsonProperty("artists")
    public List<ExportArtistLine> artists;
}
